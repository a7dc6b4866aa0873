package edu.virginia.lib.dataone.helper;

/**
 * The outcome of a single call to the Member Node: either a value, or the kind of
 * failure that occurred with a message for the log.
 *
 * @param <T> the type of value returned on success
 */
public class RemoteResult<T> {

    /**
     * Why a remote call did not succeed.
     */
    public enum FailureKind {
        /** The identifier is unknown to the node. */
        NOT_FOUND,
        /** The identifier is already in use. */
        CONFLICT,
        /** Network trouble or a server-side error; re-running later may succeed. */
        TRANSIENT,
        /** The session token was rejected. */
        AUTH_EXPIRED,
        /** The node refused the request as invalid (bad system metadata, unsupported scheme...). */
        REJECTED;

        public static FailureKind forStatusCode(int statusCode) {
            if (statusCode == 401 || statusCode == 403) {
                return AUTH_EXPIRED;
            } else if (statusCode == 404) {
                return NOT_FOUND;
            } else if (statusCode == 409) {
                return CONFLICT;
            } else if (statusCode >= 400 && statusCode < 500) {
                return REJECTED;
            } else {
                return TRANSIENT;
            }
        }
    }

    final private T value;

    final private FailureKind failureKind;

    final private String message;

    private RemoteResult(T value, FailureKind failureKind, String message) {
        this.value = value;
        this.failureKind = failureKind;
        this.message = message;
    }

    public static <T> RemoteResult<T> success(T value) {
        return new RemoteResult<T>(value, null, null);
    }

    public static <T> RemoteResult<T> failure(FailureKind kind, String message) {
        if (kind == null) {
            throw new IllegalArgumentException("A failure requires a kind!");
        }
        return new RemoteResult<T>(null, kind, message);
    }

    public boolean isSuccess() {
        return failureKind == null;
    }

    public boolean isFailure() {
        return failureKind != null;
    }

    /**
     * @return the value of a successful call, or null for a failure
     */
    public T getValue() {
        return value;
    }

    public T orElse(T defaultValue) {
        return isSuccess() ? value : defaultValue;
    }

    /**
     * @return the failure kind, or null for a successful call
     */
    public FailureKind getFailureKind() {
        return failureKind;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "success(" + value + ")";
        } else {
            return "failure(" + failureKind + (message == null ? "" : ": " + message) + ")";
        }
    }
}
