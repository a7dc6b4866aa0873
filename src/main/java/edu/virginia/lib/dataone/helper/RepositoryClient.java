package edu.virginia.lib.dataone.helper;

import java.io.File;

/**
 * The calls the ingest code makes against a repository node.  Implementations must not
 * throw for remote failures; they report them as failed {@link RemoteResult}s.  Timeouts
 * and any retry policy belong to the implementation.
 */
public interface RepositoryClient {

    /**
     * True if the session credentials are missing or expired.  Checked once at the start of
     * each insert or update so that no partial work happens under an invalid session.
     */
    boolean isTokenExpired();

    /**
     * Determines whether an object with the given identifier exists on the node.  A
     * {@link RemoteResult.FailureKind#NOT_FOUND} is reported as a successful "false".
     */
    RemoteResult<Boolean> objectExists(String identifier);

    /**
     * Creates a new object.
     * @return the identifier reported by the node
     */
    RemoteResult<String> createObject(String identifier, SystemMetadata sysmeta, File content);

    /**
     * Creates a new object that obsoletes an existing one.
     * @return the new identifier reported by the node
     */
    RemoteResult<String> updateObject(String oldIdentifier, String newIdentifier, SystemMetadata sysmeta, File content);

    /**
     * Asks the node to generate a fresh identifier under the given scheme.
     */
    RemoteResult<String> mintIdentifier(String scheme);
}
