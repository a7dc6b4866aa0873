package edu.virginia.lib.dataone.helper;

/**
 * A single "allow" entry of a DataONE access policy.
 */
public class AccessRule {

    public static final String PUBLIC = "public";

    public static final String READ = "read";
    public static final String WRITE = "write";
    public static final String CHANGE_PERMISSION = "changePermission";

    private String subject;

    private String permission;

    public AccessRule(String subject, String permission) {
        if (!READ.equals(permission) && !WRITE.equals(permission) && !CHANGE_PERMISSION.equals(permission)) {
            throw new IllegalArgumentException("Unknown permission \"" + permission + "\"!");
        }
        this.subject = subject;
        this.permission = permission;
    }

    public String getSubject() {
        return subject;
    }

    public String getPermission() {
        return permission;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof AccessRule)) {
            return false;
        }
        AccessRule other = (AccessRule) o;
        return subject.equals(other.subject) && permission.equals(other.permission);
    }

    @Override
    public int hashCode() {
        return subject.hashCode() * 31 + permission.hashCode();
    }

    @Override
    public String toString() {
        return subject + "=" + permission;
    }
}
