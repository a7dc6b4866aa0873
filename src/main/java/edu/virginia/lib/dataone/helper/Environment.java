package edu.virginia.lib.dataone.helper;

import static edu.virginia.lib.dataone.helper.PropertiesHelper.getOptionalProperty;
import static edu.virginia.lib.dataone.helper.PropertiesHelper.getProperties;
import static edu.virginia.lib.dataone.helper.PropertiesHelper.getRequiredProperty;

import edu.virginia.lib.dataone.RdfConstants;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

/**
 * The settings shared by every insert and update run: where files live on disk, which
 * identifier schemes to mint with, which Member Node to talk to and who owns what gets
 * uploaded.  Built once from a properties file and handed to the collaborators that need
 * it; nothing in the ingest code loads configuration on its own.
 */
public class Environment {

    public static final String UUID_SCHEME = "UUID";

    private String basePath;

    private String alternatePath;

    private String metadataIdentifierScheme;

    private String dataIdentifierScheme;

    private String memberNodeBaseUrl;

    private String submitter;

    private String rightsHolder;

    private String authToken;

    private String resolveBase;

    private List<AccessRule> accessRules;

    private boolean clearReplicationPolicy;

    private ReplicationPolicy replicationPolicy;

    public Environment(String basePath, String alternatePath, String metadataIdentifierScheme,
                       String dataIdentifierScheme, String memberNodeBaseUrl, String submitter,
                       String rightsHolder) {
        this.basePath = basePath;
        this.alternatePath = alternatePath;
        this.metadataIdentifierScheme = metadataIdentifierScheme;
        this.dataIdentifierScheme = dataIdentifierScheme;
        this.memberNodeBaseUrl = memberNodeBaseUrl;
        this.submitter = submitter;
        this.rightsHolder = rightsHolder;
        this.resolveBase = RdfConstants.DEFAULT_RESOLVE_BASE;
        this.accessRules = Collections.singletonList(new AccessRule(AccessRule.PUBLIC, AccessRule.READ));
        this.clearReplicationPolicy = true;
        this.replicationPolicy = new ReplicationPolicy(false, 0);
        validate();
    }

    public static Environment load(final String filename) throws IOException {
        return fromProperties(getProperties(filename));
    }

    public static Environment fromProperties(Properties p) {
        Environment env = new Environment(
                getRequiredProperty(p, "base-path"),
                getRequiredProperty(p, "alternate-path"),
                getRequiredProperty(p, "metadata-identifier-scheme"),
                getRequiredProperty(p, "data-identifier-scheme"),
                getRequiredProperty(p, "mn-base-url"),
                getRequiredProperty(p, "submitter"),
                getRequiredProperty(p, "rights-holder"));
        env.authToken = getOptionalProperty(p, "auth-token");
        env.resolveBase = getOptionalProperty(p, "resolve-base", RdfConstants.DEFAULT_RESOLVE_BASE);
        final String rules = getOptionalProperty(p, "access-rules");
        if (rules != null && rules.length() > 0) {
            env.accessRules = parseAccessRules(rules);
        }
        env.clearReplicationPolicy = Boolean.parseBoolean(getOptionalProperty(p, "clear-replication-policy", "true"));
        env.replicationPolicy = new ReplicationPolicy(
                Boolean.parseBoolean(getOptionalProperty(p, "replication-allowed", "false")),
                Integer.parseInt(getOptionalProperty(p, "number-replicas", "0")));
        return env;
    }

    /**
     * Parses rules of the form "subject=permission[,permission];subject=permission".
     * Subjects are often LDAP-style DNs that themselves contain commas and '=', so the
     * permissions are everything after the last '='.
     */
    static List<AccessRule> parseAccessRules(final String value) {
        final List<AccessRule> rules = new ArrayList<AccessRule>();
        for (String entry : value.split(";")) {
            entry = entry.trim();
            if (entry.length() == 0) {
                continue;
            }
            final int split = entry.lastIndexOf('=');
            if (split <= 0 || split == entry.length() - 1) {
                throw new RuntimeException("Invalid access rule \"" + entry + "\"!");
            }
            final String subject = entry.substring(0, split).trim();
            for (String permission : entry.substring(split + 1).split(",")) {
                rules.add(new AccessRule(subject, permission.trim()));
            }
        }
        return rules;
    }

    private void validate() {
        requireNonEmpty("base-path", basePath);
        requireNonEmpty("alternate-path", alternatePath);
        requireNonEmpty("metadata-identifier-scheme", metadataIdentifierScheme);
        requireNonEmpty("data-identifier-scheme", dataIdentifierScheme);
        requireNonEmpty("mn-base-url", memberNodeBaseUrl);
        requireNonEmpty("submitter", submitter);
        requireNonEmpty("rights-holder", rightsHolder);
    }

    private static void requireNonEmpty(String name, String value) {
        if (value == null || value.trim().length() == 0) {
            throw new RuntimeException("Required setting \"" + name + "\" is empty!");
        }
    }

    public String getBasePath() {
        return basePath;
    }

    public String getAlternatePath() {
        return alternatePath;
    }

    public String getMetadataIdentifierScheme() {
        return metadataIdentifierScheme;
    }

    public String getDataIdentifierScheme() {
        return dataIdentifierScheme;
    }

    public String getMemberNodeBaseUrl() {
        return memberNodeBaseUrl;
    }

    public String getSubmitter() {
        return submitter;
    }

    public String getRightsHolder() {
        return rightsHolder;
    }

    public String getAuthToken() {
        return authToken;
    }

    public void setAuthToken(String authToken) {
        this.authToken = authToken;
    }

    public String getResolveBase() {
        return resolveBase;
    }

    public void setResolveBase(String resolveBase) {
        this.resolveBase = resolveBase;
    }

    public List<AccessRule> getAccessRules() {
        return Collections.unmodifiableList(accessRules);
    }

    public void setAccessRules(List<AccessRule> accessRules) {
        this.accessRules = new ArrayList<AccessRule>(accessRules);
    }

    /**
     * True when descriptors must go out without a replication policy.  Member Nodes below
     * tier 4 reject system metadata that asks for replication.
     */
    public boolean isClearReplicationPolicy() {
        return clearReplicationPolicy;
    }

    public void setClearReplicationPolicy(boolean clearReplicationPolicy) {
        this.clearReplicationPolicy = clearReplicationPolicy;
    }

    public ReplicationPolicy getReplicationPolicy() {
        return replicationPolicy;
    }
}
