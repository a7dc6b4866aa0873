package edu.virginia.lib.dataone.helper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The repository-side description of an object about to be uploaded: identifier, size,
 * checksum, format, ownership and access policy.  Instances are immutable; the
 * adjustment methods return modified copies.
 */
public class SystemMetadata {

    public static final String SHA256 = "SHA256";

    final private String identifier;

    final private String formatId;

    final private long size;

    final private String checksum;

    final private String checksumAlgorithm;

    final private String submitter;

    final private String rightsHolder;

    final private String fileName;

    final private List<AccessRule> accessPolicy;

    final private ReplicationPolicy replicationPolicy;

    public SystemMetadata(String identifier, String formatId, long size, String checksum, String submitter,
                          String rightsHolder, String fileName, ReplicationPolicy replicationPolicy) {
        this(identifier, formatId, size, checksum, SHA256, submitter, rightsHolder, fileName, replicationPolicy);
    }

    public SystemMetadata(String identifier, String formatId, long size, String checksum, String checksumAlgorithm,
                          String submitter, String rightsHolder, String fileName, ReplicationPolicy replicationPolicy) {
        this(identifier, formatId, size, checksum, checksumAlgorithm, submitter, rightsHolder, fileName,
                Collections.<AccessRule>emptyList(), replicationPolicy);
    }

    private SystemMetadata(String identifier, String formatId, long size, String checksum, String checksumAlgorithm,
                           String submitter, String rightsHolder, String fileName, List<AccessRule> accessPolicy,
                           ReplicationPolicy replicationPolicy) {
        if (identifier == null || identifier.length() == 0) {
            throw new IllegalArgumentException("System metadata requires an identifier!");
        }
        if (formatId == null || formatId.length() == 0) {
            throw new IllegalArgumentException("No format id for " + identifier + "!");
        }
        if (checksum == null || checksum.length() == 0) {
            throw new IllegalArgumentException("No checksum for " + identifier + "!");
        }
        if (size < 0) {
            throw new IllegalArgumentException("Invalid size " + size + " for " + identifier + "!");
        }
        this.identifier = identifier;
        this.formatId = formatId;
        this.size = size;
        this.checksum = checksum;
        this.checksumAlgorithm = checksumAlgorithm;
        this.submitter = submitter;
        this.rightsHolder = rightsHolder;
        this.fileName = fileName;
        this.accessPolicy = Collections.unmodifiableList(new ArrayList<AccessRule>(accessPolicy));
        this.replicationPolicy = replicationPolicy;
    }

    /**
     * Returns a copy of this system metadata with the given rules added to the access
     * policy.  Rules already present are not repeated.
     */
    public SystemMetadata withAccessRules(List<AccessRule> rules) {
        List<AccessRule> merged = new ArrayList<AccessRule>(accessPolicy);
        for (AccessRule rule : rules) {
            if (!merged.contains(rule)) {
                merged.add(rule);
            }
        }
        return new SystemMetadata(identifier, formatId, size, checksum, checksumAlgorithm, submitter, rightsHolder,
                fileName, merged, replicationPolicy);
    }

    public SystemMetadata withoutReplicationPolicy() {
        return new SystemMetadata(identifier, formatId, size, checksum, checksumAlgorithm, submitter, rightsHolder,
                fileName, accessPolicy, null);
    }

    public String getIdentifier() {
        return identifier;
    }

    public String getFormatId() {
        return formatId;
    }

    public long getSize() {
        return size;
    }

    public String getChecksum() {
        return checksum;
    }

    public String getChecksumAlgorithm() {
        return checksumAlgorithm;
    }

    public String getSubmitter() {
        return submitter;
    }

    public String getRightsHolder() {
        return rightsHolder;
    }

    public String getFileName() {
        return fileName;
    }

    public List<AccessRule> getAccessPolicy() {
        return accessPolicy;
    }

    /**
     * @return the replication policy or null if none should be sent
     */
    public ReplicationPolicy getReplicationPolicy() {
        return replicationPolicy;
    }

    @Override
    public String toString() {
        return identifier + " (" + formatId + ", " + size + " bytes, " + checksumAlgorithm + "=" + checksum + ")";
    }
}
