package edu.virginia.lib.dataone.ingest;

import java.io.File;
import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.virginia.lib.dataone.helper.AccessPolicyDecorator;
import edu.virginia.lib.dataone.helper.Environment;
import edu.virginia.lib.dataone.helper.Hasher;
import edu.virginia.lib.dataone.helper.SystemMetadata;
import edu.virginia.lib.dataone.inventory.InventoryRecord;

/**
 * Builds the system metadata that accompanies each upload.  Every descriptor gets the
 * configured submitter and rights holder, loses its replication policy (when so
 * configured) and receives the standard access rules.
 */
public class SystemMetadataFactory {

    final private static Logger LOGGER = LoggerFactory.getLogger(SystemMetadataFactory.class);

    private Environment env;

    private Hasher hasher;

    private AccessPolicyDecorator accessPolicy;

    public SystemMetadataFactory(Environment env, Hasher hasher, AccessPolicyDecorator accessPolicy) {
        this.env = env;
        this.hasher = hasher;
        this.accessPolicy = accessPolicy;
    }

    /**
     * Builds the descriptor for an inventory record whose file lives under basePath.
     * The checksum and size recorded in the inventory are used; a record without a
     * checksum has one computed.
     *
     * @return the descriptor, or null if it couldn't be built (the failure is logged
     *         and the record may be retried later)
     */
    public SystemMetadata create(InventoryRecord record, String basePath) {
        if (!record.hasPid()) {
            LOGGER.error("Unable to describe " + record.getFile() + " because it has no identifier.");
            return null;
        }
        final File file = new File(basePath, record.getFile());
        if (!file.exists()) {
            LOGGER.error("Unable to describe " + record.getPid() + " because " + file.getAbsolutePath() + " does not exist.");
            return null;
        }
        try {
            String checksum = record.getChecksum();
            if (checksum == null) {
                LOGGER.debug("Computing missing checksum for " + record.getFile() + ".");
                checksum = hasher.checksum(file);
            }
            return decorate(new SystemMetadata(record.getPid(), record.getFormatId(), record.getSize(), checksum,
                    env.getSubmitter(), env.getRightsHolder(), record.getFilename(), env.getReplicationPolicy()));
        } catch (IOException e) {
            LOGGER.error("Unable to describe " + record.getPid() + ", will retry later.", e);
            return null;
        } catch (IllegalArgumentException e) {
            LOGGER.error("Unable to describe " + record.getPid() + " (" + e.getMessage() + "), will retry later.");
            return null;
        }
    }

    /**
     * Builds a descriptor for a file produced by this tool, such as a serialized
     * resource map or a rewritten metadata document.  The checksum and size are taken
     * from the file itself.
     *
     * @return the descriptor, or null if it couldn't be built
     */
    public SystemMetadata createForGeneratedFile(String pid, String formatId, File file, String fileName) {
        try {
            return decorate(new SystemMetadata(pid, formatId, file.length(), hasher.checksum(file),
                    hasher.getAlgorithm(), env.getSubmitter(), env.getRightsHolder(), fileName, env.getReplicationPolicy()));
        } catch (IOException e) {
            LOGGER.error("Unable to compute checksum of " + file.getAbsolutePath() + " for " + pid + ".", e);
            return null;
        } catch (IllegalArgumentException e) {
            LOGGER.error("Unable to describe " + pid + " (" + e.getMessage() + ").");
            return null;
        }
    }

    private SystemMetadata decorate(SystemMetadata sysmeta) {
        return accessPolicy.applyAccessRules(accessPolicy.clearReplicationPolicy(sysmeta));
    }
}
