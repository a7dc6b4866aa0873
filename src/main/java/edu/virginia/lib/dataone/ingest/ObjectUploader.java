package edu.virginia.lib.dataone.ingest;

import java.io.File;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.virginia.lib.dataone.helper.RemoteResult;
import edu.virginia.lib.dataone.helper.RepositoryClient;
import edu.virginia.lib.dataone.helper.SystemMetadata;
import edu.virginia.lib.dataone.inventory.InventoryRecord;

/**
 * Uploads a single object along with its system metadata.
 */
public class ObjectUploader {

    final private static Logger LOGGER = LoggerFactory.getLogger(ObjectUploader.class);

    private static final double BYTES_PER_MB = 1024 * 1024;

    private RepositoryClient client;

    public ObjectUploader(RepositoryClient client) {
        this.client = client;
    }

    public boolean upload(InventoryRecord record, SystemMetadata sysmeta, String basePath) {
        return upload(record.getPid(), sysmeta, new File(basePath, record.getFile()));
    }

    /**
     * @return true if the repository accepted the object and reported its identifier
     */
    public boolean upload(String pid, SystemMetadata sysmeta, File file) {
        if (sysmeta == null) {
            LOGGER.error("No system metadata for " + pid + ", skipping upload.");
            return false;
        }
        final long start = System.currentTimeMillis();
        final RemoteResult<String> result;
        try {
            result = client.createObject(pid, sysmeta, file);
        } catch (RuntimeException e) {
            LOGGER.error("Unexpected error uploading " + pid + ".", e);
            return false;
        }
        if (result.isFailure() || result.getValue() == null || result.getValue().length() == 0) {
            LOGGER.error("Upload of " + file.getName() + " as " + pid + " failed: " + result);
            return false;
        }
        logThroughput(pid, file, System.currentTimeMillis() - start);
        return true;
    }

    private void logThroughput(String pid, File file, long elapsedMs) {
        final double mb = file.length() / BYTES_PER_MB;
        final double seconds = Math.max(elapsedMs, 1) / 1000d;
        LOGGER.info(String.format("Uploaded %s (%.2f MB) in %.2f seconds (%.2f MB/s).", pid, mb, seconds, mb / seconds));
    }
}
