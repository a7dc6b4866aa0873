package edu.virginia.lib.dataone.ingest;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.virginia.lib.dataone.RdfConstants;
import edu.virginia.lib.dataone.helper.EmlPackageIdRewriter;
import edu.virginia.lib.dataone.helper.Environment;
import edu.virginia.lib.dataone.helper.MetadataRewriter;
import edu.virginia.lib.dataone.helper.RemoteResult;
import edu.virginia.lib.dataone.helper.RepositoryClient;
import edu.virginia.lib.dataone.helper.SystemMetadata;
import edu.virginia.lib.dataone.inventory.Inventory;
import edu.virginia.lib.dataone.inventory.InventoryRecord;
import edu.virginia.lib.dataone.inventory.InventoryValidationException;
import edu.virginia.lib.dataone.resourcemap.ResourceMap;
import edu.virginia.lib.dataone.resourcemap.ResourceMapBuilder;
import edu.virginia.lib.dataone.resourcemap.ResourceMapSerializer;

/**
 * Publishes a new version of an already inserted package: a revised metadata document
 * (read from the alternate path) and a resource map built from the new identifiers.
 * Each object obsoletes its previous version where that version exists on the node.
 * Identifiers must already have been rotated in the inventory, with the previous
 * identifier in pid_old.
 */
public class PackageUpdate extends AbstractPackageOperation {

    final private static Logger LOGGER = LoggerFactory.getLogger(PackageUpdate.class);

    public static final String DEFAULT_METADATA_FORMAT_ID = "eml://ecoinformatics.org/eml-2.1.1";

    public static final String DEFAULT_METADATA_FILE_NAME = "science_metadata.xml";

    private MetadataRewriter rewriter;

    public PackageUpdate(Environment env, RepositoryClient client) {
        super(env, client);
        this.rewriter = new EmlPackageIdRewriter();
    }

    public PackageUpdate(Environment env, RepositoryClient client, IdentifierResolver resolver,
                         SystemMetadataFactory sysmetaFactory, ObjectUploader uploader,
                         ResourceMapBuilder resourceMapBuilder, ResourceMapSerializer serializer,
                         MetadataRewriter rewriter) {
        super(env, client, resolver, sysmetaFactory, uploader, resourceMapBuilder, serializer);
        this.rewriter = rewriter;
    }

    /**
     * @return updated copies of the package's records; the inventory is not modified
     * @throws InventoryValidationException if the package is malformed or a record has
     *         no current or previous identifier
     */
    public List<InventoryRecord> updatePackage(Inventory inventory, String packageId) {
        final List<InventoryRecord> records = getPackageRecords(inventory, packageId);
        final InventoryRecord metadata = getMetadataRecord(records, packageId);
        for (InventoryRecord r : records) {
            if (!r.hasPid() || !r.hasPidOld()) {
                throw new InventoryValidationException(r.getFile() + " in package " + packageId
                        + " needs both a pid and a pid_old to be updated!");
            }
        }
        final List<String> childResourceMapIds = getChildResourceMapIds(inventory, packageId);

        if (isTokenExpired()) {
            return records;
        }

        final String alternatePath = env.getAlternatePath();
        if (alternatePath == null || !new File(alternatePath).exists()) {
            LOGGER.error("Alternate path " + alternatePath + " does not exist, not updating package " + packageId + ".");
            return records;
        }
        final File source = new File(alternatePath, metadata.getFile());
        if (!source.exists()) {
            LOGGER.error("Revised metadata not found at " + source.getAbsolutePath() + ", not updating package "
                    + packageId + ".");
            return records;
        }

        LOGGER.info("Updating package " + packageId + ": " + metadata.getPidOld() + " -> " + metadata.getPid() + ".");

        File rewritten = null;
        File resourceMapFile = null;
        try {
            rewritten = rewriter.rewrite(source, metadata.getPid());
            final SystemMetadata metadataSysmeta = sysmetaFactory.createForGeneratedFile(metadata.getPid(),
                    metadata.getFormatId() == null ? DEFAULT_METADATA_FORMAT_ID : metadata.getFormatId(), rewritten,
                    metadata.getFilename() == null ? DEFAULT_METADATA_FILE_NAME : metadata.getFilename());
            if (metadataSysmeta == null) {
                return records;
            }
            final Outcome metadataOutcome = publish(metadata.getPidOld(), metadata.getPid(), metadataSysmeta, rewritten);
            if (metadataOutcome == Outcome.FAILED) {
                return records;
            }
            if (metadataOutcome != Outcome.SKIPPED) {
                metadata.setUpdated(true);
            }

            final List<String> dataPids = new ArrayList<String>();
            for (InventoryRecord data : getDataRecords(records)) {
                dataPids.add(data.getPid());
            }
            final ResourceMap resourceMap = resourceMapBuilder.generate(metadata.getPid(), dataPids,
                    childResourceMapIds, null, env.getResolveBase(), null);
            resourceMapFile = writeResourceMap(resourceMap);
            final SystemMetadata resourceMapSysmeta = sysmetaFactory.createForGeneratedFile(resourceMap.getIdentifier(),
                    RdfConstants.RESOURCE_MAP_FORMAT_ID, resourceMapFile,
                    ResourceMap.fileNameFor(resourceMap.getIdentifier()));
            if (resourceMapSysmeta == null) {
                return records;
            }
            final Outcome resourceMapOutcome = publish(ResourceMap.identifierFor(metadata.getPidOld()),
                    resourceMap.getIdentifier(), resourceMapSysmeta, resourceMapFile);
            if (resourceMapOutcome == Outcome.FAILED) {
                return records;
            }
            if (resourceMapOutcome == Outcome.SKIPPED) {
                LOGGER.info("Resource map " + resourceMap.getIdentifier() + " already exists, package " + packageId
                        + " left as it is.");
                return records;
            }
            for (InventoryRecord r : records) {
                r.setResmapCreated(true);
            }
            LOGGER.info("Updated package " + packageId + ".");
            return records;
        } catch (IOException e) {
            LOGGER.error("Unable to prepare the new version of package " + packageId + ".", e);
            return records;
        } finally {
            FileUtils.deleteQuietly(rewritten);
            FileUtils.deleteQuietly(resourceMapFile);
        }
    }

    enum Outcome {
        SKIPPED,
        CREATED,
        UPDATED,
        FAILED
    }

    /**
     * Creates the new version of an object unless it already exists: as an update of
     * the old version when that exists on the node, otherwise as a new object.
     */
    private Outcome publish(String oldPid, String newPid, SystemMetadata sysmeta, File file) {
        final RemoteResult<Boolean> newExists = client.objectExists(newPid);
        if (newExists.isFailure()) {
            LOGGER.error("Unable to determine whether " + newPid + " exists: " + newExists);
            return Outcome.FAILED;
        }
        if (newExists.getValue()) {
            LOGGER.info(newPid + " already exists, moving on.");
            return Outcome.SKIPPED;
        }
        final RemoteResult<Boolean> oldExists = client.objectExists(oldPid);
        if (oldExists.isFailure()) {
            LOGGER.error("Unable to determine whether " + oldPid + " exists: " + oldExists);
            return Outcome.FAILED;
        }
        if (!oldExists.getValue()) {
            LOGGER.info(oldPid + " doesn't exist, creating " + newPid + " instead of updating it.");
            return uploader.upload(newPid, sysmeta, file) ? Outcome.CREATED : Outcome.FAILED;
        }
        final RemoteResult<String> updated = client.updateObject(oldPid, newPid, sysmeta, file);
        if (updated.isFailure()) {
            LOGGER.error("Unable to update " + oldPid + " with " + newPid + ": " + updated);
            return Outcome.FAILED;
        }
        LOGGER.info("Updated " + oldPid + " with " + newPid + ".");
        return Outcome.UPDATED;
    }
}
