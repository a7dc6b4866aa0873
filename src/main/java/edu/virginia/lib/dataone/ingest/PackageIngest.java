package edu.virginia.lib.dataone.ingest;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.virginia.lib.dataone.RdfConstants;
import edu.virginia.lib.dataone.helper.Environment;
import edu.virginia.lib.dataone.helper.RepositoryClient;
import edu.virginia.lib.dataone.helper.SystemMetadata;
import edu.virginia.lib.dataone.inventory.Inventory;
import edu.virginia.lib.dataone.inventory.InventoryRecord;
import edu.virginia.lib.dataone.inventory.InventoryValidationException;
import edu.virginia.lib.dataone.resourcemap.ResourceMap;
import edu.virginia.lib.dataone.resourcemap.ResourceMapBuilder;
import edu.virginia.lib.dataone.resourcemap.ResourceMapSerializer;

/**
 * Inserts packages (one metadata object, its data objects and a resource map linking
 * them and any child packages) into the repository.  Work is resumable: objects that
 * are already created are skipped, identifiers already assigned are reused and the
 * returned records reflect exactly what succeeded, so a failed package can simply be
 * inserted again once the returned records have been saved.
 */
public class PackageIngest extends AbstractPackageOperation {

    final private static Logger LOGGER = LoggerFactory.getLogger(PackageIngest.class);

    public PackageIngest(Environment env, RepositoryClient client) {
        super(env, client);
    }

    public PackageIngest(Environment env, RepositoryClient client, IdentifierResolver resolver,
                         SystemMetadataFactory sysmetaFactory, ObjectUploader uploader,
                         ResourceMapBuilder resourceMapBuilder, ResourceMapSerializer serializer) {
        super(env, client, resolver, sysmetaFactory, uploader, resourceMapBuilder, serializer);
    }

    /**
     * Inserts the metadata, the data and finally the resource map of a package,
     * stopping at the first failure.
     *
     * @return updated copies of the package's records; the inventory is not modified
     * @throws InventoryValidationException if the package is malformed or one of its
     *         child packages hasn't been inserted yet
     */
    public IngestResult insertPackage(Inventory inventory, String packageId) {
        final List<InventoryRecord> records = getPackageRecords(inventory, packageId);
        final InventoryRecord metadata = getMetadataRecord(records, packageId);
        final List<String> childResourceMapIds = getChildResourceMapIds(inventory, packageId);

        if (isTokenExpired()) {
            return new IngestResult(records, initialState(metadata));
        }

        LOGGER.info("Inserting package " + packageId + " (" + records.size() + " files, "
                + childResourceMapIds.size() + " child packages).");

        PackageState state = PackageState.NO_METADATA_ID;
        if (metadata.isCreated()) {
            LOGGER.debug("Metadata " + metadata.getPid() + " for package " + packageId + " was already created.");
            state = PackageState.METADATA_UPLOADED;
        } else {
            final String pid = resolver.getOrCreatePid(metadata, env.getMetadataIdentifierScheme());
            if (pid.length() == 0) {
                LOGGER.error("Unable to get an identifier for the metadata of package " + packageId + ".");
                return new IngestResult(records, state);
            }
            metadata.setPid(pid);
            final SystemMetadata sysmeta = sysmetaFactory.create(metadata, env.getBasePath());
            if (sysmeta == null) {
                return new IngestResult(records, state);
            }
            state = PackageState.METADATA_DESCRIBED;
            if (!uploader.upload(metadata, sysmeta, env.getBasePath())) {
                LOGGER.error("Unable to upload metadata " + metadata.getFile() + " for package " + packageId + ".");
                return new IngestResult(records, state);
            }
            metadata.setCreated(true);
            state = PackageState.METADATA_UPLOADED;
        }

        state = PackageState.DATA_UPLOADING;
        for (InventoryRecord data : getDataRecords(records)) {
            if (data.isCreated()) {
                LOGGER.debug("Skipping " + data.getFile() + ", it was already created as " + data.getPid() + ".");
                continue;
            }
            if (!insertRecord(data, env.getDataIdentifierScheme())) {
                LOGGER.error("Stopping package " + packageId + " at " + data.getFile() + ".");
                return new IngestResult(records, state);
            }
        }
        state = PackageState.DATA_COMPLETE;

        for (InventoryRecord r : records) {
            if (!r.isComplete()) {
                LOGGER.error(r.getFile() + " in package " + packageId + " is not created, skipping the resource map.");
                return new IngestResult(records, state);
            }
        }

        if (metadata.isResmapCreated()) {
            LOGGER.info("The resource map for package " + packageId + " was already created.");
            return new IngestResult(records, PackageState.RESOURCE_MAP_UPLOADED);
        }

        final List<String> dataPids = new ArrayList<String>();
        for (InventoryRecord data : getDataRecords(records)) {
            dataPids.add(data.getPid());
        }
        final ResourceMap resourceMap = resourceMapBuilder.generate(metadata.getPid(), dataPids, childResourceMapIds,
                null, env.getResolveBase(), null);
        File resourceMapFile = null;
        try {
            resourceMapFile = writeResourceMap(resourceMap);
            final SystemMetadata sysmeta = sysmetaFactory.createForGeneratedFile(resourceMap.getIdentifier(),
                    RdfConstants.RESOURCE_MAP_FORMAT_ID, resourceMapFile,
                    ResourceMap.fileNameFor(resourceMap.getIdentifier()));
            if (sysmeta == null) {
                return new IngestResult(records, state);
            }
            state = PackageState.RESOURCE_MAP_BUILT;
            final boolean uploaded = uploader.upload(resourceMap.getIdentifier(), sysmeta, resourceMapFile);
            for (InventoryRecord r : records) {
                r.setResmapCreated(uploaded);
            }
            if (uploaded) {
                LOGGER.info("Inserted package " + packageId + " with resource map " + resourceMap.getIdentifier() + ".");
                state = PackageState.RESOURCE_MAP_UPLOADED;
            }
            return new IngestResult(records, state);
        } catch (IOException e) {
            LOGGER.error("Unable to write the resource map for package " + packageId + ".", e);
            return new IngestResult(records, state);
        } finally {
            if (resourceMapFile != null) {
                FileUtils.deleteQuietly(resourceMapFile);
            }
        }
    }

    /**
     * Inserts a single file outside of any package processing.
     *
     * @return an updated copy of the file's record
     */
    public InventoryRecord insertFile(Inventory inventory, String file) {
        final InventoryRecord record = inventory.getRecord(file);
        if (record == null) {
            throw new InventoryValidationException("No inventory record for " + file + "!");
        }
        if (isTokenExpired()) {
            return record;
        }
        if (record.isCreated()) {
            LOGGER.info(file + " was already created as " + record.getPid() + ".");
            return record;
        }
        final String scheme = record.isMetadata() ? env.getMetadataIdentifierScheme() : env.getDataIdentifierScheme();
        if (insertRecord(record, scheme)) {
            LOGGER.info("Inserted " + file + " as " + record.getPid() + ".");
        }
        return record;
    }

    /**
     * Resolves, describes and uploads one record, updating its pid and created flag.
     */
    private boolean insertRecord(InventoryRecord record, String scheme) {
        final String pid = resolver.getOrCreatePid(record, scheme);
        if (pid.length() == 0) {
            return false;
        }
        record.setPid(pid);
        final SystemMetadata sysmeta = sysmetaFactory.create(record, env.getBasePath());
        if (sysmeta == null) {
            return false;
        }
        if (!uploader.upload(record, sysmeta, env.getBasePath())) {
            return false;
        }
        record.setCreated(true);
        return true;
    }

    private static PackageState initialState(InventoryRecord metadata) {
        if (metadata.isResmapCreated()) {
            return PackageState.RESOURCE_MAP_UPLOADED;
        }
        return metadata.isCreated() ? PackageState.METADATA_UPLOADED : PackageState.NO_METADATA_ID;
    }
}
