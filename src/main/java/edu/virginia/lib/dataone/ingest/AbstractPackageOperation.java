package edu.virginia.lib.dataone.ingest;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.virginia.lib.dataone.helper.ConfiguredAccessPolicy;
import edu.virginia.lib.dataone.helper.Environment;
import edu.virginia.lib.dataone.helper.RepositoryClient;
import edu.virginia.lib.dataone.helper.Sha256Hasher;
import edu.virginia.lib.dataone.inventory.Inventory;
import edu.virginia.lib.dataone.inventory.InventoryRecord;
import edu.virginia.lib.dataone.inventory.InventoryValidationException;
import edu.virginia.lib.dataone.resourcemap.JenaResourceMapSerializer;
import edu.virginia.lib.dataone.resourcemap.ResourceMap;
import edu.virginia.lib.dataone.resourcemap.ResourceMapBuilder;
import edu.virginia.lib.dataone.resourcemap.ResourceMapSerializer;

/**
 * State and helpers shared by the operations that push a package to the repository.
 */
public abstract class AbstractPackageOperation {

    final private static Logger LOGGER = LoggerFactory.getLogger(AbstractPackageOperation.class);

    protected Environment env;

    protected RepositoryClient client;

    protected IdentifierResolver resolver;

    protected SystemMetadataFactory sysmetaFactory;

    protected ObjectUploader uploader;

    protected ResourceMapBuilder resourceMapBuilder;

    protected ResourceMapSerializer serializer;

    public AbstractPackageOperation(Environment env, RepositoryClient client) {
        this(env, client, new IdentifierResolver(client),
                new SystemMetadataFactory(env, new Sha256Hasher(), new ConfiguredAccessPolicy(env)),
                new ObjectUploader(client), new ResourceMapBuilder(), new JenaResourceMapSerializer());
    }

    public AbstractPackageOperation(Environment env, RepositoryClient client, IdentifierResolver resolver,
                                    SystemMetadataFactory sysmetaFactory, ObjectUploader uploader,
                                    ResourceMapBuilder resourceMapBuilder, ResourceMapSerializer serializer) {
        this.env = env;
        this.client = client;
        this.resolver = resolver;
        this.sysmetaFactory = sysmetaFactory;
        this.uploader = uploader;
        this.resourceMapBuilder = resourceMapBuilder;
        this.serializer = serializer;
    }

    /**
     * Gets the records of the given package, failing if there are none.
     */
    protected List<InventoryRecord> getPackageRecords(Inventory inventory, String packageId) {
        if (packageId == null || packageId.length() == 0) {
            throw new InventoryValidationException("A package id is required!");
        }
        final List<InventoryRecord> records = inventory.getPackageRecords(packageId);
        if (records.isEmpty()) {
            throw new InventoryValidationException("No files found for package " + packageId + "!");
        }
        return records;
    }

    /**
     * Finds the single metadata record of a package.
     */
    protected static InventoryRecord getMetadataRecord(List<InventoryRecord> records, String packageId) {
        InventoryRecord metadata = null;
        for (InventoryRecord r : records) {
            if (r.isMetadata()) {
                if (metadata != null) {
                    throw new InventoryValidationException("Package " + packageId + " has more than one metadata file!");
                }
                metadata = r;
            }
        }
        if (metadata == null) {
            throw new InventoryValidationException("Package " + packageId + " has no metadata file!");
        }
        return metadata;
    }

    protected static List<InventoryRecord> getDataRecords(List<InventoryRecord> records) {
        List<InventoryRecord> data = new ArrayList<InventoryRecord>();
        for (InventoryRecord r : records) {
            if (!r.isMetadata()) {
                data.add(r);
            }
        }
        return data;
    }

    /**
     * Collects the resource map identifiers of the packages nested in the given one.
     * Every child package must already have an identifier and exist on the node.
     */
    protected static List<String> getChildResourceMapIds(Inventory inventory, String packageId) {
        List<String> ids = new ArrayList<String>();
        for (InventoryRecord child : inventory.getChildPackageRecords(packageId)) {
            if (!child.isComplete()) {
                throw new InventoryValidationException("Child package " + child.getPackageId() + " of " + packageId
                        + " must be inserted before its parent!");
            }
            ids.add(ResourceMap.identifierFor(child.getPid()));
        }
        return ids;
    }

    protected boolean isTokenExpired() {
        if (client.isTokenExpired()) {
            LOGGER.warn("The authentication token is missing or expired, nothing will be uploaded.");
            return true;
        }
        return false;
    }

    /**
     * Serializes the resource map to a temporary file.
     */
    protected File writeResourceMap(ResourceMap resourceMap) throws IOException {
        final File file = File.createTempFile("resource-map", ".xml");
        FileUtils.writeByteArrayToFile(file, serializer.serialize(resourceMap));
        return file;
    }
}
