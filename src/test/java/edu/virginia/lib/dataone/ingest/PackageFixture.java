package edu.virginia.lib.dataone.ingest;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.FileUtils;

import edu.virginia.lib.dataone.helper.Environment;
import edu.virginia.lib.dataone.inventory.InMemoryInventory;
import edu.virginia.lib.dataone.inventory.InventoryRecord;

/**
 * Builds inventories whose files exist under a temporary base path.
 */
class PackageFixture {

    static final String EML = "<?xml version=\"1.0\"?>\n"
            + "<eml:eml xmlns:eml=\"eml://ecoinformatics.org/eml-2.1.1\" packageId=\"old\" system=\"knb\">"
            + "<dataset><title>Test</title></dataset></eml:eml>\n";

    final File basePath;

    final File alternatePath;

    final List<InventoryRecord> records = new ArrayList<InventoryRecord>();

    PackageFixture(File root) {
        this.basePath = new File(root, "base");
        this.alternatePath = new File(root, "alternate");
        basePath.mkdirs();
        alternatePath.mkdirs();
    }

    Environment environment() {
        return new Environment(basePath.getAbsolutePath(), alternatePath.getAbsolutePath(), "DOI",
                Environment.UUID_SCHEME, "https://mn.example.org/mn/v2", "CN=submitter", "CN=rights-holder");
    }

    InventoryRecord metadata(String packageId, String parentPackage) throws IOException {
        InventoryRecord r = add(packageId + "/metadata.xml", EML, "eml://ecoinformatics.org/eml-2.1.1", packageId);
        r.setMetadata(true);
        r.setParentPackage(parentPackage);
        return r;
    }

    InventoryRecord data(String packageId, String name) throws IOException {
        return add(packageId + "/" + name, "a,b\n1,2\n", "text/csv", packageId);
    }

    private InventoryRecord add(String path, String content, String formatId, String packageId) throws IOException {
        final File f = new File(basePath, path);
        FileUtils.writeStringToFile(f, content, StandardCharsets.UTF_8);
        InventoryRecord r = new InventoryRecord(path, f.getName());
        r.setSize(f.length());
        r.setFormatId(formatId);
        r.setPackageId(packageId);
        r.setReady(true);
        records.add(r);
        return r;
    }

    void writeRevisedMetadata(InventoryRecord metadata) throws IOException {
        FileUtils.writeStringToFile(new File(alternatePath, metadata.getFile()), EML, StandardCharsets.UTF_8);
    }

    InMemoryInventory inventory() {
        return new InMemoryInventory(records);
    }

    static InventoryRecord find(List<InventoryRecord> records, String file) {
        for (InventoryRecord r : records) {
            if (r.getFile().equals(file)) {
                return r;
            }
        }
        throw new IllegalArgumentException(file);
    }
}
