package edu.virginia.lib.dataone.ingest;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.virginia.lib.dataone.helper.Environment;
import edu.virginia.lib.dataone.helper.MemberNodeClient;
import edu.virginia.lib.dataone.inventory.CsvInventory;
import edu.virginia.lib.dataone.inventory.InMemoryInventory;
import edu.virginia.lib.dataone.inventory.InventoryRecord;
import edu.virginia.lib.dataone.inventory.InventoryValidationException;

/**
 * A script that inserts (or updates) every ready package in an inventory CSV file,
 * children before parents, writing the inventory back after each package so that an
 * interrupted run can simply be restarted.
 *
 * Usage: LoadInventory (insert|update) inventory.csv [environment.properties]
 */
public class LoadInventory {

    final private static Logger LOGGER = LoggerFactory.getLogger(LoadInventory.class);

    public static final String INSERT = "insert";

    public static final String UPDATE = "update";

    public static void main(String [] args) throws Exception {
        if (args.length < 2 || !(INSERT.equals(args[0]) || UPDATE.equals(args[0]))) {
            System.err.println("Usage: LoadInventory (insert|update) inventory.csv [environment.properties]");
            System.exit(1);
        }
        final File csv = new File(args[1]);
        final Environment env = Environment.load(args.length > 2 ? args[2] : "environment.properties");
        final InMemoryInventory inventory = CsvInventory.load(csv);

        final List<String> ready = new ArrayList<String>();
        for (String packageId : inventory.getPackageIds()) {
            if (isReady(inventory.getPackageRecords(packageId))) {
                ready.add(packageId);
            }
        }
        LOGGER.info(ready.size() + " of " + inventory.getPackageIds().size() + " packages are ready.");

        final MemberNodeClient client = new MemberNodeClient(env);
        try {
            final int complete;
            if (INSERT.equals(args[0])) {
                complete = insertAll(new PackageIngest(env, client), inventory, ready, csv);
            } else {
                complete = updateAll(new PackageUpdate(env, client), inventory, ready, csv);
            }
            LOGGER.info(complete + " of " + ready.size() + " packages completed.");
        } finally {
            client.close();
        }
    }

    /**
     * Inserts each of the given packages, children first.  A package that fails
     * validation is logged and left alone; the remaining packages are still inserted.
     *
     * @return the number of packages whose resource map was uploaded
     */
    static int insertAll(PackageIngest ingest, InMemoryInventory inventory, List<String> packageIds, File csv)
            throws IOException {
        int complete = 0;
        for (String packageId : PackageOrdering.childrenFirst(inventory, packageIds)) {
            final IngestResult result;
            try {
                result = ingest.insertPackage(inventory, packageId);
            } catch (InventoryValidationException e) {
                LOGGER.error("Skipping package " + packageId + ": " + e.getMessage());
                continue;
            }
            inventory.save(result.getRecords());
            CsvInventory.write(inventory, csv);
            if (result.isComplete()) {
                complete ++;
            } else {
                LOGGER.warn("Package " + packageId + " stopped at " + result.getState() + ".");
            }
        }
        return complete;
    }

    /**
     * Publishes the new version of each of the given packages, children first.  A
     * package that fails validation is logged and left alone.
     *
     * @return the number of packages whose new resource map was published
     */
    static int updateAll(PackageUpdate update, InMemoryInventory inventory, List<String> packageIds, File csv)
            throws IOException {
        int complete = 0;
        for (String packageId : PackageOrdering.childrenFirst(inventory, packageIds)) {
            final List<InventoryRecord> records;
            try {
                records = update.updatePackage(inventory, packageId);
            } catch (InventoryValidationException e) {
                LOGGER.error("Skipping package " + packageId + ": " + e.getMessage());
                continue;
            }
            inventory.save(records);
            CsvInventory.write(inventory, csv);
            if (records.get(0).isResmapCreated()) {
                complete ++;
            }
        }
        return complete;
    }

    private static boolean isReady(List<InventoryRecord> records) {
        for (InventoryRecord r : records) {
            if (!r.isReady()) {
                return false;
            }
        }
        return !records.isEmpty();
    }
}
