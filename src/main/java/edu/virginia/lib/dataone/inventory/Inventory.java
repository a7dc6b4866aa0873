package edu.virginia.lib.dataone.inventory;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * The table of files and packages being loaded.  Every method that returns records
 * returns copies; changes only reach the inventory through {@link #save}.
 */
public interface Inventory {

    /**
     * @return all records in inventory order
     */
    List<InventoryRecord> getRecords();

    /**
     * @return the record for the given file or null if there is none
     */
    InventoryRecord getRecord(String file);

    /**
     * @return the records whose package is the given package, in inventory order
     */
    List<InventoryRecord> getPackageRecords(String packageId);

    /**
     * @return the metadata records of every package whose parent is the given package
     */
    List<InventoryRecord> getChildPackageRecords(String packageId);

    /**
     * @return the distinct package identifiers in inventory order
     */
    Set<String> getPackageIds();

    /**
     * Merges the given records into the inventory, row by row.
     *
     * @throws InventoryValidationException if a record is unknown or would change an
     *         assigned identifier outside of a version transition
     */
    void save(Collection<InventoryRecord> records);
}
