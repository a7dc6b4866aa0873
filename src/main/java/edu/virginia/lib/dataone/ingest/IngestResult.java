package edu.virginia.lib.dataone.ingest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import edu.virginia.lib.dataone.inventory.InventoryRecord;

/**
 * The package records as they stand after an insertion attempt, ready to be saved back
 * to the inventory, along with how far the package got.
 */
public class IngestResult {

    final private List<InventoryRecord> records;

    final private PackageState state;

    public IngestResult(List<InventoryRecord> records, PackageState state) {
        this.records = Collections.unmodifiableList(new ArrayList<InventoryRecord>(records));
        this.state = state;
    }

    public List<InventoryRecord> getRecords() {
        return records;
    }

    public PackageState getState() {
        return state;
    }

    public boolean isComplete() {
        return state.isComplete();
    }

    @Override
    public String toString() {
        return state + " " + records;
    }
}
