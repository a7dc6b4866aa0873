package edu.virginia.lib.dataone.inventory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An {@link Inventory} held in memory.  Saves are serialized so that concurrent runs on
 * different packages can share one instance.
 */
public class InMemoryInventory implements Inventory {

    final private static Logger LOGGER = LoggerFactory.getLogger(InMemoryInventory.class);

    final private Map<String, InventoryRecord> records = new LinkedHashMap<String, InventoryRecord>();

    public InMemoryInventory(Collection<InventoryRecord> initial) {
        for (InventoryRecord r : initial) {
            if (records.containsKey(r.getFile())) {
                throw new InventoryValidationException("Duplicate file \"" + r.getFile() + "\" in inventory!");
            }
            records.put(r.getFile(), r.copy());
        }
    }

    @Override
    public synchronized List<InventoryRecord> getRecords() {
        List<InventoryRecord> result = new ArrayList<InventoryRecord>();
        for (InventoryRecord r : records.values()) {
            result.add(r.copy());
        }
        return result;
    }

    @Override
    public synchronized InventoryRecord getRecord(String file) {
        InventoryRecord r = records.get(file);
        return r == null ? null : r.copy();
    }

    @Override
    public synchronized List<InventoryRecord> getPackageRecords(String packageId) {
        List<InventoryRecord> result = new ArrayList<InventoryRecord>();
        if (packageId == null) {
            return result;
        }
        for (InventoryRecord r : records.values()) {
            if (packageId.equals(r.getPackageId())) {
                result.add(r.copy());
            }
        }
        return result;
    }

    @Override
    public synchronized List<InventoryRecord> getChildPackageRecords(String packageId) {
        List<InventoryRecord> result = new ArrayList<InventoryRecord>();
        if (packageId == null) {
            return result;
        }
        for (InventoryRecord r : records.values()) {
            if (r.isMetadata() && packageId.equals(r.getParentPackage())) {
                result.add(r.copy());
            }
        }
        return result;
    }

    @Override
    public synchronized Set<String> getPackageIds() {
        Set<String> ids = new LinkedHashSet<String>();
        for (InventoryRecord r : records.values()) {
            if (r.getPackageId() != null) {
                ids.add(r.getPackageId());
            }
        }
        return ids;
    }

    /**
     * Every record is checked before any is written, so a rejected save leaves the
     * inventory as it was.  "created" is never reset: a record that comes back with
     * created=false for an object already recorded as created keeps created=true.
     */
    @Override
    public synchronized void save(Collection<InventoryRecord> updates) {
        for (InventoryRecord update : updates) {
            InventoryRecord existing = records.get(update.getFile());
            if (existing == null) {
                throw new InventoryValidationException("Unknown file \"" + update.getFile() + "\"!");
            }
            if (existing.hasPid() && !existing.getPid().equals(update.getPid())
                    && !existing.getPid().equals(update.getPidOld())) {
                throw new InventoryValidationException("Refusing to change identifier " + existing.getPid()
                        + " of " + existing.getFile() + " to " + update.getPid() + "!");
            }
        }
        for (InventoryRecord update : updates) {
            InventoryRecord merged = update.copy();
            InventoryRecord existing = records.get(update.getFile());
            if (existing.isCreated() && !merged.isCreated()) {
                LOGGER.warn("Ignoring attempt to reset created flag for " + existing.getFile() + ".");
                merged.setCreated(true);
            }
            records.put(merged.getFile(), merged);
        }
    }
}
