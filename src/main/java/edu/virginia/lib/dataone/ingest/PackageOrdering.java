package edu.virginia.lib.dataone.ingest;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import edu.virginia.lib.dataone.inventory.Inventory;
import edu.virginia.lib.dataone.inventory.InventoryRecord;
import edu.virginia.lib.dataone.inventory.InventoryValidationException;

/**
 * Orders packages so that every child package comes before its parent, which is the
 * order they must be inserted in.  Packages otherwise keep the order they were given in.
 */
public class PackageOrdering {

    public static List<String> childrenFirst(Inventory inventory, Collection<String> packageIds) {
        final Map<String, List<String>> children = new LinkedHashMap<String, List<String>>();
        for (String packageId : packageIds) {
            List<String> ids = new ArrayList<String>();
            for (InventoryRecord child : inventory.getChildPackageRecords(packageId)) {
                if (packageIds.contains(child.getPackageId())) {
                    ids.add(child.getPackageId());
                }
            }
            children.put(packageId, ids);
        }
        final List<String> ordered = new ArrayList<String>();
        final Set<String> visiting = new HashSet<String>();
        for (String packageId : packageIds) {
            visit(packageId, children, visiting, ordered);
        }
        return ordered;
    }

    private static void visit(String packageId, Map<String, List<String>> children, Set<String> visiting,
                              List<String> ordered) {
        if (ordered.contains(packageId)) {
            return;
        }
        if (!visiting.add(packageId)) {
            throw new InventoryValidationException("Package " + packageId + " is nested within itself!");
        }
        for (String child : children.get(packageId)) {
            visit(child, children, visiting, ordered);
        }
        visiting.remove(packageId);
        ordered.add(packageId);
    }
}
