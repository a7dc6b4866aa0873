package edu.virginia.lib.dataone.inventory;

/**
 * One row of the inventory: a file on disk and everything known about its progress
 * toward the repository.
 */
public class InventoryRecord {

    private String file;

    private String filename;

    private String checksum;

    private long size;

    private String formatId;

    private String packageId;

    private String parentPackage;

    private boolean metadata;

    private String pid;

    private String pidOld;

    private boolean created;

    private boolean resmapCreated;

    private boolean ready;

    private boolean updated;

    public InventoryRecord(String file, String filename) {
        if (file == null || file.length() == 0) {
            throw new InventoryValidationException("An inventory record requires a file!");
        }
        this.file = file;
        this.filename = filename;
    }

    /**
     * @return an independent copy of this record
     */
    public InventoryRecord copy() {
        InventoryRecord r = new InventoryRecord(file, filename);
        r.checksum = checksum;
        r.size = size;
        r.formatId = formatId;
        r.packageId = packageId;
        r.parentPackage = parentPackage;
        r.metadata = metadata;
        r.pid = pid;
        r.pidOld = pidOld;
        r.created = created;
        r.resmapCreated = resmapCreated;
        r.ready = ready;
        r.updated = updated;
        return r;
    }

    /**
     * Begins a version transition: the current identifier becomes the old one and the
     * given identifier becomes current.  This is the only way an assigned identifier may
     * change.
     */
    public void supersede(String newPid) {
        if (!hasPid()) {
            throw new InventoryValidationException(file + " has no identifier to supersede!");
        }
        if (newPid == null || newPid.length() == 0 || newPid.equals(pid)) {
            throw new InventoryValidationException("Invalid new identifier \"" + newPid + "\" for " + file + "!");
        }
        this.pidOld = pid;
        this.pid = newPid;
        this.updated = false;
    }

    public boolean hasPid() {
        return pid != null && pid.length() > 0;
    }

    public boolean hasPidOld() {
        return pidOld != null && pidOld.length() > 0;
    }

    /**
     * True once the object has an identifier and exists on the node.
     */
    public boolean isComplete() {
        return hasPid() && created;
    }

    public String getFile() {
        return file;
    }

    public String getFilename() {
        return filename;
    }

    public String getChecksum() {
        return checksum;
    }

    public void setChecksum(String checksum) {
        this.checksum = checksum;
    }

    public long getSize() {
        return size;
    }

    public void setSize(long size) {
        this.size = size;
    }

    public String getFormatId() {
        return formatId;
    }

    public void setFormatId(String formatId) {
        this.formatId = formatId;
    }

    public String getPackageId() {
        return packageId;
    }

    public void setPackageId(String packageId) {
        this.packageId = packageId;
    }

    public String getParentPackage() {
        return parentPackage;
    }

    public void setParentPackage(String parentPackage) {
        this.parentPackage = parentPackage;
    }

    public boolean isMetadata() {
        return metadata;
    }

    public void setMetadata(boolean metadata) {
        this.metadata = metadata;
    }

    public String getPid() {
        return pid;
    }

    public void setPid(String pid) {
        this.pid = pid;
    }

    public String getPidOld() {
        return pidOld;
    }

    public void setPidOld(String pidOld) {
        this.pidOld = pidOld;
    }

    public boolean isCreated() {
        return created;
    }

    public void setCreated(boolean created) {
        this.created = created;
    }

    public boolean isResmapCreated() {
        return resmapCreated;
    }

    public void setResmapCreated(boolean resmapCreated) {
        this.resmapCreated = resmapCreated;
    }

    public boolean isReady() {
        return ready;
    }

    public void setReady(boolean ready) {
        this.ready = ready;
    }

    public boolean isUpdated() {
        return updated;
    }

    public void setUpdated(boolean updated) {
        this.updated = updated;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof InventoryRecord)) {
            return false;
        }
        InventoryRecord other = (InventoryRecord) o;
        return file.equals(other.file)
                && equal(filename, other.filename)
                && equal(checksum, other.checksum)
                && size == other.size
                && equal(formatId, other.formatId)
                && equal(packageId, other.packageId)
                && equal(parentPackage, other.parentPackage)
                && metadata == other.metadata
                && equal(pid, other.pid)
                && equal(pidOld, other.pidOld)
                && created == other.created
                && resmapCreated == other.resmapCreated
                && ready == other.ready
                && updated == other.updated;
    }

    private static boolean equal(String a, String b) {
        return a == null ? b == null : a.equals(b);
    }

    @Override
    public int hashCode() {
        return file.hashCode();
    }

    @Override
    public String toString() {
        return file + " [package=" + packageId + ", metadata=" + metadata + ", pid=" + pid
                + ", created=" + created + ", resmap_created=" + resmapCreated + "]";
    }
}
