package edu.virginia.lib.dataone.ingest;

/**
 * The progress of a package through insertion.  A package returned in a given state
 * has completed that step and every step before it.
 */
public enum PackageState {
    NO_METADATA_ID,
    METADATA_DESCRIBED,
    METADATA_UPLOADED,
    DATA_UPLOADING,
    DATA_COMPLETE,
    RESOURCE_MAP_BUILT,
    RESOURCE_MAP_UPLOADED;

    public boolean isComplete() {
        return this == RESOURCE_MAP_UPLOADED;
    }
}
