package edu.virginia.lib.dataone.ingest;

import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.virginia.lib.dataone.helper.Environment;
import edu.virginia.lib.dataone.helper.RemoteResult;
import edu.virginia.lib.dataone.helper.RepositoryClient;
import edu.virginia.lib.dataone.inventory.InventoryRecord;

/**
 * Finds the identifier an inventory record should be uploaded under, minting one when
 * the record doesn't have one yet.
 */
public class IdentifierResolver {

    final private static Logger LOGGER = LoggerFactory.getLogger(IdentifierResolver.class);

    public static final String UUID_PREFIX = "urn:uuid:";

    private RepositoryClient client;

    public IdentifierResolver(RepositoryClient client) {
        this.client = client;
    }

    /**
     * Returns the record's identifier if it has one.  Otherwise a new identifier is
     * generated locally (for the "UUID" scheme) or by the repository (for any other
     * scheme, such as "DOI").  The record itself is not modified.
     *
     * @return the identifier, or an empty string if one could not be minted
     */
    public String getOrCreatePid(InventoryRecord record, String scheme) {
        if (record.hasPid()) {
            return record.getPid();
        }
        if (Environment.UUID_SCHEME.equals(scheme)) {
            return UUID_PREFIX + UUID.randomUUID().toString();
        }
        RemoteResult<String> minted = client.mintIdentifier(scheme);
        if (minted.isFailure() || minted.getValue() == null || minted.getValue().length() == 0) {
            LOGGER.error("Unable to mint a " + scheme + " identifier for " + record.getFile() + ": " + minted);
            return "";
        }
        LOGGER.debug("Minted " + minted.getValue() + " for " + record.getFile() + ".");
        return minted.getValue();
    }
}
