package edu.virginia.lib.dataone.resourcemap;

import java.io.IOException;

/**
 * Turns a {@link ResourceMap} into the bytes that are uploaded to the repository.
 */
public interface ResourceMapSerializer {

    public byte[] serialize(ResourceMap resourceMap) throws IOException;

}
