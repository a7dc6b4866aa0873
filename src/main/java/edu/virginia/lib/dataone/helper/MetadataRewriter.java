package edu.virginia.lib.dataone.helper;

import java.io.File;
import java.io.IOException;

public interface MetadataRewriter {

    /**
     * Writes a copy of the metadata document whose embedded package identifier has been
     * replaced with the given identifier.  The source file is left untouched.
     *
     * @return the rewritten copy
     */
    File rewrite(File source, String newIdentifier) throws IOException;
}
