package edu.virginia.lib.dataone.helper;

import java.io.File;
import java.io.IOException;

public interface Hasher {

    /**
     * The algorithm name as it appears in system metadata.
     */
    String getAlgorithm();

    /**
     * @return the lower case hex digest of the file's content
     */
    String checksum(File file) throws IOException;
}
