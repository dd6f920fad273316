package com.libragraph.inventory.formats.api;

import java.io.IOException;
import java.io.InputStream;

/**
 * Interface for codec plugins that undo transport-level compression of
 * inventory data files. Examples: gzip, bzip2.
 *
 * Codecs decode as a stream: nothing beyond the codec's own window is buffered,
 * so a data file never has to fit in memory.
 * Implementations should be {@code @ApplicationScoped} CDI beans.
 */
public interface Codec {

    /** Short name used in log lines (e.g. {@code gzip}). */
    String name();

    /**
     * Checks if this codec can handle the given file.
     *
     * @param header   First bytes of the file (up to 16)
     * @param filename Object key or file name (may contain hints like .gz extension)
     * @return true if this codec should handle the file
     */
    boolean matches(byte[] header, String filename);

    /**
     * Wraps the encoded stream in a decoding stream.
     * Closing the returned stream closes {@code input}.
     */
    InputStream decode(InputStream input) throws IOException;
}
