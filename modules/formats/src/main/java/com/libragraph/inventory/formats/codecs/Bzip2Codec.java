package com.libragraph.inventory.formats.codecs;

import com.libragraph.inventory.formats.api.Codec;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;

import java.io.IOException;
import java.io.InputStream;

/**
 * Codec for BZIP2 compression (.bz2 files).
 * Uses Apache Commons Compress for BZIP2 support.
 */
@ApplicationScoped
public class Bzip2Codec implements Codec {
    private static final byte[] BZIP2_MAGIC = new byte[]{'B', 'Z', 'h'};

    @Override
    public String name() {
        return "bzip2";
    }

    @Override
    public boolean matches(byte[] header, String filename) {
        if (header.length >= 3) {
            if (header[0] == BZIP2_MAGIC[0] &&
                header[1] == BZIP2_MAGIC[1] &&
                header[2] == BZIP2_MAGIC[2]) {
                return true;
            }
        }

        if (filename != null) {
            String lower = filename.toLowerCase();
            return lower.endsWith(".bz2") || lower.endsWith(".bzip2");
        }

        return false;
    }

    @Override
    public InputStream decode(InputStream input) throws IOException {
        // decompressConcatenated: multi-stream files written by parallel compressors
        return new BZip2CompressorInputStream(input, true);
    }
}
