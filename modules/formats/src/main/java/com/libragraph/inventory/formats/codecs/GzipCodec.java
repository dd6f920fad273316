package com.libragraph.inventory.formats.codecs;

import com.libragraph.inventory.formats.api.Codec;
import jakarta.enterprise.context.ApplicationScoped;

import java.io.IOException;
import java.io.InputStream;
import java.util.zip.GZIPInputStream;

/**
 * Codec for GZIP compression (.gz files), the default for CSV inventory reports.
 */
@ApplicationScoped
public class GzipCodec implements Codec {
    private static final byte[] GZIP_MAGIC = new byte[]{0x1f, (byte) 0x8b};
    private static final int READ_BUFFER = 64 * 1024;

    @Override
    public String name() {
        return "gzip";
    }

    @Override
    public boolean matches(byte[] header, String filename) {
        if (header.length >= 2) {
            if (header[0] == GZIP_MAGIC[0] && header[1] == GZIP_MAGIC[1]) {
                return true;
            }
        }

        if (filename != null) {
            String lower = filename.toLowerCase();
            return lower.endsWith(".gz") || lower.endsWith(".gzip");
        }

        return false;
    }

    @Override
    public InputStream decode(InputStream input) throws IOException {
        return new GZIPInputStream(input, READ_BUFFER);
    }
}
