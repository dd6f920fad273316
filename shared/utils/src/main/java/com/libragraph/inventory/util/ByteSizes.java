package com.libragraph.inventory.util;

import java.util.Locale;

/**
 * Human-readable byte sizes for log lines and summaries (1024-based units).
 */
public final class ByteSizes {

    private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB"};

    private ByteSizes() {
    }

    public static String format(long bytes) {
        if (bytes < 0) {
            throw new IllegalArgumentException("bytes must be >= 0, got: " + bytes);
        }
        double value = bytes;
        for (String unit : UNITS) {
            if (value < 1024.0) {
                return String.format(Locale.ROOT, "%.2f %s", value, unit);
            }
            value /= 1024.0;
        }
        return String.format(Locale.ROOT, "%.2f PB", value);
    }
}
