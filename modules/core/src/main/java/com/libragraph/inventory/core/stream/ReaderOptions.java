package com.libragraph.inventory.core.stream;

/**
 * Tuning for {@link RecordStreamReader}.
 *
 * @param maxConsecutiveMalformed malformed rows tolerated in a row before the file is given up
 * @param urlDecodeKeys           whether keys are URL-decoded (S3 Inventory encodes them)
 */
public record ReaderOptions(int maxConsecutiveMalformed, boolean urlDecodeKeys) {

    public static final int DEFAULT_MAX_CONSECUTIVE_MALFORMED = 100;

    public ReaderOptions {
        if (maxConsecutiveMalformed < 0) {
            throw new IllegalArgumentException(
                    "maxConsecutiveMalformed must be >= 0, got: " + maxConsecutiveMalformed);
        }
    }

    public static ReaderOptions defaults() {
        return new ReaderOptions(DEFAULT_MAX_CONSECUTIVE_MALFORMED, true);
    }
}
