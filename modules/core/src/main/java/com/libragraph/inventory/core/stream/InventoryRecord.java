package com.libragraph.inventory.core.stream;

import java.time.Instant;
import java.util.Objects;

/**
 * One object listed in an inventory report.
 *
 * <p>{@code lastModified}, {@code storageClass} and {@code eTag} are null when
 * the report's schema lacks the column or the cell is empty.
 */
public record InventoryRecord(
        String bucket,
        String key,
        long size,
        Instant lastModified,
        String storageClass,
        String eTag
) {
    public InventoryRecord {
        Objects.requireNonNull(key, "key cannot be null");
        if (size < 0) {
            throw new IllegalArgumentException("size must be >= 0, got: " + size);
        }
    }

    public static InventoryRecord of(String bucket, String key, long size) {
        return new InventoryRecord(bucket, key, size, null, null, null);
    }
}
