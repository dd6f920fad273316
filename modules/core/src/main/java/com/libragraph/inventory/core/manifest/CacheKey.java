package com.libragraph.inventory.core.manifest;

import com.libragraph.inventory.util.KeyDigest;

import java.util.Objects;

/**
 * Identity of a cached manifest: one report date of one inventory, as
 * delivered to one destination.
 */
public record CacheKey(String destinationBucket, String destinationPrefix,
                       String sourceBucket, String inventoryId, String date) {

    public CacheKey {
        Objects.requireNonNull(destinationBucket, "destinationBucket cannot be null");
        Objects.requireNonNull(destinationPrefix, "destinationPrefix cannot be null");
        Objects.requireNonNull(sourceBucket, "sourceBucket cannot be null");
        Objects.requireNonNull(inventoryId, "inventoryId cannot be null");
        Objects.requireNonNull(date, "date cannot be null");
    }

    public static CacheKey of(InventoryConfig config, String date) {
        return new CacheKey(config.destinationBucket(), config.destinationPrefix(),
                config.sourceBucket(), config.inventoryId(), date);
    }

    /** True for any report date of the inventory {@code config} describes. */
    public boolean sameInventory(InventoryConfig config) {
        return destinationBucket.equals(config.destinationBucket())
                && destinationPrefix.equals(config.destinationPrefix())
                && sourceBucket.equals(config.sourceBucket())
                && inventoryId.equals(config.inventoryId());
    }

    public boolean sameInventory(CacheKey other) {
        return destinationBucket.equals(other.destinationBucket)
                && destinationPrefix.equals(other.destinationPrefix)
                && sourceBucket.equals(other.sourceBucket)
                && inventoryId.equals(other.inventoryId);
    }

    /** Stable digest used to name the entry's file on disk. */
    public KeyDigest digest() {
        return KeyDigest.of(destinationBucket, destinationPrefix, sourceBucket, inventoryId, date);
    }
}
