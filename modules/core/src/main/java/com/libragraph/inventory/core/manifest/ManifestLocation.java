package com.libragraph.inventory.core.manifest;

import com.libragraph.inventory.types.InventoryFormat;

/**
 * Where one manifest was found in a destination bucket.
 */
public record ManifestLocation(
        String destinationBucket,
        String destinationPrefix,
        String sourceBucket,
        String inventoryId,
        String date,
        String manifestKey
) {
    public InventoryConfig toConfig(InventoryFormat format) {
        return new InventoryConfig(sourceBucket, inventoryId, destinationBucket, destinationPrefix, format);
    }
}
