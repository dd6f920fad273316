package com.libragraph.inventory.core.manifest;

import com.libragraph.inventory.types.InventoryFormat;

import java.util.Objects;

/**
 * Identifies one S3 Inventory configuration: which bucket it describes, under
 * which id, and where its reports are delivered.
 *
 * <p>Reports live at
 * {@code {destinationPrefix}/{sourceBucket}/{inventoryId}/{date}/manifest.json}
 * in {@code destinationBucket}. The prefix is stored without leading or
 * trailing slashes and may be empty.
 */
public record InventoryConfig(
        String sourceBucket,
        String inventoryId,
        String destinationBucket,
        String destinationPrefix,
        InventoryFormat format
) {
    public InventoryConfig {
        requireText(sourceBucket, "sourceBucket");
        requireText(inventoryId, "inventoryId");
        requireText(destinationBucket, "destinationBucket");
        Objects.requireNonNull(format, "format cannot be null");
        destinationPrefix = normalizePrefix(destinationPrefix);
        if (sourceBucket.contains("/") || inventoryId.contains("/")) {
            throw new IllegalArgumentException(
                    "sourceBucket and inventoryId cannot contain '/': " + sourceBucket + ", " + inventoryId);
        }
    }

    public static InventoryConfig csv(String sourceBucket, String inventoryId,
                                      String destinationBucket, String destinationPrefix) {
        return new InventoryConfig(sourceBucket, inventoryId, destinationBucket, destinationPrefix,
                InventoryFormat.CSV);
    }

    static String normalizePrefix(String prefix) {
        if (prefix == null) {
            return "";
        }
        int start = 0;
        int end = prefix.length();
        while (start < end && prefix.charAt(start) == '/') start++;
        while (end > start && prefix.charAt(end - 1) == '/') end--;
        return prefix.substring(start, end);
    }

    private static void requireText(String value, String name) {
        Objects.requireNonNull(value, name + " cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be blank");
        }
    }
}
