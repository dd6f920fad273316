package com.libragraph.inventory.core.manifest;

import com.libragraph.inventory.types.InventoryFormat;

import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot descriptor of one inventory report.
 *
 * <p>{@code schema} is the ordered column list shared by every data file of the
 * report; {@code files} are the report's data files in manifest order.
 *
 * @param creationTimestamp report creation time in epoch millis, 0 when the manifest omits it
 */
public record Manifest(
        String sourceBucket,
        String destinationBucket,
        String inventoryId,
        String date,
        String manifestKey,
        long creationTimestamp,
        InventoryFormat format,
        List<String> schema,
        List<DataFileRef> files
) {
    public Manifest {
        Objects.requireNonNull(sourceBucket, "sourceBucket cannot be null");
        Objects.requireNonNull(destinationBucket, "destinationBucket cannot be null");
        Objects.requireNonNull(inventoryId, "inventoryId cannot be null");
        Objects.requireNonNull(date, "date cannot be null");
        Objects.requireNonNull(manifestKey, "manifestKey cannot be null");
        Objects.requireNonNull(format, "format cannot be null");
        schema = List.copyOf(schema);
        files = List.copyOf(files);
    }

    /** Sum of the declared data file sizes. */
    public long totalDataSize() {
        long total = 0;
        for (DataFileRef f : files) {
            total += f.size();
        }
        return total;
    }
}
