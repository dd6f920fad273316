package com.libragraph.inventory.core.query;

import java.util.List;

/**
 * Size and count totals by path prefix, buckets sorted by path.
 */
public record AggregationResult(
        int depth,
        List<AggregationBucket> buckets,
        long totalSize,
        long objectCount,
        ScanSummary summary
) {
    public AggregationResult {
        buckets = List.copyOf(buckets);
    }

    /** Partial when the scan was cancelled or some data file failed. */
    public boolean partial() {
        return !summary.complete();
    }
}
