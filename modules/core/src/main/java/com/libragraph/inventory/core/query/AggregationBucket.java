package com.libragraph.inventory.core.query;

/**
 * Totals for one truncated path.
 *
 * @param folder true when some grouped key continues below {@code path}
 */
public record AggregationBucket(String path, long totalSize, long objectCount, boolean folder) {
}
