package com.libragraph.inventory.core.query;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Size and count totals keyed by path. Not thread-safe: each file task fills
 * its own instance and the results are merged under a lock.
 */
final class BucketAccumulator {

    private static final class Totals {
        long size;
        long count;
        boolean folder;
    }

    private final Map<String, Totals> totals = new HashMap<>();

    void add(String path, long size, boolean folder) {
        Totals t = totals.computeIfAbsent(path, p -> new Totals());
        t.size = Math.addExact(t.size, size);
        t.count++;
        t.folder |= folder;
    }

    void mergeFrom(BucketAccumulator other) {
        other.totals.forEach((path, o) -> {
            Totals t = totals.computeIfAbsent(path, p -> new Totals());
            t.size = Math.addExact(t.size, o.size);
            t.count += o.count;
            t.folder |= o.folder;
        });
    }

    boolean isEmpty() {
        return totals.isEmpty();
    }

    /** Buckets sorted by path. */
    List<AggregationBucket> buckets() {
        List<AggregationBucket> result = new ArrayList<>(totals.size());
        totals.forEach((path, t) -> result.add(new AggregationBucket(path, t.size, t.count, t.folder)));
        result.sort((a, b) -> a.path().compareTo(b.path()));
        return result;
    }

    long totalSize() {
        long sum = 0;
        for (Totals t : totals.values()) {
            sum = Math.addExact(sum, t.size);
        }
        return sum;
    }

    long objectCount() {
        long sum = 0;
        for (Totals t : totals.values()) {
            sum += t.count;
        }
        return sum;
    }
}
