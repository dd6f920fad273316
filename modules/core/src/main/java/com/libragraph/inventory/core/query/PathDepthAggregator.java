package com.libragraph.inventory.core.query;

import com.libragraph.inventory.core.manifest.Manifest;
import com.libragraph.inventory.core.stream.RecordStreamReader;
import com.libragraph.inventory.util.PathSegments;
import org.jboss.logging.Logger;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Totals object sizes and counts by key prefix truncated to a number of path
 * segments. Keys with fewer directory segments than the depth form their own
 * group; depth 0 gives one bucket-wide total under the empty path.
 */
public class PathDepthAggregator {

    private static final Logger log = Logger.getLogger(PathDepthAggregator.class);

    private final FileScanner scanner;
    private final Executor executor;

    public PathDepthAggregator(RecordStreamReader reader, Executor executor) {
        this.scanner = new FileScanner(Objects.requireNonNull(reader, "reader cannot be null"));
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
    }

    /**
     * @throws IllegalArgumentException if depth is negative
     */
    public AggregationResult aggregate(Manifest manifest, int depth, QueryCancellation cancellation) {
        if (depth < 0) {
            throw new IllegalArgumentException("depth must be >= 0, got: " + depth);
        }
        BucketScan.Outcome outcome = BucketScan.run(scanner, executor, manifest, cancellation, (acc, record) -> {
            String key = record.key();
            String path = PathSegments.truncate(key, depth);
            acc.add(path, record.size(), path.length() < key.length());
        });

        BucketAccumulator buckets = outcome.buckets();
        AggregationResult result = new AggregationResult(depth, buckets.buckets(),
                buckets.totalSize(), buckets.objectCount(), outcome.summary());
        log.debugf("Aggregated %s/%s at depth %d: %d bucket(s), %d object(s)",
                manifest.sourceBucket(), manifest.date(), depth, result.buckets().size(), result.objectCount());
        return result;
    }
}
