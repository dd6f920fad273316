package com.libragraph.inventory.core.query;

import com.libragraph.inventory.core.manifest.Manifest;
import com.libragraph.inventory.core.stream.InventoryRecord;
import org.jboss.logging.Logger;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.BiConsumer;

/**
 * Unordered fan-out over a manifest's data files. Every file groups its
 * records into a private accumulator; accumulators are merged as files finish,
 * so the result does not depend on completion order.
 */
final class BucketScan {

    private static final Logger log = Logger.getLogger(BucketScan.class);

    record Outcome(BucketAccumulator buckets, ScanSummary summary) {
    }

    private BucketScan() {
    }

    static Outcome run(FileScanner scanner, Executor executor, Manifest manifest,
                       QueryCancellation cancellation, BiConsumer<BucketAccumulator, InventoryRecord> grouping) {
        int fileCount = manifest.files().size();
        ScanProgress progress = new ScanProgress(fileCount);
        BucketAccumulator merged = new BucketAccumulator();
        CountDownLatch finished = new CountDownLatch(fileCount);
        QueryCancellation scanCancel = QueryCancellation.linkedTo(cancellation);

        for (int i = 0; i < fileCount; i++) {
            int index = i;
            Runnable task = () -> {
                BucketAccumulator local = new BucketAccumulator();
                try {
                    scanner.scan(manifest, index, scanCancel, progress, record -> grouping.accept(local, record));
                } finally {
                    synchronized (merged) {
                        merged.mergeFrom(local);
                    }
                    finished.countDown();
                }
            };
            try {
                executor.execute(task);
            } catch (RejectedExecutionException e) {
                String key = manifest.files().get(index).key();
                log.warnf("Scan of %s rejected: %s", key, e.getMessage());
                progress.fileFailed(index, key, "scan rejected: " + e.getMessage(), null);
                finished.countDown();
            }
        }

        boolean interrupted = false;
        try {
            finished.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scanCancel.cancel();
            interrupted = true;
        }
        synchronized (merged) {
            return new Outcome(merged, progress.summary(interrupted || scanCancel.isCancelled()));
        }
    }
}
