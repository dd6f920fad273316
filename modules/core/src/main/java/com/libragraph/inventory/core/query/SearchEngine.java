package com.libragraph.inventory.core.query;

import com.libragraph.inventory.core.manifest.Manifest;
import com.libragraph.inventory.core.stream.RecordStreamReader;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Streams the records of a manifest whose keys match a query.
 *
 * <p>Data files are scanned concurrently on the executor but matches reach the
 * sink in manifest file order: every file buffers into its own bounded queue
 * and the calling thread drains the queues one file after the other. The
 * first file's matches are delivered while it is still being read.
 */
public class SearchEngine {

    private static final Logger log = Logger.getLogger(SearchEngine.class);

    private static final int QUEUE_CAPACITY = 1024;
    private static final long POLL_MILLIS = 50;

    /** Marks the end of one file's matches. */
    private static final SearchEvent.Match END = new SearchEvent.Match(null, null);

    private final FileScanner scanner;
    private final Executor executor;

    public SearchEngine(RecordStreamReader reader, Executor executor) {
        this.scanner = new FileScanner(Objects.requireNonNull(reader, "reader cannot be null"));
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
    }

    /**
     * Runs the search on the calling thread, handing each match to {@code sink}.
     * Returns once every file is done or the query is cancelled.
     */
    public ScanSummary search(Manifest manifest, SearchQuery query,
                              Consumer<SearchEvent.Match> sink, QueryCancellation cancellation) {
        KeyMatcher matcher = KeyMatcher.of(query);
        int fileCount = manifest.files().size();
        ScanProgress progress = new ScanProgress(fileCount);
        QueryCancellation scanCancel = QueryCancellation.linkedTo(cancellation);
        CountDownLatch finished = new CountDownLatch(fileCount);

        List<BlockingQueue<SearchEvent.Match>> queues = new ArrayList<>(fileCount);
        for (int i = 0; i < fileCount; i++) {
            queues.add(new ArrayBlockingQueue<>(QUEUE_CAPACITY));
        }

        log.debugf("Searching %d data file(s) of %s/%s for %s '%s'",
                fileCount, manifest.sourceBucket(), manifest.date(), query.mode().label(), query.text());

        for (int i = 0; i < fileCount; i++) {
            int index = i;
            BlockingQueue<SearchEvent.Match> queue = queues.get(i);
            Runnable task = () -> {
                try {
                    scanner.scan(manifest, index, scanCancel, progress, record -> {
                        if (matcher.matches(record.key())) {
                            put(queue, new SearchEvent.Match(record, matcher.folderPath(record.key())), scanCancel);
                        }
                    });
                } finally {
                    finish(queue, scanCancel);
                    finished.countDown();
                }
            };
            try {
                executor.execute(task);
            } catch (RejectedExecutionException e) {
                String key = manifest.files().get(index).key();
                log.warnf("Scan of %s rejected: %s", key, e.getMessage());
                progress.fileFailed(index, key, "scan rejected: " + e.getMessage(), null);
                queue.offer(END);
                finished.countDown();
            }
        }

        boolean stoppedEarly = false;
        try {
            stoppedEarly = !drain(queues, sink, scanCancel);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stoppedEarly = true;
        } catch (RuntimeException e) {
            scanCancel.cancel();
            awaitWorkers(finished);
            throw e;
        }

        if (stoppedEarly) {
            scanCancel.cancel();
            awaitWorkers(finished);
        }
        return progress.summary(stoppedEarly);
    }

    /**
     * Groups records by the folder whose name contains {@code text}; the
     * folder path of a key runs up to the first such directory segment.
     */
    public FolderSearchResult searchFolders(Manifest manifest, String text, boolean caseSensitive,
                                            QueryCancellation cancellation) {
        Objects.requireNonNull(text, "text cannot be null");
        KeyMatcher matcher = KeyMatcher.folderContaining(text, caseSensitive);
        BucketScan.Outcome outcome = BucketScan.run(scanner, executor, manifest, cancellation, (acc, record) -> {
            String folder = matcher.folderPath(record.key());
            if (folder != null) {
                acc.add(folder, record.size(), true);
            }
        });
        return new FolderSearchResult(text, outcome.buckets().buckets(), outcome.summary());
    }

    /** @return false when cancellation stopped the drain */
    private static boolean drain(List<BlockingQueue<SearchEvent.Match>> queues,
                                 Consumer<SearchEvent.Match> sink,
                                 QueryCancellation cancellation) throws InterruptedException {
        for (BlockingQueue<SearchEvent.Match> queue : queues) {
            while (true) {
                if (cancellation.isCancelled()) {
                    return false;
                }
                SearchEvent.Match match = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (match == null) {
                    continue;
                }
                if (match == END) {
                    break;
                }
                sink.accept(match);
            }
        }
        return true;
    }

    private static void put(BlockingQueue<SearchEvent.Match> queue, SearchEvent.Match match,
                            QueryCancellation cancellation) {
        try {
            while (!queue.offer(match, POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                cancellation.throwIfCancelled();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryCancelledException();
        }
    }

    private static void finish(BlockingQueue<SearchEvent.Match> queue, QueryCancellation cancellation) {
        try {
            while (!queue.offer(END, POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                if (cancellation.isCancelled()) {
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void awaitWorkers(CountDownLatch finished) {
        try {
            finished.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while waiting for cancelled scan tasks");
        }
    }
}
