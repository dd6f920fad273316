package com.libragraph.inventory.core.query;

import com.libragraph.inventory.core.stream.RecordStream;

import java.util.ArrayList;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters shared by the file tasks of one scan.
 */
final class ScanProgress {

    private final int filesTotal;
    private final AtomicInteger filesScanned = new AtomicInteger();
    private final AtomicInteger filesFailed = new AtomicInteger();
    private final AtomicLong recordsScanned = new AtomicLong();
    private final AtomicLong malformedRows = new AtomicLong();
    private final ConcurrentSkipListMap<Integer, FileFailure> failures = new ConcurrentSkipListMap<>();

    ScanProgress(int filesTotal) {
        this.filesTotal = filesTotal;
    }

    void fileScanned(RecordStream stream) {
        count(stream);
        filesScanned.incrementAndGet();
    }

    /** A file interrupted by cancellation: its rows count, the file does not. */
    void filePartial(RecordStream stream) {
        count(stream);
    }

    /**
     * @param stream the file's stream when it was opened, null otherwise
     */
    void fileFailed(int index, String key, String reason, RecordStream stream) {
        count(stream);
        filesFailed.incrementAndGet();
        failures.put(index, new FileFailure(key, reason));
    }

    /**
     * @param cancelRequested whether the query's cancellation fired; the summary
     *                        only reports cancelled when some file was left unfinished
     */
    ScanSummary summary(boolean cancelRequested) {
        int scanned = filesScanned.get();
        int failed = filesFailed.get();
        boolean cancelled = cancelRequested && scanned + failed < filesTotal;
        return new ScanSummary(filesTotal, scanned, failed,
                recordsScanned.get(), malformedRows.get(), cancelled, new ArrayList<>(failures.values()));
    }

    private void count(RecordStream stream) {
        if (stream != null) {
            recordsScanned.addAndGet(stream.rowsRead());
            malformedRows.addAndGet(stream.malformedRows());
        }
    }
}
