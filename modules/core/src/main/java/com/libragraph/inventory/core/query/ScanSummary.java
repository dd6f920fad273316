package com.libragraph.inventory.core.query;

import java.util.List;

/**
 * Accounting attached to every query result.
 *
 * @param filesTotal     data files in the manifest
 * @param filesScanned   files read to the end
 * @param filesFailed    files abandoned on an error, partial rows still counted
 * @param recordsScanned non-empty rows read, malformed ones included
 * @param malformedRows  rows skipped as malformed
 * @param cancelled      true when the query stopped early on request
 * @param failures       one entry per failed file
 */
public record ScanSummary(
        int filesTotal,
        int filesScanned,
        int filesFailed,
        long recordsScanned,
        long malformedRows,
        boolean cancelled,
        List<FileFailure> failures
) {
    public ScanSummary {
        failures = List.copyOf(failures);
    }

    /** Rows that became records. */
    public long validRecords() {
        return recordsScanned - malformedRows;
    }

    /** Every file was read to the end. */
    public boolean complete() {
        return !cancelled && filesScanned == filesTotal;
    }
}
