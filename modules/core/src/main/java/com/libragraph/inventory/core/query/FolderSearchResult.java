package com.libragraph.inventory.core.query;

import java.util.List;

/**
 * Folders whose name contains the query, with the totals of everything below them.
 */
public record FolderSearchResult(String query, List<AggregationBucket> folders, ScanSummary summary) {

    public FolderSearchResult {
        folders = List.copyOf(folders);
    }
}
