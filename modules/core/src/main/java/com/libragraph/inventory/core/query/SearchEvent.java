package com.libragraph.inventory.core.query;

import com.libragraph.inventory.core.stream.InventoryRecord;

/**
 * Items of a search stream: matches in manifest file order, then exactly one
 * {@link Completed}.
 */
public sealed interface SearchEvent {

    /**
     * @param folderPath for folder matches, the key up to the matching segment; null otherwise
     */
    record Match(InventoryRecord record, String folderPath) implements SearchEvent {
    }

    record Completed(ScanSummary summary) implements SearchEvent {
    }
}
