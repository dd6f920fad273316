package com.libragraph.inventory.core.query;

import com.libragraph.inventory.core.InventoryException;

/**
 * Unwinds a file scan once its query is cancelled. Never reaches callers;
 * they receive partial results flagged as cancelled.
 */
public class QueryCancelledException extends InventoryException {

    public QueryCancelledException() {
        super("Query cancelled");
    }
}
