package com.libragraph.inventory.core.query;

/**
 * Cooperative cancellation signal for one query. Scans check it once per row.
 *
 * <p>A token created with {@link #linkedTo} also reports cancelled once its
 * parent is cancelled.
 */
public final class QueryCancellation {

    private final QueryCancellation parent;
    private volatile boolean cancelled;

    public QueryCancellation() {
        this(null);
    }

    private QueryCancellation(QueryCancellation parent) {
        this.parent = parent;
    }

    public static QueryCancellation linkedTo(QueryCancellation parent) {
        return new QueryCancellation(parent);
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled || (parent != null && parent.isCancelled());
    }

    void throwIfCancelled() {
        if (isCancelled()) {
            throw new QueryCancelledException();
        }
    }
}
