package com.smartlists.externallist;

import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation signal shared by one batch fetch.
 * Adapters check it before every page request; the aggregator checks it before every URL.
 */
public final class CancellationToken {
    private static final CancellationToken NONE = new CancellationToken();

    private volatile boolean cancelled;

    /**
     * @return a token that is never cancelled by its owner
     */
    public static CancellationToken none() {
        return NONE;
    }

    public void cancel() {
        if (this == NONE) {
            throw new IllegalStateException("The shared no-op token cannot be cancelled");
        }
        cancelled = true;
    }

    public boolean isCancellationRequested() {
        return cancelled;
    }

    /**
     * @throws CancellationException if cancellation has been requested
     */
    public void throwIfCancellationRequested() {
        if (cancelled) {
            throw new CancellationException("External list fetch cancelled");
        }
    }
}
