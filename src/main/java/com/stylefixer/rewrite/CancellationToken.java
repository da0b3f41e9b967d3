package com.stylefixer.rewrite;

import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation flag shared between a caller and long-running loops.
 */
public final class CancellationToken {
    /** A token that is never cancelled. */
    public static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private volatile boolean cancelled;

    public CancellationToken() {
        this(true);
    }

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("The NONE token cannot be cancelled");
        }
        cancelled = true;
    }

    public boolean isCancellationRequested() {
        return cancelled;
    }

    public void throwIfCancellationRequested() {
        if (cancelled) {
            throw new CancellationException("Operation cancelled");
        }
    }
}
