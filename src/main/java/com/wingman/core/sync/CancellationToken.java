package com.wingman.core.sync;

import com.wingman.core.error.SyncCancelledException;

import java.util.function.BooleanSupplier;

/**
 * Cooperative cancellation flag, checked between file operations.
 */
public final class CancellationToken implements BooleanSupplier {
    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public boolean getAsBoolean() {
        return cancelled;
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new SyncCancelledException("Sync cancelled");
        }
    }
}
