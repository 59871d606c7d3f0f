package com.wingman.core.error;

import java.util.concurrent.CancellationException;

/**
 * Raised at a file boundary when a newer sync superseded the running one.
 */
public final class SyncCancelledException extends CancellationException {

    public SyncCancelledException(String message) {
        super(message);
    }
}
