package com.wingman.core.sync;

/**
 * Receives progress while a sync runs. Called from worker threads; implementations hand off to
 * their own thread when they touch UI state.
 */
@FunctionalInterface
public interface SyncProgressListener {

    SyncProgressListener NONE = (stage, percent, message) -> { };

    /**
     * @param percent overall completion, 0 to 100
     */
    void onProgress(SyncStage stage, int percent, String message);
}
