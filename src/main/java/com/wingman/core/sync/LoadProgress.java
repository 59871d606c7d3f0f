package com.wingman.core.sync;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns per-file completions into one progress event per finished category. Loading covers the
 * {@code FIRST_PERCENT..LAST_PERCENT} span of the overall progress.
 */
final class LoadProgress {
    static final int FIRST_PERCENT = 5;
    static final int LAST_PERCENT = 70;

    private final SyncProgressListener listener;
    private final Map<SyncStage, AtomicInteger> remaining = new EnumMap<>(SyncStage.class);
    private final Map<SyncStage, Integer> totals = new EnumMap<>(SyncStage.class);
    private final AtomicInteger done = new AtomicInteger();
    private final int totalFiles;

    LoadProgress(SyncProgressListener listener, Map<SyncStage, Integer> filesPerStage) {
        this.listener = listener;
        int total = 0;
        for (Map.Entry<SyncStage, Integer> entry : filesPerStage.entrySet()) {
            remaining.put(entry.getKey(), new AtomicInteger(entry.getValue()));
            totals.put(entry.getKey(), entry.getValue());
            total += entry.getValue();
        }
        this.totalFiles = total;
    }

    /**
     * Reports the categories that have nothing to load.
     */
    void reportEmptyStages() {
        totals.forEach((stage, count) -> {
            if (count == 0) {
                listener.onProgress(stage, percent(), stage.label() + ": nothing to read");
            }
        });
    }

    void fileDone(SyncStage stage) {
        done.incrementAndGet();
        AtomicInteger left = remaining.get(stage);
        if (left != null && left.decrementAndGet() == 0) {
            listener.onProgress(stage, percent(), stage.label() + ": " + totals.get(stage) + " file(s)");
        }
    }

    private int percent() {
        if (totalFiles == 0) {
            return LAST_PERCENT;
        }
        return FIRST_PERCENT + (LAST_PERCENT - FIRST_PERCENT) * done.get() / totalFiles;
    }
}
