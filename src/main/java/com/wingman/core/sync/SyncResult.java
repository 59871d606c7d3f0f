package com.wingman.core.sync;

import com.wingman.core.error.SyncDiagnostic;
import com.wingman.core.model.UnifiedCampaignModel;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A finished sync. The completion time is kept here rather than in the model, which stays a pure
 * function of the campaign files.
 */
public record SyncResult(UnifiedCampaignModel model, List<SyncDiagnostic> diagnostics, Instant completedAt) {

    public SyncResult {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(completedAt, "completedAt");
        diagnostics = List.copyOf(diagnostics);
    }
}
