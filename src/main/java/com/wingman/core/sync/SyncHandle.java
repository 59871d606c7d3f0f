package com.wingman.core.sync;

import java.util.concurrent.CompletableFuture;

/**
 * A sync started by {@link CampaignSyncService#startSync}. The result completes exceptionally when
 * the sync was cancelled or aborted: {@code get()} throws an {@code ExecutionException} whose cause
 * is the {@link com.wingman.core.error.SyncCancelledException} or the
 * {@link com.wingman.core.error.CampaignSyncException}, while dependent stages and {@code join()}
 * see it wrapped in a {@code CompletionException}.
 */
public final class SyncHandle {
    private final CancellationToken token;
    private final CompletableFuture<SyncResult> result;

    SyncHandle(CancellationToken token, CompletableFuture<SyncResult> result) {
        this.token = token;
        this.result = result;
    }

    public CompletableFuture<SyncResult> result() {
        return result;
    }

    public void cancel() {
        token.cancel();
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }
}
