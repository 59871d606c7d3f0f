package com.wingman.core.error;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import com.wingman.logging.AppLogger;

/**
 * Thread-safe accumulator shared by the loader workers of one sync.
 */
public final class DiagnosticCollector {
    private static final Logger LOGGER = AppLogger.get();

    private final List<SyncDiagnostic> diagnostics = new ArrayList<>();

    public void report(DiagnosticKind kind, Path path, String detail) {
        add(SyncDiagnostic.of(kind, path, detail));
    }

    public void report(DiagnosticKind kind, String detail) {
        add(SyncDiagnostic.of(kind, detail));
    }

    public synchronized void add(SyncDiagnostic diagnostic) {
        LOGGER.fine(() -> "Diagnostic " + diagnostic);
        diagnostics.add(diagnostic);
    }

    public synchronized int size() {
        return diagnostics.size();
    }

    /**
     * @return diagnostics in a stable order, independent of which worker reported first
     */
    public synchronized List<SyncDiagnostic> snapshot() {
        List<SyncDiagnostic> copy = new ArrayList<>(diagnostics);
        copy.sort(SyncDiagnostic.ORDER);
        return List.copyOf(copy);
    }
}
