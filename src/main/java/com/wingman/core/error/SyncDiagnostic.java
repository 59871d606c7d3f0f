package com.wingman.core.error;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * One recovered problem, tagged with the file it came from when there is one.
 */
public record SyncDiagnostic(DiagnosticKind kind, Optional<Path> path, String detail) {

    public static final Comparator<SyncDiagnostic> ORDER = Comparator
        .comparing(SyncDiagnostic::kind)
        .thenComparing(d -> d.path().map(Path::toString).orElse(""))
        .thenComparing(SyncDiagnostic::detail);

    public SyncDiagnostic {
        Objects.requireNonNull(kind, "kind");
        path = path == null ? Optional.empty() : path;
        detail = detail == null ? "" : detail;
    }

    public static SyncDiagnostic of(DiagnosticKind kind, Path path, String detail) {
        return new SyncDiagnostic(kind, Optional.ofNullable(path), detail);
    }

    public static SyncDiagnostic of(DiagnosticKind kind, String detail) {
        return new SyncDiagnostic(kind, Optional.empty(), detail);
    }

    @Override
    public String toString() {
        return kind + path.map(p -> " [" + p + "]").orElse("") + ": " + detail;
    }
}
