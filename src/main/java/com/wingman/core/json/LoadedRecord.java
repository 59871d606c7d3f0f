package com.wingman.core.json;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Loader output paired with its provenance.
 *
 * @param partial true when the file had an unexpected shape and only recognized fields were kept
 * @param notes   what was missing or unexpected; empty for a clean load
 */
public record LoadedRecord<T>(T record, Path source, boolean partial, List<String> notes) {

    public LoadedRecord {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(source, "source");
        notes = List.copyOf(notes);
    }

    public static <T> LoadedRecord<T> of(T record, Path source, List<String> notes) {
        return new LoadedRecord<>(record, source, !notes.isEmpty(), notes);
    }
}
