package com.wingman.core.error;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A single campaign file could not be parsed at all. The sync skips the file and keeps going.
 */
public final class MalformedRecordException extends IOException {
    private final Path path;

    public MalformedRecordException(Path path, String reason) {
        super("Malformed record " + path + ": " + reason);
        this.path = path;
    }

    public MalformedRecordException(Path path, String reason, Throwable cause) {
        super("Malformed record " + path + ": " + reason, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
