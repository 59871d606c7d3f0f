package com.wingman.core.error;

import java.nio.file.Path;

/**
 * The campaign root is missing, not a directory, or not readable.
 */
public final class PathInvalidException extends CampaignSyncException {
    private final Path path;

    public PathInvalidException(Path path, String reason) {
        super("Campaign root " + path + " is not usable: " + reason);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
