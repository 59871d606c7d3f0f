package com.wingman.core.sync;

import com.wingman.core.annotation.AnnotationStore;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * @param missionFolder simulator {@code .mission} folder; without one no weather is looked up
 */
public record SyncRequest(Path campaignRoot, Optional<Path> missionFolder, AnnotationStore annotationStore) {

    public SyncRequest {
        Objects.requireNonNull(campaignRoot, "campaignRoot");
        Objects.requireNonNull(annotationStore, "annotationStore");
        missionFolder = missionFolder == null ? Optional.empty() : missionFolder;
    }
}
