package com.wingman.core.annotation;

import com.wingman.core.model.AnnotationRecord;

import java.util.Map;
import java.util.Optional;

/**
 * User annotations keyed by pilot serial number. Lives independently of any campaign sync and may be
 * written while a sync is reading it.
 */
public interface AnnotationStore {

    Optional<AnnotationRecord> get(String serialNumber);

    /**
     * Stores the record under {@code serialNumber}, replacing any previous one.
     *
     * @return false when the record could not be persisted; the previous state is kept
     */
    boolean put(String serialNumber, AnnotationRecord record);

    /**
     * @return consistent copy of every annotation, ordered by serial number
     */
    Map<String, AnnotationRecord> snapshot();

    /**
     * @return true when the backing content was damaged and the store started out empty
     */
    default boolean wasRecoveredFromCorruption() {
        return false;
    }
}
