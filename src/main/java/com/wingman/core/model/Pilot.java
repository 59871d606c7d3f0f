package com.wingman.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A pilot as seen after cross-referencing. Identity is the serial number, never the name.
 */
public record Pilot(String serialNumber,
                    String name,
                    Optional<String> rank,
                    Optional<String> squadronId,
                    Optional<String> squadronName,
                    Optional<PilotStatus> status,
                    boolean referencePilot,
                    PilotStatistics statistics,
                    Optional<AnnotationRecord> annotation,
                    Optional<Integer> ageAtLastMission) {

    public Pilot {
        Objects.requireNonNull(serialNumber, "serialNumber");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(statistics, "statistics");
    }
}
