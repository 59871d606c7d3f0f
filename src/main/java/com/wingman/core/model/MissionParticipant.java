package com.wingman.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A plane/pilot slot listed in a mission data file.
 */
public record MissionParticipant(Optional<String> serialNumber,
                                 String name,
                                 Optional<String> rank,
                                 Optional<String> squadronId) {

    public MissionParticipant {
        Objects.requireNonNull(name, "name");
    }
}
