package com.wingman.core.resolve;

import com.wingman.core.model.PilotStatus;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Merged claims for one serial number.
 *
 * @param sources every file that claimed the serial, in claim order
 */
public record PilotIdentity(String serialNumber,
                            Optional<String> name,
                            Optional<String> rank,
                            Optional<String> squadronId,
                            Optional<String> squadronName,
                            Optional<PilotStatus> status,
                            List<Path> sources) {

    public PilotIdentity {
        Objects.requireNonNull(serialNumber, "serialNumber");
        sources = List.copyOf(sources);
    }
}
