package com.wingman.core.resolve;

import com.wingman.core.model.PilotStatus;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * One source file's statement about who holds a serial number.
 */
public record PilotClaim(String serialNumber,
                         Optional<String> name,
                         Optional<String> rank,
                         Optional<String> squadronId,
                         Optional<String> squadronName,
                         Optional<PilotStatus> status,
                         Path source) {

    public PilotClaim {
        Objects.requireNonNull(serialNumber, "serialNumber");
        Objects.requireNonNull(source, "source");
        name = name.filter(n -> !n.isBlank());
    }

    static PilotClaim named(String serialNumber, Optional<String> name, Path source) {
        return new PilotClaim(serialNumber, name, Optional.empty(), Optional.empty(), Optional.empty(),
            Optional.empty(), source);
    }
}
