package com.wingman.core.json;

import com.wingman.core.model.PilotStatus;

import java.util.Objects;
import java.util.Optional;

/**
 * One roster member from {@code Personnel/<squadronId>.json}.
 */
public record PersonnelEntry(String squadronId,
                             String serialNumber,
                             Optional<String> name,
                             Optional<String> rank,
                             Optional<PilotStatus> status,
                             Optional<Integer> missionsFlown,
                             Optional<Integer> victories) {

    public PersonnelEntry {
        Objects.requireNonNull(squadronId, "squadronId");
        Objects.requireNonNull(serialNumber, "serialNumber");
    }
}
