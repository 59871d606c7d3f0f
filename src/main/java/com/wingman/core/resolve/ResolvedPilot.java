package com.wingman.core.resolve;

import com.wingman.core.json.AceEntry;
import com.wingman.core.json.PersonnelEntry;
import com.wingman.core.model.CombatReport;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A pilot identity with the records that feed its statistics.
 *
 * @param reports combat reports from the pilot's own report folder, in source order
 * @param partial true when any of these records came from a partially understood file
 */
public record ResolvedPilot(PilotIdentity identity,
                            boolean referencePilot,
                            List<CombatReport> reports,
                            Optional<AceEntry> aceEntry,
                            Optional<PersonnelEntry> personnelEntry,
                            boolean partial) {

    public ResolvedPilot {
        Objects.requireNonNull(identity, "identity");
        reports = List.copyOf(reports);
    }

    public String serialNumber() {
        return identity.serialNumber();
    }
}
