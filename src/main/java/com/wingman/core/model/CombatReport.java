package com.wingman.core.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-mission combat report of the pilot owning the {@code CombatReports/<serial>} folder.
 *
 * @param source            report file
 * @param folderSerial      serial number taken from the containing folder; the join key
 * @param missionKey        {@code date_time} when both are known, else the file stem
 * @param victoriesReported whether the file carried a victory field at all
 * @param lossesReported    whether the file carried a loss field at all
 */
public record CombatReport(Path source,
                           String folderSerial,
                           String missionKey,
                           Optional<String> pilotSerialNumber,
                           Optional<String> pilotName,
                           Optional<String> squadron,
                           Optional<CampaignDate> date,
                           Optional<String> time,
                           Optional<String> aircraft,
                           Optional<String> duty,
                           Optional<String> locality,
                           Optional<String> altitude,
                           Optional<String> haReport,
                           Optional<String> narrative,
                           List<String> flightPilots,
                           List<VictoryEvent> victories,
                           boolean victoriesReported,
                           List<LossEvent> losses,
                           boolean lossesReported) {

    public CombatReport {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(folderSerial, "folderSerial");
        Objects.requireNonNull(missionKey, "missionKey");
        flightPilots = List.copyOf(flightPilots);
        victories = List.copyOf(victories);
        losses = List.copyOf(losses);
    }
}
