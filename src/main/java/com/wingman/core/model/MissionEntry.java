package com.wingman.core.model;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One flown mission after the join: the mission data record when one exists, the combat reports
 * attached to it, and the weather when a {@code .mission} file could be matched.
 */
public record MissionEntry(String missionKey,
                           Optional<CampaignDate> date,
                           Optional<String> time,
                           Optional<MissionRecord> record,
                           List<CombatReport> reports,
                           List<String> squadmates,
                           Optional<WeatherSnapshot> weather) {

    public static final Comparator<MissionEntry> CHRONOLOGICAL = Comparator
        .comparing((MissionEntry m) -> m.date().orElse(null), Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(m -> m.time().orElse(""))
        .thenComparing(MissionEntry::missionKey);

    public MissionEntry {
        Objects.requireNonNull(missionKey, "missionKey");
        reports = List.copyOf(reports);
        squadmates = List.copyOf(squadmates);
    }

    public MissionEntry withWeather(Optional<WeatherSnapshot> snapshot) {
        return new MissionEntry(missionKey, date, time, record, reports, squadmates, snapshot);
    }
}
