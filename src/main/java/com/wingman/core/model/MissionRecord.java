package com.wingman.core.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Structured mission detail from {@code MissionData/*.json}.
 *
 * @param missionId header {@code missionFileName} stem when present, else the file stem
 */
public record MissionRecord(String missionId,
                            Path source,
                            Optional<CampaignDate> date,
                            Optional<String> time,
                            Optional<String> squadronId,
                            Optional<String> squadronName,
                            Optional<String> aircraft,
                            Optional<String> duty,
                            Optional<String> airfield,
                            Optional<Integer> altitudeMeters,
                            Optional<String> description,
                            Optional<String> missionFileName,
                            List<MissionParticipant> participants) {

    public MissionRecord {
        Objects.requireNonNull(missionId, "missionId");
        Objects.requireNonNull(source, "source");
        participants = List.copyOf(participants);
    }
}
