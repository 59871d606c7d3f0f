package com.wingman.core.mission;

import com.wingman.core.model.CampaignDate;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * What is known about a flown mission when looking for its {@code .mission} file.
 *
 * @param missionFileName file name named by the mission data header, if any
 */
public record MissionMatchQuery(Optional<String> missionId,
                                Optional<CampaignDate> date,
                                Optional<String> pilotName,
                                Optional<String> missionFileName) {

    public MissionMatchQuery {
        missionId = missionId == null ? Optional.empty() : missionId;
        date = date == null ? Optional.empty() : date;
        pilotName = pilotName == null ? Optional.empty() : pilotName;
        missionFileName = missionFileName == null ? Optional.empty() : missionFileName;
    }

    /**
     * Stem the generator would have written: {@code <pilotName>_<date>}, or the named mission file.
     */
    public Optional<String> expectedStem() {
        if (missionFileName.isPresent()) {
            return missionFileName.map(MissionMatchQuery::stripExtension);
        }
        if (pilotName.isPresent() && date.isPresent()) {
            return Optional.of(pilotName.get() + "_" + date.get().display());
        }
        return missionId.or(() -> pilotName);
    }

    /**
     * Date spellings a file name may carry: the raw text, ISO and compact forms.
     */
    List<String> dateTokens() {
        List<String> tokens = new ArrayList<>();
        date.ifPresent(d -> {
            tokens.add(d.raw());
            d.date().ifPresent(parsed -> {
                tokens.add(parsed.toString());
                tokens.add(parsed.toString().replace("-", ""));
            });
        });
        return tokens;
    }

    static String stripExtension(String name) {
        String normalized = name.replace('\\', '/');
        String base = normalized.substring(normalized.lastIndexOf('/') + 1);
        int dot = base.lastIndexOf('.');
        return dot > 0 ? base.substring(0, dot) : base;
    }
}
