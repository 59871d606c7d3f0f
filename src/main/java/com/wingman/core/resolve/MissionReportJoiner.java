package com.wingman.core.resolve;

import com.wingman.core.model.CampaignDate;
import com.wingman.core.model.CombatReport;
import com.wingman.core.model.MissionRecord;
import com.wingman.core.model.PilotNames;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Finds the mission record a combat report belongs to. Reports and missions share no key, so
 * candidates are the missions flown on the report's date. A single candidate is taken as is;
 * between several, squadron (2 points), aircraft, duty and time (1 point each) decide, and a
 * report that scores nothing anywhere stays unattached. Equal scores go to the smaller mission id.
 */
final class MissionReportJoiner {

    private final List<MissionRecord> missions;

    MissionReportJoiner(List<MissionRecord> missions) {
        List<MissionRecord> sorted = new ArrayList<>(missions);
        sorted.sort((a, b) -> a.missionId().compareTo(b.missionId()));
        this.missions = List.copyOf(sorted);
    }

    Optional<MissionRecord> missionFor(CombatReport report) {
        if (report.date().isEmpty()) {
            return Optional.empty();
        }
        List<MissionRecord> candidates = new ArrayList<>();
        for (MissionRecord mission : missions) {
            if (mission.date().isPresent() && sameDay(mission.date().get(), report.date().get())) {
                candidates.add(mission);
            }
        }
        if (candidates.size() == 1) {
            return Optional.of(candidates.get(0));
        }
        MissionRecord best = null;
        int bestScore = 0;
        for (MissionRecord candidate : candidates) {
            int score = score(report, candidate);
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        return Optional.ofNullable(best);
    }

    static int score(CombatReport report, MissionRecord mission) {
        int score = 0;
        if (report.squadron().isPresent()
            && (matches(report.squadron(), mission.squadronName()) || matches(report.squadron(), mission.squadronId()))) {
            score += 2;
        }
        if (matches(report.aircraft(), mission.aircraft())) {
            score += 1;
        }
        if (matches(report.duty(), mission.duty())) {
            score += 1;
        }
        if (matches(report.time(), mission.time())) {
            score += 1;
        }
        return score;
    }

    private static boolean sameDay(CampaignDate left, CampaignDate right) {
        if (left.isParsed() && right.isParsed()) {
            return left.date().equals(right.date());
        }
        return left.raw().equals(right.raw());
    }

    private static boolean matches(Optional<String> left, Optional<String> right) {
        if (left.isEmpty() || right.isEmpty()) {
            return false;
        }
        String a = PilotNames.normalize(left.get());
        return !a.isEmpty() && Objects.equals(a, PilotNames.normalize(right.get()));
    }
}
