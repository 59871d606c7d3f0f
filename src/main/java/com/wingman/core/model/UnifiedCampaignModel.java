package com.wingman.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The only object handed to presentation and export collaborators. Fully immutable.
 *
 * @param pilots       every resolved pilot, in serial order
 * @param squadrons    resolved squadrons, in id order
 * @param aces         leaderboard, victories descending then serial ascending
 * @param missions     mission history, chronological
 * @param campaignLog  log entries not tied to a squadron, chronological
 * @param achievements unlocked achievements of the reference pilot
 */
public record UnifiedCampaignModel(Campaign campaign,
                                   List<Pilot> pilots,
                                   List<Squadron> squadrons,
                                   List<Ace> aces,
                                   List<MissionEntry> missions,
                                   List<LogEntry> campaignLog,
                                   List<Achievement> achievements) {

    public UnifiedCampaignModel {
        Objects.requireNonNull(campaign, "campaign");
        pilots = List.copyOf(pilots);
        squadrons = List.copyOf(squadrons);
        aces = List.copyOf(aces);
        missions = List.copyOf(missions);
        campaignLog = List.copyOf(campaignLog);
        achievements = List.copyOf(achievements);
    }

    public Optional<Pilot> referencePilot() {
        return pilots.stream().filter(Pilot::referencePilot).findFirst();
    }

    public Optional<Pilot> findPilot(String serialNumber) {
        return pilots.stream().filter(p -> p.serialNumber().equals(serialNumber)).findFirst();
    }

    public Optional<Squadron> findSquadron(String squadronId) {
        return squadrons.stream().filter(s -> s.id().equals(squadronId)).findFirst();
    }
}
