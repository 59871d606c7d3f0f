package com.wingman.core.stats;

import com.wingman.core.model.Ace;
import com.wingman.core.model.Achievement;
import com.wingman.core.model.PilotStatistics;
import com.wingman.core.model.SerialNumbers;
import com.wingman.core.model.SquadronTotals;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregator output: per-pilot numbers keyed by serial, per-squadron totals keyed by squadron id,
 * the ace leaderboard and the reference pilot's unlocked achievements.
 */
public record CampaignStatistics(Map<String, PilotStatistics> bySerial,
                                 Map<String, SquadronTotals> bySquadron,
                                 List<Ace> aces,
                                 List<Achievement> achievements) {

    public CampaignStatistics {
        Map<String, PilotStatistics> sorted = new TreeMap<>(SerialNumbers.ORDER);
        sorted.putAll(bySerial);
        bySerial = Collections.unmodifiableMap(sorted);
        Map<String, SquadronTotals> squadrons = new TreeMap<>(SerialNumbers.ORDER);
        squadrons.putAll(bySquadron);
        bySquadron = Collections.unmodifiableMap(squadrons);
        aces = List.copyOf(aces);
        achievements = List.copyOf(achievements);
    }

    public CampaignStatistics(Map<String, PilotStatistics> bySerial, List<Ace> aces, List<Achievement> achievements) {
        this(bySerial, Map.of(), aces, achievements);
    }

    public PilotStatistics forPilot(String serialNumber) {
        return bySerial.getOrDefault(serialNumber, PilotStatistics.empty());
    }

    public SquadronTotals forSquadron(String squadronId) {
        return bySquadron.getOrDefault(squadronId, SquadronTotals.NONE);
    }
}
