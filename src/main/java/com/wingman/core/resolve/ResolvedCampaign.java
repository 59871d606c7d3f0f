package com.wingman.core.resolve;

import com.wingman.core.model.Campaign;
import com.wingman.core.model.LogEntry;
import com.wingman.core.model.MissionEntry;
import com.wingman.core.model.Squadron;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Output of the join, before statistics.
 *
 * @param pilots      in serial order
 * @param squadrons   in id order
 * @param missions    chronological
 * @param campaignLog entries without a squadron, chronological
 */
public record ResolvedCampaign(Campaign campaign,
                               List<ResolvedPilot> pilots,
                               List<Squadron> squadrons,
                               List<MissionEntry> missions,
                               List<LogEntry> campaignLog) {

    public ResolvedCampaign {
        Objects.requireNonNull(campaign, "campaign");
        pilots = List.copyOf(pilots);
        squadrons = List.copyOf(squadrons);
        missions = List.copyOf(missions);
        campaignLog = List.copyOf(campaignLog);
    }

    public Optional<ResolvedPilot> referencePilot() {
        return pilots.stream().filter(ResolvedPilot::referencePilot).findFirst();
    }
}
