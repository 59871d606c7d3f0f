package com.wingman.core.resolve;

import com.wingman.core.json.AceEntry;
import com.wingman.core.json.CampaignSummary;
import com.wingman.core.json.LoadedRecord;
import com.wingman.core.json.PersonnelEntry;
import com.wingman.core.model.CombatReport;
import com.wingman.core.model.LogEntry;
import com.wingman.core.model.MissionRecord;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything the loaders produced for one campaign, waiting to be joined. Lists are kept in source
 * path order whatever order the loader workers finished in.
 */
public record LoadedCampaign(Path campaignRoot,
                             Optional<LoadedRecord<CampaignSummary>> summary,
                             Optional<LoadedRecord<List<AceEntry>>> aces,
                             Optional<LoadedRecord<List<LogEntry>>> eventLog,
                             List<LoadedRecord<CombatReport>> combatReports,
                             List<LoadedRecord<MissionRecord>> missions,
                             List<LoadedRecord<List<PersonnelEntry>>> personnel) {

    public LoadedCampaign {
        Objects.requireNonNull(campaignRoot, "campaignRoot");
        summary = summary == null ? Optional.empty() : summary;
        aces = aces == null ? Optional.empty() : aces;
        eventLog = eventLog == null ? Optional.empty() : eventLog;
        combatReports = bySource(combatReports);
        missions = bySource(missions);
        personnel = bySource(personnel);
    }

    public String folderName() {
        Path name = campaignRoot.getFileName();
        return name == null ? campaignRoot.toString() : name.toString();
    }

    private static <T> List<LoadedRecord<T>> bySource(List<LoadedRecord<T>> records) {
        List<LoadedRecord<T>> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparing(r -> r.source().toString()));
        return List.copyOf(sorted);
    }
}
