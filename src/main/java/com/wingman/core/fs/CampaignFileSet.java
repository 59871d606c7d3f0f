package com.wingman.core.fs;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Paths found below one campaign root. Nothing here has been opened yet.
 */
public record CampaignFileSet(Path campaignRoot,
                              Optional<Path> campaignSummary,
                              Optional<Path> aces,
                              Optional<Path> eventLog,
                              Optional<Path> combatReportsFolder,
                              List<CombatReportFolder> combatReportFolders,
                              Optional<Path> missionDataFolder,
                              List<Path> missionDataFiles,
                              List<Path> personnelFiles) {

    public CampaignFileSet {
        combatReportFolders = List.copyOf(combatReportFolders);
        missionDataFiles = List.copyOf(missionDataFiles);
        personnelFiles = List.copyOf(personnelFiles);
    }

    public int fileCount() {
        int count = 0;
        if (campaignSummary.isPresent()) count++;
        if (aces.isPresent()) count++;
        if (eventLog.isPresent()) count++;
        for (CombatReportFolder folder : combatReportFolders) {
            count += folder.reports().size();
        }
        return count + missionDataFiles.size() + personnelFiles.size();
    }

    public Optional<CombatReportFolder> combatReportsFor(String serialNumber) {
        return combatReportFolders.stream()
            .filter(folder -> folder.serialNumber().equals(serialNumber))
            .findFirst();
    }

    /**
     * @return categories that were not found; the personnel catalog is optional and never listed
     */
    public List<FileCategory> absentCategories() {
        List<FileCategory> absent = new ArrayList<>();
        if (campaignSummary.isEmpty()) absent.add(FileCategory.CAMPAIGN_SUMMARY);
        if (aces.isEmpty()) absent.add(FileCategory.ACES);
        if (eventLog.isEmpty()) absent.add(FileCategory.EVENT_LOG);
        if (combatReportsFolder.isEmpty()) absent.add(FileCategory.COMBAT_REPORTS);
        if (missionDataFolder.isEmpty()) absent.add(FileCategory.MISSION_DATA);
        return absent;
    }
}
