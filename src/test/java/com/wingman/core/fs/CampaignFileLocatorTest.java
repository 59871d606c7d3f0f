package com.wingman.core.fs;

import com.wingman.CampaignFixture;
import com.wingman.core.error.PathInvalidException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CampaignFileLocatorTest {

    @TempDir
    Path tempDir;

    @Test
    void locatesEveryCategoryOfACompleteCampaign() throws Exception {
        Path root = CampaignFixture.writeCampaign(tempDir);

        CampaignFileSet files = new CampaignFileLocator().locate(root);

        assertTrue(files.campaignSummary().isPresent(), "Campaign.json should be found");
        assertTrue(files.aces().isPresent(), "CampaignAces.json should be found");
        assertTrue(files.eventLog().isPresent(), "CampaignLog.json should be found");
        assertEquals(1, files.combatReportFolders().size());
        assertEquals(CampaignFixture.REFERENCE_SERIAL, files.combatReportFolders().get(0).serialNumber());
        assertEquals(2, files.combatReportFolders().get(0).reports().size());
        assertEquals(1, files.missionDataFiles().size());
        assertEquals(1, files.personnelFiles().size());
        assertEquals(List.of(), files.absentCategories());
        assertEquals(7, files.fileCount());
    }

    @Test
    void missingCategoriesAreReportedAsAbsent() throws Exception {
        Path root = tempDir.resolve("sparse");
        Files.createDirectories(root);
        Files.writeString(root.resolve("Campaign.json"), "{}");

        CampaignFileSet files = new CampaignFileLocator().locate(root);

        assertEquals(List.of(FileCategory.ACES, FileCategory.EVENT_LOG, FileCategory.COMBAT_REPORTS,
            FileCategory.MISSION_DATA), files.absentCategories());
        assertTrue(files.combatReportFolders().isEmpty());
        assertTrue(files.combatReportsFor("123").isEmpty());
    }

    @Test
    void matchesEntryNamesCaseInsensitivelyAndSkipsNonJsonFiles() throws Exception {
        Path root = tempDir.resolve("mixed");
        Path reports = root.resolve("combatreports").resolve("42");
        Files.createDirectories(reports);
        Files.writeString(root.resolve("campaignaces.json"), "[]");
        Files.writeString(reports.resolve("a.json"), "{}");
        Files.writeString(reports.resolve("notes.txt"), "ignored");
        Files.writeString(reports.resolve(".hidden.json"), "{}");

        CampaignFileSet files = new CampaignFileLocator().locate(root);

        assertTrue(files.aces().isPresent());
        assertEquals(1, files.combatReportsFor("42").orElseThrow().reports().size(),
            "Only visible .json files count as reports");
    }

    @Test
    void rejectsMissingRootAndPlainFile() throws IOException {
        CampaignFileLocator locator = new CampaignFileLocator();
        assertThrows(PathInvalidException.class, () -> locator.locate(tempDir.resolve("nope")));

        Path file = Files.writeString(tempDir.resolve("file.json"), "{}");
        PathInvalidException ex = assertThrows(PathInvalidException.class, () -> locator.locate(file));
        assertEquals(file, ex.getPath());
    }

    @Test
    void listsCampaignFoldersAlphabetically() throws IOException {
        Path pwcg = tempDir.resolve("PWCGFC");
        Files.createDirectories(CampaignDirectory.campaignRoot(pwcg, "Zeta"));
        Files.createDirectories(CampaignDirectory.campaignRoot(pwcg, "Alpha"));

        assertEquals(List.of("Alpha", "Zeta"), CampaignDirectory.listCampaigns(pwcg));
        assertEquals(List.of(), CampaignDirectory.listCampaigns(tempDir.resolve("missing")));
        assertEquals(tempDir.resolve("data/Missions/PWCG").normalize(), CampaignDirectory.defaultMissionFolder(pwcg));
    }
}
