package com.wingman.report;

import com.wingman.CampaignFixture;
import com.wingman.core.annotation.JsonFileAnnotationStore;
import com.wingman.core.model.UnifiedCampaignModel;
import com.wingman.core.sync.CampaignSyncService;
import com.wingman.core.sync.SyncRequest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CampaignDiaryExporterTest {

    @TempDir
    Path tempDir;

    @Test
    void diaryHasOneEntryPerMissionInOrder() throws Exception {
        UnifiedCampaignModel model = syncFixture(tempDir);
        Path target = tempDir.resolve("diary").resolve("diary.txt");

        new CampaignDiaryExporter().export(model, target);
        String diary = Files.readString(target, StandardCharsets.UTF_8);

        assertTrue(diary.contains("CAMPAIGN DIARY: Jasta Spring"), diary);
        assertTrue(diary.contains("Pilot: Ltn Hans Weber (2000001)"), diary);
        assertTrue(diary.contains("Period: 1917-04-14 to 1917-04-15"), diary);
        int first = diary.indexOf("1917-04-14, 10:30:00");
        int second = diary.indexOf("1917-04-15, 08:00:00");
        assertTrue(first > 0 && second > first, "Entries follow mission order");
        assertTrue(diary.contains("Weather: 8 degrees, cloud base at 1500 m."), diary);
        assertTrue(diary.contains("Flying with me: Kurt Wolff."), "The diarist is not listed as a companion");
        assertTrue(diary.contains("Confirmed 1 victory."));
    }

    @Test
    void renderingIsDeterministic() throws Exception {
        UnifiedCampaignModel model = syncFixture(tempDir);
        CampaignDiaryExporter exporter = new CampaignDiaryExporter();

        assertEquals(exporter.render(model), exporter.render(model));
    }

    static UnifiedCampaignModel syncFixture(Path dir) throws Exception {
        Path root = CampaignFixture.writeCampaign(dir);
        Path missions = CampaignFixture.writeMissionFolder(dir);
        try (CampaignSyncService service = new CampaignSyncService(2)) {
            return service.runSync(new SyncRequest(root, Optional.of(missions),
                new JsonFileAnnotationStore(dir.resolve("annotations.json")))).model();
        }
    }
}
