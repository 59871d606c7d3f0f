package com.wingman.core.json;

import com.wingman.core.model.LogEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CampaignLogLoaderTest {

    @TempDir
    Path tempDir;

    private final CampaignLogLoader loader = new CampaignLogLoader();

    @Test
    void groupedLayoutInheritsTheGroupDate() throws Exception {
        Path file = Files.writeString(tempDir.resolve("CampaignLog.json"), """
            {"campaignLogsByDate":{
              "19170402":{"logs":[{"log":"Second day","squadronId":401011}]},
              "19170401":{"date":"19170401","logs":[{"log":"First day"}]}
            }}
            """);

        LoadedRecord<List<LogEntry>> loaded = loader.load(file);

        assertFalse(loaded.partial(), String.valueOf(loaded.notes()));
        assertEquals(2, loaded.record().size());
        LogEntry first = loaded.record().get(0);
        assertEquals("19170401", first.date().raw(), "Groups are read in key order");
        assertEquals("First day", first.text());
        assertEquals(Optional.empty(), first.squadronId());
        assertEquals(Optional.of("401011"), loaded.record().get(1).squadronId());
    }

    @Test
    void flatListKeepsFileOrder() throws Exception {
        Path file = Files.writeString(tempDir.resolve("CampaignLog.json"), """
            [{"date":"19170405","text":"Later"},{"date":"19170401","message":"Earlier"}]
            """);

        List<LogEntry> entries = loader.load(file).record();

        assertEquals(List.of("Later", "Earlier"), entries.stream().map(LogEntry::text).toList());
    }

    @Test
    void entriesWithoutTextAreDropped() throws Exception {
        Path file = Files.writeString(tempDir.resolve("CampaignLog.json"), """
            {"logs":[{"date":"19170401"},{"date":"19170401","log":"Kept"}]}
            """);

        LoadedRecord<List<LogEntry>> loaded = loader.load(file);

        assertTrue(loaded.partial());
        assertEquals(1, loaded.record().size());
    }
}
