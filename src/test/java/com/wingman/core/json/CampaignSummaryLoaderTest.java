package com.wingman.core.json;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CampaignSummaryLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void readsNestedCampaignObject() throws Exception {
        Path file = Files.writeString(tempDir.resolve("Campaign.json"), """
            {"campaign":{"name":"Bloody April","date":"19170401","referencePlayerSerialNumber":2000001,
              "squadronId":401011}}
            """);

        LoadedRecord<CampaignSummary> loaded = new CampaignSummaryLoader().load(file);

        assertFalse(loaded.partial(), String.valueOf(loaded.notes()));
        assertEquals(Optional.of("Bloody April"), loaded.record().name());
        assertEquals(Optional.of("2000001"), loaded.record().referencePilotSerial());
        assertEquals(Optional.of("401011"), loaded.record().squadronId());
    }

    @Test
    void missingRequiredFieldsMarkPartial() throws Exception {
        Path file = Files.writeString(tempDir.resolve("Campaign.json"), "{\"name\":\"Only a name\"}");

        LoadedRecord<CampaignSummary> loaded = new CampaignSummaryLoader().load(file);

        assertTrue(loaded.partial());
        assertEquals(2, loaded.notes().size(), String.valueOf(loaded.notes()));
        assertEquals(Optional.empty(), loaded.record().date());
    }
}
