package com.wingman.core.mission;

import com.wingman.CampaignFixture;
import com.wingman.core.error.DiagnosticCollector;
import com.wingman.core.error.DiagnosticKind;
import com.wingman.core.model.CampaignDate;
import com.wingman.core.model.WeatherKey;
import com.wingman.core.model.WeatherSnapshot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MissionWeatherLookupTest {

    @TempDir
    Path tempDir;

    @Test
    void findsAndCachesTheMatchingMissionFile() throws Exception {
        Path folder = CampaignFixture.writeMissionFolder(tempDir);
        Files.writeString(folder.resolve("readme.txt"), "not a mission");
        DiagnosticCollector diagnostics = new DiagnosticCollector();
        MissionWeatherLookup lookup = new MissionWeatherLookup(new MissionFileIndex(folder), diagnostics);
        MissionMatchQuery query = new MissionMatchQuery(Optional.empty(), Optional.of(CampaignDate.parse("19170414")),
            Optional.of("Hans Weber"), Optional.empty());

        WeatherSnapshot first = lookup.find(query).orElseThrow();

        assertEquals(Optional.of("1500"), first.get(WeatherKey.CLOUD_LEVEL));
        assertEquals(2, first.windLayers().size());
        assertSame(first, lookup.find(query).orElseThrow(), "Parsed files are reused");
        assertEquals(0, diagnostics.size());
    }

    @Test
    void missingFileIsADiagnosticNotAFailure() {
        DiagnosticCollector diagnostics = new DiagnosticCollector();
        Path folder = tempDir.resolve("absent");
        MissionWeatherLookup lookup = new MissionWeatherLookup(new MissionFileIndex(folder), diagnostics);

        Optional<WeatherSnapshot> result = lookup.find(new MissionMatchQuery(Optional.of("m1"), Optional.empty(),
            Optional.empty(), Optional.empty()));

        assertTrue(result.isEmpty());
        assertEquals(1, diagnostics.size());
        assertEquals(DiagnosticKind.MISSION_FILE_NOT_FOUND, diagnostics.snapshot().get(0).kind());
        assertEquals(Optional.of(folder), diagnostics.snapshot().get(0).path());
    }
}
