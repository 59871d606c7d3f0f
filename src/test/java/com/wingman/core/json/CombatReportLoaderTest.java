package com.wingman.core.json;

import com.wingman.core.model.CombatReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CombatReportLoaderTest {

    @TempDir
    Path tempDir;

    private final CombatReportLoader loader = new CombatReportLoader();

    @Test
    void readsReportFieldsAndBuildsMissionKey() throws Exception {
        Path file = Files.writeString(tempDir.resolve("r1.json"), """
            {"pilotSerialNumber":2000001,"reportPilotName":"Hans Weber","date":"19170414","time":"10:30:00",
             "squadron":"Jasta 11","type":"Albatros D.III","duty":"PATROL","altitude":"2000 m",
             "flightPilots":["Kurt Wolff",{"name":"Karl Allmenroder"}],
             "victories":[{"category":"Fighter"}],"losses":2}
            """);

        LoadedRecord<CombatReport> loaded = loader.load(file, "2000001");
        CombatReport report = loaded.record();

        assertFalse(loaded.partial(), String.valueOf(loaded.notes()));
        assertEquals("19170414_103000", report.missionKey());
        assertEquals(Optional.of("2000001"), report.pilotSerialNumber());
        assertEquals(Optional.of(LocalDate.of(1917, 4, 14)), report.date().flatMap(d -> d.date()));
        assertEquals(Optional.of("Albatros D.III"), report.aircraft());
        assertEquals(List.of("Kurt Wolff", "Karl Allmenroder"), report.flightPilots());
        assertEquals(1, report.victories().size());
        assertTrue(report.victoriesReported());
        assertEquals(2, report.losses().size(), "A plain loss count expands to unspecified events");
    }

    @Test
    void missingTimeFallsBackToFileStemAndMarksPartial() throws Exception {
        Path file = Files.writeString(tempDir.resolve("Report_7.json"), """
            {"reportPilotName":"Hans Weber","date":"19170414"}
            """);

        LoadedRecord<CombatReport> loaded = loader.load(file, "2000001");

        assertEquals("Report_7", loaded.record().missionKey());
        assertTrue(loaded.partial(), "Missing pilot serial should be noted");
        assertFalse(loaded.record().victoriesReported());
        assertFalse(loaded.record().lossesReported());
    }

    @Test
    void countsOutsideTheIntRangeAreRejectedNotTruncated() throws Exception {
        Path file = Files.writeString(tempDir.resolve("r2.json"), """
            {"pilotSerialNumber":2000001,"date":"19170414","time":"10:30:00",
             "victories":3.0,"losses":4294967298}
            """);

        LoadedRecord<CombatReport> loaded = loader.load(file, "2000001");

        assertEquals(3, loaded.record().victories().size(), "An integral double is still a count");
        assertFalse(loaded.record().lossesReported());
        assertTrue(loaded.record().losses().isEmpty());
        assertTrue(loaded.partial());
        assertTrue(loaded.notes().stream().anyMatch(note -> note.contains("losses")), String.valueOf(loaded.notes()));
    }
}
