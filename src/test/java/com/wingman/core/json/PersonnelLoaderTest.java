package com.wingman.core.json;

import com.wingman.core.model.PilotStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PersonnelLoaderTest {

    @TempDir
    Path tempDir;

    private final PersonnelLoader loader = new PersonnelLoader();

    @Test
    void statusBucketsAssignStatusAndFileStemIsTheSquadron() throws Exception {
        Path file = Files.writeString(tempDir.resolve("401011.json"), """
            {"active":[{"serialNumber":1,"name":"A"}],
             "kia":[{"serialNumber":2,"name":"B","victories":3}],
             "wounded":[{"serialNumber":3,"name":"C","status":"Hospital"}]}
            """);

        List<PersonnelEntry> entries = loader.load(file).record();

        assertEquals(3, entries.size());
        assertEquals("401011", entries.get(0).squadronId());
        assertEquals(Optional.of(PilotStatus.ACTIVE), find(entries, "1").status());
        assertEquals(Optional.of(PilotStatus.KILLED_IN_ACTION), find(entries, "2").status());
        assertEquals(Optional.of(3), find(entries, "2").victories());
        assertEquals(Optional.of(PilotStatus.HOSPITALIZED), find(entries, "3").status(),
            "An explicit status beats the bucket");
    }

    @Test
    void numericStatusCodesAndKeyedMembers() throws Exception {
        Path file = Files.writeString(tempDir.resolve("20111.json"), """
            {"squadronMemberCollection":{"5001":{"pilotName":"D","pilotActiveStatus":4,"missionsFlown":9}}}
            """);

        PersonnelEntry entry = loader.load(file).record().get(0);

        assertEquals("5001", entry.serialNumber(), "The numeric map key stands in for the serial");
        assertEquals(Optional.of(PilotStatus.MISSING_IN_ACTION), entry.status());
        assertEquals(Optional.of(9), entry.missionsFlown());
    }

    @Test
    void unknownShapeYieldsEmptyPartialRoster() throws Exception {
        Path file = Files.writeString(tempDir.resolve("1.json"), "{\"version\":3}");

        LoadedRecord<List<PersonnelEntry>> loaded = loader.load(file);

        assertTrue(loaded.record().isEmpty());
        assertTrue(loaded.partial());
    }

    private static PersonnelEntry find(List<PersonnelEntry> entries, String serial) {
        return entries.stream().filter(e -> e.serialNumber().equals(serial)).findFirst().orElseThrow();
    }
}
