package com.wingman.core.json;

import com.wingman.core.model.MissionParticipant;
import com.wingman.core.model.MissionRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MissionDataLoaderTest {

    @TempDir
    Path tempDir;

    private final MissionDataLoader loader = new MissionDataLoader();

    @Test
    void readsHeaderAndParticipants() throws Exception {
        Path file = Files.writeString(tempDir.resolve("data-1.json"), """
            {"missionHeader":{"date":"19170414","time":"10:30:00","squadronId":401011,"squadron":"Jasta 11",
              "aircraftType":"Albatros D.III","duty":"PATROL","airfield":"Douai","altitude":2500,
              "missionFileName":"C:\\\\Missions\\\\PWCG\\\\Hans Weber_1917-04-14.mission"},
             "missionDescription":"Patrol",
             "missionPlanes":[{"pilotName":"Hans Weber","pilotSerialNumber":2000001,"pilotRank":"Ltn"},
                              {"name":"Kurt Wolff"},{"pilotSerialNumber":3}]}
            """);

        LoadedRecord<MissionRecord> loaded = loader.load(file);
        MissionRecord record = loaded.record();

        assertEquals("Hans Weber_1917-04-14", record.missionId());
        assertEquals(Optional.of("401011"), record.squadronId());
        assertEquals(Optional.of(2500), record.altitudeMeters());
        assertEquals(Optional.of("Douai"), record.airfield());
        assertEquals(Optional.of("Patrol"), record.description());
        assertEquals(List.of("Hans Weber", "Kurt Wolff"),
            record.participants().stream().map(MissionParticipant::name).toList());
        assertEquals(Optional.of("2000001"), record.participants().get(0).serialNumber());
        assertTrue(loaded.partial(), "A plane without pilot name is noted");
    }

    @Test
    void flatHeaderWithoutFileNameUsesTheFileStem() throws Exception {
        Path file = Files.writeString(tempDir.resolve("19170420_1.json"), """
            {"date":"19170420","squadronID":"401011","missionType":"ESCORT"}
            """);

        LoadedRecord<MissionRecord> loaded = loader.load(file);

        assertFalse(loaded.partial(), String.valueOf(loaded.notes()));
        assertEquals("19170420_1", loaded.record().missionId());
        assertEquals(Optional.of("ESCORT"), loaded.record().duty());
        assertTrue(loaded.record().participants().isEmpty());
    }
}
