package com.wingman.core.model;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CampaignModelJsonWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void writesAbsentValuesAsMissingKeysAndSourcesAsFileNames() throws Exception {
        MissionRecord record = new MissionRecord("m1", tempDir.resolve("MissionData").resolve("m1.json"),
            Optional.of(CampaignDate.parse("19170414")), Optional.of("10:30:00"), Optional.of("401011"),
            Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(),
            Optional.empty(), List.of());
        MissionEntry mission = new MissionEntry("m1", record.date(), record.time(), Optional.of(record), List.of(),
            List.of("Kurt Wolff"), Optional.empty());
        Pilot pilot = new Pilot("1", "Hans Weber", Optional.empty(), Optional.of("401011"), Optional.empty(),
            Optional.empty(), true, PilotStatistics.empty(), Optional.empty(), Optional.empty());
        UnifiedCampaignModel model = new UnifiedCampaignModel(
            new Campaign("Jasta Spring", Optional.of(CampaignDate.parse("19170415")), Optional.of("1"), Optional.empty()),
            List.of(pilot), List.of(), List.of(new Ace(1, "1", "Hans Weber", 3)), List.of(mission),
            List.of(new LogEntry(CampaignDate.parse("19170414"), "Campaign started", Optional.empty())),
            List.of(Achievement.FIRST_VICTORY));
        Path target = tempDir.resolve("out").resolve("model.json");

        new CampaignModelJsonWriter().write(model, target);
        JSONObject json = new JSONObject(Files.readString(target));

        assertEquals("1917-04-15", json.getJSONObject("campaign").getString("date"));
        assertFalse(json.getJSONObject("campaign").has("product"), "Absent values are left out");
        JSONObject written = json.getJSONArray("pilots").getJSONObject(0);
        assertFalse(written.has("rank"));
        assertTrue(written.getBoolean("referencePilot"));
        JSONObject missionJson = json.getJSONArray("missions").getJSONObject(0);
        assertEquals("m1.json", missionJson.getJSONObject("record").getString("source"));
        assertEquals(new JSONArray(List.of("FIRST_VICTORY")).toString(), json.getJSONArray("achievements").toString());
        assertEquals(Map.of("position", 1, "serialNumber", "1", "name", "Hans Weber", "victories", 3),
            json.getJSONArray("aces").getJSONObject(0).toMap());
    }

    @Test
    void writesCareerBreakdownAndSquadronTotals() {
        CareerBreakdown career = new CareerBreakdown(List.of("Albatros D.III"), Map.of("PATROL", 2),
            List.of("Arras"), Optional.of(1500.5));
        PilotStatistics stats = new PilotStatistics(2, 1, Map.of(), 0, 0.5, Optional.empty(), false, career);
        Pilot pilot = new Pilot("1", "Hans Weber", Optional.empty(), Optional.of("401011"), Optional.empty(),
            Optional.empty(), true, stats, Optional.empty(), Optional.empty());
        Squadron squadron = new Squadron("401011", Optional.of("Jasta 11"), List.of("1"), List.of())
            .withTotals(new SquadronTotals(2, 1));
        UnifiedCampaignModel model = new UnifiedCampaignModel(
            new Campaign("Jasta Spring", Optional.empty(), Optional.empty(), Optional.empty()),
            List.of(pilot), List.of(squadron), List.of(), List.of(), List.of(), List.of());

        JSONObject json = new JSONObject(new CampaignModelJsonWriter().toJson(model));

        JSONObject written = json.getJSONArray("pilots").getJSONObject(0).getJSONObject("statistics").getJSONObject("career");
        assertEquals(List.of("Albatros D.III"), written.getJSONArray("aircraftTypes").toList());
        assertEquals(2, written.getJSONObject("sortiesByDuty").getInt("PATROL"));
        assertEquals(List.of("Arras"), written.getJSONArray("localities").toList());
        assertEquals(1500.5, written.getDouble("averageAltitudeMeters"), 1e-9);
        JSONObject squadronJson = json.getJSONArray("squadrons").getJSONObject(0);
        assertEquals(2, squadronJson.getInt("totalMissions"));
        assertEquals(1, squadronJson.getInt("totalVictories"));
    }
}
