package com.wingman.core.model;

import org.json.JSONStringer;
import org.json.JSONWriter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical JSON rendering of a {@link UnifiedCampaignModel}. Keys are emitted in a fixed order and
 * absent values are left out, so equal models always render to identical text. Source files appear
 * by file name only.
 */
public final class CampaignModelJsonWriter {

    public String toJson(UnifiedCampaignModel model) {
        JSONStringer json = new JSONStringer();
        json.object();
        json.key("campaign");
        campaign(json, model.campaign());
        json.key("pilots").array();
        model.pilots().forEach(pilot -> pilot(json, pilot));
        json.endArray();
        json.key("squadrons").array();
        model.squadrons().forEach(squadron -> squadron(json, squadron));
        json.endArray();
        json.key("aces").array();
        for (Ace ace : model.aces()) {
            json.object()
                .key("position").value(ace.position())
                .key("serialNumber").value(ace.serialNumber())
                .key("name").value(ace.name())
                .key("victories").value(ace.victories())
                .endObject();
        }
        json.endArray();
        json.key("missions").array();
        model.missions().forEach(mission -> mission(json, mission));
        json.endArray();
        json.key("campaignLog").array();
        model.campaignLog().forEach(entry -> logEntry(json, entry));
        json.endArray();
        json.key("achievements").array();
        model.achievements().forEach(achievement -> json.value(achievement.name()));
        json.endArray();
        json.endObject();
        return json.toString();
    }

    public void write(UnifiedCampaignModel model, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(
            target,
            toJson(model),
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE
        );
    }

    private static void campaign(JSONWriter json, Campaign campaign) {
        json.object();
        json.key("name").value(campaign.name());
        optional(json, "date", campaign.currentDate().map(CampaignDate::display));
        optional(json, "referencePilotSerial", campaign.referencePilotSerial());
        optional(json, "product", campaign.product());
        json.endObject();
    }

    private static void pilot(JSONWriter json, Pilot pilot) {
        json.object();
        json.key("serialNumber").value(pilot.serialNumber());
        json.key("name").value(pilot.name());
        optional(json, "rank", pilot.rank());
        optional(json, "squadronId", pilot.squadronId());
        optional(json, "squadronName", pilot.squadronName());
        optional(json, "status", pilot.status().map(Enum::name));
        json.key("referencePilot").value(pilot.referencePilot());

        PilotStatistics stats = pilot.statistics();
        json.key("statistics").object();
        json.key("sorties").value(stats.sorties());
        json.key("victories").value(stats.victories());
        json.key("victoriesByCategory").object();
        stats.victoriesByCategory().forEach((category, count) -> json.key(category).value(count));
        json.endObject();
        json.key("losses").value(stats.losses());
        json.key("victoryRatio").value(stats.victoryRatio());
        stats.missionsFlownReported().ifPresent(count -> json.key("missionsFlownReported").value(count));
        json.key("partial").value(stats.partial());
        career(json, stats.career());
        json.endObject();

        pilot.annotation().ifPresent(annotation -> {
            json.key("annotation").object();
            optional(json, "birthDate", annotation.birthDate());
            optional(json, "birthPlace", annotation.birthPlace());
            optional(json, "notes", annotation.notes());
            optional(json, "photoReference", annotation.photoReference());
            json.endObject();
        });
        pilot.ageAtLastMission().ifPresent(age -> json.key("ageAtLastMission").value(age));
        json.endObject();
    }

    private static void career(JSONWriter json, CareerBreakdown career) {
        json.key("career").object();
        strings(json, "aircraftTypes", career.aircraftTypes());
        json.key("sortiesByDuty").object();
        career.sortiesByDuty().forEach((duty, count) -> json.key(duty).value(count));
        json.endObject();
        strings(json, "localities", career.localities());
        career.averageAltitudeMeters().ifPresent(altitude -> json.key("averageAltitudeMeters").value(altitude));
        json.endObject();
    }

    private static void squadron(JSONWriter json, Squadron squadron) {
        json.object();
        json.key("id").value(squadron.id());
        optional(json, "name", squadron.name());
        strings(json, "roster", squadron.rosterSerials());
        json.key("totalMissions").value(squadron.totals().missions());
        json.key("totalVictories").value(squadron.totals().victories());
        json.key("recentActivity").array();
        squadron.recentActivity().forEach(entry -> logEntry(json, entry));
        json.endArray();
        json.endObject();
    }

    private static void mission(JSONWriter json, MissionEntry mission) {
        json.object();
        json.key("missionKey").value(mission.missionKey());
        optional(json, "date", mission.date().map(CampaignDate::display));
        optional(json, "time", mission.time());
        mission.record().ifPresent(record -> {
            json.key("record").object();
            json.key("missionId").value(record.missionId());
            json.key("source").value(fileName(record.source()));
            optional(json, "squadronId", record.squadronId());
            optional(json, "squadronName", record.squadronName());
            optional(json, "aircraft", record.aircraft());
            optional(json, "duty", record.duty());
            optional(json, "airfield", record.airfield());
            record.altitudeMeters().ifPresent(altitude -> json.key("altitudeMeters").value(altitude));
            optional(json, "description", record.description());
            optional(json, "missionFileName", record.missionFileName());
            json.key("participants").array();
            for (MissionParticipant participant : record.participants()) {
                json.object();
                json.key("name").value(participant.name());
                optional(json, "serialNumber", participant.serialNumber());
                optional(json, "rank", participant.rank());
                optional(json, "squadronId", participant.squadronId());
                json.endObject();
            }
            json.endArray();
            json.endObject();
        });
        json.key("reports").array();
        mission.reports().forEach(report -> report(json, report));
        json.endArray();
        strings(json, "squadmates", mission.squadmates());
        mission.weather().ifPresent(weather -> {
            json.key("weather").object();
            weather.source().ifPresent(source -> json.key("source").value(fileName(source)));
            json.key("values").object();
            for (Map.Entry<WeatherKey, String> entry : weather.values().entrySet()) {
                json.key(entry.getKey().fileKey()).value(entry.getValue());
            }
            json.endObject();
            json.key("windLayers").array();
            for (WindLayer layer : weather.windLayers()) {
                json.object()
                    .key("altitude").value(layer.altitude())
                    .key("direction").value(layer.direction())
                    .key("speed").value(layer.speed())
                    .endObject();
            }
            json.endArray();
            json.endObject();
        });
        json.endObject();
    }

    private static void report(JSONWriter json, CombatReport report) {
        json.object();
        json.key("source").value(fileName(report.source()));
        json.key("folderSerial").value(report.folderSerial());
        json.key("missionKey").value(report.missionKey());
        optional(json, "pilotSerialNumber", report.pilotSerialNumber());
        optional(json, "pilotName", report.pilotName());
        optional(json, "squadron", report.squadron());
        optional(json, "date", report.date().map(CampaignDate::display));
        optional(json, "time", report.time());
        optional(json, "aircraft", report.aircraft());
        optional(json, "duty", report.duty());
        optional(json, "locality", report.locality());
        optional(json, "altitude", report.altitude());
        optional(json, "haReport", report.haReport());
        optional(json, "narrative", report.narrative());
        strings(json, "flightPilots", report.flightPilots());
        json.key("victories").array();
        for (VictoryEvent victory : report.victories()) {
            json.object();
            optional(json, "date", victory.date().map(CampaignDate::display));
            optional(json, "category", victory.category());
            optional(json, "description", victory.description());
            json.endObject();
        }
        json.endArray();
        json.key("losses").array();
        for (LossEvent loss : report.losses()) {
            json.object();
            optional(json, "date", loss.date().map(CampaignDate::display));
            optional(json, "description", loss.description());
            json.endObject();
        }
        json.endArray();
        json.endObject();
    }

    private static void logEntry(JSONWriter json, LogEntry entry) {
        json.object();
        json.key("date").value(entry.date().display());
        json.key("text").value(entry.text());
        optional(json, "squadronId", entry.squadronId());
        json.endObject();
    }

    private static void strings(JSONWriter json, String key, List<String> values) {
        json.key(key).array();
        values.forEach(json::value);
        json.endArray();
    }

    private static void optional(JSONWriter json, String key, Optional<String> value) {
        value.ifPresent(v -> json.key(key).value(v));
    }

    private static String fileName(Path path) {
        Path name = path.getFileName();
        return name == null ? path.toString() : name.toString();
    }
}
