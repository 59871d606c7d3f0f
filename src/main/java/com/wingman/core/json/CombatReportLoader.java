package com.wingman.core.json;

import com.wingman.core.error.MalformedRecordException;
import com.wingman.core.model.CampaignDate;
import com.wingman.core.model.CombatReport;
import com.wingman.core.model.LossEvent;
import com.wingman.core.model.VictoryEvent;
import org.json.JSONArray;
import org.json.JSONObject;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Reads one {@code CombatReports/<serial>/*.json} file.
 */
public final class CombatReportLoader {

    public LoadedRecord<CombatReport> load(Path file, String folderSerial) throws MalformedRecordException {
        List<String> notes = new ArrayList<>();
        JSONObject root = TolerantJson.rootObject(TolerantJson.read(file), notes);
        TolerantJson json = TolerantJson.wrap(root, "", notes);

        Optional<String> serial = json.identifier("pilotSerialNumber", "serialNumber");
        Optional<String> pilotName = json.text("reportPilotName", "pilotName");
        Optional<String> rawDate = json.text("date");
        Optional<String> time = json.text("time");
        json.requirePresent("date", rawDate);
        json.requirePresent("pilotSerialNumber", serial);

        Optional<CampaignDate> date = CampaignDate.parseOptional(rawDate);
        Optional<List<VictoryEvent>> victories = EventListReader.victories(json, "victories", "claims");
        Optional<List<LossEvent>> losses = EventListReader.losses(json, "losses");

        CombatReport report = new CombatReport(
            file,
            folderSerial,
            missionKey(date, time, file),
            serial,
            pilotName,
            json.text("squadron", "squadronName"),
            date,
            time,
            json.text("type", "aircraftType"),
            json.text("duty"),
            json.text("locality"),
            json.text("altitude"),
            json.text("haReport"),
            json.text("narrative"),
            flightPilots(json),
            victories.orElse(List.of()),
            victories.isPresent(),
            losses.orElse(List.of()),
            losses.isPresent()
        );
        return LoadedRecord.of(report, file, notes);
    }

    /**
     * {@code <date>_<time digits>} when both are known, the file stem otherwise.
     */
    static String missionKey(Optional<CampaignDate> date, Optional<String> time, Path file) {
        if (date.isPresent() && time.isPresent()) {
            String digits = time.get().replaceAll("[^0-9]", "");
            if (!digits.isEmpty()) {
                return date.get().raw() + "_" + digits;
            }
        }
        return fileStem(file);
    }

    static String fileStem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static List<String> flightPilots(TolerantJson json) {
        Optional<JSONArray> raw = json.array("flightPilots");
        if (raw.isEmpty()) {
            return List.of();
        }
        List<String> names = new ArrayList<>();
        JSONArray array = raw.get();
        for (int i = 0; i < array.length(); i++) {
            Object item = array.opt(i);
            if (item instanceof String s && !s.isBlank()) {
                names.add(s.trim());
            } else if (item instanceof JSONObject obj) {
                json.child(obj, "flightPilots[" + i + "]").text("name", "pilotName").ifPresent(names::add);
            }
        }
        return List.copyOf(new LinkedHashSet<>(names));
    }
}
