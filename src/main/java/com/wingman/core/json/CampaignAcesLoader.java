package com.wingman.core.json;

import com.wingman.core.error.MalformedRecordException;
import com.wingman.core.model.SerialNumbers;
import com.wingman.core.model.VictoryEvent;
import org.json.JSONArray;
import org.json.JSONObject;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads {@code CampaignAces.json} in any of the layouts seen across generator versions:
 * a plain list, an object holding {@code acesInCampaign} or {@code aces} (list or keyed map),
 * or a bare map of entries keyed by serial number.
 */
public final class CampaignAcesLoader {

    public LoadedRecord<List<AceEntry>> load(Path file) throws MalformedRecordException {
        List<String> notes = new ArrayList<>();
        Object root = TolerantJson.read(file);
        Object container = locateContainer(root, notes);

        Map<String, AceEntry> bySerial = new LinkedHashMap<>();
        List<TolerantJson.KeyedObject> entries = TolerantJson.objectsOf(container);
        for (int i = 0; i < entries.size(); i++) {
            TolerantJson.KeyedObject keyed = entries.get(i);
            String context = keyed.key().map(k -> "ace '" + k + "'").orElse("ace[" + i + "]");
            TolerantJson json = TolerantJson.wrap(keyed.value(), context, notes);
            Optional<AceEntry> entry = toEntry(json, keyed.key());
            if (entry.isEmpty()) {
                continue;
            }
            AceEntry ace = entry.get();
            if (bySerial.putIfAbsent(ace.serialNumber(), ace) != null) {
                json.note("duplicate entry for serial " + ace.serialNumber() + " ignored");
            }
        }
        return LoadedRecord.of(List.copyOf(bySerial.values()), file, notes);
    }

    private static Object locateContainer(Object root, List<String> notes) {
        if (root instanceof JSONArray) {
            return root;
        }
        JSONObject obj = (JSONObject) root;
        for (String key : List.of("acesInCampaign", "aces")) {
            Object nested = obj.opt(key);
            if (nested instanceof JSONObject || nested instanceof JSONArray) {
                return nested;
            }
        }
        boolean allObjects = !obj.isEmpty() && obj.keySet().stream().allMatch(k -> obj.opt(k) instanceof JSONObject);
        if (allObjects) {
            return obj;
        }
        notes.add("no list of aces found");
        return new JSONArray();
    }

    private static Optional<AceEntry> toEntry(TolerantJson json, Optional<String> mapKey) {
        Optional<String> serial = json.identifier("serialNumber", "pilotSerialNumber");
        if (serial.isEmpty()) {
            serial = mapKey.filter(SerialNumbers::isNumeric);
        }
        if (serial.isEmpty()) {
            json.note("entry without serial number skipped");
            return Optional.empty();
        }
        Optional<String> name = json.text("name", "pilotName");
        json.requirePresent("name", name);

        Optional<List<VictoryEvent>> victoryEvents = EventListReader.victories(json, "victories", "victoryCount");
        Optional<Integer> victories = victoryEvents.map(List::size);
        Map<String, Integer> byCategory = victoryEvents.map(VictoryCategories::group).orElse(Map.of());

        return Optional.of(new AceEntry(
            serial.get(),
            name,
            json.text("rank", "pilotRank"),
            json.identifier("squadronId"),
            json.text("squadronName", "squadron"),
            json.text("country"),
            json.integer("missionFlown", "missionsFlown", "missions"),
            victories,
            byCategory
        ));
    }
}
