package com.wingman.core.json;

import com.wingman.core.error.MalformedRecordException;
import com.wingman.core.model.PilotStatus;
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
 * Reads a squadron roster catalog. The squadron id is the file stem; members sit in a plain list,
 * in one of several keyed collections, or in per-status buckets.
 */
public final class PersonnelLoader {
    private static final List<String> COLLECTION_KEYS =
        List.of("pilots", "members", "personnel", "roster", "squadronMemberCollection");
    private static final List<String> STATUS_BUCKETS =
        List.of("active", "reserve", "wounded", "kia", "mia", "transfer", "retired");

    public LoadedRecord<List<PersonnelEntry>> load(Path file) throws MalformedRecordException {
        List<String> notes = new ArrayList<>();
        Object root = TolerantJson.read(file);
        String squadronId = CombatReportLoader.fileStem(file);

        List<Member> members = collectMembers(root, notes);
        Map<String, PersonnelEntry> bySerial = new LinkedHashMap<>();
        for (int i = 0; i < members.size(); i++) {
            TolerantJson.KeyedObject member = members.get(i).json();
            TolerantJson json = TolerantJson.wrap(member.value(),
                member.key().map(k -> "member '" + k + "'").orElse("member[" + i + "]"), notes);
            Optional<String> serial = json.identifier("serialNumber", "pilotSerialNumber")
                .or(() -> member.key().filter(SerialNumbers::isNumeric));
            if (serial.isEmpty()) {
                json.note("member without serial number skipped");
                continue;
            }
            Optional<String> name = json.text("name", "pilotName");
            json.requirePresent("name", name);
            PersonnelEntry entry = new PersonnelEntry(
                squadronId,
                serial.get(),
                name,
                json.text("rank", "pilotRank", "pilotRankText"),
                status(json).or(members.get(i)::bucketStatus),
                json.integer("missionsFlown", "missionFlown", "missions", "missionCount", "sorties", "numMissions"),
                EventListReader.victories(json, "victories", "kills", "victoryCount").map(List<VictoryEvent>::size)
            );
            bySerial.putIfAbsent(entry.serialNumber(), entry);
        }
        return LoadedRecord.of(List.copyOf(bySerial.values()), file, notes);
    }

    private static List<Member> collectMembers(Object root, List<String> notes) {
        List<Member> members = new ArrayList<>();
        if (root instanceof JSONArray) {
            addAll(members, root, Optional.empty());
            return members;
        }
        JSONObject catalog = (JSONObject) root;
        for (String key : COLLECTION_KEYS) {
            Object value = catalog.opt(key);
            if (value instanceof JSONObject || value instanceof JSONArray) {
                addAll(members, value, Optional.empty());
            }
        }
        for (String key : STATUS_BUCKETS) {
            Object value = catalog.opt(key);
            if (value instanceof JSONArray || value instanceof JSONObject) {
                addAll(members, value, PilotStatus.fromText(key));
            }
        }
        if (members.isEmpty()) {
            boolean allObjects = !catalog.isEmpty()
                && catalog.keySet().stream().allMatch(k -> catalog.opt(k) instanceof JSONObject);
            if (allObjects) {
                addAll(members, catalog, Optional.empty());
            } else {
                notes.add("no roster members found");
            }
        }
        return members;
    }

    private static void addAll(List<Member> members, Object container, Optional<PilotStatus> bucketStatus) {
        for (TolerantJson.KeyedObject json : TolerantJson.objectsOf(container)) {
            members.add(new Member(json, bucketStatus));
        }
    }

    private static Optional<PilotStatus> status(TolerantJson json) {
        Optional<PilotStatus> fromText = json.text("status", "pilotActiveStatusText").flatMap(PilotStatus::fromText);
        if (fromText.isPresent()) {
            return fromText;
        }
        return json.integer("pilotActiveStatus").flatMap(PilotStatus::fromCode);
    }

    private record Member(TolerantJson.KeyedObject json, Optional<PilotStatus> bucketStatus) {
    }
}
