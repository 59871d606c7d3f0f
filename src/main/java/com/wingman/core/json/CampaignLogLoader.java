package com.wingman.core.json;

import com.wingman.core.error.MalformedRecordException;
import com.wingman.core.model.CampaignDate;
import com.wingman.core.model.LogEntry;
import org.json.JSONArray;
import org.json.JSONObject;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads {@code CampaignLog.json}: either a flat list of {@code {date, log, squadronId}} or the
 * grouped {@code campaignLogsByDate} layout. Entries keep file order here; the resolver sorts.
 */
public final class CampaignLogLoader {

    public LoadedRecord<List<LogEntry>> load(Path file) throws MalformedRecordException {
        List<String> notes = new ArrayList<>();
        Object root = TolerantJson.read(file);
        List<LogEntry> entries = new ArrayList<>();

        if (root instanceof JSONArray list) {
            readFlat(list, Optional.empty(), entries, notes, "log");
        } else {
            JSONObject obj = (JSONObject) root;
            TolerantJson json = TolerantJson.wrap(obj, "", notes);
            Optional<JSONObject> byDate = json.object("campaignLogsByDate");
            Optional<JSONArray> flat = json.array("logs", "log");
            if (byDate.isPresent()) {
                readGrouped(json, byDate.get(), entries, notes);
            } else if (flat.isPresent()) {
                readFlat(flat.get(), Optional.empty(), entries, notes, "logs");
            } else {
                notes.add("no log entries found");
            }
        }
        return LoadedRecord.of(List.copyOf(entries), file, notes);
    }

    private static void readGrouped(TolerantJson json, JSONObject byDate, List<LogEntry> out, List<String> notes) {
        for (TolerantJson.KeyedObject group : TolerantJson.objectsOf(byDate)) {
            String key = group.key().orElse("");
            TolerantJson day = json.child(group.value(), "campaignLogsByDate['" + key + "']");
            Optional<String> groupDate = day.text("date").or(() -> Optional.of(key).filter(k -> !k.isBlank()));
            Optional<JSONArray> logs = day.array("logs");
            if (logs.isEmpty()) {
                day.note("missing 'logs'");
                continue;
            }
            readFlat(logs.get(), groupDate, out, notes, "campaignLogsByDate['" + key + "'].logs");
        }
    }

    private static void readFlat(JSONArray list, Optional<String> inheritedDate, List<LogEntry> out,
                                 List<String> notes, String context) {
        for (int i = 0; i < list.length(); i++) {
            JSONObject item = list.optJSONObject(i);
            if (item == null) {
                notes.add(context + "[" + i + "]: not an object");
                continue;
            }
            TolerantJson json = TolerantJson.wrap(item, context + "[" + i + "]", notes);
            Optional<String> date = json.text("date").or(() -> inheritedDate);
            Optional<String> text = json.text("log", "text", "message");
            if (date.isEmpty() || text.isEmpty()) {
                json.note("entry without date or text skipped");
                continue;
            }
            out.add(new LogEntry(CampaignDate.parse(date.get()), text.get(), json.identifier("squadronId")));
        }
    }
}
