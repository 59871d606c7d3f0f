package com.wingman.core.json;

import com.wingman.core.model.CampaignDate;
import com.wingman.core.model.LossEvent;
import com.wingman.core.model.VictoryEvent;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Victory and loss fields come either as a plain count or as a list of event objects.
 */
final class EventListReader {

    private EventListReader() {
    }

    static Optional<List<VictoryEvent>> victories(TolerantJson json, String... keys) {
        Optional<Object> raw = json.raw(keys);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        Object value = raw.get();
        if (value instanceof JSONArray arr) {
            List<VictoryEvent> events = new ArrayList<>();
            for (int i = 0; i < arr.length(); i++) {
                JSONObject entry = arr.optJSONObject(i);
                if (entry == null) {
                    events.add(VictoryEvent.unspecified());
                    continue;
                }
                TolerantJson victory = json.child(entry, keys[0] + "[" + i + "]");
                Optional<String> category = victory.text("category", "targetCategory");
                if (category.isEmpty()) {
                    category = victory.object("victim")
                        .flatMap(victim -> victory.child(victim, "victim").text("category", "type"));
                }
                Optional<String> description = victory.text("description", "text");
                events.add(new VictoryEvent(CampaignDate.parseOptional(victory.text("date")), category, description));
            }
            return Optional.of(events);
        }
        return count(json, value, keys[0]).map(n -> Collections.nCopies(n, VictoryEvent.unspecified()));
    }

    static Optional<List<LossEvent>> losses(TolerantJson json, String... keys) {
        Optional<Object> raw = json.raw(keys);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        Object value = raw.get();
        if (value instanceof JSONArray arr) {
            List<LossEvent> events = new ArrayList<>();
            for (int i = 0; i < arr.length(); i++) {
                JSONObject entry = arr.optJSONObject(i);
                if (entry == null) {
                    events.add(LossEvent.unspecified());
                    continue;
                }
                TolerantJson loss = json.child(entry, keys[0] + "[" + i + "]");
                events.add(new LossEvent(CampaignDate.parseOptional(loss.text("date")), loss.text("description", "text")));
            }
            return Optional.of(events);
        }
        return count(json, value, keys[0]).map(n -> Collections.nCopies(n, LossEvent.unspecified()));
    }

    private static Optional<Integer> count(TolerantJson json, Object value, String key) {
        Optional<Integer> n = TolerantJson.toInteger(value);
        if (n.isEmpty()) {
            json.note("'%s' is neither a list nor a count".formatted(key));
            return Optional.empty();
        }
        if (n.get() < 0) {
            json.note("'%s' is negative".formatted(key));
            return Optional.empty();
        }
        return n;
    }
}
