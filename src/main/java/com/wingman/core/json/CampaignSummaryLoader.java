package com.wingman.core.json;

import com.wingman.core.error.MalformedRecordException;
import com.wingman.core.model.CampaignDate;
import org.json.JSONObject;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads {@code Campaign.json}. Newer generator builds nest the fields under {@code "campaign"};
 * both layouts are accepted, nested values winning.
 */
public final class CampaignSummaryLoader {

    public LoadedRecord<CampaignSummary> load(Path file) throws MalformedRecordException {
        List<String> notes = new ArrayList<>();
        JSONObject root = TolerantJson.rootObject(TolerantJson.read(file), notes);
        TolerantJson flat = TolerantJson.wrap(root, "", notes);
        Optional<JSONObject> nestedNode = flat.object("campaign");
        TolerantJson nested = nestedNode.map(n -> flat.child(n, "campaign")).orElse(flat);

        Optional<String> name = nested.text("name").or(() -> flat.text("name"));
        Optional<String> date = nested.text("date").or(() -> flat.text("date"));
        Optional<String> serial = nested.identifier("referencePlayerSerialNumber")
            .or(() -> flat.identifier("referencePlayerSerialNumber"));
        Optional<String> squadronId = nested.identifier("squadronId", "referencePlayerSquadronId")
            .or(() -> flat.identifier("squadronId", "referencePlayerSquadronId"));
        Optional<String> product = nested.text("product").or(() -> flat.text("product"));

        flat.requirePresent("name", name);
        flat.requirePresent("date", date);
        flat.requirePresent("referencePlayerSerialNumber", serial);

        CampaignSummary summary = new CampaignSummary(name, CampaignDate.parseOptional(date), serial, squadronId, product);
        return LoadedRecord.of(summary, file, notes);
    }
}
