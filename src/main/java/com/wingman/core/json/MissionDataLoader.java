package com.wingman.core.json;

import com.wingman.core.error.MalformedRecordException;
import com.wingman.core.model.CampaignDate;
import com.wingman.core.model.MissionParticipant;
import com.wingman.core.model.MissionRecord;
import org.json.JSONObject;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads one {@code MissionData/*.json} file. Header fields live under {@code missionHeader};
 * older files keep them at the top level.
 */
public final class MissionDataLoader {

    public LoadedRecord<MissionRecord> load(Path file) throws MalformedRecordException {
        List<String> notes = new ArrayList<>();
        JSONObject root = TolerantJson.rootObject(TolerantJson.read(file), notes);
        TolerantJson top = TolerantJson.wrap(root, "", notes);
        TolerantJson header = top.object("missionHeader").map(h -> top.child(h, "missionHeader")).orElse(top);

        Optional<String> rawDate = header.text("date").or(() -> top.text("date"));
        header.requirePresent("date", rawDate);
        Optional<String> missionFileName = header.text("missionFileName", "missionFile");

        MissionRecord record = new MissionRecord(
            missionId(missionFileName, file),
            file,
            CampaignDate.parseOptional(rawDate),
            header.text("time").or(() -> top.text("time")),
            header.identifier("squadronId", "squadronID").or(() -> top.identifier("squadronId", "squadronID")),
            header.text("squadron", "squadronName"),
            header.text("aircraftType", "aircraft"),
            header.text("duty").or(() -> top.text("missionType")),
            header.text("airfield"),
            header.integer("altitude"),
            top.text("missionDescription", "description"),
            missionFileName,
            participants(top)
        );
        return LoadedRecord.of(record, file, notes);
    }

    static String missionId(Optional<String> missionFileName, Path file) {
        if (missionFileName.isPresent()) {
            String name = missionFileName.get().replace('\\', '/');
            int slash = name.lastIndexOf('/');
            String base = slash >= 0 ? name.substring(slash + 1) : name;
            int dot = base.lastIndexOf('.');
            String stem = dot > 0 ? base.substring(0, dot) : base;
            if (!stem.isBlank()) {
                return stem;
            }
        }
        return CombatReportLoader.fileStem(file);
    }

    private static List<MissionParticipant> participants(TolerantJson top) {
        Optional<Object> planes = top.raw("missionPlanes");
        if (planes.isEmpty()) {
            return List.of();
        }
        List<MissionParticipant> result = new ArrayList<>();
        for (TolerantJson.KeyedObject plane : TolerantJson.objectsOf(planes.get())) {
            TolerantJson json = top.child(plane.value(), "missionPlanes['" + plane.key().orElse("") + "']");
            Optional<String> name = json.text("pilotName", "name");
            if (name.isEmpty()) {
                json.note("plane without pilot name skipped");
                continue;
            }
            result.add(new MissionParticipant(
                json.identifier("pilotSerialNumber", "serialNumber"),
                name.get(),
                json.text("pilotRank", "rank"),
                json.identifier("squadronId", "squadronID")
            ));
        }
        return result;
    }
}
