package com.wingman.core.resolve;

import com.wingman.core.model.CampaignDate;
import com.wingman.core.model.CombatReport;
import com.wingman.core.model.MissionRecord;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MissionReportJoinerTest {

    @Test
    void singleMissionOnTheDayIsTakenWithoutScoring() {
        MissionRecord only = mission("m1", "19170414", "Jasta 2", "Albatros D.II", "PATROL", "10:00");
        MissionReportJoiner joiner = new MissionReportJoiner(List.of(only));

        assertEquals(Optional.of(only), joiner.missionFor(report("1917-04-14", "Jasta 11", "SPAD", "ESCORT", "18:00")));
        assertTrue(joiner.missionFor(report("19170415", "Jasta 2", "Albatros D.II", "PATROL", "10:00")).isEmpty());
    }

    @Test
    void bestScoringMissionWinsAndTiesGoToTheSmallerId() {
        MissionRecord squadronMatch = mission("m2", "19170414", "Jasta 11", "Albatros D.III", "PATROL", "10:00");
        MissionRecord aircraftOnly = mission("m1", "19170414", "Jasta 2", "Albatros D.III", "ESCORT", "12:00");
        MissionReportJoiner joiner = new MissionReportJoiner(List.of(squadronMatch, aircraftOnly));

        assertEquals(Optional.of(squadronMatch),
            joiner.missionFor(report("19170414", "Jasta 11", "Albatros D.III", "INTERCEPT", "09:00")));
        assertEquals(Optional.of(aircraftOnly),
            joiner.missionFor(report("19170414", "Jasta 99", "Albatros D.III", "INTERCEPT", "09:00")),
            "Equal scores resolve to the smaller mission id");
        assertTrue(joiner.missionFor(report("19170414", "Jasta 99", "Camel", "INTERCEPT", "09:00")).isEmpty(),
            "Nothing in common leaves the report unattached");
    }

    @Test
    void squadronMatchesByIdOrName() {
        MissionRecord mission = mission("m1", "19170414", "Jasta 11", "x", "y", "z");
        assertEquals(2, MissionReportJoiner.score(report("19170414", "jasta-11", "a", "b", "c"), mission));
        assertEquals(2, MissionReportJoiner.score(report("19170414", "401011", "a", "b", "c"), mission));
    }

    private static MissionRecord mission(String id, String date, String squadron, String aircraft, String duty, String time) {
        return new MissionRecord(id, Path.of(id + ".json"), Optional.of(CampaignDate.parse(date)), Optional.of(time),
            Optional.of("401011"), Optional.of(squadron), Optional.of(aircraft), Optional.of(duty), Optional.empty(),
            Optional.empty(), Optional.empty(), Optional.empty(), List.of());
    }

    private static CombatReport report(String date, String squadron, String aircraft, String duty, String time) {
        return new CombatReport(Path.of("r.json"), "1", "key", Optional.of("1"), Optional.of("Pilot"),
            Optional.of(squadron), Optional.of(CampaignDate.parse(date)), Optional.of(time), Optional.of(aircraft),
            Optional.of(duty), Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(),
            List.of(), List.of(), false, List.of(), false);
    }
}
