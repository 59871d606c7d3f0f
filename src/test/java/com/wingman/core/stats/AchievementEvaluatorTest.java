package com.wingman.core.stats;

import com.wingman.core.model.Achievement;
import com.wingman.core.model.PilotStatistics;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AchievementEvaluatorTest {

    private final AchievementEvaluator evaluator = new AchievementEvaluator();

    @Test
    void thresholdsUnlockInOrder() {
        assertEquals(List.of(), evaluator.evaluate(PilotStatistics.empty()));
        assertEquals(List.of(Achievement.FIRST_VICTORY), evaluator.evaluate(stats(3, 1, Optional.empty())));
        assertEquals(List.of(Achievement.FIRST_VICTORY, Achievement.ACE), evaluator.evaluate(stats(10, 5, Optional.empty())));
    }

    @Test
    void veteranCountsReportedMissionsWhenReportsAreMissing() {
        assertEquals(List.of(Achievement.VETERAN), evaluator.evaluate(stats(0, 0, Optional.of(50))));
        assertEquals(List.of(), evaluator.evaluate(stats(49, 0, Optional.of(12))));
    }

    private static PilotStatistics stats(int sorties, int victories, Optional<Integer> missionsFlown) {
        return new PilotStatistics(sorties, victories, Map.of(), 0, 0.0, missionsFlown, false);
    }
}
