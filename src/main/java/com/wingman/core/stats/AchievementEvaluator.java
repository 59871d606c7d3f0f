package com.wingman.core.stats;

import com.wingman.core.model.Achievement;
import com.wingman.core.model.PilotStatistics;

import java.util.ArrayList;
import java.util.List;

public final class AchievementEvaluator {
    static final int ACE_VICTORIES = 5;
    static final int VETERAN_SORTIES = 50;

    public List<Achievement> evaluate(PilotStatistics statistics) {
        List<Achievement> unlocked = new ArrayList<>();
        if (statistics.victories() >= 1) {
            unlocked.add(Achievement.FIRST_VICTORY);
        }
        if (statistics.victories() >= ACE_VICTORIES) {
            unlocked.add(Achievement.ACE);
        }
        int sorties = Math.max(statistics.sorties(), statistics.missionsFlownReported().orElse(0));
        if (sorties >= VETERAN_SORTIES) {
            unlocked.add(Achievement.VETERAN);
        }
        return unlocked;
    }
}
