package com.wingman.core.model;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Derived per-pilot numbers. Always recomputed from source files, never carried over between syncs.
 *
 * @param victoriesByCategory empty when the source does not distinguish target categories
 * @param missionsFlownReported mission count as stated by the aces or personnel file, if any
 * @param partial true when a contributing record was only partially understood
 * @param career aircraft, duties, localities and altitudes taken from the combat reports
 */
public record PilotStatistics(int sorties,
                              int victories,
                              Map<String, Integer> victoriesByCategory,
                              int losses,
                              double victoryRatio,
                              Optional<Integer> missionsFlownReported,
                              boolean partial,
                              CareerBreakdown career) {

    public PilotStatistics {
        victoriesByCategory = Collections.unmodifiableMap(new TreeMap<>(victoriesByCategory));
        missionsFlownReported = missionsFlownReported == null ? Optional.empty() : missionsFlownReported;
        career = career == null ? CareerBreakdown.empty() : career;
    }

    public PilotStatistics(int sorties,
                           int victories,
                           Map<String, Integer> victoriesByCategory,
                           int losses,
                           double victoryRatio,
                           Optional<Integer> missionsFlownReported,
                           boolean partial) {
        this(sorties, victories, victoriesByCategory, losses, victoryRatio, missionsFlownReported, partial,
            CareerBreakdown.empty());
    }

    public static PilotStatistics empty() {
        return new PilotStatistics(0, 0, Map.of(), 0, 0.0, Optional.empty(), false);
    }
}
