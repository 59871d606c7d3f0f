package com.wingman.core.json;

import com.wingman.core.model.VictoryEvent;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Groups victory events by category. Sources that never name a category produce an empty map.
 */
public final class VictoryCategories {
    public static final String UNSPECIFIED = "unspecified";

    private VictoryCategories() {
    }

    public static Map<String, Integer> group(List<VictoryEvent> events) {
        boolean distinguished = events.stream().anyMatch(e -> e.category().isPresent());
        if (!distinguished) {
            return Map.of();
        }
        Map<String, Integer> grouped = new TreeMap<>();
        for (VictoryEvent event : events) {
            grouped.merge(event.category().orElse(UNSPECIFIED), 1, Integer::sum);
        }
        return grouped;
    }
}
