package com.wingman.core.json;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * One pilot summary from {@code CampaignAces.json}.
 *
 * @param victories           stated victory count, absent when the entry had no victory field
 * @param victoriesByCategory populated only when the entry listed categorized victories
 */
public record AceEntry(String serialNumber,
                       Optional<String> name,
                       Optional<String> rank,
                       Optional<String> squadronId,
                       Optional<String> squadronName,
                       Optional<String> country,
                       Optional<Integer> missionsFlown,
                       Optional<Integer> victories,
                       Map<String, Integer> victoriesByCategory) {

    public AceEntry {
        Objects.requireNonNull(serialNumber, "serialNumber");
        victoriesByCategory = Collections.unmodifiableMap(new TreeMap<>(victoriesByCategory));
    }
}
