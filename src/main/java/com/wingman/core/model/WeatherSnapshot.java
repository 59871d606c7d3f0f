package com.wingman.core.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Weather fields found in one {@code .mission} file. Keys that were not in the file are simply absent.
 */
public record WeatherSnapshot(Optional<Path> source, Map<WeatherKey, String> values, List<WindLayer> windLayers) {

    public WeatherSnapshot {
        source = source == null ? Optional.empty() : source;
        EnumMap<WeatherKey, String> copy = new EnumMap<>(WeatherKey.class);
        copy.putAll(values);
        values = Collections.unmodifiableMap(copy);
        windLayers = List.copyOf(windLayers);
    }

    public Optional<String> get(WeatherKey key) {
        return Optional.ofNullable(values.get(key));
    }

    public boolean has(WeatherKey key) {
        return values.containsKey(key);
    }

    public boolean isEmpty() {
        return values.isEmpty() && windLayers.isEmpty();
    }
}
