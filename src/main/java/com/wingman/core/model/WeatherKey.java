package com.wingman.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Weather and time-of-day keys read from the {@code Options} block of a {@code .mission} file.
 */
public enum WeatherKey {
    TIME("Time"),
    DATE("Date"),
    CLOUD_LEVEL("CloudLevel"),
    CLOUD_HEIGHT("CloudHeight"),
    CLOUD_CONFIG("CloudConfig"),
    TEMPERATURE("Temperature"),
    PRESSURE("Pressure"),
    HAZE("Haze"),
    LAYER_FOG("LayerFog"),
    PREC_TYPE("PrecType"),
    PREC_LEVEL("PrecLevel"),
    TURBULENCE("Turbulence"),
    SEA_STATE("SeaState");

    private final String fileKey;

    WeatherKey(String fileKey) {
        this.fileKey = fileKey;
    }

    public String fileKey() {
        return fileKey;
    }

    public static Optional<WeatherKey> fromFileKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String wanted = key.trim().toLowerCase(Locale.ROOT);
        for (WeatherKey candidate : values()) {
            if (candidate.fileKey.toLowerCase(Locale.ROOT).equals(wanted)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
