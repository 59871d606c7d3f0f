package com.wingman.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * What a pilot's combat reports say about the career beyond the counts: aircraft flown, duties,
 * places and altitudes.
 *
 * @param aircraftTypes          distinct aircraft named by the reports, sorted
 * @param sortiesByDuty          sorties per duty type, keyed in name order
 * @param localities             distinct localities named by the reports, sorted
 * @param averageAltitudeMeters  mean of the altitudes stated in meters, rounded to two decimals;
 *                               absent when no report states one
 */
public record CareerBreakdown(List<String> aircraftTypes,
                              Map<String, Integer> sortiesByDuty,
                              List<String> localities,
                              Optional<Double> averageAltitudeMeters) {

    private static final CareerBreakdown EMPTY = new CareerBreakdown(List.of(), Map.of(), List.of(), Optional.empty());

    public CareerBreakdown {
        aircraftTypes = List.copyOf(aircraftTypes);
        sortiesByDuty = Collections.unmodifiableMap(new TreeMap<>(sortiesByDuty));
        localities = List.copyOf(localities);
        averageAltitudeMeters = averageAltitudeMeters == null ? Optional.empty() : averageAltitudeMeters;
    }

    public static CareerBreakdown empty() {
        return EMPTY;
    }
}
