package com.wingman.core.mission;

import com.wingman.core.model.WeatherSnapshot;

import java.util.Optional;

/**
 * Finds the weather of a flown mission. Absence is a normal answer.
 */
@FunctionalInterface
public interface WeatherSource {

    WeatherSource NONE = query -> Optional.empty();

    Optional<WeatherSnapshot> find(MissionMatchQuery query);
}
