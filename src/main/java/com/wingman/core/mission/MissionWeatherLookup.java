package com.wingman.core.mission;

import com.wingman.core.error.DiagnosticCollector;
import com.wingman.core.error.DiagnosticKind;
import com.wingman.core.model.WeatherSnapshot;
import com.wingman.logging.AppLogger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * {@link WeatherSource} backed by the simulator mission folder. Misses and unreadable files are
 * reported to the collector and answered with no weather.
 */
public final class MissionWeatherLookup implements WeatherSource {
    private static final Logger LOGGER = AppLogger.get();

    private final MissionFileIndex index;
    private final MissionFileMatcher matcher;
    private final MissionTextParser parser;
    private final DiagnosticCollector diagnostics;
    private final Map<Path, Optional<WeatherSnapshot>> parsed = new HashMap<>();

    public MissionWeatherLookup(MissionFileIndex index, DiagnosticCollector diagnostics) {
        this(index, new MissionFileMatcher(), new MissionTextParser(), diagnostics);
    }

    MissionWeatherLookup(MissionFileIndex index,
                         MissionFileMatcher matcher,
                         MissionTextParser parser,
                         DiagnosticCollector diagnostics) {
        this.index = Objects.requireNonNull(index, "index");
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    @Override
    public Optional<WeatherSnapshot> find(MissionMatchQuery query) {
        Optional<Path> match;
        try {
            match = matcher.match(index, query);
        } catch (UncheckedIOException ex) {
            diagnostics.report(DiagnosticKind.MISSION_FILE_NOT_FOUND, index.folder(),
                "mission folder unreadable: " + ex.getCause().getMessage());
            return Optional.empty();
        }
        if (match.isEmpty()) {
            diagnostics.report(DiagnosticKind.MISSION_FILE_NOT_FOUND, index.folder(),
                "no .mission file for " + query.expectedStem().orElse("unnamed mission"));
            return Optional.empty();
        }
        return parsed.computeIfAbsent(match.get(), this::parse);
    }

    private Optional<WeatherSnapshot> parse(Path file) {
        try {
            return Optional.of(parser.parse(file));
        } catch (IOException ex) {
            LOGGER.warning("Unable to read mission file " + file + ": " + ex.getMessage());
            diagnostics.report(DiagnosticKind.MALFORMED_RECORD, file, "unreadable mission file: " + ex.getMessage());
            return Optional.empty();
        }
    }
}
