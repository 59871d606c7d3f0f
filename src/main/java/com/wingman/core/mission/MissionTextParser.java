package com.wingman.core.mission;

import com.wingman.core.model.WeatherKey;
import com.wingman.core.model.WeatherSnapshot;
import com.wingman.core.model.WindLayer;
import com.wingman.logging.AppLogger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the weather and time-of-day fields of a simulator {@code .mission} file.
 * <p>
 * Only the {@code Options} block is consulted when the file has one; otherwise the whole text is
 * scanned. Keys missing from the file are left out of the snapshot, never defaulted.
 */
public class MissionTextParser {
    private static final Logger LOGGER = AppLogger.get();

    private static final Pattern OPTIONS_START = Pattern.compile("(?m)^\\s*Options\\s*\\{");
    private static final Pattern KEY_VALUE = Pattern.compile("(?m)^\\s*([A-Za-z][A-Za-z0-9_]*)\\s*=\\s*([^;\\r\\n]*);");
    private static final Pattern WIND_LAYERS_START = Pattern.compile("WindLayers\\s*\\{");
    private static final Pattern WIND_LAYER = Pattern.compile(
        "(-?\\d+(?:\\.\\d+)?)\\s*:\\s*(-?\\d+(?:\\.\\d+)?)\\s*:\\s*(-?\\d+(?:\\.\\d+)?)\\s*;");

    public WeatherSnapshot parse(Path file) throws IOException {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (CharacterCodingException ex) {
            LOGGER.fine("Mission file " + file + " is not UTF-8, reading as ISO-8859-1");
            content = Files.readString(file, StandardCharsets.ISO_8859_1);
        }
        return parse(content, Optional.of(file));
    }

    public WeatherSnapshot parse(Reader reader) throws IOException {
        StringWriter text = new StringWriter();
        try (BufferedReader buffered = new BufferedReader(reader)) {
            buffered.transferTo(text);
        }
        return parse(text.toString(), Optional.empty());
    }

    private WeatherSnapshot parse(String content, Optional<Path> source) {
        String options = block(content, OPTIONS_START).orElse(content);

        Map<WeatherKey, String> values = new EnumMap<>(WeatherKey.class);
        Matcher pairs = KEY_VALUE.matcher(options);
        while (pairs.find()) {
            Optional<WeatherKey> key = WeatherKey.fromFileKey(pairs.group(1));
            String value = pairs.group(2).trim();
            if (key.isPresent() && !value.isEmpty()) {
                values.putIfAbsent(key.get(), value);
            }
        }

        List<WindLayer> windLayers = new ArrayList<>();
        block(options, WIND_LAYERS_START).ifPresent(layers -> {
            Matcher layer = WIND_LAYER.matcher(layers);
            while (layer.find()) {
                windLayers.add(new WindLayer(
                    Double.parseDouble(layer.group(1)),
                    Double.parseDouble(layer.group(2)),
                    Double.parseDouble(layer.group(3))
                ));
            }
        });
        return new WeatherSnapshot(source, values, windLayers);
    }

    /**
     * Body of the brace block opened by {@code start}, up to its matching closing brace.
     */
    static Optional<String> block(String content, Pattern start) {
        Matcher matcher = start.matcher(content);
        if (!matcher.find()) {
            return Optional.empty();
        }
        int depth = 1;
        int bodyStart = matcher.end();
        for (int i = bodyStart; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return Optional.of(content.substring(bodyStart, i));
                }
            }
        }
        return Optional.of(content.substring(bodyStart));
    }
}
