package com.wingman.core.mission;

import com.wingman.core.model.WeatherKey;
import com.wingman.core.model.WeatherSnapshot;
import com.wingman.core.model.WindLayer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MissionTextParserTest {

    @TempDir
    Path tempDir;

    private final MissionTextParser parser = new MissionTextParser();

    @Test
    void readsOptionsBlockAndWindLayers() throws Exception {
        WeatherSnapshot snapshot = parser.parse(new StringReader("""
            Mission
            {
              Options
              {
                Time = 6:15:0;
                CloudLevel = 1200;
                CloudConfig = "summer\\\\01_Medium_06\\\\sky.ini";
                PrecType = 0;
                WindLayers
                {
                  0 :     90 :     1;
                  1000 :     110.5 :     6;
                }
              }
              Block
              {
                Time = 23:59:0;
                Temperature = 40;
              }
            }
            """));

        assertEquals(Optional.of("6:15:0"), snapshot.get(WeatherKey.TIME));
        assertEquals(Optional.of("1200"), snapshot.get(WeatherKey.CLOUD_LEVEL));
        assertEquals(Optional.of("0"), snapshot.get(WeatherKey.PREC_TYPE));
        assertTrue(snapshot.get(WeatherKey.CLOUD_CONFIG).orElseThrow().contains("sky.ini"));
        assertFalse(snapshot.has(WeatherKey.TEMPERATURE), "Keys outside the Options block are ignored");
        assertEquals(List.of(new WindLayer(0, 90, 1), new WindLayer(1000, 110.5, 6)), snapshot.windLayers());
    }

    @Test
    void absentKeysStayAbsent() throws Exception {
        WeatherSnapshot snapshot = parser.parse(new StringReader("""
            Options
            {
              Temperature = -3;
              Haze = ;
            }
            """));
        assertFalse(snapshot.isEmpty());
        assertEquals(Optional.of("-3"), snapshot.get(WeatherKey.TEMPERATURE));
        assertFalse(snapshot.has(WeatherKey.HAZE), "Empty values are treated as missing");
        assertFalse(snapshot.has(WeatherKey.PRESSURE));
        assertTrue(snapshot.windLayers().isEmpty());
    }

    @Test
    void fileWithoutOptionsBlockIsScannedWhole() throws Exception {
        Path file = tempDir.resolve("legacy.mission");
        Files.write(file, "Pressure = 755;\nSeaState = 2;\nDate = 14.4.1917;\n".getBytes(StandardCharsets.ISO_8859_1));

        WeatherSnapshot snapshot = parser.parse(file);

        assertEquals(Optional.of(file), snapshot.source());
        assertEquals(Optional.of("755"), snapshot.get(WeatherKey.PRESSURE));
        assertEquals(Optional.of("2"), snapshot.get(WeatherKey.SEA_STATE));
        assertEquals(Optional.of("14.4.1917"), snapshot.get(WeatherKey.DATE));
    }
}
