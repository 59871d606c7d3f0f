package com.wingman.core.mission;

import com.wingman.core.model.CampaignDate;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MissionFileMatcherTest {

    private static final Path FOLDER = Path.of("Missions", "PWCG");

    private final MissionFileMatcher matcher = new MissionFileMatcher();

    @Test
    void picksTheClosestNameAmongQualifyingFiles() {
        List<Path> index = files("Hans Weber_1917-04-15.mission", "Hans Weber_1917-04-14.mission", "Other_1917-04-20.mission");
        MissionMatchQuery query = new MissionMatchQuery(Optional.empty(), Optional.of(CampaignDate.parse("19170414")),
            Optional.of("Hans Weber"), Optional.empty());

        assertEquals(Optional.of(FOLDER.resolve("Hans Weber_1917-04-14.mission")), matcher.match(index, query));
    }

    @Test
    void missionFileNameFromTheRecordWins() {
        List<Path> index = files("Hans Weber_1917-04-14.mission", "Hans Weber_1917-04-14 b.mission");
        MissionMatchQuery query = new MissionMatchQuery(Optional.of("Hans Weber_1917-04-14 b"), Optional.empty(),
            Optional.empty(), Optional.of("Hans Weber_1917-04-14 b.mission"));

        assertEquals(Optional.of(FOLDER.resolve("Hans Weber_1917-04-14 b.mission")), matcher.match(index, query));
    }

    @Test
    void equalScoresGoToTheSmallestFileName() {
        List<Path> index = files("b_19170414.mission", "a_19170414.mission");
        MissionMatchQuery query = new MissionMatchQuery(Optional.empty(), Optional.of(CampaignDate.parse("19170414")),
            Optional.empty(), Optional.empty());

        assertEquals(Optional.of(FOLDER.resolve("a_19170414.mission")), matcher.match(index, query));
    }

    @Test
    void noQualifyingFileOrEmptyQueryGivesNothing() {
        List<Path> index = files("Other_1917-04-20.mission");

        assertTrue(matcher.match(index, new MissionMatchQuery(Optional.empty(),
            Optional.of(CampaignDate.parse("19170414")), Optional.of("Hans Weber"), Optional.empty())).isEmpty());
        assertTrue(matcher.match(index, new MissionMatchQuery(Optional.empty(), Optional.empty(),
            Optional.empty(), Optional.empty())).isEmpty());
    }

    @Test
    void similarityIsARatioOfCommonCharacters() {
        assertEquals(1.0, MissionFileMatcher.similarity("abc", "abc"));
        assertEquals(0.0, MissionFileMatcher.similarity("abc", "xyz"));
        assertEquals(0.5, MissionFileMatcher.similarity("ab", "ac"));
    }

    private static List<Path> files(String... names) {
        return Arrays.stream(names).map(FOLDER::resolve).toList();
    }
}
