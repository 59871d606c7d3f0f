package com.wingman.core.mission;

import com.wingman.core.model.PilotNames;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Picks the {@code .mission} file that belongs to a flown mission by its name alone.
 * <p>
 * A candidate qualifies when its name contains the mission id, one spelling of the mission date or
 * the pilot name. Among qualifying files the one most similar to the expected stem wins; equal
 * scores go to the lexicographically smallest file name. No qualifying file means no match.
 */
public final class MissionFileMatcher {

    public Optional<Path> match(Iterable<Path> index, MissionMatchQuery query) {
        List<String> tokens = tokens(query);
        if (tokens.isEmpty()) {
            return Optional.empty();
        }
        String expected = query.expectedStem().map(PilotNames::normalize).orElse("");

        Path best = null;
        double bestScore = -1;
        String bestName = null;
        for (Path candidate : index) {
            String fileName = candidate.getFileName().toString();
            String stem = PilotNames.normalize(MissionMatchQuery.stripExtension(fileName));
            if (!qualifies(stem, tokens)) {
                continue;
            }
            double score = similarity(stem, expected);
            if (score > bestScore || (score == bestScore && fileName.compareTo(bestName) < 0)) {
                best = candidate;
                bestScore = score;
                bestName = fileName;
            }
        }
        return Optional.ofNullable(best);
    }

    private static List<String> tokens(MissionMatchQuery query) {
        List<String> tokens = new ArrayList<>();
        query.missionId().map(PilotNames::normalize).ifPresent(tokens::add);
        query.missionFileName().map(MissionMatchQuery::stripExtension).map(PilotNames::normalize).ifPresent(tokens::add);
        query.dateTokens().stream().map(PilotNames::normalize).forEach(tokens::add);
        query.pilotName().map(PilotNames::normalize).ifPresent(tokens::add);
        tokens.removeIf(String::isEmpty);
        return tokens;
    }

    private static boolean qualifies(String stem, List<String> tokens) {
        for (String token : tokens) {
            if (stem.contains(token)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Ratio of matching characters, {@code 2 * lcs / (|a| + |b|)}, in {@code [0, 1]}.
     */
    static double similarity(String a, String b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 1.0;
        }
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int i = 1; i <= a.length(); i++) {
            for (int j = 1; j <= b.length(); j++) {
                current[j] = a.charAt(i - 1) == b.charAt(j - 1)
                    ? previous[j - 1] + 1
                    : Math.max(previous[j], current[j - 1]);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return 2.0 * previous[b.length()] / (a.length() + b.length());
    }
}
