package com.wingman.core.resolve;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Pulls the flight roster out of a report's after-action text: the lines following
 * "This mission was flown by" up to the first blank line. Lines carrying digits are times or
 * tallies, not names, and are skipped.
 */
final class SquadmateExtractor {
    private static final String MARKER = "this mission was flown by";

    private SquadmateExtractor() {
    }

    static List<String> fromReport(Optional<String> haReport) {
        if (haReport.isEmpty()) {
            return List.of();
        }
        Set<String> names = new LinkedHashSet<>();
        boolean collecting = false;
        for (String raw : haReport.get().split("\\R")) {
            String line = raw.strip();
            if (!collecting) {
                collecting = line.toLowerCase(Locale.ROOT).startsWith(MARKER);
                continue;
            }
            if (line.isEmpty()) {
                break;
            }
            if (line.chars().anyMatch(Character::isDigit)) {
                continue;
            }
            names.add(line);
        }
        return List.copyOf(names);
    }
}
