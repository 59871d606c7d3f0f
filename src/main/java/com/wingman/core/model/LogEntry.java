package com.wingman.core.model;

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * Campaign log line. Source order is not chronological; consumers sort with {@link #CHRONOLOGICAL}.
 */
public record LogEntry(CampaignDate date, String text, Optional<String> squadronId) {

    public static final Comparator<LogEntry> CHRONOLOGICAL = Comparator.comparing(LogEntry::date);

    public LogEntry {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(text, "text");
        squadronId = squadronId == null ? Optional.empty() : squadronId;
    }
}
