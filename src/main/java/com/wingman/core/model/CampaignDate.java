package com.wingman.core.model;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * In-story date as written by the campaign generator. Keeps the raw text and, when one of the known
 * layouts matches, the parsed {@link LocalDate}. Parsed dates sort chronologically ahead of
 * unparsable ones, which sort by their raw text.
 */
public final class CampaignDate implements Comparable<CampaignDate> {
    private static final List<DateTimeFormatter> FORMATS = List.of(
        DateTimeFormatter.ofPattern("uuuuMMdd").withResolverStyle(ResolverStyle.STRICT),
        DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT),
        DateTimeFormatter.ofPattern("dd/MM/uuuu").withResolverStyle(ResolverStyle.STRICT),
        DateTimeFormatter.ofPattern("d.M.uuuu").withResolverStyle(ResolverStyle.STRICT)
    );

    private final String raw;
    private final LocalDate date;

    private CampaignDate(String raw, LocalDate date) {
        this.raw = raw;
        this.date = date;
    }

    public static CampaignDate parse(String raw) {
        String trimmed = Objects.requireNonNull(raw, "raw").trim();
        for (DateTimeFormatter format : FORMATS) {
            try {
                return new CampaignDate(trimmed, LocalDate.parse(trimmed, format));
            } catch (DateTimeParseException ignored) {
                // try the next layout
            }
        }
        return new CampaignDate(trimmed, null);
    }

    public static Optional<CampaignDate> parseOptional(Optional<String> raw) {
        return raw.filter(value -> !value.isBlank()).map(CampaignDate::parse);
    }

    public static CampaignDate of(LocalDate date) {
        return new CampaignDate(date.format(FORMATS.get(0)), date);
    }

    public String raw() {
        return raw;
    }

    public Optional<LocalDate> date() {
        return Optional.ofNullable(date);
    }

    public boolean isParsed() {
        return date != null;
    }

    /**
     * @return ISO-8601 text when parsed, the raw text otherwise
     */
    public String display() {
        return date != null ? date.toString() : raw;
    }

    @Override
    public int compareTo(CampaignDate other) {
        if (date != null && other.date != null) {
            int byDate = date.compareTo(other.date);
            return byDate != 0 ? byDate : raw.compareTo(other.raw);
        }
        if (date != null) {
            return -1;
        }
        if (other.date != null) {
            return 1;
        }
        return raw.compareTo(other.raw);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CampaignDate that)) return false;
        return raw.equals(that.raw) && Objects.equals(date, that.date);
    }

    @Override
    public int hashCode() {
        return Objects.hash(raw, date);
    }

    @Override
    public String toString() {
        return display();
    }
}
