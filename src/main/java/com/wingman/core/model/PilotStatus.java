package com.wingman.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Roster status codes used by the personnel files ({@code pilotActiveStatus}).
 */
public enum PilotStatus {
    ACTIVE(0),
    RESTING(1),
    WOUNDED(2),
    HOSPITALIZED(3),
    MISSING_IN_ACTION(4),
    KILLED_IN_ACTION(5),
    TRANSFERRED(6);

    private final int code;

    PilotStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Optional<PilotStatus> fromCode(int code) {
        for (PilotStatus status : values()) {
            if (status.code == code) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }

    /**
     * Personnel files sometimes spell the status out, e.g. {@code "KIA"} or {@code "Wounded"}.
     */
    public static Optional<PilotStatus> fromText(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String normalized = text.trim().toUpperCase(Locale.ROOT).replace(' ', '_');
        return switch (normalized) {
            case "ACTIVE" -> Optional.of(ACTIVE);
            case "RESTING", "RESERVE", "ON_LEAVE" -> Optional.of(RESTING);
            case "WOUNDED" -> Optional.of(WOUNDED);
            case "HOSPITAL", "HOSPITALIZED" -> Optional.of(HOSPITALIZED);
            case "MIA", "MISSING", "MISSING_IN_ACTION" -> Optional.of(MISSING_IN_ACTION);
            case "KIA", "KILLED", "KILLED_IN_ACTION" -> Optional.of(KILLED_IN_ACTION);
            case "TRANSFER", "TRANSFERRED" -> Optional.of(TRANSFERRED);
            default -> Optional.empty();
        };
    }
}
