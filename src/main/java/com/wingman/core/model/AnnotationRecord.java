package com.wingman.core.model;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * User-entered pilot metadata. Written only by the presentation layer through the annotation store.
 */
public record AnnotationRecord(String serialNumber,
                               Optional<String> birthDate,
                               Optional<String> birthPlace,
                               Optional<String> notes,
                               Optional<String> photoReference) {

    private static final List<DateTimeFormatter> BIRTH_DATE_FORMATS = List.of(
        DateTimeFormatter.ofPattern("dd/MM/uuuu").withResolverStyle(ResolverStyle.STRICT),
        DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT),
        DateTimeFormatter.ofPattern("uuuuMMdd").withResolverStyle(ResolverStyle.STRICT)
    );

    public AnnotationRecord {
        Objects.requireNonNull(serialNumber, "serialNumber");
        birthDate = blankToEmpty(birthDate);
        birthPlace = blankToEmpty(birthPlace);
        notes = blankToEmpty(notes);
        photoReference = blankToEmpty(photoReference);
    }

    public AnnotationRecord withSerialNumber(String serial) {
        return new AnnotationRecord(serial, birthDate, birthPlace, notes, photoReference);
    }

    /**
     * Birth date accepted as {@code dd/MM/yyyy} (what the profile form writes), ISO, or {@code yyyyMMdd}.
     */
    public Optional<LocalDate> parsedBirthDate() {
        if (birthDate.isEmpty()) {
            return Optional.empty();
        }
        String raw = birthDate.get().trim();
        for (DateTimeFormatter format : BIRTH_DATE_FORMATS) {
            try {
                return Optional.of(LocalDate.parse(raw, format));
            } catch (DateTimeParseException ignored) {
                // next layout
            }
        }
        return Optional.empty();
    }

    private static Optional<String> blankToEmpty(Optional<String> value) {
        if (value == null) {
            return Optional.empty();
        }
        return value.filter(v -> !v.isBlank());
    }
}
