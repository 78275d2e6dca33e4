package com.discharge.reconciliation.bulk;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Parses the timestamp shapes produced by the source extracts:
 * ISO date-time, ISO date (start of day), {@code yyyy-MM-dd HH:mm:ss[.SSS]} and {@code dd/MM/yyyy[ HH:mm[:ss]]}.
 */
final class TimestampParser {

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss[.SSS]"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
            DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm[:ss]")
    );

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("dd/MM/yyyy")
    );

    private TimestampParser() {
        // Utility class
    }

    /**
     * Parses a timestamp; returns null for null input.
     *
     * @throws DateTimeParseException if no supported shape matches
     */
    static LocalDateTime parse(String value) {
        if (value == null) {
            return null;
        }
        String text = value.trim();
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            try {
                return LocalDateTime.parse(text, format);
            } catch (DateTimeParseException ignored) {
                // try the next shape
            }
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(text, format).atStartOfDay();
            } catch (DateTimeParseException ignored) {
                // try the next shape
            }
        }
        throw new DateTimeParseException("Unsupported timestamp: " + text, text, 0);
    }
}
