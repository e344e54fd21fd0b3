package com.example.poscore.utils;

import java.time.*;
import java.time.format.DateTimeParseException;

/**
 * Utilities for parsing caller-provided date/time strings in a consistent way,
 * treating timezone-less values as local times of the store's zone.
 */
public final class DateTimeUtils {

    private DateTimeUtils() {
    }

    /**
     * Parse a string into an OffsetDateTime. If the string carries an explicit
     * offset or 'Z', it is parsed as-is. A local datetime (contains 'T' but no
     * offset) is interpreted in {@code zone}. A date-only string (YYYY-MM-DD) is
     * the start of that day in {@code zone}. Returns null on parse failure.
     */
    public static OffsetDateTime parseToOffsetDateTimeOrNull(String s, ZoneId zone) {
        if (s == null || s.isBlank())
            return null;
        try {
            return OffsetDateTime.parse(s);
        } catch (DateTimeParseException ignored) {
            // not an offset timestamp, try the local forms below
        }

        try {
            if (s.contains("T")) {
                LocalDateTime ldt = LocalDateTime.parse(s);
                return ldt.atZone(zone).toOffsetDateTime();
            }
        } catch (DateTimeParseException ignored) {
            // fall through to date-only
        }

        try {
            LocalDate ld = LocalDate.parse(s);
            return ld.atStartOfDay(zone).toOffsetDateTime();
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    public static OffsetDateTime startOfDay(LocalDate day, ZoneId zone) {
        return day.atStartOfDay(zone).toOffsetDateTime();
    }
}
