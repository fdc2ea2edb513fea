package com.lpgcert.auditservice.api;

import com.lpgcert.auditmodel.LogLevel;
import com.lpgcert.auditmodel.LogType;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/** Parsing of audit query request parameters. Invalid values raise IllegalArgumentException. */
final class QueryParameters {

    private QueryParameters() {
        // utility class
    }

    static LogType logType(String value) {
        return isBlank(value) ? null : LogType.fromValue(value.trim());
    }

    static LogLevel level(String value) {
        return isBlank(value) ? null : LogLevel.fromValue(value.trim());
    }

    /** ISO-8601 instant, or a {@code yyyy-MM-dd} date meaning the start of that day (UTC). */
    static Instant startDate(String value) {
        if (isBlank(value)) {
            return null;
        }
        return isDateOnly(value)
                ? date(value).atStartOfDay(ZoneOffset.UTC).toInstant()
                : instant(value, "start_date");
    }

    /**
     * ISO-8601 instant, or a {@code yyyy-MM-dd} date meaning the whole of that day (UTC). The
     * date-only bound is the day's last microsecond, the finest precision of {@code timestamptz}.
     */
    static Instant endDate(String value) {
        if (isBlank(value)) {
            return null;
        }
        if (!isDateOnly(value)) {
            return instant(value, "end_date");
        }
        Instant nextDay = date(value).plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        return nextDay.minus(1, ChronoUnit.MICROS);
    }

    private static boolean isDateOnly(String value) {
        return value.trim().length() == 10;
    }

    private static LocalDate date(String value) {
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid date: '" + value + "'", e);
        }
    }

    private static Instant instant(String value, String name) {
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid " + name + ": '" + value + "'", e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
