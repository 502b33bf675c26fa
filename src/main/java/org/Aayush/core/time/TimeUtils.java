package org.Aayush.core.time;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.List;

/**
 * Shared time helpers for programme ingestion and schedule annotation.
 *
 * <p>All timestamps are festival-local wall-clock times without a zone. Calendar-day
 * comparisons use the local date of the value.</p>
 */
public final class TimeUtils {

    private static final DateTimeFormatter SPACE_SEPARATED = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd HH:mm")
            .optionalStart()
            .appendLiteral(':')
            .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
            .optionalEnd()
            .toFormatter();

    private static final List<DateTimeFormatter> ACCEPTED_FORMATS = List.of(
            SPACE_SEPARATED,
            DateTimeFormatter.ISO_LOCAL_DATE_TIME
    );

    /**
     * Prevents instantiation of this utility class.
     */
    private TimeUtils() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Parses one programme timestamp.
     *
     * <p>Accepted forms are {@code yyyy-MM-dd HH:mm}, {@code yyyy-MM-dd HH:mm:ss} and
     * ISO-8601 local date-time ({@code yyyy-MM-ddTHH:mm[:ss]}).</p>
     *
     * @param text timestamp text, surrounding whitespace ignored.
     * @return parsed local date-time.
     * @throws DateTimeParseException when no accepted form matches.
     */
    public static LocalDateTime parseTimestamp(String text) {
        if (text == null) {
            throw new DateTimeParseException("timestamp text is null", "", 0);
        }
        String trimmed = text.trim();
        DateTimeParseException last = null;
        for (DateTimeFormatter format : ACCEPTED_FORMATS) {
            try {
                return LocalDateTime.parse(trimmed, format);
            } catch (DateTimeParseException ex) {
                last = ex;
            }
        }
        throw last;
    }

    /**
     * Returns whole minutes from {@code from} to {@code to}; negative when {@code to} is earlier.
     *
     * @param from start instant.
     * @param to end instant.
     * @return signed minute difference, truncated toward zero.
     */
    public static long minutesBetween(LocalDateTime from, LocalDateTime to) {
        return Duration.between(from, to).toMinutes();
    }

    /**
     * Returns true when both timestamps fall on the same calendar date.
     */
    public static boolean sameCalendarDay(LocalDateTime a, LocalDateTime b) {
        return a.toLocalDate().equals(b.toLocalDate());
    }
}
