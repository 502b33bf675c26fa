package org.Aayush.core.time;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimeUtilsTest {

    @Test
    @DisplayName("Programme timestamps parse in space-separated and ISO forms")
    void testParseAcceptedForms() {
        LocalDateTime expected = LocalDateTime.of(2022, 8, 20, 19, 0);
        assertEquals(expected, TimeUtils.parseTimestamp("2022-08-20 19:00"));
        assertEquals(expected, TimeUtils.parseTimestamp("2022-08-20 19:00:00"));
        assertEquals(expected, TimeUtils.parseTimestamp("2022-08-20T19:00"));
        assertEquals(expected, TimeUtils.parseTimestamp("  2022-08-20T19:00:00 "));
    }

    @Test
    @DisplayName("Unparseable timestamps raise DateTimeParseException")
    void testParseRejectsGarbage() {
        assertThrows(DateTimeParseException.class, () -> TimeUtils.parseTimestamp("next tuesday"));
        assertThrows(DateTimeParseException.class, () -> TimeUtils.parseTimestamp("2022-08-20"));
        assertThrows(DateTimeParseException.class, () -> TimeUtils.parseTimestamp(null));
    }

    @Test
    @DisplayName("Minute differences are signed")
    void testMinutesBetween() {
        LocalDateTime a = LocalDateTime.of(2022, 8, 20, 19, 0);
        LocalDateTime b = LocalDateTime.of(2022, 8, 20, 20, 35);
        assertEquals(95L, TimeUtils.minutesBetween(a, b));
        assertEquals(-95L, TimeUtils.minutesBetween(b, a));
    }

    @Test
    @DisplayName("Calendar-day comparison ignores time of day")
    void testSameCalendarDay() {
        assertTrue(TimeUtils.sameCalendarDay(
                LocalDateTime.of(2022, 8, 20, 0, 0),
                LocalDateTime.of(2022, 8, 20, 23, 59)
        ));
        assertFalse(TimeUtils.sameCalendarDay(
                LocalDateTime.of(2022, 8, 20, 23, 59),
                LocalDateTime.of(2022, 8, 21, 0, 0)
        ));
    }
}
