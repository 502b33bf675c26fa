package org.Aayush.planner.catalog;

import lombok.Value;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * One scheduled showing of a titled work at a venue.
 *
 * <p>Occurrences sharing a title are alternative showings of the same work. The end
 * time is derived once at construction and is strictly after the start.</p>
 */
@Value
public class EventOccurrence {
    /** Title of the work; equal titles denote the same work. */
    String title;
    /** Festival-local start time. */
    LocalDateTime start;
    /** Running time, strictly positive. */
    Duration duration;
    /** {@code start + duration}. */
    LocalDateTime end;
    /** Venue code, resolvable in the run's transit table. */
    String venue;

    private EventOccurrence(String title, LocalDateTime start, Duration duration, LocalDateTime end, String venue) {
        this.title = title;
        this.start = start;
        this.duration = duration;
        this.end = end;
        this.venue = venue;
    }

    /**
     * Creates an occurrence from a running time in minutes.
     *
     * @throws MalformedEventException when the title is blank, the start is missing or the
     *                                 running time is not positive or too large.
     */
    public static EventOccurrence of(String title, LocalDateTime start, long runningMinutes, String venue) {
        Duration duration;
        try {
            duration = Duration.ofMinutes(runningMinutes);
        } catch (ArithmeticException ex) {
            throw new MalformedEventException(
                    MalformedEventException.REASON_DURATION_OUT_OF_RANGE,
                    "running time of \"" + title + "\" is out of range: " + runningMinutes + " minutes",
                    ex
            );
        }
        return of(title, start, duration, venue);
    }

    /**
     * Creates an occurrence from an explicit duration.
     *
     * @throws MalformedEventException when the title is blank, the start is missing or the
     *                                 duration is not positive or pushes the end out of range.
     */
    public static EventOccurrence of(String title, LocalDateTime start, Duration duration, String venue) {
        if (title == null || title.isBlank()) {
            throw new MalformedEventException(MalformedEventException.REASON_TITLE_REQUIRED, "title must be non-blank");
        }
        if (start == null) {
            throw new MalformedEventException(
                    MalformedEventException.REASON_START_REQUIRED,
                    "start must be provided for \"" + title + "\""
            );
        }
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new MalformedEventException(
                    MalformedEventException.REASON_NON_POSITIVE_DURATION,
                    "duration must be positive for \"" + title + "\" at " + start + ", got " + duration
            );
        }
        if (venue == null || venue.isBlank()) {
            throw new MalformedEventException(
                    MalformedEventException.REASON_UNKNOWN_VENUE,
                    "venue must be non-blank for \"" + title + "\" at " + start
            );
        }
        LocalDateTime end;
        try {
            end = start.plus(duration);
        } catch (DateTimeException | ArithmeticException ex) {
            throw new MalformedEventException(
                    MalformedEventException.REASON_DURATION_OUT_OF_RANGE,
                    "end of \"" + title + "\" at " + start + " is out of range for duration " + duration,
                    ex
            );
        }
        return new EventOccurrence(title, start, duration, end, venue.trim());
    }
}
