package org.Aayush.planner.catalog;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Ingestion-side description of one titled work and all of its showings.
 */
@Value
@Builder
public class EventListing {
    /** Title shared by every showing. */
    String title;
    /** Running time in minutes; must be positive. */
    long runningMinutes;
    /** Showings of the work; at least one is required. */
    @Singular
    List<Showing> showings;

    /**
     * One showing of a listing.
     *
     * @param start timestamp text, see {@link org.Aayush.core.time.TimeUtils#parseTimestamp(String)}.
     * @param venue venue code.
     */
    public record Showing(String start, String venue) {
    }
}
