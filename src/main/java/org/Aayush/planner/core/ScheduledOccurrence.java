package org.Aayush.planner.core;

import lombok.Builder;
import lombok.Value;
import org.Aayush.planner.catalog.EventOccurrence;

import java.time.LocalDateTime;

/**
 * One attended occurrence with its transition from the previous attended one.
 *
 * <p>{@code transitMinutes} and {@code downtimeMinutes} are null for the first occurrence
 * of a calendar date.</p>
 */
@Value
@Builder
public class ScheduledOccurrence {
    /** Index in the catalog the schedule was solved on. */
    int catalogIndex;
    EventOccurrence occurrence;
    /** Transit minutes from the previous attended occurrence on the same date. */
    Integer transitMinutes;
    /** Idle minutes between arriving from the previous occurrence and this start. */
    Integer downtimeMinutes;
    /** True when the previous attended occurrence on the same date was at another venue. */
    boolean venueChanged;

    public boolean hasTransition() {
        return transitMinutes != null;
    }

    public String getTitle() {
        return occurrence.getTitle();
    }

    public LocalDateTime getStart() {
        return occurrence.getStart();
    }

    public LocalDateTime getEnd() {
        return occurrence.getEnd();
    }

    public String getVenue() {
        return occurrence.getVenue();
    }
}
