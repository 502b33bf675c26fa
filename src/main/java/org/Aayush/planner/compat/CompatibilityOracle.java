package org.Aayush.planner.compat;

import org.Aayush.core.time.TimeUtils;
import org.Aayush.planner.catalog.EventOccurrence;
import org.Aayush.planner.transit.TransitCostTable;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Pairwise feasibility and transit cost between two occurrences.
 *
 * <p>Two occurrences are compatible when the later one starts no earlier than the first
 * one's end plus the direct transit time between their venues, and their titles differ.
 * The check is evaluated for every pair in a catalog, not only for neighbours in a chosen
 * schedule, so a pair can be rejected even when some detour would make it reachable.</p>
 */
public final class CompatibilityOracle implements ConflictPredicate {
    private final TransitCostTable transitTable;

    public CompatibilityOracle(TransitCostTable transitTable) {
        this.transitTable = Objects.requireNonNull(transitTable, "transitTable");
    }

    /**
     * Returns direct transit minutes from {@code earlier}'s venue to {@code later}'s venue.
     */
    public int transitMinutes(EventOccurrence earlier, EventOccurrence later) {
        if (earlier.getVenue().equals(later.getVenue())) {
            return transitTable.sameVenueMinutes();
        }
        return transitTable.minutes(earlier.getVenue(), later.getVenue());
    }

    /**
     * Returns the earliest time {@code later} could start when attending {@code earlier} first.
     */
    public LocalDateTime earliestStart(EventOccurrence earlier, EventOccurrence later) {
        return earlier.getEnd().plusMinutes(transitMinutes(earlier, later));
    }

    @Override
    public boolean pairFeasible(EventOccurrence earlier, EventOccurrence later) {
        if (earlier.getTitle().equals(later.getTitle())) {
            return false;
        }
        return !later.getStart().isBefore(earliestStart(earlier, later));
    }

    /**
     * Returns transit minutes charged when {@code later} directly follows {@code earlier}.
     *
     * <p>Only transitions within one calendar date are charged; crossing midnight costs zero.</p>
     */
    public int attributedTransitMinutes(EventOccurrence earlier, EventOccurrence later) {
        if (!TimeUtils.sameCalendarDay(earlier.getStart(), later.getStart())) {
            return 0;
        }
        return transitMinutes(earlier, later);
    }

    public TransitCostTable transitTable() {
        return transitTable;
    }
}
