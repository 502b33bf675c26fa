package org.Aayush.planner.compat;

import org.Aayush.planner.catalog.EventOccurrence;

/**
 * Pure pairwise feasibility test over two occurrences.
 */
@FunctionalInterface
public interface ConflictPredicate {

    /**
     * Returns true when both occurrences may be attended.
     *
     * @param earlier occurrence starting no later than {@code later}.
     * @param later occurrence starting no earlier than {@code earlier}.
     */
    boolean pairFeasible(EventOccurrence earlier, EventOccurrence later);

    /**
     * Order-insensitive form of {@link #pairFeasible(EventOccurrence, EventOccurrence)}.
     */
    default boolean compatible(EventOccurrence a, EventOccurrence b) {
        if (a.getStart().isAfter(b.getStart())) {
            return pairFeasible(b, a);
        }
        return pairFeasible(a, b);
    }
}
