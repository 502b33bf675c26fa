package org.Aayush.planner.core;

import org.Aayush.planner.catalog.EventCatalog;
import org.Aayush.planner.catalog.EventOccurrence;
import org.Aayush.planner.compat.CompatibilityOracle;
import org.Aayush.planner.compat.ConflictPredicate;
import org.Aayush.planner.solver.SelectionAssignment;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Replays a solved assignment against the catalog, independently of the solver.
 */
public final class ScheduleVerifier {
    private final ConflictPredicate predicate;

    public ScheduleVerifier(ConflictPredicate predicate) {
        this.predicate = Objects.requireNonNull(predicate, "predicate");
    }

    /**
     * One violated pair.
     */
    public record Violation(int earlierIndex, int laterIndex) {
    }

    /**
     * Lists every attended pair the predicate rejects.
     */
    public List<Violation> violations(EventCatalog catalog, SelectionAssignment assignment) {
        requireMatchingSize(catalog, assignment);
        List<Violation> violations = new ArrayList<>();
        for (int i = 0; i < catalog.size(); i++) {
            if (!assignment.isSelected(i)) {
                continue;
            }
            EventOccurrence earlier = catalog.get(i);
            for (int j = i + 1; j < catalog.size(); j++) {
                if (assignment.isSelected(j) && !predicate.pairFeasible(earlier, catalog.get(j))) {
                    violations.add(new Violation(i, j));
                }
            }
        }
        return violations;
    }

    /**
     * Sums attributed transit between consecutive attended occurrences.
     */
    public static int totalTransit(EventCatalog catalog, CompatibilityOracle oracle, SelectionAssignment assignment) {
        requireMatchingSize(catalog, assignment);
        int total = 0;
        EventOccurrence previous = null;
        for (int i = 0; i < catalog.size(); i++) {
            if (!assignment.isSelected(i)) {
                continue;
            }
            EventOccurrence current = catalog.get(i);
            if (previous != null) {
                total += oracle.attributedTransitMinutes(previous, current);
            }
            previous = current;
        }
        return total;
    }

    /**
     * Fails when any attended pair is infeasible.
     *
     * @throws PlannerException with {@link ScheduleOptimizer#REASON_VERIFICATION_FAILED}.
     */
    public void verify(EventCatalog catalog, SelectionAssignment assignment) {
        List<Violation> violations = violations(catalog, assignment);
        if (!violations.isEmpty()) {
            Violation first = violations.get(0);
            throw new PlannerException(
                    ScheduleOptimizer.REASON_VERIFICATION_FAILED,
                    violations.size() + " infeasible attended pair(s), first: "
                            + describe(catalog, first.earlierIndex()) + " / " + describe(catalog, first.laterIndex())
            );
        }
    }

    private static String describe(EventCatalog catalog, int index) {
        EventOccurrence occurrence = catalog.get(index);
        return "#" + index + " \"" + occurrence.getTitle() + "\" " + occurrence.getStart() + " @ " + occurrence.getVenue();
    }

    private static void requireMatchingSize(EventCatalog catalog, SelectionAssignment assignment) {
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(assignment, "assignment");
        if (catalog.size() != assignment.size()) {
            throw new IllegalArgumentException(
                    "assignment size " + assignment.size() + " != catalog size " + catalog.size()
            );
        }
    }
}
