package org.Aayush.planner.core;

import org.Aayush.core.time.TimeUtils;
import org.Aayush.planner.catalog.EventCatalog;
import org.Aayush.planner.catalog.EventOccurrence;
import org.Aayush.planner.compat.CompatibilityOracle;
import org.Aayush.planner.solver.SelectionAssignment;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives per-entry transit and downtime from a final assignment.
 */
final class ScheduleAnnotator {
    private final CompatibilityOracle oracle;

    ScheduleAnnotator(CompatibilityOracle oracle) {
        this.oracle = oracle;
    }

    List<ScheduledOccurrence> annotate(EventCatalog catalog, SelectionAssignment assignment) {
        List<ScheduledOccurrence> entries = new ArrayList<>(assignment.attendance());
        EventOccurrence previous = null;
        for (int i = 0; i < catalog.size(); i++) {
            if (!assignment.isSelected(i)) {
                continue;
            }
            EventOccurrence current = catalog.get(i);
            ScheduledOccurrence.ScheduledOccurrenceBuilder entry = ScheduledOccurrence.builder()
                    .catalogIndex(i)
                    .occurrence(current);
            if (previous != null && TimeUtils.sameCalendarDay(previous.getStart(), current.getStart())) {
                int transit = oracle.transitMinutes(previous, current);
                long gap = TimeUtils.minutesBetween(previous.getEnd(), current.getStart());
                entry.transitMinutes(transit)
                        .downtimeMinutes((int) (gap - transit))
                        .venueChanged(!previous.getVenue().equals(current.getVenue()));
            }
            entries.add(entry.build());
            previous = current;
        }
        return entries;
    }
}
