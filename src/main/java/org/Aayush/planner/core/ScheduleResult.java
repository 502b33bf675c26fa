package org.Aayush.planner.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.planner.solver.SelectionAssignment;
import org.Aayush.planner.solver.SolverStats;
import org.Aayush.planner.solver.TerminationReason;

import java.util.List;

/**
 * Start-ordered schedule produced by one optimization run.
 *
 * <p>When {@code optimal=false} a search limit was reached and the schedule is the best
 * feasible one found, not a proven optimum.</p>
 */
@Value
@Builder
public class ScheduleResult {
    /** Attended occurrences in start order. */
    @Singular
    List<ScheduledOccurrence> entries;
    /** Number of attended occurrences. */
    int attendance;
    /** Sum of same-date transit minutes between consecutive attended occurrences. */
    int totalTransitMinutes;
    /** Whether both passes completed. */
    boolean optimal;
    TerminationReason terminationReason;
    /** Raw decision per catalog index. */
    SelectionAssignment assignment;
    /** Backend that produced the assignment. */
    String solverId;
    SolverStats stats;
}
