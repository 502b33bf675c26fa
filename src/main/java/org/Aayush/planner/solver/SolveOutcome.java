package org.Aayush.planner.solver;

import lombok.Builder;
import lombok.Value;

/**
 * Final assignment of a solve with both objective values.
 */
@Value
@Builder
public class SolveOutcome {
    SelectionAssignment assignment;
    int attendance;
    int totalTransit;
    TerminationReason terminationReason;
    SolverStats stats;

    /**
     * True when both passes completed, so no feasible assignment beats this one.
     */
    public boolean isOptimal() {
        return terminationReason.isOptimal();
    }
}
