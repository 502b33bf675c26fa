package org.Aayush.planner.solver;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Execution counters for one solve.
 */
@Value
@Builder
public class SolverStats {
    /** Nodes visited by the attendance pass. */
    long attendanceNodes;
    /** Nodes visited by the transit pass. */
    long transitNodes;
    /** Number of subtrees the search space was split into. */
    int subtrees;
    /** Worker threads used. */
    int parallelism;
    Duration elapsed;

    public long totalNodes() {
        return attendanceNodes + transitNodes;
    }
}
