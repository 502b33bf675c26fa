package org.Aayush.planner.solver;

import lombok.Builder;
import lombok.Value;

/**
 * Incumbent state reported whenever a search improves its best solution.
 */
@Value
@Builder
public class ProgressSnapshot {
    SearchPhase phase;
    SelectionAssignment assignment;
    int attendance;
    int totalTransit;
    /** Nodes explored across both passes when the improvement was found. */
    long nodesExplored;
}
