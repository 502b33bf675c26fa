package org.Aayush.planner.solver;

/**
 * The two lexicographic passes of a solve.
 */
public enum SearchPhase {
    MAXIMIZE_ATTENDANCE,
    MINIMIZE_TRANSIT
}
