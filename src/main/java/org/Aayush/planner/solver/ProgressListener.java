package org.Aayush.planner.solver;

/**
 * Optional observer of incumbent improvements.
 *
 * <p>Calls are serialized by the solver, but may arrive from worker threads when the
 * search runs in parallel. Implementations must not block for long.</p>
 */
@FunctionalInterface
public interface ProgressListener {
    ProgressListener NONE = snapshot -> { };

    void onImprovement(ProgressSnapshot snapshot);
}
