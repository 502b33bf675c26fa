package org.Aayush.planner.solver;

/**
 * Why a search stopped.
 */
public enum TerminationReason {
    /** Both passes explored their whole space; the result is proven optimal. */
    OPTIMAL,
    /** The node cap was reached; the result is the best found so far. */
    NODE_BUDGET_EXHAUSTED,
    /** The deadline passed; the result is the best found so far. */
    DEADLINE_EXCEEDED;

    public boolean isOptimal() {
        return this == OPTIMAL;
    }
}
