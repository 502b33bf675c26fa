package org.Aayush.planner.core;

import lombok.Builder;
import lombok.Value;
import org.Aayush.planner.solver.BranchAndBoundSolver;
import org.Aayush.planner.solver.SolverBudget;

import java.time.Duration;

/**
 * Runtime configuration bound once when an optimizer is built.
 */
@Value
@Builder
public class OptimizerRuntimeConfig {
    public static final String PROP_PARALLELISM = "planner.solver.parallelism";
    public static final String PROP_MAX_SEARCH_NODES = "planner.solver.maxSearchNodes";
    public static final String PROP_DEADLINE_MILLIS = "planner.solver.deadlineMillis";

    /**
     * Worker threads for the default solver; clamped by {@link #effectiveParallelism()}.
     */
    @Builder.Default
    int parallelism = 1;

    /**
     * Node cap across both passes; {@code <= 0} for none.
     */
    long maxSearchNodes;

    /**
     * Wall-clock cap per run; null or non-positive for none.
     */
    Duration deadline;

    /**
     * Re-check every selected pair after solving.
     */
    @Builder.Default
    boolean verifyResult = true;

    /**
     * Returns a config with no limits and a single worker.
     */
    public static OptimizerRuntimeConfig exact() {
        return OptimizerRuntimeConfig.builder().build();
    }

    /**
     * Loads values from system properties, falling back to {@link #exact()} per field.
     */
    public static OptimizerRuntimeConfig defaults() {
        long deadlineMillis = readLong(PROP_DEADLINE_MILLIS, 0L);
        return OptimizerRuntimeConfig.builder()
                .parallelism((int) Math.max(1L, Math.min(Integer.MAX_VALUE, readLong(PROP_PARALLELISM, 1L))))
                .maxSearchNodes(readLong(PROP_MAX_SEARCH_NODES, 0L))
                .deadline(deadlineMillis > 0L ? Duration.ofMillis(deadlineMillis) : null)
                .build();
    }

    /**
     * Effective worker count, clamped to {@code [1, BranchAndBoundSolver.MAX_PARALLELISM]}.
     */
    public int effectiveParallelism() {
        return Math.max(1, Math.min(BranchAndBoundSolver.MAX_PARALLELISM, parallelism));
    }

    /**
     * Converts the limits into a solver budget.
     */
    public SolverBudget toBudget() {
        return SolverBudget.of(maxSearchNodes, deadline);
    }

    private static long readLong(String property, long fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
