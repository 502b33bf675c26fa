package org.Aayush.planner.solver;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-solve limits on explored nodes and wall-clock time.
 *
 * <p>Non-positive values mean unbounded. A solve that hits either limit returns its best
 * incumbent flagged as non-optimal instead of failing.</p>
 */
public final class SolverBudget {
    static final long UNBOUNDED = Long.MAX_VALUE;

    // deadline is sampled every this many nodes
    private static final int CLOCK_STRIDE = 256;

    private final long maxNodes;
    private final long deadlineNanos;

    private SolverBudget(long maxNodes, long deadlineNanos) {
        this.maxNodes = normalizeBound(maxNodes);
        this.deadlineNanos = normalizeBound(deadlineNanos);
    }

    /**
     * Creates a budget with explicit bounds.
     *
     * @param maxNodes node cap across both passes, {@code <= 0} for none.
     * @param deadline wall-clock cap, null or non-positive for none.
     */
    public static SolverBudget of(long maxNodes, Duration deadline) {
        long nanos = deadline == null ? 0L : saturatedNanos(deadline);
        return new SolverBudget(maxNodes, nanos);
    }

    public static SolverBudget unbounded() {
        return new SolverBudget(0L, 0L);
    }

    public boolean isBounded() {
        return maxNodes != UNBOUNDED || deadlineNanos != UNBOUNDED;
    }

    public long maxNodes() {
        return maxNodes;
    }

    /**
     * Starts the clock for one solve.
     */
    Tracker start() {
        long now = System.nanoTime();
        long deadlineAt = deadlineNanos == UNBOUNDED ? UNBOUNDED : saturatingAdd(now, deadlineNanos);
        return new Tracker(maxNodes, deadlineAt);
    }

    private static long normalizeBound(long bound) {
        if (bound <= 0L) {
            return UNBOUNDED;
        }
        return bound;
    }

    private static long saturatedNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException ex) {
            return UNBOUNDED;
        }
    }

    private static long saturatingAdd(long a, long b) {
        if (a >= Long.MAX_VALUE - b) {
            return Long.MAX_VALUE;
        }
        return a + b;
    }

    /**
     * Thread-safe node counter and deadline check shared by all workers of one solve.
     */
    static final class Tracker {
        private final long maxNodes;
        private final long deadlineAt;
        private final AtomicLong nodes = new AtomicLong();
        private volatile TerminationReason stopReason;
        private volatile boolean cancelled;

        private Tracker(long maxNodes, long deadlineAt) {
            this.maxNodes = maxNodes;
            this.deadlineAt = deadlineAt;
        }

        /**
         * Counts one node and returns false once the search must stop.
         */
        boolean admitNode() {
            if (stopReason != null || cancelled) {
                return false;
            }
            long count = nodes.incrementAndGet();
            if (count > maxNodes) {
                stop(TerminationReason.NODE_BUDGET_EXHAUSTED);
                return false;
            }
            if (deadlineAt != UNBOUNDED && count % CLOCK_STRIDE == 0 && System.nanoTime() - deadlineAt > 0) {
                stop(TerminationReason.DEADLINE_EXCEEDED);
                return false;
            }
            return true;
        }

        boolean stopped() {
            return stopReason != null || cancelled;
        }

        /**
         * Abandons the solve after a failure; remaining workers stop at their next node.
         */
        void cancel() {
            cancelled = true;
        }

        boolean cancelled() {
            return cancelled;
        }

        TerminationReason stopReason() {
            return stopReason;
        }

        long nodes() {
            // overshoot from concurrent increments after stop is not work done
            return Math.min(nodes.get(), maxNodes);
        }

        private synchronized void stop(TerminationReason reason) {
            if (stopReason == null) {
                stopReason = reason;
            }
        }
    }
}
