package org.Aayush.planner.solver;

/**
 * Exact backend for the two-pass selection problem.
 *
 * <p>Implementations first maximize attendance, then minimize total transit among
 * assignments of that attendance. Ties must be broken deterministically.</p>
 */
public interface ScheduleSolver {

    /**
     * Stable backend identifier.
     */
    String id();

    /**
     * Solves one model.
     *
     * @param model decision model.
     * @param budget work and time limits; exhaustion yields a non-optimal outcome.
     * @param listener incumbent observer, never null.
     * @return best assignment found.
     * @throws SolverExecutionException when the backend itself fails.
     */
    SolveOutcome solve(SelectionModel model, SolverBudget budget, ProgressListener listener);

    /**
     * Backend failure used by the optimizer facade for reason-code mapping.
     */
    final class SolverExecutionException extends RuntimeException {
        private final String reasonCode;

        public SolverExecutionException(String reasonCode, String message, Throwable cause) {
            super(message, cause);
            this.reasonCode = reasonCode;
        }

        public String reasonCode() {
            return reasonCode;
        }
    }
}
