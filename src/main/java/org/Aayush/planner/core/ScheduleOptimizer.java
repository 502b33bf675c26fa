package org.Aayush.planner.core;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.planner.catalog.EventCatalog;
import org.Aayush.planner.catalog.EventListing;
import org.Aayush.planner.compat.CompatibilityOracle;
import org.Aayush.planner.solver.BranchAndBoundSolver;
import org.Aayush.planner.solver.ProgressListener;
import org.Aayush.planner.solver.ScheduleSolver;
import org.Aayush.planner.solver.SelectionModel;
import org.Aayush.planner.solver.SolveOutcome;
import org.Aayush.planner.solver.SolverBudget;
import org.Aayush.planner.transit.TransitCostTable;

import java.util.Collection;
import java.util.Objects;

/**
 * Main scheduling entry point.
 *
 * <p>Selects the largest set of occurrences one attendee can reach, then, among sets of
 * that size, the one with the least same-day transit. Execution flow:</p>
 * <ul>
 * <li>Check the catalog is bound to this optimizer's transit table.</li>
 * <li>Evaluate pairwise compatibility for every pair into a {@link SelectionModel}.</li>
 * <li>Delegate both passes to the configured {@link ScheduleSolver}.</li>
 * <li>Re-check every attended pair against the catalog.</li>
 * <li>Annotate the attended occurrences with transit and downtime.</li>
 * </ul>
 *
 * <p>The optimizer holds no mutable state; one instance may serve concurrent runs.</p>
 */
@Slf4j
public final class ScheduleOptimizer {
    public static final String REASON_CATALOG_REQUIRED = "OPTIMIZER_CATALOG_REQUIRED";
    public static final String REASON_TABLE_MISMATCH = "OPTIMIZER_TABLE_MISMATCH";
    public static final String REASON_VERIFICATION_FAILED = "OPTIMIZER_VERIFICATION_FAILED";
    public static final String REASON_SEARCH_FAILED = "OPTIMIZER_SEARCH_FAILED";

    private final TransitCostTable transitTable;
    private final CompatibilityOracle oracle;
    private final ScheduleSolver solver;
    private final SolverBudget budget;
    private final ProgressListener progressListener;
    private final boolean verifyResult;
    private final ScheduleVerifier verifier;
    private final ScheduleAnnotator annotator;

    /**
     * Creates an optimizer bound to one transit table.
     *
     * @param transitTable venue transit times shared by every run.
     * @param runtimeConfig limits and parallelism; {@link OptimizerRuntimeConfig#defaults()} when null.
     * @param solver backend override; a {@link BranchAndBoundSolver} when null.
     * @param progressListener optional incumbent observer.
     */
    @Builder
    public ScheduleOptimizer(
            TransitCostTable transitTable,
            OptimizerRuntimeConfig runtimeConfig,
            ScheduleSolver solver,
            ProgressListener progressListener
    ) {
        this.transitTable = Objects.requireNonNull(transitTable, "transitTable");
        OptimizerRuntimeConfig config = runtimeConfig == null ? OptimizerRuntimeConfig.defaults() : runtimeConfig;
        this.oracle = new CompatibilityOracle(transitTable);
        this.solver = solver == null ? new BranchAndBoundSolver(config.effectiveParallelism()) : solver;
        this.budget = config.toBudget();
        this.progressListener = progressListener == null ? ProgressListener.NONE : progressListener;
        this.verifyResult = config.isVerifyResult();
        this.verifier = new ScheduleVerifier(oracle);
        this.annotator = new ScheduleAnnotator(oracle);
    }

    /**
     * Builds a catalog from listings and optimizes it.
     *
     * @throws org.Aayush.planner.catalog.MalformedEventException when a listing is invalid.
     */
    public ScheduleResult optimize(Collection<EventListing> listings) {
        return optimize(EventCatalog.fromListings(listings, transitTable));
    }

    /**
     * Computes the optimal schedule for one catalog.
     *
     * @param catalog occurrences bound to this optimizer's transit table.
     * @return attended occurrences with objective values; flagged non-optimal when a limit was hit.
     * @throws PlannerException when the catalog is missing or foreign, or the backend fails.
     */
    public ScheduleResult optimize(EventCatalog catalog) {
        if (catalog == null) {
            throw new PlannerException(REASON_CATALOG_REQUIRED, "catalog must be provided");
        }
        if (catalog.transitTable() != transitTable) {
            throw new PlannerException(
                    REASON_TABLE_MISMATCH,
                    "catalog was validated against a different transit table"
            );
        }
        log.info("optimizing {} occurrence(s) with {}", catalog.size(), solver.id());

        SelectionModel model = SelectionModel.build(catalog, oracle);
        SolveOutcome outcome;
        try {
            outcome = solver.solve(model, budget, progressListener);
        } catch (ScheduleSolver.SolverExecutionException ex) {
            throw new PlannerException(
                    REASON_SEARCH_FAILED,
                    ex.reasonCode() + ": " + ex.getMessage(),
                    ex
            );
        }

        if (verifyResult) {
            verifier.verify(catalog, outcome.getAssignment());
            int replayed = ScheduleVerifier.totalTransit(catalog, oracle, outcome.getAssignment());
            if (replayed != outcome.getTotalTransit()) {
                throw new PlannerException(
                        REASON_VERIFICATION_FAILED,
                        "solver reported transit " + outcome.getTotalTransit() + " but schedule replays to " + replayed
                );
            }
        }

        if (!outcome.isOptimal()) {
            log.warn(
                    "search stopped early ({}); returning best known schedule: attendance={}, transit={}",
                    outcome.getTerminationReason(),
                    outcome.getAttendance(),
                    outcome.getTotalTransit()
            );
        }
        log.info(
                "schedule ready: attendance={}, transit={}m, optimal={}, nodes={}, elapsed={}ms",
                outcome.getAttendance(),
                outcome.getTotalTransit(),
                outcome.isOptimal(),
                outcome.getStats().totalNodes(),
                outcome.getStats().getElapsed().toMillis()
        );

        return ScheduleResult.builder()
                .entries(annotator.annotate(catalog, outcome.getAssignment()))
                .attendance(outcome.getAttendance())
                .totalTransitMinutes(outcome.getTotalTransit())
                .optimal(outcome.isOptimal())
                .terminationReason(outcome.getTerminationReason())
                .assignment(outcome.getAssignment())
                .solverId(solver.id())
                .stats(outcome.getStats())
                .build();
    }

    public TransitCostTable transitTable() {
        return transitTable;
    }

    /**
     * Exposes the pairwise oracle used for model construction and verification.
     */
    public CompatibilityOracle oracle() {
        return oracle;
    }
}
