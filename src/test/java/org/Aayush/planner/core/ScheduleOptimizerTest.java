package org.Aayush.planner.core;

import org.Aayush.app.SampleProgramme;
import org.Aayush.planner.catalog.EventCatalog;
import org.Aayush.planner.catalog.EventListing;
import org.Aayush.planner.solver.BranchAndBoundSolver;
import org.Aayush.planner.solver.ProgressListener;
import org.Aayush.planner.solver.ProgressSnapshot;
import org.Aayush.planner.solver.ScheduleSolver;
import org.Aayush.planner.solver.SelectionAssignment;
import org.Aayush.planner.solver.SelectionModel;
import org.Aayush.planner.solver.SolveOutcome;
import org.Aayush.planner.solver.SolverBudget;
import org.Aayush.planner.solver.SolverStats;
import org.Aayush.planner.solver.TerminationReason;
import org.Aayush.planner.testutil.PlannerFixtureFactory;
import org.Aayush.planner.transit.TransitCostTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.Aayush.planner.testutil.PlannerFixtureFactory.at;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("ScheduleOptimizer Tests")
class ScheduleOptimizerTest {

    private final TransitCostTable table = PlannerFixtureFactory.fourVenueTable();

    private ScheduleOptimizer exactOptimizer() {
        return ScheduleOptimizer.builder()
                .transitTable(table)
                .runtimeConfig(OptimizerRuntimeConfig.exact())
                .build();
    }

    @Test
    @DisplayName("Back-to-back showings at one venue are all attended")
    void testSameVenueChain() {
        EventCatalog catalog = EventCatalog.builder(table)
                .add("First", at("2022-08-13 10:00"), 60, "A")
                .add("Second", at("2022-08-13 11:05"), 55, "A")
                .add("Third", at("2022-08-13 12:30"), 60, "A")
                .build();

        ScheduleResult result = exactOptimizer().optimize(catalog);

        assertEquals(3, result.getAttendance());
        assertEquals(10, result.getTotalTransitMinutes());
        assertTrue(result.isOptimal());
        assertEquals(TerminationReason.OPTIMAL, result.getTerminationReason());
        assertEquals(BranchAndBoundSolver.ID, result.getSolverId());

        List<ScheduledOccurrence> entries = result.getEntries();
        assertFalse(entries.get(0).hasTransition());
        assertNull(entries.get(0).getTransitMinutes());
        assertNull(entries.get(0).getDowntimeMinutes());
        assertEquals(5, entries.get(1).getTransitMinutes());
        assertEquals(0, entries.get(1).getDowntimeMinutes());
        assertFalse(entries.get(1).isVenueChanged());
        assertEquals(5, entries.get(2).getTransitMinutes());
        assertEquals(25, entries.get(2).getDowntimeMinutes());
    }

    @Test
    @DisplayName("Among equal attendance the cheaper duplicate showing is chosen")
    void testDuplicateShowingPrefersLowerTransit() {
        EventCatalog catalog = EventCatalog.builder(table)
                .add("X", at("2022-08-13 10:00"), 60, "A")
                .add("Dup", at("2022-08-13 12:00"), 60, "B")
                .add("Dup", at("2022-08-13 14:00"), 60, "A")
                .build();

        ScheduleResult result = exactOptimizer().optimize(catalog);

        assertEquals(2, result.getAttendance());
        assertEquals(5, result.getTotalTransitMinutes());
        assertEquals(SelectionAssignment.ofIndices(3, 0, 2), result.getAssignment());
        assertEquals("A", result.getEntries().get(1).getVenue());
    }

    @Test
    @DisplayName("Insufficient transit leaves one showing; the earlier index wins the tie")
    void testInfeasiblePairTieBreak() {
        EventCatalog catalog = EventCatalog.builder(table)
                .add("Near", at("2022-08-13 10:00"), 60, "A")
                .add("Far", at("2022-08-13 11:20"), 60, "B")
                .build();

        ScheduleResult result = exactOptimizer().optimize(catalog);

        assertEquals(1, result.getAttendance());
        assertEquals(0, result.getTotalTransitMinutes());
        assertEquals(0, result.getEntries().get(0).getCatalogIndex());
        assertEquals("Near", result.getEntries().get(0).getTitle());
    }

    @Test
    @DisplayName("Empty catalog yields an empty optimal schedule")
    void testEmptyCatalog() {
        ScheduleResult result = exactOptimizer().optimize(EventCatalog.empty(table));
        assertEquals(0, result.getAttendance());
        assertEquals(0, result.getTotalTransitMinutes());
        assertTrue(result.getEntries().isEmpty());
        assertTrue(result.isOptimal());
    }

    @Test
    @DisplayName("Transitions across midnight cost nothing and carry no annotation")
    void testCrossDayTransition() {
        EventCatalog catalog = EventCatalog.builder(table)
                .add("Late", at("2022-08-13 22:00"), 90, "A")
                .add("Morning", at("2022-08-14 10:00"), 60, "B")
                .build();

        ScheduleResult result = exactOptimizer().optimize(catalog);

        assertEquals(2, result.getAttendance());
        assertEquals(0, result.getTotalTransitMinutes());
        ScheduledOccurrence morning = result.getEntries().get(1);
        assertFalse(morning.hasTransition());
        assertNull(morning.getDowntimeMinutes());
        assertFalse(morning.isVenueChanged());
    }

    @Test
    @DisplayName("Venue changes are flagged on same-day transitions")
    void testVenueChangedAnnotation() {
        EventCatalog catalog = EventCatalog.builder(table)
                .add("P", at("2022-08-13 10:00"), 60, "A")
                .add("Q", at("2022-08-13 11:30"), 60, "C")
                .build();

        ScheduledOccurrence second = exactOptimizer().optimize(catalog).getEntries().get(1);
        assertTrue(second.isVenueChanged());
        assertEquals(10, second.getTransitMinutes());
        assertEquals(20, second.getDowntimeMinutes());
    }

    @Test
    @DisplayName("Listings are expanded before solving")
    void testOptimizeListings() {
        List<EventListing> listings = List.of(
                EventListing.builder()
                        .title("Solo")
                        .runningMinutes(60)
                        .showing(new EventListing.Showing("2022-08-13 10:00", "A"))
                        .build(),
                EventListing.builder()
                        .title("Twice")
                        .runningMinutes(60)
                        .showing(new EventListing.Showing("2022-08-13 10:30", "B"))
                        .showing(new EventListing.Showing("2022-08-13 11:10", "C"))
                        .build()
        );

        ScheduleResult result = exactOptimizer().optimize(listings);

        assertEquals(2, result.getAttendance());
        assertEquals(10, result.getTotalTransitMinutes());
        assertEquals("C", result.getEntries().get(1).getVenue());
    }

    @Test
    @DisplayName("Missing or foreign catalogs are rejected with reason codes")
    void testCatalogValidation() {
        ScheduleOptimizer optimizer = exactOptimizer();
        PlannerException missing = assertThrows(PlannerException.class, () -> optimizer.optimize((EventCatalog) null));
        assertEquals(ScheduleOptimizer.REASON_CATALOG_REQUIRED, missing.getReasonCode());

        EventCatalog foreign = EventCatalog.empty(PlannerFixtureFactory.fourVenueTable());
        PlannerException mismatch = assertThrows(PlannerException.class, () -> optimizer.optimize(foreign));
        assertEquals(ScheduleOptimizer.REASON_TABLE_MISMATCH, mismatch.getReasonCode());
        assertTrue(mismatch.getMessage().startsWith("[" + ScheduleOptimizer.REASON_TABLE_MISMATCH + "]"));
    }

    @Test
    @DisplayName("An infeasible solver answer fails verification")
    void testVerificationCatchesRogueSolver() {
        EventCatalog catalog = EventCatalog.builder(table)
                .add("P", at("2022-08-13 10:00"), 60, "A")
                .add("Q", at("2022-08-13 10:30"), 60, "B")
                .build();
        ScheduleSolver rogue = new FixedSolver(SelectionAssignment.ofIndices(2, 0, 1), 30);

        ScheduleOptimizer optimizer = ScheduleOptimizer.builder()
                .transitTable(table)
                .runtimeConfig(OptimizerRuntimeConfig.exact())
                .solver(rogue)
                .build();

        PlannerException ex = assertThrows(PlannerException.class, () -> optimizer.optimize(catalog));
        assertEquals(ScheduleOptimizer.REASON_VERIFICATION_FAILED, ex.getReasonCode());
    }

    @Test
    @DisplayName("A misreported transit total fails verification")
    void testVerificationCatchesWrongTransit() {
        EventCatalog catalog = EventCatalog.builder(table)
                .add("P", at("2022-08-13 10:00"), 60, "A")
                .add("Q", at("2022-08-13 12:00"), 60, "B")
                .build();
        ScheduleOptimizer optimizer = ScheduleOptimizer.builder()
                .transitTable(table)
                .runtimeConfig(OptimizerRuntimeConfig.exact())
                .solver(new FixedSolver(SelectionAssignment.ofIndices(2, 0, 1), 0))
                .build();

        PlannerException ex = assertThrows(PlannerException.class, () -> optimizer.optimize(catalog));
        assertEquals(ScheduleOptimizer.REASON_VERIFICATION_FAILED, ex.getReasonCode());
    }

    @Test
    @DisplayName("Backend failures are wrapped with a search reason code")
    void testSolverFailureWrapped() {
        ScheduleSolver failing = new ScheduleSolver() {
            @Override
            public String id() {
                return "FAILING";
            }

            @Override
            public SolveOutcome solve(
                    SelectionModel model,
                    SolverBudget budget,
                    ProgressListener listener
            ) {
                throw new SolverExecutionException("BACKEND_DOWN", "backend unavailable", null);
            }
        };
        ScheduleOptimizer optimizer = ScheduleOptimizer.builder()
                .transitTable(table)
                .runtimeConfig(OptimizerRuntimeConfig.exact())
                .solver(failing)
                .build();

        PlannerException ex = assertThrows(PlannerException.class, () -> optimizer.optimize(EventCatalog.empty(table)));
        assertEquals(ScheduleOptimizer.REASON_SEARCH_FAILED, ex.getReasonCode());
        assertTrue(ex.getMessage().contains("BACKEND_DOWN"));
        assertTrue(ex.getCause() instanceof ScheduleSolver.SolverExecutionException);
    }

    @Test
    @DisplayName("Bundled programme: parallel equals sequential and repeated runs agree")
    void testSampleProgrammeDeterminism() {
        TransitCostTable sampleTable = SampleProgramme.transitTable();
        EventCatalog catalog = EventCatalog.fromListings(SampleProgramme.listings(), sampleTable);

        ScheduleOptimizer sequential = ScheduleOptimizer.builder()
                .transitTable(sampleTable)
                .runtimeConfig(OptimizerRuntimeConfig.exact())
                .build();
        ScheduleOptimizer parallel = ScheduleOptimizer.builder()
                .transitTable(sampleTable)
                .runtimeConfig(OptimizerRuntimeConfig.builder().parallelism(4).build())
                .build();

        ScheduleResult first = sequential.optimize(catalog);
        ScheduleResult second = sequential.optimize(catalog);
        ScheduleResult concurrent = parallel.optimize(catalog);

        assertEquals(31, catalog.size());
        assertTrue(first.isOptimal());
        assertEquals(19, first.getAttendance());
        assertEquals(110, first.getTotalTransitMinutes());
        assertTrue(concurrent.isOptimal());
        assertEquals(first.getAssignment(), second.getAssignment());
        assertEquals(first.getAssignment(), concurrent.getAssignment());
        assertEquals(first.getTotalTransitMinutes(), concurrent.getTotalTransitMinutes());

        Set<String> titles = new HashSet<>();
        for (ScheduledOccurrence entry : first.getEntries()) {
            assertTrue(titles.add(entry.getTitle()), "title attended twice: " + entry.getTitle());
        }
        assertTrue(new ScheduleVerifier(sequential.oracle()).violations(catalog, first.getAssignment()).isEmpty());
    }

    @Test
    @DisplayName("A failing progress listener does not change the result")
    void testThrowingListenerIsIsolated() {
        EventCatalog catalog = EventCatalog.builder(table)
                .add("P", at("2022-08-13 10:00"), 60, "A")
                .add("Q", at("2022-08-13 11:10"), 60, "C")
                .add("R", at("2022-08-13 12:20"), 60, "D")
                .add("S", at("2022-08-13 13:30"), 60, "D")
                .build();
        ScheduleResult expected = exactOptimizer().optimize(catalog);

        for (int parallelism : new int[]{1, 4}) {
            ScheduleOptimizer optimizer = ScheduleOptimizer.builder()
                    .transitTable(table)
                    .runtimeConfig(OptimizerRuntimeConfig.builder().parallelism(parallelism).build())
                    .progressListener(snapshot -> {
                        throw new IllegalStateException("listener failure");
                    })
                    .build();

            ScheduleResult result = optimizer.optimize(catalog);

            assertTrue(result.isOptimal(), "parallelism " + parallelism);
            assertEquals(4, result.getAttendance(), "parallelism " + parallelism);
            assertEquals(expected.getAssignment(), result.getAssignment(), "parallelism " + parallelism);
            assertEquals(expected.getTotalTransitMinutes(), result.getTotalTransitMinutes());
        }
    }

    @Test
    @DisplayName("Node limit yields a feasible non-optimal result instead of failing")
    void testBudgetedRun() {
        TransitCostTable sampleTable = SampleProgramme.transitTable();
        List<ProgressSnapshot> snapshots = new ArrayList<>();
        ScheduleOptimizer optimizer = ScheduleOptimizer.builder()
                .transitTable(sampleTable)
                .runtimeConfig(OptimizerRuntimeConfig.builder().maxSearchNodes(50).build())
                .progressListener(snapshots::add)
                .build();

        ScheduleResult result = optimizer.optimize(SampleProgramme.listings());

        assertFalse(result.isOptimal());
        assertEquals(TerminationReason.NODE_BUDGET_EXHAUSTED, result.getTerminationReason());
        assertEquals(result.getAttendance(), result.getEntries().size());
        assertTrue(result.getStats().totalNodes() <= 50L);
        assertFalse(snapshots.isEmpty());
    }

    @Test
    @DisplayName("Deadline configuration reaches the solver budget")
    void testDeadlineConfig() {
        OptimizerRuntimeConfig config = OptimizerRuntimeConfig.builder()
                .deadline(Duration.ofMinutes(1))
                .build();
        assertTrue(config.toBudget().isBounded());
        assertFalse(OptimizerRuntimeConfig.exact().toBudget().isBounded());
    }

    private static final class FixedSolver implements ScheduleSolver {
        private final SelectionAssignment assignment;
        private final int reportedTransit;

        private FixedSolver(SelectionAssignment assignment, int reportedTransit) {
            this.assignment = assignment;
            this.reportedTransit = reportedTransit;
        }

        @Override
        public String id() {
            return "FIXED";
        }

        @Override
        public SolveOutcome solve(
                SelectionModel model,
                SolverBudget budget,
                ProgressListener listener
        ) {
            return SolveOutcome.builder()
                    .assignment(assignment)
                    .attendance(assignment.attendance())
                    .totalTransit(reportedTransit)
                    .terminationReason(TerminationReason.OPTIMAL)
                    .stats(SolverStats.builder().parallelism(1).elapsed(Duration.ZERO).build())
                    .build();
        }
    }
}
