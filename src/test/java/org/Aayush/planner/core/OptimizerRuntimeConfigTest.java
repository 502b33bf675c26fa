package org.Aayush.planner.core;

import org.Aayush.planner.catalog.EventCatalog;
import org.Aayush.planner.solver.BranchAndBoundSolver;
import org.Aayush.planner.testutil.PlannerFixtureFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("OptimizerRuntimeConfig Tests")
class OptimizerRuntimeConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(OptimizerRuntimeConfig.PROP_PARALLELISM);
        System.clearProperty(OptimizerRuntimeConfig.PROP_MAX_SEARCH_NODES);
        System.clearProperty(OptimizerRuntimeConfig.PROP_DEADLINE_MILLIS);
    }

    @Test
    @DisplayName("Exact config is unbounded, sequential and verifying")
    void testExact() {
        OptimizerRuntimeConfig config = OptimizerRuntimeConfig.exact();
        assertEquals(1, config.getParallelism());
        assertEquals(0L, config.getMaxSearchNodes());
        assertNull(config.getDeadline());
        assertTrue(config.isVerifyResult());
        assertFalse(config.toBudget().isBounded());
    }

    @Test
    @DisplayName("System properties populate the defaults")
    void testDefaultsFromSystemProperties() {
        System.setProperty(OptimizerRuntimeConfig.PROP_PARALLELISM, "3");
        System.setProperty(OptimizerRuntimeConfig.PROP_MAX_SEARCH_NODES, " 5000 ");
        System.setProperty(OptimizerRuntimeConfig.PROP_DEADLINE_MILLIS, "250");

        OptimizerRuntimeConfig config = OptimizerRuntimeConfig.defaults();

        assertEquals(3, config.effectiveParallelism());
        assertEquals(5000L, config.getMaxSearchNodes());
        assertEquals(Duration.ofMillis(250), config.getDeadline());
        assertEquals(5000L, config.toBudget().maxNodes());
    }

    @Test
    @DisplayName("Unparseable or out-of-range properties fall back")
    void testInvalidPropertiesFallBack() {
        System.setProperty(OptimizerRuntimeConfig.PROP_PARALLELISM, "-2");
        System.setProperty(OptimizerRuntimeConfig.PROP_MAX_SEARCH_NODES, "lots");
        System.setProperty(OptimizerRuntimeConfig.PROP_DEADLINE_MILLIS, "0");

        OptimizerRuntimeConfig config = OptimizerRuntimeConfig.defaults();

        assertEquals(1, config.effectiveParallelism());
        assertEquals(0L, config.getMaxSearchNodes());
        assertNull(config.getDeadline());
        assertFalse(config.toBudget().isBounded());
    }

    @Test
    @DisplayName("Parallelism is clamped to the supported range")
    void testParallelismClamp() {
        OptimizerRuntimeConfig config = OptimizerRuntimeConfig.builder().parallelism(0).build();
        assertEquals(1, config.effectiveParallelism());

        OptimizerRuntimeConfig huge = OptimizerRuntimeConfig.builder().parallelism(Integer.MAX_VALUE).build();
        assertEquals(BranchAndBoundSolver.MAX_PARALLELISM, huge.effectiveParallelism());
    }

    @Test
    @DisplayName("Oversized parallelism property still builds a working optimizer")
    void testOversizedParallelismProperty() {
        System.setProperty(OptimizerRuntimeConfig.PROP_PARALLELISM, String.valueOf(Long.MAX_VALUE));

        OptimizerRuntimeConfig config = OptimizerRuntimeConfig.defaults();

        assertEquals(BranchAndBoundSolver.MAX_PARALLELISM, config.effectiveParallelism());
        assertEquals(
                0,
                ScheduleOptimizer.builder()
                        .transitTable(PlannerFixtureFactory.fourVenueTable())
                        .runtimeConfig(config)
                        .build()
                        .optimize(EventCatalog.empty(PlannerFixtureFactory.fourVenueTable()))
                        .getAttendance()
        );
    }
}
