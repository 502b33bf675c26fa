package org.Aayush.planner.testutil;

import org.Aayush.core.time.TimeUtils;
import org.Aayush.planner.catalog.EventCatalog;
import org.Aayush.planner.solver.SelectionModel;
import org.Aayush.planner.transit.TransitCostTable;

import java.time.LocalDateTime;
import java.util.Random;

/**
 * Shared fixtures for planner tests.
 */
public final class PlannerFixtureFactory {
    public static final int SAME_VENUE_MINUTES = 5;
    public static final String[] VENUES = {"A", "B", "C", "D"};

    private PlannerFixtureFactory() {
    }

    /**
     * Four venues; A-B 30, A-C 10, A-D 20, B-C 15, B-D 25, C-D 5; same venue 5.
     */
    public static TransitCostTable fourVenueTable() {
        return TransitCostTable.builder()
                .sameVenueMinutes(SAME_VENUE_MINUTES)
                .symmetricCost("A", "B", 30)
                .symmetricCost("A", "C", 10)
                .symmetricCost("A", "D", 20)
                .symmetricCost("B", "C", 15)
                .symmetricCost("B", "D", 25)
                .symmetricCost("C", "D", 5)
                .build();
    }

    public static LocalDateTime at(String text) {
        return TimeUtils.parseTimestamp(text);
    }

    /**
     * Random catalog over {@link #fourVenueTable()} spread across two days.
     *
     * <p>Titles are drawn from a small pool so duplicate showings occur.</p>
     */
    public static EventCatalog randomCatalog(Random random, int size, TransitCostTable table) {
        EventCatalog.Builder builder = EventCatalog.builder(table);
        LocalDateTime dayOne = at("2022-08-13 10:00");
        for (int i = 0; i < size; i++) {
            LocalDateTime start = dayOne
                    .plusDays(random.nextInt(2))
                    .plusMinutes(15L * random.nextInt(40));
            builder.add(
                    "T" + random.nextInt(Math.max(1, size - 2)),
                    start,
                    30 + random.nextInt(90),
                    VENUES[random.nextInt(VENUES.length)]
            );
        }
        return builder.build();
    }

    /**
     * Random model with the given compatibility density and costs in {@code [0, maxCost]}.
     */
    public static SelectionModel randomModel(Random random, int size, double density, int maxCost) {
        boolean[][] compatible = new boolean[size][size];
        int[][] cost = new int[size][size];
        for (int i = 0; i < size; i++) {
            for (int j = i + 1; j < size; j++) {
                compatible[i][j] = random.nextDouble() < density;
                cost[i][j] = random.nextInt(maxCost + 1);
            }
        }
        return SelectionModel.of(compatible, cost);
    }
}
