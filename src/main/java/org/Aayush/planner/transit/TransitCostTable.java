package org.Aayush.planner.transit;

import org.Aayush.core.id.IDMapper;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable venue-to-venue transit time lookup, in whole minutes.
 *
 * <p>The table is stored as a dense square matrix over venue indices assigned in
 * registration order. Every distinct venue pair must have a cost, entries must agree in
 * both directions, and the diagonal holds the fixed same-venue repositioning time. The
 * triangle inequality is not required and is not checked.</p>
 *
 * <p>Thread Safety: immutable after construction, safe for concurrent reads.</p>
 */
public final class TransitCostTable {
    public static final int DEFAULT_SAME_VENUE_MINUTES = 5;

    private final IDMapper venueIds;
    private final int[][] minutes;
    private final int sameVenueMinutes;

    private TransitCostTable(IDMapper venueIds, int[][] minutes, int sameVenueMinutes) {
        this.venueIds = venueIds;
        this.minutes = minutes;
        this.sameVenueMinutes = sameVenueMinutes;
    }

    /**
     * Returns transit minutes between two venue codes.
     *
     * @throws IDMapper.UnknownIDException when either venue is not in the table.
     */
    public int minutes(String fromVenue, String toVenue) {
        return minutes(venueIds.toInternal(fromVenue), venueIds.toInternal(toVenue));
    }

    /**
     * Returns transit minutes between two venue indices.
     */
    public int minutes(int fromVenueIndex, int toVenueIndex) {
        return minutes[fromVenueIndex][toVenueIndex];
    }

    /**
     * Resolves a venue code to its dense index.
     *
     * @throws IDMapper.UnknownIDException when the venue is not in the table.
     */
    public int venueIndex(String venue) {
        return venueIds.toInternal(venue);
    }

    public boolean containsVenue(String venue) {
        return venueIds.containsExternal(venue);
    }

    /**
     * Returns venue codes in index order.
     */
    public List<String> venues() {
        return venueIds.externalIds();
    }

    public int venueCount() {
        return venueIds.size();
    }

    public int sameVenueMinutes() {
        return sameVenueMinutes;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a table from an adjacency map of the form {@code from -> (to -> minutes)}.
     *
     * <p>Venues appearing only as inner keys are registered too, so a pair missing in both
     * directions is reported rather than silently ignored.</p>
     *
     * @param adjacency nested transit map.
     * @param sameVenueMinutes fixed cost between two occurrences at one venue.
     * @return validated immutable table.
     */
    public static TransitCostTable fromNestedMap(Map<String, Map<String, Integer>> adjacency, int sameVenueMinutes) {
        Objects.requireNonNull(adjacency, "adjacency");
        Builder builder = builder().sameVenueMinutes(sameVenueMinutes);
        for (Map.Entry<String, Map<String, Integer>> row : adjacency.entrySet()) {
            builder.venue(row.getKey());
            if (row.getValue() == null) {
                continue;
            }
            for (Map.Entry<String, Integer> cell : row.getValue().entrySet()) {
                Integer value = cell.getValue();
                if (value == null) {
                    throw new InfeasibleTransitTableException(
                            InfeasibleTransitTableException.REASON_MISSING_PAIR,
                            "null transit minutes for " + row.getKey() + " -> " + cell.getKey()
                    );
                }
                builder.cost(row.getKey(), cell.getKey(), value);
            }
        }
        return builder.build();
    }

    /**
     * Collects directed entries and validates them into a symmetric matrix on {@link #build()}.
     */
    public static final class Builder {
        private final LinkedHashSet<String> venues = new LinkedHashSet<>();
        private final Map<String, Map<String, Integer>> directed = new LinkedHashMap<>();
        private int sameVenueMinutes = DEFAULT_SAME_VENUE_MINUTES;

        private Builder() {
        }

        public Builder sameVenueMinutes(int minutes) {
            this.sameVenueMinutes = minutes;
            return this;
        }

        /**
         * Registers a venue without adding any cost entry.
         */
        public Builder venue(String venue) {
            venues.add(requireVenue(venue));
            return this;
        }

        /**
         * Adds one directed entry. The reverse direction may be omitted; when both are
         * present they must agree.
         */
        public Builder cost(String fromVenue, String toVenue, int minutes) {
            String from = requireVenue(fromVenue);
            String to = requireVenue(toVenue);
            venues.add(from);
            venues.add(to);
            directed.computeIfAbsent(from, ignored -> new LinkedHashMap<>()).put(to, minutes);
            return this;
        }

        /**
         * Adds the same cost in both directions.
         */
        public Builder symmetricCost(String venueA, String venueB, int minutes) {
            return cost(venueA, venueB, minutes).cost(venueB, venueA, minutes);
        }

        /**
         * Validates all entries and freezes the table.
         *
         * @throws InfeasibleTransitTableException on a missing, negative, self or asymmetric entry.
         */
        public TransitCostTable build() {
            if (venues.isEmpty()) {
                throw new InfeasibleTransitTableException(
                        InfeasibleTransitTableException.REASON_EMPTY_TABLE,
                        "transit table must reference at least one venue"
                );
            }
            if (sameVenueMinutes < 0) {
                throw new InfeasibleTransitTableException(
                        InfeasibleTransitTableException.REASON_NEGATIVE_COST,
                        "same-venue minutes must be >= 0, got " + sameVenueMinutes
                );
            }
            IDMapper venueIds = IDMapper.createImmutable(venues);
            int n = venueIds.size();
            int[][] matrix = new int[n][n];
            for (int a = 0; a < n; a++) {
                String from = venueIds.toExternal(a);
                matrix[a][a] = sameVenueMinutes;
                for (int b = a + 1; b < n; b++) {
                    String to = venueIds.toExternal(b);
                    int cost = resolvePair(from, to);
                    matrix[a][b] = cost;
                    matrix[b][a] = cost;
                }
            }
            for (Map.Entry<String, Map<String, Integer>> row : directed.entrySet()) {
                if (row.getValue().containsKey(row.getKey())) {
                    throw new InfeasibleTransitTableException(
                            InfeasibleTransitTableException.REASON_SELF_ROUTE,
                            "explicit same-venue entry for " + row.getKey()
                                    + "; use sameVenueMinutes instead"
                    );
                }
            }
            return new TransitCostTable(venueIds, matrix, sameVenueMinutes);
        }

        private int resolvePair(String from, String to) {
            Integer forward = lookup(from, to);
            Integer backward = lookup(to, from);
            if (forward == null && backward == null) {
                throw new InfeasibleTransitTableException(
                        InfeasibleTransitTableException.REASON_MISSING_PAIR,
                        "no transit minutes between " + from + " and " + to
                );
            }
            if (forward != null && backward != null && !forward.equals(backward)) {
                throw new InfeasibleTransitTableException(
                        InfeasibleTransitTableException.REASON_ASYMMETRIC_PAIR,
                        "transit minutes differ: " + from + " -> " + to + " = " + forward
                                + ", " + to + " -> " + from + " = " + backward
                );
            }
            int cost = forward != null ? forward : backward;
            if (cost < 0) {
                throw new InfeasibleTransitTableException(
                        InfeasibleTransitTableException.REASON_NEGATIVE_COST,
                        "transit minutes must be >= 0 between " + from + " and " + to + ", got " + cost
                );
            }
            return cost;
        }

        private Integer lookup(String from, String to) {
            Map<String, Integer> row = directed.get(from);
            return row == null ? null : row.get(to);
        }

        private static String requireVenue(String venue) {
            if (venue == null || venue.isBlank()) {
                throw new InfeasibleTransitTableException(
                        InfeasibleTransitTableException.REASON_VENUE_REQUIRED,
                        "venue code must be non-blank"
                );
            }
            return venue.trim();
        }
    }
}
