package org.Aayush.planner.solver;

import org.Aayush.planner.catalog.EventCatalog;
import org.Aayush.planner.catalog.EventOccurrence;
import org.Aayush.planner.compat.CompatibilityOracle;

import java.util.BitSet;
import java.util.Objects;

/**
 * Boolean decision model over catalog indices.
 *
 * <p>Holds the pairwise compatibility relation and the transit cost charged when one
 * index directly follows another among the selected ones. Indices are in catalog order;
 * the model knows nothing about titles, venues or times, so any exact backend can work
 * from it alone.</p>
 */
public final class SelectionModel {
    private final int size;
    // row i holds every j > i compatible with i
    private final BitSet[] compatibleAfter;
    private final int[][] transitCost;

    private SelectionModel(int size, BitSet[] compatibleAfter, int[][] transitCost) {
        this.size = size;
        this.compatibleAfter = compatibleAfter;
        this.transitCost = transitCost;
    }

    /**
     * Evaluates the oracle on every pair of a catalog.
     *
     * @param catalog start-ordered occurrences.
     * @param oracle pairwise feasibility and attributed transit.
     * @return decision model indexed like the catalog.
     */
    public static SelectionModel build(EventCatalog catalog, CompatibilityOracle oracle) {
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(oracle, "oracle");
        int n = catalog.size();
        BitSet[] compatibleAfter = new BitSet[n];
        int[][] transitCost = new int[n][n];
        for (int i = 0; i < n; i++) {
            EventOccurrence earlier = catalog.get(i);
            BitSet row = new BitSet(n);
            for (int j = i + 1; j < n; j++) {
                EventOccurrence later = catalog.get(j);
                if (oracle.pairFeasible(earlier, later)) {
                    row.set(j);
                }
                transitCost[i][j] = oracle.attributedTransitMinutes(earlier, later);
            }
            compatibleAfter[i] = row;
        }
        return new SelectionModel(n, compatibleAfter, transitCost);
    }

    /**
     * Creates a model from explicit matrices.
     *
     * <p>Only the upper triangle ({@code i < j}) of both matrices is read.</p>
     *
     * @param compatible {@code compatible[i][j]} for {@code i < j}.
     * @param transitCost non-negative cost when {@code j} directly follows {@code i}.
     */
    public static SelectionModel of(boolean[][] compatible, int[][] transitCost) {
        Objects.requireNonNull(compatible, "compatible");
        Objects.requireNonNull(transitCost, "transitCost");
        int n = compatible.length;
        if (transitCost.length != n) {
            throw new IllegalArgumentException("matrix sizes differ: " + n + " vs " + transitCost.length);
        }
        BitSet[] compatibleAfter = new BitSet[n];
        int[][] costs = new int[n][n];
        for (int i = 0; i < n; i++) {
            if (compatible[i].length != n || transitCost[i].length != n) {
                throw new IllegalArgumentException("row " + i + " is not of length " + n);
            }
            BitSet row = new BitSet(n);
            for (int j = i + 1; j < n; j++) {
                if (compatible[i][j]) {
                    row.set(j);
                }
                if (transitCost[i][j] < 0) {
                    throw new IllegalArgumentException("transit cost must be >= 0 at [" + i + "][" + j + "]");
                }
                costs[i][j] = transitCost[i][j];
            }
            compatibleAfter[i] = row;
        }
        return new SelectionModel(n, compatibleAfter, costs);
    }

    public int size() {
        return size;
    }

    /**
     * Returns whether two distinct indices may both be selected.
     */
    public boolean compatible(int a, int b) {
        if (a == b) {
            throw new IllegalArgumentException("indices must differ: " + a);
        }
        return a < b ? compatibleAfter[a].get(b) : compatibleAfter[b].get(a);
    }

    /**
     * Returns the cost charged when {@code later} directly follows {@code earlier}.
     */
    public int transitCost(int earlier, int later) {
        if (earlier >= later) {
            throw new IllegalArgumentException("earlier must precede later: " + earlier + " >= " + later);
        }
        return transitCost[earlier][later];
    }

    /**
     * Checks every selected pair.
     */
    public boolean isFeasible(SelectionAssignment assignment) {
        requireSize(assignment);
        for (int i = 0; i < size; i++) {
            if (!assignment.isSelected(i)) {
                continue;
            }
            for (int j = i + 1; j < size; j++) {
                if (assignment.isSelected(j) && !compatibleAfter[i].get(j)) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Sums the cost of each selected index against its nearest selected predecessor.
     */
    public int totalTransit(SelectionAssignment assignment) {
        requireSize(assignment);
        int total = 0;
        int previous = -1;
        for (int i = 0; i < size; i++) {
            if (!assignment.isSelected(i)) {
                continue;
            }
            if (previous >= 0) {
                total += transitCost[previous][i];
            }
            previous = i;
        }
        return total;
    }

    BitSet compatibleAfter(int index) {
        return compatibleAfter[index];
    }

    int transitCostUnchecked(int earlier, int later) {
        return transitCost[earlier][later];
    }

    BitSet allIndices() {
        BitSet all = new BitSet(size);
        all.set(0, size);
        return all;
    }

    private void requireSize(SelectionAssignment assignment) {
        if (assignment.size() != size) {
            throw new IllegalArgumentException("assignment size " + assignment.size() + " != model size " + size);
        }
    }
}
