package org.Aayush.planner.solver;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.Arrays;

/**
 * Immutable attend/skip decision per catalog index.
 */
public final class SelectionAssignment {
    private final boolean[] selected;
    private final int attendance;

    private SelectionAssignment(boolean[] selected) {
        this.selected = selected;
        int count = 0;
        for (boolean s : selected) {
            if (s) {
                count++;
            }
        }
        this.attendance = count;
    }

    /**
     * Copies a raw decision array.
     */
    public static SelectionAssignment of(boolean[] selected) {
        return new SelectionAssignment(selected.clone());
    }

    /**
     * Returns the assignment that attends nothing.
     */
    public static SelectionAssignment none(int size) {
        return new SelectionAssignment(new boolean[size]);
    }

    /**
     * Creates an assignment attending exactly the given indices.
     */
    public static SelectionAssignment ofIndices(int size, int... indices) {
        boolean[] selected = new boolean[size];
        for (int index : indices) {
            selected[index] = true;
        }
        return new SelectionAssignment(selected);
    }

    public int size() {
        return selected.length;
    }

    public boolean isSelected(int index) {
        return selected[index];
    }

    /**
     * Number of attended occurrences.
     */
    public int attendance() {
        return attendance;
    }

    /**
     * Returns attended indices in ascending order.
     */
    public IntList selectedIndices() {
        IntArrayList indices = new IntArrayList(attendance);
        for (int i = 0; i < selected.length; i++) {
            if (selected[i]) {
                indices.add(i);
            }
        }
        return IntLists.unmodifiable(indices);
    }

    /**
     * Returns a copy of the raw decision array.
     */
    public boolean[] toArray() {
        return selected.clone();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SelectionAssignment)) {
            return false;
        }
        return Arrays.equals(selected, ((SelectionAssignment) other).selected);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(selected);
    }

    @Override
    public String toString() {
        return "SelectionAssignment" + selectedIndices();
    }
}
