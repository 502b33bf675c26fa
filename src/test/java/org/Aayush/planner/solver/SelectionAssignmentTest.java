package org.Aayush.planner.solver;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("SelectionAssignment Tests")
class SelectionAssignmentTest {

    @Test
    @DisplayName("Selected indices come back ascending and read-only")
    void testSelectedIndices() {
        SelectionAssignment assignment = SelectionAssignment.ofIndices(6, 4, 1, 3);
        IntList indices = assignment.selectedIndices();

        assertEquals(3, assignment.attendance());
        assertEquals(IntArrayList.wrap(new int[]{1, 3, 4}), indices);
        assertThrows(UnsupportedOperationException.class, () -> indices.add(5));
        assertTrue(assignment.isSelected(4));
        assertFalse(assignment.isSelected(0));
    }

    @Test
    @DisplayName("Raw arrays are copied in and out")
    void testDefensiveCopies() {
        boolean[] raw = {true, false, true};
        SelectionAssignment assignment = SelectionAssignment.of(raw);
        raw[1] = true;
        assertFalse(assignment.isSelected(1));

        boolean[] out = assignment.toArray();
        out[0] = false;
        assertTrue(assignment.isSelected(0));
        assertArrayEquals(new boolean[]{true, false, true}, assignment.toArray());
    }

    @Test
    @DisplayName("Equality is by decision vector")
    void testEquality() {
        assertEquals(SelectionAssignment.ofIndices(3, 0, 2), SelectionAssignment.of(new boolean[]{true, false, true}));
        assertEquals(
                SelectionAssignment.ofIndices(3, 0, 2).hashCode(),
                SelectionAssignment.of(new boolean[]{true, false, true}).hashCode()
        );
        assertNotEquals(SelectionAssignment.none(3), SelectionAssignment.none(4));
        assertEquals(0, SelectionAssignment.none(5).attendance());
    }
}
