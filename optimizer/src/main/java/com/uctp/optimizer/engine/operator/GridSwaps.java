package com.uctp.optimizer.engine.operator;

import com.uctp.optimizer.model.ClassAssignment;
import com.uctp.optimizer.model.TimetableGrid;
import com.uctp.optimizer.snapshot.ProblemSnapshot;

import java.util.List;
import java.util.random.RandomGenerator;

public final class GridSwaps {
    private GridSwaps() {
    }

    /**
     * Exchanges the (day, slot) of two sessions inside {@code grid}. Each
     * session stays in its own batch; when the two batches differ, whatever
     * already sat in a target cell is displaced and left for repair.
     */
    public static void swapCoordinates(TimetableGrid grid, ClassAssignment first, ClassAssignment second) {
        if (first.getId().equals(second.getId())) {
            return;
        }
        grid.remove(first);
        grid.remove(second);
        grid.place(first.moveTo(second.getDay(), second.getSlot()));
        grid.place(second.moveTo(first.getDay(), first.getSlot()));
    }

    /**
     * Swaps two random non-pinned sessions of {@code grid}.
     *
     * @return false when fewer than two sessions exist or a pinned one was drawn
     */
    static boolean swapRandomPair(ProblemSnapshot snapshot, TimetableGrid grid, RandomGenerator rng) {
        List<ClassAssignment> assignments = grid.assignments();
        if (assignments.size() < 2) {
            return false;
        }
        ClassAssignment first = assignments.get(rng.nextInt(assignments.size()));
        ClassAssignment second = assignments.get(rng.nextInt(assignments.size()));
        if (snapshot.isPinned(first) || snapshot.isPinned(second)) {
            return false;
        }
        swapCoordinates(grid, first, second);
        return true;
    }
}
