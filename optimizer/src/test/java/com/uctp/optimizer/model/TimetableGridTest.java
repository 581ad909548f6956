package com.uctp.optimizer.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.uctp.optimizer.TestProblems.session;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimetableGridTest {

    private TimetableGrid newGrid() {
        TimetableGrid grid = new TimetableGrid(5, 4);
        grid.addBatch("B1");
        grid.addBatch("B2");
        return grid;
    }

    @Test
    void placeReturnsDisplacedSession() {
        TimetableGrid grid = newGrid();
        ClassAssignment first = session("a1", "B1", "MATH", "F1", "R1", 0, 0);
        ClassAssignment second = session("a2", "B1", "PHYS", "F2", "R1", 0, 0);

        assertThat(grid.place(first)).isNull();
        assertThat(grid.place(second)).isEqualTo(first);
        assertThat(grid.get("B1", 0, 0)).isEqualTo(second);
        assertThat(grid.size()).isEqualTo(1);
    }

    @Test
    void rejectsUnknownBatchAndOutOfBoundsCells() {
        TimetableGrid grid = newGrid();

        assertThatThrownBy(() -> grid.place(session("a1", "B9", "MATH", "F1", "R1", 0, 0)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("B9");
        assertThatThrownBy(() -> grid.place(session("a1", "B1", "MATH", "F1", "R1", 5, 0)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(grid.get("B1", 9, 9)).isNull();
    }

    @Test
    void removeOnlyClearsTheSameSession() {
        TimetableGrid grid = newGrid();
        ClassAssignment placed = session("a1", "B1", "MATH", "F1", "R1", 1, 2);
        grid.place(placed);

        assertThat(grid.remove(session("other", "B1", "MATH", "F1", "R1", 1, 2))).isFalse();
        assertThat(grid.remove(placed)).isTrue();
        assertThat(grid.get("B1", 1, 2)).isNull();
    }

    @Test
    void copyIsIndependent() {
        TimetableGrid grid = newGrid();
        grid.place(session("a1", "B1", "MATH", "F1", "R1", 0, 0));

        TimetableGrid copy = grid.copy();
        copy.clear("B1", 0, 0);
        copy.place(session("a2", "B2", "PHYS", "F2", "R1", 3, 3));

        assertThat(grid.get("B1", 0, 0)).isNotNull();
        assertThat(grid.get("B2", 3, 3)).isNull();
    }

    @Test
    void queriesCellsAcrossBatchesAndSlotsOfADay() {
        TimetableGrid grid = newGrid();
        grid.place(session("a1", "B1", "MATH", "F1", "R1", 2, 3));
        grid.place(session("a2", "B1", "PHYS", "F2", "R1", 2, 0));
        grid.place(session("a3", "B2", "MATH", "F1", "R2", 2, 3));

        assertThat(grid.occupiedSlots("B1", 2)).containsExactly(0, 3);
        assertThat(grid.assignmentsAt(2, 3)).extracting(ClassAssignment::getId).containsExactly("a1", "a3");
        assertThat(grid.findById("a2")).isPresent();
        assertThat(grid.assignments()).extracting(ClassAssignment::getId).containsExactly("a2", "a1", "a3");
    }

    @Test
    void contentSignatureIgnoresSessionIds() {
        TimetableGrid left = newGrid();
        TimetableGrid right = newGrid();
        left.place(session("x", "B1", "MATH", "F1", "R1", 0, 1));
        right.place(session("y", "B1", "MATH", "F1", "R1", 0, 1));

        assertThat(left.contentSignature()).isEqualTo(right.contentSignature());

        right.place(session("z", "B2", "PHYS", "F2", "R1", 4, 0));
        assertThat(left.contentSignature()).isNotEqualTo(right.contentSignature());
    }

    @Test
    void copyDayFromReplacesOnlyThatDay() {
        TimetableGrid source = newGrid();
        source.place(session("s1", "B1", "MATH", "F1", "R1", 1, 0));
        TimetableGrid target = newGrid();
        target.place(session("t1", "B1", "PHYS", "F2", "R1", 1, 3));
        target.place(session("t2", "B1", "PHYS", "F2", "R1", 2, 3));

        target.copyDayFrom(source, "B1", 1);

        assertThat(target.assignments()).extracting(ClassAssignment::getId).isEqualTo(List.of("s1", "t2"));
    }
}
