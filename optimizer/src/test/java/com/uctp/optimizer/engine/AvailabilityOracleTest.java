package com.uctp.optimizer.engine;

import com.uctp.optimizer.TestProblems;
import com.uctp.optimizer.model.Batch;
import com.uctp.optimizer.model.Faculty;
import com.uctp.optimizer.model.FacultyAvailabilityConstraint;
import com.uctp.optimizer.model.OptimizationRequest;
import com.uctp.optimizer.model.PlannedLeave;
import com.uctp.optimizer.model.Room;
import com.uctp.optimizer.model.RoomCategory;
import com.uctp.optimizer.model.Subject;
import com.uctp.optimizer.model.SubjectCategory;
import com.uctp.optimizer.model.TimetableGrid;
import com.uctp.optimizer.snapshot.ProblemSnapshot;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Set;
import java.util.SplittableRandom;

import static com.uctp.optimizer.TestProblems.session;
import static org.assertj.core.api.Assertions.assertThat;

class AvailabilityOracleTest {
    private final AvailabilityOracle oracle = new AvailabilityOracle();

    @Test
    void batchIsBusyOnlyWhereItHasASession() {
        OptimizationRequest request = TestProblems.twoBatches().build();
        TimetableGrid grid = TestProblems.grid(request, session("a1", "B1", "MATH", "F1", "R1", 0, 0));

        assertThat(oracle.batchFree(grid, "B1", 0, 0)).isFalse();
        assertThat(oracle.batchFree(grid, "B1", 0, 1)).isTrue();
        assertThat(oracle.batchFree(grid, "B2", 0, 0)).isTrue();
    }

    @Test
    void facultyIsBusyAcrossBatches() {
        OptimizationRequest request = TestProblems.twoBatches().build();
        ProblemSnapshot snapshot = ProblemSnapshot.from(request);
        TimetableGrid grid = TestProblems.grid(request, session("a1", "B1", "MATH", "F1", "R1", 0, 0));

        assertThat(oracle.facultyFree(snapshot, grid, "F1", 0, 0)).isFalse();
        assertThat(oracle.facultyFree(snapshot, grid, "F1", 0, 0, "a1")).isTrue();
        assertThat(oracle.facultyFree(snapshot, grid, "F2", 0, 0)).isTrue();
    }

    @Test
    void facultyOutsideAllowedSlotsIsUnavailable() {
        OptimizationRequest request = TestProblems.singleBatch()
                .availabilityConstraint(FacultyAvailabilityConstraint.builder().facultyId("F1")
                        .allowedDay(1, Set.of(2, 3)).build())
                .build();
        ProblemSnapshot snapshot = ProblemSnapshot.from(request);
        TimetableGrid grid = TestProblems.grid(request);

        assertThat(oracle.facultyFree(snapshot, grid, "F1", 1, 2)).isTrue();
        assertThat(oracle.facultyFree(snapshot, grid, "F1", 1, 0)).isFalse();
        assertThat(oracle.facultyFree(snapshot, grid, "F1", 0, 2)).isFalse();
        assertThat(oracle.facultyFree(snapshot, grid, "F2", 0, 0)).isTrue();
    }

    @Test
    void facultyOnPlannedLeaveIsUnavailableAllDay() {
        OptimizationRequest request = TestProblems.singleBatch()
                .weekStart(LocalDate.of(2024, 3, 4))
                .plannedLeave(PlannedLeave.builder().id("L1").facultyId("F1")
                        .startDate(LocalDate.of(2024, 3, 6)).endDate(LocalDate.of(2024, 3, 6)).build())
                .build();
        ProblemSnapshot snapshot = ProblemSnapshot.from(request);
        TimetableGrid grid = TestProblems.grid(request);

        assertThat(oracle.facultyFree(snapshot, grid, "F1", 2, 0)).isFalse();
        assertThat(oracle.facultyFree(snapshot, grid, "F1", 2, 3)).isFalse();
        assertThat(oracle.facultyFree(snapshot, grid, "F1", 1, 0)).isTrue();
        assertThat(oracle.facultyFree(snapshot, grid, "F2", 2, 0)).isTrue();
    }

    @Test
    void roomMustMatchCategoryCapacityAndRestriction() {
        Room hall = Room.builder().id("R1").name("Hall").capacity(40).build();
        Room smallHall = Room.builder().id("R2").name("Small").capacity(20).build();
        Room lab = Room.builder().id("L1").name("Lab").capacity(40).category(RoomCategory.LAB).build();
        Subject theory = Subject.builder().id("MATH").name("Maths").code("MA").hoursPerWeek(1).build();
        Subject practical = Subject.builder().id("LAB").name("Lab").code("LB").hoursPerWeek(1)
                .category(SubjectCategory.PRACTICAL).build();
        Batch batch = Batch.builder().id("B1").name("Y1").studentCount(30).build();
        Batch restricted = Batch.builder().id("B2").name("Y2").studentCount(10).allowedRoomId("R2").build();

        assertThat(oracle.isSuitable(hall, batch, theory)).isTrue();
        assertThat(oracle.isSuitable(smallHall, batch, theory)).isFalse();
        assertThat(oracle.isSuitable(lab, batch, theory)).isFalse();
        assertThat(oracle.isSuitable(lab, batch, practical)).isTrue();
        assertThat(oracle.isSuitable(hall, restricted, theory)).isFalse();
        assertThat(oracle.isSuitable(smallHall, restricted, theory)).isTrue();
    }

    @Test
    void findsOnlyFreeRooms() {
        OptimizationRequest request = TestProblems.twoBatches().build();
        ProblemSnapshot snapshot = ProblemSnapshot.from(request);
        TimetableGrid grid = TestProblems.grid(request, session("a1", "B1", "MATH", "F1", "R1", 0, 0));

        for (int i = 0; i < 20; i++) {
            assertThat(oracle.findRoom(snapshot, grid, snapshot.batch("B2"), snapshot.subject("PHYS"), 0, 0,
                    new SplittableRandom(i))).map(Room::getId).contains("R2");
        }
        grid.place(session("a2", "B2", "PHYS", "F2", "R2", 0, 0));
        assertThat(oracle.findRoom(snapshot, grid, snapshot.batch("B2"), snapshot.subject("PHYS"), 1, 0,
                new SplittableRandom(1))).isPresent();
        assertThat(oracle.roomFree(grid, snapshot.room("R2"), 0, 0, snapshot.batch("B2"), snapshot.subject("PHYS")))
                .isFalse();
    }

    @Test
    void selectsTheRequiredFacultyHeadcount() {
        OptimizationRequest request = TestProblems.singleBatch()
                .subject(Subject.builder().id("LAB").name("Lab").code("LB").hoursPerWeek(2)
                        .category(SubjectCategory.PRACTICAL).build())
                .facultyMember(Faculty.builder().id("F3").name("Lise").subjectId("LAB").build())
                .facultyMember(Faculty.builder().id("F4").name("Marie").subjectId("LAB").build())
                .build();
        ProblemSnapshot snapshot = ProblemSnapshot.from(request);
        TimetableGrid grid = TestProblems.grid(request);

        assertThat(oracle.selectFaculty(snapshot, grid, snapshot.batch("B1"), snapshot.subject("LAB"), 0, 0))
                .hasValueSatisfying(ids -> assertThat(ids).containsExactly("F3", "F4"));

        grid.place(session("busy", "B1", "MATH", "F3", "R1", 0, 0));
        assertThat(oracle.selectFaculty(snapshot, grid, snapshot.batch("B1"), snapshot.subject("LAB"), 0, 0))
                .isEmpty();
    }
}
