package com.uctp.optimizer.engine;

import com.uctp.optimizer.TestProblems;
import com.uctp.optimizer.config.OptimizerProperties;
import com.uctp.optimizer.model.ClassAssignment;
import com.uctp.optimizer.model.OptimizationRequest;
import com.uctp.optimizer.model.PinnedAssignment;
import com.uctp.optimizer.model.Room;
import com.uctp.optimizer.model.TimetableGrid;
import com.uctp.optimizer.snapshot.ProblemSnapshot;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;
import java.util.SplittableRandom;

import static com.uctp.optimizer.TestProblems.session;
import static org.assertj.core.api.Assertions.assertThat;

class RepairEngineTest {
    private final AvailabilityOracle oracle = new AvailabilityOracle();
    private final SessionPlacer placer = new SessionPlacer(oracle);
    private final RepairEngine repairEngine = new RepairEngine(oracle, placer, new OptimizerProperties());
    private final FitnessEvaluator evaluator = new FitnessEvaluator(new ConflictDetector());

    @Test
    void removesDuplicateFacultyBookings() {
        OptimizationRequest request = TestProblems.twoBatches().build();
        ProblemSnapshot snapshot = ProblemSnapshot.from(request);
        TimetableGrid grid = TestProblems.grid(request,
                session("a1", "B1", "MATH", "F1", "R1", 0, 0),
                session("a2", "B2", "MATH", "F1", "R2", 0, 0));

        repairEngine.repair(snapshot, grid, new SplittableRandom(11));

        assertNoFacultyTwiceInACell(grid);
        assertThat(grid.get("B1", 0, 0)).extracting(ClassAssignment::getId).isEqualTo("a1");
        assertThat(grid.findById("a2")).hasValueSatisfying(moved -> assertThat(moved.occupies(0, 0)).isFalse());
        assertThat(evaluator.evaluate(snapshot, grid).getHardConflicts()).isZero();
    }

    @Test
    void dropsSurplusSessions() {
        OptimizationRequest request = TestProblems.singleBatch().build();
        ProblemSnapshot snapshot = ProblemSnapshot.from(request);
        TimetableGrid grid = TestProblems.grid(request,
                session("m1", "B1", "MATH", "F1", "R1", 0, 0),
                session("m2", "B1", "MATH", "F1", "R1", 1, 0),
                session("m3", "B1", "MATH", "F1", "R1", 2, 0),
                session("p1", "B1", "PHYS", "F2", "R1", 3, 0));

        RepairEngine.RepairReport report = repairEngine.repair(snapshot, grid, new SplittableRandom(5));

        assertThat(grid.assignments()).extracting(ClassAssignment::getId).containsExactly("m1", "p1");
        assertThat(report.getFlagged()).isEqualTo(2);
        assertThat(report.getUnrepaired()).isZero();
    }

    @Test
    void movesSessionsOutOfUnsuitableRooms() {
        OptimizationRequest request = TestProblems.singleBatch()
                .room(Room.builder().id("R2").name("Seminar").capacity(10).build())
                .build();
        ProblemSnapshot snapshot = ProblemSnapshot.from(request);
        TimetableGrid grid = TestProblems.grid(request,
                session("m1", "B1", "MATH", "F1", "R2", 0, 0),
                session("p1", "B1", "PHYS", "F2", "R1", 0, 1));

        repairEngine.repair(snapshot, grid, new SplittableRandom(2));

        assertThat(grid.findById("m1")).hasValueSatisfying(a -> assertThat(a.getRoomId()).isEqualTo("R1"));
        assertThat(evaluator.unplacedSessions(snapshot, grid)).isZero();
    }

    @Test
    void restoresPinnedPlacements() {
        OptimizationRequest request = TestProblems.singleBatch()
                .pinnedAssignment(PinnedAssignment.builder().id("P1").batchId("B1").subjectId("MATH")
                        .facultyId("F1").roomId("R1").day(0).startSlot(0).build())
                .build();
        ProblemSnapshot snapshot = ProblemSnapshot.from(request);
        TimetableGrid grid = TestProblems.grid(request, session("p1", "B1", "PHYS", "F2", "R1", 0, 0));

        repairEngine.repair(snapshot, grid, new SplittableRandom(9));

        assertThat(grid.get("B1", 0, 0)).isEqualTo(snapshot.getPinnedPlacements().get(0));
        assertThat(grid.assignments()).extracting(ClassAssignment::getSubjectId)
                .containsExactlyInAnyOrder("MATH", "PHYS");
    }

    @Test
    void initialisedAndRepairedSingleBatchHasBothSessionsWithoutClashes() {
        ProblemSnapshot snapshot = ProblemSnapshot.from(TestProblems.singleBatch().build());
        PopulationInitializer initializer = new PopulationInitializer(placer);

        for (long seed = 0; seed < 10; seed++) {
            SplittableRandom rng = new SplittableRandom(seed);
            TimetableGrid grid = initializer.createIndividual(snapshot, rng);
            repairEngine.repair(snapshot, grid, rng);

            assertThat(grid.size()).isEqualTo(2);
            assertNoFacultyTwiceInACell(grid);
            assertThat(evaluator.evaluate(snapshot, grid).getHardConflicts()).isZero();
        }
    }

    private static void assertNoFacultyTwiceInACell(TimetableGrid grid) {
        for (int day = 0; day < grid.getDayCount(); day++) {
            for (int slot = 0; slot < grid.getSlotsPerDay(); slot++) {
                Set<String> seen = new HashSet<>();
                for (ClassAssignment assignment : grid.assignmentsAt(day, slot)) {
                    for (String facultyId : assignment.getFacultyIds()) {
                        assertThat(seen.add(facultyId))
                                .as("faculty %s double-booked on day %d slot %d", facultyId, day, slot)
                                .isTrue();
                    }
                }
            }
        }
    }
}
