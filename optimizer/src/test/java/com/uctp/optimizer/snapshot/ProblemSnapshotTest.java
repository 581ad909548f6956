package com.uctp.optimizer.snapshot;

import com.uctp.optimizer.TestProblems;
import com.uctp.optimizer.model.Batch;
import com.uctp.optimizer.model.ClassAssignment;
import com.uctp.optimizer.model.Faculty;
import com.uctp.optimizer.model.FacultyAllocation;
import com.uctp.optimizer.model.FeedbackSample;
import com.uctp.optimizer.model.OptimizationRequest;
import com.uctp.optimizer.model.PinnedAssignment;
import com.uctp.optimizer.model.PlannedLeave;
import com.uctp.optimizer.model.TimetableGrid;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class ProblemSnapshotTest {

    @Test
    void countsRequiredSessionsPerBatchAndSubject() {
        ProblemSnapshot snapshot = ProblemSnapshot.from(TestProblems.twoBatches().build());

        assertThat(snapshot.requiredSessions("B1", "MATH")).isEqualTo(3);
        assertThat(snapshot.requiredSessions("B2", "PHYS")).isEqualTo(2);
        assertThat(snapshot.requiredSessions("B2", "CHEM")).isZero();
        assertThat(snapshot.totalRequiredSessions()).isEqualTo(10);
    }

    @Test
    void failsFastOnUnknownSubjectOfABatch() {
        OptimizationRequest request = TestProblems.singleBatch()
                .batch(Batch.builder().id("B2").name("Year 2").studentCount(10).subjectId("CHEM").build())
                .build();

        assertThatThrownBy(() -> ProblemSnapshot.from(request))
                .isInstanceOf(InvalidProblemException.class)
                .hasMessageContaining("batch 'B2'")
                .hasMessageContaining("CHEM");
    }

    @Test
    void failsFastOnUnknownReferencesOfPinsAndLeaves() {
        OptimizationRequest badPin = TestProblems.singleBatch()
                .pinnedAssignment(PinnedAssignment.builder().id("P1").batchId("B1").subjectId("MATH")
                        .facultyId("F1").roomId("R404").day(0).startSlot(0).build())
                .build();
        OptimizationRequest badLeave = TestProblems.singleBatch()
                .plannedLeave(PlannedLeave.builder().id("L1").facultyId("F9")
                        .startDate(LocalDate.of(2024, 1, 1)).endDate(LocalDate.of(2024, 1, 2)).build())
                .build();

        assertThatThrownBy(() -> ProblemSnapshot.from(badPin)).hasMessageContaining("R404");
        assertThatThrownBy(() -> ProblemSnapshot.from(badLeave)).hasMessageContaining("F9");
    }

    @Test
    void rejectsDuplicateIdsAndBaselineOfTheWrongShape() {
        OptimizationRequest duplicate = TestProblems.singleBatch()
                .facultyMember(Faculty.builder().id("F1").name("Copy").build())
                .build();
        OptimizationRequest wrongBaseline = TestProblems.singleBatch()
                .baseline(new TimetableGrid(3, 3))
                .build();

        assertThatThrownBy(() -> ProblemSnapshot.from(duplicate))
                .isInstanceOf(InvalidProblemException.class)
                .hasMessageContaining("Duplicate");
        assertThatThrownBy(() -> ProblemSnapshot.from(wrongBaseline))
                .isInstanceOf(InvalidProblemException.class)
                .hasMessageContaining("Baseline");
    }

    @Test
    void allocationOverridesQualifiedFaculty() {
        OptimizationRequest request = TestProblems.twoBatches()
                .facultyMember(Faculty.builder().id("F3").name("Emmy").subjectId("MATH").build())
                .facultyAllocation(FacultyAllocation.builder().batchId("B2").subjectId("MATH").facultyId("F3").build())
                .build();
        ProblemSnapshot snapshot = ProblemSnapshot.from(request);

        assertThat(snapshot.facultyCandidates("B1", "MATH")).extracting(Faculty::getId).containsExactly("F1", "F3");
        assertThat(snapshot.facultyCandidates("B2", "MATH")).extracting(Faculty::getId).containsExactly("F3");
    }

    @Test
    void expandsPinsAndSkipsOutOfBoundsSlots() {
        OptimizationRequest request = TestProblems.singleBatch()
                .pinnedAssignment(PinnedAssignment.builder().id("P1").batchId("B1").subjectId("MATH")
                        .facultyId("F1").roomId("R1").day(0).day(2).startSlot(3).duration(2).build())
                .build();
        ProblemSnapshot snapshot = ProblemSnapshot.from(request);

        assertThat(snapshot.getPinnedPlacements())
                .extracting(ClassAssignment::getDay, ClassAssignment::getSlot)
                .containsExactly(tuple(0, 3), tuple(2, 3));
        assertThat(snapshot.isPinned("B1", 2, 3)).isTrue();
        assertThat(snapshot.isPinned("B1", 1, 3)).isFalse();
        assertThat(snapshot.pinnedAssignmentCount()).isEqualTo(1);
    }

    @Test
    void resolvesPlannedLeaveAgainstTheWeek() {
        OptimizationRequest request = TestProblems.singleBatch()
                .weekStart(LocalDate.of(2024, 3, 4))
                .plannedLeave(PlannedLeave.builder().id("L1").facultyId("F1")
                        .startDate(LocalDate.of(2024, 3, 5)).endDate(LocalDate.of(2024, 3, 6)).build())
                .build();
        LeaveCalendar calendar = ProblemSnapshot.from(request).getLeaveCalendar();

        assertThat(calendar.isOnLeave("F1", 0)).isFalse();
        assertThat(calendar.isOnLeave("F1", 1)).isTrue();
        assertThat(calendar.isOnLeave("F1", 2)).isTrue();
        assertThat(calendar.isOnLeave("F2", 1)).isFalse();
    }

    @Test
    void rejectsLeaveWithMissingOrReversedDates() {
        OptimizationRequest openEnded = TestProblems.singleBatch()
                .weekStart(LocalDate.of(2024, 3, 4))
                .plannedLeave(PlannedLeave.builder().id("L1").facultyId("F1")
                        .startDate(LocalDate.of(2024, 3, 5)).build())
                .build();
        OptimizationRequest reversed = TestProblems.singleBatch()
                .weekStart(LocalDate.of(2024, 3, 4))
                .plannedLeave(PlannedLeave.builder().id("L2").facultyId("F1")
                        .startDate(LocalDate.of(2024, 3, 8)).endDate(LocalDate.of(2024, 3, 5)).build())
                .build();

        assertThatThrownBy(() -> ProblemSnapshot.from(openEnded))
                .isInstanceOf(InvalidProblemException.class)
                .hasMessageContaining("planned leave 'L1'");
        assertThatThrownBy(() -> ProblemSnapshot.from(reversed))
                .isInstanceOf(InvalidProblemException.class)
                .hasMessageContaining("planned leave 'L2'")
                .hasMessageContaining("2024-03-05");
    }

    @Test
    void rejectsFeedbackRatingsOutsideOneToFive() {
        OptimizationRequest tooLow = TestProblems.singleBatch()
                .feedbackSample(FeedbackSample.builder().facultyId("F1").rating(0).build())
                .build();
        OptimizationRequest tooHigh = TestProblems.singleBatch()
                .feedbackSample(FeedbackSample.builder().facultyId("F2").rating(6).build())
                .build();
        OptimizationRequest inRange = TestProblems.singleBatch()
                .feedbackSample(FeedbackSample.builder().facultyId("F1").rating(1).build())
                .feedbackSample(FeedbackSample.builder().facultyId("F2").rating(5).build())
                .build();

        assertThatThrownBy(() -> ProblemSnapshot.from(tooLow))
                .isInstanceOf(InvalidProblemException.class)
                .hasMessageContaining("rating 0");
        assertThatThrownBy(() -> ProblemSnapshot.from(tooHigh))
                .isInstanceOf(InvalidProblemException.class)
                .hasMessageContaining("rating 6");
        assertThat(ProblemSnapshot.from(inRange).getFeedbackSamples()).hasSize(2);
    }
}
