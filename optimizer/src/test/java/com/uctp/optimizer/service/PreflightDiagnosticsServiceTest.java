package com.uctp.optimizer.service;

import com.uctp.optimizer.TestProblems;
import com.uctp.optimizer.engine.AvailabilityOracle;
import com.uctp.optimizer.model.Batch;
import com.uctp.optimizer.model.DiagnosticIssue;
import com.uctp.optimizer.model.DiagnosticIssue.Severity;
import com.uctp.optimizer.model.Faculty;
import com.uctp.optimizer.model.OptimizationRequest;
import com.uctp.optimizer.model.Room;
import com.uctp.optimizer.model.RoomCategory;
import com.uctp.optimizer.model.Subject;
import com.uctp.optimizer.model.SubjectCategory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class PreflightDiagnosticsServiceTest {
    private final PreflightDiagnosticsService service = new PreflightDiagnosticsService(new AvailabilityOracle());

    @Test
    void cleanProblemHasNoIssues() {
        assertThat(service.diagnose(TestProblems.singleBatch().build())).isEmpty();
    }

    @Test
    void reportsSubjectsNobodyTeaches() {
        OptimizationRequest request = TestProblems.singleBatch()
                .subject(Subject.builder().id("CHEM").name("Chemistry").code("CH1").hoursPerWeek(1).build())
                .build();

        assertThat(service.diagnose(request))
                .extracting(DiagnosticIssue::getSeverity, DiagnosticIssue::getTitle)
                .containsExactly(tuple(Severity.WARNING, "Unassigned Subject"));
    }

    @Test
    void practicalNeedingTwoLecturersWithOnlyOneIsCritical() {
        OptimizationRequest request = TestProblems.singleBatch()
                .subject(Subject.builder().id("LABW").name("Physics Lab").code("PHL").hoursPerWeek(2)
                        .category(SubjectCategory.PRACTICAL).build())
                .facultyMember(Faculty.builder().id("F3").name("Marie").subjectId("LABW").build())
                .room(Room.builder().id("L1").name("Lab 1").capacity(40).category(RoomCategory.LAB).build())
                .clearBatches()
                .batch(Batch.builder().id("B1").name("Year 1").studentCount(30)
                        .subjectId("MATH").subjectId("PHYS").subjectId("LABW").build())
                .build();

        List<DiagnosticIssue> issues = service.diagnose(request);

        assertThat(issues).extracting(DiagnosticIssue::getTitle).containsExactly("No Qualified Faculty");
        assertThat(issues.get(0).getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(issues.get(0).getDescription()).contains("needs 2 faculty but only 1");
    }

    @Test
    void missingRoomOfTheRightKindOrSizeIsCritical() {
        OptimizationRequest request = TestProblems.singleBatch()
                .batch(Batch.builder().id("B2").name("Year 2").studentCount(60).subjectId("MATH").build())
                .build();

        List<DiagnosticIssue> issues = service.diagnose(request);

        assertThat(issues).extracting(DiagnosticIssue::getTitle).containsExactly("No Suitable Room");
        assertThat(issues.get(0).getDescription()).contains("Lecture Hall", "60 students", "Year 2");
    }

    @Test
    void idleFacultyIsAWarning() {
        OptimizationRequest request = TestProblems.singleBatch()
                .facultyMember(Faculty.builder().id("F9").name("Idle").build())
                .build();

        assertThat(service.diagnose(request))
                .extracting(DiagnosticIssue::getSeverity, DiagnosticIssue::getTitle)
                .containsExactly(tuple(Severity.WARNING, "Faculty Without Subjects"));
    }
}
