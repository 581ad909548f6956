package com.uctp.optimizer.service;

import com.uctp.optimizer.engine.AvailabilityOracle;
import com.uctp.optimizer.model.Batch;
import com.uctp.optimizer.model.DiagnosticIssue;
import com.uctp.optimizer.model.DiagnosticIssue.Severity;
import com.uctp.optimizer.model.Faculty;
import com.uctp.optimizer.model.OptimizationRequest;
import com.uctp.optimizer.model.Subject;
import com.uctp.optimizer.snapshot.ProblemSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Looks for data problems that make a timetable impossible or lopsided before
 * any search runs. The issues are advisory; callers decide whether to go on.
 */
@Service
public class PreflightDiagnosticsService {
    private static final Logger logger = LoggerFactory.getLogger(PreflightDiagnosticsService.class);

    private final AvailabilityOracle oracle;

    public PreflightDiagnosticsService(AvailabilityOracle oracle) {
        this.oracle = oracle;
    }

    public List<DiagnosticIssue> diagnose(OptimizationRequest request) {
        ProblemSnapshot snapshot = ProblemSnapshot.from(request);
        List<DiagnosticIssue> issues = new ArrayList<>();

        Set<String> taughtSubjects = snapshot.getFaculty().stream()
                .flatMap(member -> member.getSubjectIds().stream())
                .collect(Collectors.toSet());
        for (Subject subject : snapshot.getSubjects()) {
            if (!taughtSubjects.contains(subject.getId())) {
                issues.add(new DiagnosticIssue(Severity.WARNING, "Unassigned Subject",
                        String.format("The subject \"%s\" (%s) is not assigned to any faculty member.",
                                subject.getName(), subject.getCode()),
                        "Assign this subject to at least one faculty member."));
            }
        }

        for (Batch batch : snapshot.getBatches()) {
            for (String subjectId : batch.getSubjectIds()) {
                Subject subject = snapshot.subject(subjectId);
                List<Faculty> candidates = snapshot.facultyCandidates(batch.getId(), subjectId);
                if (candidates.size() < subject.requiredFacultyCount()) {
                    issues.add(new DiagnosticIssue(Severity.CRITICAL, "No Qualified Faculty",
                            String.format("The subject \"%s\" required by batch \"%s\" needs %d faculty but only %d can teach it.",
                                    subject.getName(), batch.getName(), subject.requiredFacultyCount(), candidates.size()),
                            String.format("Assign a faculty member to teach \"%s\" or remove it from the batch's curriculum.",
                                    subject.getCode())));
                }
                boolean hasRoom = snapshot.getRooms().stream().anyMatch(room -> oracle.isSuitable(room, batch, subject));
                if (!hasRoom) {
                    issues.add(new DiagnosticIssue(Severity.CRITICAL, "No Suitable Room",
                            String.format("No %s with room for %d students is available to batch \"%s\" for \"%s\".",
                                    subject.requiredRoomCategory().getDisplayName(), batch.getStudentCount(),
                                    batch.getName(), subject.getCode()),
                            "Add a suitable room or relax the batch's room restrictions."));
                }
            }
        }

        for (Faculty member : snapshot.getFaculty()) {
            if (member.getSubjectIds().isEmpty()) {
                issues.add(new DiagnosticIssue(Severity.WARNING, "Faculty Without Subjects",
                        String.format("Faculty member \"%s\" is not assigned to teach any subjects.", member.getName()),
                        "Assign subjects to this faculty member or remove them if they are no longer active."));
            }
        }

        if (!issues.isEmpty()) {
            logger.info("Pre-flight diagnostics found {} issues", issues.size());
        }
        return issues;
    }
}
