package com.uctp.optimizer.engine;

import com.uctp.optimizer.model.ClassAssignment;
import com.uctp.optimizer.model.ConstraintWeights;
import com.uctp.optimizer.model.Faculty;
import com.uctp.optimizer.model.TimetableGrid;
import com.uctp.optimizer.model.TimetableMetrics;
import com.uctp.optimizer.snapshot.ProblemSnapshot;
import com.uctp.optimizer.snapshot.SessionKey;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores a timetable on a 0..1000 scale. Every penalty is a count of soft
 * constraint breaches multiplied by its weight from the snapshot.
 */
@Component
public class FitnessEvaluator {
    private final ConflictDetector conflictDetector;

    public FitnessEvaluator(ConflictDetector conflictDetector) {
        this.conflictDetector = conflictDetector;
    }

    public TimetableMetrics evaluate(ProblemSnapshot snapshot, TimetableGrid grid) {
        int studentGaps = 0;
        for (String batchId : grid.batchIds()) {
            for (int day = 0; day < grid.getDayCount(); day++) {
                studentGaps += idleSlots(grid.occupiedSlots(batchId, day));
            }
        }

        Map<String, List<List<Integer>>> taughtSlots = taughtSlotsByFaculty(snapshot, grid);
        int facultyGaps = 0;
        int preferenceViolations = 0;
        List<Integer> workloads = new ArrayList<>(snapshot.getFaculty().size());
        for (Faculty member : snapshot.getFaculty()) {
            List<List<Integer>> days = taughtSlots.get(member.getId());
            int workload = 0;
            for (int day = 0; day < days.size(); day++) {
                List<Integer> slots = days.get(day);
                workload += slots.size();
                facultyGaps += idleSlots(slots);
                if (member.hasPreferences()) {
                    for (int slot : slots) {
                        if (!member.prefers(day, slot)) {
                            preferenceViolations++;
                        }
                    }
                }
            }
            workloads.add(workload);
        }
        double workloadStdDev = populationStdDev(workloads);
        int hardConflicts = conflictDetector.countConflictingAssignments(snapshot, grid);

        ConstraintWeights weights = snapshot.getWeights();
        double score = TimetableMetrics.MAX_SCORE
                - studentGaps * weights.getStudentGap()
                - facultyGaps * weights.getFacultyGap()
                - workloadStdDev * weights.getFacultyWorkloadStdDev()
                - preferenceViolations * weights.getFacultyPreference()
                - hardConflicts * weights.getHardConflict();

        return TimetableMetrics.builder()
                .score(Math.max(0, score))
                .hardConflicts(hardConflicts)
                .studentGaps(studentGaps)
                .facultyGaps(facultyGaps)
                .facultyWorkloadStdDev(workloadStdDev)
                .preferenceViolations(preferenceViolations)
                .unplacedSessions(unplacedSessions(snapshot, grid))
                .build();
    }

    /** Required sessions missing from the grid, summed over every (batch, subject). */
    public int unplacedSessions(ProblemSnapshot snapshot, TimetableGrid grid) {
        Map<SessionKey, Integer> placed = new HashMap<>();
        for (ClassAssignment assignment : grid.assignments()) {
            placed.merge(SessionKey.of(assignment.getBatchId(), assignment.getSubjectId()), 1, Integer::sum);
        }
        int missing = 0;
        for (Map.Entry<SessionKey, Integer> required : snapshot.getRequiredSessions().entrySet()) {
            missing += Math.max(0, required.getValue() - placed.getOrDefault(required.getKey(), 0));
        }
        return missing;
    }

    private Map<String, List<List<Integer>>> taughtSlotsByFaculty(ProblemSnapshot snapshot, TimetableGrid grid) {
        Map<String, List<List<Integer>>> taught = new HashMap<>();
        for (Faculty member : snapshot.getFaculty()) {
            List<List<Integer>> days = new ArrayList<>(grid.getDayCount());
            for (int day = 0; day < grid.getDayCount(); day++) {
                days.add(new ArrayList<>());
            }
            taught.put(member.getId(), days);
        }
        for (ClassAssignment assignment : grid.assignments()) {
            for (String facultyId : assignment.getFacultyIds()) {
                List<List<Integer>> days = taught.get(facultyId);
                if (days != null) {
                    days.get(assignment.getDay()).add(assignment.getSlot());
                }
            }
        }
        taught.values().forEach(days -> days.forEach(Collections::sort));
        return taught;
    }

    // slots must be ascending; a double-booked slot counts as no gap
    public static int idleSlots(List<Integer> slots) {
        int idle = 0;
        for (int i = 0; i + 1 < slots.size(); i++) {
            idle += Math.max(0, slots.get(i + 1) - slots.get(i) - 1);
        }
        return idle;
    }

    private static double populationStdDev(List<Integer> values) {
        if (values.size() < 2) {
            return 0.0;
        }
        double mean = values.stream().mapToInt(Integer::intValue).average().orElse(0);
        double variance = values.stream().mapToDouble(v -> (v - mean) * (v - mean)).sum() / values.size();
        return Math.sqrt(variance);
    }
}
