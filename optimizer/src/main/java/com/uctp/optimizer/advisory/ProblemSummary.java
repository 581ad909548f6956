package com.uctp.optimizer.advisory;

import com.uctp.optimizer.snapshot.ProblemSnapshot;
import lombok.Builder;
import lombok.Value;

/** Size figures of a problem, enough for an advisor to shape a phase plan. */
@Value
@Builder
public class ProblemSummary {
    int batchCount;
    int sessionCount;
    int facultyCount;
    int roomCount;
    int pinnedAssignmentCount;
    int availabilityConstraintCount;
    int workingDays;
    int slotsPerDay;
    int generationBudget;

    public static ProblemSummary of(ProblemSnapshot snapshot, int generationBudget) {
        return ProblemSummary.builder()
                .batchCount(snapshot.getBatches().size())
                .sessionCount(snapshot.totalRequiredSessions())
                .facultyCount(snapshot.getFaculty().size())
                .roomCount(snapshot.getRooms().size())
                .pinnedAssignmentCount(snapshot.pinnedAssignmentCount())
                .availabilityConstraintCount(snapshot.availabilityConstraintCount())
                .workingDays(snapshot.getGeometry().numWorkingDays())
                .slotsPerDay(snapshot.getGeometry().getSlotsPerDay())
                .generationBudget(generationBudget)
                .build();
    }
}
