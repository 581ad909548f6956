package com.uctp.optimizer.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Everything one optimization run reads. The caller owns these objects; the
 * engine only ever reads them.
 */
@Value
@Builder
public class OptimizationRequest {
    @Singular("batch")
    List<Batch> batches;
    @Singular("subject")
    List<Subject> subjects;
    @Singular("facultyMember")
    List<Faculty> faculty;
    @Singular("room")
    List<Room> rooms;
    @Singular("pinnedAssignment")
    List<PinnedAssignment> pinnedAssignments;
    @Singular("availabilityConstraint")
    List<FacultyAvailabilityConstraint> availabilityConstraints;
    @Singular("facultyAllocation")
    List<FacultyAllocation> facultyAllocations;
    @Singular("plannedLeave")
    List<PlannedLeave> plannedLeaves;
    @Singular("feedbackSample")
    List<FeedbackSample> feedbackSamples;
    // Monday of the week being planned; only needed to resolve planned leaves
    LocalDate weekStart;
    @Builder.Default
    ConstraintWeights weights = ConstraintWeights.defaults();
    ScheduleGeometry geometry;
    @Builder.Default
    int candidateCount = 5;
    TimetableGrid baseline;
}
