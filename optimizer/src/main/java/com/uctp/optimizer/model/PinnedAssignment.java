package com.uctp.optimizer.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A hard-anchored placement. Every combination of {@code days} and
 * {@code startSlots} occupies {@code duration} consecutive slots.
 */
@Value
@Builder
public class PinnedAssignment {
    String id;
    String name;
    String subjectId;
    String facultyId;
    String roomId;
    String batchId;
    @Singular("day")
    List<Integer> days;
    @Singular("startSlot")
    List<Integer> startSlots;
    @Builder.Default
    int duration = 1;
}
