package com.uctp.optimizer.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Set;

@Value
@Builder
public class FacultyAvailabilityConstraint {
    String facultyId;
    @Singular("allowedDay")
    Map<Integer, Set<Integer>> allowedSlots;

    public boolean allows(int day, int slot) {
        Set<Integer> slots = allowedSlots.get(day);
        return slots != null && slots.contains(slot);
    }
}
