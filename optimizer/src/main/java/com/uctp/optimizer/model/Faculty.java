package com.uctp.optimizer.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Set;

@Value
@Builder
public class Faculty {
    String id;
    String name;
    @Singular("subjectId")
    Set<String> subjectIds;
    // day -> preferred slots; empty means the faculty member stated no preference
    @Singular("preferredDay")
    Map<Integer, Set<Integer>> preferredSlots;

    public boolean isQualifiedFor(String subjectId) {
        return subjectIds.contains(subjectId);
    }

    public boolean hasPreferences() {
        return !preferredSlots.isEmpty();
    }

    public boolean prefers(int day, int slot) {
        Set<Integer> slots = preferredSlots.get(day);
        return slots != null && slots.contains(slot);
    }
}
