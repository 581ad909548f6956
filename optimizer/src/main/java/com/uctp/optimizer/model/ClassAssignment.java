package com.uctp.optimizer.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;

import java.util.Set;

/**
 * One scheduled teaching hour of a subject for a batch. Immutable: moving a
 * session to another cell produces a new value with the same id.
 */
@Value
@Builder(toBuilder = true)
public class ClassAssignment {
    String id;
    String subjectId;
    @Singular("facultyId")
    Set<String> facultyIds;
    @With
    String roomId;
    String batchId;
    int day;
    int slot;

    public ClassAssignment moveTo(int day, int slot) {
        return toBuilder().day(day).slot(slot).build();
    }

    public boolean isTaughtBy(String facultyId) {
        return facultyIds.contains(facultyId);
    }

    public boolean occupies(int day, int slot) {
        return this.day == day && this.slot == slot;
    }
}
