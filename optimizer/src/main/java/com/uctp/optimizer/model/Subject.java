package com.uctp.optimizer.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Subject {
    String id;
    String name;
    String code;
    int hoursPerWeek;
    @Builder.Default
    SubjectCategory category = SubjectCategory.THEORY;

    public RoomCategory requiredRoomCategory() {
        return category.getRequiredRoomCategory();
    }

    public int requiredFacultyCount() {
        return category.getRequiredFacultyCount();
    }
}
