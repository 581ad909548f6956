package com.uctp.optimizer.model;

public enum RoomCategory {
    LECTURE_HALL("Lecture Hall"),
    LAB("Lab"),
    WORKSHOP("Workshop");

    private final String displayName;

    RoomCategory(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
