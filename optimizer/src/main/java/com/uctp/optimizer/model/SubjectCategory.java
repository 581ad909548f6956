package com.uctp.optimizer.model;

/**
 * Teaching category of a subject. Decides which kind of room the subject needs
 * and how many faculty members must be present for one session.
 */
public enum SubjectCategory {
    THEORY(RoomCategory.LECTURE_HALL, 1),
    PRACTICAL(RoomCategory.LAB, 2),
    WORKSHOP(RoomCategory.WORKSHOP, 1);

    private final RoomCategory requiredRoomCategory;
    private final int requiredFacultyCount;

    SubjectCategory(RoomCategory requiredRoomCategory, int requiredFacultyCount) {
        this.requiredRoomCategory = requiredRoomCategory;
        this.requiredFacultyCount = requiredFacultyCount;
    }

    public RoomCategory getRequiredRoomCategory() {
        return requiredRoomCategory;
    }

    public int getRequiredFacultyCount() {
        return requiredFacultyCount;
    }
}
