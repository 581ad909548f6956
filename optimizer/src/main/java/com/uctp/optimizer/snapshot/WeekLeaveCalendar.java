package com.uctp.optimizer.snapshot;

import com.uctp.optimizer.model.PlannedLeave;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Resolves planned leave date ranges against one concrete week: day index
 * {@code d} is the date {@code weekStart + d}.
 */
public class WeekLeaveCalendar implements LeaveCalendar {
    private final LocalDate weekStart;
    private final Map<String, List<PlannedLeave>> leavesByFaculty;

    public WeekLeaveCalendar(LocalDate weekStart, List<PlannedLeave> leaves) {
        this.weekStart = weekStart;
        this.leavesByFaculty = leaves.stream().collect(Collectors.groupingBy(PlannedLeave::getFacultyId));
    }

    @Override
    public boolean isOnLeave(String facultyId, int day) {
        List<PlannedLeave> leaves = leavesByFaculty.get(facultyId);
        if (leaves == null) {
            return false;
        }
        LocalDate date = weekStart.plusDays(day);
        return leaves.stream().anyMatch(leave -> leave.covers(date));
    }
}
