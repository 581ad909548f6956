package com.uctp.optimizer.snapshot;

/**
 * Tells whether a faculty member is away on a weekday of the planned week.
 * How leave dates map onto weekdays belongs to the caller.
 */
@FunctionalInterface
public interface LeaveCalendar {
    LeaveCalendar NONE = (facultyId, day) -> false;

    boolean isOnLeave(String facultyId, int day);
}
