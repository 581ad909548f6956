package com.uctp.optimizer.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.DayOfWeek;
import java.time.format.TextStyle;
import java.util.List;
import java.util.Locale;
import java.util.random.RandomGenerator;

/**
 * The weekly shape of a timetable: which day indices are taught (0 is Monday)
 * and how many slots each day has. Timeslot labels are optional and only used
 * for human-readable summaries.
 */
@Value
@Builder
public class ScheduleGeometry {
    @Singular("workingDay")
    List<Integer> workingDays;
    int slotsPerDay;
    @Singular("timeslot")
    List<Timeslot> timeslots;

    public static ScheduleGeometry of(int dayCount, int slotsPerDay) {
        ScheduleGeometryBuilder builder = ScheduleGeometry.builder().slotsPerDay(slotsPerDay);
        for (int day = 0; day < dayCount; day++) {
            builder.workingDay(day);
        }
        return builder.build();
    }

    public static ScheduleGeometry of(List<Integer> workingDays, List<Timeslot> timeslots) {
        return ScheduleGeometry.builder()
                .workingDays(workingDays)
                .slotsPerDay(timeslots.size())
                .timeslots(timeslots)
                .build();
    }

    /** Working days with the timeslots cut from the college day. */
    public static ScheduleGeometry of(List<Integer> workingDays, DaySettings daySettings) {
        return of(workingDays, daySettings.timeslots());
    }

    /** Size of the day axis of a grid; covers the highest working-day index. */
    public int dayCount() {
        return workingDays.stream().mapToInt(Integer::intValue).max().orElse(-1) + 1;
    }

    public int numWorkingDays() {
        return workingDays.size();
    }

    public boolean isWorkingDay(int day) {
        return workingDays.contains(day);
    }

    public boolean containsSlot(int slot) {
        return slot >= 0 && slot < slotsPerDay;
    }

    public int randomDay(RandomGenerator rng) {
        return workingDays.get(rng.nextInt(workingDays.size()));
    }

    public int randomSlot(RandomGenerator rng) {
        return rng.nextInt(slotsPerDay);
    }

    public String dayName(int day) {
        return DayOfWeek.of(day % 7 + 1).getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }

    public String slotLabel(int slot) {
        if (slot < timeslots.size()) {
            return timeslots.get(slot).label();
        }
        return "slot " + slot;
    }
}
