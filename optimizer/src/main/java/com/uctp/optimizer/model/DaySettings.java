package com.uctp.optimizer.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/** College hours from which the daily timeslots are derived. */
@Value
@Builder
public class DaySettings {
    private static final int MAX_SLOTS = 50;

    LocalTime collegeStartTime;
    LocalTime collegeEndTime;
    int periodMinutes;
    @Singular("breakPeriod")
    List<BreakPeriod> breaks;

    /**
     * Cuts the college day into equal periods. A period that would run into a
     * break is dropped and the next one starts when the break ends.
     */
    public List<Timeslot> timeslots() {
        if (periodMinutes <= 0) {
            throw new IllegalArgumentException("Period length must be positive, got " + periodMinutes);
        }
        List<BreakPeriod> sortedBreaks = new ArrayList<>(breaks);
        sortedBreaks.sort(Comparator.comparing(BreakPeriod::getStartTime));

        int end = minutesOf(collegeEndTime);
        int current = minutesOf(collegeStartTime);
        List<Timeslot> slots = new ArrayList<>();
        while (current + periodMinutes <= end && slots.size() < MAX_SLOTS) {
            int slotStart = current;
            int slotEnd = current + periodMinutes;
            Optional<BreakPeriod> clash = sortedBreaks.stream()
                    .filter(b -> slotStart < minutesOf(b.getEndTime()) && slotEnd > minutesOf(b.getStartTime()))
                    .findFirst();
            if (clash.isPresent()) {
                int resume = minutesOf(clash.get().getEndTime());
                if (resume <= current) {
                    break;
                }
                current = resume;
                continue;
            }
            slots.add(new Timeslot(slots.size(), timeOf(slotStart), timeOf(slotEnd)));
            current = slotEnd;
        }
        return slots;
    }

    private static int minutesOf(LocalTime time) {
        return time.getHour() * 60 + time.getMinute();
    }

    private static LocalTime timeOf(int minutes) {
        return LocalTime.of(minutes / 60, minutes % 60);
    }
}
