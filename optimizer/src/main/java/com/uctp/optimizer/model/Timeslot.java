package com.uctp.optimizer.model;

import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

@Value
@AllArgsConstructor
public class Timeslot {
    private static final DateTimeFormatter LABEL_FORMAT = DateTimeFormatter.ofPattern("hh:mm a", Locale.ENGLISH);

    int index;
    LocalTime startTime;
    LocalTime endTime;

    public String label() {
        return startTime.format(LABEL_FORMAT) + " - " + endTime.format(LABEL_FORMAT);
    }
}
