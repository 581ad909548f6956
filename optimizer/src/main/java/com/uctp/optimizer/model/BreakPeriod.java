package com.uctp.optimizer.model;

import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.LocalTime;

@Value
@AllArgsConstructor
public class BreakPeriod {
    String name;
    LocalTime startTime;
    LocalTime endTime;
}
