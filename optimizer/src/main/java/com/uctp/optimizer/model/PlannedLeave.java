package com.uctp.optimizer.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class PlannedLeave {
    String id;
    String facultyId;
    LocalDate startDate;
    LocalDate endDate;
    String reason;

    public boolean covers(LocalDate date) {
        return !date.isBefore(startDate) && !date.isAfter(endDate);
    }
}
