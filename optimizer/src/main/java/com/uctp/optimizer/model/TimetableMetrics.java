package com.uctp.optimizer.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TimetableMetrics {
    public static final double MAX_SCORE = 1000.0;

    double score;
    int hardConflicts;
    int studentGaps;
    int facultyGaps;
    double facultyWorkloadStdDev;
    int preferenceViolations;
    int unplacedSessions;
}
