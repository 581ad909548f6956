package com.uctp.optimizer.model;

import lombok.Value;

import java.util.Comparator;

/**
 * A scored individual of the population. The grid is treated as frozen once
 * wrapped in a candidate: operators copy it before changing anything.
 */
@Value
public class Candidate {
    public static final Comparator<Candidate> BY_SCORE_DESCENDING =
            Comparator.comparingDouble(Candidate::score).reversed();

    TimetableGrid timetable;
    TimetableMetrics metrics;

    public double score() {
        return metrics.getScore();
    }
}
