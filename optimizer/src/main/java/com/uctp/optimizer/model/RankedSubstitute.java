package com.uctp.optimizer.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A faculty member who is free to cover one session, with the measures the
 * ranking was based on. Scores run from 0 to 100, higher is better.
 */
@Value
@Builder(toBuilder = true)
public class RankedSubstitute {
    Faculty faculty;
    @Singular("suitableSubjectId")
    List<String> suitableSubjectIds;
    boolean canTeachOriginal;
    boolean allocatedToBatch;
    // sessions already taught this week
    int workload;
    // idle slots on the session's day once the session is taken
    int scheduleGaps;
    int score;
    @Singular("reason")
    List<String> reasons;
}
