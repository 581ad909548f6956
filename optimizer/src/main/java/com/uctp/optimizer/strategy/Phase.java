package com.uctp.optimizer.strategy;

import com.uctp.optimizer.engine.operator.HeuristicDistribution;
import lombok.Value;

/** A run of generations bred with one heuristic mix. */
@Value
public class Phase {
    String name;
    int generations;
    HeuristicDistribution distribution;
}
