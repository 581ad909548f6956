package com.uctp.optimizer.engine.operator;

import java.util.Arrays;
import java.util.Optional;

/** Low-level heuristics a phase can mix. */
public enum Heuristic {
    SWAP_MUTATE,
    MOVE_MUTATE,
    SIMULATED_ANNEALING,
    DAY_WISE_CROSSOVER;

    public static Optional<Heuristic> fromName(String name) {
        return Arrays.stream(values()).filter(h -> h.name().equalsIgnoreCase(name)).findFirst();
    }
}
