package com.uctp.optimizer.engine;

import java.util.random.RandomGenerator;

public final class AssignmentIds {
    private AssignmentIds() {
    }

    /** Random session id drawn from the caller's generator, so seeded runs repeat. */
    public static String next(RandomGenerator rng) {
        String suffix = Long.toString(rng.nextLong() & Long.MAX_VALUE, 36);
        return "asgn_" + (suffix.length() > 9 ? suffix.substring(0, 9) : suffix);
    }
}
