package com.uctp.optimizer.engine.operator;

import com.uctp.optimizer.model.TimetableGrid;
import com.uctp.optimizer.snapshot.ProblemSnapshot;
import org.springframework.stereotype.Component;

import java.util.random.RandomGenerator;

/** Exchanges the time coordinates of two random sessions. */
@Component
public class SwapMutation {

    /**
     * @param rate probability that the offspring is mutated at all
     * @return a mutated copy, or an unchanged copy of {@code parent}
     */
    public TimetableGrid mutate(ProblemSnapshot snapshot, TimetableGrid parent, double rate, RandomGenerator rng) {
        TimetableGrid offspring = parent.copy();
        if (rng.nextDouble() > rate) {
            return offspring;
        }
        GridSwaps.swapRandomPair(snapshot, offspring, rng);
        return offspring;
    }
}
