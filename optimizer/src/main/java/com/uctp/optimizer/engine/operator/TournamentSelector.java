package com.uctp.optimizer.engine.operator;

import com.uctp.optimizer.model.Candidate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.random.RandomGenerator;

@Component
public class TournamentSelector {

    /**
     * Samples {@code tournamentSize} candidates with replacement and keeps the
     * strictly best; on a tie the earlier draw wins.
     */
    public Candidate select(List<Candidate> population, int tournamentSize, RandomGenerator rng) {
        if (population.isEmpty()) {
            throw new IllegalArgumentException("Cannot select from an empty population");
        }
        Candidate best = null;
        for (int i = 0; i < Math.max(1, tournamentSize); i++) {
            Candidate contender = population.get(rng.nextInt(population.size()));
            if (best == null || contender.score() > best.score()) {
                best = contender;
            }
        }
        return best;
    }
}
