package com.uctp.optimizer.engine.operator;

import com.uctp.optimizer.config.OptimizerProperties;
import com.uctp.optimizer.engine.FitnessEvaluator;
import com.uctp.optimizer.model.TimetableGrid;
import com.uctp.optimizer.snapshot.ProblemSnapshot;
import org.springframework.stereotype.Component;

import java.util.random.RandomGenerator;

/**
 * Local search by random pairwise swaps under a geometric cooling schedule.
 * Worse neighbours are accepted with probability {@code exp(delta / T)}.
 */
@Component
public class SimulatedAnnealing {
    private final FitnessEvaluator fitnessEvaluator;
    private final OptimizerProperties properties;

    public SimulatedAnnealing(FitnessEvaluator fitnessEvaluator, OptimizerProperties properties) {
        this.fitnessEvaluator = fitnessEvaluator;
        this.properties = properties;
    }

    public TimetableGrid anneal(ProblemSnapshot snapshot, TimetableGrid start, RandomGenerator rng) {
        OptimizerProperties.Annealing schedule = properties.getAnnealing();
        if (schedule.getCoolingRate() <= 0 || schedule.getCoolingRate() >= 1) {
            throw new IllegalStateException("Cooling rate must lie in (0, 1), got " + schedule.getCoolingRate());
        }

        TimetableGrid current = start.copy();
        double currentScore = fitnessEvaluator.evaluate(snapshot, current).getScore();
        TimetableGrid best = current;
        double bestScore = currentScore;

        double temperature = schedule.getInitialTemperature();
        while (temperature > schedule.getMinTemperature()) {
            for (int i = 0; i < schedule.getIterationsPerTemperature(); i++) {
                TimetableGrid neighbour = current.copy();
                if (!GridSwaps.swapRandomPair(snapshot, neighbour, rng)) {
                    continue;
                }
                double neighbourScore = fitnessEvaluator.evaluate(snapshot, neighbour).getScore();
                double delta = neighbourScore - currentScore;
                if (delta > 0 || Math.exp(delta / temperature) > rng.nextDouble()) {
                    current = neighbour;
                    currentScore = neighbourScore;
                    if (currentScore > bestScore) {
                        best = current;
                        bestScore = currentScore;
                    }
                }
            }
            temperature *= schedule.getCoolingRate();
        }
        return schedule.isReturnBestVisited() ? best : current;
    }
}
