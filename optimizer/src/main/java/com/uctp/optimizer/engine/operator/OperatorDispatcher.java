package com.uctp.optimizer.engine.operator;

import com.uctp.optimizer.config.OptimizerProperties;
import com.uctp.optimizer.model.Candidate;
import com.uctp.optimizer.model.TimetableGrid;
import com.uctp.optimizer.snapshot.ProblemSnapshot;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Produces one raw offspring: tournament-selects a parent, draws a heuristic
 * from the phase distribution and applies it. The result still needs repair.
 */
@Component
public class OperatorDispatcher {
    private final TournamentSelector selector;
    private final DayWiseCrossover crossover;
    private final SwapMutation swapMutation;
    private final MoveMutation moveMutation;
    private final SimulatedAnnealing annealing;
    private final OptimizerProperties properties;

    public OperatorDispatcher(TournamentSelector selector, DayWiseCrossover crossover, SwapMutation swapMutation,
                              MoveMutation moveMutation, SimulatedAnnealing annealing,
                              OptimizerProperties properties) {
        this.selector = selector;
        this.crossover = crossover;
        this.swapMutation = swapMutation;
        this.moveMutation = moveMutation;
        this.annealing = annealing;
        this.properties = properties;
    }

    public TimetableGrid breed(ProblemSnapshot snapshot, List<Candidate> population,
                               HeuristicDistribution distribution, RandomGenerator rng) {
        TimetableGrid parent = selector.select(population, properties.getTournamentSize(), rng).getTimetable();
        Heuristic heuristic = distribution.sample(rng);
        return apply(heuristic, snapshot, parent, population, rng);
    }

    public TimetableGrid apply(Heuristic heuristic, ProblemSnapshot snapshot, TimetableGrid parent,
                               List<Candidate> population, RandomGenerator rng) {
        switch (heuristic) {
            case DAY_WISE_CROSSOVER:
                TimetableGrid other = selector.select(population, properties.getTournamentSize(), rng).getTimetable();
                return crossover.cross(snapshot, parent, other, rng);
            case MOVE_MUTATE:
                return moveMutation.mutate(snapshot, parent, properties.getMutationRate(), rng);
            case SIMULATED_ANNEALING:
                return annealing.anneal(snapshot, parent, rng);
            case SWAP_MUTATE:
            default:
                return swapMutation.mutate(snapshot, parent, properties.getMutationRate(), rng);
        }
    }
}
