package com.uctp.optimizer.engine.operator;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.random.RandomGenerator;

/**
 * Discrete probability distribution over {@link Heuristic}s. Weights are
 * normalised to sum to one; sampling walks the cumulative mass in enum order.
 */
public final class HeuristicDistribution {
    private final Map<Heuristic, Double> probabilities;

    private HeuristicDistribution(Map<Heuristic, Double> probabilities) {
        this.probabilities = Collections.unmodifiableMap(probabilities);
    }

    /**
     * @throws IllegalArgumentException when a weight is negative or not finite,
     *                                  or all weights are zero
     */
    public static HeuristicDistribution of(Map<Heuristic, Double> weights) {
        double total = 0;
        for (Map.Entry<Heuristic, Double> entry : weights.entrySet()) {
            double weight = entry.getValue() == null ? 0.0 : entry.getValue();
            if (!Double.isFinite(weight) || weight < 0) {
                throw new IllegalArgumentException("Invalid weight " + weight + " for " + entry.getKey());
            }
            total += weight;
        }
        if (total <= 0) {
            throw new IllegalArgumentException("At least one heuristic needs a positive weight");
        }
        Map<Heuristic, Double> normalised = new EnumMap<>(Heuristic.class);
        for (Heuristic heuristic : Heuristic.values()) {
            Double weight = weights.get(heuristic);
            normalised.put(heuristic, weight == null ? 0.0 : weight / total);
        }
        return new HeuristicDistribution(normalised);
    }

    public static HeuristicDistribution of(double swap, double move, double annealing, double crossover) {
        Map<Heuristic, Double> weights = new EnumMap<>(Heuristic.class);
        weights.put(Heuristic.SWAP_MUTATE, swap);
        weights.put(Heuristic.MOVE_MUTATE, move);
        weights.put(Heuristic.SIMULATED_ANNEALING, annealing);
        weights.put(Heuristic.DAY_WISE_CROSSOVER, crossover);
        return of(weights);
    }

    public double probabilityOf(Heuristic heuristic) {
        return probabilities.get(heuristic);
    }

    public Map<Heuristic, Double> asMap() {
        return probabilities;
    }

    public Heuristic sample(RandomGenerator rng) {
        return pick(rng.nextDouble());
    }

    /**
     * First heuristic whose cumulative probability covers {@code draw}. A draw
     * left over by rounding goes to the last heuristic with any weight.
     */
    Heuristic pick(double draw) {
        double cumulative = 0;
        Heuristic lastWeighted = Heuristic.SWAP_MUTATE;
        for (Heuristic heuristic : Heuristic.values()) {
            double probability = probabilities.get(heuristic);
            if (probability <= 0) {
                continue;
            }
            cumulative += probability;
            lastWeighted = heuristic;
            if (draw <= cumulative) {
                return heuristic;
            }
        }
        return lastWeighted;
    }

    @Override
    public String toString() {
        return probabilities.toString();
    }
}
