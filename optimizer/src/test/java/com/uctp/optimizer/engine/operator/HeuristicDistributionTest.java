package com.uctp.optimizer.engine.operator;

import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;
import java.util.SplittableRandom;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class HeuristicDistributionTest {

    @Test
    void normalisesWeights() {
        HeuristicDistribution distribution = HeuristicDistribution.of(1, 1, 0, 2);

        assertThat(distribution.probabilityOf(Heuristic.SWAP_MUTATE)).isCloseTo(0.25, within(1e-12));
        assertThat(distribution.probabilityOf(Heuristic.DAY_WISE_CROSSOVER)).isCloseTo(0.5, within(1e-12));
        assertThat(distribution.probabilityOf(Heuristic.SIMULATED_ANNEALING)).isZero();
    }

    @Test
    void walksCumulativeProbabilities() {
        HeuristicDistribution distribution = HeuristicDistribution.of(0.1, 0.4, 0.0, 0.5);

        assertThat(distribution.pick(0.05)).isEqualTo(Heuristic.SWAP_MUTATE);
        assertThat(distribution.pick(0.3)).isEqualTo(Heuristic.MOVE_MUTATE);
        assertThat(distribution.pick(0.5)).isEqualTo(Heuristic.MOVE_MUTATE);
        assertThat(distribution.pick(0.51)).isEqualTo(Heuristic.DAY_WISE_CROSSOVER);
    }

    @Test
    void neverSamplesZeroWeightHeuristics() {
        HeuristicDistribution distribution = HeuristicDistribution.of(0, 0, 1, 0);
        SplittableRandom rng = new SplittableRandom(42);

        for (int i = 0; i < 200; i++) {
            assertThat(distribution.sample(rng)).isEqualTo(Heuristic.SIMULATED_ANNEALING);
        }
        assertThat(distribution.pick(0.0)).isEqualTo(Heuristic.SIMULATED_ANNEALING);
    }

    @Test
    void drawsPastTheTotalGoToTheLastWeightedHeuristic() {
        assertThat(HeuristicDistribution.of(0, 0, 1, 0).pick(1.0 + 1e-9)).isEqualTo(Heuristic.SIMULATED_ANNEALING);
        assertThat(HeuristicDistribution.of(0, 3, 0, 0).pick(1.0 + 1e-9)).isEqualTo(Heuristic.MOVE_MUTATE);
        assertThat(HeuristicDistribution.of(1, 1, 0, 1).pick(1.0 + 1e-9)).isEqualTo(Heuristic.DAY_WISE_CROSSOVER);
    }

    @Test
    void rejectsUnusableWeights() {
        Map<Heuristic, Double> negative = new EnumMap<>(Heuristic.class);
        negative.put(Heuristic.SWAP_MUTATE, -1.0);

        assertThatThrownBy(() -> HeuristicDistribution.of(0, 0, 0, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> HeuristicDistribution.of(negative)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> HeuristicDistribution.of(Double.NaN, 1, 1, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parsesHeuristicNames() {
        assertThat(Heuristic.fromName("move_mutate")).contains(Heuristic.MOVE_MUTATE);
        assertThat(Heuristic.fromName("TABU_SEARCH")).isEmpty();
    }
}
