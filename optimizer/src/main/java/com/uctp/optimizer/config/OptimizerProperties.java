package com.uctp.optimizer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tuning knobs of the genetic search, bound from {@code timetable.optimizer.*}.
 */
@Data
@ConfigurationProperties(prefix = "timetable.optimizer")
public class OptimizerProperties {
    private int populationSize = 20;
    // total generations of the default phase plan
    private int generationBudget = 25;
    private int elitismCount = 2;
    private int tournamentSize = 5;
    private int stagnationLimitExit = 8;
    private int stagnationLimitIntervention = 5;
    private double perfectScoreThreshold = 990.0;
    private double mutationRate = 0.1;
    private int moveAttempts = 50;
    private int repairAttempts = 100;
    // advised phase plans longer than this are rejected
    private int maxAdvisedGenerations = 100;
    // 0 means one worker per available processor
    private int workerThreads = 0;
    private Long seed;
    private Annealing annealing = new Annealing();

    @Data
    public static class Annealing {
        private double initialTemperature = 80.0;
        private double coolingRate = 0.98;
        private double minTemperature = 0.1;
        private int iterationsPerTemperature = 1;
        private boolean returnBestVisited = false;
    }

    public int effectiveWorkerThreads() {
        return workerThreads > 0 ? workerThreads : Runtime.getRuntime().availableProcessors();
    }
}
