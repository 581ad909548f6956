package com.uctp.optimizer.service;

/** Receives one report per generation, on the thread running the optimization. */
@FunctionalInterface
public interface OptimizationListener {
    OptimizationListener NONE = report -> {
    };

    void onGeneration(GenerationReport report);
}
