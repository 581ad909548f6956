package com.uctp.optimizer.service;

import lombok.Value;

@Value
public class GenerationReport {
    String phaseName;
    int phaseIndex;
    int generation;
    double bestScore;
    // consecutive generations at this best score, this one included
    int stagnantGenerations;
}
