package com.uctp.optimizer.strategy;

/**
 * Counts how many consecutive generations ended with the same best score.
 * Not thread-safe; the orchestrator steps generations on one thread.
 */
public class StagnationTracker {
    private static final double EPSILON = 1e-9;

    private double lastBest = Double.NaN;
    private int unchanged;

    /** @return the number of consecutive generations at this best score, including this one */
    public int record(double bestScore) {
        if (!Double.isNaN(lastBest) && Math.abs(bestScore - lastBest) < EPSILON) {
            unchanged++;
        } else {
            unchanged = 1;
        }
        lastBest = bestScore;
        return unchanged;
    }

    public int getUnchanged() {
        return unchanged;
    }

    public void reset() {
        lastBest = Double.NaN;
        unchanged = 0;
    }
}
