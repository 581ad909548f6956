package com.uctp.optimizer.model;

import lombok.Builder;
import lombok.Value;

/**
 * Penalty weights of the soft constraints. Higher weight means a higher
 * penalty per unit in the fitness score.
 */
@Value
@Builder(toBuilder = true)
public class ConstraintWeights {
    double studentGap;
    double facultyGap;
    double facultyWorkloadStdDev;
    double facultyPreference;
    @Builder.Default
    double hardConflict = 0.0;

    public static ConstraintWeights defaults() {
        return ConstraintWeights.builder()
                .studentGap(5)
                .facultyGap(5)
                .facultyWorkloadStdDev(10)
                .facultyPreference(2)
                .build();
    }

    public boolean isValid() {
        return isUsable(studentGap) && isUsable(facultyGap) && isUsable(facultyWorkloadStdDev)
                && isUsable(facultyPreference) && isUsable(hardConflict);
    }

    private static boolean isUsable(double weight) {
        return Double.isFinite(weight) && weight >= 0;
    }
}
