package com.herzen.screening.stats;

public sealed interface MahalanobisOutcome {

    record Computed(double distanceSquared,
                    double criticalValue,
                    double pValue,
                    int degreesOfFreedom,
                    boolean pseudoInverse) implements MahalanobisOutcome {
        public double distance() {
            return Math.sqrt(distanceSquared);
        }

        public boolean exceedsCriticalValue() {
            return distanceSquared > criticalValue;
        }
    }

    record Degenerate(String reason) implements MahalanobisOutcome {}
}
