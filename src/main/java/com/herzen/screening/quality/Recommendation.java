package com.herzen.screening.quality;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Recommendation {
    EXCELLENT(0.8),
    ACCEPTABLE(0.6),
    WARNING(0.4),
    REJECT(Double.NEGATIVE_INFINITY);

    private final double minScore;

    Recommendation(double minScore) {
        this.minScore = minScore;
    }

    public double minScore() {
        return minScore;
    }

    public static Recommendation fromScore(double qualityScore) {
        for (Recommendation r : values()) {
            if (qualityScore >= r.minScore) {
                return r;
            }
        }
        return REJECT;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
