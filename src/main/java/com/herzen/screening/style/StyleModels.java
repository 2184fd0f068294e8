package com.herzen.screening.style;

import java.util.List;

public class StyleModels {
    public static final String EXTREME_RESPONDING = "extreme_responding";
    public static final String MIDPOINT_RESPONDING = "midpoint_responding";
    public static final String ACQUIESCENCE = "acquiescence";
    public static final String ACQUIESCENCE_BIAS = "acquiescence_bias";

    public record CorrectionResult(List<Integer> correctedResponses,
                                   List<String> correctionsApplied,
                                   List<Integer> originalResponses,
                                   StyleScores styleScores) {}

    // acquiescence is null when no reverse items were given
    public record StyleScores(double extremeResponding, double midpointResponding, Double acquiescence) {}

    public record StyleInterpretation(String level, String message, String recommendation) {}
}
