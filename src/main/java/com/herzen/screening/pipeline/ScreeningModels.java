package com.herzen.screening.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;
import com.herzen.screening.quality.QualityModels.QualityCheckResult;
import com.herzen.screening.quality.QualityModels.QualityIssue;
import com.herzen.screening.style.StyleModels.CorrectionResult;

import java.util.List;
import java.util.Locale;
import java.util.Set;

public class ScreeningModels {
    // null reverseItems means the configured default, null referenceData skips the outlier check
    public record ScreeningRequest(String respondentId,
                                   List<Integer> responses,
                                   List<Double> responseTimes,
                                   Set<Integer> reverseItems,
                                   double[][] referenceData) {
        public ScreeningRequest(String respondentId, List<Integer> responses, List<Double> responseTimes) {
            this(respondentId, responses, responseTimes, null, null);
        }
    }

    public enum ScreeningStatus {
        SUCCESS, WARNING, INVALID;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public record ScreeningOutcome(String respondentId,
                                   ScreeningStatus status,
                                   QualityCheckResult quality,
                                   CorrectionResult correction,
                                   List<Integer> finalResponses,
                                   List<QualityIssue> qualityIssues) {}
}
