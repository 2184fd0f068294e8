package com.herzen.screening.quality;

import com.herzen.screening.quality.QualityModels.QualityIssue;

import java.util.List;
import java.util.Map;

public final class QualityFlags {
    public static final String SPEEDING = "speeding";
    public static final String LONGSTRING = "longstring";
    public static final String INCONSISTENT = "inconsistent";
    public static final String STATISTICAL_OUTLIER = "statistical_outlier";
    public static final String LOW_VARIANCE = "low_variance";

    // flags are always reported in this order
    public static final List<String> ALL = List.of(SPEEDING, LONGSTRING, INCONSISTENT, STATISTICAL_OUTLIER, LOW_VARIANCE);

    private static final Map<String, QualityIssue> ISSUES = Map.of(
            SPEEDING, new QualityIssue(SPEEDING, "TOO_FAST", "Answers were given too quickly to have been read."),
            LONGSTRING, new QualityIssue(LONGSTRING, "REPEATED_ANSWERS", "Too many identical answers in a row."),
            INCONSISTENT, new QualityIssue(INCONSISTENT, "INCONSISTENT_ANSWERS", "Answers to related items do not agree."),
            STATISTICAL_OUTLIER, new QualityIssue(STATISTICAL_OUTLIER, "UNUSUAL_PATTERN", "The answer pattern is statistically unusual."),
            LOW_VARIANCE, new QualityIssue(LOW_VARIANCE, "LOW_SPREAD", "Almost all answers are the same.")
    );

    private QualityFlags() {}

    public static List<QualityIssue> issuesFor(List<String> flags) {
        return ALL.stream()
                .filter(flags::contains)
                .map(ISSUES::get)
                .toList();
    }
}
