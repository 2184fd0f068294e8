package com.herzen.screening.quality;

import java.util.List;
import java.util.Map;

public class QualityModels {
    public record QualityCheckResult(boolean careless,
                                     List<String> flags,
                                     double qualityScore,
                                     Map<String, CheckDetails> details,
                                     Recommendation recommendation) {}

    public sealed interface CheckDetails {
        boolean flagged();
    }

    public record ResponseTimeDetails(double avgTime,
                                      double minTime,
                                      double maxTime,
                                      int maxConsecutiveFast,
                                      int fastCount,
                                      double fastRatio,
                                      double threshold,
                                      boolean flagged) implements CheckDetails {}

    public record Streak(int value, int length, int startIndex) {}

    public record LongstringDetails(int maxStreak,
                                    int threshold,
                                    List<Streak> longStreaks,
                                    boolean flagged) implements CheckDetails {}

    public record ConsistencyDetails(Double correlation,
                                     double threshold,
                                     int evenItemsCount,
                                     int oddItemsCount,
                                     Double evenMean,
                                     Double oddMean,
                                     String error,
                                     boolean flagged) implements CheckDetails {}

    public record MahalanobisDetails(Double distance,
                                     Double distanceSquared,
                                     Double chi2Threshold,
                                     Double pValue,
                                     boolean pseudoInverse,
                                     String error,
                                     boolean flagged) implements CheckDetails {}

    public record VarianceDetails(double variance, double threshold, boolean flagged) implements CheckDetails {}

    public record QualityIssue(String flag, String code, String explanation) {}

    public static final String RESPONSE_TIME = "response_time";
    public static final String LONGSTRING = "longstring";
    public static final String CONSISTENCY = "consistency";
    public static final String MAHALANOBIS = "mahalanobis";
    public static final String VARIANCE = "variance";
}
