package com.herzen.screening.quality;

import com.herzen.screening.config.ScreeningProperties;
import com.herzen.screening.quality.QualityModels.*;
import com.herzen.screening.stats.Descriptive;
import com.herzen.screening.stats.MahalanobisCalculator;
import com.herzen.screening.stats.MahalanobisOutcome;
import com.herzen.screening.validation.ResponseValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

import static com.herzen.screening.stats.Descriptive.round;

@Service
public class QualityScreeningService {
    private static final Logger log = LoggerFactory.getLogger(QualityScreeningService.class);

    static final int MIN_RESPONSES_FOR_CONSISTENCY = 20;
    static final int RECORDED_STREAK_LENGTH = 5;
    static final double CONSISTENCY_FALLBACK_CORRELATION = 0.0;
    static final int LONGSTRING_PENALTY_CAP = 20;
    static final double FAST_RATIO_PENALTY_FLOOR = 0.3;
    static final double OUTLIER_PENALTY_P_VALUE = 0.01;

    private static final double TIME_PENALTY = 0.30;
    private static final double FAST_RATIO_PENALTY = 0.10;
    private static final double LONGSTRING_PENALTY = 0.25;
    private static final double CONSISTENCY_PENALTY = 0.25;
    private static final double OUTLIER_PENALTY = 0.20;
    private static final double LOW_VARIANCE_PENALTY = 0.20;

    private final ScreeningProperties.Quality config;
    private final ResponseValidator validator;
    private final MahalanobisCalculator mahalanobis;

    public QualityScreeningService(ScreeningProperties properties,
                                   ResponseValidator validator,
                                   MahalanobisCalculator mahalanobis) {
        this.config = properties.quality();
        this.validator = validator;
        this.mahalanobis = mahalanobis;
    }

    public QualityCheckResult analyze(List<Integer> responses, List<Double> responseTimes) {
        return analyze(responses, responseTimes, null);
    }

    public QualityCheckResult analyze(List<Integer> responses, List<Double> responseTimes, double[][] referenceData) {
        validator.validateScreeningInput(responses, responseTimes);
        validator.validateReferenceData(referenceData, responses.size());

        List<String> flags = new ArrayList<>();
        Map<String, CheckDetails> details = new LinkedHashMap<>();

        ResponseTimeDetails time = checkResponseTime(responseTimes);
        put(QualityModels.RESPONSE_TIME, time, QualityFlags.SPEEDING, details, flags);

        LongstringDetails longstring = checkLongstring(responses);
        put(QualityModels.LONGSTRING, longstring, QualityFlags.LONGSTRING, details, flags);

        ConsistencyDetails consistency = checkConsistency(responses);
        put(QualityModels.CONSISTENCY, consistency, QualityFlags.INCONSISTENT, details, flags);

        MahalanobisDetails outlier = null;
        if (referenceData != null) {
            outlier = checkMahalanobis(responses, referenceData);
            put(QualityModels.MAHALANOBIS, outlier, QualityFlags.STATISTICAL_OUTLIER, details, flags);
        }

        VarianceDetails variance = checkLowVariance(responses);
        put(QualityModels.VARIANCE, variance, QualityFlags.LOW_VARIANCE, details, flags);

        double score = qualityScore(time, longstring, consistency, outlier, variance);
        Recommendation recommendation = Recommendation.fromScore(score);
        log.debug("Screened {} responses: flags={}, score={}, recommendation={}",
                responses.size(), flags, score, recommendation);

        return new QualityCheckResult(flags.size() >= 2, List.copyOf(flags), score,
                Collections.unmodifiableMap(details), recommendation);
    }

    ResponseTimeDetails checkResponseTime(List<Double> times) {
        double avg = Descriptive.mean(times);
        double min = times.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
        double max = times.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);

        int consecutiveFast = 0;
        int maxConsecutiveFast = 0;
        int fastCount = 0;
        for (double t : times) {
            if (t < config.fastResponseSeconds()) {
                consecutiveFast++;
                fastCount++;
                maxConsecutiveFast = Math.max(maxConsecutiveFast, consecutiveFast);
            } else {
                consecutiveFast = 0;
            }
        }

        boolean speeding = avg < config.minTimePerItem() || maxConsecutiveFast >= config.consecutiveFastLimit();
        return new ResponseTimeDetails(round(avg, 2), round(min, 2), round(max, 2),
                maxConsecutiveFast, fastCount, round((double) fastCount / times.size(), 3),
                config.minTimePerItem(), speeding);
    }

    LongstringDetails checkLongstring(List<Integer> responses) {
        List<Streak> streaks = new ArrayList<>();
        int maxStreak = 1;
        int current = 1;
        for (int i = 1; i < responses.size(); i++) {
            if (responses.get(i).equals(responses.get(i - 1))) {
                current++;
            } else {
                closeStreak(responses.get(i - 1), current, i - current, streaks);
                maxStreak = Math.max(maxStreak, current);
                current = 1;
            }
        }
        // the last run is never closed by a value change
        int n = responses.size();
        closeStreak(responses.get(n - 1), current, n - current, streaks);
        maxStreak = Math.max(maxStreak, current);

        return new LongstringDetails(maxStreak, config.longstringThreshold(), List.copyOf(streaks),
                maxStreak >= config.longstringThreshold());
    }

    private static void closeStreak(int value, int length, int start, List<Streak> streaks) {
        if (length >= RECORDED_STREAK_LENGTH) {
            streaks.add(new Streak(value, length, start));
        }
    }

    ConsistencyDetails checkConsistency(List<Integer> responses) {
        if (responses.size() < MIN_RESPONSES_FOR_CONSISTENCY) {
            return new ConsistencyDetails(null, config.correlationThreshold(), 0, 0, null, null,
                    "Too few responses for consistency check", false);
        }

        List<Integer> even = new ArrayList<>();
        List<Integer> odd = new ArrayList<>();
        for (int i = 0; i < responses.size(); i++) {
            (i % 2 == 0 ? even : odd).add(responses.get(i));
        }
        int len = Math.min(even.size(), odd.size());
        even = even.subList(0, len);
        odd = odd.subList(0, len);

        double correlation = Descriptive.pearson(even, odd).orElse(CONSISTENCY_FALLBACK_CORRELATION);
        boolean inconsistent = correlation < config.correlationThreshold();

        return new ConsistencyDetails(round(correlation, 3), config.correlationThreshold(), even.size(), odd.size(),
                round(Descriptive.mean(even), 2), round(Descriptive.mean(odd), 2), null, inconsistent);
    }

    MahalanobisDetails checkMahalanobis(List<Integer> responses, double[][] referenceData) {
        MahalanobisOutcome outcome = mahalanobis.evaluate(responses, referenceData, config.mahalanobisPThreshold());
        if (outcome instanceof MahalanobisOutcome.Computed computed) {
            return new MahalanobisDetails(
                    round(computed.distance(), 3),
                    round(computed.distanceSquared(), 3),
                    round(computed.criticalValue(), 3),
                    round(computed.pValue(), 6),
                    computed.pseudoInverse(),
                    null,
                    computed.exceedsCriticalValue());
        }
        MahalanobisOutcome.Degenerate degenerate = (MahalanobisOutcome.Degenerate) outcome;
        log.warn("Mahalanobis check skipped: {}", degenerate.reason());
        return new MahalanobisDetails(null, null, null, null, false, degenerate.reason(), false);
    }

    VarianceDetails checkLowVariance(List<Integer> responses) {
        double variance = Descriptive.variance(responses);
        return new VarianceDetails(round(variance, 3), config.varianceThreshold(),
                variance < config.varianceThreshold());
    }

    // penalties on the rounded diagnostics; the weights sum past 1.0 and the result is clamped
    double qualityScore(ResponseTimeDetails time,
                        LongstringDetails longstring,
                        ConsistencyDetails consistency,
                        MahalanobisDetails outlier,
                        VarianceDetails variance) {
        double score = 1.0;

        double minTime = config.minTimePerItem();
        if (time.avgTime() < minTime) {
            score -= TIME_PENALTY * (minTime - time.avgTime()) / minTime;
        }
        if (time.fastRatio() > FAST_RATIO_PENALTY_FLOOR) {
            score -= FAST_RATIO_PENALTY * time.fastRatio();
        }

        if (longstring.maxStreak() >= config.longstringThreshold()) {
            score -= LONGSTRING_PENALTY * Math.min((double) longstring.maxStreak() / LONGSTRING_PENALTY_CAP, 1.0);
        }

        double threshold = config.correlationThreshold();
        if (consistency.correlation() != null && consistency.correlation() < threshold && threshold > 0.0) {
            score -= CONSISTENCY_PENALTY * (threshold - consistency.correlation()) / threshold;
        }

        if (outlier != null && outlier.pValue() != null && outlier.pValue() < OUTLIER_PENALTY_P_VALUE) {
            score -= OUTLIER_PENALTY;
        }

        if (variance.flagged()) {
            score -= LOW_VARIANCE_PENALTY;
        }

        return Descriptive.clamp(score, 0.0, 1.0);
    }

    private static void put(String key, CheckDetails result, String flag,
                               Map<String, CheckDetails> details, List<String> flags) {
        details.put(key, result);
        if (result.flagged()) {
            flags.add(flag);
        }
    }
}
