package com.herzen.screening.style;

import com.herzen.screening.config.ScreeningProperties;
import com.herzen.screening.stats.Descriptive;
import com.herzen.screening.style.StyleModels.CorrectionResult;
import com.herzen.screening.style.StyleModels.StyleScores;
import com.herzen.screening.validation.ResponseValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

import static com.herzen.screening.stats.Descriptive.round;

@Service
public class StyleCorrectionService {
    private static final Logger log = LoggerFactory.getLogger(StyleCorrectionService.class);

    static final double MIN_SPREAD_FOR_RESCALE = 0.1;
    static final double COMPRESSED_SCALE = 0.75;
    static final double MIDPOINT_NUDGE = 0.5;
    static final double MIDPOINT_TIE_NUDGE = 0.3;
    static final int PAIR_SUM_TOLERANCE = 1;

    private final ScreeningProperties.Style config;
    private final int scaleMin;
    private final int scaleMax;
    private final int reversalSum;
    private final ResponseValidator validator;

    public StyleCorrectionService(ScreeningProperties properties, ResponseValidator validator) {
        this.config = properties.style();
        this.scaleMin = properties.instrument().scaleMin();
        this.scaleMax = properties.instrument().scaleMax();
        this.reversalSum = properties.instrument().reversalSum();
        this.validator = validator;
    }

    public CorrectionResult correct(List<Integer> responses) {
        return correct(responses, null);
    }

    public CorrectionResult correct(List<Integer> responses, Set<Integer> reverseItems) {
        validator.validateResponses(responses);
        validator.validateReverseItems(reverseItems, responses.size());

        List<Integer> original = List.copyOf(responses);
        boolean hasReverseItems = reverseItems != null && !reverseItems.isEmpty();

        double ers = extremeResponding(original);
        double mrs = midpointResponding(original);
        Double aq = hasReverseItems ? acquiescence(original, reverseItems) : null;

        List<Integer> working = original;
        List<String> corrections = new ArrayList<>();
        if (ers > config.extremeThreshold()) {
            working = correctExtreme(working);
            corrections.add(StyleModels.EXTREME_RESPONDING);
        }
        if (mrs > config.midpointThreshold()) {
            working = correctMidpoint(working);
            corrections.add(StyleModels.MIDPOINT_RESPONDING);
        }
        if (aq != null && aq > config.acquiescenceThreshold()) {
            working = correctAcquiescence(working, reverseItems);
            corrections.add(StyleModels.ACQUIESCENCE_BIAS);
        }

        if (!corrections.isEmpty()) {
            log.debug("Applied style corrections {} (ers={}, mrs={}, aq={})", corrections, ers, mrs, aq);
        }
        StyleScores scores = new StyleScores(round(ers, 3), round(mrs, 3), aq == null ? null : round(aq, 3));
        return new CorrectionResult(List.copyOf(working), List.copyOf(corrections), original, scores);
    }

    double extremeResponding(List<Integer> responses) {
        long count = responses.stream().filter(r -> r == scaleMin || r == scaleMax).count();
        return (double) count / responses.size();
    }

    double midpointResponding(List<Integer> responses) {
        long count = responses.stream().filter(this::isMidpoint).count();
        return (double) count / responses.size();
    }

    // only neighbouring items of opposite polarity are paired, within a tolerance of 1
    double acquiescence(List<Integer> responses, Set<Integer> reverseItems) {
        int pairs = 0;
        int mismatches = 0;
        for (int i = 0; i < responses.size() - 1; i++) {
            if (reverseItems.contains(i) != reverseItems.contains(i + 1)) {
                pairs++;
                int actualSum = responses.get(i) + responses.get(i + 1);
                if (Math.abs(actualSum - reversalSum) > PAIR_SUM_TOLERANCE) {
                    mismatches++;
                }
            }
        }
        return pairs == 0 ? 0.0 : (double) mismatches / pairs;
    }

    List<Integer> correctExtreme(List<Integer> responses) {
        double sd = Descriptive.standardDeviation(responses);
        if (sd < MIN_SPREAD_FOR_RESCALE) {
            return responses;
        }
        double mean = Descriptive.mean(responses);
        double center = (scaleMin + scaleMax) / 2.0;
        List<Integer> corrected = new ArrayList<>(responses.size());
        for (int r : responses) {
            double z = (r - mean) / sd;
            double score = Descriptive.clamp(center + z * COMPRESSED_SCALE, scaleMin, scaleMax);
            corrected.add((int) Math.rint(score));
        }
        return corrected;
    }

    List<Integer> correctMidpoint(List<Integer> responses) {
        double mean = Descriptive.mean(responses);
        double center = (scaleMin + scaleMax) / 2.0;
        List<Integer> corrected = new ArrayList<>(responses.size());
        for (int r : responses) {
            if (!isMidpoint(r)) {
                corrected.add(r);
                continue;
            }
            double adjustment;
            if (r > mean) {
                adjustment = MIDPOINT_NUDGE;
            } else if (r < mean) {
                adjustment = -MIDPOINT_NUDGE;
            } else {
                adjustment = r > center ? MIDPOINT_TIE_NUDGE : -MIDPOINT_TIE_NUDGE;
            }
            corrected.add((int) Math.rint(Descriptive.clamp(r + adjustment, scaleMin, scaleMax)));
        }
        return corrected;
    }

    List<Integer> correctAcquiescence(List<Integer> responses, Set<Integer> reverseItems) {
        List<Integer> corrected = new ArrayList<>(responses);
        for (int idx : reverseItems) {
            corrected.set(idx, reverseScore(responses.get(idx)));
        }
        return corrected;
    }

    public int reverseScore(int value) {
        return reversalSum - value;
    }

    private boolean isMidpoint(int value) {
        return value > scaleMin && value < scaleMax;
    }
}
