package com.herzen.screening.style;

import com.herzen.screening.style.StyleModels.StyleInterpretation;
import com.herzen.screening.style.StyleModels.StyleScores;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class StyleInterpretationService {
    public static final String NORMAL = "normal";
    public static final String HIGH = "high";
    public static final String VERY_HIGH = "very_high";

    private static final List<Band> EXTREME_BANDS = List.of(
            new Band(0.8, new StyleInterpretation(VERY_HIGH,
                    "Almost every item was answered at an extreme (1 or 4).",
                    "Consider the middle options too.")),
            new Band(0.6, new StyleInterpretation(HIGH,
                    "Many items were answered at an extreme.",
                    "Try choosing 2 or 3 where your view is less clear-cut.")),
            new Band(Double.NEGATIVE_INFINITY, new StyleInterpretation(NORMAL,
                    "Extreme answering is within the normal range.", null))
    );

    private static final List<Band> MIDPOINT_BANDS = List.of(
            new Band(0.8, new StyleInterpretation(VERY_HIGH,
                    "Most items were answered with 2 or 3.",
                    "If you feel sure, 1 or 4 are fine choices.")),
            new Band(0.6, new StyleInterpretation(HIGH,
                    "Middle answers were chosen often.",
                    "Where you have a clear opinion, an extreme answer is fine.")),
            new Band(Double.NEGATIVE_INFINITY, new StyleInterpretation(NORMAL,
                    "Midpoint answering is within the normal range.", null))
    );

    private static final List<Band> ACQUIESCENCE_BANDS = List.of(
            new Band(0.7, new StyleInterpretation(HIGH,
                    "There is a tendency to agree with every statement.",
                    "Read reversed statements carefully.")),
            new Band(Double.NEGATIVE_INFINITY, new StyleInterpretation(NORMAL,
                    "Agreement tendency is within the normal range.", null))
    );

    public Map<String, StyleInterpretation> interpret(StyleScores scores) {
        Map<String, StyleInterpretation> out = new LinkedHashMap<>();
        out.put(StyleModels.EXTREME_RESPONDING, lookup(EXTREME_BANDS, scores.extremeResponding()));
        out.put(StyleModels.MIDPOINT_RESPONDING, lookup(MIDPOINT_BANDS, scores.midpointResponding()));
        if (scores.acquiescence() != null) {
            out.put(StyleModels.ACQUIESCENCE, lookup(ACQUIESCENCE_BANDS, scores.acquiescence()));
        }
        return out;
    }

    private static StyleInterpretation lookup(List<Band> bands, double score) {
        return bands.stream()
                .filter(b -> score > b.above())
                .findFirst()
                .map(Band::interpretation)
                .orElse(bands.get(bands.size() - 1).interpretation());
    }

    private record Band(double above, StyleInterpretation interpretation) {}
}
