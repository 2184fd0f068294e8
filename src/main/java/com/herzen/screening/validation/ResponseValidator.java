package com.herzen.screening.validation;

import com.herzen.screening.config.ScreeningProperties;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

import static com.herzen.screening.validation.ValidationCodes.*;

@Component
public class ResponseValidator {
    private final int scaleMin;
    private final int scaleMax;
    private final int instrumentLength;

    public ResponseValidator(ScreeningProperties properties) {
        this.scaleMin = properties.instrument().scaleMin();
        this.scaleMax = properties.instrument().scaleMax();
        this.instrumentLength = properties.instrument().length();
    }

    public void validateResponses(List<Integer> responses) {
        if (responses == null) {
            throw new InvalidInputException(NULL_INPUT, "responses are required");
        }
        if (responses.isEmpty()) {
            throw new InvalidInputException(EMPTY_VECTOR, "responses must not be empty");
        }
        for (int i = 0; i < responses.size(); i++) {
            Integer value = responses.get(i);
            if (value == null) {
                throw new InvalidInputException(NULL_INPUT, "response at index " + i + " is missing", i);
            }
            if (value < scaleMin || value > scaleMax) {
                throw new InvalidInputException(VALUE_OUT_OF_RANGE,
                        "response at index " + i + " is " + value + ", expected " + scaleMin + ".." + scaleMax, i);
            }
        }
    }

    public void validateScreeningInput(List<Integer> responses, List<Double> responseTimes) {
        validateResponses(responses);
        if (responseTimes == null) {
            throw new InvalidInputException(NULL_INPUT, "response times are required");
        }
        if (responseTimes.size() != responses.size()) {
            throw new InvalidInputException(LENGTH_MISMATCH,
                    "got " + responses.size() + " responses but " + responseTimes.size() + " response times");
        }
        for (int i = 0; i < responseTimes.size(); i++) {
            Double t = responseTimes.get(i);
            if (t == null) {
                throw new InvalidInputException(NULL_INPUT, "response time at index " + i + " is missing", i);
            }
            if (t.isNaN() || t.isInfinite()) {
                throw new InvalidInputException(NON_FINITE_TIME, "response time at index " + i + " is " + t, i);
            }
            if (t < 0.0) {
                throw new InvalidInputException(NEGATIVE_TIME, "response time at index " + i + " is negative: " + t, i);
            }
        }
    }

    public void validateReverseItems(Collection<Integer> reverseItems, int length) {
        if (reverseItems == null) return;
        for (Integer idx : reverseItems) {
            if (idx == null || idx < 0 || idx >= length) {
                throw new InvalidInputException(REVERSE_INDEX_OUT_OF_RANGE,
                        "reverse item " + idx + " is outside [0, " + length + ")", idx == null ? -1 : idx);
            }
        }
    }

    public void validateReferenceData(double[][] referenceData, int length) {
        if (referenceData == null) return;
        for (int r = 0; r < referenceData.length; r++) {
            double[] row = referenceData[r];
            if (row == null || row.length != length) {
                throw new InvalidInputException(REFERENCE_SHAPE,
                        "reference row " + r + " has " + (row == null ? 0 : row.length) + " columns, expected " + length, r);
            }
        }
    }

    public void validateInstrumentLength(List<Integer> responses) {
        if (responses != null && responses.size() != instrumentLength) {
            throw new InvalidInputException(INSTRUMENT_LENGTH,
                    "instrument has " + instrumentLength + " items, got " + responses.size() + " responses");
        }
    }
}
