package com.herzen.screening.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;
import java.util.Objects;

@ConfigurationProperties(prefix = "screening")
public record ScreeningProperties(@DefaultValue Instrument instrument,
                                  @DefaultValue Quality quality,
                                  @DefaultValue Style style) {

    // 0-based
    public static final List<Integer> ROSENBERG_REVERSE_ITEMS = List.of(2, 4, 7, 8, 9, 13, 14, 15, 19, 20, 21);

    public ScreeningProperties {
        Objects.requireNonNull(instrument, "instrument");
        Objects.requireNonNull(quality, "quality");
        Objects.requireNonNull(style, "style");
    }

    public static ScreeningProperties defaults() {
        return new ScreeningProperties(Instrument.defaults(), Quality.defaults(), Style.defaults());
    }

    public ScreeningProperties withQuality(Quality quality) {
        return new ScreeningProperties(instrument, quality, style);
    }

    public ScreeningProperties withStyle(Style style) {
        return new ScreeningProperties(instrument, quality, style);
    }

    public record Instrument(@DefaultValue("50") int length,
                             @DefaultValue("1") int scaleMin,
                             @DefaultValue("4") int scaleMax,
                             @DefaultValue({"2", "4", "7", "8", "9", "13", "14", "15", "19", "20", "21"}) List<Integer> reverseItems) {
        public Instrument {
            if (length < 1) {
                throw new IllegalArgumentException("screening.instrument.length must be positive, got " + length);
            }
            if (scaleMin >= scaleMax) {
                throw new IllegalArgumentException("screening.instrument.scale-min must be below scale-max, got "
                        + scaleMin + ".." + scaleMax);
            }
            reverseItems = reverseItems == null ? List.of() : List.copyOf(reverseItems);
            for (Integer idx : reverseItems) {
                if (idx < 0 || idx >= length) {
                    throw new IllegalArgumentException("screening.instrument.reverse-items contains " + idx
                            + ", outside [0, " + length + ")");
                }
            }
        }

        public static Instrument defaults() {
            return new Instrument(50, 1, 4, ROSENBERG_REVERSE_ITEMS);
        }

        public int reversalSum() {
            return scaleMin + scaleMax;
        }
    }

    public record Quality(@DefaultValue("2.0") double minTimePerItem,
                          @DefaultValue("1.0") double fastResponseSeconds,
                          @DefaultValue("3") int consecutiveFastLimit,
                          @DefaultValue("10") int longstringThreshold,
                          @DefaultValue("0.3") double correlationThreshold,
                          @DefaultValue("0.001") double mahalanobisPThreshold,
                          @DefaultValue("0.3") double varianceThreshold) {
        public Quality {
            requirePositive("screening.quality.min-time-per-item", minTimePerItem);
            requirePositive("screening.quality.fast-response-seconds", fastResponseSeconds);
            if (consecutiveFastLimit < 1) {
                throw new IllegalArgumentException("screening.quality.consecutive-fast-limit must be at least 1, got " + consecutiveFastLimit);
            }
            if (longstringThreshold < 2) {
                throw new IllegalArgumentException("screening.quality.longstring-threshold must be at least 2, got " + longstringThreshold);
            }
            requireUnitInterval("screening.quality.correlation-threshold", correlationThreshold);
            if (!(mahalanobisPThreshold > 0.0 && mahalanobisPThreshold < 1.0)) {
                throw new IllegalArgumentException("screening.quality.mahalanobis-p-threshold must be in (0, 1), got " + mahalanobisPThreshold);
            }
            if (!(varianceThreshold >= 0.0) || Double.isInfinite(varianceThreshold)) {
                throw new IllegalArgumentException("screening.quality.variance-threshold must be a non-negative number, got " + varianceThreshold);
            }
        }

        public static Quality defaults() {
            return new Quality(2.0, 1.0, 3, 10, 0.3, 0.001, 0.3);
        }

        public Quality withLongstringThreshold(int threshold) {
            return new Quality(minTimePerItem, fastResponseSeconds, consecutiveFastLimit, threshold,
                    correlationThreshold, mahalanobisPThreshold, varianceThreshold);
        }
    }

    public record Style(@DefaultValue("0.7") double extremeThreshold,
                        @DefaultValue("0.7") double midpointThreshold,
                        @DefaultValue("0.7") double acquiescenceThreshold) {
        public Style {
            requireUnitInterval("screening.style.extreme-threshold", extremeThreshold);
            requireUnitInterval("screening.style.midpoint-threshold", midpointThreshold);
            requireUnitInterval("screening.style.acquiescence-threshold", acquiescenceThreshold);
        }

        public static Style defaults() {
            return new Style(0.7, 0.7, 0.7);
        }
    }

    private static void requireUnitInterval(String name, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(name + " must be in [0, 1], got " + value);
        }
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0.0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(name + " must be a positive number, got " + value);
        }
    }
}
