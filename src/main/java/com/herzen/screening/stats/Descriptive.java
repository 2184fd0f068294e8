package com.herzen.screening.stats;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.OptionalDouble;

public final class Descriptive {

    private Descriptive() {}

    public static double mean(List<? extends Number> values) {
        return values.stream().mapToDouble(Number::doubleValue).average().orElse(0.0);
    }

    // population variance, divides by n
    public static double variance(List<? extends Number> values) {
        if (values.isEmpty()) return 0.0;
        double m = mean(values);
        double sum = 0.0;
        for (Number v : values) {
            double d = v.doubleValue() - m;
            sum += d * d;
        }
        return sum / values.size();
    }

    public static double standardDeviation(List<? extends Number> values) {
        return Math.sqrt(variance(values));
    }

    // empty when either side has zero variance
    public static OptionalDouble pearson(List<? extends Number> xs, List<? extends Number> ys) {
        if (xs.size() != ys.size()) {
            throw new IllegalArgumentException("samples differ in size: " + xs.size() + " vs " + ys.size());
        }
        if (xs.size() < 2) return OptionalDouble.empty();
        double mx = mean(xs);
        double my = mean(ys);
        double sxy = 0.0, sxx = 0.0, syy = 0.0;
        for (int i = 0; i < xs.size(); i++) {
            double dx = xs.get(i).doubleValue() - mx;
            double dy = ys.get(i).doubleValue() - my;
            sxy += dx * dy;
            sxx += dx * dx;
            syy += dy * dy;
        }
        if (sxx == 0.0 || syy == 0.0) return OptionalDouble.empty();
        double r = sxy / Math.sqrt(sxx * syy);
        return OptionalDouble.of(Math.max(-1.0, Math.min(1.0, r)));
    }

    // rounds the exact binary value, so 2.675 (stored as 2.67499...) becomes 2.67
    public static double round(double value, int places) {
        if (Double.isNaN(value) || Double.isInfinite(value)) return value;
        return new BigDecimal(value).setScale(places, RoundingMode.HALF_EVEN).doubleValue();
    }

    public static double clamp(double value, double lo, double hi) {
        return Math.max(lo, Math.min(hi, value));
    }
}
