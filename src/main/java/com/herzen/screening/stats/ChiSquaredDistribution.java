package com.herzen.screening.stats;

// regularized incomplete gamma: series below a + 1, Lentz continued fraction above
public final class ChiSquaredDistribution {
    private static final int MAX_ITERATIONS = 1000;
    private static final double EPSILON = 1e-15;
    private static final double TINY = 1e-300;

    private static final double[] LANCZOS = {
            0.99999999999980993, 676.5203681218851, -1259.1392167224028,
            771.32342877765313, -176.61502916214059, 12.507343278686905,
            -0.13857109526572012, 9.9843695780195716e-6, 1.5056327351493116e-7
    };

    private ChiSquaredDistribution() {}

    public static double cdf(double x, int degreesOfFreedom) {
        requireDf(degreesOfFreedom);
        if (x <= 0.0) return 0.0;
        if (Double.isInfinite(x)) return 1.0;
        return regularizedLowerGamma(degreesOfFreedom / 2.0, x / 2.0);
    }

    // computed directly so small p-values keep their precision
    public static double survival(double x, int degreesOfFreedom) {
        requireDf(degreesOfFreedom);
        if (x <= 0.0) return 1.0;
        if (Double.isInfinite(x)) return 0.0;
        return regularizedUpperGamma(degreesOfFreedom / 2.0, x / 2.0);
    }

    public static double inverseCdf(double probability, int degreesOfFreedom) {
        requireDf(degreesOfFreedom);
        if (!(probability >= 0.0 && probability < 1.0)) {
            throw new IllegalArgumentException("probability must be in [0, 1), got " + probability);
        }
        if (probability == 0.0) return 0.0;

        double lo = 0.0;
        double hi = Math.max(1.0, degreesOfFreedom);
        while (cdf(hi, degreesOfFreedom) < probability) {
            lo = hi;
            hi *= 2.0;
        }
        for (int i = 0; i < 200 && hi - lo > 1e-12 * Math.max(1.0, hi); i++) {
            double mid = 0.5 * (lo + hi);
            if (cdf(mid, degreesOfFreedom) < probability) {
                lo = mid;
            } else {
                hi = mid;
            }
        }
        return 0.5 * (lo + hi);
    }

    static double logGamma(double x) {
        if (x < 0.5) {
            return Math.log(Math.PI / Math.abs(Math.sin(Math.PI * x))) - logGamma(1.0 - x);
        }
        x -= 1.0;
        double a = LANCZOS[0];
        double t = x + 7.5;
        for (int i = 1; i < LANCZOS.length; i++) {
            a += LANCZOS[i] / (x + i);
        }
        return 0.5 * Math.log(2 * Math.PI) + (x + 0.5) * Math.log(t) - t + Math.log(a);
    }

    static double regularizedLowerGamma(double a, double x) {
        if (x < a + 1.0) {
            return gammaSeries(a, x);
        }
        return 1.0 - gammaContinuedFraction(a, x);
    }

    static double regularizedUpperGamma(double a, double x) {
        if (x < a + 1.0) {
            return 1.0 - gammaSeries(a, x);
        }
        return gammaContinuedFraction(a, x);
    }

    private static double gammaSeries(double a, double x) {
        double ap = a;
        double sum = 1.0 / a;
        double del = sum;
        for (int n = 0; n < MAX_ITERATIONS; n++) {
            ap += 1.0;
            del *= x / ap;
            sum += del;
            if (Math.abs(del) < Math.abs(sum) * EPSILON) break;
        }
        return sum * Math.exp(-x + a * Math.log(x) - logGamma(a));
    }

    private static double gammaContinuedFraction(double a, double x) {
        double b = x + 1.0 - a;
        double c = 1.0 / TINY;
        double d = 1.0 / b;
        double h = d;
        for (int i = 1; i <= MAX_ITERATIONS; i++) {
            double an = -i * (i - a);
            b += 2.0;
            d = an * d + b;
            if (Math.abs(d) < TINY) d = TINY;
            c = b + an / c;
            if (Math.abs(c) < TINY) c = TINY;
            d = 1.0 / d;
            double delta = d * c;
            h *= delta;
            if (Math.abs(delta - 1.0) < EPSILON) break;
        }
        return Math.exp(-x + a * Math.log(x) - logGamma(a)) * h;
    }

    private static void requireDf(int degreesOfFreedom) {
        if (degreesOfFreedom < 1) {
            throw new IllegalArgumentException("degrees of freedom must be positive, got " + degreesOfFreedom);
        }
    }
}
