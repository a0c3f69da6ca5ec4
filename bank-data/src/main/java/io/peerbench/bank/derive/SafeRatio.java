package io.peerbench.bank.derive;

import java.util.ArrayList;
import java.util.List;

/**
 * Division that never yields NaN or infinity: a zero or missing denominator gives the fill value, and so does
 * a missing numerator.
 */
public final class SafeRatio {
    public static final double DEFAULT_FILL = 0.0;

    private SafeRatio() {}

    public static double of(Double numerator, Double denominator) {
        return of(numerator, denominator, DEFAULT_FILL);
    }

    public static double of(Double numerator, Double denominator, double fill) {
        if (numerator == null || denominator == null || denominator == 0.0) return fill;
        double r = numerator / denominator;
        return Double.isNaN(r) || Double.isInfinite(r) ? fill : r;
    }

    /** Element-wise form; the two series must be aligned. */
    public static List<Double> of(List<Double> numerators, List<Double> denominators, double fill) {
        if (numerators.size() != denominators.size()) throw new IllegalArgumentException("series differ in length");
        List<Double> out = new ArrayList<>(numerators.size());
        for (int i = 0; i < numerators.size(); i++) out.add(of(numerators.get(i), denominators.get(i), fill));
        return out;
    }
}
