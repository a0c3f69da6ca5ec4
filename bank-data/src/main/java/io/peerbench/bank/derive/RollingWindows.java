package io.peerbench.bank.derive;

import java.util.ArrayList;
import java.util.List;
import java.util.function.DoubleBinaryOperator;

/**
 * Trailing statistics over the last {@code window} observations of a series. A value is only emitted once
 * {@code window} observations are available and all of them are present.
 */
public final class RollingWindows {
    private RollingWindows() {}

    public static List<Double> mean(List<Double> series, int window) {
        List<Double> sums = sum(series, window);
        List<Double> out = new ArrayList<>(sums.size());
        for (Double s : sums) out.add(s == null ? null : s / window);
        return out;
    }

    public static List<Double> sum(List<Double> series, int window) {
        if (window < 1) throw new IllegalArgumentException("window must be positive: " + window);
        List<Double> out = new ArrayList<>(series.size());
        for (int i = 0; i < series.size(); i++) {
            if (i + 1 < window) {
                out.add(null);
                continue;
            }
            double total = 0.0;
            boolean complete = true;
            for (int j = i - window + 1; j <= i; j++) {
                Double v = series.get(j);
                if (v == null) {
                    complete = false;
                    break;
                }
                total += v;
            }
            out.add(complete ? total : null);
        }
        return out;
    }

    /** Percent change against the value {@code lag} observations back. */
    public static List<Double> growth(List<Double> series, int lag) {
        List<Double> out = new ArrayList<>(series.size());
        for (int i = 0; i < series.size(); i++) {
            out.add(i < lag ? null : safeGrowth(series.get(i), series.get(i - lag)));
        }
        return out;
    }

    /** 0 to 0 is 0 %, 0 to anything else is undefined (null). */
    public static Double safeGrowth(Double current, Double previous) {
        if (current == null || previous == null) return null;
        if (previous == 0.0) return current == 0.0 ? 0.0 : null;
        return (current - previous) / Math.abs(previous) * 100.0;
    }

    /** Element-wise combination; null wherever either side is null. */
    public static List<Double> combine(List<Double> a, List<Double> b, DoubleBinaryOperator op) {
        if (a.size() != b.size()) throw new IllegalArgumentException("series differ in length");
        List<Double> out = new ArrayList<>(a.size());
        for (int i = 0; i < a.size(); i++) {
            Double x = a.get(i);
            Double y = b.get(i);
            out.add(x == null || y == null ? null : op.applyAsDouble(x, y));
        }
        return out;
    }
}
