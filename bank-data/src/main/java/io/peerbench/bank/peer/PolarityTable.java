package io.peerbench.bank.peer;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Whether a low or a high percentile is good for a metric. A metric is a risk metric when its code contains
 * one of the configured terms, case-insensitively.
 */
public class PolarityTable {
    public enum Polarity { LOWER_IS_BETTER, HIGHER_IS_BETTER }

    public static final List<String> DEFAULT_RISK_TERMS =
            List.of("nco", "npl", "past_due", "nonaccrual", "cost_of_funds", "pd30", "pd90", "risk");

    private final List<String> riskTerms;

    public PolarityTable(List<String> riskTerms) {
        this.riskTerms = riskTerms.stream().map(t -> t.toLowerCase(Locale.ROOT)).collect(Collectors.toList());
    }

    public static PolarityTable defaults() {
        return new PolarityTable(DEFAULT_RISK_TERMS);
    }

    public Polarity polarityOf(String metric) {
        String m = metric.toLowerCase(Locale.ROOT);
        for (String term : riskTerms) {
            if (m.contains(term)) return Polarity.LOWER_IS_BETTER;
        }
        return Polarity.HIGHER_IS_BETTER;
    }

    public PerformanceFlag classify(String metric, Double percentile) {
        if (percentile == null) return PerformanceFlag.NOT_AVAILABLE;
        if (polarityOf(metric) == Polarity.LOWER_IS_BETTER) {
            if (percentile <= 25) return PerformanceFlag.TOP_QUARTILE;
            if (percentile <= 50) return PerformanceFlag.BETTER_THAN_MEDIAN;
            return PerformanceFlag.BOTTOM_QUARTILE;
        }
        if (percentile >= 75) return PerformanceFlag.TOP_QUARTILE;
        if (percentile >= 50) return PerformanceFlag.BETTER_THAN_MEDIAN;
        return PerformanceFlag.BOTTOM_QUARTILE;
    }
}
