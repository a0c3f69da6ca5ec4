package io.peerbench.bank.peer;

/** Qualitative standing of the subject within the primary peer group. */
public enum PerformanceFlag {
    TOP_QUARTILE,
    BETTER_THAN_MEDIAN,
    BOTTOM_QUARTILE,
    NOT_AVAILABLE;

    public String label(PolarityTable.Polarity polarity) {
        boolean risk = polarity == PolarityTable.Polarity.LOWER_IS_BETTER;
        return switch (this) {
            case TOP_QUARTILE -> risk ? "Top Quartile (Low Risk)" : "Top Quartile (Strong)";
            case BETTER_THAN_MEDIAN -> "Better than Median";
            case BOTTOM_QUARTILE -> risk ? "Bottom Quartile (High Risk)" : "Bottom Quartile (Weak)";
            case NOT_AVAILABLE -> "N/A";
        };
    }
}
