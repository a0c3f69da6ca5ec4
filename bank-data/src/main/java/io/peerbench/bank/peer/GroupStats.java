package io.peerbench.bank.peer;

/**
 * Distribution of one metric within one peer group at the subject's latest period.
 *
 * @param percentile subject's rank percentile, null when the subject has no value
 */
public record GroupStats(String groupKey, String shortName, int count,
                         double mean, double median, double p25, double p75, Double percentile) {
}
