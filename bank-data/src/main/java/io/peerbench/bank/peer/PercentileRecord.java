package io.peerbench.bank.peer;

import java.util.List;

/**
 * Subject value and per-group standing for one metric.
 */
public record PercentileRecord(String metric, String metricName, Double subjectValue,
                               List<GroupStats> groups, PerformanceFlag flag, String flagLabel) {
    public PercentileRecord {
        groups = List.copyOf(groups);
    }
}
