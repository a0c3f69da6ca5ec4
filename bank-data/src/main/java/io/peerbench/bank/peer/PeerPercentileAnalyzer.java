package io.peerbench.bank.peer;

import io.peerbench.bank.catalog.MetricCatalog;
import io.peerbench.bank.model.InstitutionIds;
import io.peerbench.bank.model.MetricFrame;
import io.peerbench.bank.model.ObservationKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Ranks the subject against each peer group at the subject's latest period, for every cataloged metric the
 * frame carries.
 */
public class PeerPercentileAnalyzer {
    private static final Logger LOGGER = LoggerFactory.getLogger(PeerPercentileAnalyzer.class);

    private final PeerCatalog peers;
    private final PolarityTable polarity;
    private final MetricCatalog metrics;

    public PeerPercentileAnalyzer(PeerCatalog peers, PolarityTable polarity, MetricCatalog metrics) {
        this.peers = peers;
        this.polarity = polarity;
        this.metrics = metrics;
    }

    public List<PercentileRecord> analyze(MetricFrame frame, int subject) {
        Optional<LocalDate> latest = frame.latestPeriod(subject);
        if (latest.isEmpty()) {
            LOGGER.warn("Subject CERT {} has no data; no peer comparison", subject);
            return List.of();
        }
        LocalDate period = latest.get();
        List<PercentileRecord> out = new ArrayList<>();
        for (String metric : metrics.codes()) {
            if (!frame.columns().contains(metric)) continue;
            Double subjectValue = frame.get(new ObservationKey(subject, period), metric);
            List<GroupStats> stats = new ArrayList<>();
            Double primaryPct = null;
            for (PeerGroup group : peers.groups()) {
                List<Double> values = new ArrayList<>();
                for (int cert : group.members()) {
                    if (InstitutionIds.isComposite(cert)) continue;
                    Double v = frame.get(new ObservationKey(cert, period), metric);
                    if (v != null && !v.isNaN()) values.add(v);
                }
                if (values.isEmpty()) continue;
                Collections.sort(values);
                Double pct = subjectValue == null ? null : percentileOfScore(values, subjectValue);
                if (group.key().equals(peers.primary().key())) primaryPct = pct;
                stats.add(new GroupStats(group.key(), group.shortName(), values.size(),
                        mean(values), quantile(values, 0.5), quantile(values, 0.25), quantile(values, 0.75), pct));
            }
            PerformanceFlag flag = polarity.classify(metric, primaryPct);
            out.add(new PercentileRecord(metric, metrics.shortName(metric), subjectValue, stats, flag,
                    flag.label(polarity.polarityOf(metric))));
        }
        LOGGER.info("Compared CERT {} at {} on {} metric(s)", subject, period, out.size());
        return out;
    }

    /** Rank percentile: ties get the average of the strict and weak ranks. */
    static double percentileOfScore(List<Double> values, double score) {
        int below = 0;
        int atOrBelow = 0;
        for (double v : values) {
            if (v < score) below++;
            if (v <= score) atOrBelow++;
        }
        int n = values.size();
        return (below + atOrBelow + (atOrBelow > below ? 1 : 0)) * 50.0 / n;
    }

    /** Linear interpolation between closest ranks; {@code sorted} must be ascending and non-empty. */
    static double quantile(List<Double> sorted, double q) {
        double pos = q * (sorted.size() - 1);
        int lo = (int) Math.floor(pos);
        int hi = (int) Math.ceil(pos);
        return sorted.get(lo) + (sorted.get(hi) - sorted.get(lo)) * (pos - lo);
    }

    private static double mean(List<Double> values) {
        double total = 0.0;
        for (double v : values) total += v;
        return total / values.size();
    }
}
