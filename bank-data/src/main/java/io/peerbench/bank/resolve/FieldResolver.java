package io.peerbench.bank.resolve;

import io.peerbench.bank.model.MetricFrame;
import io.peerbench.bank.model.ObservationKey;
import io.peerbench.bank.model.RawTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies resolution rules row by row. Every raw field is carried into the resolved row; rule outputs
 * override fields of the same code. A rule takes its first candidate that is present and non-zero,
 * otherwise the metric resolves to 0.0, so "no data" and "true zero" look the same downstream.
 */
public class FieldResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(FieldResolver.class);

    private final List<ResolutionRule> rules;

    public FieldResolver(List<ResolutionRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public Map<String, Double> resolve(Map<String, Double> raw) {
        Map<String, Double> row = new HashMap<>(raw);
        ResolutionContext ctx = row::get;
        for (ResolutionRule rule : rules) {
            row.put(rule.metric(), first(rule, ctx));
        }
        return row;
    }

    static double first(ResolutionRule rule, ResolutionContext ctx) {
        for (Candidate c : rule.candidates()) {
            Double v = c.evaluate(ctx);
            if (v != null && !v.isNaN() && v != 0.0) return v;
        }
        return 0.0;
    }

    /** Resolves every row of a frozen raw table into a new frame. */
    public MetricFrame resolveAll(RawTable table) {
        if (!table.isFrozen()) throw new IllegalStateException("raw table must be frozen before resolution");
        MetricFrame frame = new MetricFrame();
        for (ObservationKey key : table.keys()) {
            frame.putRow(key, resolve(table.row(key)));
        }
        table.names().forEach(frame::setName);
        LOGGER.info("Resolved {} row(s) with {} rule(s)", frame.size(), rules.size());
        return frame;
    }
}
