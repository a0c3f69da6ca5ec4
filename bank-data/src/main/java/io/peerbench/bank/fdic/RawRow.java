package io.peerbench.bank.fdic;

import java.time.LocalDate;
import java.util.Map;

/**
 * One institution-quarter returned by the financials endpoint; absent fields are not in {@code values}.
 */
public record RawRow(int cert, LocalDate period, String name, Map<String, Double> values) {
    public RawRow {
        values = Map.copyOf(values);
    }

    public RawRow with(String field, Double value) {
        if (value == null) return this;
        java.util.HashMap<String, Double> next = new java.util.HashMap<>(values);
        next.put(field, value);
        return new RawRow(cert, period, name, next);
    }
}
