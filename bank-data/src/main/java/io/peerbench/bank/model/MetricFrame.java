package io.peerbench.bank.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Resolved and derived values keyed by (cert, period). A null value means "not computed".
 * Rows iterate by cert, then ascending period, so each institution's slice is a time series.
 * Single-threaded: built once per run after the raw table is frozen.
 */
public class MetricFrame {
    private final TreeMap<ObservationKey, Map<String, Double>> rows = new TreeMap<>();
    private final LinkedHashSet<String> columns = new LinkedHashSet<>();
    private final Map<Integer, String> names = new HashMap<>();

    public void put(ObservationKey key, String metric, Double value) {
        rows.computeIfAbsent(key, k -> new HashMap<>()).put(metric, value);
        columns.add(metric);
    }

    public void putRow(ObservationKey key, Map<String, Double> values) {
        values.forEach((metric, value) -> put(key, metric, value));
    }

    public Double get(ObservationKey key, String metric) {
        Map<String, Double> row = rows.get(key);
        return row == null ? null : row.get(metric);
    }

    public boolean contains(ObservationKey key) {
        return rows.containsKey(key);
    }

    public Map<String, Double> row(ObservationKey key) {
        Map<String, Double> row = rows.get(key);
        return row == null ? Map.of() : Collections.unmodifiableMap(row);
    }

    public NavigableSet<ObservationKey> keys() {
        return Collections.unmodifiableNavigableSet(rows.navigableKeySet());
    }

    public NavigableSet<Integer> certs() {
        TreeSet<Integer> certs = new TreeSet<>();
        rows.keySet().forEach(k -> certs.add(k.cert()));
        return certs;
    }

    /** Ascending report dates of one institution. */
    public List<LocalDate> periods(int cert) {
        List<LocalDate> out = new ArrayList<>();
        slice(cert).keySet().forEach(k -> out.add(k.period()));
        return out;
    }

    /** Values of one metric aligned with {@link #periods(int)}. */
    public List<Double> series(int cert, String metric) {
        List<Double> out = new ArrayList<>();
        slice(cert).values().forEach(row -> out.add(row.get(metric)));
        return out;
    }

    public void putSeries(int cert, String metric, List<Double> values) {
        List<ObservationKey> keys = new ArrayList<>(slice(cert).keySet());
        if (keys.size() != values.size()) {
            throw new IllegalArgumentException("series length " + values.size() + " != " + keys.size() + " periods for cert " + cert);
        }
        for (int i = 0; i < keys.size(); i++) put(keys.get(i), metric, values.get(i));
    }

    public Optional<LocalDate> latestPeriod(int cert) {
        NavigableMap<ObservationKey, Map<String, Double>> s = slice(cert);
        return s.isEmpty() ? Optional.empty() : Optional.of(s.lastKey().period());
    }

    public Optional<LocalDate> latestPeriod() {
        return rows.keySet().stream().map(ObservationKey::period).max(LocalDate::compareTo);
    }

    public Set<String> columns() {
        return Collections.unmodifiableSet(columns);
    }

    public void setName(int cert, String name) {
        names.put(cert, name);
    }

    public String name(int cert) {
        return names.getOrDefault(cert, "Bank with CERT " + cert);
    }

    public int size() {
        return rows.size();
    }

    private NavigableMap<ObservationKey, Map<String, Double>> slice(int cert) {
        return rows.subMap(new ObservationKey(cert, LocalDate.MIN), true, new ObservationKey(cert, LocalDate.MAX), true);
    }
}
