package io.peerbench.bank.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BinaryOperator;
import java.util.stream.Collectors;

/**
 * Unified raw observations: (cert, period) -> field code -> value. An absent field is simply not stored.
 * <p>
 * Writes into one key go through {@link ConcurrentHashMap#compute} so concurrent writers of the same
 * (cert, period) are serialized. After {@link #freeze()} every write fails.
 */
public class RawTable {
    private final ConcurrentHashMap<ObservationKey, Map<String, Double>> rows = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Integer, String> names = new ConcurrentHashMap<>();
    private volatile boolean frozen;

    /** Adds every non-null value to the row, creating it if needed. */
    public void putRow(ObservationKey key, Map<String, Double> values) {
        checkWritable();
        rows.compute(key, (k, row) -> {
            Map<String, Double> target = row == null ? new ConcurrentHashMap<>() : row;
            values.forEach((field, value) -> {
                if (value != null) target.put(field, value);
            });
            return target;
        });
    }

    public void put(ObservationKey key, String field, Double value) {
        putRow(key, Collections.singletonMap(field, value));
    }

    /**
     * Combines a recovered value into an existing row. Rows that do not exist yet are left alone.
     *
     * @return true if the stored value changed
     */
    public boolean merge(ObservationKey key, String field, Double recovered, BinaryOperator<Double> rule) {
        checkWritable();
        boolean[] changed = {false};
        rows.computeIfPresent(key, (k, row) -> {
            Double existing = row.get(field);
            Double next = rule.apply(existing, recovered);
            if (!Objects.equals(existing, next)) {
                if (next == null) row.remove(field); else row.put(field, next);
                changed[0] = true;
            }
            return row;
        });
        return changed[0];
    }

    public Double get(ObservationKey key, String field) {
        Map<String, Double> row = rows.get(key);
        return row == null ? null : row.get(field);
    }

    public boolean contains(ObservationKey key) {
        return rows.containsKey(key);
    }

    /** Sorted snapshot of one row; empty if the key is unknown. */
    public SortedMap<String, Double> row(ObservationKey key) {
        Map<String, Double> row = rows.get(key);
        return row == null ? Collections.emptySortedMap() : Collections.unmodifiableSortedMap(new TreeMap<>(row));
    }

    public NavigableSet<ObservationKey> keys() {
        return Collections.unmodifiableNavigableSet(new TreeSet<>(rows.keySet()));
    }

    public List<ObservationKey> keysForPeriod(LocalDate period) {
        return rows.keySet().stream()
                .filter(k -> k.period().equals(period))
                .sorted()
                .collect(Collectors.toList());
    }

    /** Distinct report dates, newest first. */
    public List<LocalDate> periodsNewestFirst() {
        return rows.keySet().stream()
                .map(ObservationKey::period)
                .distinct()
                .sorted(Collections.reverseOrder())
                .collect(Collectors.toList());
    }

    public NavigableSet<Integer> certs() {
        return rows.keySet().stream().map(ObservationKey::cert).collect(Collectors.toCollection(TreeSet::new));
    }

    public void setName(int cert, String name) {
        checkWritable();
        if (name != null && !name.isBlank()) names.put(cert, name);
    }

    public String name(int cert) {
        return names.get(cert);
    }

    public Map<Integer, String> names() {
        return Collections.unmodifiableMap(new TreeMap<>(names));
    }

    public int size() {
        return rows.size();
    }

    /** Ends the mutable phase. */
    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    private void checkWritable() {
        if (frozen) throw new IllegalStateException("raw table is frozen");
    }
}
