package io.peerbench.bank.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeMap;

/**
 * One row per institution, columns in insertion order. Used for the latest snapshot and long-run averages.
 */
public class InstitutionTable {
    private final TreeMap<Integer, Map<String, Double>> rows = new TreeMap<>();
    private final Map<Integer, String> names = new TreeMap<>();
    private final LinkedHashSet<String> columns = new LinkedHashSet<>();

    public void put(int cert, String column, Double value) {
        rows.computeIfAbsent(cert, c -> new LinkedHashMap<>()).put(column, value);
        columns.add(column);
    }

    public Double get(int cert, String column) {
        Map<String, Double> row = rows.get(cert);
        return row == null ? null : row.get(column);
    }

    public Map<String, Double> row(int cert) {
        Map<String, Double> row = rows.get(cert);
        return row == null ? Map.of() : Collections.unmodifiableMap(row);
    }

    public void setName(int cert, String name) {
        names.put(cert, name);
        rows.computeIfAbsent(cert, c -> new LinkedHashMap<>());
    }

    public String name(int cert) {
        return names.get(cert);
    }

    public NavigableSet<Integer> certs() {
        return Collections.unmodifiableNavigableSet(rows.navigableKeySet());
    }

    public Set<String> columns() {
        return Collections.unmodifiableSet(columns);
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
