package io.peerbench.bank.derive;

import io.peerbench.bank.model.ObservationKey;
import io.peerbench.bank.model.RawTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * How well each requested raw field is populated, so gaps show up instead of disappearing into zero fills.
 */
public class CoverageReport {
    public static final double SPARSE_BELOW_PCT = 25.0;
    private static final Set<String> IDENTIFIERS = Set.of("CERT", "NAME", "REPDTE");

    public enum Status { EMPTY, SPARSE, AVAILABLE }

    public record Entry(String field, Status status, double coveragePct, String description) {
    }

    private final List<Entry> entries;

    private CoverageReport(List<Entry> entries) {
        this.entries = List.copyOf(entries);
    }

    /**
     * @param describe short description per field code; may return null
     */
    public static CoverageReport analyze(RawTable table, List<String> fields, Function<String, String> describe) {
        List<Entry> out = new ArrayList<>();
        int total = table.size();
        Set<ObservationKey> keys = table.keys();
        for (String field : fields) {
            if (IDENTIFIERS.contains(field)) continue;
            long present = 0;
            for (ObservationKey key : keys) {
                if (table.get(key, field) != null) present++;
            }
            double pct = total == 0 ? 0.0 : Math.round(present * 1000.0 / total) / 10.0;
            Status status = present == 0 ? Status.EMPTY : pct < SPARSE_BELOW_PCT ? Status.SPARSE : Status.AVAILABLE;
            out.add(new Entry(field, status, pct, describe.apply(field)));
        }
        return new CoverageReport(out);
    }

    public List<Entry> entries() {
        return entries;
    }

    public List<String> fieldsWith(Status status) {
        return entries.stream().filter(e -> e.status() == status).map(Entry::field).collect(Collectors.toList());
    }
}
