package io.peerbench.bank.peer;

import io.peerbench.bank.model.Institution;
import io.peerbench.bank.model.InstitutionIds;
import io.peerbench.bank.model.MetricFrame;
import io.peerbench.bank.model.ObservationKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Adds one synthetic institution per peer group whose value at each period is the mean of the members'
 * non-null values. Composites are computed from real members only.
 */
public class PeerCompositeSynthesizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(PeerCompositeSynthesizer.class);
    public static final String COMPOSITE_STATE = "AVG";

    private final PeerCatalog catalog;

    public PeerCompositeSynthesizer(PeerCatalog catalog) {
        this.catalog = catalog;
    }

    /** Adds composite rows to the frame and returns the synthesized institutions. */
    public List<Institution> synthesize(MetricFrame frame) {
        List<String> columns = new ArrayList<>(frame.columns());
        Map<ObservationKey, Map<String, Double>> pending = new LinkedHashMap<>();
        List<Institution> composites = new ArrayList<>();

        for (PeerGroup group : catalog.groups()) {
            TreeMap<LocalDate, List<Map<String, Double>>> byPeriod = new TreeMap<>();
            for (ObservationKey key : frame.keys()) {
                if (InstitutionIds.isComposite(key.cert()) || !group.contains(key.cert())) continue;
                byPeriod.computeIfAbsent(key.period(), p -> new ArrayList<>()).add(frame.row(key));
            }
            if (byPeriod.isEmpty()) {
                LOGGER.warn("No member data for peer group {}; no composite", group.key());
                continue;
            }
            int id = group.compositeId();
            byPeriod.forEach((period, rows) -> pending.put(new ObservationKey(id, period), mean(rows, columns)));
            composites.add(new Institution(id, group.compositeName(), COMPOSITE_STATE, List.of()));
            LOGGER.info("Composite {} ({}) over {} period(s)", id, group.compositeName(), byPeriod.size());
        }

        pending.forEach(frame::putRow);
        composites.forEach(c -> frame.setName(c.cert(), c.name()));
        return composites;
    }

    static Map<String, Double> mean(List<Map<String, Double>> rows, List<String> columns) {
        Map<String, Double> out = new LinkedHashMap<>();
        for (String column : columns) {
            double total = 0.0;
            int n = 0;
            for (Map<String, Double> row : rows) {
                Double v = row.get(column);
                if (v != null && !v.isNaN()) {
                    total += v;
                    n++;
                }
            }
            out.put(column, n == 0 ? null : total / n);
        }
        return out;
    }
}
