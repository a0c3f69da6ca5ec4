package io.peerbench.bank.resolve;

import io.peerbench.bank.derive.CategoryTaxonomy;
import io.peerbench.bank.derive.FiscalCalendar;
import io.peerbench.bank.derive.MetricsDerivationEngine;
import io.peerbench.bank.model.MetricFrame;
import io.peerbench.bank.model.ObservationKey;
import io.peerbench.bank.model.RawTable;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FieldResolverTest {
    private static final ResolutionRule RULE = ResolutionRule.of("M",
            Candidate.raw("X"), Candidate.raw("Y"),
            Candidate.derived("Z - W", row -> row.valueOrZero("Z") - row.valueOrZero("W")));
    private final FieldResolver resolver = new FieldResolver(List.of(RULE));

    @Test
    void firstPresentCandidateWins() {
        assertEquals(100.0, resolver.resolve(Map.of("X", 100.0)).get("M"));
    }

    @Test
    void zerosFallThroughToLaterCandidates() {
        Map<String, Double> row = Map.of("X", 0.0, "Y", 0.0, "Z", 300.0, "W", 50.0);
        assertEquals(250.0, resolver.resolve(row).get("M"));
    }

    @Test
    void nothingUsableResolvesToZero() {
        assertEquals(0.0, resolver.resolve(Map.of()).get("M"));
        assertEquals(0.0, resolver.resolve(Map.of("X", 0.0, "Z", 10.0, "W", 10.0)).get("M"));
        Map<String, Double> nan = new HashMap<>();
        nan.put("X", Double.NaN);
        nan.put("Y", 7.0);
        assertEquals(7.0, resolver.resolve(nan).get("M"));
    }

    @Test
    void rawFieldsAreCarriedThrough() {
        Map<String, Double> resolved = resolver.resolve(Map.of("X", 1.0, "ASSET", 5000.0));
        assertEquals(5000.0, resolved.get("ASSET"));
        assertEquals(1.0, resolved.get("X"));
    }

    @Test
    void ruleWithoutCandidatesIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ResolutionRule("M", List.of()));
    }

    @Test
    void defaultRulesPreferConsolidatedOverDomestic() {
        FieldResolver defaults = new FieldResolver(FallbackCatalog.defaultRules());
        Map<String, Double> row = defaults.resolve(Map.of(
                "RCFD1545", 0.0, "RCON1545", 75.0,
                "RCFDJ466", 10.0, "RCONJ466", 8.0,
                "LNCON", 100.0, "LNAUTO", 60.0, "LNCRCD", 50.0,
                "LNATRES", 40.0));

        assertEquals(75.0, row.get("LNOTHPCS"));
        assertEquals(10.0, row.get(FallbackCatalog.ricBest("Constr")));
        assertEquals(0.0, row.get(FallbackCatalog.ricBest("Resi")));
        assertEquals(0.0, row.get("LNCONOTHX"));
        assertEquals(60.0, row.get("LNCONAUTO"));
        assertEquals(40.0, row.get("Total_ACL"));
    }

    @Test
    void resolveAllRequiresAFrozenTable() {
        RawTable raw = new RawTable();
        ObservationKey key = new ObservationKey(34221, LocalDate.of(2024, 3, 31));
        raw.put(key, "Y", 20.0);
        raw.setName(34221, "Subject Bank");

        assertThrows(IllegalStateException.class, () -> resolver.resolveAll(raw));

        raw.freeze();
        MetricFrame frame = resolver.resolveAll(raw);
        assertEquals(20.0, frame.get(key, "M"));
        assertEquals("Subject Bank", frame.name(34221));
        assertThrows(IllegalStateException.class, () -> raw.put(key, "Y", 1.0));
    }

    private static Map<ObservationKey, Map<String, Double>> sampleRows() {
        Map<ObservationKey, Map<String, Double>> rows = new HashMap<>();
        List<LocalDate> periods = List.of(
                LocalDate.of(2023, 3, 31), LocalDate.of(2023, 6, 30), LocalDate.of(2023, 9, 30),
                LocalDate.of(2023, 12, 31), LocalDate.of(2024, 3, 31));
        for (int cert : List.of(34221, 628, 3510)) {
            for (int i = 0; i < periods.size(); i++) {
                int ytd = periods.get(i).getMonthValue() / 3;
                Map<String, Double> row = new HashMap<>();
                row.put("LNLS", 1000.0 + cert % 7 * 10 + i);
                row.put("NTLNLS", 2.0 * ytd + cert % 3);
                row.put("NTCI", 1.0 * ytd);
                row.put("EINTEXP", 5.0 * ytd);
                row.put("DEP", 900.0);
                row.put("LNCI", 400.0);
                row.put("LNCON", 100.0);
                row.put("LNAUTO", 60.0);
                row.put("RCFD1545", 0.0);
                row.put("RCON1545", 20.0 + i);
                row.put("LNATRES", 12.0);
                row.put("RBCT1J", 110.0);
                rows.put(new ObservationKey(cert, periods.get(i)), row);
            }
        }
        return rows;
    }

    private static MetricFrame resolveAndDerive(List<Map.Entry<ObservationKey, Map<String, Double>>> rows) {
        RawTable raw = new RawTable();
        rows.forEach(e -> raw.putRow(e.getKey(), e.getValue()));
        raw.freeze();
        MetricFrame frame = new FieldResolver(FallbackCatalog.defaultRules()).resolveAll(raw);
        new MetricsDerivationEngine(FiscalCalendar.calendarYear(), CategoryTaxonomy.defaults()).derive(frame);
        return frame;
    }

    @Test
    void identicalInputGivesIdenticalFramesRegardlessOfInsertionOrder() {
        List<Map.Entry<ObservationKey, Map<String, Double>>> ordered = new ArrayList<>(sampleRows().entrySet());
        ordered.sort(Map.Entry.comparingByKey());
        List<Map.Entry<ObservationKey, Map<String, Double>>> reversed = new ArrayList<>(ordered);
        Collections.reverse(reversed);

        MetricFrame first = resolveAndDerive(ordered);
        MetricFrame second = resolveAndDerive(reversed);

        assertEquals(first.keys(), second.keys());
        assertEquals(first.columns(), second.columns());
        assertFalse(first.columns().isEmpty());
        for (ObservationKey key : first.keys()) {
            for (String column : first.columns()) {
                assertEquals(first.get(key, column), second.get(key, column), key + " " + column);
            }
        }
    }
}
