package io.peerbench.bank.derive;

import io.peerbench.bank.model.InstitutionTable;
import io.peerbench.bank.model.MetricFrame;
import io.peerbench.bank.model.ObservationKey;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Key metrics of every institution reporting at the most recent period. Loan/allowance group shares and
 * RI-C allowance shares are scaled to percentages here.
 */
public class LatestSnapshot {
    private static final List<String> BASE = List.of(
            "LNLS", "Total_ACL", "Total_Capital", "Allowance_to_Gross_Loans_Rate", "TTM_NCO_Rate");
    private static final List<String> GROUPS = List.of("Commercial", "Residential", "CRE", "OtherSBL");

    private final List<LoanCategory> categories;

    public LatestSnapshot(List<LoanCategory> categories) {
        this.categories = List.copyOf(categories);
    }

    public InstitutionTable build(MetricFrame frame) {
        InstitutionTable out = new InstitutionTable();
        Optional<LocalDate> latest = frame.latestPeriod();
        if (latest.isEmpty()) return out;
        for (int cert : frame.certs()) {
            ObservationKey key = new ObservationKey(cert, latest.get());
            if (!frame.contains(key)) continue;
            Map<String, Double> row = frame.row(key);
            out.setName(cert, frame.name(cert));
            for (String m : BASE) out.put(cert, m, row.get(m));
            for (LoanCategory cat : categories) {
                out.put(cert, cat.key() + "_TTM_NA_Rate", row.get(cat.key() + "_TTM_NA_Rate"));
                out.put(cert, cat.key() + "_Composition", row.get(cat.key() + "_Composition"));
            }
            for (String g : GROUPS) {
                out.put(cert, "Group_" + g + "_ACL_Share", percent(row.get("Group_" + g + "_ACL_Share")));
                out.put(cert, "Group_" + g + "_Loan_Share", percent(row.get("Group_" + g + "_Loan_Share")));
            }
            for (Map.Entry<String, Double> e : new TreeMap<>(row).entrySet()) {
                if (e.getKey().startsWith("RIC_") && e.getKey().endsWith("_ACL_Pct")) {
                    out.put(cert, e.getKey(), percent(e.getValue()));
                }
            }
        }
        return out;
    }

    private static Double percent(Double fraction) {
        return fraction == null ? null : fraction * 100.0;
    }
}
