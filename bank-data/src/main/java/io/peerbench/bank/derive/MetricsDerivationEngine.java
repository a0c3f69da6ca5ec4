package io.peerbench.bank.derive;

import io.peerbench.bank.model.MetricFrame;
import io.peerbench.bank.model.ObservationKey;
import io.peerbench.bank.resolve.FallbackCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adds quarterly, aggregate, ratio and trailing-window columns to a resolved frame.
 * <p>
 * Rates are percentages. Group loan/allowance shares and RI-C allowance shares are fractions.
 * Trailing values stay null until the window has enough observations.
 */
public class MetricsDerivationEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(MetricsDerivationEngine.class);

    public static final int DEFAULT_TTM_WINDOW = 4;
    public static final int DEFAULT_CRE_GROWTH_LAG = 12;

    private static final List<String> NONACCRUAL_FIELDS = List.of("NACI", "NARENROT", "NARECONS", "NARERES", "NACON");
    private static final List<String> INTEREST_BEARING = List.of("DEP", "FREPP", "OTHBOR");
    private static final String[][] RIC_SHARES = {
            {"Constr", "RIC_Constr_ACL_Pct"},
            {"CommRE", "RIC_CommRE_ACL_Pct"},
            {"Resi", "RIC_Resi_ACL_Pct"},
            {"Comm", "RIC_Comm_ACL_Pct"},
            {"Card", "RIC_CreditCard_ACL_Pct"},
            {"OthCons", "RIC_OtherCons_ACL_Pct"},
            {"Other", "RIC_Other_ACL_Pct"},
            {"Unalloc", "RIC_Unallocated_ACL_Pct"},
    };
    static final List<String> CAPITAL_MIX = List.of("Common_Stock_Pct", "EQSUR_Pct", "Retained_Earnings_Pct", "Preferred_Stock_Pct");

    /** A quarterly value that spans more than one quarter and needs manual review. */
    public record YtdGapFlag(int cert, LocalDate period, String field) {
    }

    private final YtdConverter ytd;
    private final List<LoanCategory> categories;
    private final int ttmWindow;
    private final int creGrowthLag;

    public MetricsDerivationEngine(FiscalCalendar calendar, List<LoanCategory> categories) {
        this(calendar, categories, DEFAULT_TTM_WINDOW, DEFAULT_CRE_GROWTH_LAG);
    }

    public MetricsDerivationEngine(FiscalCalendar calendar, List<LoanCategory> categories, int ttmWindow, int creGrowthLag) {
        if (ttmWindow < 1 || creGrowthLag < 1) throw new IllegalArgumentException("windows must be positive");
        this.ytd = new YtdConverter(calendar);
        this.categories = List.copyOf(categories);
        this.ttmWindow = ttmWindow;
        this.creGrowthLag = creGrowthLag;
    }

    /** Derives every column in place and returns the periods whose quarterly value spans a gap. */
    public List<YtdGapFlag> derive(MetricFrame frame) {
        List<YtdGapFlag> flags = convertYtd(frame);
        for (ObservationKey key : new ArrayList<>(frame.keys())) {
            frame.putRow(key, pointInTime(frame.row(key)));
        }
        for (int cert : frame.certs()) {
            trailing(frame, cert);
        }
        LOGGER.info("Derived {} column(s) over {} row(s); {} YTD gap flag(s)", frame.columns().size(), frame.size(), flags.size());
        return flags;
    }

    List<YtdGapFlag> convertYtd(MetricFrame frame) {
        List<String> fields = new ArrayList<>();
        for (String c : frame.columns()) {
            if (YtdConverter.isYtdField(c)) fields.add(c);
        }
        List<YtdGapFlag> flags = new ArrayList<>();
        for (int cert : frame.certs()) {
            List<LocalDate> periods = frame.periods(cert);
            for (String field : fields) {
                YtdConverter.Conversion c = ytd.convert(periods, frame.series(cert, field));
                frame.putSeries(cert, field + "_Q", c.quarterly());
                c.flagged().forEach(p -> flags.add(new YtdGapFlag(cert, p, field)));
            }
        }
        return flags;
    }

    Map<String, Double> pointInTime(Map<String, Double> row) {
        Map<String, Double> out = new LinkedHashMap<>();
        double loans = zero(row.get("LNLS"));
        double acl = zero(row.get("Total_ACL"));

        out.put("Total_Nonaccrual", sum(row, NONACCRUAL_FIELDS));
        double tier1 = zero(row.get("RBCT1J"));
        double totalCapital = tier1 + zero(row.get("RBCT2"));
        out.put("Tier1_Capital", tier1);
        out.put("Tier2_Capital", zero(row.get("RBCT2")));
        out.put("Total_Capital", totalCapital);

        Map<String, Double> balances = new LinkedHashMap<>();
        double categorized = 0.0;
        for (LoanCategory cat : categories) {
            double balance = sum(row, cat.balance());
            balances.put(cat.key(), balance);
            categorized += balance;
            out.put(cat.balanceColumn(), balance);
            out.put(cat.ncoColumn(), quarterlySum(row, cat.nco()));
            out.put(cat.pd30Column(), sum(row, cat.pd30()));
            out.put(cat.pd90Column(), sum(row, cat.pd90()));
            out.put(cat.nonaccrualColumn(), sum(row, cat.nonaccrual()));
        }
        out.put("Total_Categorized_Loans", categorized);

        out.put("Allowance_to_Gross_Loans_Rate", pct(acl, loans));
        out.put("Nonaccrual_to_Gross_Loans_Rate", pct(out.get("Total_Nonaccrual"), loans));
        out.put("Total_Past_Due_to_Book", pct(zero(row.get("P3LNLS")) + zero(row.get("P9LNLS")), loans));
        out.put("Risk_Adj_Allowance_Coverage", pct(acl, loans - balances.getOrDefault("SBL", 0.0)));
        for (LoanCategory cat : categories) {
            double balance = balances.get(cat.key());
            out.put(cat.key() + "_Composition", pct(balance, categorized));
            out.put(cat.key() + "_NA_Rate", pct(out.get(cat.nonaccrualColumn()), balance));
        }
        out.put("CRE_Concentration_Capital_Risk", pct(balances.getOrDefault("CRE_Investment", 0.0), tier1 + acl));
        out.put("CI_to_Capital_Risk", pct(balances.getOrDefault("Corp_CI", 0.0), totalCapital));

        double equity = zero(row.get("EQ"));
        double netRetained = zero(row.get("EQUP")) - zero(row.get("EQCCOMPI"));
        out.put("Net_Retained_Earnings", netRetained);
        out.put("Common_Stock_Pct", pct(zero(row.get("EQCS")), equity));
        out.put("EQSUR_Pct", pct(zero(row.get("EQSUR")), equity));
        out.put("Retained_Earnings_Pct", pct(netRetained, equity));
        out.put("Preferred_Stock_Pct", pct(zero(row.get("EQPP")), equity));

        boolean ricAvailable = false;
        for (String[] ric : FallbackCatalog.RIC_SOURCES) {
            ricAvailable |= row.get(ric[1]) != null || row.get(ric[2]) != null;
        }
        out.put("RIC_SOURCE_AVAILABLE", ricAvailable ? 1.0 : 0.0);
        double ricTotal = 0.0;
        for (String[] ric : FallbackCatalog.RIC_SOURCES) ricTotal += ric(row, ric[0]);
        for (String[] share : RIC_SHARES) {
            out.put(share[1], SafeRatio.of(ric(row, share[0]), ricTotal));
        }

        double commercial = balances.getOrDefault("Corp_CI", 0.0) + balances.getOrDefault("Fund_Finance", 0.0);
        groupShare(out, "Commercial", commercial, categorized, ric(row, "Comm"), ricTotal);
        groupShare(out, "Residential", balances.getOrDefault("Wealth_Resi", 0.0), categorized, ric(row, "Resi"), ricTotal);
        double cre = balances.getOrDefault("CRE_OO", 0.0) + balances.getOrDefault("CRE_Investment", 0.0);
        groupShare(out, "CRE", cre, categorized, ric(row, "Constr") + ric(row, "CommRE"), ricTotal);
        double other = balances.getOrDefault("SBL", 0.0) + balances.getOrDefault("Consumer_Auto", 0.0)
                + balances.getOrDefault("Consumer_Other", 0.0);
        groupShare(out, "OtherSBL", other, categorized, ric(row, "Other") + ric(row, "Card") + ric(row, "OthCons"), ricTotal);
        return out;
    }

    void trailing(MetricFrame frame, int cert) {
        int w = ttmWindow;
        List<Double> loans = frame.series(cert, "LNLS");
        List<Double> avgLoans = RollingWindows.mean(loans, w);

        frame.putSeries(cert, "Cost_of_Funds", costOfFunds(frame, cert));
        frame.putSeries(cert, "TTM_NCO_Rate", ratio(RollingWindows.sum(frame.series(cert, "NTLNLS_Q"), w), avgLoans));
        List<Double> pd30 = ratio(RollingWindows.mean(frame.series(cert, "P3LNLS"), w), avgLoans);
        List<Double> pd90 = ratio(RollingWindows.mean(frame.series(cert, "P9LNLS"), w), avgLoans);
        frame.putSeries(cert, "TTM_PD30_Rate", pd30);
        frame.putSeries(cert, "TTM_PD90_Rate", pd90);
        frame.putSeries(cert, "TTM_Past_Due_Rate", RollingWindows.combine(pd30, pd90, Double::sum));
        frame.putSeries(cert, "Total_Loan_Growth_TTM", RollingWindows.growth(loans, w));

        for (LoanCategory cat : categories) {
            List<Double> balance = frame.series(cert, cat.balanceColumn());
            List<Double> avgBalance = RollingWindows.mean(balance, w);
            frame.putSeries(cert, cat.key() + "_TTM_NCO_Rate",
                    ratio(RollingWindows.sum(frame.series(cert, cat.ncoColumn()), w), avgBalance));
            frame.putSeries(cert, cat.key() + "_TTM_PD30_Rate",
                    ratio(RollingWindows.mean(frame.series(cert, cat.pd30Column()), w), avgBalance));
            frame.putSeries(cert, cat.key() + "_TTM_NA_Rate",
                    ratio(RollingWindows.mean(frame.series(cert, cat.nonaccrualColumn()), w), avgBalance));
            frame.putSeries(cert, cat.key() + "_Growth_TTM", RollingWindows.growth(balance, w));
        }
        for (String mix : CAPITAL_MIX) {
            frame.putSeries(cert, "TTM_" + mix, RollingWindows.mean(frame.series(cert, mix), w));
        }
        frame.putSeries(cert, "CRE_Investment_Growth_36M",
                RollingWindows.growth(frame.series(cert, "CRE_Investment_Balance"), creGrowthLag));
    }

    /** Annualized quarterly interest expense over the two-quarter average of interest-bearing liabilities. */
    private static List<Double> costOfFunds(MetricFrame frame, int cert) {
        List<Double> expense = frame.series(cert, "EINTEXP_Q");
        List<Double> liabilities = new ArrayList<>();
        for (LocalDate period : frame.periods(cert)) {
            liabilities.add(sum(frame.row(new ObservationKey(cert, period)), INTEREST_BEARING));
        }
        List<Double> out = new ArrayList<>(expense.size());
        for (int i = 0; i < expense.size(); i++) {
            if (i == 0 || expense.get(i) == null) {
                out.add(null);
                continue;
            }
            double avg = (liabilities.get(i) + liabilities.get(i - 1)) / 2.0;
            out.add(pct(expense.get(i) * 4.0, avg));
        }
        return out;
    }

    private static void groupShare(Map<String, Double> out, String group, double loans, double categorized,
                                   double allowance, double ricTotal) {
        out.put("Group_" + group + "_Loan_Share", SafeRatio.of(loans, categorized));
        out.put("Group_" + group + "_ACL_Share", SafeRatio.of(allowance, ricTotal));
    }

    /** Null unless both windows are complete, then a percentage. */
    private static List<Double> ratio(List<Double> numerators, List<Double> denominators) {
        List<Double> out = new ArrayList<>(numerators.size());
        for (int i = 0; i < numerators.size(); i++) {
            Double n = numerators.get(i);
            Double d = denominators.get(i);
            out.add(n == null || d == null ? null : pct(n, d));
        }
        return out;
    }

    /**
     * Sum of the quarterly forms of YTD fields. Null when a field was reported but its quarterly value
     * could not be computed; absent fields count as zero.
     */
    private static Double quarterlySum(Map<String, Double> row, List<String> ytdFields) {
        double total = 0.0;
        for (String f : ytdFields) {
            Double q = row.get(f + "_Q");
            if (q == null) {
                if (row.get(f) != null) return null;
                continue;
            }
            total += q;
        }
        return total;
    }

    private static double ric(Map<String, Double> row, String suffix) {
        return zero(row.get(FallbackCatalog.ricBest(suffix)));
    }

    private static double sum(Map<String, Double> row, List<String> fields) {
        double total = 0.0;
        for (String f : fields) total += zero(row.get(f));
        return total;
    }

    private static double pct(double numerator, double denominator) {
        return SafeRatio.of(numerator, denominator) * 100.0;
    }

    private static double zero(Double v) {
        return v == null ? 0.0 : v;
    }
}
