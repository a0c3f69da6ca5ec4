package io.peerbench.bank.derive;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts fiscal-year-to-date cumulative values into discrete quarters for one institution.
 * <ul>
 *   <li>fiscal Q1 keeps the cumulative value;</li>
 *   <li>otherwise the difference from the prior observation of the same fiscal year;</li>
 *   <li>if that prior observation is not the immediately preceding quarter the difference still applies
 *       (it then spans the gap) and the period is flagged;</li>
 *   <li>if the prior observation belongs to an earlier fiscal year the cumulative value is used and flagged;</li>
 *   <li>a first observation outside Q1, or a missing operand, yields null.</li>
 * </ul>
 */
public class YtdConverter {
    private final FiscalCalendar calendar;

    public YtdConverter(FiscalCalendar calendar) {
        this.calendar = calendar;
    }

    /** @param flagged periods whose value spans more than one quarter */
    public record Conversion(List<Double> quarterly, List<LocalDate> flagged) {
    }

    public static boolean isYtdField(String code) {
        return !code.endsWith("_Q") && (code.startsWith("NT") || code.contains("EINTEXP"));
    }

    /**
     * @param periods    strictly ascending report dates
     * @param cumulative values aligned with {@code periods}
     */
    public Conversion convert(List<LocalDate> periods, List<Double> cumulative) {
        if (periods.size() != cumulative.size()) {
            throw new IllegalArgumentException("periods and values differ in length");
        }
        List<Double> out = new ArrayList<>(periods.size());
        List<LocalDate> flagged = new ArrayList<>();
        for (int i = 0; i < periods.size(); i++) {
            LocalDate period = periods.get(i);
            Double current = cumulative.get(i);
            if (current == null) {
                out.add(null);
                continue;
            }
            if (calendar.fiscalQuarter(period) == 1) {
                out.add(current);
                continue;
            }
            if (i == 0) {
                out.add(null);
                continue;
            }
            LocalDate prior = periods.get(i - 1);
            if (!calendar.sameFiscalYear(prior, period)) {
                out.add(current);
                flagged.add(period);
                continue;
            }
            Double previous = cumulative.get(i - 1);
            if (previous == null) {
                out.add(null);
                continue;
            }
            out.add(current - previous);
            if (!calendar.isImmediatelyBefore(prior, period)) flagged.add(period);
        }
        return new Conversion(out, flagged);
    }
}
