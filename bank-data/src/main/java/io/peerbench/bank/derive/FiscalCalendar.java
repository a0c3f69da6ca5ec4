package io.peerbench.bank.derive;

import java.time.LocalDate;

/**
 * Fiscal quarters for a year starting in {@code startMonth}. A fiscal year is named after the calendar
 * year it ends in.
 */
public final class FiscalCalendar {
    private final int startMonth;

    public FiscalCalendar(int startMonth) {
        if (startMonth < 1 || startMonth > 12) throw new IllegalArgumentException("start month must be 1..12: " + startMonth);
        this.startMonth = startMonth;
    }

    public static FiscalCalendar calendarYear() {
        return new FiscalCalendar(1);
    }

    public int fiscalYear(LocalDate date) {
        return startMonth != 1 && date.getMonthValue() >= startMonth ? date.getYear() + 1 : date.getYear();
    }

    /** 1..4 */
    public int fiscalQuarter(LocalDate date) {
        return ((date.getMonthValue() - startMonth + 12) % 12) / 3 + 1;
    }

    /** Consecutive quarters map to consecutive integers. */
    public int quarterIndex(LocalDate date) {
        return fiscalYear(date) * 4 + fiscalQuarter(date) - 1;
    }

    public boolean sameFiscalYear(LocalDate a, LocalDate b) {
        return fiscalYear(a) == fiscalYear(b);
    }

    public boolean isImmediatelyBefore(LocalDate prior, LocalDate current) {
        return quarterIndex(current) - quarterIndex(prior) == 1;
    }
}
