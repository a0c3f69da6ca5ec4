package io.peerbench.bank.fdic;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Normalizes the report-date spellings the API returns to a bare calendar date.
 */
public final class ReportDates {
    private ReportDates() {}

    /**
     * Accepts {@code 20240331}, {@code 2024-03-31}, {@code 2024-03-31T00:00:00Z},
     * {@code 2024-03-31T00:00:00.000+00:00} and {@code 2024-03-31 00:00:00}; the time part is dropped.
     */
    public static LocalDate normalize(String raw) {
        if (raw == null) throw new IllegalArgumentException("report date is null");
        String s = raw.trim();
        try {
            if (s.length() == 8 && s.chars().allMatch(Character::isDigit)) {
                return LocalDate.parse(s, DateTimeFormatter.BASIC_ISO_DATE);
            }
            if (s.length() >= 10) {
                return LocalDate.parse(s.substring(0, 10), DateTimeFormatter.ISO_LOCAL_DATE);
            }
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("unparseable report date: " + raw, e);
        }
        throw new IllegalArgumentException("unparseable report date: " + raw);
    }
}
