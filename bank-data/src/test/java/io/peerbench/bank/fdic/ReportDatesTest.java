package io.peerbench.bank.fdic;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class ReportDatesTest {
    private static final LocalDate Q1 = LocalDate.of(2024, 3, 31);

    @Test
    void everySpellingNormalizesToTheSameDate() {
        assertEquals(Q1, ReportDates.normalize("20240331"));
        assertEquals(Q1, ReportDates.normalize("2024-03-31"));
        assertEquals(Q1, ReportDates.normalize("2024-03-31T00:00:00Z"));
        assertEquals(Q1, ReportDates.normalize("2024-03-31T00:00:00.000+00:00"));
        assertEquals(Q1, ReportDates.normalize("2024-03-31 00:00:00"));
        assertEquals(Q1, ReportDates.normalize(" 20240331 "));
    }

    @Test
    void garbageIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ReportDates.normalize("31/03/2024"));
        assertThrows(IllegalArgumentException.class, () -> ReportDates.normalize("2024"));
        assertThrows(IllegalArgumentException.class, () -> ReportDates.normalize(null));
    }
}
