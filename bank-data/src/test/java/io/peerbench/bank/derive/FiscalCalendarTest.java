package io.peerbench.bank.derive;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class FiscalCalendarTest {

    @Test
    void calendarYearQuarters() {
        FiscalCalendar cal = FiscalCalendar.calendarYear();
        assertEquals(1, cal.fiscalQuarter(LocalDate.of(2024, 3, 31)));
        assertEquals(4, cal.fiscalQuarter(LocalDate.of(2023, 12, 31)));
        assertEquals(2023, cal.fiscalYear(LocalDate.of(2023, 12, 31)));
        assertTrue(cal.isImmediatelyBefore(LocalDate.of(2023, 12, 31), LocalDate.of(2024, 3, 31)));
        assertFalse(cal.isImmediatelyBefore(LocalDate.of(2023, 9, 30), LocalDate.of(2024, 3, 31)));
    }

    @Test
    void fiscalYearStartingInJuly() {
        FiscalCalendar cal = new FiscalCalendar(7);
        assertEquals(1, cal.fiscalQuarter(LocalDate.of(2023, 9, 30)));
        assertEquals(4, cal.fiscalQuarter(LocalDate.of(2023, 6, 30)));
        assertEquals(2024, cal.fiscalYear(LocalDate.of(2023, 9, 30)));
        assertEquals(2023, cal.fiscalYear(LocalDate.of(2023, 6, 30)));
        assertTrue(cal.isImmediatelyBefore(LocalDate.of(2023, 6, 30), LocalDate.of(2023, 9, 30)));
        assertFalse(cal.sameFiscalYear(LocalDate.of(2023, 6, 30), LocalDate.of(2023, 9, 30)));
    }

    @Test
    void rejectsInvalidStartMonth() {
        assertThrows(IllegalArgumentException.class, () -> new FiscalCalendar(0));
        assertThrows(IllegalArgumentException.class, () -> new FiscalCalendar(13));
    }
}
