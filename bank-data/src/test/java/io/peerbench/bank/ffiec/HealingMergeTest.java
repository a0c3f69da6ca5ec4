package io.peerbench.bank.ffiec;

import io.peerbench.bank.model.ObservationKey;
import io.peerbench.bank.model.RawTable;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class HealingMergeTest {

    @Test
    void zeroIsReplacedByARecoveredValue() {
        assertEquals(500.0, HealingMerge.merge(0.0, 500.0));
    }

    @Test
    void presentNonZeroValueWins() {
        assertEquals(500.0, HealingMerge.merge(500.0, 0.0));
        assertEquals(500.0, HealingMerge.merge(500.0, 700.0));
        assertEquals(500.0, HealingMerge.merge(500.0, null));
    }

    @Test
    void absentCellIsFilled() {
        assertEquals(500.0, HealingMerge.merge(null, 500.0));
        assertEquals(0.0, HealingMerge.merge(null, 0.0));
        assertNull(HealingMerge.merge(null, null));
        assertEquals(0.0, HealingMerge.merge(0.0, 0.0));
    }

    @Test
    void mergeIntoRawTableOnlyTouchesExistingRows() {
        RawTable table = new RawTable();
        ObservationKey known = new ObservationKey(34221, LocalDate.of(2024, 3, 31));
        table.put(known, "RCFD1545", 0.0);

        assertTrue(table.merge(known, "RCFD1545", 500.0, HealingMerge::merge));
        assertFalse(table.merge(known, "RCFD1545", 900.0, HealingMerge::merge));
        assertFalse(table.merge(new ObservationKey(628, known.period()), "RCFD1545", 1.0, HealingMerge::merge));

        assertEquals(500.0, table.get(known, "RCFD1545"));
        assertEquals(1, table.size());
    }
}
