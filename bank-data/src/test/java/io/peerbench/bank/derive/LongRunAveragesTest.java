package io.peerbench.bank.derive;

import io.peerbench.bank.model.InstitutionTable;
import io.peerbench.bank.model.MetricFrame;
import io.peerbench.bank.model.ObservationKey;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LongRunAveragesTest {

    @Test
    void averagesTheLastWindowPerInstitution() {
        MetricFrame frame = new MetricFrame();
        LocalDate p1 = LocalDate.of(2023, 9, 30);
        LocalDate p2 = LocalDate.of(2023, 12, 31);
        LocalDate p3 = LocalDate.of(2024, 3, 31);
        frame.put(new ObservationKey(1, p1), "ROA", 1.0);
        frame.put(new ObservationKey(1, p2), "ROA", 2.0);
        frame.put(new ObservationKey(1, p3), "ROA", 3.0);
        frame.put(new ObservationKey(1, p1), "NIMY", 3.0);
        frame.put(new ObservationKey(1, p3), "NIMY", 4.0);
        frame.put(new ObservationKey(2, p3), "ROA", 9.0);
        frame.setName(1, "Subject Bank");

        InstitutionTable averages = new LongRunAverages(2).compute(frame);

        assertEquals(List.of(1), List.copyOf(averages.certs()));
        assertEquals(2.5, averages.get(1, "ROA"));
        assertNull(averages.get(1, "NIMY"));
        assertEquals("Subject Bank", averages.name(1));
    }

    @Test
    void rejectsEmptyWindow() {
        assertThrows(IllegalArgumentException.class, () -> new LongRunAverages(0));
    }
}
