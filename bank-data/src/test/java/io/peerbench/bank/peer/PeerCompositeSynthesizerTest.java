package io.peerbench.bank.peer;

import io.peerbench.bank.model.Institution;
import io.peerbench.bank.model.MetricFrame;
import io.peerbench.bank.model.ObservationKey;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PeerCompositeSynthesizerTest {
    private static final LocalDate Q1 = LocalDate.of(2024, 3, 31);
    private static final LocalDate Q4 = LocalDate.of(2023, 12, 31);

    @Test
    void compositeIsTheMeanOfPresentMemberValues() {
        MetricFrame frame = new MetricFrame();
        frame.put(new ObservationKey(1, Q1), "ROA", 1.0);
        frame.put(new ObservationKey(2, Q1), "ROA", 3.0);
        frame.put(new ObservationKey(3, Q1), "ROA", null);
        frame.put(new ObservationKey(1, Q4), "ROA", 2.0);
        frame.put(new ObservationKey(1, Q4), "NIMY", Double.NaN);
        frame.put(new ObservationKey(9, Q1), "ROA", 100.0);
        PeerCatalog catalog = new PeerCatalog(List.of(
                new PeerGroup("CORE", "Core Peers", "Core", List.of(1, 2, 3), 1),
                new PeerGroup("EMPTY", "Nobody", "None", List.of(77), 2)));

        List<Institution> composites = new PeerCompositeSynthesizer(catalog).synthesize(frame);

        assertEquals(1, composites.size());
        Institution core = composites.get(0);
        assertEquals(90001, core.cert());
        assertEquals("AVG: Core Peers", core.name());
        assertEquals(PeerCompositeSynthesizer.COMPOSITE_STATE, core.hqState());
        assertEquals(2.0, frame.get(new ObservationKey(90001, Q1), "ROA"));
        assertEquals(2.0, frame.get(new ObservationKey(90001, Q4), "ROA"));
        assertNull(frame.get(new ObservationKey(90001, Q4), "NIMY"));
        assertEquals("AVG: Core Peers", frame.name(90001));
        assertFalse(frame.certs().contains(90002));
    }
}
