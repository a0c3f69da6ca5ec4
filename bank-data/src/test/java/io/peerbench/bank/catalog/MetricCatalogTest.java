package io.peerbench.bank.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MetricCatalogTest {

    @Test
    void bundledCatalogLoadsInDisplayOrder() {
        MetricCatalog catalog = MetricCatalog.defaults();
        List<String> codes = catalog.codes();
        assertEquals("Cost_of_Funds", codes.get(0));
        assertTrue(codes.contains("TTM_NCO_Rate"));
        assertTrue(codes.contains("RIC_Comm_ACL_Pct"));
        assertEquals("Cost of Funds", catalog.shortName("Cost_of_Funds"));
        assertFalse(catalog.longName("Cost_of_Funds").isBlank());
    }

    @Test
    void unknownCodes() {
        MetricCatalog catalog = MetricCatalog.defaults();
        assertEquals("Made_Up", catalog.shortName("Made_Up"));
        assertNull(catalog.describe("Made_Up"));
        assertNull(catalog.longName("Made_Up"));
        assertFalse(catalog.contains("Made_Up"));
    }

    @Test
    void parseRejectsMalformedEntries() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        assertThrows(IllegalArgumentException.class, () -> MetricCatalog.parse(mapper.readTree("{}")));
        assertThrows(IllegalArgumentException.class,
                () -> MetricCatalog.parse(mapper.readTree("{\"metrics\":[{\"short\":\"x\"}]}")));
        assertThrows(IllegalArgumentException.class,
                () -> MetricCatalog.parse(mapper.readTree("{\"metrics\":[{\"code\":\"A\"},{\"code\":\"A\"}]}")));

        MetricCatalog one = MetricCatalog.parse(mapper.readTree("{\"metrics\":[{\"code\":\"ROA\"}]}"));
        assertEquals("ROA", one.shortName("ROA"));
        assertEquals("", one.longName("ROA"));
    }

    @Test
    void missingResourceFails() {
        assertThrows(IllegalStateException.class, () -> MetricCatalog.load("/no-such-catalog.json"));
    }

    @Test
    void fetchListCarriesNoIdentifiersOrDuplicates() {
        List<String> fields = FieldCatalog.FDIC_FIELDS_TO_FETCH;
        assertFalse(fields.contains("CERT"));
        assertFalse(fields.contains("REPDTE"));
        assertTrue(fields.contains("LNLS"));
        assertTrue(fields.contains("P3NDFI"));
        assertEquals(fields.size(), fields.stream().distinct().count());
    }
}
