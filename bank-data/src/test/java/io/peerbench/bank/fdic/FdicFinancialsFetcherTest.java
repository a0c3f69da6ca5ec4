package io.peerbench.bank.fdic;

import io.peerbench.bank.error.JoinIntegrityException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FdicFinancialsFetcherTest {

    @Test
    void separateFieldIsFetchedNarrowlyAndJoinedOnNormalizedDate() throws Exception {
        FakeFdicApi api = new FakeFdicApi();
        api.financials.put(100, FakeFdicApi.body(
                "{\"CERT\":100,\"REPDTE\":\"20240630\",\"NAME\":\"First Bank\",\"ASSET\":\"1,250\",\"LNLS\":800}",
                "{\"CERT\":100,\"REPDTE\":\"20240331\",\"NAME\":\"First Bank\",\"ASSET\":1200,\"LNLS\":null}"));
        api.lnci.put(100, FakeFdicApi.body(
                "{\"CERT\":100,\"REPDTE\":\"2024-06-30T00:00:00Z\",\"LNCI\":300}",
                "{\"CERT\":100,\"REPDTE\":\"2024-03-31 00:00:00\",\"LNCI\":290}"));

        List<RawRow> rows = new FdicFinancialsFetcher(api).fetchSeries(100, List.of("ASSET", "LNCI", "LNLS"), 10);

        assertEquals(2, rows.size());
        RawRow june = rows.get(0);
        assertEquals(LocalDate.of(2024, 6, 30), june.period());
        assertEquals("First Bank", june.name());
        assertEquals(1250.0, june.values().get("ASSET"));
        assertEquals(300.0, june.values().get("LNCI"));
        assertEquals(290.0, rows.get(1).values().get("LNCI"));
        assertFalse(rows.get(1).values().containsKey("LNLS"), "null stays absent");

        assertEquals(List.of("CERT", "REPDTE", "ASSET", "LNLS"), api.requestedFields.get(0));
        assertEquals(List.of("CERT", "REPDTE", "LNCI"), api.requestedFields.get(1));
    }

    @Test
    void emptySecondaryLeavesFieldAbsent() throws Exception {
        FakeFdicApi api = new FakeFdicApi();
        api.financials.put(7, FakeFdicApi.body("{\"CERT\":7,\"REPDTE\":\"20231231\",\"ASSET\":5}"));

        List<RawRow> rows = new FdicFinancialsFetcher(api).fetchSeries(7, List.of("ASSET", "LNCI"), 4);

        assertEquals(1, rows.size());
        assertFalse(rows.get(0).values().containsKey("LNCI"));
    }

    @Test
    void noFieldRequestedSeparatelyMeansOneCall() throws Exception {
        FakeFdicApi api = new FakeFdicApi();
        api.financials.put(7, FakeFdicApi.body("{\"CERT\":7,\"REPDTE\":\"20231231\",\"ASSET\":5}"));

        new FdicFinancialsFetcher(api).fetchSeries(7, List.of("ASSET"), 4);

        assertEquals(1, api.requestedFields.size());
    }

    @Test
    void disjointKeysAreAJoinIntegrityFailure() {
        RawRow primary = new RawRow(5, LocalDate.of(2024, 3, 31), null, java.util.Map.of("ASSET", 1.0));
        RawRow shifted = new RawRow(5, LocalDate.of(2024, 4, 1), null, java.util.Map.of("LNCI", 2.0));

        JoinIntegrityException e = assertThrows(JoinIntegrityException.class,
                () -> FdicFinancialsFetcher.join(5, List.of(primary), List.of(shifted), "LNCI"));
        assertTrue(e.getMessage().contains("5@2024-03-31"), e.getMessage());
        assertTrue(e.getMessage().contains("5@2024-04-01"), e.getMessage());
    }

    @Test
    void partialJoinKeepsUnmatchedRowsWithoutTheField() {
        RawRow q1 = new RawRow(5, LocalDate.of(2024, 3, 31), null, java.util.Map.of("ASSET", 1.0));
        RawRow q2 = new RawRow(5, LocalDate.of(2024, 6, 30), null, java.util.Map.of("ASSET", 2.0));
        RawRow lnci = new RawRow(5, LocalDate.of(2024, 6, 30), null, java.util.Map.of("LNCI", 9.0));

        List<RawRow> joined = FdicFinancialsFetcher.join(5, List.of(q1, q2), List.of(lnci), "LNCI");

        assertNull(joined.get(0).values().get("LNCI"));
        assertEquals(9.0, joined.get(1).values().get("LNCI"));
    }

    @Test
    void malformedBodyIsTransient() {
        FakeFdicApi api = new FakeFdicApi();
        api.financials.put(3, "{not json");
        assertThrows(io.peerbench.bank.error.TransientFetchException.class,
                () -> new FdicFinancialsFetcher(api).fetchSeries(3, List.of("ASSET"), 4));
    }
}
