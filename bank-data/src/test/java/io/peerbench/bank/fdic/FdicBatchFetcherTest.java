package io.peerbench.bank.fdic;

import com.codahale.metrics.MetricRegistry;
import io.peerbench.bank.error.JoinIntegrityException;
import io.peerbench.bank.error.TransientFetchException;
import io.peerbench.bank.model.ObservationKey;
import io.peerbench.bank.model.RawTable;
import io.peerbench.budget.FixedDelayBudget;
import io.peerbench.retry.ExponentialBackoffRetryPolicy;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FdicBatchFetcherTest {
    private static final LocalDate Q4 = LocalDate.of(2023, 12, 31);

    private static FakeFdicApi apiWithBanks(int... certs) {
        FakeFdicApi api = new FakeFdicApi();
        for (int cert : certs) {
            api.financials.put(cert, FakeFdicApi.body(
                    "{\"CERT\":" + cert + ",\"REPDTE\":\"20231231\",\"NAME\":\"Bank " + cert + "\",\"ASSET\":" + cert * 10 + "}"));
        }
        return api;
    }

    private static FdicBatchFetcher batch(FakeFdicApi api, MetricRegistry registry, Path dlq) {
        return new FdicBatchFetcher(new FdicFinancialsFetcher(api), new FixedDelayBudget(3, Duration.ZERO),
                new ExponentialBackoffRetryPolicy(3, 1, 5, e -> e instanceof TransientFetchException),
                3, registry, dlq, Duration.ofSeconds(20));
    }

    @Test
    void transientFailuresAreRetriedUntilTheySucceed() throws Exception {
        FakeFdicApi api = apiWithBanks(1, 2, 3);
        api.transientFailuresLeft.put(2, 2);
        RawTable table = new RawTable();
        MetricRegistry registry = new MetricRegistry();

        FetchReport report = batch(api, registry, null).fetchAll(List.of(1, 2, 3), List.of("ASSET"), 8, table);

        assertEquals(3, report.succeeded());
        assertTrue(report.failures().isEmpty());
        assertEquals(3, api.calls.get(2).get());
        assertEquals(20.0, table.get(new ObservationKey(2, Q4), "ASSET"));
        assertEquals("Bank 3", table.name(3));
        assertEquals(5, registry.counter("fdic.fetch.attempts").getCount());
    }

    @Test
    void exhaustedInstitutionIsRecordedAndTheBatchContinues() throws Exception {
        Path tmp = Files.createTempDirectory("batch-test");
        try {
            FakeFdicApi api = apiWithBanks(1, 2, 3);
            api.transientFailuresLeft.put(2, 100);
            RawTable table = new RawTable();
            Path dlq = tmp.resolve("dlq_fetch.jsonl");

            FetchReport report = batch(api, new MetricRegistry(), dlq).fetchAll(List.of(1, 2, 3), List.of("ASSET"), 8, table);

            assertEquals(2, report.succeeded());
            assertEquals(List.of(2), List.copyOf(report.failures().keySet()));
            assertEquals(3, api.calls.get(2).get());
            assertTrue(table.contains(new ObservationKey(1, Q4)));
            assertTrue(table.contains(new ObservationKey(3, Q4)));
            assertFalse(table.contains(new ObservationKey(2, Q4)));
            List<String> lines = Files.readAllLines(dlq, StandardCharsets.UTF_8);
            assertEquals(1, lines.size());
            assertTrue(lines.get(0).contains("HTTP 503 for CERT 2"));
        } finally {
            try (var s = Files.walk(tmp)) { s.sorted(java.util.Comparator.reverseOrder()).forEach(p -> { try { Files.deleteIfExists(p); } catch (Exception ignore) {} }); }
        }
    }

    @Test
    void joinIntegrityFailureAbortsTheBatch() {
        FakeFdicApi api = apiWithBanks(1, 2);
        api.lnci.put(2, FakeFdicApi.body("{\"CERT\":2,\"REPDTE\":\"20230930\",\"LNCI\":4}"));
        FdicBatchFetcher fetcher = batch(api, new MetricRegistry(), null);

        assertThrows(JoinIntegrityException.class,
                () -> fetcher.fetchAll(List.of(1, 2), List.of("ASSET", "LNCI"), 8, new RawTable()));
    }
}
