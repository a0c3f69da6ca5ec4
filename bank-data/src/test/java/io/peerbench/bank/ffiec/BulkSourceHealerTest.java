package io.peerbench.bank.ffiec;

import com.codahale.metrics.MetricRegistry;
import io.peerbench.bank.model.ObservationKey;
import io.peerbench.bank.model.RawTable;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class BulkSourceHealerTest {
    private static final LocalDate Q1 = LocalDate.of(2024, 3, 31);
    private static final LocalDate Q4 = LocalDate.of(2023, 12, 31);
    private static final LocalDate Q3 = LocalDate.of(2023, 9, 30);
    private static final byte[] ARCHIVE = {'P', 'K', 3, 4};

    private final Map<LocalDate, AtomicInteger> downloads = new ConcurrentHashMap<>();

    private BulkDownloader downloader(Set<LocalDate> failing) {
        return period -> {
            downloads.computeIfAbsent(period, p -> new AtomicInteger()).incrementAndGet();
            BulkSessionState init = BulkSessionState.init(period);
            if (failing.contains(period)) return BulkDownloadProtocol.failed(init, "form page carried no __VIEWSTATE");
            return new BulkSessionState(BulkSessionState.Phase.DOWNLOADED, period, Map.of(), ARCHIVE, List.of(), null);
        };
    }

    private static final ArchiveParser PARSER = (bytes, filter) -> Stream.of(
                    new BulkObservation(34221, "RCFD1545", 1500.0),
                    new BulkObservation(34221, "RCFDJ466", 10.0),
                    new BulkObservation(628, "RCFD1545", 75.0),
                    new BulkObservation(99999, "RCFD1545", 5.0))
            .filter(o -> filter.test(o.cert()))
            .collect(Collectors.toList());

    private static RawTable thinTable() {
        RawTable table = new RawTable();
        for (LocalDate p : List.of(Q1, Q4, Q3)) {
            table.putRow(new ObservationKey(34221, p), Map.of("LNLS", 100.0, "RCFD1545", 0.0));
            table.putRow(new ObservationKey(628, p), Map.of("LNLS", 50.0));
        }
        return table;
    }

    @Test
    void healsThinPeriodsAndIsolatesFailures() throws Exception {
        Path tmp = Files.createTempDirectory("healer-test");
        try {
            RawTable table = thinTable();
            MetricRegistry registry = new MetricRegistry();
            BulkSourceHealer healer = new BulkSourceHealer(downloader(Set.of(Q4)), PARSER,
                    new BulkArchiveCache(tmp), new HealingNeedAssessor(), 8, 2, registry);

            HealingReport report = healer.heal(table, Set.of(34221, 628));

            assertEquals(HealingReport.Status.PARSED, report.statusOf(Q1).orElseThrow());
            assertEquals(HealingReport.Status.FAILED, report.statusOf(Q4).orElseThrow());
            assertEquals(HealingReport.Status.PARSED, report.statusOf(Q3).orElseThrow());
            assertEquals(List.of(Q4), report.failedPeriods());

            ObservationKey subjectQ1 = new ObservationKey(34221, Q1);
            assertEquals(1500.0, table.get(subjectQ1, "RCFD1545"));
            assertEquals(10.0, table.get(subjectQ1, "RCFDJ466"));
            assertEquals(75.0, table.get(new ObservationKey(628, Q1), "RCFD1545"));
            assertFalse(table.contains(new ObservationKey(99999, Q1)));
            assertEquals(0.0, table.get(new ObservationKey(34221, Q4), "RCFD1545"));

            assertTrue(Files.exists(new BulkArchiveCache(tmp).fileFor(Q1)));
            assertFalse(Files.exists(new BulkArchiveCache(tmp).fileFor(Q4)));
            List<BulkObservation> cachedQ1 = new BulkArchiveCache(tmp).read(Q1).orElseThrow();
            assertEquals(3, cachedQ1.size());
            assertTrue(cachedQ1.stream().noneMatch(o -> o.cert() == 99999), "only institutions of interest are parsed");
            assertEquals(1, registry.counter("ffiec.heal.failed").getCount());
        } finally {
            try (var s = Files.walk(tmp)) { s.sorted(java.util.Comparator.reverseOrder()).forEach(p -> { try { Files.deleteIfExists(p); } catch (Exception ignore) {} }); }
        }
    }

    @Test
    void cachedPeriodIsNotDownloadedAgain() throws Exception {
        Path tmp = Files.createTempDirectory("healer-test");
        try {
            BulkArchiveCache cache = new BulkArchiveCache(tmp);
            cache.write(Q1, List.of(new BulkObservation(34221, "RCFD1545", 2000.0)));
            RawTable table = new RawTable();
            table.put(new ObservationKey(34221, Q1), "LNLS", 100.0);

            BulkSourceHealer healer = new BulkSourceHealer(downloader(Set.of()), PARSER, cache,
                    new HealingNeedAssessor(), 8, 1, new MetricRegistry());
            HealingReport report = healer.heal(table, Set.of(34221));

            assertEquals(HealingReport.Status.CACHED, report.statusOf(Q1).orElseThrow());
            assertNull(downloads.get(Q1));
            assertEquals(2000.0, table.get(new ObservationKey(34221, Q1), "RCFD1545"));
            assertEquals(1, report.totalMerged());
        } finally {
            try (var s = Files.walk(tmp)) { s.sorted(java.util.Comparator.reverseOrder()).forEach(p -> { try { Files.deleteIfExists(p); } catch (Exception ignore) {} }); }
        }
    }

    @Test
    void wellFilledAndOlderPeriodsAreSkipped() throws Exception {
        Path tmp = Files.createTempDirectory("healer-test");
        try {
            RawTable table = thinTable();
            table.putRow(new ObservationKey(34221, Q1), Map.of("RCFD1545", 9.0, "LNOTHPCS", 1.0, "RCFDJ466", 1.0));
            table.putRow(new ObservationKey(628, Q1), Map.of("RCFD1545", 9.0, "LNOTHPCS", 1.0, "RCFDJ466", 1.0));

            BulkSourceHealer healer = new BulkSourceHealer(downloader(Set.of()), PARSER, new BulkArchiveCache(tmp),
                    new HealingNeedAssessor(), 2, 1, new MetricRegistry());
            HealingReport report = healer.heal(table, Set.of(34221));

            assertEquals(2, report.periods().size());
            assertEquals(HealingReport.Status.SKIPPED, report.statusOf(Q1).orElseThrow());
            assertEquals(HealingReport.Status.PARSED, report.statusOf(Q4).orElseThrow());
            assertTrue(report.statusOf(Q3).isEmpty());
            assertNull(downloads.get(Q1));
            assertNull(table.get(new ObservationKey(628, Q4), "RCFD1545"));
            assertEquals(1500.0, table.get(new ObservationKey(34221, Q4), "RCFD1545"));
        } finally {
            try (var s = Files.walk(tmp)) { s.sorted(java.util.Comparator.reverseOrder()).forEach(p -> { try { Files.deleteIfExists(p); } catch (Exception ignore) {} }); }
        }
    }

    @Test
    void unparseableArchiveFailsOnlyThatPeriod() throws Exception {
        Path tmp = Files.createTempDirectory("healer-test");
        try {
            RawTable table = new RawTable();
            table.put(new ObservationKey(34221, Q1), "LNLS", 100.0);
            ArchiveParser broken = (bytes, filter) -> { throw new IOException("zip END header not found"); };

            BulkSourceHealer healer = new BulkSourceHealer(downloader(Set.of()), broken, new BulkArchiveCache(tmp),
                    new HealingNeedAssessor(), 8, 1, new MetricRegistry());
            HealingReport report = healer.heal(table, Set.of(34221));

            assertEquals(List.of(Q1), report.failedPeriods());
            assertEquals("zip END header not found", report.periods().get(0).detail());
        } finally {
            try (var s = Files.walk(tmp)) { s.sorted(java.util.Comparator.reverseOrder()).forEach(p -> { try { Files.deleteIfExists(p); } catch (Exception ignore) {} }); }
        }
    }
}
