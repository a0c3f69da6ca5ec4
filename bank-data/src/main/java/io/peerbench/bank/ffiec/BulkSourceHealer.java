package io.peerbench.bank.ffiec;

import com.codahale.metrics.MetricRegistry;
import io.peerbench.bank.model.ObservationKey;
import io.peerbench.bank.model.RawTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Fills gaps in the most recent periods of the raw table from the bulk archive. Periods are healed in
 * parallel, each with its own download session; a failed period is reported and the others carry on.
 * Only rows the primary source already produced are touched.
 */
public class BulkSourceHealer {
    private static final Logger LOGGER = LoggerFactory.getLogger(BulkSourceHealer.class);

    public static final int DEFAULT_PERIODS = 8;
    public static final int DEFAULT_PARALLELISM = 2;

    private final BulkDownloader downloader;
    private final ArchiveParser parser;
    private final BulkArchiveCache cache;
    private final HealingNeedAssessor assessor;
    private final int periodsToHeal;
    private final int parallelism;
    private final MetricRegistry registry;

    public BulkSourceHealer(BulkDownloader downloader, ArchiveParser parser, BulkArchiveCache cache, MetricRegistry registry) {
        this(downloader, parser, cache, new HealingNeedAssessor(), DEFAULT_PERIODS, DEFAULT_PARALLELISM, registry);
    }

    public BulkSourceHealer(BulkDownloader downloader, ArchiveParser parser, BulkArchiveCache cache,
                            HealingNeedAssessor assessor, int periodsToHeal, int parallelism, MetricRegistry registry) {
        this.downloader = downloader;
        this.parser = parser;
        this.cache = cache;
        this.assessor = assessor;
        this.periodsToHeal = Math.max(0, periodsToHeal);
        this.parallelism = Math.max(1, parallelism);
        this.registry = registry;
    }

    public HealingReport heal(RawTable table, Set<Integer> certsOfInterest) throws InterruptedException {
        List<LocalDate> periods = table.periodsNewestFirst();
        if (periods.size() > periodsToHeal) periods = periods.subList(0, periodsToHeal);

        List<HealingReport.PeriodOutcome> outcomes = new ArrayList<>();
        List<Future<HealingReport.PeriodOutcome>> futures = new ArrayList<>();
        ExecutorService pool = Executors.newFixedThreadPool(parallelism, r -> {
            Thread t = new Thread(r, "bulk-healer");
            t.setDaemon(true);
            return t;
        });
        try {
            for (LocalDate period : periods) {
                if (!assessor.needsHealing(table, period)) {
                    LOGGER.info("Primary data sufficient for {}; skipping bulk source", period);
                    registry.counter("ffiec.heal.skipped").inc();
                    futures.add(null);
                    continue;
                }
                Callable<HealingReport.PeriodOutcome> task = () -> healPeriod(table, period, certsOfInterest);
                futures.add(pool.submit(task));
            }
            for (int i = 0; i < periods.size(); i++) {
                LocalDate period = periods.get(i);
                Future<HealingReport.PeriodOutcome> f = futures.get(i);
                if (f == null) {
                    outcomes.add(new HealingReport.PeriodOutcome(period, HealingReport.Status.SKIPPED, 0, null));
                    continue;
                }
                try {
                    outcomes.add(f.get());
                } catch (ExecutionException e) {
                    LOGGER.error("Healing {} failed unexpectedly", period, e.getCause());
                    registry.counter("ffiec.heal.failed").inc();
                    outcomes.add(new HealingReport.PeriodOutcome(period, HealingReport.Status.FAILED, 0, String.valueOf(e.getCause())));
                }
            }
        } finally {
            pool.shutdownNow();
        }
        HealingReport report = new HealingReport(outcomes);
        LOGGER.info("Healing finished: {} cell(s) merged, failed periods {}", report.totalMerged(), report.failedPeriods());
        return report;
    }

    private HealingReport.PeriodOutcome healPeriod(RawTable table, LocalDate period, Set<Integer> certsOfInterest)
            throws InterruptedException {
        Optional<List<BulkObservation>> cached = cache.read(period);
        if (cached.isPresent()) {
            registry.counter("ffiec.cache.hits").inc();
            LOGGER.info("Bulk cache hit for {} ({} cell(s))", period, cached.get().size());
            return new HealingReport.PeriodOutcome(period, HealingReport.Status.CACHED,
                    apply(table, period, cached.get(), certsOfInterest), null);
        }

        BulkSessionState state = downloader.download(period);
        if (state.isFailed()) {
            registry.counter("ffiec.heal.failed").inc();
            return new HealingReport.PeriodOutcome(period, HealingReport.Status.FAILED, 0, state.failureReason());
        }
        try {
            List<BulkObservation> parsed = parser.parse(state.archive(), certsOfInterest::contains);
            state = BulkDownloadProtocol.onParsed(state, parsed);
        } catch (IOException e) {
            LOGGER.error("Bulk archive for {} could not be parsed: {}", period, e.getMessage());
            registry.counter("ffiec.heal.failed").inc();
            return new HealingReport.PeriodOutcome(period, HealingReport.Status.FAILED, 0, e.getMessage());
        }
        try {
            cache.write(period, state.observations());
        } catch (IOException e) {
            LOGGER.warn("Could not cache bulk cells for {}: {}", period, e.getMessage());
        }
        registry.counter("ffiec.heal.parsed").inc();
        return new HealingReport.PeriodOutcome(period, HealingReport.Status.PARSED,
                apply(table, period, state.observations(), certsOfInterest), null);
    }

    private int apply(RawTable table, LocalDate period, List<BulkObservation> observations, Set<Integer> certsOfInterest) {
        int merged = 0;
        for (BulkObservation o : observations) {
            if (!certsOfInterest.contains(o.cert())) continue;
            if (table.merge(new ObservationKey(o.cert(), period), o.field(), o.value(), HealingMerge::merge)) merged++;
        }
        registry.counter("ffiec.heal.cells").inc(merged);
        LOGGER.info("Merged {} bulk cell(s) into {}", merged, period);
        return merged;
    }
}
