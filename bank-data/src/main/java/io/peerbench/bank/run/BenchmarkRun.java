package io.peerbench.bank.run;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import io.peerbench.bank.catalog.FieldCatalog;
import io.peerbench.bank.catalog.MetricCatalog;
import io.peerbench.bank.derive.CoverageReport;
import io.peerbench.bank.derive.LatestSnapshot;
import io.peerbench.bank.derive.LongRunAverages;
import io.peerbench.bank.derive.MetricsDerivationEngine;
import io.peerbench.bank.derive.MetricsDerivationEngine.YtdGapFlag;
import io.peerbench.bank.fdic.FdicBatchFetcher;
import io.peerbench.bank.fdic.FetchReport;
import io.peerbench.bank.fdic.InstitutionDirectory;
import io.peerbench.bank.ffiec.BulkFields;
import io.peerbench.bank.ffiec.BulkSourceHealer;
import io.peerbench.bank.ffiec.HealingReport;
import io.peerbench.bank.model.Institution;
import io.peerbench.bank.model.InstitutionIds;
import io.peerbench.bank.model.InstitutionTable;
import io.peerbench.bank.model.MetricFrame;
import io.peerbench.bank.model.RawTable;
import io.peerbench.bank.peer.PeerCatalog;
import io.peerbench.bank.peer.PeerCompositeSynthesizer;
import io.peerbench.bank.peer.PeerPercentileAnalyzer;
import io.peerbench.bank.peer.PercentileRecord;
import io.peerbench.bank.resolve.FieldResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One end-to-end benchmark: fetch, heal, freeze, resolve, derive, add composites, rank the subject.
 */
public class BenchmarkRun {
    private static final Logger LOGGER = LoggerFactory.getLogger(BenchmarkRun.class);

    private final BenchmarkConfig config;
    private final FdicBatchFetcher fetcher;
    private final InstitutionDirectory directory;
    private final Optional<BulkSourceHealer> healer;
    private final FieldResolver resolver;
    private final MetricsDerivationEngine engine;
    private final PeerCatalog peers;
    private final PeerPercentileAnalyzer analyzer;
    private final LatestSnapshot snapshot;
    private final LongRunAverages longRun;
    private final MetricCatalog metrics;
    private final MetricRegistry registry;

    public BenchmarkRun(BenchmarkConfig config, FdicBatchFetcher fetcher, InstitutionDirectory directory,
                        Optional<BulkSourceHealer> healer, FieldResolver resolver, MetricsDerivationEngine engine,
                        PeerCatalog peers, PeerPercentileAnalyzer analyzer, LatestSnapshot snapshot,
                        LongRunAverages longRun, MetricCatalog metrics, MetricRegistry registry) {
        this.config = config;
        this.fetcher = fetcher;
        this.directory = directory;
        this.healer = healer;
        this.resolver = resolver;
        this.engine = engine;
        this.peers = peers;
        this.analyzer = analyzer;
        this.snapshot = snapshot;
        this.longRun = longRun;
        this.metrics = metrics;
        this.registry = registry;
    }

    /** Subject first, then every peer member; all must be real institution ids. */
    public List<Integer> institutionsToFetch() {
        Set<Integer> certs = new LinkedHashSet<>();
        certs.add(InstitutionIds.requireReal(config.subject()));
        for (int cert : peers.allMembers()) certs.add(InstitutionIds.requireReal(cert));
        return new ArrayList<>(certs);
    }

    public BenchmarkResult run() throws IOException, InterruptedException {
        List<Integer> certs = institutionsToFetch();
        RawTable raw = new RawTable();

        FetchReport fetchReport;
        try (Timer.Context ignored = registry.timer("run.fetch.time").time()) {
            fetchReport = fetcher.fetchAll(certs, FieldCatalog.FDIC_FIELDS_TO_FETCH, config.fetchLimit(), raw);
        }
        if (raw.size() == 0) {
            throw new IllegalStateException("no financial data was fetched for any of " + certs.size() + " institution(s)");
        }

        Map<Integer, Institution> institutions = directory.lookupAll(certs);
        institutions.values().forEach(i -> {
            if (raw.name(i.cert()) == null) raw.setName(i.cert(), i.name());
        });

        HealingReport healingReport = new HealingReport(List.of());
        if (healer.isPresent()) {
            try (Timer.Context ignored = registry.timer("run.heal.time").time()) {
                healingReport = healer.get().heal(raw, Set.copyOf(certs));
            }
            if (!healingReport.failedPeriods().isEmpty()) {
                LOGGER.warn("Bulk source failed for period(s) {}; those stay unhealed", healingReport.failedPeriods());
            }
        } else {
            LOGGER.info("Bulk source healing disabled");
        }
        raw.freeze();

        List<String> requested = new ArrayList<>(FieldCatalog.FDIC_FIELDS_TO_FETCH);
        requested.addAll(BulkFields.TARGET_FIELDS);
        CoverageReport coverage = CoverageReport.analyze(raw, requested, metrics::describe);
        List<String> empty = coverage.fieldsWith(CoverageReport.Status.EMPTY);
        if (!empty.isEmpty()) LOGGER.warn("{} requested field(s) have no data: {}", empty.size(), empty);

        MetricFrame frame;
        List<YtdGapFlag> flags;
        try (Timer.Context ignored = registry.timer("run.derive.time").time()) {
            frame = resolver.resolveAll(raw);
            flags = engine.derive(frame);
        }
        if (!flags.isEmpty()) LOGGER.warn("{} quarterly value(s) span a reporting gap and need review", flags.size());

        List<Institution> composites = new PeerCompositeSynthesizer(peers).synthesize(frame);
        List<PercentileRecord> comparison = analyzer.analyze(frame, config.subject());
        InstitutionTable latest = snapshot.build(frame);
        InstitutionTable averages = longRun.compute(frame);

        registry.counter("run.institutions").inc(fetchReport.succeeded());
        registry.counter("run.rows").inc(frame.size());
        LOGGER.info("Benchmark for CERT {} done: {} row(s), {} composite(s), {} compared metric(s)",
                config.subject(), frame.size(), composites.size(), comparison.size());
        return new BenchmarkResult(config.subject(), frame, institutions, composites, comparison, latest, averages,
                coverage, fetchReport, healingReport, flags);
    }
}
