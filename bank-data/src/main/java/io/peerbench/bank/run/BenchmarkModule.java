package io.peerbench.bank.run;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.peerbench.bank.catalog.MetricCatalog;
import io.peerbench.bank.derive.CategoryTaxonomy;
import io.peerbench.bank.derive.FiscalCalendar;
import io.peerbench.bank.derive.LatestSnapshot;
import io.peerbench.bank.derive.LongRunAverages;
import io.peerbench.bank.derive.MetricsDerivationEngine;
import io.peerbench.bank.fdic.FdicApi;
import io.peerbench.bank.fdic.FdicBatchFetcher;
import io.peerbench.bank.fdic.FdicFinancialsFetcher;
import io.peerbench.bank.fdic.HttpFdicClient;
import io.peerbench.bank.fdic.InstitutionDirectory;
import io.peerbench.bank.ffiec.BulkArchiveCache;
import io.peerbench.bank.ffiec.BulkDownloadSession;
import io.peerbench.bank.ffiec.BulkSourceHealer;
import io.peerbench.bank.ffiec.HealingNeedAssessor;
import io.peerbench.bank.ffiec.TabDelimitedArchiveParser;
import io.peerbench.bank.peer.PeerCatalog;
import io.peerbench.bank.peer.PeerPercentileAnalyzer;
import io.peerbench.bank.peer.PolarityTable;
import io.peerbench.bank.resolve.FallbackCatalog;
import io.peerbench.bank.resolve.FieldResolver;
import io.peerbench.budget.Budget;
import io.peerbench.budget.FixedDelayBudget;

import java.time.Duration;
import java.util.Optional;

public class BenchmarkModule extends AbstractModule {
    private final BenchmarkConfig config;

    public BenchmarkModule(BenchmarkConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(BenchmarkConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Budget budget() { return new FixedDelayBudget(config.workers(), Duration.ofMillis(config.requestSpacingMillis())); }

    @Provides @Singleton FdicApi fdicApi(Budget budget) { return new HttpFdicClient(config.fdicBase(), config.apiKey(), Duration.ofSeconds(30), budget); }

    @Provides @Singleton FdicBatchFetcher batchFetcher(FdicApi api, Budget budget, MetricRegistry registry) {
        return new FdicBatchFetcher(new FdicFinancialsFetcher(api), budget, FdicBatchFetcher.defaultRetry(),
                config.workers(), registry, config.deadLetterFile(), Duration.ofMinutes(30));
    }

    @Provides @Singleton InstitutionDirectory directory(FdicApi api) { return new InstitutionDirectory(api); }

    @Provides @Singleton Optional<BulkSourceHealer> healer(MetricRegistry registry) {
        if (!config.healEnabled()) return Optional.empty();
        return Optional.of(new BulkSourceHealer(
                new BulkDownloadSession(config.ffiecUrl(), config.debugDir()),
                new TabDelimitedArchiveParser(),
                new BulkArchiveCache(config.cacheDir()),
                new HealingNeedAssessor(), config.healPeriods(), config.healParallelism(), registry));
    }

    @Provides @Singleton FieldResolver resolver() { return new FieldResolver(FallbackCatalog.defaultRules()); }

    @Provides @Singleton MetricsDerivationEngine engine() {
        return new MetricsDerivationEngine(new FiscalCalendar(config.fiscalYearStartMonth()), CategoryTaxonomy.defaults(),
                config.ttmWindow(), MetricsDerivationEngine.DEFAULT_CRE_GROWTH_LAG);
    }

    @Provides @Singleton PeerCatalog peers() {
        return config.peerGroups().isEmpty() ? PeerCatalog.defaults() : PeerCatalog.parse(config.peerGroups());
    }

    @Provides @Singleton MetricCatalog metricCatalog() { return MetricCatalog.defaults(); }

    @Provides @Singleton PeerPercentileAnalyzer analyzer(PeerCatalog peers, MetricCatalog metrics) {
        return new PeerPercentileAnalyzer(peers, PolarityTable.defaults(), metrics);
    }

    @Provides @Singleton BenchmarkRun run(FdicBatchFetcher fetcher, InstitutionDirectory directory,
                                          Optional<BulkSourceHealer> healer, FieldResolver resolver,
                                          MetricsDerivationEngine engine, PeerCatalog peers,
                                          PeerPercentileAnalyzer analyzer, MetricCatalog metrics, MetricRegistry registry) {
        return new BenchmarkRun(config, fetcher, directory, healer, resolver, engine, peers, analyzer,
                new LatestSnapshot(CategoryTaxonomy.defaults()), new LongRunAverages(config.longRunWindow()),
                metrics, registry);
    }
}
