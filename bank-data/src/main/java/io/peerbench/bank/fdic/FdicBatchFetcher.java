package io.peerbench.bank.fdic;

import com.codahale.metrics.MetricRegistry;
import io.peerbench.bank.error.JoinIntegrityException;
import io.peerbench.bank.error.TransientFetchException;
import io.peerbench.bank.model.RawTable;
import io.peerbench.budget.Budget;
import io.peerbench.core.ListSource;
import io.peerbench.error.FileDeadLetterSink;
import io.peerbench.retry.ExponentialBackoffRetryPolicy;
import io.peerbench.retry.RetryPolicy;
import io.peerbench.runtime.Pipeline;
import io.peerbench.runtime.PipelineAbortedException;
import io.peerbench.runtime.PipelineBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Fetches many institutions through the pipeline runtime. Transient failures are retried, then recorded
 * and skipped; a join-integrity failure stops the batch and is rethrown.
 */
public class FdicBatchFetcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(FdicBatchFetcher.class);

    public static final int DEFAULT_WORKERS = 3;

    private final FdicFinancialsFetcher fetcher;
    private final Budget budget;
    private final RetryPolicy retry;
    private final int workers;
    private final MetricRegistry registry;
    private final Path deadLetterFile;
    private final Duration timeout;

    public FdicBatchFetcher(FdicFinancialsFetcher fetcher, Budget budget, MetricRegistry registry, Path deadLetterFile) {
        this(fetcher, budget, defaultRetry(), DEFAULT_WORKERS, registry, deadLetterFile, Duration.ofMinutes(30));
    }

    public FdicBatchFetcher(FdicFinancialsFetcher fetcher, Budget budget, RetryPolicy retry, int workers,
                            MetricRegistry registry, Path deadLetterFile, Duration timeout) {
        this.fetcher = fetcher;
        this.budget = budget;
        this.retry = retry;
        this.workers = workers;
        this.registry = registry;
        this.deadLetterFile = deadLetterFile;
        this.timeout = timeout;
    }

    /** Three attempts with a doubling delay, transient network failures only. */
    public static RetryPolicy defaultRetry() {
        return new ExponentialBackoffRetryPolicy(3, 500, 4_000, e -> e instanceof TransientFetchException);
    }

    public FetchReport fetchAll(List<Integer> certs, List<String> fields, int periodLimit, RawTable table)
            throws IOException, InterruptedException {
        FailureLedger ledger = new FailureLedger(deadLetterFile == null ? null : new FileDeadLetterSink<>(deadLetterFile));
        Pipeline<Integer, FetchedSeries> pipeline = new PipelineBuilder<Integer, FetchedSeries>()
                .source(new ListSource<>(certs))
                .transform(new FetchSeriesTransform(fetcher, fields, periodLimit, registry))
                .sink(new RawTableSink(table))
                .budget(budget)
                .retry(retry)
                .abortOn(JoinIntegrityException.class)
                .workers(workers)
                .queueCapacity(64)
                .maxInFlight(Math.max(workers, 8))
                .sinkBatchSize(1)
                .sinkFlushEveryMillis(200)
                .metrics(registry)
                .deadLetterIn(ledger)
                .build();

        LOGGER.info("Fetching {} institution(s) with {} worker(s)", certs.size(), workers);
        try (ledger; pipeline) {
            pipeline.start();
            if (!pipeline.awaitCompletion(timeout)) {
                throw new TransientFetchException("batch fetch did not finish within " + timeout);
            }
        } catch (PipelineAbortedException e) {
            if (e.getCause() instanceof JoinIntegrityException jie) throw jie;
            throw e;
        }
        FetchReport report = new FetchReport(certs.size(), ledger.failures());
        if (!report.failures().isEmpty()) {
            LOGGER.warn("{} institution(s) skipped after retries: {}", report.failures().size(), report.failures().keySet());
        }
        LOGGER.info("Fetched {}/{} institution(s), raw table now has {} row(s)", report.succeeded(), certs.size(), table.size());
        return report;
    }
}
