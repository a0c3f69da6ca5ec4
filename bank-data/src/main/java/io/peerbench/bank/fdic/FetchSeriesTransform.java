package io.peerbench.bank.fdic;

import com.codahale.metrics.MetricRegistry;
import io.peerbench.core.Record;
import io.peerbench.core.Transform;

import java.util.List;

/**
 * Turns an institution id into its fetched quarterly series. Errors propagate so the pipeline can retry them.
 */
class FetchSeriesTransform implements Transform<Integer, FetchedSeries> {
    private final FdicFinancialsFetcher fetcher;
    private final List<String> fields;
    private final int periodLimit;
    private final MetricRegistry registry;

    FetchSeriesTransform(FdicFinancialsFetcher fetcher, List<String> fields, int periodLimit, MetricRegistry registry) {
        this.fetcher = fetcher;
        this.fields = List.copyOf(fields);
        this.periodLimit = periodLimit;
        this.registry = registry;
    }

    @Override
    public List<Record<FetchedSeries>> apply(Record<Integer> input) throws Exception {
        int cert = input.payload();
        registry.counter("fdic.fetch.attempts").inc();
        List<RawRow> rows;
        try {
            rows = fetcher.fetchSeries(cert, fields, periodLimit);
        } catch (Exception e) {
            registry.counter("fdic.fetch.errors").inc();
            throw e;
        }
        registry.counter("fdic.fetch.rows").inc(rows.size());
        if (rows.isEmpty()) {
            registry.counter("fdic.fetch.empty").inc();
            return List.of();
        }
        return List.of(input.withPayload(new FetchedSeries(cert, rows)));
    }
}
