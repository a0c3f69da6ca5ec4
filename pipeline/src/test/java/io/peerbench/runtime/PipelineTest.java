package io.peerbench.runtime;

import com.codahale.metrics.MetricRegistry;
import io.peerbench.budget.FixedDelayBudget;
import io.peerbench.core.BatchSink;
import io.peerbench.core.ListSource;
import io.peerbench.core.Record;
import io.peerbench.core.Sink;
import io.peerbench.core.Transform;
import io.peerbench.error.DeadLetterSink;
import io.peerbench.retry.ExponentialBackoffRetryPolicy;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class PipelineTest {

    static class CollectingSink implements Sink<Integer> {
        final List<Integer> seen = Collections.synchronizedList(new ArrayList<>());
        @Override public void accept(Record<Integer> record) { seen.add(record.payload()); }
    }

    static class BatchCountingSink implements BatchSink<Integer> {
        final List<Integer> batchSizes = new ArrayList<>();
        @Override public void accept(Record<Integer> record) {}
        @Override public void acceptBatch(List<Record<Integer>> records) { batchSizes.add(records.size()); }
    }

    static class MemoryDeadLetters implements DeadLetterSink<Integer> {
        final Map<Integer, Exception> failures = new ConcurrentHashMap<>();
        final Map<Integer, String> stages = new ConcurrentHashMap<>();
        @Override public void acceptFailure(String stage, Record<Integer> record, Exception e) {
            failures.put(record.payload(), e);
            stages.put(record.payload(), stage);
        }
    }

    private static List<Integer> range(int n) {
        return IntStream.range(0, n).boxed().collect(Collectors.toList());
    }

    @Test
    void outputsArriveInSourceOrderDespiteUnevenWork() throws Exception {
        var sink = new CollectingSink();
        Transform<Integer, Integer> slowEvens = Transform.mapping(i -> {
            if (i % 2 == 0) Thread.sleep(5);
            return i * 10;
        });
        try (var p = new PipelineBuilder<Integer, Integer>()
                .source(new ListSource<>(range(20)))
                .transform(slowEvens)
                .sink(sink)
                .retry(new ExponentialBackoffRetryPolicy(1, 1, 1))
                .workers(4)
                .sinkBatchSize(3)
                .build()) {
            p.start();
            assertTrue(p.awaitCompletion(Duration.ofSeconds(10)));
        }
        assertEquals(range(20).stream().map(i -> i * 10).collect(Collectors.toList()), sink.seen);
    }

    @Test
    void failedRecordGoesToDeadLettersAndDoesNotStallLaterOutput() throws Exception {
        var sink = new CollectingSink();
        var dlq = new MemoryDeadLetters();
        AtomicInteger attemptsOnThree = new AtomicInteger();
        Transform<Integer, Integer> failOnThree = Transform.mapping(i -> {
            if (i == 3) {
                attemptsOnThree.incrementAndGet();
                throw new IOException("upstream unavailable");
            }
            return i;
        });
        try (var p = new PipelineBuilder<Integer, Integer>()
                .source(new ListSource<>(range(6)))
                .transform(failOnThree)
                .sink(sink)
                .retry(new ExponentialBackoffRetryPolicy(3, 1, 5))
                .deadLetterIn(dlq)
                .workers(2)
                .build()) {
            p.start();
            assertTrue(p.awaitCompletion(Duration.ofSeconds(10)));
        }
        assertEquals(List.of(0, 1, 2, 4, 5), sink.seen);
        assertEquals(3, attemptsOnThree.get());
        assertTrue(dlq.failures.get(3) instanceof IOException);
    }

    @Test
    void abortPredicateStopsRunAndSurfacesCause() throws Exception {
        var sink = new CollectingSink();
        AtomicInteger calls = new AtomicInteger();
        Transform<Integer, Integer> fatalOnOne = Transform.mapping(i -> {
            calls.incrementAndGet();
            if (i == 1) throw new IllegalStateException("keys never line up");
            return i;
        });
        var p = new PipelineBuilder<Integer, Integer>()
                .source(new ListSource<>(List.of(0, 1)))
                .transform(fatalOnOne)
                .sink(sink)
                .retry(new ExponentialBackoffRetryPolicy(5, 1, 5))
                .abortOn(IllegalStateException.class)
                .workers(1)
                .build();
        try {
            p.start();
            PipelineAbortedException ex = assertThrows(PipelineAbortedException.class, () -> p.awaitCompletion(Duration.ofSeconds(10)));
            assertTrue(ex.getCause() instanceof IllegalStateException);
            assertEquals(2, calls.get(), "a fatal error is never retried");
        } finally {
            p.close();
        }
    }

    @Test
    void batchesAreGroupedByConfiguredSize() throws Exception {
        var sink = new BatchCountingSink();
        try (var p = new PipelineBuilder<Integer, Integer>()
                .source(new ListSource<>(List.of(1, 2, 3, 4, 5)))
                .transform(r -> List.of(r))
                .sink(sink)
                .budget(new FixedDelayBudget(2, Duration.ZERO))
                .retry(new ExponentialBackoffRetryPolicy(2, 1, 5))
                .workers(1)
                .sinkBatchSize(3)
                .sinkFlushEveryMillis(0)
                .metrics(new MetricRegistry())
                .build()) {
            p.start();
            assertTrue(p.awaitCompletion(Duration.ofSeconds(10)));
        }
        assertEquals(List.of(3, 2), sink.batchSizes);
    }

    @Test
    void unwritableDeadLetterSinkDoesNotDropLaterRecords() throws Exception {
        var sink = new CollectingSink();
        var registry = new MetricRegistry();
        DeadLetterSink<Integer> diskFull = (stage, record, e) -> {
            throw new UncheckedIOException(new IOException("No space left on device"));
        };
        Transform<Integer, Integer> failOnOne = Transform.mapping(i -> {
            if (i == 1) throw new IOException("upstream unavailable");
            return i;
        });
        try (var p = new PipelineBuilder<Integer, Integer>()
                .source(new ListSource<>(range(5)))
                .transform(failOnOne)
                .sink(sink)
                .retry(new ExponentialBackoffRetryPolicy(1, 1, 1))
                .deadLetterIn(diskFull)
                .workers(2)
                .metrics(registry)
                .build()) {
            p.start();
            assertTrue(p.awaitCompletion(Duration.ofSeconds(10)));
        }
        assertEquals(List.of(0, 2, 3, 4), sink.seen);
        assertEquals(1, registry.counter("pipeline.deadletter.errors").getCount());
    }

    @Test
    void interruptedTransformIsRecordedAsFailure() throws Exception {
        var sink = new CollectingSink();
        var dlq = new MemoryDeadLetters();
        Transform<Integer, Integer> interruptedOnTwo = Transform.mapping(i -> {
            if (i == 2) throw new InterruptedException("shutting down");
            return i;
        });
        try (var p = new PipelineBuilder<Integer, Integer>()
                .source(new ListSource<>(range(5)))
                .transform(interruptedOnTwo)
                .sink(sink)
                .retry(new ExponentialBackoffRetryPolicy(3, 1, 5))
                .deadLetterIn(dlq)
                .workers(1)
                .build()) {
            p.start();
            assertTrue(p.awaitCompletion(Duration.ofSeconds(10)));
        }
        assertEquals(List.of(0, 1, 3, 4), sink.seen);
        assertEquals("interrupted", dlq.stages.get(2));
        assertTrue(dlq.failures.get(2) instanceof InterruptedException);
    }
}
