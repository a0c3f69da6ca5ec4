package io.peerbench.runtime;

import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.peerbench.budget.Budget;
import io.peerbench.core.BatchSink;
import io.peerbench.core.Record;
import io.peerbench.core.Sink;
import io.peerbench.core.Source;
import io.peerbench.core.Transform;
import io.peerbench.error.DeadLetterSink;
import io.peerbench.metrics.Metrics;
import io.peerbench.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

/**
 * Single-source -> worker-pool transform -> single ordered sink, with backpressure, budgeting and retries.
 * <p>
 * A record whose transform keeps failing is handed to the input dead-letter sink and contributes no output;
 * the rest of the run continues. An error matched by the abort predicate stops the run instead and is
 * rethrown from {@link #awaitCompletion(Duration)}.
 */
public class Pipeline<I, O> implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(Pipeline.class);

    private final Source<I> source;
    private final Transform<I, O> transform;
    private final Sink<O> sink;
    private final Budget budget;
    private final RetryPolicy retryPolicy;
    private final Predicate<? super Exception> abortOn;
    private final int workers;
    private final Metrics metrics;
    private final DeadLetterSink<I> dlqIn;
    private final DeadLetterSink<O> dlqOut;
    private final int sinkBatchSize;
    private final int sinkFlushEveryMillis;
    private final int maxInFlight;

    private final ExecutorService workerPool;
    private final ArrayBlockingQueue<Batch<O>> queue;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger inflight = new AtomicInteger(0);
    private final AtomicReference<Exception> abortCause = new AtomicReference<>();
    private final CountDownLatch done = new CountDownLatch(1);
    private volatile Thread srcThread;
    private volatile Thread sinkThread;

    private final Timer sourceTimer;
    private final Timer transformTimer;
    private final Timer sinkTimer;
    private final Meter inMeter;
    private final Meter outMeter;
    private final Meter errorMeter;
    private final Meter failedMeter;

    Pipeline(Source<I> source,
             Transform<I, O> transform,
             Sink<O> sink,
             Budget budget,
             RetryPolicy retryPolicy,
             Predicate<? super Exception> abortOn,
             int workers,
             int queueCapacity,
             Metrics metrics,
             DeadLetterSink<I> dlqIn,
             DeadLetterSink<O> dlqOut,
             int sinkBatchSize,
             int sinkFlushEveryMillis,
             int maxInFlight) {
        this.source = Objects.requireNonNull(source);
        this.transform = Objects.requireNonNull(transform);
        this.sink = Objects.requireNonNull(sink);
        this.budget = Objects.requireNonNull(budget);
        this.retryPolicy = Objects.requireNonNull(retryPolicy);
        this.abortOn = abortOn == null ? e -> false : abortOn;
        this.workers = Math.max(1, workers);
        this.metrics = Objects.requireNonNull(metrics);
        this.dlqIn = dlqIn;
        this.dlqOut = dlqOut;
        this.sinkBatchSize = Math.max(1, sinkBatchSize);
        this.sinkFlushEveryMillis = Math.max(0, sinkFlushEveryMillis);
        this.maxInFlight = Math.max(1, maxInFlight);
        this.workerPool = Executors.newFixedThreadPool(this.workers, r -> {
            Thread t = new Thread(r, "pipeline-worker");
            t.setDaemon(true);
            return t;
        });
        this.queue = new ArrayBlockingQueue<>(Math.max(1, queueCapacity));
        this.sourceTimer = metrics.timer("pipeline.source.time");
        this.transformTimer = metrics.timer("pipeline.transform.time");
        this.sinkTimer = metrics.timer("pipeline.sink.time");
        this.inMeter = metrics.meter("pipeline.input.rate");
        this.outMeter = metrics.meter("pipeline.output.rate");
        this.errorMeter = metrics.meter("pipeline.error.rate");
        this.failedMeter = metrics.meter("pipeline.failed.rate");
    }

    public void start() {
        if (!running.compareAndSet(false, true)) return;
        srcThread = new Thread(this::runSource, "pipeline-source");
        srcThread.start();
        // single sink thread to enforce ordering
        sinkThread = new Thread(this::runSink, "pipeline-sink");
        sinkThread.start();
    }

    /**
     * Blocks until every source record has been transformed and sunk, or the run aborted.
     *
     * @return false if the timeout elapsed first
     * @throws PipelineAbortedException if a record failed with an error matched by the abort predicate
     */
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        boolean finished = done.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        Exception cause = abortCause.get();
        if (cause != null) throw new PipelineAbortedException(cause);
        return finished;
    }

    public void stop() {
        running.set(false);
        Thread st = srcThread; Thread kt = sinkThread;
        if (st != null) { try { st.join(5000); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); } }
        if (kt != null) { try { kt.join(5000); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); } }
        workerPool.shutdown();
    }

    public boolean isRunning() { return running.get(); }
    public int getQueueSize() { return queue.size(); }
    public int getInflight() { return inflight.get(); }

    private void runSource() {
        while (running.get() && abortCause.get() == null) {
            // Backpressure: limit pending/in-flight tasks
            if (inflight.get() >= maxInFlight) { sleepQuiet(1); continue; }
            Optional<Record<I>> opt;
            try (Timer.Context ignored = sourceTimer.time()) {
                opt = source.poll();
            }
            if (opt.isEmpty()) {
                if (source.isFinished()) break;
                sleepQuiet(1);
                continue;
            }
            inMeter.mark();
            Record<I> in = opt.get();
            inflight.incrementAndGet();
            workerPool.submit(() -> process(in));
        }
        // wait for all submitted work to complete, then signal end
        while (inflight.get() > 0) { sleepQuiet(5); }
        enqueue(Batch.poison());
    }

    private void process(Record<I> in) {
        while (!budget.tryAcquireSlot()) {
            sleepQuiet(1);
        }
        List<Record<O>> outputs = List.of();
        try {
            int attempt = 0;
            while (abortCause.get() == null) {
                attempt++;
                try (Timer.Context ignored = transformTimer.time()) {
                    List<Record<O>> result = transform.apply(in);
                    outputs = result == null ? List.of() : new ArrayList<>(result);
                    outputs.sort(Comparator.comparingInt(Record::subSeq));
                    break;
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    LOGGER.warn("Record seq={} interrupted on attempt {}", in.seq(), attempt);
                    failedMeter.mark();
                    deadLetter(dlqIn, "interrupted", in, ie);
                    break;
                } catch (Exception e) {
                    errorMeter.mark();
                    if (abortOn.test(e)) {
                        LOGGER.error("Record seq={} failed with a run-fatal error; stopping", in.seq(), e);
                        abortCause.compareAndSet(null, e);
                        break;
                    }
                    if (retryPolicy.shouldRetry(attempt, e)) {
                        LOGGER.warn("Record seq={} attempt {} failed: {}; retrying", in.seq(), attempt, e.toString());
                        sleepQuiet(retryPolicy.backoffMillis(attempt));
                        continue;
                    }
                    LOGGER.warn("Record seq={} failed after {} attempt(s): {}", in.seq(), attempt, e.toString());
                    failedMeter.mark();
                    deadLetter(dlqIn, "transform", in, e);
                    break;
                }
            }
        } finally {
            // an empty batch still advances the sink's expected seq
            enqueue(Batch.of(in.seq(), outputs));
            budget.releaseSlot();
            inflight.decrementAndGet();
        }
    }

    private void runSink() {
        List<Record<O>> emitBuffer = new ArrayList<>();
        TreeMap<Long, Batch<O>> pending = new TreeMap<>();
        long expectedSeq = 0;
        try {
            while (true) {
                Batch<O> batch = sinkFlushEveryMillis > 0
                        ? queue.poll(sinkFlushEveryMillis, TimeUnit.MILLISECONDS)
                        : queue.take();
                if (batch == null) {
                    flushQuiet(emitBuffer);
                    continue;
                }
                if (batch.isPoison()) {
                    flushQuiet(emitBuffer);
                    return;
                }
                pending.put(batch.seq, batch);
                Batch<O> ready;
                while ((ready = pending.remove(expectedSeq)) != null) {
                    emitBuffer.addAll(ready.items);
                    if (emitBuffer.size() >= sinkBatchSize) flushQuiet(emitBuffer);
                    expectedSeq++;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            running.set(false);
            done.countDown();
        }
    }

    private void flushQuiet(List<Record<O>> records) {
        if (records.isEmpty()) return;
        try (Timer.Context ignored = sinkTimer.time()) {
            if (sink instanceof BatchSink<O> bs) {
                bs.acceptBatch(records);
                outMeter.mark(records.size());
            } else {
                for (Record<O> r : records) {
                    try {
                        sink.accept(r);
                        outMeter.mark();
                    } catch (Exception e) {
                        errorMeter.mark();
                        LOGGER.warn("Sink rejected record seq={}: {}", r.seq(), e.toString());
                        deadLetter(dlqOut, "sink", r, e);
                    }
                }
            }
            metrics.counter("pipeline.sink.batch.flushes").inc();
        } catch (Exception e) {
            errorMeter.mark();
            LOGGER.warn("Sink rejected batch of {} record(s): {}", records.size(), e.toString());
            records.forEach(r -> deadLetter(dlqOut, "sink", r, e));
        } finally {
            records.clear();
        }
    }

    private <T> void deadLetter(DeadLetterSink<T> dlq, String stage, Record<T> record, Exception cause) {
        if (dlq == null) return;
        try {
            dlq.acceptFailure(stage, record, cause);
        } catch (RuntimeException e) {
            metrics.counter("pipeline.deadletter.errors").inc();
            LOGGER.error("Dead-letter sink rejected record seq={} ({})", record.seq(), stage, e);
        }
    }

    /** Puts even when the caller's interrupt flag is set; the flag is restored afterwards. */
    private void enqueue(Batch<O> batch) {
        boolean interrupted = Thread.interrupted();
        try {
            while (true) {
                try {
                    queue.put(batch);
                    return;
                } catch (InterruptedException ie) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) Thread.currentThread().interrupt();
        }
    }

    private static void sleepQuiet(long millis) {
        try { Thread.sleep(millis); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); }
    }

    @Override
    public void close() {
        stop();
        workerPool.shutdownNow();
    }

    static final class Batch<T> {
        final long seq;
        final List<Record<T>> items;
        private final boolean poison;

        private Batch(long seq, List<Record<T>> items, boolean poison) {
            this.seq = seq; this.items = items; this.poison = poison;
        }
        static <T> Batch<T> of(long seq, List<Record<T>> items) { return new Batch<>(seq, items, false); }
        static <T> Batch<T> poison() { return new Batch<>(Long.MAX_VALUE, List.of(), true); }
        boolean isPoison() { return poison; }
    }
}
