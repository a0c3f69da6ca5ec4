package io.peerbench.bank.fdic;

import io.peerbench.core.Record;
import io.peerbench.error.DeadLetterSink;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Remembers which institutions exhausted their retries and forwards each failure to an optional
 * file-backed dead-letter sink.
 */
class FailureLedger implements DeadLetterSink<Integer> {
    private final ConcurrentSkipListMap<Integer, String> failures = new ConcurrentSkipListMap<>();
    private final DeadLetterSink<Integer> delegate;

    FailureLedger(DeadLetterSink<Integer> delegate) {
        this.delegate = delegate;
    }

    @Override
    public void acceptFailure(String stage, Record<Integer> record, Exception e) {
        failures.put(record.payload(), e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        if (delegate != null) delegate.acceptFailure(stage, record, e);
    }

    Map<Integer, String> failures() {
        return new TreeMap<>(failures);
    }

    @Override
    public void close() {
        if (delegate != null) delegate.close();
    }
}
