package io.peerbench.error;

import io.peerbench.core.Record;

public interface DeadLetterSink<T> extends AutoCloseable {
    void acceptFailure(String stage, Record<T> record, Exception e);
    @Override default void close() {}
}
