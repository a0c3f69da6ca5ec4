package io.peerbench.core;

import java.io.Closeable;

/**
 * Sink consumes records in seq order.
 */
public interface Sink<T> extends Closeable {
    void accept(Record<T> record) throws Exception;

    @Override
    default void close() {}
}
