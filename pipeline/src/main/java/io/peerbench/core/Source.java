package io.peerbench.core;

import java.io.Closeable;
import java.util.Optional;

/**
 * A Source produces records with increasing seq numbers starting at zero.
 */
public interface Source<T> extends Closeable {
    /**
     * Next available record, or empty when nothing is ready. Finite sources keep returning empty once
     * {@link #isFinished()} is true.
     */
    Optional<Record<T>> poll();

    boolean isFinished();

    @Override
    default void close() {}
}
