package io.peerbench.budget;

/**
 * Budget governs how much work runs concurrently and how fast external calls are issued.
 */
public interface Budget extends AutoCloseable {
    /** Acquire a worker slot without blocking. Return true if acquired. */
    boolean tryAcquireSlot();
    void releaseSlot();

    /** Block as needed to respect the spacing between external requests (one op). */
    void acquireExternalOp() throws InterruptedException;

    @Override
    default void close() {}

    /** A budget that never limits anything. */
    static Budget unlimited() {
        return new Budget() {
            @Override public boolean tryAcquireSlot() { return true; }
            @Override public void releaseSlot() {}
            @Override public void acquireExternalOp() {}
        };
    }
}
