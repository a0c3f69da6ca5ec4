package io.peerbench.budget;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Bounded slots plus a minimum spacing between external requests shared by every caller.
 * A request reserves the next free start time with a CAS, then sleeps until it arrives.
 */
public class FixedDelayBudget implements Budget {
    private final Semaphore slots;
    private final long spacingNanos;
    private final LongSupplier nanoClock;
    private final AtomicLong nextAvailableNanos;

    public FixedDelayBudget(int slots, Duration minSpacing) {
        this(slots, minSpacing, System::nanoTime);
    }

    FixedDelayBudget(int slots, Duration minSpacing, LongSupplier nanoClock) {
        this.slots = new Semaphore(Math.max(1, slots));
        this.spacingNanos = Math.max(0, minSpacing.toNanos());
        this.nanoClock = nanoClock;
        this.nextAvailableNanos = new AtomicLong(nanoClock.getAsLong());
    }

    @Override
    public boolean tryAcquireSlot() {
        return slots.tryAcquire();
    }

    @Override
    public void releaseSlot() {
        slots.release();
    }

    @Override
    public void acquireExternalOp() throws InterruptedException {
        if (spacingNanos == 0) return;
        long now = nanoClock.getAsLong();
        while (true) {
            long current = nextAvailableNanos.get();
            long earliest = Math.max(current, now);
            if (nextAvailableNanos.compareAndSet(current, earliest + spacingNanos)) {
                long delay = earliest - now;
                if (delay > 0) TimeUnit.NANOSECONDS.sleep(delay);
                return;
            }
        }
    }

    public int availableSlots() { return slots.availablePermits(); }
}
