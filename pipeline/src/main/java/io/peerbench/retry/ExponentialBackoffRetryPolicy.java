package io.peerbench.retry;

import java.util.function.Predicate;

/**
 * Retries up to {@code maxAttempts} total attempts with a doubling delay capped at {@code maxMillis}.
 * Errors rejected by the retryable predicate are never retried.
 */
public class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long baseMillis;
    private final long maxMillis;
    private final Predicate<? super Exception> retryable;

    public ExponentialBackoffRetryPolicy(int maxAttempts, long baseMillis, long maxMillis) {
        this(maxAttempts, baseMillis, maxMillis, e -> true);
    }

    public ExponentialBackoffRetryPolicy(int maxAttempts, long baseMillis, long maxMillis, Predicate<? super Exception> retryable) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(1, baseMillis);
        this.maxMillis = Math.max(this.baseMillis, maxMillis);
        this.retryable = retryable;
    }

    @Override
    public boolean shouldRetry(int attempt, Exception e) {
        return attempt < maxAttempts && retryable.test(e);
    }

    @Override
    public long backoffMillis(int attempt) {
        long delay = baseMillis * (1L << Math.min(20, Math.max(0, attempt - 1)));
        return Math.min(delay, maxMillis);
    }

    public int maxAttempts() { return maxAttempts; }
}
