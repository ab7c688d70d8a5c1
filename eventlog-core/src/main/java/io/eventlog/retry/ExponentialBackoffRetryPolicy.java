package io.eventlog.retry;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry policy using exponential backoff, optionally with jitter.
 *
 * <p>Delay formula: {@code baseDelay * 2^(attempt-1)}, capped at {@code maxDelay}. With
 * jitter enabled the delay is multiplied by a random factor in [0.5, 1.5) and capped again.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final boolean jitter;

    /**
     * Creates a policy with jitter.
     *
     * @param baseDelayMs base delay for the first retry (milliseconds)
     * @param maxDelayMs  maximum delay cap (milliseconds)
     */
    public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
        this(baseDelayMs, maxDelayMs, true);
    }

    /**
     * @param baseDelayMs base delay for the first retry (milliseconds)
     * @param maxDelayMs  maximum delay cap (milliseconds)
     * @param jitter      whether to randomize delays
     */
    public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, boolean jitter) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitter = jitter;
    }

    /**
     * Deterministic policy producing {@code base, 2*base, 4*base, ...} up to {@code maxDelayMs}.
     */
    public static ExponentialBackoffRetryPolicy withoutJitter(long baseDelayMs, long maxDelayMs) {
        return new ExponentialBackoffRetryPolicy(baseDelayMs, maxDelayMs, false);
    }

    public long baseDelayMs() {
        return baseDelayMs;
    }

    public long maxDelayMs() {
        return maxDelayMs;
    }

    @Override
    public long computeDelayMs(int attempts) {
        if (attempts <= 0) {
            return 0L;
        }
        long expDelay;
        if (attempts >= 31) {
            expDelay = Long.MAX_VALUE;
        } else {
            long shift = 1L << (attempts - 1);
            expDelay = shift > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * shift;
        }
        long capped = Math.min(maxDelayMs, expDelay);
        if (!jitter) {
            return capped;
        }
        double factor = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
        return Math.min(maxDelayMs, Math.max(0L, (long) (capped * factor)));
    }
}
