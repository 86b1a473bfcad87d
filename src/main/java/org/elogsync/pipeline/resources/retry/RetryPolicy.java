package org.elogsync.pipeline.resources.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with symmetric jitter for remote calls.
 * <p>
 * The delay before retry {@code n} (zero-based) is {@code baseDelay * 2^n}, capped at
 * {@code maxDelay}, then scaled by a random factor in {@code [1 - jitter, 1 + jitter]}.
 */
public final class RetryPolicy {

    private final int maxAttempts;
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;

    /**
     * @param maxAttempts  Total attempts including the first one (at least 1)
     * @param baseDelay    Delay before the first retry
     * @param maxDelay     Upper bound of the un-jittered delay
     * @param jitterFactor Relative jitter in {@code [0, 1]}
     */
    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, double jitterFactor) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Retry delays must not be negative");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be within [0, 1], was " + jitterFactor);
        }
        this.maxAttempts = maxAttempts;
        this.baseDelayMs = baseDelay.toMillis();
        this.maxDelayMs = Math.max(baseDelayMs, maxDelay.toMillis());
        this.jitterFactor = jitterFactor;
    }

    /**
     * Delay in milliseconds before the retry following the given zero-based failed attempt.
     */
    public long delayMs(int attempt) {
        long exponential = baseDelayMs * (1L << Math.min(Math.max(attempt, 0), 20));
        return jitter(Math.min(exponential, maxDelayMs));
    }

    private long jitter(long value) {
        if (jitterFactor == 0.0 || value == 0) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    /**
     * @return {@code true} if another attempt is allowed after {@code attemptsMade} attempts
     */
    public boolean canRetry(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    /**
     * Three attempts, 500 ms base delay, 10 s cap, 20% jitter.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(3, Duration.ofMillis(500), Duration.ofSeconds(10), 0.2);
    }

    /**
     * Policy without any delay between attempts.
     */
    public static RetryPolicy immediate(int maxAttempts) {
        return new RetryPolicy(maxAttempts, Duration.ZERO, Duration.ZERO, 0.0);
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxAttempts=" + maxAttempts + ", baseDelayMs=" + baseDelayMs
            + ", maxDelayMs=" + maxDelayMs + ", jitter=" + jitterFactor + '}';
    }
}
