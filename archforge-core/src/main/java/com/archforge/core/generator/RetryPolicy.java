package com.archforge.core.generator;

import com.archforge.core.config.ProjectConfig.GenerationConfig;

/**
 * Bounded exponential backoff for text-generation calls.
 *
 * @param maxAttempts total attempts, at least one
 * @param initialDelayMillis delay before the second attempt
 * @param multiplier growth factor between delays
 * @param maxDelayMillis upper bound for any delay
 */
public record RetryPolicy(
    int maxAttempts,
    long initialDelayMillis,
    double multiplier,
    long maxDelayMillis
) {
    /**
     * Compact constructor with validation.
     */
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (initialDelayMillis < 0 || maxDelayMillis < 0) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        if (multiplier < 1.0) {
            multiplier = 1.0;
        }
    }

    public static RetryPolicy from(GenerationConfig config) {
        return new RetryPolicy(config.maxAttempts(), config.initialBackoffMillis(),
            config.backoffMultiplier(), config.maxBackoffMillis());
    }

    public static RetryPolicy noDelay(int maxAttempts) {
        return new RetryPolicy(maxAttempts, 0, 1.0, 0);
    }

    /**
     * Returns the delay to wait after a failed attempt.
     *
     * @param failedAttempt 1-based number of the attempt that just failed
     * @return delay in milliseconds, capped at {@link #maxDelayMillis()}
     */
    public long delayAfter(int failedAttempt) {
        double delay = initialDelayMillis * Math.pow(multiplier, Math.max(0, failedAttempt - 1));
        return (long) Math.min(delay, maxDelayMillis);
    }

    /**
     * Pause between attempts. Replaced in tests.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
