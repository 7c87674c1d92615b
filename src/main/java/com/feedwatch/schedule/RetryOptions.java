package com.feedwatch.schedule;

import com.feedwatch.exception.InvalidParameterException;
import java.util.Map;

/**
 * Retry policy of one {@link RetryExecutor#run} invocation.
 *
 * <p>Delays grow geometrically without jitter: the n-th retry waits
 * {@code initialDelayMs * backoffMultiplier^(n-1)} milliseconds.
 *
 * @param maxRetries        retries after the first attempt (total attempts = maxRetries + 1)
 * @param initialDelayMs    wait before the first retry, at least 1 ms
 * @param backoffMultiplier growth factor between successive waits, at least 1.0
 */
public record RetryOptions(int maxRetries, long initialDelayMs, double backoffMultiplier) {

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_INITIAL_DELAY_MS = 5000;
    public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;

    public RetryOptions {
        if (maxRetries < 0) {
            throw new InvalidParameterException("maxRetries must not be negative", Map.of("maxRetries", maxRetries));
        }
        if (initialDelayMs < 1) {
            throw new InvalidParameterException(
                    "initialDelayMs must be at least 1", Map.of("initialDelayMs", initialDelayMs));
        }
        if (Double.isNaN(backoffMultiplier) || backoffMultiplier < 1.0) {
            throw new InvalidParameterException(
                    "backoffMultiplier must be at least 1.0", Map.of("backoffMultiplier", backoffMultiplier));
        }
    }

    public static RetryOptions defaults() {
        return new RetryOptions(DEFAULT_MAX_RETRIES, DEFAULT_INITIAL_DELAY_MS, DEFAULT_BACKOFF_MULTIPLIER);
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }
}
