package com.globalnewsbrief.service.retry;

import java.time.Duration;

/**
 * Backoff parameters. {@code maxRetries} counts every attempt including the first.
 */
public record RetrySettings(int maxRetries, double baseDelaySeconds, double maxDelaySeconds) {
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final double DEFAULT_BASE_DELAY_SECONDS = 1.0;
    public static final double DEFAULT_MAX_DELAY_SECONDS = 60.0;

    public RetrySettings {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1 (was " + maxRetries + ")");
        }
        if (!(baseDelaySeconds >= 0) || !(maxDelaySeconds >= 0)) {
            throw new IllegalArgumentException("retry delays must not be negative");
        }
    }

    public static RetrySettings defaults() {
        return new RetrySettings(DEFAULT_MAX_RETRIES, DEFAULT_BASE_DELAY_SECONDS, DEFAULT_MAX_DELAY_SECONDS);
    }

    /**
     * Wait before attempt {@code attempt} (2 for the first retry): {@code min(base * 2^(attempt-2), max)}.
     */
    public Duration delayBefore(int attempt) {
        if (attempt < 2) {
            return Duration.ZERO;
        }
        double seconds = Math.min(baseDelaySeconds * Math.pow(2, attempt - 2), maxDelaySeconds);
        return Duration.ofMillis(Math.round(seconds * 1000));
    }
}
