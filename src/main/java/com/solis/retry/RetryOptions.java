package com.solis.retry;

import com.solis.config.Config;

public final class RetryOptions {
    public static final int DEFAULT_ATTEMPTS = 3;
    public static final long DEFAULT_BASE_DELAY_MS = 1_000L;
    public static final long DEFAULT_MAX_DELAY_MS = 10_000L;

    public final int attempts;
    public final long baseDelayMs;
    public final long maxDelayMs;

    public RetryOptions(int attempts, long baseDelayMs, long maxDelayMs) {
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be >= 1, got " + attempts);
        }
        if (baseDelayMs < 0L || maxDelayMs < 0L) {
            throw new IllegalArgumentException("retry delays must not be negative");
        }
        this.attempts = attempts;
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    public static RetryOptions defaults() {
        return new RetryOptions(DEFAULT_ATTEMPTS, DEFAULT_BASE_DELAY_MS, DEFAULT_MAX_DELAY_MS);
    }

    public static RetryOptions fromConfig(Config config) {
        return new RetryOptions(
                Math.max(1, config.getInt("retry.attempts", DEFAULT_ATTEMPTS)),
                Math.max(0L, config.getLong("retry.base_delay_ms", DEFAULT_BASE_DELAY_MS)),
                Math.max(0L, config.getLong("retry.max_delay_ms", DEFAULT_MAX_DELAY_MS))
        );
    }

    public RetryOptions withAttempts(int attempts) {
        return new RetryOptions(attempts, baseDelayMs, maxDelayMs);
    }

    /**
     * Wait before the attempt that follows {@code failedAttempt} (1-based).
     */
    public long delayAfter(int failedAttempt) {
        int exponent = Math.max(0, failedAttempt - 1);
        if (exponent >= 62 || baseDelayMs > (Long.MAX_VALUE >> exponent)) {
            return maxDelayMs;
        }
        return Math.min(baseDelayMs << exponent, maxDelayMs);
    }

    @Override
    public String toString() {
        return "attempts=" + attempts + ", base_delay_ms=" + baseDelayMs + ", max_delay_ms=" + maxDelayMs;
    }
}
