package com.solis.retry;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.Callable;

/**
 * Runs a fallible call with bounded exponential backoff.
 * <p>
 * The final failure is rethrown as-is; callers own the fallback. No state is kept between calls.
 */
public final class RetryExecutor {
    private static final Logger LOG = LogManager.getLogger(RetryExecutor.class);

    private final RetryOptions defaults;
    private final Sleeper sleeper;

    public RetryExecutor() {
        this(RetryOptions.defaults(), Sleeper.SYSTEM);
    }

    public RetryExecutor(RetryOptions defaults, Sleeper sleeper) {
        this.defaults = defaults == null ? RetryOptions.defaults() : defaults;
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
    }

    public RetryOptions defaults() {
        return defaults;
    }

    public <T> T withRetry(Callable<T> operation, String label) throws Exception {
        return withRetry(operation, label, defaults);
    }

    public <T> T withRetry(Callable<T> operation, String label, RetryOptions options) throws Exception {
        RetryOptions opts = options == null ? defaults : options;
        String name = label == null || label.isBlank() ? "operation" : label.trim();
        for (int attempt = 1; ; attempt++) {
            try {
                return operation.call();
            } catch (Exception e) {
                if (attempt >= opts.attempts) {
                    LOG.error("[RETRY] label={} attempt={} exhausted error={}", name, attempt, e.getMessage());
                    throw e;
                }
                long waitMs = opts.delayAfter(attempt);
                LOG.warn("[RETRY] label={} attempt={} next_in_ms={} error={}", name, attempt, waitMs, e.getMessage());
                try {
                    sleeper.sleep(waitMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw ie;
                }
            }
        }
    }
}
