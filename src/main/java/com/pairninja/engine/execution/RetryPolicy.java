package com.pairninja.engine.execution;

import com.pairninja.config.StrategyConfig;

/**
 * Bounded retry shape for order calls: up to maxAttempts calls in total, waiting
 * baseDelayMs, 2 x baseDelayMs, 4 x baseDelayMs, ... between them.
 */
public final class RetryPolicy {

    private final int maxAttempts;
    private final long baseDelayMs;

    public RetryPolicy(int maxAttempts, long baseDelayMs) {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0, got " + maxAttempts);
        }
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs must be >= 0, got " + baseDelayMs);
        }
        this.maxAttempts = maxAttempts;
        this.baseDelayMs = baseDelayMs;
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(2, 1);
    }

    public static RetryPolicy from(StrategyConfig.ExecutionParams params) {
        return new RetryPolicy(params.retryMaxAttempts, params.retryBaseDelayMs);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    /**
     * Worst-case total wait between attempts of one call.
     */
    public long worstCaseDelayMs() {
        long total = 0;
        long delay = Math.max(1, baseDelayMs);
        for (int i = 1; i < maxAttempts; i++) {
            total += delay;
            delay *= 2;
        }
        return total;
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxAttempts=" + maxAttempts + ", baseDelayMs=" + baseDelayMs + "}";
    }
}
