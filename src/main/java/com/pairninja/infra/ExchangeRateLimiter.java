package com.pairninja.infra;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Paces exchange calls with a resilience4j RateLimiter.
 *
 * Callers block until a permit is available; no call is ever dropped. One
 * instance is shared by every adapter talking to the same venue.
 */
public class ExchangeRateLimiter {
    private static final Logger logger = LoggerFactory.getLogger(ExchangeRateLimiter.class);

    private final RateLimiter rateLimiter;

    public ExchangeRateLimiter(String name, int permitsPerSecond) {
        if (permitsPerSecond <= 0) {
            throw new IllegalArgumentException("Permits per second must be > 0, got " + permitsPerSecond);
        }
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(permitsPerSecond)
                .timeoutDuration(Duration.ofSeconds(1))
                .build();
        this.rateLimiter = RateLimiter.of(name, config);
        logger.info("✅ Rate limiter '{}' initialized: {} req/sec", name, permitsPerSecond);
    }

    /**
     * Wait for a permit. Retries the acquisition until granted.
     */
    public void acquire() {
        while (!rateLimiter.acquirePermission()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new IllegalStateException("Interrupted while waiting for rate limiter " + rateLimiter.getName());
            }
            logger.debug("⏸️ Rate limiter '{}' saturated, waiting", rateLimiter.getName());
        }
    }

    public int availablePermits() {
        return rateLimiter.getMetrics().getAvailablePermissions();
    }
}
