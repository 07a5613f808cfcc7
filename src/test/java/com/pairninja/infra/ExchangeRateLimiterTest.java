package com.pairninja.infra;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ExchangeRateLimiterTest {

    @Test
    public void testAcquireConsumesPermits() {
        ExchangeRateLimiter limiter = new ExchangeRateLimiter("test", 5);
        limiter.acquire();
        limiter.acquire();
        assertTrue(limiter.availablePermits() <= 3);
    }

    @Test
    public void testRejectsNonPositiveRate() {
        assertThrows(IllegalArgumentException.class, () -> new ExchangeRateLimiter("test", 0));
    }
}
