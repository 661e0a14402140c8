package com.eyelevel.pdfcompressor.service.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Fixed-window limiter backed by one Resilience4j rate limiter per key.
 * Permit acquisition never waits, so a caller over quota is rejected immediately.
 * <p>
 * A key's limiter is dropped once it has been idle for two full periods. By then its window has refreshed,
 * so a fresh limiter admits exactly what the old one would have.
 */
@Slf4j
public class EnforcingRateLimiter implements RateLimiter {

    private final RateLimitQuota quota;
    private final RateLimiterConfig limiterConfig;
    private final Cache<String, io.github.resilience4j.ratelimiter.RateLimiter> limiters;

    public EnforcingRateLimiter(final RateLimitQuota quota) {
        this(quota, Ticker.systemTicker(), ForkJoinPool.commonPool());
    }

    EnforcingRateLimiter(final RateLimitQuota quota, final Ticker ticker, final Executor maintenanceExecutor) {
        this.quota = quota;
        this.limiterConfig = RateLimiterConfig.custom()
                                              .limitForPeriod(quota.permits())
                                              .limitRefreshPeriod(quota.period())
                                              .timeoutDuration(Duration.ZERO)
                                              .build();
        this.limiters = Caffeine.newBuilder()
                                .expireAfterAccess(quota.period().multipliedBy(2))
                                .ticker(ticker)
                                .executor(maintenanceExecutor)
                                .build();
    }

    @Override
    public boolean allow(final String key) {
        final boolean permitted = limiters.get(key, k -> io.github.resilience4j.ratelimiter.RateLimiter.of(k, limiterConfig))
                                          .acquirePermission();
        if (!permitted) {
            log.warn("Rate limit of {} exceeded for key '{}'.", quota, key);
        }
        return permitted;
    }

    @Override
    public void reset() {
        final long cleared = limiters.estimatedSize();
        limiters.invalidateAll();
        log.debug("Cleared {} rate limiter counters.", cleared);
    }

    /**
     * Number of keys currently holding a limiter, after pending expirations have been applied.
     */
    long trackedKeys() {
        limiters.cleanUp();
        return limiters.estimatedSize();
    }
}
