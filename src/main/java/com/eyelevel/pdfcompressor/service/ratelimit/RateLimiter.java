package com.eyelevel.pdfcompressor.service.ratelimit;

/**
 * Per-key admission control. Implementations are chosen once at startup.
 */
public interface RateLimiter {

    /**
     * Consumes one permit for the key.
     *
     * @return {@code true} if the call fits in the key's quota.
     */
    boolean allow(String key);

    /**
     * Forgets all per-key counters.
     */
    void reset();
}
