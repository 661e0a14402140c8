package com.eyelevel.pdfcompressor.service.ratelimit;

public class DisabledRateLimiter implements RateLimiter {

    @Override
    public boolean allow(final String key) {
        return true;
    }

    @Override
    public void reset() {
        // nothing to forget
    }
}
