package com.eyelevel.pdfcompressor.config;

import com.eyelevel.pdfcompressor.service.ratelimit.DisabledRateLimiter;
import com.eyelevel.pdfcompressor.service.ratelimit.EnforcingRateLimiter;
import com.eyelevel.pdfcompressor.service.ratelimit.RateLimitQuota;
import com.eyelevel.pdfcompressor.service.ratelimit.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chooses the rate limiter variant once, at startup. Quota strings are parsed here so that a malformed
 * value stops the application instead of surfacing on the first request.
 */
@Slf4j
@Configuration
public class RateLimitConfig {

    @Bean
    public RateLimiter compressRateLimiter(final PdfCompressorConfig config) {
        final PdfCompressorConfig.RateLimit settings = config.getRateLimit();
        if (!settings.isEnabled()) {
            log.info("Rate limiting is disabled.");
            return new DisabledRateLimiter();
        }
        final RateLimitQuota quota = RateLimitQuota.parse(settings.getCompress());
        log.info("Rate limiting enabled for compress scope: {}", quota);
        return new EnforcingRateLimiter(quota);
    }
}
