package com.eyelevel.pdfcompressor.web.gate;

import com.eyelevel.pdfcompressor.config.PdfCompressorConfig;
import com.eyelevel.pdfcompressor.exception.apiclient.TooManyRequestsException;
import com.eyelevel.pdfcompressor.service.ratelimit.RateLimiter;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Applies the {@code compress} quota keyed by the caller's remote address.
 */
@Component
@RequiredArgsConstructor
public class RateLimitGate implements RequestGate {

    static final String SCOPE = "compress";

    private final RateLimiter compressRateLimiter;
    private final PdfCompressorConfig config;

    @Override
    public GateDecision check(final HttpServletRequest request) {
        final String key = config.getRateLimit().getKeyPrefix() + ":" + SCOPE + ":" + request.getRemoteAddr();
        if (compressRateLimiter.allow(key)) {
            return GateDecision.allow();
        }
        return GateDecision.deny(new TooManyRequestsException("rate_limited", "Too many requests, please try again later."));
    }
}
