package com.eyelevel.pdfcompressor.config;

import com.eyelevel.pdfcompressor.web.gate.ApiKeyGate;
import com.eyelevel.pdfcompressor.web.gate.RateLimitGate;
import com.eyelevel.pdfcompressor.web.gate.RequestGateChain;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

/**
 * Installs the request gates in front of the API handlers. Submission is rate limited before the
 * credential is checked; the read endpoints only require the credential.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    private final RateLimitGate rateLimitGate;
    private final ApiKeyGate apiKeyGate;

    @Override
    public void addInterceptors(@NonNull final InterceptorRegistry registry) {
        registry.addInterceptor(new RequestGateChain(List.of(rateLimitGate, apiKeyGate)))
                .addPathPatterns("/api/compress");
        registry.addInterceptor(new RequestGateChain(List.of(apiKeyGate)))
                .addPathPatterns("/api/jobs", "/api/jobs/**", "/api/version");
        log.info("Request gates registered for /api/compress, /api/jobs and /api/version.");
    }
}
