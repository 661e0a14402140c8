package com.eyelevel.pdfcompressor.controller;

import com.eyelevel.pdfcompressor.config.PdfCompressorConfig;
import com.eyelevel.pdfcompressor.dto.system.HealthResponse;
import com.eyelevel.pdfcompressor.dto.system.VersionResponse;
import com.eyelevel.pdfcompressor.service.compression.GhostscriptLocator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.info.BuildProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * Liveness and build information. Neither endpoint touches the database.
 */
@Tag(name = "System", description = "Health and version information.")
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final PdfCompressorConfig config;
    private final GhostscriptLocator ghostscriptLocator;
    private final Optional<BuildProperties> buildProperties;

    @Operation(summary = "Liveness probe", description = "Always answers 200 and reports the Ghostscript executable, or null when none is found.")
    @GetMapping("/healthz")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(HealthResponse.builder()
                                               .status("ok")
                                               .ghostscript(ghostscriptLocator.resolve().orElse(null))
                                               .version(version())
                                               .build());
    }

    @Operation(summary = "Build information")
    @GetMapping("/api/version")
    public ResponseEntity<VersionResponse> buildInfo() {
        final PdfCompressorConfig.Build build = config.getBuild();
        final String buildTime = StringUtils.hasText(build.getTime())
                ? build.getTime()
                : buildProperties.map(properties -> properties.getTime() == null ? null : properties.getTime().toString())
                                 .orElse(null);
        return ResponseEntity.ok(VersionResponse.builder()
                                                .version(version())
                                                .commit(StringUtils.hasText(build.getCommit()) ? build.getCommit() : null)
                                                .buildTime(buildTime)
                                                .build());
    }

    private String version() {
        final String configured = config.getBuild().getVersion();
        if (StringUtils.hasText(configured)) {
            return configured;
        }
        return buildProperties.map(BuildProperties::getVersion).orElse("unknown");
    }
}
