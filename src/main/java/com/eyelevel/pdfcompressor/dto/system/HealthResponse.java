package com.eyelevel.pdfcompressor.dto.system;

import lombok.Builder;
import lombok.Getter;

/**
 * Liveness payload. {@code ghostscript} is the resolved executable path, or {@code null} when none was found.
 */
@Getter
@Builder
public class HealthResponse {
    private final String status;
    private final String ghostscript;
    private final String version;
}
