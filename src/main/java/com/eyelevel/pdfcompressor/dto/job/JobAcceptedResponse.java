package com.eyelevel.pdfcompressor.dto.job;

import lombok.Builder;
import lombok.Getter;

/**
 * 202 body returned when a job was handed to a background worker.
 */
@Getter
@Builder
public class JobAcceptedResponse {
    @Builder.Default
    private final boolean ok = true;
    private final JobResponse job;
}
