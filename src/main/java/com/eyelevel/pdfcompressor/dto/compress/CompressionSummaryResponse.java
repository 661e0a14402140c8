package com.eyelevel.pdfcompressor.dto.compress;

import com.eyelevel.pdfcompressor.model.CompressionProfile;
import lombok.Builder;
import lombok.Getter;

import java.util.UUID;

/**
 * JSON body returned by an inline compression when the caller prefers JSON over the binary PDF.
 */
@Getter
@Builder
public class CompressionSummaryResponse {
    @Builder.Default
    private final boolean ok = true;
    private final long originalBytes;
    private final long compressedBytes;
    private final double ratio;
    private final CompressionProfile profile;
    private final String requestId;
    private final UUID jobId;
}
