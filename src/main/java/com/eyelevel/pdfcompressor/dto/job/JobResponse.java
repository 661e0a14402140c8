package com.eyelevel.pdfcompressor.dto.job;

import com.eyelevel.pdfcompressor.model.CompressionJob;
import com.eyelevel.pdfcompressor.model.CompressionProfile;
import com.eyelevel.pdfcompressor.model.JobStatus;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

/**
 * Public view of a {@link CompressionJob}.
 * Only the first line of a stored error message is exposed; the full tool diagnostic stays in the record.
 */
@Getter
@Builder
public class JobResponse {
    private final UUID id;
    private final UUID userId;
    private final JobStatus status;
    private final String originalFilename;
    private final long originalSizeBytes;
    private final Long compressedSizeBytes;
    private final CompressionProfile compressionLevel;
    private final boolean preserveImages;
    private final String errorMessage;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant completedAt;

    public static JobResponse from(final CompressionJob job) {
        return JobResponse.builder()
                          .id(job.getId())
                          .userId(job.getPrincipalId())
                          .status(job.getStatus())
                          .originalFilename(job.getOriginalFilename())
                          .originalSizeBytes(job.getOriginalSizeBytes())
                          .compressedSizeBytes(job.getCompressedSizeBytes())
                          .compressionLevel(job.getCompressionLevel())
                          .preserveImages(job.isPreserveImages())
                          .errorMessage(firstLine(job.getErrorMessage()))
                          .createdAt(job.getCreatedAt())
                          .updatedAt(job.getUpdatedAt())
                          .completedAt(job.getCompletedAt())
                          .build();
    }

    private static String firstLine(final String message) {
        if (message == null) {
            return null;
        }
        final int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }
}
