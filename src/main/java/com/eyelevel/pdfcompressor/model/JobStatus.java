package com.eyelevel.pdfcompressor.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle states of a {@link CompressionJob}.
 * <p>
 * Legal edges are {@code QUEUED -> RUNNING}, {@code QUEUED -> FAILED}, {@code RUNNING -> COMPLETED}
 * and {@code RUNNING -> FAILED}. Terminal states never change again.
 */
public enum JobStatus {
    /**
     * The job has been accepted and is waiting for a worker to claim it.
     */
    QUEUED,
    /**
     * Exactly one worker has claimed the job and is running Ghostscript.
     */
    RUNNING,
    /**
     * Ghostscript succeeded and the compressed size has been recorded.
     */
    COMPLETED,
    /**
     * The job failed before or during execution. The error detail is recorded on the job.
     */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(final JobStatus target) {
        return switch (this) {
            case QUEUED -> target == RUNNING || target == FAILED;
            case RUNNING -> target == COMPLETED || target == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
