package com.eyelevel.pdfcompressor.exception;

import com.eyelevel.pdfcompressor.model.JobStatus;
import lombok.Getter;

import java.io.Serial;
import java.util.UUID;

/**
 * Thrown when a status change would violate the job lifecycle, or a terminal transition is missing its details.
 */
@Getter
public class IllegalJobTransitionException extends CompressionException {
    @Serial
    private static final long serialVersionUID = -8512350930712876041L;

    private final UUID jobId;
    private final JobStatus from;
    private final JobStatus to;

    public IllegalJobTransitionException(UUID jobId, JobStatus from, JobStatus to) {
        this(jobId, from, to, String.format("Job %s cannot move from %s to %s", jobId, from, to));
    }

    public IllegalJobTransitionException(UUID jobId, JobStatus from, JobStatus to, String message) {
        super(message);
        this.jobId = jobId;
        this.from = from;
        this.to = to;
    }
}
