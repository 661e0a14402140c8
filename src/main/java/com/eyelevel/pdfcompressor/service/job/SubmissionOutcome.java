package com.eyelevel.pdfcompressor.service.job;

import com.eyelevel.pdfcompressor.model.CompressionJob;

/**
 * What the HTTP layer needs after a submission.
 *
 * @param job    the job record, terminal for inline runs and QUEUED for background runs
 * @param output the compressed bytes for inline runs, {@code null} otherwise
 */
public record SubmissionOutcome(CompressionJob job, byte[] output) {

    public boolean isAccepted() {
        return output == null;
    }
}
