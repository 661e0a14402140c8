package com.eyelevel.pdfcompressor.service.dispatch;

import com.eyelevel.pdfcompressor.exception.ExternalToolException;
import com.eyelevel.pdfcompressor.exception.IllegalJobTransitionException;
import com.eyelevel.pdfcompressor.exception.ToolNotFoundException;
import com.eyelevel.pdfcompressor.model.CompressionJob;
import com.eyelevel.pdfcompressor.model.JobStatus;
import com.eyelevel.pdfcompressor.service.compression.CompressionResult;
import com.eyelevel.pdfcompressor.service.compression.PdfCompressor;
import com.eyelevel.pdfcompressor.service.job.JobStore;
import com.eyelevel.pdfcompressor.service.job.TransitionDetails;
import com.eyelevel.pdfcompressor.service.workspace.JobWorkspace;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Drives a single job from QUEUED through RUNNING to a terminal state.
 * <p>
 * The same code path serves every dispatch mode: inline requests call {@link #execute} directly, while the
 * in-process pool and the queue listener call {@link #executeDetached}, which also owns the workspace cleanup.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobDispatcher {

    static final String TOOL_MISSING_MESSAGE = "Ghostscript is not installed on the server.";

    private final JobStore jobStore;
    private final PdfCompressor pdfCompressor;

    /**
     * Claims and runs the job. A failure is recorded on the job before the exception is rethrown.
     *
     * @return the completed job, or empty when another worker holds the claim
     * @throws ToolNotFoundException         if Ghostscript cannot be launched
     * @throws ExternalToolException         if Ghostscript fails
     * @throws IllegalJobTransitionException if the job was moved to a terminal state behind this worker's back
     */
    public Optional<CompressionJob> execute(final UUID jobId, final JobWorkspace workspace) {
        if (!tryClaim(jobId)) {
            return Optional.empty();
        }

        final CompressionJob job = jobStore.get(jobId);
        final CompressionResult result;
        try {
            result = pdfCompressor.compress(workspace.getInputPath(), workspace.getOutputPath(),
                                            job.getCompressionLevel(), job.isPreserveImages(), jobId.toString());
        } catch (ToolNotFoundException e) {
            markFailed(jobId, TOOL_MISSING_MESSAGE);
            throw e;
        } catch (ExternalToolException e) {
            markFailed(jobId, describe(e));
            throw e;
        } catch (RuntimeException e) {
            log.error("[{}] Unexpected error while compressing.", jobId, e);
            markFailed(jobId, "Unexpected error during compression: " + e.getMessage());
            throw e;
        }

        try {
            return Optional.of(jobStore.transition(jobId, JobStatus.COMPLETED,
                                                   TransitionDetails.completed(result.bytesOut())));
        } catch (IllegalJobTransitionException e) {
            log.error("[{}] Compression finished but the job could not be completed: {}", jobId, e.getMessage());
            throw e;
        }
    }

    /**
     * Runs the job on a worker thread and releases the workspace afterwards. Never throws: the outcome is
     * recorded on the job itself.
     */
    public void executeDetached(final UUID jobId, final JobWorkspace workspace) {
        boolean release = true;
        try {
            final Optional<CompressionJob> completed = execute(jobId, workspace);
            if (completed.isEmpty()) {
                // a live claimer still needs the files
                release = jobStore.get(jobId).getStatus().isTerminal();
            }
        } catch (RuntimeException e) {
            log.error("[{}] Background compression ended in failure: {}", jobId, e.getMessage());
        } finally {
            if (release) {
                workspace.close();
            }
        }
    }

    /**
     * Moves a job that never started straight to FAILED.
     */
    public void failQueued(final UUID jobId, final String errorMessage) {
        markFailed(jobId, errorMessage);
    }

    private boolean tryClaim(final UUID jobId) {
        try {
            return jobStore.claim(jobId);
        } catch (ConcurrencyFailureException e) {
            log.info("[{}] Claim attempt collided with another worker: {}", jobId, e.getMessage());
            return false;
        }
    }

    private void markFailed(final UUID jobId, final String errorMessage) {
        try {
            jobStore.transition(jobId, JobStatus.FAILED, TransitionDetails.failed(errorMessage));
        } catch (IllegalJobTransitionException e) {
            log.error("[{}] Could not record failure: {}", jobId, e.getMessage());
        }
    }

    private static String describe(final ExternalToolException e) {
        final String diagnostic = e.getDiagnostic();
        if (diagnostic == null || diagnostic.isBlank()) {
            return e.getMessage();
        }
        return e.getMessage() + "\n" + diagnostic;
    }
}
