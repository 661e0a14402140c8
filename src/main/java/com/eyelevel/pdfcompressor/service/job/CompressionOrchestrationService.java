package com.eyelevel.pdfcompressor.service.job;

import com.eyelevel.pdfcompressor.config.DispatchMode;
import com.eyelevel.pdfcompressor.config.PdfCompressorConfig;
import com.eyelevel.pdfcompressor.exception.JobDispatchException;
import com.eyelevel.pdfcompressor.exception.StorageException;
import com.eyelevel.pdfcompressor.model.CompressionJob;
import com.eyelevel.pdfcompressor.model.CompressionProfile;
import com.eyelevel.pdfcompressor.model.Principal;
import com.eyelevel.pdfcompressor.service.dispatch.JobDispatcher;
import com.eyelevel.pdfcompressor.service.dispatch.JobQueuePublisher;
import com.eyelevel.pdfcompressor.service.identity.CallerCredential;
import com.eyelevel.pdfcompressor.service.identity.IdentityResolver;
import com.eyelevel.pdfcompressor.service.workspace.JobWorkspace;
import com.eyelevel.pdfcompressor.service.workspace.JobWorkspaceFactory;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.util.UUID;

/**
 * Entry point for a validated submission: resolves the caller, records the job, stores the upload and hands the
 * job to the configured dispatch mode.
 * <p>
 * Job creation commits in its own transaction before anything is dispatched, so a worker can always see the job
 * it is asked to run.
 */
@Slf4j
@Service
public class CompressionOrchestrationService {

    private static final String DEFAULT_FILENAME = "document.pdf";

    private final PdfCompressorConfig config;
    private final IdentityResolver identityResolver;
    private final JobStore jobStore;
    private final JobWorkspaceFactory workspaceFactory;
    private final JobDispatcher dispatcher;
    private final AsyncTaskExecutor compressionTaskExecutor;
    private final ObjectProvider<JobQueuePublisher> queuePublisher;

    public CompressionOrchestrationService(final PdfCompressorConfig config, final IdentityResolver identityResolver,
                                           final JobStore jobStore, final JobWorkspaceFactory workspaceFactory,
                                           final JobDispatcher dispatcher,
                                           @Qualifier("compressionTaskExecutor") final AsyncTaskExecutor compressionTaskExecutor,
                                           final ObjectProvider<JobQueuePublisher> queuePublisher) {
        this.config = config;
        this.identityResolver = identityResolver;
        this.jobStore = jobStore;
        this.workspaceFactory = workspaceFactory;
        this.dispatcher = dispatcher;
        this.compressionTaskExecutor = compressionTaskExecutor;
        this.queuePublisher = queuePublisher;
    }

    public SubmissionOutcome submit(final CallerCredential caller, final MultipartFile file,
                                    final CompressionProfile profile, final boolean preserveImages) {
        final Principal principal = identityResolver.resolve(caller);
        final CompressionJob job = jobStore.create(principal, originalFilename(file), file.getSize(), profile,
                                                   preserveImages);
        final UUID jobId = job.getId();
        final JobWorkspace workspace = workspaceFactory.allocate(jobId.toString());

        try {
            workspace.storeUpload(file);
        } catch (StorageException e) {
            workspace.close();
            dispatcher.failQueued(jobId, e.getMessage());
            throw e;
        }

        final DispatchMode mode = config.getDispatch().getMode();
        log.info("[{}] Dispatching job in {} mode.", jobId, mode);
        return switch (mode) {
            case INLINE -> runInline(jobId, workspace);
            case ASYNC -> runOnExecutor(job, workspace);
            case SQS -> publishToQueue(job, workspace);
        };
    }

    private SubmissionOutcome runInline(final UUID jobId, final JobWorkspace workspace) {
        try (JobWorkspace owned = workspace) {
            final CompressionJob finished = dispatcher.execute(jobId, owned)
                                                      .orElseThrow(() -> new IllegalStateException(
                                                              "Freshly created job " + jobId + " was claimed elsewhere"));
            return new SubmissionOutcome(finished, owned.readOutput());
        }
    }

    private SubmissionOutcome runOnExecutor(final CompressionJob job, final JobWorkspace workspace) {
        try {
            compressionTaskExecutor.execute(() -> dispatcher.executeDetached(job.getId(), workspace));
        } catch (TaskRejectedException e) {
            log.error("[{}] Compression pool rejected the job.", job.getId(), e);
            workspace.close();
            dispatcher.failQueued(job.getId(), "The compression worker pool is saturated.");
            throw new JobDispatchException("Job " + job.getId() + " could not be scheduled.", e);
        }
        return new SubmissionOutcome(job, null);
    }

    private SubmissionOutcome publishToQueue(final CompressionJob job, final JobWorkspace workspace) {
        final JobQueuePublisher publisher = queuePublisher.getIfAvailable();
        try {
            if (publisher == null) {
                throw new JobDispatchException("No queue publisher is configured for SQS dispatch.", null);
            }
            publisher.publish(job.getId(), workspace.getInputPath(), workspace.getOutputPath());
        } catch (JobDispatchException e) {
            workspace.close();
            dispatcher.failQueued(job.getId(), "The job could not be queued for processing.");
            throw e;
        }
        return new SubmissionOutcome(job, null);
    }

    private static String originalFilename(final MultipartFile file) {
        final String name = FilenameUtils.getName(file.getOriginalFilename());
        return StringUtils.hasText(name) ? fitToColumn(name) : DEFAULT_FILENAME;
    }

    /**
     * Shortens a name to the stored column length, cutting the base name and keeping the extension.
     */
    static String fitToColumn(final String name) {
        final int max = CompressionJob.ORIGINAL_FILENAME_LENGTH;
        if (name.length() <= max) {
            return name;
        }
        final String extension = FilenameUtils.getExtension(name);
        final String suffix = extension.isEmpty() || extension.length() >= max / 2 ? "" : "." + extension;
        int cut = max - suffix.length();
        if (Character.isHighSurrogate(name.charAt(cut - 1))) {
            cut--;
        }
        return name.substring(0, cut) + suffix;
    }
}
