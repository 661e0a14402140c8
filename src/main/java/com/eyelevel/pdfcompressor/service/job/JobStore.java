package com.eyelevel.pdfcompressor.service.job;

import com.eyelevel.pdfcompressor.exception.IllegalJobTransitionException;
import com.eyelevel.pdfcompressor.exception.apiclient.JobNotFoundException;
import com.eyelevel.pdfcompressor.model.CompressionJob;
import com.eyelevel.pdfcompressor.model.CompressionProfile;
import com.eyelevel.pdfcompressor.model.JobStatus;
import com.eyelevel.pdfcompressor.model.Principal;
import com.eyelevel.pdfcompressor.repository.CompressionJobRepository;
import com.eyelevel.pdfcompressor.repository.PrincipalRepository;
import com.eyelevel.pdfcompressor.repository.support.OffsetPageRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * The only component that mutates {@link CompressionJob} rows.
 * <p>
 * Every public method is its own transaction: it commits on normal return and rolls back on any runtime
 * exception. Callers never share a persistence context across calls.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobStore {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;
    static final int MAX_ERROR_LENGTH = 4000;

    private final CompressionJobRepository jobRepository;
    private final PrincipalRepository principalRepository;

    @Transactional
    public CompressionJob create(final Principal principal, final String originalFilename, final long originalSizeBytes,
                                 final CompressionProfile profile, final boolean preserveImages) {
        final CompressionJob job = new CompressionJob();
        job.setPrincipal(principalRepository.getReferenceById(principal.getId()));
        job.setPrincipalId(principal.getId());
        job.setOriginalFilename(originalFilename);
        job.setOriginalSizeBytes(originalSizeBytes);
        job.setCompressionLevel(profile);
        job.setPreserveImages(preserveImages);
        job.setStatus(JobStatus.QUEUED);
        final CompressionJob saved = jobRepository.save(job);
        log.info("[{}] Job created for principal {} ({} bytes, profile {}).", saved.getId(), principal.getId(),
                 originalSizeBytes, profile.getValue());
        return saved;
    }

    /**
     * Atomically moves the job from QUEUED to RUNNING.
     *
     * @return {@code true} only for the single caller whose update matched the row
     */
    @Transactional
    public boolean claim(final UUID jobId) {
        final boolean claimed = jobRepository.updateStatusIfExpected(jobId, JobStatus.RUNNING, JobStatus.QUEUED,
                                                                     Instant.now()) == 1;
        if (claimed) {
            log.info("[{}] Job claimed, status is now RUNNING.", jobId);
        } else {
            log.info("[{}] Claim lost. The job is no longer QUEUED.", jobId);
        }
        return claimed;
    }

    /**
     * Applies a lifecycle transition under a pessimistic row lock.
     *
     * @throws JobNotFoundException          if the job does not exist
     * @throws IllegalJobTransitionException if the edge is not allowed, or a completion is missing its size
     */
    @Transactional
    public CompressionJob transition(final UUID jobId, final JobStatus newStatus, final TransitionDetails details) {
        final CompressionJob job = jobRepository.findByIdForUpdate(jobId)
                                                .orElseThrow(() -> new JobNotFoundException(jobId.toString()));
        final JobStatus current = job.getStatus();
        if (!current.canTransitionTo(newStatus)) {
            throw new IllegalJobTransitionException(jobId, current, newStatus);
        }

        final TransitionDetails effective = details == null ? TransitionDetails.none() : details;
        if (newStatus == JobStatus.COMPLETED) {
            final Long size = effective.compressedSizeBytes();
            if (size == null || size < 0) {
                throw new IllegalJobTransitionException(jobId, current, newStatus,
                                                        "Job " + jobId + " cannot complete without a compressed size");
            }
            job.setCompressedSizeBytes(size);
        }
        if (newStatus == JobStatus.FAILED) {
            job.setErrorMessage(truncate(effective.errorMessage() == null ? "Compression failed."
                                                                          : effective.errorMessage()));
        }
        if (newStatus.isTerminal()) {
            job.setCompletedAt(Instant.now());
        }
        job.setStatus(newStatus);
        final CompressionJob saved = jobRepository.saveAndFlush(job);
        log.info("[{}] Job moved from {} to {}.", jobId, current, newStatus);
        return saved;
    }

    @Transactional(readOnly = true)
    public CompressionJob get(final UUID jobId) {
        return jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId.toString()));
    }

    /**
     * Lists jobs newest first.
     *
     * @param principalId owner to scope to, or {@code null} for all jobs
     * @param limit       page size, defaulting to {@value #DEFAULT_LIMIT} and clamped to {@code 1..}{@value #MAX_LIMIT}
     * @param offset      rows to skip, defaulting to zero
     */
    @Transactional(readOnly = true)
    public JobPage list(final UUID principalId, final Integer limit, final Long offset) {
        final int effectiveLimit = clampLimit(limit);
        final long effectiveOffset = offset == null ? 0 : offset;
        if (effectiveOffset < 0) {
            throw new IllegalArgumentException("Offset must not be negative");
        }
        if (effectiveOffset > Integer.MAX_VALUE) {
            // JPA row offsets are ints; no page can start that far in.
            final long total = principalId == null
                    ? jobRepository.count()
                    : jobRepository.countByPrincipalId(principalId);
            return new JobPage(List.of(), total, effectiveLimit, effectiveOffset);
        }
        final OffsetPageRequest pageable = new OffsetPageRequest(effectiveOffset, effectiveLimit,
                                                                 Sort.by(Sort.Direction.DESC, "createdAt")
                                                                     .and(Sort.by(Sort.Direction.DESC, "id")));
        final Page<CompressionJob> page = principalId == null
                ? jobRepository.findAll(pageable)
                : jobRepository.findByPrincipalId(principalId, pageable);
        return new JobPage(page.getContent(), page.getTotalElements(), effectiveLimit, effectiveOffset);
    }

    @Transactional(readOnly = true)
    public List<CompressionJob> findStale(final Collection<JobStatus> statuses, final Instant olderThan) {
        return jobRepository.findByStatusInAndUpdatedAtBefore(statuses, olderThan);
    }

    static int clampLimit(final Integer limit) {
        if (limit == null) {
            return DEFAULT_LIMIT;
        }
        return Math.max(1, Math.min(MAX_LIMIT, limit));
    }

    private static String truncate(final String message) {
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
