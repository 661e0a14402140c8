package com.eyelevel.pdfcompressor.scheduler;

import com.eyelevel.pdfcompressor.config.PdfCompressorConfig;
import com.eyelevel.pdfcompressor.exception.IllegalJobTransitionException;
import com.eyelevel.pdfcompressor.model.CompressionJob;
import com.eyelevel.pdfcompressor.model.JobStatus;
import com.eyelevel.pdfcompressor.service.job.JobStore;
import com.eyelevel.pdfcompressor.service.job.TransitionDetails;
import com.eyelevel.pdfcompressor.service.workspace.JobWorkspaceFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

/**
 * Fails jobs left in QUEUED or RUNNING by a worker that died, so they never stay non-terminal forever, then
 * removes workspace files older than the same window.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StaleJobRecoveryScheduler {

    private final JobStore jobStore;
    private final PdfCompressorConfig config;
    private final JobWorkspaceFactory workspaceFactory;

    @Scheduled(cron = "${app.scheduler.stale-job-cron}")
    public void failStaleJobs() {
        final long staleMinutes = config.getScheduler().getStaleJobMinutes();
        final Instant threshold = Instant.now().minus(Duration.ofMinutes(staleMinutes));
        log.info("Running stale job recovery. Finding QUEUED or RUNNING jobs not updated since {}.", threshold);

        final List<CompressionJob> staleJobs = jobStore.findStale(EnumSet.of(JobStatus.QUEUED, JobStatus.RUNNING),
                                                                  threshold);
        if (CollectionUtils.isEmpty(staleJobs)) {
            log.info("No stale jobs found.");
        } else {
            failAll(staleJobs, staleMinutes);
        }

        final int purged = workspaceFactory.purgeOlderThan(threshold);
        if (purged > 0) {
            log.info("Removed {} abandoned workspace files.", purged);
        }
    }

    private void failAll(final List<CompressionJob> staleJobs, final long staleMinutes) {
        log.warn("Found {} stale jobs to mark as FAILED.", staleJobs.size());
        int failed = 0;
        for (final CompressionJob job : staleJobs) {
            final String reason = String.format("Job was abandoned in %s and exceeded the %d-minute time limit.",
                                                job.getStatus(), staleMinutes);
            try {
                jobStore.transition(job.getId(), JobStatus.FAILED, TransitionDetails.failed(reason));
                failed++;
            } catch (IllegalJobTransitionException e) {
                log.warn("[{}] Job finished while recovery was running: {}", job.getId(), e.getMessage());
            }
        }
        log.info("Finished stale job recovery. Marked {} jobs as FAILED.", failed);
    }
}
