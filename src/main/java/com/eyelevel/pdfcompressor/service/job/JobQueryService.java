package com.eyelevel.pdfcompressor.service.job;

import com.eyelevel.pdfcompressor.exception.apiclient.JobNotFoundException;
import com.eyelevel.pdfcompressor.model.CompressionJob;
import com.eyelevel.pdfcompressor.model.Principal;
import com.eyelevel.pdfcompressor.service.identity.CallerCredential;
import com.eyelevel.pdfcompressor.service.identity.IdentityResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Read access to jobs on behalf of a caller. Jobs owned by someone else look exactly like missing jobs
 * unless the caller is elevated.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobQueryService {

    private final JobStore jobStore;
    private final IdentityResolver identityResolver;

    public CompressionJob getJob(final CallerCredential caller, final String rawJobId) {
        final UUID jobId = parseJobId(rawJobId);
        final Principal principal = identityResolver.resolve(caller);
        final CompressionJob job = jobStore.get(jobId);
        if (!caller.elevated() && !principal.getId().equals(job.getPrincipalId())) {
            log.warn("[{}] Principal {} requested a job it does not own.", jobId, principal.getId());
            throw new JobNotFoundException(rawJobId);
        }
        return job;
    }

    public JobPage listJobs(final CallerCredential caller, final Integer limit, final Long offset) {
        final Principal principal = identityResolver.resolve(caller);
        return jobStore.list(caller.elevated() ? null : principal.getId(), limit, offset);
    }

    private static UUID parseJobId(final String rawJobId) {
        try {
            return UUID.fromString(rawJobId);
        } catch (IllegalArgumentException e) {
            throw new JobNotFoundException(rawJobId);
        }
    }
}
