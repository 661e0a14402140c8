package com.eyelevel.pdfcompressor.controller;

import com.eyelevel.pdfcompressor.dto.compress.CompressionSummaryResponse;
import com.eyelevel.pdfcompressor.dto.job.JobAcceptedResponse;
import com.eyelevel.pdfcompressor.dto.job.JobPageResponse;
import com.eyelevel.pdfcompressor.dto.job.JobResponse;
import com.eyelevel.pdfcompressor.exception.apiclient.BadRequestException;
import com.eyelevel.pdfcompressor.model.CompressionJob;
import com.eyelevel.pdfcompressor.model.CompressionProfile;
import com.eyelevel.pdfcompressor.service.compression.CompressionResult;
import com.eyelevel.pdfcompressor.service.file.ValidationService;
import com.eyelevel.pdfcompressor.service.identity.CallerCredential;
import com.eyelevel.pdfcompressor.service.job.CompressionOrchestrationService;
import com.eyelevel.pdfcompressor.service.job.JobPage;
import com.eyelevel.pdfcompressor.service.job.JobQueryService;
import com.eyelevel.pdfcompressor.service.job.SubmissionOutcome;
import com.eyelevel.pdfcompressor.web.DownloadNames;
import com.eyelevel.pdfcompressor.web.ResponseFormatNegotiator;
import com.eyelevel.pdfcompressor.web.gate.ApiKeyGate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.UUID;

/**
 * REST controller for PDF submission and job inspection.
 * The caller credential is placed on the request by {@link ApiKeyGate} before any handler runs.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class CompressionController implements CompressionApi {

    private final ValidationService validationService;
    private final CompressionOrchestrationService orchestrationService;
    private final JobQueryService jobQueryService;

    @Override
    @PostMapping("/compress")
    public ResponseEntity<?> compress(
            @RequestParam(value = "file", required = false) final MultipartFile file,
            @RequestParam(value = "profile", required = false) final String profile,
            @RequestParam(value = "keep_images", required = false) final String keepImages,
            @RequestHeader(value = HttpHeaders.ACCEPT, required = false) final String accept,
            @RequestAttribute(ApiKeyGate.CALLER_ATTRIBUTE) final CallerCredential caller) {

        final MultipartFile upload = validationService.requireFile(file);
        final CompressionProfile compressionProfile = validationService.requireProfile(profile);
        validationService.requirePdf(upload);
        validationService.requireGhostscript();
        final boolean preserveImages = validationService.isTruthyFlag(keepImages);

        log.info("Compression requested for '{}' ({} bytes, profile {}, keep images {}).",
                 upload.getOriginalFilename(), upload.getSize(), compressionProfile.getValue(), preserveImages);

        final SubmissionOutcome outcome = orchestrationService.submit(caller, upload, compressionProfile, preserveImages);
        final CompressionJob job = outcome.job();

        if (outcome.isAccepted()) {
            return ResponseEntity.status(HttpStatus.ACCEPTED)
                                 .body(JobAcceptedResponse.builder().job(JobResponse.from(job)).build());
        }

        if (ResponseFormatNegotiator.prefersJson(accept)) {
            final CompressionResult result = new CompressionResult(job.getOriginalSizeBytes(),
                                                                   job.getCompressedSizeBytes());
            return ResponseEntity.ok(CompressionSummaryResponse.builder()
                                                               .originalBytes(result.bytesIn())
                                                               .compressedBytes(result.bytesOut())
                                                               .ratio(result.ratio())
                                                               .profile(compressionProfile)
                                                               .requestId(UUID.randomUUID().toString().replace("-", ""))
                                                               .jobId(job.getId())
                                                               .build());
        }

        final ContentDisposition disposition = ContentDisposition.attachment()
                                                                 .filename(DownloadNames.compressedName(job.getOriginalFilename()))
                                                                 .build();
        return ResponseEntity.ok()
                             .contentType(MediaType.APPLICATION_PDF)
                             .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                             .contentLength(outcome.output().length)
                             .body(outcome.output());
    }

    @Override
    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<JobResponse> getJob(
            @PathVariable("jobId") final String jobId,
            @RequestAttribute(ApiKeyGate.CALLER_ATTRIBUTE) final CallerCredential caller) {
        return ResponseEntity.ok(JobResponse.from(jobQueryService.getJob(caller, jobId)));
    }

    @Override
    @GetMapping("/jobs")
    public ResponseEntity<JobPageResponse> listJobs(
            @RequestParam(value = "limit", required = false) final Integer limit,
            @RequestParam(value = "offset", required = false) final Long offset,
            @RequestAttribute(ApiKeyGate.CALLER_ATTRIBUTE) final CallerCredential caller) {
        if (offset != null && offset < 0) {
            throw new BadRequestException("bad_request", "Offset must not be negative.");
        }
        final JobPage page = jobQueryService.listJobs(caller, limit, offset);
        return ResponseEntity.ok(JobPageResponse.builder()
                                                .items(page.items().stream().map(JobResponse::from).toList())
                                                .total(page.total())
                                                .limit(page.limit())
                                                .offset(page.offset())
                                                .build());
    }
}
