package com.eyelevel.pdfcompressor.controller;

import com.eyelevel.pdfcompressor.dto.common.ApiErrorResponse;
import com.eyelevel.pdfcompressor.dto.compress.CompressionSummaryResponse;
import com.eyelevel.pdfcompressor.dto.job.JobAcceptedResponse;
import com.eyelevel.pdfcompressor.dto.job.JobPageResponse;
import com.eyelevel.pdfcompressor.dto.job.JobResponse;
import com.eyelevel.pdfcompressor.service.identity.CallerCredential;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.multipart.MultipartFile;

@Tag(name = "PDF Compression", description = "Submit PDF documents for compression and inspect the resulting jobs.")
@SecurityRequirement(name = "apiKey")
public interface CompressionApi {

    @Operation(summary = "Compress a PDF",
            description = "Compresses the uploaded PDF with the selected profile. In inline mode the compressed PDF is "
                          + "returned as an attachment, or a JSON summary when the Accept header prefers JSON. In the "
                          + "background modes the job is accepted and returned with status 202.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Compressed document or summary.",
                    content = {
                            @Content(mediaType = "application/pdf"),
                            @Content(mediaType = "application/json",
                                    schema = @Schema(implementation = CompressionSummaryResponse.class),
                                    examples = @ExampleObject(name = "Summary", value = """
                                            {
                                                "ok": true,
                                                "original_bytes": 248311,
                                                "compressed_bytes": 90127,
                                                "ratio": 0.363,
                                                "profile": "medium",
                                                "request_id": "5f0c1e0b9d6c4b7f8a0f3f0b2d1c9e77",
                                                "job_id": "3f2a6b0e-8f7d-4a53-9d55-0c1b2e3f4a5b"
                                            }
                                            """))}),
            @ApiResponse(responseCode = "202", description = "Job accepted for background processing.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = JobAcceptedResponse.class))),
            @ApiResponse(responseCode = "400", description = "Missing file or invalid profile.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiErrorResponse.class))),
            @ApiResponse(responseCode = "401", description = "Missing or unknown API key.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiErrorResponse.class))),
            @ApiResponse(responseCode = "413", description = "Upload exceeds the size limit.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiErrorResponse.class))),
            @ApiResponse(responseCode = "415", description = "The upload is not a PDF document.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiErrorResponse.class))),
            @ApiResponse(responseCode = "429", description = "Rate limit exceeded.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiErrorResponse.class))),
            @ApiResponse(responseCode = "500", description = "Storage, Ghostscript or dispatch failure.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiErrorResponse.class))),
            @ApiResponse(responseCode = "503", description = "Ghostscript is not available.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiErrorResponse.class)))
    })
    ResponseEntity<?> compress(
            @Parameter(description = "The PDF document to compress.", required = true) MultipartFile file,
            @Parameter(description = "Compression profile: low, medium or high.", example = "medium") String profile,
            @Parameter(description = "Keep embedded images at full resolution (1, true, yes or on).") String keepImages,
            @Parameter(hidden = true) String accept,
            @Parameter(hidden = true) CallerCredential caller);

    @Operation(summary = "Get a compression job",
            description = "Returns a single job. Jobs owned by other callers are reported as not found unless the caller is elevated.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "The job record.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = JobResponse.class))),
            @ApiResponse(responseCode = "404", description = "Unknown job.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiErrorResponse.class)))
    })
    ResponseEntity<JobResponse> getJob(
            @Parameter(description = "The job id.", required = true) String jobId,
            @Parameter(hidden = true) CallerCredential caller);

    @Operation(summary = "List compression jobs",
            description = "Lists the caller's jobs, newest first. Elevated callers see every job.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "A page of jobs.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = JobPageResponse.class))),
            @ApiResponse(responseCode = "400", description = "Negative offset.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiErrorResponse.class)))
    })
    ResponseEntity<JobPageResponse> listJobs(
            @Parameter(description = "Page size, 1 to 100.", example = "20") Integer limit,
            @Parameter(description = "Rows to skip.", example = "0") Long offset,
            @Parameter(hidden = true) CallerCredential caller);
}
