package com.eyelevel.pdfcompressor.controller;

import com.eyelevel.pdfcompressor.common.processexec.ProcessExecutor;
import com.eyelevel.pdfcompressor.config.PdfCompressorConfig;
import com.eyelevel.pdfcompressor.model.CompressionJob;
import com.eyelevel.pdfcompressor.model.JobStatus;
import com.eyelevel.pdfcompressor.repository.CompressionJobRepository;
import com.eyelevel.pdfcompressor.support.GhostscriptStub;
import com.eyelevel.pdfcompressor.support.StorageDirectories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMultipartHttpServletRequestBuilder;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasLength;
import static org.hamcrest.Matchers.not;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class CompressionControllerTest {

    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private CompressionJobRepository jobRepository;
    @Autowired
    private PdfCompressorConfig config;

    @MockBean
    private ProcessExecutor processExecutor;

    @BeforeEach
    void setUp() {
        jobRepository.deleteAllInBatch();
    }

    @Test
    void returnsCompressedPdfAsAttachment() throws Exception {
        GhostscriptStub.succeed(processExecutor);

        mockMvc.perform(upload(pdf("Quarterly Report.pdf")).param("profile", "low"))
               .andExpect(status().isOk())
               .andExpect(content().contentType(MediaType.APPLICATION_PDF))
               .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION,
                                          containsString("Quarterly_Report-compressed.pdf")))
               .andExpect(content().bytes(GhostscriptStub.COMPRESSED));

        final List<CompressionJob> jobs = jobRepository.findAll();
        assertThat(jobs).hasSize(1);
        final CompressionJob job = jobs.get(0);
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getOriginalFilename()).isEqualTo("Quarterly Report.pdf");
        assertThat(job.getOriginalSizeBytes()).isEqualTo(GhostscriptStub.samplePdf().length);
        assertThat(job.getCompressedSizeBytes()).isEqualTo(GhostscriptStub.COMPRESSED.length);
        assertThat(job.getCompletedAt()).isNotNull();
        assertThat(StorageDirectories.leftoverFiles(config)).isZero();
    }

    @Test
    void returnsSummaryWhenJsonIsPreferred() throws Exception {
        GhostscriptStub.succeed(processExecutor);

        mockMvc.perform(upload(pdf("report.pdf")).param("keep_images", "yes")
                                                 .header(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE))
               .andExpect(status().isOk())
               .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
               .andExpect(jsonPath("$.ok").value(true))
               .andExpect(jsonPath("$.original_bytes").value(GhostscriptStub.samplePdf().length))
               .andExpect(jsonPath("$.compressed_bytes").value(GhostscriptStub.COMPRESSED.length))
               .andExpect(jsonPath("$.profile").value("medium"))
               .andExpect(jsonPath("$.ratio").isNumber())
               .andExpect(jsonPath("$.request_id", hasLength(32)))
               .andExpect(jsonPath("$.job_id").isNotEmpty());

        assertThat(jobRepository.findAll()).singleElement()
                                           .satisfies(job -> assertThat(job.isPreserveImages()).isTrue());
    }

    @Test
    void missingFileIsRejectedBeforeAnyJobExists() throws Exception {
        mockMvc.perform(multipart("/api/compress").param("profile", "low"))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.ok").value(false))
               .andExpect(jsonPath("$.error").value("missing_file"))
               .andExpect(jsonPath("$.detail").value("No file part in the request."));

        assertThat(jobRepository.count()).isZero();
    }

    @Test
    void unknownProfileIsRejectedBeforeAnyJobExists() throws Exception {
        mockMvc.perform(upload(pdf("report.pdf")).param("profile", "ultra"))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.error").value("invalid_profile"));

        assertThat(jobRepository.count()).isZero();
        verify(processExecutor, never()).execute(anyList(), anyString(), anyLong(), anyString());
    }

    @Test
    void nonPdfUploadsAreRejected() throws Exception {
        final MockMultipartFile text = new MockMultipartFile("file", "notes.txt", MediaType.TEXT_PLAIN_VALUE,
                                                             "just text".getBytes(StandardCharsets.UTF_8));
        final MockMultipartFile disguised = new MockMultipartFile("file", "notes.pdf", MediaType.APPLICATION_PDF_VALUE,
                                                                  "just text".getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(upload(text))
               .andExpect(status().isUnsupportedMediaType())
               .andExpect(jsonPath("$.error").value("unsupported_media_type"));
        mockMvc.perform(upload(disguised))
               .andExpect(status().isUnsupportedMediaType());

        assertThat(jobRepository.count()).isZero();
    }

    @Test
    void toolFailureIsRecordedButNotLeaked() throws Exception {
        GhostscriptStub.fail(processExecutor, 1, "Error: /syntaxerror in /opt/private/fonts");

        mockMvc.perform(upload(pdf("broken.pdf")))
               .andExpect(status().isInternalServerError())
               .andExpect(jsonPath("$.error").value("ghostscript_error"))
               .andExpect(jsonPath("$.detail").value("Ghostscript failed while compressing the file."))
               .andExpect(content().string(not(containsString("syntaxerror"))));

        final CompressionJob job = jobRepository.findAll().get(0);
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getErrorMessage()).startsWith("Ghostscript exited with code 1.").contains("/syntaxerror");
        assertThat(job.getCompressedSizeBytes()).isNull();
        assertThat(StorageDirectories.leftoverFiles(config)).isZero();

        mockMvc.perform(get("/api/jobs/{id}", job.getId()))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.status").value("failed"))
               .andExpect(jsonPath("$.error_message").value("Ghostscript exited with code 1."));
    }

    @Test
    void completedJobCanBeFetched() throws Exception {
        GhostscriptStub.succeed(processExecutor);
        mockMvc.perform(upload(pdf("report.pdf")).param("profile", "high")).andExpect(status().isOk());
        final CompressionJob job = jobRepository.findAll().get(0);

        mockMvc.perform(get("/api/jobs/{id}", job.getId()))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.id").value(job.getId().toString()))
               .andExpect(jsonPath("$.user_id").value(job.getPrincipalId().toString()))
               .andExpect(jsonPath("$.status").value("completed"))
               .andExpect(jsonPath("$.compression_level").value("high"))
               .andExpect(jsonPath("$.compressed_size_bytes").value(GhostscriptStub.COMPRESSED.length))
               .andExpect(jsonPath("$.completed_at").isNotEmpty());
    }

    @Test
    void unknownOrMalformedJobIdIsNotFound() throws Exception {
        mockMvc.perform(get("/api/jobs/{id}", UUID.randomUUID()))
               .andExpect(status().isNotFound())
               .andExpect(jsonPath("$.error").value("job_not_found"));
        mockMvc.perform(get("/api/jobs/{id}", "not-a-uuid"))
               .andExpect(status().isNotFound())
               .andExpect(jsonPath("$.error").value("job_not_found"));
    }

    @Test
    void listsJobsNewestFirstWithPaging() throws Exception {
        GhostscriptStub.succeed(processExecutor);
        for (int i = 0; i < 3; i++) {
            mockMvc.perform(upload(pdf("doc-" + i + ".pdf"))).andExpect(status().isOk());
        }

        mockMvc.perform(get("/api/jobs").param("limit", "2"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.items.length()").value(2))
               .andExpect(jsonPath("$.total").value(3))
               .andExpect(jsonPath("$.limit").value(2))
               .andExpect(jsonPath("$.offset").value(0));
        mockMvc.perform(get("/api/jobs").param("limit", "1000").param("offset", "2"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.items.length()").value(1))
               .andExpect(jsonPath("$.limit").value(100))
               .andExpect(jsonPath("$.offset").value(2));
    }

    @Test
    void negativeOffsetIsABadRequest() throws Exception {
        mockMvc.perform(get("/api/jobs").param("offset", "-1"))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.error").value("bad_request"));
        mockMvc.perform(get("/api/jobs").param("limit", "many"))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.error").value("bad_request"));
    }

    @Test
    void offsetBeyondAnyPageReturnsEmptyItemsWithTotal() throws Exception {
        GhostscriptStub.succeed(processExecutor);
        mockMvc.perform(upload(pdf("only.pdf"))).andExpect(status().isOk());

        mockMvc.perform(get("/api/jobs").param("offset", "3000000000"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.items.length()").value(0))
               .andExpect(jsonPath("$.total").value(1))
               .andExpect(jsonPath("$.offset").value(3000000000L));
    }

    @Test
    void overlongFilenameIsShortenedKeepingExtension() throws Exception {
        GhostscriptStub.succeed(processExecutor);

        mockMvc.perform(upload(pdf("a".repeat(300) + ".pdf"))).andExpect(status().isOk());

        final List<CompressionJob> jobs = jobRepository.findAll();
        assertThat(jobs).hasSize(1);
        assertThat(jobs.get(0).getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(jobs.get(0).getOriginalFilename()).hasSize(CompressionJob.ORIGINAL_FILENAME_LENGTH)
                                                     .isEqualTo("a".repeat(251) + ".pdf");
    }

    @Test
    void wrongMethodAndUnknownPathUseErrorEnvelope() throws Exception {
        mockMvc.perform(get("/api/compress"))
               .andExpect(status().isMethodNotAllowed())
               .andExpect(jsonPath("$.error").value("method_not_allowed"));
        mockMvc.perform(get("/api/nothing-here"))
               .andExpect(status().isNotFound())
               .andExpect(jsonPath("$.error").value("not_found"));
    }

    @Test
    void everyResponseCarriesSecurityHeaders() throws Exception {
        mockMvc.perform(get("/api/jobs/{id}", "missing"))
               .andExpect(status().isNotFound())
               .andExpect(header().string("X-Content-Type-Options", "nosniff"))
               .andExpect(header().string("X-Frame-Options", "DENY"))
               .andExpect(header().string("Referrer-Policy", "no-referrer"))
               .andExpect(header().string("Content-Security-Policy", containsString("default-src 'self'")));
    }

    private static MockMultipartHttpServletRequestBuilder upload(final MockMultipartFile file) {
        return multipart("/api/compress").file(file);
    }

    private static MockMultipartFile pdf(final String filename) {
        return new MockMultipartFile("file", filename, MediaType.APPLICATION_PDF_VALUE, GhostscriptStub.samplePdf());
    }
}
