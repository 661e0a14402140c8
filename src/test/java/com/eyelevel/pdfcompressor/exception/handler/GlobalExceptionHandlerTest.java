package com.eyelevel.pdfcompressor.exception.handler;

import com.eyelevel.pdfcompressor.dto.common.ApiErrorResponse;
import com.eyelevel.pdfcompressor.exception.ExternalToolException;
import com.eyelevel.pdfcompressor.exception.StorageException;
import com.eyelevel.pdfcompressor.exception.ToolNotFoundException;
import com.eyelevel.pdfcompressor.exception.apiclient.JobNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.unit.DataSize;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler(DataSize.ofMegabytes(100));

    @Test
    void oversizedUploadReportsTheLimit() {
        final ResponseEntity<ApiErrorResponse> response =
                handler.handleMaxUploadSize(new MaxUploadSizeExceededException(DataSize.ofMegabytes(100).toBytes()));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.PAYLOAD_TOO_LARGE);
        assertThat(response.getBody().getError()).isEqualTo("payload_too_large");
        assertThat(response.getBody().getDetail()).isEqualTo("The uploaded file exceeds the 100 MiB limit.");
        assertThat(response.getBody().isOk()).isFalse();
    }

    @Test
    void apiExceptionsKeepTheirStatusAndCode() {
        final ResponseEntity<ApiErrorResponse> response = handler.handleApiException(new JobNotFoundException("abc"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().getError()).isEqualTo("job_not_found");
        assertThat(response.getBody().getDetail()).isEqualTo("Compression job 'abc' was not found.");
    }

    @Test
    void toolDiagnosticsNeverReachTheBody() {
        final ResponseEntity<ApiErrorResponse> response = handler.handleExternalTool(
                new ExternalToolException("Ghostscript exited with code 1.", "/usr/share/fonts/secret missing"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().getError()).isEqualTo("ghostscript_error");
        assertThat(response.getBody().getDetail()).doesNotContain("secret").doesNotContain("code 1");
    }

    @Test
    void serverSideFailuresMapToStableCodes() {
        assertThat(handler.handleToolNotFound(new ToolNotFoundException("gs missing")).getBody().getError())
                .isEqualTo("ghostscript_not_found");
        assertThat(handler.handleStorage(new StorageException("Failed to save the uploaded file.", null)).getBody())
                .satisfies(body -> {
                    assertThat(body.getError()).isEqualTo("storage_error");
                    assertThat(body.getDetail()).isEqualTo("Failed to save the uploaded file.");
                });
        assertThat(handler.handleGenericException(new IllegalStateException("boom")).getBody().getError())
                .isEqualTo("internal_error");
    }
}
