package com.eyelevel.pdfcompressor.exception.handler;

import com.eyelevel.pdfcompressor.dto.common.ApiErrorResponse;
import com.eyelevel.pdfcompressor.exception.ExternalToolException;
import com.eyelevel.pdfcompressor.exception.IllegalJobTransitionException;
import com.eyelevel.pdfcompressor.exception.JobDispatchException;
import com.eyelevel.pdfcompressor.exception.StorageException;
import com.eyelevel.pdfcompressor.exception.ToolNotFoundException;
import com.eyelevel.pdfcompressor.exception.apiclient.ApiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.unit.DataSize;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingRequestValueException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Converts every exception that escapes a handler or a request gate into the uniform
 * {@code {"ok": false, "error": ..., "detail": ...}} body with the matching HTTP status.
 * Tool diagnostics are logged here and never copied into the response.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private final DataSize maxFileSize;

    public GlobalExceptionHandler(@Value("${spring.servlet.multipart.max-file-size:100MB}") final DataSize maxFileSize) {
        this.maxFileSize = maxFileSize;
    }

    // --- 4xx Client Error Handlers ---

    /**
     * Handles every error raised deliberately for the caller, gates included.
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiErrorResponse> handleApiException(final ApiException ex) {
        log.warn("API exception [{} {}]: {}", ex.getStatusCode(), ex.getErrorCode(), ex.getMessage());
        return error(HttpStatus.valueOf(ex.getStatusCode()), ex.getErrorCode(), ex.getMessage());
    }

    /**
     * Handles uploads over {@code spring.servlet.multipart.max-file-size}. (413 Payload Too Large)
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiErrorResponse> handleMaxUploadSize(final MaxUploadSizeExceededException ex) {
        final String detail = String.format("The uploaded file exceeds the %d MiB limit.", maxFileSize.toMegabytes());
        log.warn("Rejected oversized upload: {}", ex.getMessage());
        return error(HttpStatus.PAYLOAD_TOO_LARGE, "payload_too_large", detail);
    }

    /**
     * Handles a missing multipart part or request parameter. (400 Bad Request)
     */
    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ApiErrorResponse> handleMissingPart(final MissingServletRequestPartException ex) {
        log.warn("Missing request part: {}", ex.getRequestPartName());
        return error(HttpStatus.BAD_REQUEST, "missing_file", "No file part in the request.");
    }

    @ExceptionHandler({MissingRequestValueException.class, MethodArgumentTypeMismatchException.class,
            MultipartException.class})
    public ResponseEntity<ApiErrorResponse> handleMalformedRequest(final Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "bad_request", "The request could not be understood.");
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleNoResource(final NoResourceFoundException ex) {
        log.warn("No endpoint for {}", ex.getResourcePath());
        return error(HttpStatus.NOT_FOUND, "not_found", "The requested resource was not found.");
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiErrorResponse> handleMethodNotSupported(final HttpRequestMethodNotSupportedException ex) {
        log.warn("Method {} not supported.", ex.getMethod());
        return error(HttpStatus.METHOD_NOT_ALLOWED, "method_not_allowed",
                     String.format("Request method '%s' is not supported here.", ex.getMethod()));
    }

    // --- 5xx Server Error Handlers ---

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ApiErrorResponse> handleStorage(final StorageException ex) {
        log.error("Storage failure: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "storage_error", ex.getMessage());
    }

    @ExceptionHandler(ToolNotFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleToolNotFound(final ToolNotFoundException ex) {
        log.error("Ghostscript not found: {}", ex.getMessage());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "ghostscript_not_found", "Ghostscript is not installed on the server.");
    }

    @ExceptionHandler(ExternalToolException.class)
    public ResponseEntity<ApiErrorResponse> handleExternalTool(final ExternalToolException ex) {
        log.error("Ghostscript failure: {} Diagnostic: {}", ex.getMessage(), ex.getDiagnostic());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "ghostscript_error", "Ghostscript failed while compressing the file.");
    }

    @ExceptionHandler(JobDispatchException.class)
    public ResponseEntity<ApiErrorResponse> handleDispatch(final JobDispatchException ex) {
        log.error("Dispatch failure: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "dispatch_error", "The job could not be dispatched for processing.");
    }

    @ExceptionHandler(IllegalJobTransitionException.class)
    public ResponseEntity<ApiErrorResponse> handleIllegalTransition(final IllegalJobTransitionException ex) {
        log.error("Job lifecycle violation: {}", ex.getMessage());
        return internalError();
    }

    /**
     * A final catch-all handler for any other unexpected exceptions. (500 Internal Server Error)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleGenericException(final Exception ex) {
        log.error("An unexpected internal server error occurred", ex);
        return internalError();
    }

    private ResponseEntity<ApiErrorResponse> internalError() {
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "An unexpected internal error occurred.");
    }

    private static ResponseEntity<ApiErrorResponse> error(final HttpStatus status, final String code, final String detail) {
        return new ResponseEntity<>(ApiErrorResponse.of(code, detail), status);
    }
}
