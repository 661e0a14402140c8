package com.eyelevel.pdfcompressor.exception.apiclient;

import java.io.Serial;

/**
 * Exception indicating that a required collaborator, such as Ghostscript, is unavailable (HTTP 503).
 */
public class ServiceUnavailableException extends ApiException {

    @Serial
    private static final long serialVersionUID = 5518702966320147210L;

    public ServiceUnavailableException(String errorCode, String message) {
        super(message, 503, errorCode);
    }
}
