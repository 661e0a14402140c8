package com.eyelevel.pdfcompressor.exception.apiclient;

import java.io.Serial;

/**
 * Exception indicating that the caller exceeded its request quota (HTTP 429).
 */
public class TooManyRequestsException extends ApiException {

    @Serial
    private static final long serialVersionUID = -6576126133407459351L;

    public TooManyRequestsException(String errorCode, String message) {
        super(message, 429, errorCode);
    }
}
