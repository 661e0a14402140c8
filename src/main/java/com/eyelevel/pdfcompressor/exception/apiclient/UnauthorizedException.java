package com.eyelevel.pdfcompressor.exception.apiclient;

import java.io.Serial;

/**
 * Exception indicating that the caller could not be authenticated (HTTP 401).
 */
public class UnauthorizedException extends ApiException {

    @Serial
    private static final long serialVersionUID = -3310921854471220968L;

    public UnauthorizedException(String errorCode, String message) {
        super(message, 401, errorCode);
    }
}
