package com.eyelevel.pdfcompressor.exception.apiclient;

import java.io.Serial;

/**
 * Exception indicating a malformed or semantically invalid request (HTTP 400).
 */
public class BadRequestException extends ApiException {

    @Serial
    private static final long serialVersionUID = 6209837561097264371L;

    public BadRequestException(String errorCode, String message) {
        super(message, 400, errorCode);
    }
}
