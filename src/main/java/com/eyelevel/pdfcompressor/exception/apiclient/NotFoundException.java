package com.eyelevel.pdfcompressor.exception.apiclient;

import java.io.Serial;

/**
 * Exception indicating that the requested resource does not exist or is not visible to the caller (HTTP 404).
 */
public class NotFoundException extends ApiException {

    @Serial
    private static final long serialVersionUID = 2184469300512770233L;

    public NotFoundException(String errorCode, String message) {
        super(message, 404, errorCode);
    }
}
