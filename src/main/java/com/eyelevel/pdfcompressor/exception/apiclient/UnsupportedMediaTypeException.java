package com.eyelevel.pdfcompressor.exception.apiclient;

import java.io.Serial;

/**
 * Exception indicating that the uploaded content is not a PDF document (HTTP 415).
 */
public class UnsupportedMediaTypeException extends ApiException {

    @Serial
    private static final long serialVersionUID = 8871145260083342717L;

    public UnsupportedMediaTypeException(String errorCode, String message) {
        super(message, 415, errorCode);
    }
}
