package com.eyelevel.pdfcompressor.exception.apiclient;

import lombok.Getter;

import java.io.Serial;

/**
 * Base class for errors that are reported to the HTTP caller.
 *
 * <p>Carries the HTTP status code and the stable, machine-readable error code that ends up in the
 * {@code error} field of the response body. The exception message becomes the human-readable {@code detail}.
 */
@Getter
public class ApiException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 4830840555831897529L;
    private final int statusCode;
    private final String errorCode;

    /**
     * Constructs a new ApiException.
     *
     * @param message    A human-readable detail message.
     * @param statusCode The HTTP status code associated with the exception.
     * @param errorCode  The stable error code, e.g. {@code invalid_profile}.
     */
    public ApiException(String message, int statusCode, String errorCode) {
        super(message);
        this.statusCode = statusCode;
        this.errorCode = errorCode;
    }
}
