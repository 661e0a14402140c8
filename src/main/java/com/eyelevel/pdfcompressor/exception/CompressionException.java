package com.eyelevel.pdfcompressor.exception;

import java.io.Serial;

/**
 * A base exception for errors that occur inside the compression pipeline.
 */
public class CompressionException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 7431586623017045119L;

    public CompressionException(String message) {
        super(message);
    }

    public CompressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
