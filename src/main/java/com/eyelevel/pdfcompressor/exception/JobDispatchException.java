package com.eyelevel.pdfcompressor.exception;

import java.io.Serial;

/**
 * Thrown when a job cannot be handed to its worker, e.g. the queue publish failed after all retries.
 */
public class JobDispatchException extends CompressionException {
    @Serial
    private static final long serialVersionUID = 3127785042211650368L;

    public JobDispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
