package com.eyelevel.pdfcompressor.exception;

import java.io.Serial;

/**
 * Thrown when an upload cannot be persisted to, or an output cannot be read from, the job workspace.
 */
public class StorageException extends CompressionException {
    @Serial
    private static final long serialVersionUID = -2287702954173018890L;

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
