package com.eyelevel.pdfcompressor.exception;

import java.io.Serial;

/**
 * Thrown when the Ghostscript executable cannot be located or launched.
 */
public class ToolNotFoundException extends CompressionException {
    @Serial
    private static final long serialVersionUID = 1904861502446652203L;

    public ToolNotFoundException(String message) {
        super(message);
    }

    public ToolNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
