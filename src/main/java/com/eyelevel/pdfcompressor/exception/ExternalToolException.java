package com.eyelevel.pdfcompressor.exception;

import lombok.Getter;

import java.io.Serial;

/**
 * Thrown when Ghostscript runs but fails: non-zero exit, timeout, or no output file.
 * The captured diagnostic output is kept for the job record and the logs, never for the HTTP body.
 */
@Getter
public class ExternalToolException extends CompressionException {
    @Serial
    private static final long serialVersionUID = -5320937812004446163L;

    private final String diagnostic;

    public ExternalToolException(String message, String diagnostic) {
        super(message);
        this.diagnostic = diagnostic;
    }

    public ExternalToolException(String message, String diagnostic, Throwable cause) {
        super(message, cause);
        this.diagnostic = diagnostic;
    }
}
