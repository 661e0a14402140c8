package com.eyelevel.pdfcompressor.common.processexec;

import java.io.IOException;
import java.io.Serial;

/**
 * Signals that a started process did not finish within its time limit and was killed.
 */
public class ProcessTimeoutException extends IOException {
    @Serial
    private static final long serialVersionUID = 2930587217458112063L;

    public ProcessTimeoutException(String message) {
        super(message);
    }
}
