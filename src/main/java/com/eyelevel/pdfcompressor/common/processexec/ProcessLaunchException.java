package com.eyelevel.pdfcompressor.common.processexec;

import java.io.IOException;
import java.io.Serial;

/**
 * Signals that the operating system refused to start the process at all, typically because the executable
 * does not exist. Distinct from failures of a process that did start.
 */
public class ProcessLaunchException extends IOException {
    @Serial
    private static final long serialVersionUID = -4411620981531452214L;

    public ProcessLaunchException(String message, Throwable cause) {
        super(message, cause);
    }
}
