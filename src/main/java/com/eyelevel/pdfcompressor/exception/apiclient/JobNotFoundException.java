package com.eyelevel.pdfcompressor.exception.apiclient;

import java.io.Serial;

/**
 * Thrown when a job id is unknown, malformed, or owned by someone else.
 */
public class JobNotFoundException extends NotFoundException {

    @Serial
    private static final long serialVersionUID = -1722043387215602449L;

    public JobNotFoundException(String jobId) {
        super("job_not_found", String.format("Compression job '%s' was not found.", jobId));
    }
}
