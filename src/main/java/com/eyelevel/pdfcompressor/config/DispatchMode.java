package com.eyelevel.pdfcompressor.config;

/**
 * How an accepted job reaches its worker.
 */
public enum DispatchMode {
    /**
     * The request thread claims and runs the job, and the response carries the result.
     */
    INLINE,
    /**
     * The job runs on the in-process compression task executor.
     */
    ASYNC,
    /**
     * The job is announced on an SQS queue and picked up by a listener.
     */
    SQS
}
