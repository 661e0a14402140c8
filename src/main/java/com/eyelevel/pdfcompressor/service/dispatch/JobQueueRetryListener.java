package com.eyelevel.pdfcompressor.service.dispatch;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

/**
 * Logs each failed publish attempt made by {@link JobQueuePublisher}.
 */
@Slf4j
@Component("jobQueueRetryListener")
public class JobQueueRetryListener implements RetryListener {

    @Override
    public <T, E extends Throwable> void onError(final RetryContext context, final RetryCallback<T, E> callback,
                                                 final Throwable throwable) {
        log.warn("Queue publish attempt {} failed: {}", context.getRetryCount(), throwable.getMessage());
    }

    @Override
    public <T, E extends Throwable> void close(final RetryContext context, final RetryCallback<T, E> callback,
                                               final Throwable throwable) {
        if (throwable != null && context.getRetryCount() > 1) {
            log.error("Queue publish gave up after {} attempts.", context.getRetryCount());
        }
    }
}
