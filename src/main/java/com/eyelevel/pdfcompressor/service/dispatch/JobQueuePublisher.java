package com.eyelevel.pdfcompressor.service.dispatch;

import com.eyelevel.pdfcompressor.config.PdfCompressorConfig;
import com.eyelevel.pdfcompressor.exception.JobDispatchException;
import io.awspring.cloud.sqs.operations.MessagingOperationFailedException;
import io.awspring.cloud.sqs.operations.SqsTemplate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;

import java.nio.file.Path;
import java.util.Map;
import java.util.UUID;

/**
 * Announces committed jobs on the compression queue. Only present in SQS dispatch mode.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.dispatch.mode", havingValue = "sqs")
public class JobQueuePublisher {

    public static final String JOB_ID = "jobId";
    public static final String INPUT_PATH = "inputPath";
    public static final String OUTPUT_PATH = "outputPath";

    private final SqsTemplate sqsTemplate;
    private final PdfCompressorConfig config;

    @Retryable(retryFor = {MessagingOperationFailedException.class, SdkException.class},
            maxAttemptsExpression = "#{${app.dispatch.retry.attempts} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.dispatch.retry.delay-ms}}"),
            listeners = {"jobQueueRetryListener"})
    public void publish(final UUID jobId, final Path inputPath, final Path outputPath) {
        final String queueName = config.getDispatch().getQueueName();
        final Map<String, Object> payload = Map.of(JOB_ID, jobId.toString(),
                                                   INPUT_PATH, inputPath.toString(),
                                                   OUTPUT_PATH, outputPath.toString());
        sqsTemplate.send(to -> to.queue(queueName).payload(payload));
        log.info("[{}] Job published to queue '{}'.", jobId, queueName);
    }

    @Recover
    public void recover(final RuntimeException e, final UUID jobId, final Path inputPath, final Path outputPath) {
        log.error("[{}] Could not publish job to the queue after all retry attempts.", jobId, e);
        throw new JobDispatchException("Job " + jobId + " could not be queued.", e);
    }
}
