package com.eyelevel.pdfcompressor.consumer;

import com.eyelevel.pdfcompressor.service.dispatch.JobDispatcher;
import com.eyelevel.pdfcompressor.service.dispatch.JobQueuePublisher;
import com.eyelevel.pdfcompressor.service.workspace.JobWorkspaceFactory;
import io.awspring.cloud.sqs.annotation.SqsListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.UUID;

/**
 * Worker side of SQS dispatch. Each message names a committed job and the files it owns; the job's own claim
 * decides whether this delivery actually runs it, so duplicate deliveries are harmless.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.dispatch.mode", havingValue = "sqs")
public class CompressionJobConsumer {

    public static final String LISTENER_ID = "compressionJobListener";

    private final JobDispatcher jobDispatcher;
    private final JobWorkspaceFactory workspaceFactory;

    @SqsListener(value = "${app.dispatch.queue-name}", factory = "compressionJobContainerFactory", id = LISTENER_ID)
    public void processJobMessage(@Payload final Map<String, Object> message) {
        log.debug("Received new message on compression queue: {}", message);

        final UUID jobId = parseJobId(message.get(JobQueuePublisher.JOB_ID));
        final Object input = message.get(JobQueuePublisher.INPUT_PATH);
        final Object output = message.get(JobQueuePublisher.OUTPUT_PATH);
        if (jobId == null || !(input instanceof String) || !(output instanceof String)) {
            log.error("[FATAL] Compression message is invalid and will be dropped. Payload: {}", message);
            return;
        }

        final Path inputPath = Paths.get((String) input);
        final Path outputPath = Paths.get((String) output);
        log.info("[{}] Received compression task.", jobId);
        jobDispatcher.executeDetached(jobId, workspaceFactory.attach(jobId.toString(), inputPath, outputPath));
    }

    private static UUID parseJobId(final Object value) {
        if (!(value instanceof String)) {
            return null;
        }
        try {
            return UUID.fromString((String) value);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
