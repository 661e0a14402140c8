package com.eyelevel.pdfcompressor.config;

import io.awspring.cloud.sqs.config.SqsBootstrapConfiguration;
import io.awspring.cloud.sqs.config.SqsMessageListenerContainerFactory;
import io.awspring.cloud.sqs.listener.acknowledgement.handler.AcknowledgementMode;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;

import java.time.Duration;

/**
 * Listener side of SQS dispatch. Boot's SQS auto-configuration is switched off, so the {@code @SqsListener}
 * infrastructure is imported here and only exists in {@code sqs} mode.
 */
@Configuration
@Import(SqsBootstrapConfiguration.class)
@ConditionalOnProperty(name = "app.dispatch.mode", havingValue = "sqs")
public class SqsListenerConfig {

    /**
     * Container factory for the compression job listener, tuned by {@code app.dispatch.listener.*}.
     * Messages are acknowledged only when the listener returns normally.
     */
    @Bean("compressionJobContainerFactory")
    public SqsMessageListenerContainerFactory<Object> compressionJobContainerFactory(SqsAsyncClient sqsAsyncClient,
                                                                                     PdfCompressorConfig config) {
        final PdfCompressorConfig.Dispatch.Listener listener = config.getDispatch().getListener();

        SqsMessageListenerContainerFactory<Object> factory = new SqsMessageListenerContainerFactory<>();
        factory.setSqsAsyncClient(sqsAsyncClient);
        factory.configure(options -> options.acknowledgementMode(AcknowledgementMode.ON_SUCCESS)
                                            .maxConcurrentMessages(listener.getMaxConcurrentMessages())
                                            .maxMessagesPerPoll(listener.getMaxMessagesPerPoll())
                                            .pollTimeout(Duration.ofSeconds(listener.getPollTimeoutSeconds())));
        return factory;
    }
}
