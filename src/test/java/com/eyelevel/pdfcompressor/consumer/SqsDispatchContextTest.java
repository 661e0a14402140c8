package com.eyelevel.pdfcompressor.consumer;

import io.awspring.cloud.sqs.listener.MessageListenerContainer;
import io.awspring.cloud.sqs.listener.MessageListenerContainerRegistry;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.ActiveProfiles;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.model.GetQueueAttributesRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueAttributesResponse;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlResponse;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageResponse;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Boots the application in SQS dispatch mode against a stubbed client and checks that the job listener is
 * registered and polling the configured queue.
 */
@SpringBootTest(properties = {
        "app.dispatch.mode=sqs",
        "app.dispatch.queue-name=pdf-compression-jobs-test"
})
@ActiveProfiles("test")
class SqsDispatchContextTest {

    private static final String QUEUE_URL = "https://sqs.us-east-1.amazonaws.com/000000000000/pdf-compression-jobs-test";

    @TestConfiguration
    static class StubQueueClient {

        @Bean
        @Primary
        SqsAsyncClient stubSqsAsyncClient() {
            final SqsAsyncClient client = mock(SqsAsyncClient.class);
            when(client.getQueueUrl(any(GetQueueUrlRequest.class)))
                    .thenReturn(CompletableFuture.completedFuture(GetQueueUrlResponse.builder()
                                                                                    .queueUrl(QUEUE_URL)
                                                                                    .build()));
            when(client.getQueueAttributes(any(GetQueueAttributesRequest.class)))
                    .thenReturn(CompletableFuture.completedFuture(GetQueueAttributesResponse.builder().build()));
            when(client.receiveMessage(any(ReceiveMessageRequest.class)))
                    .thenAnswer(invocation -> CompletableFuture.supplyAsync(
                            () -> ReceiveMessageResponse.builder().build(),
                            CompletableFuture.delayedExecutor(200, TimeUnit.MILLISECONDS)));
            return client;
        }
    }

    @Autowired
    private MessageListenerContainerRegistry containerRegistry;

    @Autowired
    private SqsAsyncClient sqsAsyncClient;

    @Test
    void compressionListenerIsRegisteredAndRunning() {
        final MessageListenerContainer<?> container =
                containerRegistry.getContainerById(CompressionJobConsumer.LISTENER_ID);

        assertThat(container).isNotNull();
        assertThat(container.isRunning()).isTrue();
    }

    @Test
    void listenerResolvesAndPollsTheConfiguredQueue() {
        final ArgumentCaptor<GetQueueUrlRequest> urlRequest = ArgumentCaptor.forClass(GetQueueUrlRequest.class);
        verify(sqsAsyncClient, timeout(5000).atLeastOnce()).getQueueUrl(urlRequest.capture());
        assertThat(urlRequest.getAllValues()).extracting(GetQueueUrlRequest::queueName)
                                             .contains("pdf-compression-jobs-test");

        final ArgumentCaptor<ReceiveMessageRequest> receive = ArgumentCaptor.forClass(ReceiveMessageRequest.class);
        verify(sqsAsyncClient, timeout(5000).atLeastOnce()).receiveMessage(receive.capture());
        assertThat(receive.getValue().queueUrl()).isEqualTo(QUEUE_URL);
    }
}
