package com.eyelevel.pdfcompressor.config;

import io.awspring.cloud.sqs.operations.SqsTemplate;
import io.awspring.cloud.sqs.operations.TemplateAcknowledgementMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;

/**
 * SQS client and template for queue dispatch. Only built when {@code app.dispatch.mode=sqs}, so the inline and
 * async modes never need AWS settings.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "app.dispatch.mode", havingValue = "sqs")
public class AwsConfig {

    @Value("${aws.region}")
    private String awsRegion;

    @Value("${aws.access-key:}")
    private String accessKey;

    @Value("${aws.secret-key:}")
    private String secretKey;

    /**
     * Explicit keys when both are configured, otherwise the SDK default chain (environment, profile, IAM role).
     * Supplying only one of the two keys is a configuration error.
     */
    @Bean
    public AwsCredentialsProvider awsCredentialsProvider() {
        final boolean hasAccessKey = StringUtils.hasText(accessKey);
        final boolean hasSecretKey = StringUtils.hasText(secretKey);
        if (hasAccessKey != hasSecretKey) {
            throw new IllegalStateException("aws.access-key and aws.secret-key must be configured together.");
        }
        if (hasAccessKey) {
            log.info("Using static AWS credentials for queue dispatch.");
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey));
        }
        log.info("Using the default AWS credentials chain for queue dispatch.");
        return DefaultCredentialsProvider.create();
    }

    @Bean
    public SqsAsyncClient sqsAsyncClient(final AwsCredentialsProvider credentialsProvider) {
        log.info("Creating SqsAsyncClient in region {}.", awsRegion);
        return SqsAsyncClient.builder()
                             .region(Region.of(awsRegion))
                             .credentialsProvider(credentialsProvider)
                             .build();
    }

    /**
     * Template used only for sending; receiving goes through the listener container.
     */
    @Bean
    public SqsTemplate sqsTemplate(final SqsAsyncClient sqsAsyncClient) {
        return SqsTemplate.builder()
                          .sqsAsyncClient(sqsAsyncClient)
                          .configure(options -> options.acknowledgementMode(TemplateAcknowledgementMode.MANUAL))
                          .build();
    }
}
