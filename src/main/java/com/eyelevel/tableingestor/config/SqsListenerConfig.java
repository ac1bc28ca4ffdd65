package com.eyelevel.tableingestor.config;

import io.awspring.cloud.sqs.config.SqsMessageListenerContainerFactory;
import io.awspring.cloud.sqs.listener.acknowledgement.handler.AcknowledgementMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;

import java.time.Duration;

/**
 * SQS client and listener container for upload notifications. Only active when
 * {@code app.ingestion.sqs.enabled} is true.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "app.ingestion.sqs", name = "enabled", havingValue = "true")
public class SqsListenerConfig {

    @Bean
    public SqsAsyncClient sqsAsyncClient(AwsCredentialsProvider credentialsProvider,
                                         @Value("${aws.region}") String awsRegion) {
        log.info("Configuring AWS SqsAsyncClient for region: {}", awsRegion);
        return SqsAsyncClient.builder().region(Region.of(awsRegion)).credentialsProvider(credentialsProvider).build();
    }

    @Bean("uploadEventContainerFactory") // referenced by UploadEventConsumer
    public SqsMessageListenerContainerFactory<Object> uploadEventContainerFactory(SqsAsyncClient sqsAsyncClient,
                                                                                  @Value("${app.sqs.listener.upload-event-queue.concurrency-limit:4}")
                                                                                  int concurrency,
                                                                                  @Value("${app.sqs.listener.upload-event-queue.max-messages-per-poll:4}")
                                                                                  int maxMessagesPerPoll,
                                                                                  @Value("${app.sqs.listener.upload-event-queue.poll-timeout-seconds:20}")
                                                                                  int pollTimeoutSeconds) {

        SqsMessageListenerContainerFactory<Object> factory = new SqsMessageListenerContainerFactory<>();
        factory.setSqsAsyncClient(sqsAsyncClient);
        factory.configure(options -> options.acknowledgementMode(AcknowledgementMode.ON_SUCCESS)
                .maxConcurrentMessages(concurrency).maxMessagesPerPoll(maxMessagesPerPoll)
                .pollTimeout(Duration.ofSeconds(pollTimeoutSeconds)));
        return factory;
    }
}
