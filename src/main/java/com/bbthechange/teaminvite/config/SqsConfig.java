package com.bbthechange.teaminvite.config;

import io.awspring.cloud.sqs.config.SqsMessageListenerContainerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;

import java.time.Duration;

/**
 * SQS transport for invite tasks. Only enabled when team-invite.queue.transport=sqs.
 */
@Configuration
@ConditionalOnProperty(name = "team-invite.queue.transport", havingValue = "sqs")
public class SqsConfig {

    @Value("${aws.region}")
    private String region;

    @Bean
    public SqsAsyncClient sqsAsyncClient() {
        return SqsAsyncClient.builder()
                .region(Region.of(region))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }

    /**
     * Polls at most one batch per worker so the channel, not SQS, holds the backlog.
     */
    @Bean
    public SqsMessageListenerContainerFactory<Object> inviteTaskListenerFactory(
            SqsAsyncClient sqsAsyncClient, TeamInviteProperties properties) {
        int concurrency = Math.max(1, Math.min(10, properties.getDispatch().getBatchSize()));
        return SqsMessageListenerContainerFactory.builder()
                .sqsAsyncClient(sqsAsyncClient)
                .configure(options -> options
                        .maxConcurrentMessages(concurrency)
                        .maxMessagesPerPoll(concurrency)
                        .pollTimeout(Duration.ofSeconds(20))
                        .acknowledgementShutdownTimeout(Duration.ofSeconds(30)))
                .build();
    }
}
