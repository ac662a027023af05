package com.bbthechange.teaminvite.dispatch;

import com.bbthechange.teaminvite.config.TeamInviteProperties;
import com.bbthechange.teaminvite.dto.queue.InviteTaskMessage;
import com.bbthechange.teaminvite.exception.TaskPublishException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CompletionException;

/**
 * Publishes invite tasks to SQS. Sends are awaited so callers can compensate on failure.
 */
@Service
@ConditionalOnProperty(name = "team-invite.queue.transport", havingValue = "sqs")
public class SqsInviteTaskPublisher implements InviteTaskPublisher {

    private static final Logger logger = LoggerFactory.getLogger(SqsInviteTaskPublisher.class);
    static final int MAX_DELAY_SECONDS = 900;

    private final SqsAsyncClient sqsAsyncClient;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final String queueUrl;

    public SqsInviteTaskPublisher(SqsAsyncClient sqsAsyncClient,
                                  ObjectMapper objectMapper,
                                  MeterRegistry meterRegistry,
                                  TeamInviteProperties properties) {
        this.sqsAsyncClient = sqsAsyncClient;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.queueUrl = properties.getQueue().getUrl();
    }

    @Override
    public void publish(InviteTaskMessage message) {
        publish(message, Duration.ZERO);
    }

    @Override
    public void publish(InviteTaskMessage message, Duration delay) {
        if (message.getMessageId() == null) {
            message.setMessageId(UUID.randomUUID().toString());
        }

        String messageBody;
        try {
            messageBody = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize {} message", message.getType(), e);
            countSend(message, "serialization_error");
            throw new TaskPublishException("Failed to serialize " + message.getType(), e);
        }

        int delaySeconds = (int) Math.min(MAX_DELAY_SECONDS, Math.max(0, delay.getSeconds()));
        SendMessageRequest request = SendMessageRequest.builder()
                .queueUrl(queueUrl)
                .messageBody(messageBody)
                .delaySeconds(delaySeconds)
                .build();

        try {
            sqsAsyncClient.sendMessage(request).join();
        } catch (CompletionException e) {
            logger.error("Failed to send {} to invite queue", message.getType(), e.getCause());
            countSend(message, "error");
            throw new TaskPublishException("Failed to send " + message.getType() + " to SQS", e.getCause());
        }

        logger.info("Sent message to invite queue: type={}, messageId={}, delay={}s",
                message.getType(), message.getMessageId(), delaySeconds);
        countSend(message, "success");
    }

    private void countSend(InviteTaskMessage message, String status) {
        meterRegistry.counter("team_invite_sqs_send_total",
                "type", message.getType(),
                "status", status).increment();
    }
}
