package com.bbthechange.teaminvite.listener;

import com.bbthechange.teaminvite.dispatch.InviteTaskChannel;
import com.bbthechange.teaminvite.dto.queue.InviteTaskMessage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.awspring.cloud.sqs.annotation.SqsListener;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * SQS listener for invite task messages. Hands each message to the dispatch workers through
 * the task channel, blocking while the channel is full.
 */
@Component
@ConditionalOnProperty(name = "team-invite.queue.transport", havingValue = "sqs")
public class InviteTaskListener {

    private static final Logger logger = LoggerFactory.getLogger(InviteTaskListener.class);

    private final InviteTaskChannel channel;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    public InviteTaskListener(InviteTaskChannel channel, ObjectMapper objectMapper, MeterRegistry meterRegistry) {
        this.channel = channel;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
    }

    @SqsListener(value = "${team-invite.queue.name}", factory = "inviteTaskListenerFactory")
    public void handleMessage(String messageBody) throws InterruptedException {
        String messageType = null;
        try {
            JsonNode node = objectMapper.readTree(messageBody);
            JsonNode typeNode = node.get("type");
            if (typeNode == null || typeNode.isNull()) {
                logger.warn("Received invite task without type field: {}", messageBody);
                meterRegistry.counter("team_invite_task_received_total", "type", "unknown", "status", "missing_type").increment();
                return;
            }
            messageType = typeNode.asText();

            InviteTaskMessage message = objectMapper.treeToValue(node, InviteTaskMessage.class);
            channel.put(message);

            logger.debug("Received invite task: type={}, messageId={}", messageType, message.getMessageId());
            meterRegistry.counter("team_invite_task_received_total", "type", messageType, "status", "success").increment();
        } catch (InterruptedException e) {
            // let SQS redeliver it
            Thread.currentThread().interrupt();
            throw e;
        } catch (Exception e) {
            String type = messageType != null ? messageType : "unknown";
            logger.error("Error reading invite task message (type={}): {}", type, messageBody, e);
            meterRegistry.counter("team_invite_task_received_total", "type", type, "status", "error").increment();
            // Don't rethrow - acknowledge message to prevent infinite retry
        }
    }
}
