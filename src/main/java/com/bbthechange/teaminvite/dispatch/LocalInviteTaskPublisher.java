package com.bbthechange.teaminvite.dispatch;

import com.bbthechange.teaminvite.dto.queue.InviteTaskMessage;
import com.bbthechange.teaminvite.exception.TaskPublishException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Publishes straight into the in-process channel. Delayed messages are held by a scheduler
 * and are lost if the process stops first.
 */
@Component
@ConditionalOnProperty(name = "team-invite.queue.transport", havingValue = "local", matchIfMissing = true)
public class LocalInviteTaskPublisher implements InviteTaskPublisher, DisposableBean {

    private static final Logger logger = LoggerFactory.getLogger(LocalInviteTaskPublisher.class);

    private final InviteTaskChannel channel;
    private final ScheduledExecutorService delayScheduler;

    public LocalInviteTaskPublisher(InviteTaskChannel channel) {
        this.channel = channel;
        this.delayScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "invite-task-delay");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void publish(InviteTaskMessage message) {
        if (message.getMessageId() == null) {
            message.setMessageId(UUID.randomUUID().toString());
        }
        if (!channel.offer(message)) {
            throw new TaskPublishException("Invite task channel is full, dropped " + message.getType());
        }
        logger.debug("Queued {} locally, messageId={}", message.getType(), message.getMessageId());
    }

    @Override
    public void publish(InviteTaskMessage message, Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            publish(message);
            return;
        }
        delayScheduler.schedule(() -> {
            try {
                publish(message);
            } catch (TaskPublishException e) {
                logger.error("Delayed {} could not be queued: {}", message.getType(), e.getMessage());
            }
        }, delay.toMillis(), TimeUnit.MILLISECONDS);
        logger.debug("Scheduled {} in {}", message.getType(), delay);
    }

    @Override
    public void destroy() {
        delayScheduler.shutdownNow();
    }
}
