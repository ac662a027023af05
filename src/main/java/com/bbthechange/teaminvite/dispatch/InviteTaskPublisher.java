package com.bbthechange.teaminvite.dispatch;

import com.bbthechange.teaminvite.dto.queue.InviteTaskMessage;

import java.time.Duration;

/**
 * Puts invite task messages on the work queue.
 */
public interface InviteTaskPublisher {

    /**
     * @throws com.bbthechange.teaminvite.exception.TaskPublishException if the message was not accepted
     */
    void publish(InviteTaskMessage message);

    /**
     * Publish after {@code delay}. A zero delay publishes immediately.
     *
     * @throws com.bbthechange.teaminvite.exception.TaskPublishException if the message was not accepted
     */
    void publish(InviteTaskMessage message, Duration delay);
}
