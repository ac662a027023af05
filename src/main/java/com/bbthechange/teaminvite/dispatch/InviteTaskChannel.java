package com.bbthechange.teaminvite.dispatch;

import com.bbthechange.teaminvite.config.TeamInviteProperties;
import com.bbthechange.teaminvite.dto.queue.InviteTaskMessage;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded in-process hand-off between message transports and dispatch workers.
 */
@Component
public class InviteTaskChannel {

    private final BlockingQueue<InviteTaskMessage> queue;

    @Autowired
    public InviteTaskChannel(TeamInviteProperties properties) {
        this(properties.getDispatch().getChannelCapacity());
    }

    InviteTaskChannel(int capacity) {
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    /**
     * @return false if the channel is full
     */
    public boolean offer(InviteTaskMessage message) {
        return queue.offer(message);
    }

    /**
     * Blocks while the channel is full. Used by the SQS listener so back-pressure reaches the poller.
     */
    public void put(InviteTaskMessage message) throws InterruptedException {
        queue.put(message);
    }

    /**
     * Wait up to {@code maxWait} for the first message, then take whatever else is already
     * queued up to {@code maxSize}.
     *
     * @return an empty list if nothing arrived in time
     */
    public List<InviteTaskMessage> drainBatch(int maxSize, Duration maxWait) throws InterruptedException {
        List<InviteTaskMessage> batch = new ArrayList<>(maxSize);
        InviteTaskMessage first = queue.poll(maxWait.toMillis(), TimeUnit.MILLISECONDS);
        if (first == null) {
            return batch;
        }
        batch.add(first);
        queue.drainTo(batch, maxSize - 1);
        return batch;
    }

    public int size() {
        return queue.size();
    }
}
