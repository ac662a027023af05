package com.bbthechange.teaminvite.dispatch;

import com.bbthechange.teaminvite.dto.queue.InviteTaskMessage;
import com.bbthechange.teaminvite.model.InviteRecord;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Shared between a dispatch worker and the thread processing its batch.
 *
 * <p>Each message is settled exactly once: whichever side claims it first owns its outcome.
 * Reservations committed for a request stay open until that request is settled, so a batch cut
 * off by the hard time limit can release them.</p>
 */
public class BatchProgress {

    private final Set<String> settledMessageIds = ConcurrentHashMap.newKeySet();
    private final Map<String, InviteRecord> openReservations = new ConcurrentHashMap<>();
    private volatile boolean abandoned;

    /**
     * Claim the right to settle {@code message}.
     *
     * @return false if it was already settled
     */
    public boolean settle(InviteTaskMessage message) {
        return settledMessageIds.add(message.getMessageId());
    }

    public boolean isSettled(InviteTaskMessage message) {
        return settledMessageIds.contains(message.getMessageId());
    }

    public void reserved(InviteRecord record) {
        openReservations.put(record.getRequestId(), record);
    }

    public Optional<InviteRecord> takeReservation(String requestId) {
        return Optional.ofNullable(openReservations.remove(requestId));
    }

    /**
     * Tell the processing thread to stop starting new work.
     */
    public void abandon() {
        abandoned = true;
    }

    public boolean isAbandoned() {
        return abandoned;
    }
}
