package com.bbthechange.teaminvite.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Returned to callers of invite enqueueing.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class InviteHandle {
    private String requestId;
    private InviteState state;
    /** Reserved team; null while waiting. */
    private Long teamId;
    /** 1-based FIFO position; null once a seat is reserved. */
    private Long queuePosition;

    public static InviteHandle queued(String requestId, Long teamId) {
        return new InviteHandle(requestId, InviteState.INVITE_QUEUED, teamId, null);
    }

    public static InviteHandle waiting(String requestId, long queuePosition) {
        return new InviteHandle(requestId, InviteState.WAITING_FOR_SEAT, null, queuePosition);
    }
}
