package com.bbthechange.teaminvite.service;

import com.bbthechange.teaminvite.dto.InviteHandle;
import com.bbthechange.teaminvite.dto.ReservationRequest;
import com.bbthechange.teaminvite.dto.ReservationResult;
import com.bbthechange.teaminvite.dto.SeatSummary;
import com.bbthechange.teaminvite.model.WaitingTaskStatus;

import java.util.Map;

/**
 * Entry point of the seat dispatch core.
 */
public interface InviteDispatchService {

    /**
     * Redeem {@code code} for {@code identity}: throttle, consume one use, then reserve a seat
     * and queue the invite, or park the request in the waiting queue when no seat is free.
     *
     * @param groupId seat group to draw from; null falls back to the code's group
     * @throws com.bbthechange.teaminvite.exception.RedeemCodeRejectedException if the code cannot be used
     * @throws com.bbthechange.teaminvite.exception.TaskPublishException if the invite could not be queued
     */
    InviteHandle enqueueInvite(String identity, String code, Long groupId);

    /**
     * Reserve a seat without consuming a code or queueing an invite.
     */
    ReservationResult reserveSeat(ReservationRequest request);

    SeatSummary getCapacity(Long groupId);

    Map<WaitingTaskStatus, Long> getQueueDepth();
}
