package com.bbthechange.teaminvite.dto;

public enum InviteState {
    /** A seat is reserved and the invite is queued for dispatch. */
    INVITE_QUEUED,
    /** No seat was free; the request sits in the waiting queue. */
    WAITING_FOR_SEAT
}
