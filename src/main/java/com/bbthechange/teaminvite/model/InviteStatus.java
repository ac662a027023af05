package com.bbthechange.teaminvite.model;

/**
 * Lifecycle of an invite record. Records are only ever moved between states, never deleted.
 */
public enum InviteStatus {
    RESERVED,   // seat claimed, external call not yet confirmed
    PENDING,
    SUCCESS,    // invitation delivered, awaiting acceptance
    FAILED,
    REMOVED;

    /**
     * Statuses that hold a seat while inside the pending lookback window.
     */
    public boolean holdsSeat() {
        return this == RESERVED || this == SUCCESS;
    }
}
