package com.bbthechange.teaminvite.dto.queue;

/**
 * Asks a worker to run a waiting-queue reconciliation pass now, e.g. after seats were freed.
 */
public class ReconcileQueueTask extends InviteTaskMessage {

    public static final String TYPE = "RECONCILE_QUEUE";

    private String reason;

    public ReconcileQueueTask() {
        super(TYPE);
    }

    public ReconcileQueueTask(String reason) {
        super(TYPE);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }
}
