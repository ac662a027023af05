package com.bbthechange.teaminvite.dto.queue;

/**
 * An invite request that still needs a seat. Workers batch these through allocation.
 */
public class ReserveSeatTask extends InviteRequestTask {

    public static final String TYPE = "RESERVE_SEAT";

    public ReserveSeatTask() {
        super(TYPE);
    }

    /**
     * The same request, one attempt later. Any previous reservation is abandoned.
     */
    public static ReserveSeatTask retryOf(InviteRequestTask task) {
        ReserveSeatTask retry = new ReserveSeatTask();
        retry.copyRequestFields(task);
        retry.setAttempt(task.getAttempt() + 1);
        return retry;
    }

    /**
     * The same request at the same attempt, for requeueing work that was never started.
     */
    public static ReserveSeatTask requeueOf(InviteRequestTask task) {
        ReserveSeatTask requeued = new ReserveSeatTask();
        requeued.copyRequestFields(task);
        return requeued;
    }
}
