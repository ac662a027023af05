package com.bbthechange.teaminvite.service;

import com.bbthechange.teaminvite.dispatch.InviteTaskPublisher;
import com.bbthechange.teaminvite.dto.queue.InviteRequestTask;
import com.bbthechange.teaminvite.dto.queue.ReserveSeatTask;
import com.bbthechange.teaminvite.exception.TaskPublishException;
import com.bbthechange.teaminvite.model.WaitingTaskStatus;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Decides what happens to an invite request whose dispatch failed.
 *
 * <p>Transient failures are republished with backoff until the retry limit; after that, and for
 * terminal failures, the request is given up: its code use is refunded and its waiting task, if
 * any, is marked FAILED. The caller has already released the seat by failing the reservation.</p>
 */
@Service
public class InviteFailureHandler {

    private static final Logger logger = LoggerFactory.getLogger(InviteFailureHandler.class);

    private final InviteTaskRetryPolicy retryPolicy;
    private final InviteTaskPublisher publisher;
    private final QuotaCompensationService compensationService;
    private final WaitingQueueService waitingQueueService;
    private final MeterRegistry meterRegistry;

    public InviteFailureHandler(InviteTaskRetryPolicy retryPolicy,
                                InviteTaskPublisher publisher,
                                QuotaCompensationService compensationService,
                                WaitingQueueService waitingQueueService,
                                MeterRegistry meterRegistry) {
        this.retryPolicy = retryPolicy;
        this.publisher = publisher;
        this.compensationService = compensationService;
        this.waitingQueueService = waitingQueueService;
        this.meterRegistry = meterRegistry;
    }

    public void handleTransientFailure(InviteRequestTask task, String error) {
        RetryDecision decision = retryPolicy.decide(task.getAttempt());
        if (!decision.isRetry()) {
            logger.error("Invite request {} for {} failed after {} retries: {}",
                    task.getRequestId(), task.getIdentity(), task.getAttempt(), error);
            giveUp(task, error);
            return;
        }

        try {
            publisher.publish(ReserveSeatTask.retryOf(task), decision.getDelay());
            logger.warn("Invite request {} for {} failed ({}), retry {} in {}",
                    task.getRequestId(), task.getIdentity(), error, task.getAttempt() + 1, decision.getDelay());
            meterRegistry.counter("team_invite_failure_total", "outcome", "retry").increment();
        } catch (TaskPublishException e) {
            logger.error("Could not schedule retry for invite request {}", task.getRequestId(), e);
            giveUp(task, error + "; retry not scheduled: " + e.getMessage());
        }
    }

    public void handleTerminalFailure(InviteRequestTask task, String error) {
        logger.error("Invite request {} for {} failed permanently: {}", task.getRequestId(), task.getIdentity(), error);
        giveUp(task, error);
    }

    private void giveUp(InviteRequestTask task, String error) {
        compensationService.compensate(task.getRequestId(), task.getRedeemCode());
        waitingQueueService.complete(task.getWaitingTaskId(), WaitingTaskStatus.FAILED, error);
        meterRegistry.counter("team_invite_failure_total", "outcome", "gave_up").increment();
    }
}
