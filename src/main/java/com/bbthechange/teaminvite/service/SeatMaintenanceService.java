package com.bbthechange.teaminvite.service;

import com.bbthechange.teaminvite.config.TeamInviteProperties;
import com.bbthechange.teaminvite.coordination.ExclusiveJobRunner;
import com.bbthechange.teaminvite.dispatch.InviteTaskPublisher;
import com.bbthechange.teaminvite.dto.queue.ReconcileQueueTask;
import com.bbthechange.teaminvite.exception.RepositoryException;
import com.bbthechange.teaminvite.exception.TaskPublishException;
import com.bbthechange.teaminvite.model.InviteRecord;
import com.bbthechange.teaminvite.model.InviteStatus;
import com.bbthechange.teaminvite.model.WaitingTask;
import com.bbthechange.teaminvite.model.WaitingTaskStatus;
import com.bbthechange.teaminvite.repository.InviteRecordRepository;
import com.bbthechange.teaminvite.repository.WaitingTaskRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Periodic housekeeping of the seat store: releases reservations that were never resolved,
 * returns waiting tasks stuck in PROCESSING to the queue and purges old finished tasks.
 */
@Service
public class SeatMaintenanceService {

    private static final Logger logger = LoggerFactory.getLogger(SeatMaintenanceService.class);
    static final String LOCK_NAME = "lock:seat-maintenance";
    static final String STALE_RESERVATION = "reservation expired";

    private final ExclusiveJobRunner jobRunner;
    private final InviteRecordRepository inviteRepository;
    private final WaitingTaskRepository taskRepository;
    private final QuotaCompensationService compensationService;
    private final SeatLedgerService ledgerService;
    private final InviteTaskPublisher publisher;
    private final TeamInviteProperties.Reconciler settings;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public SeatMaintenanceService(ExclusiveJobRunner jobRunner,
                                  InviteRecordRepository inviteRepository,
                                  WaitingTaskRepository taskRepository,
                                  QuotaCompensationService compensationService,
                                  SeatLedgerService ledgerService,
                                  InviteTaskPublisher publisher,
                                  TeamInviteProperties properties,
                                  MeterRegistry meterRegistry,
                                  Clock clock) {
        this.jobRunner = jobRunner;
        this.inviteRepository = inviteRepository;
        this.taskRepository = taskRepository;
        this.compensationService = compensationService;
        this.ledgerService = ledgerService;
        this.publisher = publisher;
        this.settings = properties.getReconciler();
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${team-invite.reconciler.maintenance-interval:PT10M}", initialDelayString = "PT1M")
    public void scheduledMaintenance() {
        if (!settings.isEnabled()) {
            return;
        }
        try {
            jobRunner.runExclusively(LOCK_NAME, settings.getLockTtl(), () -> {
                releaseStaleReservations();
                requeueStuckTasks();
                purgeFinishedTasks();
                return null;
            });
            meterRegistry.counter("team_invite_maintenance_total", "status", "success").increment();
        } catch (Exception e) {
            logger.error("Error during seat maintenance", e);
            meterRegistry.counter("team_invite_maintenance_total", "status", "error").increment();
        }
    }

    /**
     * Fail RESERVED invites older than the stale age, freeing their seats. The code use is
     * refunded unless the same request already succeeded elsewhere or is still waiting.
     *
     * @return number of reservations released
     */
    public int releaseStaleReservations() {
        Instant cutoff = clock.instant().minus(settings.getStaleReservationAge());
        List<InviteRecord> stale = inviteRepository.findByStatusCreatedBefore(InviteStatus.RESERVED, cutoff,
                settings.getBatchLimit());

        int released = 0;
        for (InviteRecord record : stale) {
            if (!inviteRepository.transitionStatus(record.getTeamId(), record.getInviteId(),
                    InviteStatus.RESERVED, InviteStatus.FAILED, STALE_RESERVATION)) {
                continue;
            }
            released++;
            logger.info("Released stale reservation {} of {} on team {}",
                    record.getInviteId(), record.getIdentity(), record.getTeamId());
            if (isSettledElsewhere(record)) {
                continue;
            }
            compensationService.compensate(record.getRequestId(), record.getRedeemCode());
        }

        if (released > 0) {
            ledgerService.evictSummaries();
            meterRegistry.counter("team_invite_stale_reservations_total").increment(released);
            try {
                publisher.publish(new ReconcileQueueTask("stale reservations released"));
            } catch (TaskPublishException e) {
                logger.warn("Could not trigger reconciliation after releasing seats: {}", e.getMessage());
            }
        }
        return released;
    }

    private boolean isSettledElsewhere(InviteRecord record) {
        if (record.getRequestId() == null) {
            return true;
        }
        boolean succeeded = inviteRepository.findByRequestId(record.getRequestId()).stream()
                .anyMatch(other -> other.getStatus() == InviteStatus.SUCCESS);
        boolean stillWaiting = taskRepository.findById(record.getRequestId())
                .map(task -> !task.getStatus().isFinished())
                .orElse(false);
        return succeeded || stillWaiting;
    }

    /**
     * Return PROCESSING waiting tasks untouched for longer than the stale age to WAITING.
     * Their worker died or their message was lost.
     */
    public int requeueStuckTasks() {
        Instant cutoff = clock.instant().minus(settings.getStaleReservationAge());
        int requeued = 0;
        for (WaitingTask task : taskRepository.findByStatus(WaitingTaskStatus.PROCESSING, settings.getBatchLimit())) {
            if (task.getUpdatedAt() != null && task.getUpdatedAt().isAfter(cutoff)) {
                continue;
            }
            task.setStatus(WaitingTaskStatus.WAITING);
            task.setUpdatedAt(clock.instant());
            try {
                taskRepository.save(task);
                requeued++;
            } catch (RepositoryException e) {
                logger.debug("Waiting task {} changed concurrently, skipped", task.getTaskId());
            }
        }
        if (requeued > 0) {
            logger.warn("Returned {} stuck waiting tasks to the queue", requeued);
        }
        return requeued;
    }

    public int purgeFinishedTasks() {
        Instant cutoff = clock.instant().minus(settings.getFinishedTaskRetention());
        int deleted = taskRepository.deleteFinishedBefore(cutoff);
        if (deleted > 0) {
            logger.info("Purged {} finished waiting tasks older than {}", deleted, cutoff);
        }
        return deleted;
    }
}
