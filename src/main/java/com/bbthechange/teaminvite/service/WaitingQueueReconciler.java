package com.bbthechange.teaminvite.service;

import com.bbthechange.teaminvite.config.TeamInviteProperties;
import com.bbthechange.teaminvite.coordination.ExclusiveJobRunner;
import com.bbthechange.teaminvite.dispatch.InviteTaskPublisher;
import com.bbthechange.teaminvite.dto.queue.ReserveSeatTask;
import com.bbthechange.teaminvite.exception.RepositoryException;
import com.bbthechange.teaminvite.exception.TaskPublishException;
import com.bbthechange.teaminvite.model.RedeemCode;
import com.bbthechange.teaminvite.model.WaitingTask;
import com.bbthechange.teaminvite.model.WaitingTaskStatus;
import com.bbthechange.teaminvite.repository.RedeemCodeRepository;
import com.bbthechange.teaminvite.repository.WaitingTaskRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Promotes waiting tasks, oldest first, while their group (or, as a fallback, the ungrouped
 * teams) has free seats. At most one replica reconciles at a time.
 *
 * <p>Promotion marks a task PROCESSING and republishes it as a reservation request. Seats are
 * counted against a snapshot taken at the start of the pass; the workers re-check under lock,
 * so a promoted task that loses its seat simply returns to the queue.</p>
 */
@Service
public class WaitingQueueReconciler {

    private static final Logger logger = LoggerFactory.getLogger(WaitingQueueReconciler.class);
    static final String LOCK_NAME = "lock:waiting-queue";

    private final ExclusiveJobRunner jobRunner;
    private final SeatLedgerService ledgerService;
    private final WaitingTaskRepository taskRepository;
    private final RedeemCodeRepository codeRepository;
    private final QuotaCompensationService compensationService;
    private final InviteTaskPublisher publisher;
    private final TeamInviteProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public WaitingQueueReconciler(ExclusiveJobRunner jobRunner,
                                  SeatLedgerService ledgerService,
                                  WaitingTaskRepository taskRepository,
                                  RedeemCodeRepository codeRepository,
                                  QuotaCompensationService compensationService,
                                  InviteTaskPublisher publisher,
                                  TeamInviteProperties properties,
                                  MeterRegistry meterRegistry,
                                  Clock clock) {
        this.jobRunner = jobRunner;
        this.ledgerService = ledgerService;
        this.taskRepository = taskRepository;
        this.codeRepository = codeRepository;
        this.compensationService = compensationService;
        this.publisher = publisher;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${team-invite.reconciler.interval:PT30S}", initialDelayString = "PT10S")
    public void scheduledReconcile() {
        if (!properties.getReconciler().isEnabled()) {
            return;
        }
        try {
            reconcile();
        } catch (Exception e) {
            logger.error("Error during waiting queue reconciliation", e);
            meterRegistry.counter("team_invite_reconcile_total", "status", "error").increment();
        }
    }

    /**
     * Run one reconciliation pass if no other instance is running one.
     *
     * @return number of tasks promoted; 0 when the pass was skipped
     */
    public int reconcile() {
        return jobRunner.runExclusively(LOCK_NAME, properties.getReconciler().getLockTtl(), this::promoteWaiting)
                .orElse(0);
    }

    private int promoteWaiting() {
        Map<Long, Integer> available = new HashMap<>(ledgerService.availableByGroup());
        int totalAvailable = available.values().stream().mapToInt(Integer::intValue).sum();
        if (totalAvailable <= 0) {
            logger.debug("No free seats, waiting queue left as is");
            return 0;
        }

        List<WaitingTask> waiting = taskRepository.findByStatus(WaitingTaskStatus.WAITING,
                properties.getReconciler().getBatchLimit());
        int promoted = 0;
        for (WaitingTask task : waiting) {
            long group = task.getGroupId() == null ? SeatLedgerService.UNGROUPED : task.getGroupId();
            Long target = pickGroup(group, available);
            if (target == null) {
                continue;
            }
            if (!hasUsableCode(task)) {
                continue;
            }
            if (promote(task, target == group ? task.getGroupId() : target)) {
                available.merge(target, -1, Integer::sum);
                promoted++;
            }
        }

        logger.info("Waiting queue reconciliation: {} of {} waiting tasks promoted ({} seats were free)",
                promoted, waiting.size(), totalAvailable);
        meterRegistry.counter("team_invite_reconcile_total", "status", "success").increment();
        if (promoted > 0) {
            meterRegistry.counter("team_invite_waiting_promoted_total").increment(promoted);
        }
        return promoted;
    }

    private static Long pickGroup(long group, Map<Long, Integer> available) {
        if (available.getOrDefault(group, 0) > 0) {
            return group;
        }
        if (group != SeatLedgerService.UNGROUPED && available.getOrDefault(SeatLedgerService.UNGROUPED, 0) > 0) {
            return SeatLedgerService.UNGROUPED;
        }
        return null;
    }

    /**
     * Fails the task when its redeem code has gone away, been disabled or expired.
     */
    private boolean hasUsableCode(WaitingTask task) {
        if (task.getRedeemCode() == null) {
            return true;
        }
        Optional<RedeemCode> code = codeRepository.findByCode(task.getRedeemCode());
        String problem = null;
        if (code.isEmpty()) {
            problem = "redeem code no longer exists";
        } else if (!Boolean.TRUE.equals(code.get().getActive())) {
            problem = "redeem code disabled";
        } else if (code.get().isExpiredAt(clock.instant())) {
            problem = "redeem code expired";
        }
        if (problem == null) {
            return true;
        }

        task.setStatus(WaitingTaskStatus.FAILED);
        task.setErrorMessage(problem);
        task.setProcessedAt(clock.instant());
        task.setUpdatedAt(clock.instant());
        try {
            taskRepository.save(task);
            compensationService.compensate(task.getTaskId(), task.getRedeemCode());
            logger.info("Waiting task {} failed: {}", task.getTaskId(), problem);
        } catch (RepositoryException e) {
            logger.debug("Waiting task {} changed concurrently, skipped", task.getTaskId());
        }
        return false;
    }

    private boolean promote(WaitingTask task, Long publishGroupId) {
        task.setStatus(WaitingTaskStatus.PROCESSING);
        task.setRetryCount(task.getRetryCount() == null ? 1 : task.getRetryCount() + 1);
        task.setUpdatedAt(clock.instant());
        WaitingTask saved;
        try {
            saved = taskRepository.save(task);
        } catch (RepositoryException e) {
            logger.debug("Waiting task {} changed concurrently, skipped", task.getTaskId());
            return false;
        }

        ReserveSeatTask message = new ReserveSeatTask();
        message.setRequestId(saved.getTaskId());
        message.setWaitingTaskId(saved.getTaskId());
        message.setIdentity(saved.getIdentity());
        message.setGroupId(publishGroupId);
        message.setRedeemCode(saved.getRedeemCode());
        message.setRebind(Boolean.TRUE.equals(saved.getRebind()));
        message.setOldTeamId(saved.getOldTeamId());

        try {
            publisher.publish(message);
            logger.info("Promoted waiting task {} for {} (group {})", saved.getTaskId(), saved.getIdentity(), publishGroupId);
            return true;
        } catch (TaskPublishException e) {
            logger.error("Could not publish promoted task {}, returning it to the queue", saved.getTaskId(), e);
            saved.setStatus(WaitingTaskStatus.WAITING);
            saved.setUpdatedAt(clock.instant());
            try {
                taskRepository.save(saved);
            } catch (RepositoryException re) {
                logger.warn("Waiting task {} left PROCESSING after failed publish", saved.getTaskId());
            }
            return false;
        }
    }
}
