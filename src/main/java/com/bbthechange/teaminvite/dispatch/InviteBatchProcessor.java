package com.bbthechange.teaminvite.dispatch;

import com.bbthechange.teaminvite.client.TeamMembershipClient;
import com.bbthechange.teaminvite.config.TeamInviteProperties;
import com.bbthechange.teaminvite.dto.AllocationResult;
import com.bbthechange.teaminvite.dto.MembershipResult;
import com.bbthechange.teaminvite.dto.ReservationRequest;
import com.bbthechange.teaminvite.dto.SeatCapacity;
import com.bbthechange.teaminvite.dto.queue.DispatchInviteTask;
import com.bbthechange.teaminvite.dto.queue.InviteRequestTask;
import com.bbthechange.teaminvite.dto.queue.InviteTaskMessage;
import com.bbthechange.teaminvite.dto.queue.ReconcileQueueTask;
import com.bbthechange.teaminvite.dto.queue.ReserveSeatTask;
import com.bbthechange.teaminvite.exception.LockConflictException;
import com.bbthechange.teaminvite.exception.TaskPublishException;
import com.bbthechange.teaminvite.exception.TerminalExternalFailureException;
import com.bbthechange.teaminvite.model.InviteRecord;
import com.bbthechange.teaminvite.model.InviteStatus;
import com.bbthechange.teaminvite.model.Team;
import com.bbthechange.teaminvite.model.WaitingTaskStatus;
import com.bbthechange.teaminvite.repository.InviteRecordRepository;
import com.bbthechange.teaminvite.repository.SeatTransaction;
import com.bbthechange.teaminvite.repository.SeatTransactionManager;
import com.bbthechange.teaminvite.repository.TeamMemberRepository;
import com.bbthechange.teaminvite.repository.TeamRepository;
import com.bbthechange.teaminvite.service.BatchAllocator;
import com.bbthechange.teaminvite.service.InviteFailureHandler;
import com.bbthechange.teaminvite.service.SeatLedgerService;
import com.bbthechange.teaminvite.service.SeatReservationService;
import com.bbthechange.teaminvite.service.WaitingQueueReconciler;
import com.bbthechange.teaminvite.service.WaitingQueueService;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Processes one batch of invite task messages.
 *
 * <p>Messages whose seat was reserved on the request path are dispatched per team right away.
 * The rest are grouped by seat group, allocated over an unlocked capacity snapshot, then
 * re-validated team by team under the team lock before a single membership call per team.
 * Requests that find no seat are parked in the waiting queue. Once the soft deadline passes,
 * work not yet started is requeued.</p>
 */
@Component
public class InviteBatchProcessor {

    private static final Logger logger = LoggerFactory.getLogger(InviteBatchProcessor.class);

    static final String NO_SEATS = "no seats available";
    static final String CAPACITY_EXHAUSTED = "capacity exhausted";
    static final String LOCK_CONFLICT = "lock conflict";

    private final SeatLedgerService ledgerService;
    private final BatchAllocator allocator;
    private final SeatReservationService reservationService;
    private final SeatTransactionManager transactionManager;
    private final TeamRepository teamRepository;
    private final TeamMemberRepository memberRepository;
    private final InviteRecordRepository inviteRepository;
    private final TeamMembershipClient membershipClient;
    private final InviteFailureHandler failureHandler;
    private final WaitingQueueService waitingQueueService;
    private final WaitingQueueReconciler reconciler;
    private final InviteTaskPublisher publisher;
    private final TeamInviteProperties properties;
    private final MeterRegistry meterRegistry;

    public InviteBatchProcessor(SeatLedgerService ledgerService,
                                BatchAllocator allocator,
                                SeatReservationService reservationService,
                                SeatTransactionManager transactionManager,
                                TeamRepository teamRepository,
                                TeamMemberRepository memberRepository,
                                InviteRecordRepository inviteRepository,
                                TeamMembershipClient membershipClient,
                                InviteFailureHandler failureHandler,
                                WaitingQueueService waitingQueueService,
                                WaitingQueueReconciler reconciler,
                                InviteTaskPublisher publisher,
                                TeamInviteProperties properties,
                                MeterRegistry meterRegistry) {
        this.ledgerService = ledgerService;
        this.allocator = allocator;
        this.reservationService = reservationService;
        this.transactionManager = transactionManager;
        this.teamRepository = teamRepository;
        this.memberRepository = memberRepository;
        this.inviteRepository = inviteRepository;
        this.membershipClient = membershipClient;
        this.failureHandler = failureHandler;
        this.waitingQueueService = waitingQueueService;
        this.reconciler = reconciler;
        this.publisher = publisher;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    public void process(List<InviteTaskMessage> batch, TaskDeadline deadline, BatchProgress progress) {
        Map<Long, List<DispatchInviteTask>> byTeam = new TreeMap<>();
        Map<Long, List<ReserveSeatTask>> byGroup = new LinkedHashMap<>();
        boolean reconcile = false;

        for (InviteTaskMessage message : batch) {
            if (message instanceof DispatchInviteTask) {
                DispatchInviteTask dispatch = (DispatchInviteTask) message;
                byTeam.computeIfAbsent(dispatch.getTeamId(), id -> new ArrayList<>()).add(dispatch);
            } else if (message instanceof ReserveSeatTask) {
                ReserveSeatTask reserve = (ReserveSeatTask) message;
                byGroup.computeIfAbsent(reserve.getGroupId(), id -> new ArrayList<>()).add(reserve);
            } else if (message instanceof ReconcileQueueTask) {
                reconcile |= progress.settle(message);
            } else {
                logger.warn("Unknown invite task message type: {}", message.getType());
                progress.settle(message);
            }
        }

        logger.info("Processing batch of {} messages: {} teams with reserved seats, {} groups to allocate",
                batch.size(), byTeam.size(), byGroup.size());

        byTeam.forEach((teamId, tasks) -> dispatchReserved(teamId, tasks, deadline, progress));
        byGroup.forEach((groupId, tasks) -> allocateAndDispatch(groupId, tasks, deadline, progress));

        if (reconcile && !progress.isAbandoned()) {
            reconciler.reconcile();
        }
    }

    /**
     * Settle every message the processing thread did not, after the batch hit its hard time limit.
     */
    public void abandonUnsettled(List<InviteTaskMessage> batch, BatchProgress progress, String reason) {
        progress.abandon();
        for (InviteTaskMessage message : batch) {
            if (!(message instanceof InviteRequestTask) || !progress.settle(message)) {
                continue;
            }
            InviteRequestTask task = (InviteRequestTask) message;
            Optional<InviteRecord> reservation = progress.takeReservation(task.getRequestId());
            if (reservation.isPresent()) {
                failReservation(reservation.get().getTeamId(), reservation.get().getInviteId(), reason);
            } else if (task instanceof DispatchInviteTask) {
                DispatchInviteTask dispatch = (DispatchInviteTask) task;
                failReservation(dispatch.getTeamId(), dispatch.getInviteId(), reason);
            }
            failureHandler.handleTransientFailure(task, reason);
            count(task, "timed_out");
        }
    }

    private void dispatchReserved(Long teamId, List<DispatchInviteTask> tasks, TaskDeadline deadline, BatchProgress progress) {
        if (isStopping(deadline, progress)) {
            requeue(tasks, progress);
            return;
        }

        Optional<Team> team = teamRepository.findById(teamId);
        List<PendingInvite> pending = new ArrayList<>();
        for (DispatchInviteTask task : tasks) {
            Optional<InviteRecord> record = inviteRepository.findById(teamId, task.getInviteId());
            if (record.isEmpty() || record.get().getStatus() != InviteStatus.RESERVED) {
                // released by cleanup in the meantime; a retry reserves again
                if (progress.settle(task)) {
                    failureHandler.handleTransientFailure(task, "reservation no longer held");
                    count(task, "retry");
                }
                continue;
            }
            progress.reserved(record.get());
            pending.add(new PendingInvite(task, record.get()));
        }

        if (team.isEmpty() || !team.get().isHealthy()) {
            logger.warn("Team {} is unavailable, releasing {} reserved seats", teamId, pending.size());
            pending.forEach(invite -> failTransient(invite, "team unavailable", progress));
            return;
        }
        invite(team.get(), pending, progress);
    }

    private void allocateAndDispatch(Long groupId, List<ReserveSeatTask> tasks, TaskDeadline deadline, BatchProgress progress) {
        if (isStopping(deadline, progress)) {
            requeue(tasks, progress);
            return;
        }

        List<SeatCapacity> capacities = ledgerService.listCapacities(groupId, true);
        AllocationResult<ReserveSeatTask> allocation = allocator.allocate(tasks, capacities);
        String unallocatedReason = allocation.getTotalAvailable() == 0 ? NO_SEATS : CAPACITY_EXHAUSTED;
        allocation.getUnallocated().forEach(task -> park(task, unallocatedReason, progress));

        logger.info("Group {}: allocated {}/{} requests over {} teams ({} seats free)", groupId,
                allocation.getAllocatedCount(), tasks.size(), allocation.getAllocated().size(),
                allocation.getTotalAvailable());

        for (Map.Entry<Long, List<ReserveSeatTask>> entry : new TreeMap<>(allocation.getAllocated()).entrySet()) {
            Long teamId = entry.getKey();
            List<ReserveSeatTask> assigned = entry.getValue();
            if (isStopping(deadline, progress)) {
                requeue(assigned, progress);
                continue;
            }

            Optional<Team> team = teamRepository.findById(teamId);
            if (team.isEmpty()) {
                assigned.forEach(task -> park(task, CAPACITY_EXHAUSTED, progress));
                continue;
            }

            Optional<List<InviteRecord>> staged = reserveOnTeam(teamId, assigned);
            if (staged.isEmpty()) {
                assigned.forEach(task -> park(task, LOCK_CONFLICT, progress));
                continue;
            }

            List<InviteRecord> records = staged.get();
            List<PendingInvite> pending = new ArrayList<>(records.size());
            for (int i = 0; i < assigned.size(); i++) {
                if (i < records.size()) {
                    progress.reserved(records.get(i));
                    pending.add(new PendingInvite(assigned.get(i), records.get(i)));
                } else {
                    park(assigned.get(i), CAPACITY_EXHAUSTED, progress);
                }
            }
            invite(team.get(), pending, progress);
        }
    }

    /**
     * @return the committed reservations, or empty when every attempt hit a lock conflict
     */
    private Optional<List<InviteRecord>> reserveOnTeam(Long teamId, List<ReserveSeatTask> tasks) {
        List<ReservationRequest> requests = tasks.stream()
                .map(InviteRequestTask::toReservationRequest)
                .collect(Collectors.toList());
        int maxAttempts = properties.getReservation().getLockConflictRetries() + 1;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try (SeatTransaction tx = transactionManager.begin()) {
                List<InviteRecord> staged = reservationService.reserveOnTeam(tx, teamId, requests);
                tx.commit();
                if (!staged.isEmpty()) {
                    ledgerService.evictSummaries();
                }
                return Optional.of(staged);
            } catch (LockConflictException e) {
                logger.debug("Lock conflict reserving on team {} (attempt {}/{})", teamId, attempt, maxAttempts);
            }
        }
        logger.warn("Gave up reserving {} seats on team {} after {} lock conflicts", tasks.size(), teamId, maxAttempts);
        return Optional.empty();
    }

    private void invite(Team team, List<PendingInvite> pending, BatchProgress progress) {
        if (pending.isEmpty()) {
            return;
        }
        List<String> identities = pending.stream()
                .map(invite -> invite.task.getIdentity())
                .collect(Collectors.toList());

        try {
            List<MembershipResult> results = membershipClient.invite(team, identities);
            Map<String, MembershipResult> byIdentity = new HashMap<>();
            results.forEach(result -> byIdentity.put(result.getIdentity(), result));
            for (PendingInvite invite : pending) {
                MembershipResult result = byIdentity.get(invite.task.getIdentity());
                apply(team, invite, result != null ? result
                        : MembershipResult.transientFailure(invite.task.getIdentity(), "no result for identity"), progress);
            }
        } catch (TerminalExternalFailureException e) {
            logger.error("Team {} refused the invite batch: {}", team.getTeamId(), e.getMessage());
            pending.forEach(invite -> failTerminal(invite, e.getMessage(), progress));
        } catch (RuntimeException e) {
            logger.warn("Batch invite to team {} failed, falling back to one call per identity: {}",
                    team.getTeamId(), e.getMessage());
            inviteSerially(team, pending, progress);
        }
    }

    private void inviteSerially(Team team, List<PendingInvite> pending, BatchProgress progress) {
        int maxAttempts = Math.max(1, properties.getDispatch().getLocalRetries());
        Duration delay = properties.getDispatch().getLocalRetryDelay();

        for (PendingInvite invite : pending) {
            if (progress.isAbandoned()) {
                return;
            }
            String lastError = null;
            boolean done = false;
            for (int attempt = 1; attempt <= maxAttempts && !done; attempt++) {
                try {
                    List<MembershipResult> results = membershipClient.invite(team, List.of(invite.task.getIdentity()));
                    apply(team, invite, results.isEmpty()
                            ? MembershipResult.transientFailure(invite.task.getIdentity(), "no result for identity")
                            : results.get(0), progress);
                    done = true;
                } catch (TerminalExternalFailureException e) {
                    failTerminal(invite, e.getMessage(), progress);
                    done = true;
                } catch (RuntimeException e) {
                    lastError = e.getMessage();
                    if (attempt < maxAttempts) {
                        sleep(delay);
                    }
                }
            }
            if (!done) {
                failTransient(invite, lastError, progress);
            }
        }
    }

    private void apply(Team team, PendingInvite invite, MembershipResult result, BatchProgress progress) {
        switch (result.getOutcome()) {
            case INVITED -> succeed(team, invite, progress);
            case TRANSIENT_FAILURE -> failTransient(invite, result.getMessage(), progress);
            case TERMINAL_FAILURE -> failTerminal(invite, result.getMessage(), progress);
        }
    }

    private void succeed(Team team, PendingInvite invite, BatchProgress progress) {
        InviteRequestTask task = invite.task;
        if (!progress.settle(task)) {
            return;
        }
        progress.takeReservation(task.getRequestId());

        if (!inviteRepository.transitionStatus(team.getTeamId(), invite.record.getInviteId(),
                InviteStatus.RESERVED, InviteStatus.SUCCESS, null)) {
            logger.warn("Invite {} for {} was no longer RESERVED when the membership call succeeded",
                    invite.record.getInviteId(), task.getIdentity());
        }
        waitingQueueService.complete(task.getWaitingTaskId(), WaitingTaskStatus.SUCCESS, null);

        if (task.isRebind() && task.getOldTeamId() != null && !task.getOldTeamId().equals(team.getTeamId())) {
            releaseOldSeat(task.getIdentity(), task.getOldTeamId());
        }
        logger.info("Invited {} to team {} (request {})", task.getIdentity(), team.getTeamId(), task.getRequestId());
        count(task, "invited");
    }

    private void failTransient(PendingInvite invite, String error, BatchProgress progress) {
        if (!progress.settle(invite.task)) {
            return;
        }
        progress.takeReservation(invite.task.getRequestId());
        failReservation(invite.record.getTeamId(), invite.record.getInviteId(), error);
        failureHandler.handleTransientFailure(invite.task, error);
        count(invite.task, "transient_failure");
    }

    private void failTerminal(PendingInvite invite, String error, BatchProgress progress) {
        if (!progress.settle(invite.task)) {
            return;
        }
        progress.takeReservation(invite.task.getRequestId());
        failReservation(invite.record.getTeamId(), invite.record.getInviteId(), error);
        failureHandler.handleTerminalFailure(invite.task, error);
        count(invite.task, "terminal_failure");
    }

    private void failReservation(Long teamId, String inviteId, String error) {
        inviteRepository.transitionStatus(teamId, inviteId, InviteStatus.RESERVED, InviteStatus.FAILED, error);
    }

    private void park(ReserveSeatTask task, String reason, BatchProgress progress) {
        if (!progress.settle(task)) {
            return;
        }
        waitingQueueService.park(task.toReservationRequest(), task.getWaitingTaskId(), task.getOldTeamId(), reason);
        count(task, "parked");
    }

    private void requeue(List<? extends InviteRequestTask> tasks, BatchProgress progress) {
        for (InviteRequestTask task : tasks) {
            if (!progress.settle(task)) {
                continue;
            }
            InviteTaskMessage next = task instanceof DispatchInviteTask ? task : ReserveSeatTask.requeueOf(task);
            try {
                publisher.publish(next);
                count(task, "requeued");
            } catch (TaskPublishException e) {
                logger.error("Could not requeue request {} after soft deadline", task.getRequestId(), e);
                if (task instanceof DispatchInviteTask) {
                    DispatchInviteTask dispatch = (DispatchInviteTask) task;
                    failReservation(dispatch.getTeamId(), dispatch.getInviteId(), "requeue failed");
                    failureHandler.handleTransientFailure(task, "requeue failed");
                } else {
                    waitingQueueService.park(task.toReservationRequest(), task.getWaitingTaskId(),
                            task.getOldTeamId(), "requeue failed");
                }
            }
        }
    }

    /**
     * Drop the identity's old seat after a rebind. Failures leave the old seat held.
     */
    private void releaseOldSeat(String identity, Long oldTeamId) {
        Optional<Team> oldTeam = teamRepository.findById(oldTeamId);
        if (oldTeam.isEmpty()) {
            return;
        }
        try {
            if (!membershipClient.remove(oldTeam.get(), identity)) {
                return;
            }
        } catch (RuntimeException e) {
            logger.warn("Could not remove {} from old team {} after rebind: {}", identity, oldTeamId, e.getMessage());
            return;
        }

        memberRepository.delete(oldTeamId, identity);
        for (InviteRecord record : inviteRepository.findByTeamId(oldTeamId)) {
            if (identity.equals(record.getIdentity()) && record.getStatus() == InviteStatus.SUCCESS) {
                inviteRepository.transitionStatus(oldTeamId, record.getInviteId(),
                        InviteStatus.SUCCESS, InviteStatus.REMOVED, "rebound to another team");
            }
        }
        ledgerService.evictSummaries();
        logger.info("Released old seat of {} on team {}", identity, oldTeamId);
    }

    private static boolean isStopping(TaskDeadline deadline, BatchProgress progress) {
        return deadline.isExpired() || progress.isAbandoned();
    }

    private void count(InviteRequestTask task, String outcome) {
        meterRegistry.counter("team_invite_dispatch_total", "type", task.getType(), "outcome", outcome).increment();
    }

    /**
     * Package-private for testing.
     */
    void sleep(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class PendingInvite {
        private final InviteRequestTask task;
        private final InviteRecord record;

        private PendingInvite(InviteRequestTask task, InviteRecord record) {
            this.task = task;
            this.record = record;
        }
    }
}
