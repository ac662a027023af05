package com.bbthechange.teaminvite.service.impl;

import com.bbthechange.teaminvite.dispatch.InviteTaskPublisher;
import com.bbthechange.teaminvite.dto.InviteHandle;
import com.bbthechange.teaminvite.dto.ReservationRequest;
import com.bbthechange.teaminvite.dto.ReservationResult;
import com.bbthechange.teaminvite.dto.SeatSummary;
import com.bbthechange.teaminvite.dto.queue.DispatchInviteTask;
import com.bbthechange.teaminvite.exception.LockConflictException;
import com.bbthechange.teaminvite.exception.RedeemCodeRejectedException;
import com.bbthechange.teaminvite.exception.TaskPublishException;
import com.bbthechange.teaminvite.model.InviteStatus;
import com.bbthechange.teaminvite.model.RedeemCode;
import com.bbthechange.teaminvite.model.WaitingTask;
import com.bbthechange.teaminvite.model.WaitingTaskStatus;
import com.bbthechange.teaminvite.repository.InviteRecordRepository;
import com.bbthechange.teaminvite.repository.RedeemCodeRepository;
import com.bbthechange.teaminvite.service.InviteDispatchService;
import com.bbthechange.teaminvite.service.QuotaCompensationService;
import com.bbthechange.teaminvite.service.SeatLedgerService;
import com.bbthechange.teaminvite.service.SeatReservationService;
import com.bbthechange.teaminvite.service.WaitingQueueService;
import com.bbthechange.teaminvite.service.throttle.RateLimitingService;
import com.bbthechange.teaminvite.service.throttle.RedeemTokenBucket;
import com.bbthechange.teaminvite.service.throttle.RedemptionSemaphore;
import com.bbthechange.teaminvite.util.TeamInviteKeyFactory;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Service
public class InviteDispatchServiceImpl implements InviteDispatchService {

    private static final Logger logger = LoggerFactory.getLogger(InviteDispatchServiceImpl.class);

    private final RateLimitingService rateLimitingService;
    private final RedemptionSemaphore semaphore;
    private final RedeemTokenBucket tokenBucket;
    private final RedeemCodeRepository codeRepository;
    private final InviteRecordRepository inviteRepository;
    private final SeatReservationService reservationService;
    private final SeatLedgerService ledgerService;
    private final WaitingQueueService waitingQueueService;
    private final QuotaCompensationService compensationService;
    private final InviteTaskPublisher publisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public InviteDispatchServiceImpl(RateLimitingService rateLimitingService,
                                     RedemptionSemaphore semaphore,
                                     RedeemTokenBucket tokenBucket,
                                     RedeemCodeRepository codeRepository,
                                     InviteRecordRepository inviteRepository,
                                     SeatReservationService reservationService,
                                     SeatLedgerService ledgerService,
                                     WaitingQueueService waitingQueueService,
                                     QuotaCompensationService compensationService,
                                     InviteTaskPublisher publisher,
                                     MeterRegistry meterRegistry,
                                     Clock clock) {
        this.rateLimitingService = rateLimitingService;
        this.semaphore = semaphore;
        this.tokenBucket = tokenBucket;
        this.codeRepository = codeRepository;
        this.inviteRepository = inviteRepository;
        this.reservationService = reservationService;
        this.ledgerService = ledgerService;
        this.waitingQueueService = waitingQueueService;
        this.compensationService = compensationService;
        this.publisher = publisher;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @Override
    public InviteHandle enqueueInvite(String identity, String code, Long groupId) {
        String normalized = TeamInviteKeyFactory.normalizeIdentity(identity);
        TeamInviteKeyFactory.validateCode(code);

        if (!rateLimitingService.isEnqueueAllowed(normalized)) {
            throw RedeemCodeRejectedException.rateLimited(code);
        }

        RedeemCode redeemCode = loadUsableCode(code, normalized);
        Long effectiveGroup = groupId != null ? groupId : redeemCode.getGroupId();

        // the same identity redeeming the same code again gets its existing place back
        Optional<WaitingTask> open = waitingQueueService.findOpen(normalized, code);
        if (open.isPresent()) {
            logger.info("{} already waiting with code {}, returning existing request {}",
                    normalized, code, open.get().getTaskId());
            return InviteHandle.waiting(open.get().getTaskId(), waitingQueueService.position(open.get()));
        }

        Optional<RedemptionSemaphore.Permit> permit = semaphore.acquire();
        if (permit.isEmpty()) {
            throw RedeemCodeRejectedException.busy(code);
        }
        try (RedemptionSemaphore.Permit held = permit.get()) {
            String requestId = UUID.randomUUID().toString();
            consumeUse(redeemCode, normalized);

            ReservationRequest request = ReservationRequest.builder()
                    .requestId(requestId)
                    .identity(normalized)
                    .groupId(effectiveGroup)
                    .redeemCode(code)
                    .build();
            return reserveOrPark(request);
        }
    }

    @Override
    public ReservationResult reserveSeat(ReservationRequest request) {
        return reservationService.reserveSeat(request);
    }

    @Override
    public SeatSummary getCapacity(Long groupId) {
        return ledgerService.summarize(groupId);
    }

    @Override
    public Map<WaitingTaskStatus, Long> getQueueDepth() {
        return waitingQueueService.depth();
    }

    private RedeemCode loadUsableCode(String code, String identity) {
        RedeemCode redeemCode = codeRepository.findByCode(code)
                .orElseThrow(() -> RedeemCodeRejectedException.notFound(code));
        Instant now = clock.instant();
        if (!Boolean.TRUE.equals(redeemCode.getActive())) {
            throw RedeemCodeRejectedException.inactive(code);
        }
        if (redeemCode.isExpiredAt(now)) {
            throw RedeemCodeRejectedException.expired(code);
        }
        if (redeemCode.getBoundIdentity() != null && !redeemCode.getBoundIdentity().equals(identity)) {
            throw RedeemCodeRejectedException.boundToOther(code);
        }
        return redeemCode;
    }

    /**
     * Take one use from the token bucket, then record it durably. A durable refusal returns the token.
     */
    private void consumeUse(RedeemCode redeemCode, String identity) {
        if (!tokenBucket.tryConsume(redeemCode)) {
            meterRegistry.counter("team_invite_enqueue_total", "status", "exhausted").increment();
            throw RedeemCodeRejectedException.exhausted(redeemCode.getCode());
        }
        if (!codeRepository.recordUse(redeemCode.getCode(), identity)) {
            tokenBucket.refund(redeemCode.getCode());
            meterRegistry.counter("team_invite_enqueue_total", "status", "exhausted").increment();
            throw RedeemCodeRejectedException.exhausted(redeemCode.getCode());
        }
    }

    private InviteHandle reserveOrPark(ReservationRequest request) {
        ReservationResult result;
        String parkReason = "no seats available";
        try {
            result = reservationService.reserveSeat(request);
        } catch (LockConflictException e) {
            result = ReservationResult.rejected();
            parkReason = "lock conflict";
        } catch (RuntimeException e) {
            releaseUse(request, "reservation failed", e);
            throw e;
        }

        if (!result.isOk()) {
            WaitingTask task;
            try {
                task = waitingQueueService.park(request, null, null, parkReason);
            } catch (RuntimeException e) {
                releaseUse(request, "could not park", e);
                throw e;
            }
            long position = waitingQueueService.position(task);
            meterRegistry.counter("team_invite_enqueue_total", "status", "waiting").increment();
            logger.info("No seat for {} (request {}), waiting at position {}",
                    request.getIdentity(), request.getRequestId(), position);
            return InviteHandle.waiting(request.getRequestId(), position);
        }

        DispatchInviteTask task = new DispatchInviteTask();
        task.setRequestId(request.getRequestId());
        task.setIdentity(request.getIdentity());
        task.setGroupId(request.getGroupId());
        task.setRedeemCode(request.getRedeemCode());
        task.setTeamId(result.getTeamId());
        task.setInviteId(result.getInviteId());
        try {
            publisher.publish(task);
        } catch (TaskPublishException e) {
            logger.error("Could not queue invite for request {}, releasing seat on team {}",
                    request.getRequestId(), result.getTeamId(), e);
            inviteRepository.transitionStatus(result.getTeamId(), result.getInviteId(),
                    InviteStatus.RESERVED, InviteStatus.FAILED, "invite could not be queued");
            ledgerService.evictSummaries();
            compensationService.compensate(request.getRequestId(), request.getRedeemCode());
            meterRegistry.counter("team_invite_enqueue_total", "status", "publish_failed").increment();
            throw e;
        }

        meterRegistry.counter("team_invite_enqueue_total", "status", "queued").increment();
        logger.info("Reserved seat on team {} for {} (request {})",
                result.getTeamId(), request.getIdentity(), request.getRequestId());
        return InviteHandle.queued(request.getRequestId(), result.getTeamId());
    }

    /**
     * Give back the use taken by {@link #consumeUse} when the request ends with neither a seat nor a queue entry.
     */
    private void releaseUse(ReservationRequest request, String reason, RuntimeException cause) {
        logger.error("Request {} for {} {}, returning use of code {}",
                request.getRequestId(), request.getIdentity(), reason, request.getRedeemCode(), cause);
        try {
            compensationService.compensate(request.getRequestId(), request.getRedeemCode());
        } catch (RuntimeException refundFailure) {
            cause.addSuppressed(refundFailure);
        }
        meterRegistry.counter("team_invite_enqueue_total", "status", "error").increment();
    }
}
