package com.bbthechange.teaminvite.service;

import com.bbthechange.teaminvite.config.TeamInviteProperties;
import com.bbthechange.teaminvite.dto.ReservationRequest;
import com.bbthechange.teaminvite.dto.ReservationResult;
import com.bbthechange.teaminvite.dto.SeatCapacity;
import com.bbthechange.teaminvite.exception.LockConflictException;
import com.bbthechange.teaminvite.model.InviteRecord;
import com.bbthechange.teaminvite.model.InviteStatus;
import com.bbthechange.teaminvite.repository.SeatTransaction;
import com.bbthechange.teaminvite.repository.SeatTransactionManager;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Reservation coordinator: claims seats under team locks.
 *
 * <p>Every reservation follows lock, recheck, then reserve or reject. Candidate teams are
 * picked from an unlocked capacity snapshot, locked in ascending id order, and their capacity
 * is recomputed inside the lock before a RESERVED invite is staged. The staged invite becomes
 * durable only when the owning transaction commits.</p>
 */
@Service
public class SeatReservationService {

    private static final Logger logger = LoggerFactory.getLogger(SeatReservationService.class);

    private final SeatTransactionManager transactionManager;
    private final SeatLedgerService ledgerService;
    private final TeamInviteProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public SeatReservationService(SeatTransactionManager transactionManager,
                                  SeatLedgerService ledgerService,
                                  TeamInviteProperties properties,
                                  MeterRegistry meterRegistry,
                                  Clock clock) {
        this.transactionManager = transactionManager;
        this.ledgerService = ledgerService;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Stage one reservation inside a caller-owned transaction. The caller commits or rolls back.
     *
     * @return the reserved team, or {@link ReservationResult#rejected()} when no seat is free
     */
    public ReservationResult reserve(SeatTransaction tx, ReservationRequest request) {
        List<Long> candidates = ledgerService.listCapacities(request.getGroupId(), true).stream()
                .filter(SeatCapacity::hasAvailableSeats)
                .map(SeatCapacity::getTeamId)
                .sorted()
                .collect(Collectors.toList());
        if (candidates.isEmpty()) {
            logger.debug("No candidate teams for request {} in group {}", request.getRequestId(), request.getGroupId());
            return ReservationResult.rejected();
        }

        tx.lockTeams(candidates);
        for (Long teamId : candidates) {
            SeatCapacity locked = ledgerService.computeCapacity(tx.readState(teamId, ledgerService.pendingWindowStart()));
            if (locked.hasAvailableSeats()) {
                InviteRecord record = newReservation(teamId, request);
                tx.stageInvite(record);
                logger.debug("Staged reservation {} for {} on team {} ({} seats were free)",
                        record.getInviteId(), request.getIdentity(), teamId, locked.getAvailable());
                return ReservationResult.reserved(teamId, record.getInviteId());
            }
        }

        logger.info("All {} candidate teams filled up before request {} could reserve",
                candidates.size(), request.getRequestId());
        return ReservationResult.rejected();
    }

    /**
     * Reserve and commit in one call, retrying lock conflicts a bounded number of times.
     *
     * @throws LockConflictException when every attempt hit a conflict
     */
    public ReservationResult reserveSeat(ReservationRequest request) {
        int maxAttempts = properties.getReservation().getLockConflictRetries() + 1;
        LockConflictException lastConflict = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try (SeatTransaction tx = transactionManager.begin()) {
                ReservationResult result = reserve(tx, request);
                if (result.isOk()) {
                    tx.commit();
                    ledgerService.evictSummaries();
                    meterRegistry.counter("team_invite_reservation_total", "status", "reserved").increment();
                } else {
                    tx.rollback();
                    meterRegistry.counter("team_invite_reservation_total", "status", "rejected").increment();
                }
                return result;
            } catch (LockConflictException e) {
                lastConflict = e;
                meterRegistry.counter("team_invite_reservation_total", "status", "conflict").increment();
                logger.debug("Reservation for request {} hit a lock conflict (attempt {}/{})",
                        request.getRequestId(), attempt, maxAttempts);
            }
        }

        logger.warn("Reservation for request {} gave up after {} lock conflicts", request.getRequestId(), maxAttempts);
        throw lastConflict;
    }

    /**
     * Lock one team and stage as many of {@code requests} as it still has seats for, in order.
     * Used by the dispatch worker to re-validate an allocation made from a snapshot.
     *
     * @return the staged invites; requests beyond the team's free seats are left out
     */
    public List<InviteRecord> reserveOnTeam(SeatTransaction tx, Long teamId, List<ReservationRequest> requests) {
        tx.lockTeams(List.of(teamId));
        SeatCapacity locked = ledgerService.computeCapacity(tx.readState(teamId, ledgerService.pendingWindowStart()));

        List<InviteRecord> staged = new ArrayList<>();
        for (ReservationRequest request : requests) {
            if (staged.size() >= locked.getAvailable()) {
                break;
            }
            InviteRecord record = newReservation(teamId, request);
            tx.stageInvite(record);
            staged.add(record);
        }

        if (staged.size() < requests.size()) {
            logger.info("Team {} had {} seats left under lock for {} allocated requests",
                    teamId, locked.getAvailable(), requests.size());
        }
        return staged;
    }

    private InviteRecord newReservation(Long teamId, ReservationRequest request) {
        InviteRecord record = new InviteRecord(teamId, UUID.randomUUID().toString(),
                request.getIdentity(), InviteStatus.RESERVED, request.getRequestId());
        record.setRedeemCode(request.getRedeemCode());
        record.setRebind(request.isRebind());
        record.setCreatedAt(clock.instant());
        record.setUpdatedAt(record.getCreatedAt());
        return record;
    }
}
