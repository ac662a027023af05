package com.bbthechange.teaminvite.repository;

import com.bbthechange.teaminvite.model.InviteRecord;
import com.bbthechange.teaminvite.model.InviteStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Invite records are written by seat transactions and moved between statuses here.
 * Nothing deletes them.
 */
public interface InviteRecordRepository {

    Optional<InviteRecord> findById(Long teamId, String inviteId);

    List<InviteRecord> findByTeamId(Long teamId);

    /**
     * Records of a team created at or after {@code since}.
     */
    List<InviteRecord> findByTeamIdSince(Long teamId, Instant since);

    /**
     * Oldest first, at most {@code limit}.
     */
    List<InviteRecord> findByStatusCreatedBefore(InviteStatus status, Instant cutoff, int limit);

    List<InviteRecord> findByRequestId(String requestId);

    InviteRecord save(InviteRecord record);

    /**
     * Conditionally move a record from {@code expected} to {@code next}.
     *
     * @return false when the record is missing or no longer in {@code expected}
     */
    boolean transitionStatus(Long teamId, String inviteId, InviteStatus expected, InviteStatus next, String errorMessage);
}
