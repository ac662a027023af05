package com.bbthechange.teaminvite.repository;

import com.bbthechange.teaminvite.model.InviteRecord;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * A unit of work that holds team locks while seats are counted and reserved.
 *
 * <p>Locks are taken in ascending team id order. Staged invites become visible to
 * {@link #readState} in the same transaction and durable on {@link #commit}. Closing an
 * uncommitted transaction rolls it back.</p>
 */
public interface SeatTransaction extends AutoCloseable {

    /**
     * @throws com.bbthechange.teaminvite.exception.LockConflictException when a lock cannot be taken
     */
    void lockTeams(Collection<Long> teamIds);

    /**
     * Consistent view of a locked team, including invites staged in this transaction.
     */
    TeamSeatState readState(Long teamId, Instant inviteWindowStart);

    void stageInvite(InviteRecord record);

    List<InviteRecord> getStagedInvites();

    /**
     * @throws com.bbthechange.teaminvite.exception.LockConflictException when a locked team changed underneath
     */
    void commit();

    void rollback();

    @Override
    void close();
}
