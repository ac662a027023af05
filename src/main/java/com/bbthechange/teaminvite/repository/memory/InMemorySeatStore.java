package com.bbthechange.teaminvite.repository.memory;

import com.bbthechange.teaminvite.exception.LockConflictException;
import com.bbthechange.teaminvite.exception.RepositoryException;
import com.bbthechange.teaminvite.model.InviteRecord;
import com.bbthechange.teaminvite.model.RedeemCode;
import com.bbthechange.teaminvite.model.Team;
import com.bbthechange.teaminvite.model.TeamMember;
import com.bbthechange.teaminvite.model.WaitingTask;
import com.bbthechange.teaminvite.repository.SeatTransaction;
import com.bbthechange.teaminvite.repository.SeatTransactionManager;
import com.bbthechange.teaminvite.repository.TeamSeatState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Single-node seat store. Team locks are real {@link ReentrantLock}s, so reservations are
 * serialized per team exactly like row locks in a relational store.
 *
 * <p>Items are copied in and out through their DynamoDB table schemas so callers never share
 * mutable state with the store.</p>
 */
public class InMemorySeatStore implements SeatTransactionManager {

    private static final Logger logger = LoggerFactory.getLogger(InMemorySeatStore.class);

    static final TableSchema<Team> TEAM_SCHEMA = TableSchema.fromBean(Team.class);
    static final TableSchema<TeamMember> MEMBER_SCHEMA = TableSchema.fromBean(TeamMember.class);
    static final TableSchema<InviteRecord> INVITE_SCHEMA = TableSchema.fromBean(InviteRecord.class);
    static final TableSchema<WaitingTask> TASK_SCHEMA = TableSchema.fromBean(WaitingTask.class);
    static final TableSchema<RedeemCode> CODE_SCHEMA = TableSchema.fromBean(RedeemCode.class);

    final ConcurrentSkipListMap<Long, Team> teams = new ConcurrentSkipListMap<>();
    final ConcurrentMap<Long, ConcurrentMap<String, TeamMember>> members = new ConcurrentHashMap<>();
    final ConcurrentMap<Long, ConcurrentMap<String, InviteRecord>> invites = new ConcurrentHashMap<>();
    final ConcurrentMap<String, WaitingTask> tasks = new ConcurrentHashMap<>();
    final ConcurrentMap<String, RedeemCode> codes = new ConcurrentHashMap<>();
    final Set<String> refundMarkers = ConcurrentHashMap.newKeySet();

    // Guards read-modify-write of tasks, codes and invite status outside team locks
    final Object monitor = new Object();

    private final ConcurrentMap<Long, ReentrantLock> teamLocks = new ConcurrentHashMap<>();
    private final Duration lockTimeout;

    public InMemorySeatStore(Duration lockTimeout) {
        this.lockTimeout = lockTimeout;
    }

    static <T> T copy(TableSchema<T> schema, T item) {
        return item == null ? null : schema.mapToItem(schema.itemToMap(item, true));
    }

    @Override
    public SeatTransaction begin() {
        return new InMemorySeatTransaction();
    }

    ConcurrentMap<String, InviteRecord> invitesOf(Long teamId) {
        return invites.computeIfAbsent(teamId, id -> new ConcurrentHashMap<>());
    }

    ConcurrentMap<String, TeamMember> membersOf(Long teamId) {
        return members.computeIfAbsent(teamId, id -> new ConcurrentHashMap<>());
    }

    private class InMemorySeatTransaction implements SeatTransaction {

        private final List<ReentrantLock> held = new ArrayList<>();
        private final Set<Long> lockedTeams = new HashSet<>();
        private final List<InviteRecord> staged = new ArrayList<>();
        private boolean finished;

        @Override
        public void lockTeams(Collection<Long> teamIds) {
            for (Long teamId : new TreeSet<>(teamIds)) {
                if (lockedTeams.contains(teamId)) {
                    continue;
                }
                ReentrantLock lock = teamLocks.computeIfAbsent(teamId, id -> new ReentrantLock());
                try {
                    if (!lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                        throw new LockConflictException("Timed out waiting for lock on team " + teamId);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new LockConflictException("Interrupted while locking team " + teamId, e);
                }
                held.add(lock);
                lockedTeams.add(teamId);
            }
        }

        @Override
        public TeamSeatState readState(Long teamId, Instant inviteWindowStart) {
            requireLocked(teamId);
            Team team = copy(TEAM_SCHEMA, teams.get(teamId));
            if (team == null) {
                throw new RepositoryException("Team not found: " + teamId);
            }
            Set<String> memberIdentities = new HashSet<>(membersOf(teamId).keySet());
            List<InviteRecord> recent = invitesOf(teamId).values().stream()
                    .filter(r -> !r.getCreatedAt().isBefore(inviteWindowStart))
                    .map(r -> copy(INVITE_SCHEMA, r))
                    .collect(Collectors.toCollection(ArrayList::new));
            staged.stream()
                    .filter(r -> teamId.equals(r.getTeamId()))
                    .forEach(recent::add);
            return new TeamSeatState(team, memberIdentities, recent);
        }

        @Override
        public void stageInvite(InviteRecord record) {
            requireLocked(record.getTeamId());
            staged.add(record);
        }

        @Override
        public List<InviteRecord> getStagedInvites() {
            return Collections.unmodifiableList(staged);
        }

        @Override
        public void commit() {
            if (finished) {
                throw new IllegalStateException("Transaction already finished");
            }
            try {
                for (InviteRecord record : staged) {
                    invitesOf(record.getTeamId()).put(record.getInviteId(), copy(INVITE_SCHEMA, record));
                }
                for (Long teamId : lockedTeams) {
                    teams.computeIfPresent(teamId, (id, team) -> {
                        Team bumped = copy(TEAM_SCHEMA, team);
                        bumped.setSeatVersion(team.getSeatVersion() == null ? 1L : team.getSeatVersion() + 1);
                        return bumped;
                    });
                }
                logger.debug("Committed {} staged invites across teams {}", staged.size(), lockedTeams);
            } finally {
                finished = true;
                release();
            }
        }

        @Override
        public void rollback() {
            if (finished) {
                return;
            }
            finished = true;
            staged.clear();
            release();
        }

        @Override
        public void close() {
            rollback();
        }

        private void requireLocked(Long teamId) {
            if (!lockedTeams.contains(teamId)) {
                throw new IllegalStateException("Team " + teamId + " is not locked by this transaction");
            }
        }

        private void release() {
            for (int i = held.size() - 1; i >= 0; i--) {
                held.get(i).unlock();
            }
            held.clear();
        }
    }
}
