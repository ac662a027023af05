package com.bbthechange.teaminvite.repository.memory;

import com.bbthechange.teaminvite.model.InviteRecord;
import com.bbthechange.teaminvite.model.InviteStatus;
import com.bbthechange.teaminvite.repository.InviteRecordRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.bbthechange.teaminvite.repository.memory.InMemorySeatStore.INVITE_SCHEMA;
import static com.bbthechange.teaminvite.repository.memory.InMemorySeatStore.copy;

public class InMemoryInviteRecordRepository implements InviteRecordRepository {

    private final InMemorySeatStore store;

    public InMemoryInviteRecordRepository(InMemorySeatStore store) {
        this.store = store;
    }

    @Override
    public Optional<InviteRecord> findById(Long teamId, String inviteId) {
        return Optional.ofNullable(copy(INVITE_SCHEMA, store.invitesOf(teamId).get(inviteId)));
    }

    @Override
    public List<InviteRecord> findByTeamId(Long teamId) {
        return store.invitesOf(teamId).values().stream()
                .sorted(Comparator.comparing(InviteRecord::getCreatedAt))
                .map(record -> copy(INVITE_SCHEMA, record))
                .collect(Collectors.toList());
    }

    @Override
    public List<InviteRecord> findByTeamIdSince(Long teamId, Instant since) {
        return findByTeamId(teamId).stream()
                .filter(record -> !record.getCreatedAt().isBefore(since))
                .collect(Collectors.toList());
    }

    @Override
    public List<InviteRecord> findByStatusCreatedBefore(InviteStatus status, Instant cutoff, int limit) {
        return store.invites.values().stream()
                .flatMap(byId -> byId.values().stream())
                .filter(record -> record.getStatus() == status && record.getCreatedAt().isBefore(cutoff))
                .sorted(Comparator.comparing(InviteRecord::getCreatedAt))
                .limit(limit)
                .map(record -> copy(INVITE_SCHEMA, record))
                .collect(Collectors.toList());
    }

    @Override
    public List<InviteRecord> findByRequestId(String requestId) {
        return store.invites.values().stream()
                .flatMap(byId -> byId.values().stream())
                .filter(record -> requestId.equals(record.getRequestId()))
                .map(record -> copy(INVITE_SCHEMA, record))
                .collect(Collectors.toList());
    }

    @Override
    public InviteRecord save(InviteRecord record) {
        record.touch();
        store.invitesOf(record.getTeamId()).put(record.getInviteId(), copy(INVITE_SCHEMA, record));
        return record;
    }

    @Override
    public boolean transitionStatus(Long teamId, String inviteId, InviteStatus expected,
                                    InviteStatus next, String errorMessage) {
        synchronized (store.monitor) {
            InviteRecord stored = store.invitesOf(teamId).get(inviteId);
            if (stored == null || stored.getStatus() != expected) {
                return false;
            }
            InviteRecord updated = copy(INVITE_SCHEMA, stored);
            updated.setStatus(next);
            updated.setErrorMessage(errorMessage);
            updated.touch();
            store.invitesOf(teamId).put(inviteId, updated);
            return true;
        }
    }
}
