package com.bbthechange.teaminvite.repository.memory;

import com.bbthechange.teaminvite.model.TeamMember;
import com.bbthechange.teaminvite.repository.TeamMemberRepository;
import com.bbthechange.teaminvite.util.TeamInviteKeyFactory;

import java.util.List;
import java.util.stream.Collectors;

import static com.bbthechange.teaminvite.repository.memory.InMemorySeatStore.MEMBER_SCHEMA;
import static com.bbthechange.teaminvite.repository.memory.InMemorySeatStore.copy;

public class InMemoryTeamMemberRepository implements TeamMemberRepository {

    private final InMemorySeatStore store;

    public InMemoryTeamMemberRepository(InMemorySeatStore store) {
        this.store = store;
    }

    @Override
    public List<TeamMember> findByTeamId(Long teamId) {
        return store.membersOf(teamId).values().stream()
                .map(member -> copy(MEMBER_SCHEMA, member))
                .collect(Collectors.toList());
    }

    @Override
    public TeamMember save(TeamMember member) {
        member.touch();
        store.membersOf(member.getTeamId()).put(member.getIdentity(), copy(MEMBER_SCHEMA, member));
        return member;
    }

    @Override
    public void delete(Long teamId, String identity) {
        store.membersOf(teamId).remove(TeamInviteKeyFactory.normalizeIdentity(identity));
    }
}
