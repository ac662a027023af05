package com.bbthechange.teaminvite.repository.memory;

import com.bbthechange.teaminvite.model.Team;
import com.bbthechange.teaminvite.repository.TeamRepository;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.bbthechange.teaminvite.repository.memory.InMemorySeatStore.TEAM_SCHEMA;
import static com.bbthechange.teaminvite.repository.memory.InMemorySeatStore.copy;

public class InMemoryTeamRepository implements TeamRepository {

    private final InMemorySeatStore store;

    public InMemoryTeamRepository(InMemorySeatStore store) {
        this.store = store;
    }

    @Override
    public List<Team> findAll() {
        return store.teams.values().stream()
                .map(team -> copy(TEAM_SCHEMA, team))
                .collect(Collectors.toList());
    }

    @Override
    public List<Team> findByGroup(Long groupId) {
        if (groupId == null) {
            return findAll();
        }
        return store.teams.values().stream()
                .filter(team -> Objects.equals(groupId, team.getGroupId() == null ? 0L : team.getGroupId()))
                .map(team -> copy(TEAM_SCHEMA, team))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Team> findById(Long teamId) {
        return Optional.ofNullable(copy(TEAM_SCHEMA, store.teams.get(teamId)));
    }

    @Override
    public Team save(Team team) {
        team.touch();
        store.teams.put(team.getTeamId(), copy(TEAM_SCHEMA, team));
        return team;
    }
}
