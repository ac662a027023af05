package com.bbthechange.teaminvite.repository;

import com.bbthechange.teaminvite.model.Team;

import java.util.List;
import java.util.Optional;

public interface TeamRepository {

    /**
     * All teams ordered by ascending team id.
     */
    List<Team> findAll();

    /**
     * Teams in a group ordered by ascending team id. {@code null} means every team,
     * {@code 0} the teams without a group.
     */
    List<Team> findByGroup(Long groupId);

    Optional<Team> findById(Long teamId);

    Team save(Team team);
}
