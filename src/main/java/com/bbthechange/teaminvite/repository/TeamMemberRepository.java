package com.bbthechange.teaminvite.repository;

import com.bbthechange.teaminvite.model.TeamMember;

import java.util.List;

public interface TeamMemberRepository {

    List<TeamMember> findByTeamId(Long teamId);

    TeamMember save(TeamMember member);

    void delete(Long teamId, String identity);
}
