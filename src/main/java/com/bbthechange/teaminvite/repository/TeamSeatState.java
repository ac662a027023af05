package com.bbthechange.teaminvite.repository;

import com.bbthechange.teaminvite.model.InviteRecord;
import com.bbthechange.teaminvite.model.Team;

import java.util.List;
import java.util.Set;

/**
 * Everything needed to compute a team's capacity, read in one consistent view.
 */
public class TeamSeatState {

    private final Team team;
    private final Set<String> memberIdentities;
    private final List<InviteRecord> recentInvites;

    public TeamSeatState(Team team, Set<String> memberIdentities, List<InviteRecord> recentInvites) {
        this.team = team;
        this.memberIdentities = Set.copyOf(memberIdentities);
        this.recentInvites = List.copyOf(recentInvites);
    }

    public Team getTeam() {
        return team;
    }

    public Set<String> getMemberIdentities() {
        return memberIdentities;
    }

    public List<InviteRecord> getRecentInvites() {
        return recentInvites;
    }
}
