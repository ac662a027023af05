package com.bbthechange.teaminvite.client;

import com.bbthechange.teaminvite.dto.MembershipResult;
import com.bbthechange.teaminvite.model.Team;

import java.util.List;

/**
 * External membership service that actually adds identities to a team.
 */
public interface TeamMembershipClient {

    /**
     * Invite a batch of identities to one team in a single call.
     *
     * @return one result per identity, in request order
     * @throws com.bbthechange.teaminvite.exception.TransientExternalFailureException when the
     *         whole call failed and may succeed later
     * @throws com.bbthechange.teaminvite.exception.TerminalExternalFailureException when the
     *         whole call was refused for good
     */
    List<MembershipResult> invite(Team team, List<String> identities);

    /**
     * Remove one identity from a team.
     *
     * @return true if the identity is no longer a member
     */
    boolean remove(Team team, String identity);
}
