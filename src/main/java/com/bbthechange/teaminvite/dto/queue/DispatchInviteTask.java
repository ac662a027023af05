package com.bbthechange.teaminvite.dto.queue;

/**
 * An invite whose seat was already reserved on the request path.
 */
public class DispatchInviteTask extends InviteRequestTask {

    public static final String TYPE = "DISPATCH_INVITE";

    private Long teamId;
    private String inviteId;

    public DispatchInviteTask() {
        super(TYPE);
    }

    public Long getTeamId() {
        return teamId;
    }

    public void setTeamId(Long teamId) {
        this.teamId = teamId;
    }

    public String getInviteId() {
        return inviteId;
    }

    public void setInviteId(String inviteId) {
        this.inviteId = inviteId;
    }
}
