package com.bbthechange.teaminvite.dto;

/**
 * Outcome of a seat reservation: either a RESERVED invite on a team, or rejection.
 */
public final class ReservationResult {

    private static final ReservationResult REJECTED = new ReservationResult(false, null, null);

    private final boolean ok;
    private final Long teamId;
    private final String inviteId;

    private ReservationResult(boolean ok, Long teamId, String inviteId) {
        this.ok = ok;
        this.teamId = teamId;
        this.inviteId = inviteId;
    }

    public static ReservationResult reserved(Long teamId, String inviteId) {
        return new ReservationResult(true, teamId, inviteId);
    }

    public static ReservationResult rejected() {
        return REJECTED;
    }

    public boolean isOk() {
        return ok;
    }

    public Long getTeamId() {
        return teamId;
    }

    public String getInviteId() {
        return inviteId;
    }

    @Override
    public String toString() {
        return ok ? "ReservationResult{teamId=" + teamId + ", inviteId=" + inviteId + "}" : "ReservationResult{rejected}";
    }
}
