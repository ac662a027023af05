package com.bbthechange.teaminvite.dto.queue;

import com.bbthechange.teaminvite.dto.ReservationRequest;
import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Fields shared by every message that carries one invite request.
 */
public abstract class InviteRequestTask extends InviteTaskMessage {

    private String requestId;
    private String identity;
    private Long groupId;
    private String redeemCode;
    private int attempt;
    private boolean rebind;
    private Long oldTeamId;
    private String waitingTaskId;

    protected InviteRequestTask() {}

    protected InviteRequestTask(String type) {
        super(type);
    }

    protected void copyRequestFields(InviteRequestTask source) {
        this.requestId = source.requestId;
        this.identity = source.identity;
        this.groupId = source.groupId;
        this.redeemCode = source.redeemCode;
        this.attempt = source.attempt;
        this.rebind = source.rebind;
        this.oldTeamId = source.oldTeamId;
        this.waitingTaskId = source.waitingTaskId;
    }

    @JsonIgnore
    public ReservationRequest toReservationRequest() {
        return ReservationRequest.builder()
                .requestId(requestId)
                .identity(identity)
                .groupId(groupId)
                .redeemCode(redeemCode)
                .rebind(rebind)
                .build();
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    public String getIdentity() {
        return identity;
    }

    public void setIdentity(String identity) {
        this.identity = identity;
    }

    public Long getGroupId() {
        return groupId;
    }

    public void setGroupId(Long groupId) {
        this.groupId = groupId;
    }

    public String getRedeemCode() {
        return redeemCode;
    }

    public void setRedeemCode(String redeemCode) {
        this.redeemCode = redeemCode;
    }

    public int getAttempt() {
        return attempt;
    }

    public void setAttempt(int attempt) {
        this.attempt = attempt;
    }

    public boolean isRebind() {
        return rebind;
    }

    public void setRebind(boolean rebind) {
        this.rebind = rebind;
    }

    public Long getOldTeamId() {
        return oldTeamId;
    }

    public void setOldTeamId(Long oldTeamId) {
        this.oldTeamId = oldTeamId;
    }

    public String getWaitingTaskId() {
        return waitingTaskId;
    }

    public void setWaitingTaskId(String waitingTaskId) {
        this.waitingTaskId = waitingTaskId;
    }

    @Override
    public String toString() {
        return getType() + "{requestId=" + requestId + ", identity=" + identity + ", attempt=" + attempt + "}";
    }
}
