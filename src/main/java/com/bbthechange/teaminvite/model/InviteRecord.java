package com.bbthechange.teaminvite.model;

import com.bbthechange.teaminvite.util.TeamInviteKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;

import java.time.Instant;

/**
 * One invitation attempt of an identity into a team.
 *
 * Key Pattern: PK = TEAM#{teamId}, SK = INVITE#{inviteId}
 * DirectoryIndex: INVITE_STATUS#{status} / {createdAt}#{inviteId}
 * LookupIndex: REQUEST#{requestId} / {inviteId}
 */
@DynamoDbBean
public class InviteRecord extends BaseItem {

    private String inviteId;
    private Long teamId;
    private String identity;
    private InviteStatus status;
    private String requestId;
    private String redeemCode;
    private Boolean rebind;
    private String errorMessage;

    public InviteRecord() {
        super();
        setItemType(TeamInviteKeyFactory.INVITE_PREFIX);
    }

    public InviteRecord(Long teamId, String inviteId, String identity, InviteStatus status, String requestId) {
        this();
        this.teamId = teamId;
        this.inviteId = inviteId;
        this.identity = TeamInviteKeyFactory.normalizeIdentity(identity);
        this.requestId = requestId;
        this.rebind = false;
        setPk(TeamInviteKeyFactory.getTeamPk(teamId));
        setSk(TeamInviteKeyFactory.getInviteSk(inviteId));
        setGsi1sk(TeamInviteKeyFactory.getTimeOrderedSk(getCreatedAt(), inviteId));
        setGsi2pk(TeamInviteKeyFactory.getRequestKey(requestId));
        setGsi2sk(inviteId);
        setStatus(status);
    }

    public String getInviteId() {
        return inviteId;
    }

    public void setInviteId(String inviteId) {
        this.inviteId = inviteId;
    }

    public Long getTeamId() {
        return teamId;
    }

    public void setTeamId(Long teamId) {
        this.teamId = teamId;
    }

    public String getIdentity() {
        return identity;
    }

    public void setIdentity(String identity) {
        this.identity = identity;
    }

    public InviteStatus getStatus() {
        return status;
    }

    /**
     * Also moves the record between DirectoryIndex status partitions.
     */
    public void setStatus(InviteStatus status) {
        this.status = status;
        if (status != null) {
            setGsi1pk(TeamInviteKeyFactory.getInviteStatusKey(status.name()));
        }
    }

    @Override
    public void setCreatedAt(Instant createdAt) {
        super.setCreatedAt(createdAt);
        if (createdAt != null && inviteId != null) {
            setGsi1sk(TeamInviteKeyFactory.getTimeOrderedSk(createdAt, inviteId));
        }
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    public String getRedeemCode() {
        return redeemCode;
    }

    public void setRedeemCode(String redeemCode) {
        this.redeemCode = redeemCode;
    }

    public Boolean getRebind() {
        return rebind;
    }

    public void setRebind(Boolean rebind) {
        this.rebind = rebind;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }
}
