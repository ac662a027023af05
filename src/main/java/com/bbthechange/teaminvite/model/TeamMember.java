package com.bbthechange.teaminvite.model;

import com.bbthechange.teaminvite.util.TeamInviteKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;

/**
 * A confirmed occupant of a team seat, as last seen by the membership sync.
 *
 * Key Pattern: PK = TEAM#{teamId}, SK = MEMBER#{identity}
 */
@DynamoDbBean
public class TeamMember extends BaseItem {

    private Long teamId;
    private String identity;
    private String externalUserId;

    public TeamMember() {
        super();
        setItemType(TeamInviteKeyFactory.MEMBER_PREFIX);
    }

    public TeamMember(Long teamId, String identity) {
        this();
        this.teamId = teamId;
        this.identity = TeamInviteKeyFactory.normalizeIdentity(identity);
        setPk(TeamInviteKeyFactory.getTeamPk(teamId));
        setSk(TeamInviteKeyFactory.getMemberSk(identity));
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

    public String getExternalUserId() {
        return externalUserId;
    }

    public void setExternalUserId(String externalUserId) {
        this.externalUserId = externalUserId;
    }
}
