package com.bbthechange.teaminvite.model;

import com.bbthechange.teaminvite.util.TeamInviteKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;

/**
 * A capacity-bounded external team. Maintained by the team sync collaborator; read-only here
 * except for {@code seatVersion}, which the seat store bumps on every committed reservation.
 *
 * Key Pattern: PK = TEAM#{teamId}, SK = METADATA; DirectoryIndex: TEAM_DIRECTORY / padded id
 */
@DynamoDbBean
public class Team extends BaseItem {

    private Long teamId;
    private String name;
    private Integer maxSeats;
    private Long groupId;
    private TeamHealth health;
    private String accountId;
    private String accessToken;
    private Long seatVersion;

    public Team() {
        super();
        setItemType(TeamInviteKeyFactory.TEAM_PREFIX);
    }

    public Team(Long teamId, String name, int maxSeats) {
        this();
        this.teamId = teamId;
        this.name = name;
        this.maxSeats = maxSeats;
        this.health = TeamHealth.ACTIVE;
        this.seatVersion = 0L;
        setPk(TeamInviteKeyFactory.getTeamPk(teamId));
        setSk(TeamInviteKeyFactory.getMetadataSk());
        setGsi1pk(TeamInviteKeyFactory.TEAM_DIRECTORY);
        setGsi1sk(TeamInviteKeyFactory.getTeamDirectorySk(teamId));
    }

    public Long getTeamId() {
        return teamId;
    }

    public void setTeamId(Long teamId) {
        this.teamId = teamId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Integer getMaxSeats() {
        return maxSeats;
    }

    public void setMaxSeats(Integer maxSeats) {
        this.maxSeats = maxSeats;
    }

    public Long getGroupId() {
        return groupId;
    }

    public void setGroupId(Long groupId) {
        this.groupId = groupId;
    }

    public TeamHealth getHealth() {
        return health;
    }

    public void setHealth(TeamHealth health) {
        this.health = health;
    }

    public String getAccountId() {
        return accountId;
    }

    public void setAccountId(String accountId) {
        this.accountId = accountId;
    }

    public String getAccessToken() {
        return accessToken;
    }

    public void setAccessToken(String accessToken) {
        this.accessToken = accessToken;
    }

    public Long getSeatVersion() {
        return seatVersion;
    }

    public void setSeatVersion(Long seatVersion) {
        this.seatVersion = seatVersion;
    }

    @DynamoDbIgnore
    public boolean isHealthy() {
        return health != null && health.isHealthy();
    }

    @DynamoDbIgnore
    public int getCapacity() {
        return maxSeats == null ? 0 : maxSeats;
    }
}
