package com.bbthechange.teaminvite.model;

import com.bbthechange.teaminvite.util.InstantAsLongAttributeConverter;
import com.bbthechange.teaminvite.util.TeamInviteKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;

import java.time.Instant;

/**
 * Authorization to redeem team seats. {@code maxUses == 0} means unlimited.
 *
 * Key Pattern: PK = CODE#{code}, SK = METADATA; DirectoryIndex: CODE_DIRECTORY / {code}
 */
@DynamoDbBean
public class RedeemCode extends BaseItem {

    private String code;
    private Integer maxUses;
    private Integer usedCount;
    private Instant expiresAt;
    private Boolean active;
    private Long groupId;
    private String boundIdentity;

    public RedeemCode() {
        super();
        setItemType(TeamInviteKeyFactory.CODE_PREFIX);
    }

    public RedeemCode(String code, int maxUses) {
        this();
        this.code = TeamInviteKeyFactory.validateCode(code);
        this.maxUses = maxUses;
        this.usedCount = 0;
        this.active = true;
        setPk(TeamInviteKeyFactory.getCodePk(code));
        setSk(TeamInviteKeyFactory.getMetadataSk());
        setGsi1pk(TeamInviteKeyFactory.CODE_DIRECTORY);
        setGsi1sk(code);
    }

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public Integer getMaxUses() {
        return maxUses;
    }

    public void setMaxUses(Integer maxUses) {
        this.maxUses = maxUses;
    }

    public Integer getUsedCount() {
        return usedCount;
    }

    public void setUsedCount(Integer usedCount) {
        this.usedCount = usedCount;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }

    public Boolean getActive() {
        return active;
    }

    public void setActive(Boolean active) {
        this.active = active;
    }

    public Long getGroupId() {
        return groupId;
    }

    public void setGroupId(Long groupId) {
        this.groupId = groupId;
    }

    public String getBoundIdentity() {
        return boundIdentity;
    }

    public void setBoundIdentity(String boundIdentity) {
        this.boundIdentity = boundIdentity;
    }

    @DynamoDbIgnore
    public boolean isUnlimited() {
        return maxUses == null || maxUses == 0;
    }

    @DynamoDbIgnore
    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    @DynamoDbIgnore
    public boolean isUsable(Instant now) {
        return Boolean.TRUE.equals(active) && !isExpiredAt(now);
    }

    @DynamoDbIgnore
    public int getRemainingUses() {
        int used = usedCount == null ? 0 : usedCount;
        return Math.max(0, (maxUses == null ? 0 : maxUses) - used);
    }
}
