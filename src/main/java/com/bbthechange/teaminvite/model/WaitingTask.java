package com.bbthechange.teaminvite.model;

import com.bbthechange.teaminvite.util.InstantAsLongAttributeConverter;
import com.bbthechange.teaminvite.util.TeamInviteKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.extensions.annotations.DynamoDbVersionAttribute;

import java.time.Instant;

/**
 * An invite request deferred until a seat frees up. The task id doubles as the request id,
 * so an invite flowing through the waiting queue keeps one identity end to end.
 *
 * Key Pattern: PK = TASK#{taskId}, SK = METADATA
 * DirectoryIndex: TASK_STATUS#{status} / {createdAt}#{queueSequence}#{taskId} (FIFO order)
 * LookupIndex: IDENTITY#{identity}#{code} / {taskId}
 */
@DynamoDbBean
public class WaitingTask extends BaseItem {

    private String taskId;
    private String identity;
    private Long groupId;
    private String redeemCode;
    private WaitingTaskStatus status;
    private Integer retryCount;
    private String errorMessage;
    private Instant processedAt;
    private Boolean rebind;
    private Long oldTeamId;
    private Long queueSequence;
    private Long version;

    public WaitingTask() {
        super();
        setItemType(TeamInviteKeyFactory.TASK_PREFIX);
    }

    public WaitingTask(String taskId, String identity, Long groupId, String redeemCode) {
        this();
        this.taskId = taskId;
        this.identity = TeamInviteKeyFactory.normalizeIdentity(identity);
        this.groupId = groupId;
        this.redeemCode = redeemCode;
        this.retryCount = 0;
        this.rebind = false;
        setPk(TeamInviteKeyFactory.getTaskPk(taskId));
        setSk(TeamInviteKeyFactory.getMetadataSk());
        refreshQueueKey();
        setGsi2pk(TeamInviteKeyFactory.getIdentityKey(identity, redeemCode));
        setGsi2sk(taskId);
        setStatus(WaitingTaskStatus.WAITING);
    }

    public String getTaskId() {
        return taskId;
    }

    public void setTaskId(String taskId) {
        this.taskId = taskId;
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

    public WaitingTaskStatus getStatus() {
        return status;
    }

    public void setStatus(WaitingTaskStatus status) {
        this.status = status;
        if (status != null) {
            setGsi1pk(TeamInviteKeyFactory.getTaskStatusKey(status.name()));
        }
    }

    @Override
    public void setCreatedAt(Instant createdAt) {
        super.setCreatedAt(createdAt);
        refreshQueueKey();
    }

    /**
     * Position among tasks parked in the same millisecond. Kept when a task is requeued.
     */
    public Long getQueueSequence() {
        return queueSequence;
    }

    public void setQueueSequence(Long queueSequence) {
        this.queueSequence = queueSequence;
        refreshQueueKey();
    }

    private void refreshQueueKey() {
        if (getCreatedAt() != null && taskId != null) {
            setGsi1sk(TeamInviteKeyFactory.getQueueOrderSk(getCreatedAt(),
                    queueSequence == null ? 0L : queueSequence, taskId));
        }
    }

    public Integer getRetryCount() {
        return retryCount;
    }

    public void setRetryCount(Integer retryCount) {
        this.retryCount = retryCount;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getProcessedAt() {
        return processedAt;
    }

    public void setProcessedAt(Instant processedAt) {
        this.processedAt = processedAt;
    }

    public Boolean getRebind() {
        return rebind;
    }

    public void setRebind(Boolean rebind) {
        this.rebind = rebind;
    }

    public Long getOldTeamId() {
        return oldTeamId;
    }

    public void setOldTeamId(Long oldTeamId) {
        this.oldTeamId = oldTeamId;
    }

    @DynamoDbVersionAttribute
    public Long getVersion() {
        return version;
    }

    public void setVersion(Long version) {
        this.version = version;
    }
}
