package com.bbthechange.teaminvite.repository.impl;

import com.bbthechange.teaminvite.exception.RepositoryException;
import com.bbthechange.teaminvite.model.WaitingTask;
import com.bbthechange.teaminvite.model.WaitingTaskStatus;
import com.bbthechange.teaminvite.repository.WaitingTaskRepository;
import com.bbthechange.teaminvite.util.QueryPerformanceTracker;
import com.bbthechange.teaminvite.util.TeamInviteKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbIndex;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.Page;
import software.amazon.awssdk.enhanced.dynamodb.model.PutItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import static com.bbthechange.teaminvite.util.TeamInviteKeyFactory.TABLE_NAME;

/**
 * Waiting tasks are queued per status in the DirectoryIndex; the sort key starts with the
 * zero-padded creation time, so ascending queries read the queue in FIFO order.
 */
@Repository
@ConditionalOnProperty(name = "team-invite.store", havingValue = "dynamodb", matchIfMissing = true)
public class WaitingTaskRepositoryImpl implements WaitingTaskRepository {

    private static final Logger logger = LoggerFactory.getLogger(WaitingTaskRepositoryImpl.class);

    private final DynamoDbTable<WaitingTask> taskTable;
    private final DynamoDbIndex<WaitingTask> statusIndex;
    private final DynamoDbIndex<WaitingTask> lookupIndex;
    private final QueryPerformanceTracker performanceTracker;

    @Autowired
    public WaitingTaskRepositoryImpl(DynamoDbEnhancedClient enhancedClient, QueryPerformanceTracker performanceTracker) {
        this.taskTable = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(WaitingTask.class));
        this.statusIndex = taskTable.index(TeamInviteKeyFactory.DIRECTORY_INDEX);
        this.lookupIndex = taskTable.index(TeamInviteKeyFactory.LOOKUP_INDEX);
        this.performanceTracker = performanceTracker;
    }

    @Override
    public WaitingTask save(WaitingTask task) {
        return performanceTracker.trackQuery("saveWaitingTask", TABLE_NAME, () -> {
            task.touch();
            try {
                // VersionedRecordExtension checks and increments the version attribute
                taskTable.putItem(task);
            } catch (ConditionalCheckFailedException e) {
                throw new RepositoryException("Waiting task " + task.getTaskId() + " was modified concurrently", e);
            }
            task.setVersion(task.getVersion() == null ? 1L : task.getVersion() + 1);
            return task;
        });
    }

    @Override
    public boolean createIfAbsent(WaitingTask task) {
        return performanceTracker.trackQuery("createWaitingTask", TABLE_NAME, () -> {
            task.setVersion(null);
            try {
                taskTable.putItem(PutItemEnhancedRequest.builder(WaitingTask.class)
                        .item(task)
                        .conditionExpression(Expression.builder().expression("attribute_not_exists(pk)").build())
                        .build());
            } catch (ConditionalCheckFailedException e) {
                logger.debug("Waiting task {} already exists", task.getTaskId());
                return false;
            }
            task.setVersion(1L);
            return true;
        });
    }

    @Override
    public Optional<WaitingTask> findById(String taskId) {
        return performanceTracker.trackQuery("findWaitingTaskById", TABLE_NAME, () -> {
            Key key = Key.builder()
                    .partitionValue(TeamInviteKeyFactory.getTaskPk(taskId))
                    .sortValue(TeamInviteKeyFactory.getMetadataSk())
                    .build();
            return Optional.ofNullable(taskTable.getItem(r -> r.key(key).consistentRead(true)));
        });
    }

    @Override
    public List<WaitingTask> findByStatus(WaitingTaskStatus status, int limit) {
        return performanceTracker.trackQuery("findWaitingTasksByStatus", TABLE_NAME, () -> {
            QueryEnhancedRequest request = QueryEnhancedRequest.builder()
                    .queryConditional(QueryConditional.keyEqualTo(statusPartition(status)))
                    .scanIndexForward(true)
                    .limit(limit)
                    .build();
            return collect(statusIndex, request, limit);
        });
    }

    @Override
    public Optional<WaitingTask> findOpenByIdentityAndCode(String identity, String redeemCode) {
        return performanceTracker.trackQuery("findOpenWaitingTask", TABLE_NAME, () -> {
            QueryEnhancedRequest request = QueryEnhancedRequest.builder()
                    .queryConditional(QueryConditional.keyEqualTo(Key.builder()
                            .partitionValue(TeamInviteKeyFactory.getIdentityKey(identity, redeemCode))
                            .build()))
                    .build();
            return collect(lookupIndex, request, Integer.MAX_VALUE).stream()
                    .filter(task -> !task.getStatus().isFinished())
                    .min(Comparator.comparing(WaitingTask::getGsi1sk));
        });
    }

    @Override
    public long countByStatus(WaitingTaskStatus status) {
        return performanceTracker.trackQuery("countWaitingTasksByStatus", TABLE_NAME, () -> {
            QueryEnhancedRequest request = QueryEnhancedRequest.builder()
                    .queryConditional(QueryConditional.keyEqualTo(statusPartition(status)))
                    .build();
            return (long) collect(statusIndex, request, Integer.MAX_VALUE).size();
        });
    }

    @Override
    public long queuePosition(WaitingTask task) {
        return performanceTracker.trackQuery("waitingQueuePosition", TABLE_NAME, () -> {
            QueryConditional conditional = QueryConditional.sortLessThanOrEqualTo(Key.builder()
                    .partitionValue(TeamInviteKeyFactory.getTaskStatusKey(WaitingTaskStatus.WAITING.name()))
                    .sortValue(task.getGsi1sk())
                    .build());
            QueryEnhancedRequest request = QueryEnhancedRequest.builder().queryConditional(conditional).build();
            return (long) collect(statusIndex, request, Integer.MAX_VALUE).size();
        });
    }

    @Override
    public int deleteFinishedBefore(Instant cutoff) {
        return performanceTracker.trackQuery("deleteFinishedWaitingTasks", TABLE_NAME, () -> {
            int deleted = 0;
            for (WaitingTaskStatus status : List.of(WaitingTaskStatus.SUCCESS, WaitingTaskStatus.FAILED)) {
                QueryConditional conditional = QueryConditional.sortLessThan(Key.builder()
                        .partitionValue(TeamInviteKeyFactory.getTaskStatusKey(status.name()))
                        .sortValue(TeamInviteKeyFactory.getTimePrefix(cutoff))
                        .build());
                QueryEnhancedRequest request = QueryEnhancedRequest.builder().queryConditional(conditional).build();
                for (WaitingTask task : collect(statusIndex, request, Integer.MAX_VALUE)) {
                    taskTable.deleteItem(Key.builder().partitionValue(task.getPk()).sortValue(task.getSk()).build());
                    deleted++;
                }
            }
            logger.debug("Deleted {} finished waiting tasks older than {}", deleted, cutoff);
            return deleted;
        });
    }

    private static Key statusPartition(WaitingTaskStatus status) {
        return Key.builder().partitionValue(TeamInviteKeyFactory.getTaskStatusKey(status.name())).build();
    }

    private static List<WaitingTask> collect(DynamoDbIndex<WaitingTask> index, QueryEnhancedRequest request, int limit) {
        List<WaitingTask> tasks = new ArrayList<>();
        for (Page<WaitingTask> page : index.query(request)) {
            for (WaitingTask task : page.items()) {
                if (tasks.size() >= limit) {
                    return tasks;
                }
                tasks.add(task);
            }
        }
        return tasks;
    }
}
