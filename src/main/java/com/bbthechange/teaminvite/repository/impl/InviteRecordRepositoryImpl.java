package com.bbthechange.teaminvite.repository.impl;

import com.bbthechange.teaminvite.model.InviteRecord;
import com.bbthechange.teaminvite.model.InviteStatus;
import com.bbthechange.teaminvite.repository.InviteRecordRepository;
import com.bbthechange.teaminvite.util.InstantAsLongAttributeConverter;
import com.bbthechange.teaminvite.util.QueryPerformanceTracker;
import com.bbthechange.teaminvite.util.TeamInviteKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.core.pagination.sync.SdkIterable;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.Page;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.bbthechange.teaminvite.util.TeamInviteKeyFactory.TABLE_NAME;

/**
 * Invite records live in their team's partition so seat transactions can read them with
 * one consistent query. Status changes go through conditional updates.
 */
@Repository
@ConditionalOnProperty(name = "team-invite.store", havingValue = "dynamodb", matchIfMissing = true)
public class InviteRecordRepositoryImpl implements InviteRecordRepository {

    private static final Logger logger = LoggerFactory.getLogger(InviteRecordRepositoryImpl.class);

    private final DynamoDbClient dynamoDbClient;
    private final DynamoDbTable<InviteRecord> inviteTable;
    private final QueryPerformanceTracker performanceTracker;

    @Autowired
    public InviteRecordRepositoryImpl(DynamoDbClient dynamoDbClient,
                                      DynamoDbEnhancedClient enhancedClient,
                                      QueryPerformanceTracker performanceTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.inviteTable = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(InviteRecord.class));
        this.performanceTracker = performanceTracker;
    }

    @Override
    public Optional<InviteRecord> findById(Long teamId, String inviteId) {
        return performanceTracker.trackQuery("findInviteById", TABLE_NAME, () -> {
            Key key = Key.builder()
                    .partitionValue(TeamInviteKeyFactory.getTeamPk(teamId))
                    .sortValue(TeamInviteKeyFactory.getInviteSk(inviteId))
                    .build();
            return Optional.ofNullable(inviteTable.getItem(key));
        });
    }

    @Override
    public List<InviteRecord> findByTeamId(Long teamId) {
        return performanceTracker.trackQuery("findInvitesByTeamId", TABLE_NAME, () ->
                queryTeamPartition(teamId, null));
    }

    @Override
    public List<InviteRecord> findByTeamIdSince(Long teamId, Instant since) {
        return performanceTracker.trackQuery("findRecentInvitesByTeamId", TABLE_NAME, () -> {
            Expression filter = Expression.builder()
                    .expression("createdAt >= :since")
                    .putExpressionValue(":since", InstantAsLongAttributeConverter.toAttribute(since))
                    .build();
            return queryTeamPartition(teamId, filter);
        });
    }

    private List<InviteRecord> queryTeamPartition(Long teamId, Expression filter) {
        QueryConditional conditional = QueryConditional.sortBeginsWith(
                Key.builder()
                        .partitionValue(TeamInviteKeyFactory.getTeamPk(teamId))
                        .sortValue(TeamInviteKeyFactory.INVITE_PREFIX + "#")
                        .build());

        QueryEnhancedRequest.Builder request = QueryEnhancedRequest.builder()
                .queryConditional(conditional);
        if (filter != null) {
            request.filterExpression(filter);
        }

        List<InviteRecord> records = new ArrayList<>();
        inviteTable.query(request.build()).items().forEach(records::add);
        logger.debug("Found {} invite records for team {}", records.size(), teamId);
        return records;
    }

    @Override
    public List<InviteRecord> findByStatusCreatedBefore(InviteStatus status, Instant cutoff, int limit) {
        return performanceTracker.trackQuery("findInvitesByStatus", TABLE_NAME, () -> {
            QueryConditional conditional = QueryConditional.sortLessThan(
                    Key.builder()
                            .partitionValue(TeamInviteKeyFactory.getInviteStatusKey(status.name()))
                            .sortValue(TeamInviteKeyFactory.getTimePrefix(cutoff))
                            .build());

            QueryEnhancedRequest request = QueryEnhancedRequest.builder()
                    .queryConditional(conditional)
                    .scanIndexForward(true)
                    .limit(limit)
                    .build();

            return collect(inviteTable.index(TeamInviteKeyFactory.DIRECTORY_INDEX).query(request), limit);
        });
    }

    @Override
    public List<InviteRecord> findByRequestId(String requestId) {
        return performanceTracker.trackQuery("findInvitesByRequestId", TABLE_NAME, () -> {
            QueryEnhancedRequest request = QueryEnhancedRequest.builder()
                    .queryConditional(QueryConditional.keyEqualTo(
                            Key.builder().partitionValue(TeamInviteKeyFactory.getRequestKey(requestId)).build()))
                    .build();
            return collect(inviteTable.index(TeamInviteKeyFactory.LOOKUP_INDEX).query(request), Integer.MAX_VALUE);
        });
    }

    private static List<InviteRecord> collect(SdkIterable<Page<InviteRecord>> pages, int limit) {
        List<InviteRecord> records = new ArrayList<>();
        for (Page<InviteRecord> page : pages) {
            for (InviteRecord record : page.items()) {
                if (records.size() >= limit) {
                    return records;
                }
                records.add(record);
            }
        }
        return records;
    }

    @Override
    public InviteRecord save(InviteRecord record) {
        return performanceTracker.trackQuery("saveInviteRecord", TABLE_NAME, () -> {
            record.touch();
            inviteTable.putItem(record);
            return record;
        });
    }

    @Override
    public boolean transitionStatus(Long teamId, String inviteId, InviteStatus expected,
                                    InviteStatus next, String errorMessage) {
        return performanceTracker.trackQuery("transitionInviteStatus", TABLE_NAME, () -> {
            Map<String, AttributeValue> key = new HashMap<>();
            key.put("pk", AttributeValue.builder().s(TeamInviteKeyFactory.getTeamPk(teamId)).build());
            key.put("sk", AttributeValue.builder().s(TeamInviteKeyFactory.getInviteSk(inviteId)).build());

            Map<String, AttributeValue> values = new HashMap<>();
            values.put(":expected", AttributeValue.builder().s(expected.name()).build());
            values.put(":next", AttributeValue.builder().s(next.name()).build());
            values.put(":statusKey", AttributeValue.builder()
                    .s(TeamInviteKeyFactory.getInviteStatusKey(next.name())).build());
            values.put(":now", InstantAsLongAttributeConverter.toAttribute(Instant.now()));

            String updateExpression = "SET #status = :next, gsi1pk = :statusKey, updatedAt = :now";
            if (errorMessage != null) {
                values.put(":error", AttributeValue.builder().s(errorMessage).build());
                updateExpression += ", errorMessage = :error";
            }

            try {
                dynamoDbClient.updateItem(UpdateItemRequest.builder()
                        .tableName(TABLE_NAME)
                        .key(key)
                        .updateExpression(updateExpression)
                        .conditionExpression("attribute_exists(pk) AND #status = :expected")
                        .expressionAttributeNames(Map.of("#status", "status"))
                        .expressionAttributeValues(values)
                        .build());
                logger.debug("Invite {} on team {} moved {} -> {}", inviteId, teamId, expected, next);
                return true;
            } catch (ConditionalCheckFailedException e) {
                logger.debug("Invite {} on team {} is no longer {}", inviteId, teamId, expected);
                return false;
            }
        });
    }
}
