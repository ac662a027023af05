package com.bbthechange.teaminvite.repository.impl;

import com.bbthechange.teaminvite.model.RedeemCode;
import com.bbthechange.teaminvite.repository.RedeemCodeRepository;
import com.bbthechange.teaminvite.util.InstantAsLongAttributeConverter;
import com.bbthechange.teaminvite.util.QueryPerformanceTracker;
import com.bbthechange.teaminvite.util.TeamInviteKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.Put;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItem;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItemsRequest;
import software.amazon.awssdk.services.dynamodb.model.TransactionCanceledException;
import software.amazon.awssdk.services.dynamodb.model.Update;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.bbthechange.teaminvite.util.TeamInviteKeyFactory.TABLE_NAME;

/**
 * Durable redeem-code usage. Refunds are made idempotent by writing a REFUND#{key} marker in
 * the same transaction as the decrement.
 */
@Repository
@ConditionalOnProperty(name = "team-invite.store", havingValue = "dynamodb", matchIfMissing = true)
public class RedeemCodeRepositoryImpl implements RedeemCodeRepository {

    private static final Logger logger = LoggerFactory.getLogger(RedeemCodeRepositoryImpl.class);

    private final DynamoDbClient dynamoDbClient;
    private final DynamoDbTable<RedeemCode> codeTable;
    private final QueryPerformanceTracker performanceTracker;

    @Autowired
    public RedeemCodeRepositoryImpl(DynamoDbClient dynamoDbClient,
                                    DynamoDbEnhancedClient enhancedClient,
                                    QueryPerformanceTracker performanceTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.codeTable = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(RedeemCode.class));
        this.performanceTracker = performanceTracker;
    }

    @Override
    public Optional<RedeemCode> findByCode(String code) {
        return performanceTracker.trackQuery("findRedeemCode", TABLE_NAME, () ->
                Optional.ofNullable(codeTable.getItem(codeKey(code))));
    }

    @Override
    public RedeemCode save(RedeemCode code) {
        return performanceTracker.trackQuery("saveRedeemCode", TABLE_NAME, () -> {
            code.touch();
            codeTable.putItem(code);
            return code;
        });
    }

    @Override
    public List<RedeemCode> findActive() {
        return performanceTracker.trackQuery("findActiveRedeemCodes", TABLE_NAME, () -> {
            QueryEnhancedRequest request = QueryEnhancedRequest.builder()
                    .queryConditional(QueryConditional.keyEqualTo(
                            Key.builder().partitionValue(TeamInviteKeyFactory.CODE_DIRECTORY).build()))
                    .build();
            List<RedeemCode> codes = new ArrayList<>();
            codeTable.index(TeamInviteKeyFactory.DIRECTORY_INDEX).query(request)
                    .forEach(page -> page.items().stream()
                            .filter(code -> Boolean.TRUE.equals(code.getActive()))
                            .forEach(codes::add));
            return codes;
        });
    }

    @Override
    public boolean recordUse(String code, String identity) {
        return performanceTracker.trackQuery("recordRedeemCodeUse", TABLE_NAME, () -> {
            Map<String, AttributeValue> values = new HashMap<>();
            values.put(":zero", AttributeValue.builder().n("0").build());
            values.put(":one", AttributeValue.builder().n("1").build());
            values.put(":identity", AttributeValue.builder().s(TeamInviteKeyFactory.normalizeIdentity(identity)).build());
            values.put(":now", InstantAsLongAttributeConverter.toAttribute(Instant.now()));

            try {
                dynamoDbClient.updateItem(UpdateItemRequest.builder()
                        .tableName(TABLE_NAME)
                        .key(rawKey(code, TeamInviteKeyFactory.getMetadataSk()))
                        .updateExpression("SET usedCount = if_not_exists(usedCount, :zero) + :one, "
                                + "boundIdentity = if_not_exists(boundIdentity, :identity), updatedAt = :now")
                        .conditionExpression("attribute_exists(pk) AND "
                                + "(maxUses = :zero OR attribute_not_exists(usedCount) OR usedCount < maxUses)")
                        .expressionAttributeValues(values)
                        .build());
                return true;
            } catch (ConditionalCheckFailedException e) {
                logger.info("Redeem code {} has no durable uses left", code);
                return false;
            }
        });
    }

    @Override
    public boolean refundUse(String code, String refundKey) {
        return performanceTracker.trackQuery("refundRedeemCodeUse", TABLE_NAME, () -> {
            long now = Instant.now().toEpochMilli();

            Map<String, AttributeValue> marker = new HashMap<>(rawKey(code, TeamInviteKeyFactory.getRefundSk(refundKey)));
            marker.put("itemType", AttributeValue.builder().s(TeamInviteKeyFactory.REFUND_PREFIX).build());
            marker.put("createdAt", AttributeValue.builder().n(String.valueOf(now)).build());

            Map<String, AttributeValue> values = new HashMap<>();
            values.put(":zero", AttributeValue.builder().n("0").build());
            values.put(":one", AttributeValue.builder().n("1").build());
            values.put(":now", AttributeValue.builder().n(String.valueOf(now)).build());

            List<TransactWriteItem> items = List.of(
                    TransactWriteItem.builder()
                            .put(Put.builder()
                                    .tableName(TABLE_NAME)
                                    .item(marker)
                                    .conditionExpression("attribute_not_exists(pk)")
                                    .build())
                            .build(),
                    TransactWriteItem.builder()
                            .update(Update.builder()
                                    .tableName(TABLE_NAME)
                                    .key(rawKey(code, TeamInviteKeyFactory.getMetadataSk()))
                                    .updateExpression("SET usedCount = usedCount - :one, updatedAt = :now")
                                    .conditionExpression("attribute_exists(pk) AND usedCount > :zero")
                                    .expressionAttributeValues(values)
                                    .build())
                            .build());

            try {
                dynamoDbClient.transactWriteItems(TransactWriteItemsRequest.builder().transactItems(items).build());
                logger.info("Refunded one use of redeem code {} (key {})", code, refundKey);
                return true;
            } catch (TransactionCanceledException e) {
                logger.info("Refund of redeem code {} (key {}) not applied: {}", code, refundKey, e.getMessage());
                return false;
            }
        });
    }

    @Override
    public boolean updateUsedCount(String code, int expectedUsedCount, int usedCount) {
        return performanceTracker.trackQuery("updateRedeemCodeUsedCount", TABLE_NAME, () -> {
            Map<String, AttributeValue> values = new HashMap<>();
            values.put(":used", AttributeValue.builder().n(String.valueOf(usedCount)).build());
            values.put(":expected", AttributeValue.builder().n(String.valueOf(expectedUsedCount)).build());
            values.put(":now", InstantAsLongAttributeConverter.toAttribute(Instant.now()));
            String condition = expectedUsedCount == 0
                    ? "attribute_exists(pk) AND (attribute_not_exists(usedCount) OR usedCount = :expected)"
                    : "attribute_exists(pk) AND usedCount = :expected";
            try {
                dynamoDbClient.updateItem(UpdateItemRequest.builder()
                        .tableName(TABLE_NAME)
                        .key(rawKey(code, TeamInviteKeyFactory.getMetadataSk()))
                        .updateExpression("SET usedCount = :used, updatedAt = :now")
                        .conditionExpression(condition)
                        .expressionAttributeValues(values)
                        .build());
                return true;
            } catch (ConditionalCheckFailedException e) {
                logger.info("Used count of redeem code {} changed before it could be synced", code);
                return false;
            }
        });
    }

    private static Key codeKey(String code) {
        return Key.builder()
                .partitionValue(TeamInviteKeyFactory.getCodePk(code))
                .sortValue(TeamInviteKeyFactory.getMetadataSk())
                .build();
    }

    private static Map<String, AttributeValue> rawKey(String code, String sk) {
        Map<String, AttributeValue> key = new HashMap<>();
        key.put("pk", AttributeValue.builder().s(TeamInviteKeyFactory.getCodePk(code)).build());
        key.put("sk", AttributeValue.builder().s(sk).build());
        return key;
    }
}
