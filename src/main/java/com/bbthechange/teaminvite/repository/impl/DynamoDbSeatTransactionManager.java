package com.bbthechange.teaminvite.repository.impl;

import com.bbthechange.teaminvite.exception.LockConflictException;
import com.bbthechange.teaminvite.exception.RepositoryException;
import com.bbthechange.teaminvite.model.InviteRecord;
import com.bbthechange.teaminvite.model.Team;
import com.bbthechange.teaminvite.model.TeamMember;
import com.bbthechange.teaminvite.repository.SeatTransaction;
import com.bbthechange.teaminvite.repository.SeatTransactionManager;
import com.bbthechange.teaminvite.repository.TeamSeatState;
import com.bbthechange.teaminvite.util.InstantAsLongAttributeConverter;
import com.bbthechange.teaminvite.util.QueryPerformanceTracker;
import com.bbthechange.teaminvite.util.TeamInviteKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.Put;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItem;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItemsRequest;
import software.amazon.awssdk.services.dynamodb.model.TransactionCanceledException;
import software.amazon.awssdk.services.dynamodb.model.Update;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Seat transactions on DynamoDB.
 *
 * <p>DynamoDB has no row locks, so a team "lock" is its {@code seatVersion} read with a
 * consistent read. The commit writes every staged invite together with a conditional bump of
 * each locked team's version in one TransactWriteItems call; if any other writer reserved a
 * seat on one of those teams in between, the whole commit is cancelled and surfaces as a
 * {@link LockConflictException}.</p>
 */
@Component
@ConditionalOnProperty(name = "team-invite.store", havingValue = "dynamodb", matchIfMissing = true)
public class DynamoDbSeatTransactionManager implements SeatTransactionManager {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDbSeatTransactionManager.class);
    private static final String TABLE_NAME = TeamInviteKeyFactory.TABLE_NAME;
    private static final int MAX_TRANSACTION_ITEMS = 100;

    private final DynamoDbClient dynamoDbClient;
    private final DynamoDbTable<Team> teamTable;
    private final DynamoDbTable<TeamMember> memberTable;
    private final DynamoDbTable<InviteRecord> inviteTable;
    private final QueryPerformanceTracker performanceTracker;

    @Autowired
    public DynamoDbSeatTransactionManager(DynamoDbClient dynamoDbClient,
                                          DynamoDbEnhancedClient enhancedClient,
                                          QueryPerformanceTracker performanceTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.teamTable = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(Team.class));
        this.memberTable = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(TeamMember.class));
        this.inviteTable = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(InviteRecord.class));
        this.performanceTracker = performanceTracker;
    }

    @Override
    public SeatTransaction begin() {
        return new DynamoDbSeatTransaction();
    }

    private class DynamoDbSeatTransaction implements SeatTransaction {

        private final Map<Long, Team> lockedTeams = new TreeMap<>();
        private final List<InviteRecord> staged = new ArrayList<>();
        private boolean finished;

        @Override
        public void lockTeams(Collection<Long> teamIds) {
            for (Long teamId : new TreeSet<>(teamIds)) {
                if (lockedTeams.containsKey(teamId)) {
                    continue;
                }
                Team team = performanceTracker.trackQuery("lockTeam", TABLE_NAME, () -> teamTable.getItem(r -> r
                        .key(Key.builder()
                                .partitionValue(TeamInviteKeyFactory.getTeamPk(teamId))
                                .sortValue(TeamInviteKeyFactory.getMetadataSk())
                                .build())
                        .consistentRead(true)));
                if (team == null) {
                    throw new RepositoryException("Team not found: " + teamId);
                }
                lockedTeams.put(teamId, team);
            }
        }

        @Override
        public TeamSeatState readState(Long teamId, Instant inviteWindowStart) {
            Team team = lockedTeams.get(teamId);
            if (team == null) {
                throw new IllegalStateException("Team " + teamId + " is not locked by this transaction");
            }
            return performanceTracker.trackQuery("readTeamSeatState", TABLE_NAME, () -> {
                Set<String> members = new HashSet<>();
                memberTable.query(consistentPrefixQuery(teamId, TeamInviteKeyFactory.MEMBER_PREFIX, null))
                        .items().forEach(member -> members.add(member.getIdentity()));

                Expression recent = Expression.builder()
                        .expression("createdAt >= :since")
                        .putExpressionValue(":since", InstantAsLongAttributeConverter.toAttribute(inviteWindowStart))
                        .build();
                List<InviteRecord> invites = new ArrayList<>();
                inviteTable.query(consistentPrefixQuery(teamId, TeamInviteKeyFactory.INVITE_PREFIX, recent))
                        .items().forEach(invites::add);
                staged.stream().filter(r -> teamId.equals(r.getTeamId())).forEach(invites::add);

                return new TeamSeatState(team, members, invites);
            });
        }

        private QueryEnhancedRequest consistentPrefixQuery(Long teamId, String prefix, Expression filter) {
            QueryEnhancedRequest.Builder builder = QueryEnhancedRequest.builder()
                    .queryConditional(QueryConditional.sortBeginsWith(Key.builder()
                            .partitionValue(TeamInviteKeyFactory.getTeamPk(teamId))
                            .sortValue(prefix + "#")
                            .build()))
                    .consistentRead(true);
            if (filter != null) {
                builder.filterExpression(filter);
            }
            return builder.build();
        }

        @Override
        public void stageInvite(InviteRecord record) {
            if (!lockedTeams.containsKey(record.getTeamId())) {
                throw new IllegalStateException("Team " + record.getTeamId() + " is not locked by this transaction");
            }
            staged.add(record);
        }

        @Override
        public List<InviteRecord> getStagedInvites() {
            return Collections.unmodifiableList(staged);
        }

        @Override
        public void commit() {
            if (finished) {
                throw new IllegalStateException("Transaction already finished");
            }
            finished = true;
            if (staged.isEmpty()) {
                return;
            }

            Set<Long> touchedTeams = staged.stream().map(InviteRecord::getTeamId).collect(Collectors.toSet());
            if (staged.size() + touchedTeams.size() > MAX_TRANSACTION_ITEMS) {
                throw new IllegalStateException("Seat transaction too large: " + staged.size() + " invites");
            }

            List<TransactWriteItem> items = new ArrayList<>();
            long now = System.currentTimeMillis();
            for (Long teamId : touchedTeams) {
                items.add(versionBump(lockedTeams.get(teamId), now));
            }
            for (InviteRecord record : staged) {
                items.add(TransactWriteItem.builder()
                        .put(Put.builder()
                                .tableName(TABLE_NAME)
                                .item(inviteTable.tableSchema().itemToMap(record, true))
                                .conditionExpression("attribute_not_exists(pk)")
                                .build())
                        .build());
            }

            try {
                performanceTracker.trackWrite("commitSeatTransaction", TABLE_NAME, () ->
                        dynamoDbClient.transactWriteItems(TransactWriteItemsRequest.builder()
                                .transactItems(items)
                                .build()));
                logger.debug("Committed {} reservations on teams {}", staged.size(), touchedTeams);
            } catch (TransactionCanceledException e) {
                logger.debug("Seat transaction on teams {} cancelled: {}", touchedTeams, e.getMessage());
                throw new LockConflictException("Teams " + touchedTeams + " changed during reservation", e);
            }
        }

        private TransactWriteItem versionBump(Team team, long now) {
            long expected = team.getSeatVersion() == null ? 0L : team.getSeatVersion();

            Map<String, AttributeValue> key = new HashMap<>();
            key.put("pk", AttributeValue.builder().s(team.getPk()).build());
            key.put("sk", AttributeValue.builder().s(team.getSk()).build());

            Map<String, AttributeValue> values = new HashMap<>();
            values.put(":expected", AttributeValue.builder().n(String.valueOf(expected)).build());
            values.put(":next", AttributeValue.builder().n(String.valueOf(expected + 1)).build());
            values.put(":now", AttributeValue.builder().n(String.valueOf(now)).build());

            String condition = expected == 0L
                    ? "attribute_not_exists(seatVersion) OR seatVersion = :expected"
                    : "seatVersion = :expected";

            return TransactWriteItem.builder()
                    .update(Update.builder()
                            .tableName(TABLE_NAME)
                            .key(key)
                            .updateExpression("SET seatVersion = :next, updatedAt = :now")
                            .conditionExpression(condition)
                            .expressionAttributeValues(values)
                            .build())
                    .build();
        }

        @Override
        public void rollback() {
            finished = true;
            staged.clear();
        }

        @Override
        public void close() {
            if (!finished) {
                rollback();
            }
        }
    }
}
