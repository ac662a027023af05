package com.bbthechange.teaminvite.repository.impl;

import com.bbthechange.teaminvite.exception.LockConflictException;
import com.bbthechange.teaminvite.exception.RepositoryException;
import com.bbthechange.teaminvite.model.InviteRecord;
import com.bbthechange.teaminvite.model.InviteStatus;
import com.bbthechange.teaminvite.model.Team;
import com.bbthechange.teaminvite.model.TeamMember;
import com.bbthechange.teaminvite.repository.SeatTransaction;
import com.bbthechange.teaminvite.repository.TeamSeatState;
import com.bbthechange.teaminvite.util.QueryPerformanceTracker;
import com.bbthechange.teaminvite.util.TeamInviteKeyFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.PageIterable;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItem;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItemsRequest;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItemsResponse;
import software.amazon.awssdk.services.dynamodb.model.TransactionCanceledException;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DynamoDbSeatTransactionManagerTest {

    @Mock
    private DynamoDbClient dynamoDbClient;

    @Mock
    private DynamoDbEnhancedClient enhancedClient;

    @Mock
    private DynamoDbTable<Team> teamTable;

    @Mock
    private DynamoDbTable<TeamMember> memberTable;

    @Mock
    private DynamoDbTable<InviteRecord> inviteTable;

    private DynamoDbSeatTransactionManager manager;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        when(enhancedClient.table(anyString(), any(TableSchema.class))).thenAnswer(invocation -> {
            TableSchema<?> schema = invocation.getArgument(1);
            Class<?> itemClass = schema.itemType().rawClass();
            if (itemClass == Team.class) {
                return teamTable;
            }
            return itemClass == TeamMember.class ? memberTable : inviteTable;
        });
        when(inviteTable.tableSchema()).thenReturn(TableSchema.fromBean(InviteRecord.class));
        manager = new DynamoDbSeatTransactionManager(dynamoDbClient, enhancedClient,
                new QueryPerformanceTracker(new SimpleMeterRegistry()));
    }

    @SuppressWarnings("unchecked")
    private void teamExists(long teamId, long seatVersion) {
        Team team = new Team(teamId, "Team " + teamId, 5);
        team.setSeatVersion(seatVersion);
        when(teamTable.getItem(any(Consumer.class))).thenReturn(team);
    }

    private static InviteRecord reservation(long teamId) {
        return new InviteRecord(teamId, UUID.randomUUID().toString(), "a@example.com", InviteStatus.RESERVED,
                UUID.randomUUID().toString());
    }

    @Nested
    @DisplayName("commit")
    class CommitTests {

        @Test
        @DisplayName("should write invites and a conditional version bump in one transaction")
        void commit_StagedInvite_ConditionalVersionBump() {
            // Given
            teamExists(1L, 3L);
            when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
                    .thenReturn(TransactWriteItemsResponse.builder().build());

            // When
            try (SeatTransaction tx = manager.begin()) {
                tx.lockTeams(List.of(1L));
                tx.stageInvite(reservation(1L));
                tx.commit();
            }

            // Then
            ArgumentCaptor<TransactWriteItemsRequest> captor = ArgumentCaptor.forClass(TransactWriteItemsRequest.class);
            verify(dynamoDbClient).transactWriteItems(captor.capture());
            List<TransactWriteItem> items = captor.getValue().transactItems();
            assertThat(items).hasSize(2);
            assertThat(items.get(0).update().conditionExpression()).isEqualTo("seatVersion = :expected");
            assertThat(items.get(0).update().expressionAttributeValues().get(":expected").n()).isEqualTo("3");
            assertThat(items.get(0).update().expressionAttributeValues().get(":next").n()).isEqualTo("4");
            assertThat(items.get(1).put().conditionExpression()).isEqualTo("attribute_not_exists(pk)");
            assertThat(items.get(1).put().tableName()).isEqualTo(TeamInviteKeyFactory.TABLE_NAME);
        }

        @Test
        @DisplayName("should accept a team that never had a version")
        void commit_FreshTeam_AllowsMissingVersion() {
            // Given
            teamExists(1L, 0L);

            // When
            try (SeatTransaction tx = manager.begin()) {
                tx.lockTeams(List.of(1L));
                tx.stageInvite(reservation(1L));
                tx.commit();
            }

            // Then
            ArgumentCaptor<TransactWriteItemsRequest> captor = ArgumentCaptor.forClass(TransactWriteItemsRequest.class);
            verify(dynamoDbClient).transactWriteItems(captor.capture());
            assertThat(captor.getValue().transactItems().get(0).update().conditionExpression())
                    .contains("attribute_not_exists(seatVersion)");
        }

        @Test
        @DisplayName("should surface a cancelled transaction as a lock conflict")
        void commit_Cancelled_ThrowsLockConflict() {
            // Given
            teamExists(1L, 3L);
            when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
                    .thenThrow(TransactionCanceledException.builder().message("ConditionalCheckFailed").build());

            try (SeatTransaction tx = manager.begin()) {
                tx.lockTeams(List.of(1L));
                tx.stageInvite(reservation(1L));

                // When/Then
                assertThatThrownBy(tx::commit).isInstanceOf(LockConflictException.class);
            }
        }

        @Test
        @DisplayName("should not write anything when nothing was staged")
        void commit_NothingStaged_NoWrite() {
            // Given
            teamExists(1L, 3L);

            // When
            try (SeatTransaction tx = manager.begin()) {
                tx.lockTeams(List.of(1L));
                tx.commit();
            }

            // Then
            verify(dynamoDbClient, never()).transactWriteItems(any(TransactWriteItemsRequest.class));
        }
    }

    @Nested
    @DisplayName("locking")
    class LockingTests {

        @Test
        void lockTeams_UnknownTeam_Throws() {
            try (SeatTransaction tx = manager.begin()) {
                assertThatThrownBy(() -> tx.lockTeams(List.of(42L))).isInstanceOf(RepositoryException.class);
            }
        }

        @Test
        void stageInvite_TeamNotLocked_Throws() {
            try (SeatTransaction tx = manager.begin()) {
                assertThatThrownBy(() -> tx.stageInvite(reservation(1L))).isInstanceOf(IllegalStateException.class);
            }
        }

        @Test
        @SuppressWarnings("unchecked")
        void readState_IncludesMembersStoredAndStagedInvites() {
            // Given
            teamExists(1L, 3L);
            PageIterable<TeamMember> memberPages = mock(PageIterable.class);
            when(memberPages.items()).thenReturn(() -> List.of(new TeamMember(1L, "m@example.com")).iterator());
            PageIterable<InviteRecord> invitePages = mock(PageIterable.class);
            InviteRecord stored = reservation(1L);
            when(invitePages.items()).thenReturn(() -> List.of(stored).iterator());
            when(memberTable.query(any(QueryEnhancedRequest.class))).thenReturn(memberPages);
            when(inviteTable.query(any(QueryEnhancedRequest.class))).thenReturn(invitePages);

            try (SeatTransaction tx = manager.begin()) {
                tx.lockTeams(List.of(1L));
                InviteRecord staged = reservation(1L);
                tx.stageInvite(staged);

                // When
                TeamSeatState state = tx.readState(1L, Instant.EPOCH);

                // Then
                assertThat(state.getTeam().getSeatVersion()).isEqualTo(3L);
                assertThat(state.getMemberIdentities()).containsExactly("m@example.com");
                assertThat(state.getRecentInvites()).containsExactly(stored, staged);
            }
        }
    }
}
