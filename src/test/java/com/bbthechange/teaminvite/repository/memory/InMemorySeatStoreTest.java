package com.bbthechange.teaminvite.repository.memory;

import com.bbthechange.teaminvite.exception.LockConflictException;
import com.bbthechange.teaminvite.exception.RepositoryException;
import com.bbthechange.teaminvite.model.InviteRecord;
import com.bbthechange.teaminvite.model.InviteStatus;
import com.bbthechange.teaminvite.model.WaitingTask;
import com.bbthechange.teaminvite.repository.SeatTransaction;
import com.bbthechange.teaminvite.repository.TeamSeatState;
import com.bbthechange.teaminvite.testutil.SeatStoreFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemorySeatStoreTest {

    private static final Instant WINDOW_START = Instant.EPOCH;

    private SeatStoreFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new SeatStoreFixture(Duration.ofMillis(50));
        fixture.team(1L, 5);
    }

    private static InviteRecord reservation(long teamId, String identity) {
        return new InviteRecord(teamId, UUID.randomUUID().toString(), identity, InviteStatus.RESERVED,
                UUID.randomUUID().toString());
    }

    @Nested
    @DisplayName("Seat transactions")
    class SeatTransactions {

        @Test
        @DisplayName("Commit stores staged invites and bumps the team seat version")
        void commit_StagedInvites_PersistedAndVersionBumped() {
            // Given
            long before = fixture.teamRepository.findById(1L).orElseThrow().getSeatVersion();

            // When
            try (SeatTransaction tx = fixture.store.begin()) {
                tx.lockTeams(List.of(1L));
                tx.stageInvite(reservation(1L, "a@example.com"));
                tx.commit();
            }

            // Then
            assertThat(fixture.inviteRepository.findByTeamId(1L)).hasSize(1);
            assertThat(fixture.teamRepository.findById(1L).orElseThrow().getSeatVersion()).isEqualTo(before + 1);
        }

        @Test
        @DisplayName("Closing without commit discards staged invites")
        void close_WithoutCommit_Discarded() {
            // When
            try (SeatTransaction tx = fixture.store.begin()) {
                tx.lockTeams(List.of(1L));
                tx.stageInvite(reservation(1L, "a@example.com"));
            }

            // Then
            assertThat(fixture.inviteRepository.findByTeamId(1L)).isEmpty();
        }

        @Test
        @DisplayName("Reads see invites staged earlier in the same transaction")
        void readState_SeesStagedInvites() {
            // Given
            fixture.members(1L, 2);

            try (SeatTransaction tx = fixture.store.begin()) {
                tx.lockTeams(List.of(1L));
                tx.stageInvite(reservation(1L, "a@example.com"));

                // When
                TeamSeatState state = tx.readState(1L, WINDOW_START);

                // Then
                assertThat(state.getMemberIdentities()).hasSize(2);
                assertThat(state.getRecentInvites()).extracting(InviteRecord::getIdentity)
                        .containsExactly("a@example.com");
            }
        }

        @Test
        @DisplayName("Reading or staging on an unlocked team is refused")
        void readState_TeamNotLocked_Throws() {
            try (SeatTransaction tx = fixture.store.begin()) {
                assertThatThrownBy(() -> tx.readState(1L, WINDOW_START)).isInstanceOf(IllegalStateException.class);
                assertThatThrownBy(() -> tx.stageInvite(reservation(1L, "a@example.com")))
                        .isInstanceOf(IllegalStateException.class);
            }
        }

        @Test
        @DisplayName("A second transaction times out on a held team lock")
        void lockTeams_HeldElsewhere_LockConflict() {
            try (SeatTransaction holder = fixture.store.begin()) {
                holder.lockTeams(List.of(1L));

                // When
                CompletableFuture<Throwable> contender = CompletableFuture.supplyAsync(() -> {
                    try (SeatTransaction tx = fixture.store.begin()) {
                        tx.lockTeams(List.of(1L));
                        return null;
                    } catch (LockConflictException e) {
                        return e;
                    }
                });

                // Then
                assertThat(contender.join()).isInstanceOf(LockConflictException.class);
            }
        }
    }

    @Nested
    @DisplayName("Redeem codes")
    class RedeemCodes {

        @Test
        void recordUse_BindsFirstIdentityAndStopsAtLimit() {
            // Given
            fixture.code("CODE1", 2);

            // When
            boolean first = fixture.codeRepository.recordUse("CODE1", "A@Example.com");
            boolean second = fixture.codeRepository.recordUse("CODE1", "b@example.com");
            boolean third = fixture.codeRepository.recordUse("CODE1", "a@example.com");

            // Then
            assertThat(first).isTrue();
            assertThat(second).isTrue();
            assertThat(third).isFalse();
            assertThat(fixture.codeRepository.findByCode("CODE1").orElseThrow().getBoundIdentity())
                    .isEqualTo("a@example.com");
        }

        @Test
        void refundUse_SameKeyTwice_RefundsOnce() {
            // Given
            fixture.code("CODE1", 2);
            fixture.codeRepository.recordUse("CODE1", "a@example.com");

            // When
            boolean first = fixture.codeRepository.refundUse("CODE1", "request-1");
            boolean second = fixture.codeRepository.refundUse("CODE1", "request-1");

            // Then
            assertThat(first).isTrue();
            assertThat(second).isFalse();
            assertThat(fixture.codeRepository.findByCode("CODE1").orElseThrow().getUsedCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Waiting tasks")
    class WaitingTasks {

        @Test
        void save_StaleVersion_Rejected() {
            // Given
            WaitingTask task = new WaitingTask(UUID.randomUUID().toString(), "a@example.com", null, "CODE1");
            fixture.taskRepository.createIfAbsent(task);
            WaitingTask first = fixture.taskRepository.findById(task.getTaskId()).orElseThrow();
            WaitingTask second = fixture.taskRepository.findById(task.getTaskId()).orElseThrow();
            fixture.taskRepository.save(first);

            // When/Then
            assertThatThrownBy(() -> fixture.taskRepository.save(second)).isInstanceOf(RepositoryException.class);
        }

        @Test
        void createIfAbsent_ExistingId_ReturnsFalse() {
            // Given
            String taskId = UUID.randomUUID().toString();
            fixture.taskRepository.createIfAbsent(new WaitingTask(taskId, "a@example.com", null, "CODE1"));

            // When
            boolean created = fixture.taskRepository.createIfAbsent(
                    new WaitingTask(taskId, "a@example.com", null, "CODE1"));

            // Then
            assertThat(created).isFalse();
        }
    }
}
