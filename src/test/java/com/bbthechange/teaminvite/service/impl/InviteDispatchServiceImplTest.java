package com.bbthechange.teaminvite.service.impl;

import com.bbthechange.teaminvite.coordination.ExclusiveJobRunner;
import com.bbthechange.teaminvite.coordination.InMemoryCoordinator;
import com.bbthechange.teaminvite.dispatch.InviteTaskPublisher;
import com.bbthechange.teaminvite.dto.InviteHandle;
import com.bbthechange.teaminvite.dto.InviteState;
import com.bbthechange.teaminvite.dto.SeatSummary;
import com.bbthechange.teaminvite.dto.queue.DispatchInviteTask;
import com.bbthechange.teaminvite.dto.queue.InviteTaskMessage;
import com.bbthechange.teaminvite.dto.queue.ReserveSeatTask;
import com.bbthechange.teaminvite.exception.InvalidKeyException;
import com.bbthechange.teaminvite.exception.RedeemCodeRejectedException;
import com.bbthechange.teaminvite.exception.RepositoryException;
import com.bbthechange.teaminvite.exception.TaskPublishException;
import com.bbthechange.teaminvite.model.InviteRecord;
import com.bbthechange.teaminvite.model.InviteStatus;
import com.bbthechange.teaminvite.model.RedeemCode;
import com.bbthechange.teaminvite.model.WaitingTaskStatus;
import com.bbthechange.teaminvite.service.QuotaCompensationService;
import com.bbthechange.teaminvite.service.SeatReservationService;
import com.bbthechange.teaminvite.service.WaitingQueueReconciler;
import com.bbthechange.teaminvite.service.WaitingQueueService;
import com.bbthechange.teaminvite.service.throttle.RateLimitingService;
import com.bbthechange.teaminvite.service.throttle.RedeemTokenBucket;
import com.bbthechange.teaminvite.service.throttle.RedemptionSemaphore;
import com.bbthechange.teaminvite.testutil.SeatStoreFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class InviteDispatchServiceImplTest {

    private SeatStoreFixture fixture;
    private InMemoryCoordinator coordinator;
    private InviteTaskPublisher publisher;
    private RedeemTokenBucket tokenBucket;
    private WaitingQueueService waitingQueue;
    private QuotaCompensationService compensation;
    private InviteDispatchServiceImpl dispatchService;

    @BeforeEach
    void setUp() {
        fixture = new SeatStoreFixture();
        fixture.properties.getThrottle().setAcquireTimeout(Duration.ofMillis(20));
        coordinator = new InMemoryCoordinator();
        publisher = mock(InviteTaskPublisher.class);
        tokenBucket = new RedeemTokenBucket(coordinator, fixture.codeRepository, fixture.properties,
                fixture.meterRegistry);
        waitingQueue = new WaitingQueueService(fixture.taskRepository, fixture.meterRegistry, fixture.clock);
        compensation = new QuotaCompensationService(fixture.codeRepository, tokenBucket, fixture.meterRegistry);
        dispatchService = new InviteDispatchServiceImpl(
                new RateLimitingService(coordinator, fixture.properties, fixture.meterRegistry, fixture.clock),
                new RedemptionSemaphore(coordinator, fixture.properties, fixture.meterRegistry),
                tokenBucket, fixture.codeRepository, fixture.inviteRepository, fixture.reservationService,
                fixture.ledgerService, waitingQueue, compensation, publisher, fixture.meterRegistry, fixture.clock);
    }

    private InviteDispatchServiceImpl withReservationService(SeatReservationService reservationService) {
        return new InviteDispatchServiceImpl(
                new RateLimitingService(coordinator, fixture.properties, fixture.meterRegistry, fixture.clock),
                new RedemptionSemaphore(coordinator, fixture.properties, fixture.meterRegistry),
                tokenBucket, fixture.codeRepository, fixture.inviteRepository, reservationService,
                fixture.ledgerService, waitingQueue, compensation, publisher, fixture.meterRegistry, fixture.clock);
    }

    @Nested
    @DisplayName("enqueueInvite")
    class EnqueueInvite {

        @Test
        @DisplayName("Should reserve a seat and queue a dispatch task when a seat is free")
        void enqueueInvite_SeatFree_ReservesAndQueues() {
            // Given
            fixture.team(1L, 3);
            fixture.code("WELCOME", 5);

            // When
            InviteHandle handle = dispatchService.enqueueInvite("New.User@Example.com", "WELCOME", null);

            // Then
            assertThat(handle.getState()).isEqualTo(InviteState.INVITE_QUEUED);
            assertThat(handle.getTeamId()).isEqualTo(1L);
            ArgumentCaptor<InviteTaskMessage> captor = ArgumentCaptor.forClass(InviteTaskMessage.class);
            verify(publisher).publish(captor.capture());
            DispatchInviteTask task = (DispatchInviteTask) captor.getValue();
            assertThat(task.getRequestId()).isEqualTo(handle.getRequestId());
            assertThat(task.getIdentity()).isEqualTo("new.user@example.com");
            assertThat(task.getTeamId()).isEqualTo(1L);
            InviteRecord record = fixture.inviteRepository.findById(1L, task.getInviteId()).orElseThrow();
            assertThat(record.getStatus()).isEqualTo(InviteStatus.RESERVED);
            assertThat(fixture.codeRepository.findByCode("WELCOME").orElseThrow().getUsedCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should park requests in FIFO order when no seat is free")
        void enqueueInvite_NoSeats_ParkedInOrder() {
            // Given
            fixture.team(1L, 1);
            fixture.members(1L, 1);
            fixture.code("FIRST", 1);
            fixture.code("SECOND", 1);

            // When
            InviteHandle first = dispatchService.enqueueInvite("a@example.com", "FIRST", null);
            InviteHandle second = dispatchService.enqueueInvite("b@example.com", "SECOND", null);

            // Then
            assertThat(first.getState()).isEqualTo(InviteState.WAITING_FOR_SEAT);
            assertThat(first.getQueuePosition()).isEqualTo(1);
            assertThat(second.getQueuePosition()).isEqualTo(2);
            assertThat(dispatchService.getQueueDepth()).containsEntry(WaitingTaskStatus.WAITING, 2L);
            verify(publisher, never()).publish(any());
        }

        @Test
        @DisplayName("Should promote the oldest waiting request once a seat frees up")
        void enqueueInvite_SeatFreedLater_OldestPromoted() {
            // Given
            fixture.team(1L, 1);
            fixture.members(1L, 1);
            fixture.code("FIRST", 1);
            fixture.code("SECOND", 1);
            InviteHandle first = dispatchService.enqueueInvite("a@example.com", "FIRST", null);
            InviteHandle second = dispatchService.enqueueInvite("b@example.com", "SECOND", null);
            WaitingQueueReconciler reconciler = new WaitingQueueReconciler(new ExclusiveJobRunner(coordinator),
                    fixture.ledgerService, fixture.taskRepository, fixture.codeRepository, compensation, publisher,
                    fixture.properties, fixture.meterRegistry, fixture.clock);

            // When
            fixture.memberRepository.delete(1L, "member0@team1.test");
            int promoted = reconciler.reconcile();

            // Then
            assertThat(promoted).isEqualTo(1);
            ArgumentCaptor<InviteTaskMessage> captor = ArgumentCaptor.forClass(InviteTaskMessage.class);
            verify(publisher).publish(captor.capture());
            assertThat(((ReserveSeatTask) captor.getValue()).getRequestId()).isEqualTo(first.getRequestId());
            assertThat(fixture.taskRepository.findById(first.getRequestId()).orElseThrow().getStatus())
                .isEqualTo(WaitingTaskStatus.PROCESSING);
            assertThat(fixture.taskRepository.findById(second.getRequestId()).orElseThrow().getStatus())
                .isEqualTo(WaitingTaskStatus.WAITING);
        }

        @Test
        @DisplayName("Should return the code use when the seat store fails during reservation")
        void enqueueInvite_ReservationStoreFails_UseRefunded() {
            // Given
            fixture.code("ONCE", 1);
            SeatReservationService failing = mock(SeatReservationService.class);
            when(failing.reserveSeat(any())).thenThrow(new RepositoryException("store timeout"));
            InviteDispatchServiceImpl service = withReservationService(failing);

            // When / Then
            assertThatThrownBy(() -> service.enqueueInvite("a@example.com", "ONCE", null))
                .isInstanceOf(RepositoryException.class)
                .hasMessage("store timeout");
            assertThat(fixture.codeRepository.findByCode("ONCE").orElseThrow().getUsedCount()).isZero();
            assertThat(tokenBucket.remaining("ONCE")).hasValue(1L);
            assertThat(fixture.taskRepository.countByStatus(WaitingTaskStatus.WAITING)).isZero();
            verify(publisher, never()).publish(any());
        }

        @Test
        @DisplayName("Should allow the code to be redeemed again after a failed reservation")
        void enqueueInvite_AfterReservationFailure_CodeStillUsable() {
            // Given
            fixture.team(1L, 2);
            fixture.code("ONCE", 1);
            SeatReservationService failing = mock(SeatReservationService.class);
            when(failing.reserveSeat(any())).thenThrow(new RepositoryException("store timeout"));
            assertThatThrownBy(() -> withReservationService(failing).enqueueInvite("a@example.com", "ONCE", null))
                .isInstanceOf(RepositoryException.class);

            // When
            InviteHandle handle = dispatchService.enqueueInvite("a@example.com", "ONCE", null);

            // Then
            assertThat(handle.getState()).isEqualTo(InviteState.INVITE_QUEUED);
            assertThat(fixture.codeRepository.findByCode("ONCE").orElseThrow().getUsedCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should hand back the existing waiting request when the same identity retries a code")
        void enqueueInvite_AlreadyWaiting_ReturnsExistingRequest() {
            // Given
            fixture.code("AGAIN", 3);
            InviteHandle first = dispatchService.enqueueInvite("a@example.com", "AGAIN", null);

            // When
            InviteHandle again = dispatchService.enqueueInvite("a@example.com", "AGAIN", null);

            // Then
            assertThat(again.getRequestId()).isEqualTo(first.getRequestId());
            assertThat(fixture.codeRepository.findByCode("AGAIN").orElseThrow().getUsedCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should use the code's group when the caller gives none")
        void enqueueInvite_CodeHasGroup_ReservesInGroup() {
            // Given
            fixture.team(1L, 3, 4L);
            fixture.team(2L, 3, 9L);
            RedeemCode code = fixture.code("GROUPED", 2);
            code.setGroupId(9L);
            fixture.codeRepository.save(code);

            // When
            InviteHandle handle = dispatchService.enqueueInvite("a@example.com", "GROUPED", null);

            // Then
            assertThat(handle.getTeamId()).isEqualTo(2L);
        }
    }

    @Nested
    @DisplayName("Code rejection")
    class CodeRejection {

        @Test
        void enqueueInvite_UnknownCode_NotFound() {
            assertThatThrownBy(() -> dispatchService.enqueueInvite("a@example.com", "NOPE", null))
                .isInstanceOf(RedeemCodeRejectedException.class)
                .extracting("reason").isEqualTo(RedeemCodeRejectedException.Reason.NOT_FOUND);
        }

        @Test
        void enqueueInvite_MalformedCode_InvalidKey() {
            assertThatThrownBy(() -> dispatchService.enqueueInvite("a@example.com", "bad code", null))
                .isInstanceOf(InvalidKeyException.class);
        }

        @Test
        void enqueueInvite_DisabledCode_Inactive() {
            // Given
            RedeemCode code = fixture.code("OFF", 3);
            code.setActive(false);
            fixture.codeRepository.save(code);

            // Then
            assertThatThrownBy(() -> dispatchService.enqueueInvite("a@example.com", "OFF", null))
                .isInstanceOf(RedeemCodeRejectedException.class)
                .extracting("reason").isEqualTo(RedeemCodeRejectedException.Reason.INACTIVE);
        }

        @Test
        void enqueueInvite_ExpiredCode_Expired() {
            // Given
            RedeemCode code = fixture.code("OLD", 3);
            code.setExpiresAt(fixture.clock.instant().minusSeconds(60));
            fixture.codeRepository.save(code);

            // Then
            assertThatThrownBy(() -> dispatchService.enqueueInvite("a@example.com", "OLD", null))
                .isInstanceOf(RedeemCodeRejectedException.class)
                .extracting("reason").isEqualTo(RedeemCodeRejectedException.Reason.EXPIRED);
        }

        @Test
        @DisplayName("Should bind a code to its first identity and refuse others")
        void enqueueInvite_CodeUsedByOtherIdentity_BoundToOther() {
            // Given
            fixture.team(1L, 5);
            fixture.code("MINE", 3);
            dispatchService.enqueueInvite("owner@example.com", "MINE", null);

            // Then
            assertThatThrownBy(() -> dispatchService.enqueueInvite("someone@example.com", "MINE", null))
                .isInstanceOf(RedeemCodeRejectedException.class)
                .extracting("reason").isEqualTo(RedeemCodeRejectedException.Reason.BOUND_TO_OTHER_IDENTITY);
        }

        @Test
        @DisplayName("Should refuse once the code's uses are gone")
        void enqueueInvite_CodeUsedUp_Exhausted() {
            // Given
            fixture.team(1L, 5);
            fixture.code("ONCE", 1);
            dispatchService.enqueueInvite("a@example.com", "ONCE", null);

            // Then
            assertThatThrownBy(() -> dispatchService.enqueueInvite("a@example.com", "ONCE", null))
                .isInstanceOf(RedeemCodeRejectedException.class)
                .extracting("reason").isEqualTo(RedeemCodeRejectedException.Reason.EXHAUSTED);
        }

        @Test
        void enqueueInvite_TooManyAttempts_RateLimited() {
            // Given
            fixture.properties.getThrottle().setRequestsPerMinute(1);
            fixture.code("FAST", 5);
            dispatchService.enqueueInvite("a@example.com", "FAST", null);

            // Then
            assertThatThrownBy(() -> dispatchService.enqueueInvite("a@example.com", "FAST", null))
                .isInstanceOf(RedeemCodeRejectedException.class)
                .extracting("reason").isEqualTo(RedeemCodeRejectedException.Reason.RATE_LIMITED);
        }

        @Test
        void enqueueInvite_AllPermitsHeld_Busy() {
            // Given
            fixture.properties.getThrottle().setMaxConcurrentRedemptions(1);
            coordinator.tryAcquirePermit("redeem:inflight", 1, Duration.ofMinutes(1));
            fixture.code("BUSY", 5);

            // Then
            assertThatThrownBy(() -> dispatchService.enqueueInvite("a@example.com", "BUSY", null))
                .isInstanceOf(RedeemCodeRejectedException.class)
                .extracting("reason").isEqualTo(RedeemCodeRejectedException.Reason.BUSY);
        }
    }

    @Test
    @DisplayName("Should release the seat and refund the use when the dispatch task cannot be queued")
    void enqueueInvite_PublishFails_SeatReleasedAndRefunded() {
        // Given
        fixture.team(1L, 1);
        fixture.code("LOST", 2);
        doThrow(new TaskPublishException("queue down")).when(publisher).publish(any());

        // When/Then
        assertThatThrownBy(() -> dispatchService.enqueueInvite("a@example.com", "LOST", null))
            .isInstanceOf(TaskPublishException.class);
        List<InviteRecord> records = fixture.inviteRepository.findByTeamId(1L);
        assertThat(records).singleElement().extracting(InviteRecord::getStatus).isEqualTo(InviteStatus.FAILED);
        assertThat(fixture.codeRepository.findByCode("LOST").orElseThrow().getUsedCount()).isZero();
        assertThat(dispatchService.getCapacity(null).getAvailable()).isEqualTo(1);
    }

    @Test
    void getCapacity_SummarizesGroup() {
        // Given
        fixture.team(1L, 4);
        fixture.members(1L, 1);

        // When
        SeatSummary summary = dispatchService.getCapacity(null);

        // Then
        assertThat(summary.getAvailable()).isEqualTo(3);
    }

    @Test
    void enqueueInvite_ManyRequestsOneSeat_OnlyOneQueued() {
        // Given
        fixture.team(1L, 1);
        for (int i = 0; i < 3; i++) {
            fixture.code("MANY" + i, 1);
        }

        // When
        for (int i = 0; i < 3; i++) {
            dispatchService.enqueueInvite("user" + i + "@example.com", "MANY" + i, null);
            fixture.clock.advance(Duration.ofSeconds(1));
        }

        // Then
        verify(publisher, times(1)).publish(any());
        Map<WaitingTaskStatus, Long> depth = dispatchService.getQueueDepth();
        assertThat(depth).containsEntry(WaitingTaskStatus.WAITING, 2L);
    }
}
