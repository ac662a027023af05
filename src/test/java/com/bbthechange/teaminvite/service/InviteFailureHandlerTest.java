package com.bbthechange.teaminvite.service;

import com.bbthechange.teaminvite.dispatch.InviteTaskPublisher;
import com.bbthechange.teaminvite.dto.queue.DispatchInviteTask;
import com.bbthechange.teaminvite.dto.queue.ReserveSeatTask;
import com.bbthechange.teaminvite.exception.TaskPublishException;
import com.bbthechange.teaminvite.model.WaitingTaskStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InviteFailureHandlerTest {

    @Mock
    private InviteTaskRetryPolicy retryPolicy;

    @Mock
    private InviteTaskPublisher publisher;

    @Mock
    private QuotaCompensationService compensationService;

    @Mock
    private WaitingQueueService waitingQueueService;

    private InviteFailureHandler handler;
    private DispatchInviteTask task;

    @BeforeEach
    void setUp() {
        handler = new InviteFailureHandler(retryPolicy, publisher, compensationService, waitingQueueService,
                new SimpleMeterRegistry());
        task = new DispatchInviteTask();
        task.setRequestId(UUID.randomUUID().toString());
        task.setIdentity("user@example.com");
        task.setRedeemCode("CODE1");
        task.setWaitingTaskId(task.getRequestId());
        task.setTeamId(4L);
        task.setAttempt(1);
    }

    @Test
    @DisplayName("Should republish a reserve task one attempt later after the backoff")
    void handleTransientFailure_RetriesLeft_Republishes() {
        // Given
        when(retryPolicy.decide(1)).thenReturn(RetryDecision.retryAfter(Duration.ofSeconds(120)));

        // When
        handler.handleTransientFailure(task, "503 from membership API");

        // Then
        ArgumentCaptor<ReserveSeatTask> captor = ArgumentCaptor.forClass(ReserveSeatTask.class);
        verify(publisher).publish(captor.capture(), eq(Duration.ofSeconds(120)));
        assertThat(captor.getValue().getAttempt()).isEqualTo(2);
        assertThat(captor.getValue().getRequestId()).isEqualTo(task.getRequestId());
        assertThat(captor.getValue().getWaitingTaskId()).isEqualTo(task.getWaitingTaskId());
        verify(compensationService, never()).compensate(any(), any());
    }

    @Test
    @DisplayName("Should refund and fail the waiting task once retries are exhausted")
    void handleTransientFailure_RetriesExhausted_GivesUp() {
        // Given
        when(retryPolicy.decide(1)).thenReturn(RetryDecision.giveUp());

        // When
        handler.handleTransientFailure(task, "timeout");

        // Then
        verify(publisher, never()).publish(any(), any());
        verify(compensationService).compensate(task.getRequestId(), "CODE1");
        verify(waitingQueueService).complete(task.getWaitingTaskId(), WaitingTaskStatus.FAILED, "timeout");
    }

    @Test
    @DisplayName("Should give up when the retry cannot be published")
    void handleTransientFailure_PublishFails_GivesUp() {
        // Given
        when(retryPolicy.decide(1)).thenReturn(RetryDecision.retryAfter(Duration.ofSeconds(60)));
        doThrow(new TaskPublishException("queue down")).when(publisher).publish(any(), any());

        // When
        handler.handleTransientFailure(task, "timeout");

        // Then
        verify(compensationService).compensate(task.getRequestId(), "CODE1");
        verify(waitingQueueService).complete(eq(task.getWaitingTaskId()), eq(WaitingTaskStatus.FAILED),
                startsWith("timeout; retry not scheduled"));
    }

    @Test
    void handleTerminalFailure_NeverRetries() {
        // When
        handler.handleTerminalFailure(task, "account banned");

        // Then
        verify(retryPolicy, never()).decide(anyInt());
        verify(compensationService).compensate(task.getRequestId(), "CODE1");
        verify(waitingQueueService).complete(task.getWaitingTaskId(), WaitingTaskStatus.FAILED, "account banned");
    }
}
