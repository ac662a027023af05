package com.bbthechange.teaminvite.dto.queue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InviteTaskMessageTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void serialize_WritesTypeOnceAndOmitsReservationRequest() throws Exception {
        // Given
        ReserveSeatTask task = new ReserveSeatTask();
        task.setRequestId("req-1");
        task.setIdentity("a@example.com");

        // When
        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(task));

        // Then
        assertThat(json.get("type").asText()).isEqualTo(ReserveSeatTask.TYPE);
        assertThat(json.has("reservationRequest")).isFalse();
    }

    @Test
    void retryOf_NextAttemptKeepsRequestFields() {
        // Given
        DispatchInviteTask dispatch = new DispatchInviteTask();
        dispatch.setRequestId("req-1");
        dispatch.setIdentity("a@example.com");
        dispatch.setRedeemCode("CODE1");
        dispatch.setWaitingTaskId("req-1");
        dispatch.setTeamId(4L);
        dispatch.setAttempt(2);

        // When
        ReserveSeatTask retry = ReserveSeatTask.retryOf(dispatch);

        // Then
        assertThat(retry.getType()).isEqualTo(ReserveSeatTask.TYPE);
        assertThat(retry.getAttempt()).isEqualTo(3);
        assertThat(retry.getRequestId()).isEqualTo("req-1");
        assertThat(retry.getWaitingTaskId()).isEqualTo("req-1");
        assertThat(retry.getMessageId()).isNull();
    }

    @Test
    void requeueOf_SameAttempt() {
        // Given
        ReserveSeatTask task = new ReserveSeatTask();
        task.setAttempt(1);

        // When
        ReserveSeatTask requeued = ReserveSeatTask.requeueOf(task);

        // Then
        assertThat(requeued.getAttempt()).isEqualTo(1);
    }
}
