package com.bbthechange.teaminvite.listener;

import com.bbthechange.teaminvite.config.TeamInviteProperties;
import com.bbthechange.teaminvite.dispatch.InviteTaskChannel;
import com.bbthechange.teaminvite.dto.queue.DispatchInviteTask;
import com.bbthechange.teaminvite.dto.queue.InviteTaskMessage;
import com.bbthechange.teaminvite.dto.queue.ReserveSeatTask;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InviteTaskListenerTest {

    private InviteTaskChannel channel;
    private SimpleMeterRegistry meterRegistry;
    private InviteTaskListener listener;

    @BeforeEach
    void setUp() {
        channel = new InviteTaskChannel(new TeamInviteProperties());
        meterRegistry = new SimpleMeterRegistry();
        listener = new InviteTaskListener(channel, new ObjectMapper(), meterRegistry);
    }

    private double received(String type, String status) {
        return meterRegistry.counter("team_invite_task_received_total", "type", type, "status", status).count();
    }

    @Test
    void handleMessage_ReserveSeat_HandsTaskToChannel() throws Exception {
        // Given
        String messageBody = """
            {"type":"RESERVE_SEAT","messageId":"msg-1","requestId":"req-1","identity":"a@example.com",
             "groupId":3,"redeemCode":"CODE1","attempt":1}
            """;

        // When
        listener.handleMessage(messageBody);

        // Then
        List<InviteTaskMessage> batch = channel.drainBatch(10, Duration.ofMillis(10));
        assertThat(batch).singleElement().isInstanceOf(ReserveSeatTask.class);
        ReserveSeatTask task = (ReserveSeatTask) batch.get(0);
        assertThat(task.getRequestId()).isEqualTo("req-1");
        assertThat(task.getGroupId()).isEqualTo(3L);
        assertThat(task.getAttempt()).isEqualTo(1);
        assertThat(received("RESERVE_SEAT", "success")).isEqualTo(1.0);
    }

    @Test
    void handleMessage_DispatchInvite_KeepsReservation() throws Exception {
        // Given
        String messageBody = """
            {"type":"DISPATCH_INVITE","messageId":"msg-2","requestId":"req-2","identity":"b@example.com",
             "teamId":9,"inviteId":"invite-9"}
            """;

        // When
        listener.handleMessage(messageBody);

        // Then
        DispatchInviteTask task = (DispatchInviteTask) channel.drainBatch(1, Duration.ofMillis(10)).get(0);
        assertThat(task.getTeamId()).isEqualTo(9L);
        assertThat(task.getInviteId()).isEqualTo("invite-9");
    }

    @Test
    void handleMessage_MissingType_Dropped() throws Exception {
        // When
        listener.handleMessage("{\"requestId\":\"req-3\"}");

        // Then
        assertThat(channel.size()).isZero();
        assertThat(received("unknown", "missing_type")).isEqualTo(1.0);
    }

    @Test
    void handleMessage_UnknownType_CountedAsError() throws Exception {
        // When
        listener.handleMessage("{\"type\":\"DELETE_EVERYTHING\"}");

        // Then
        assertThat(channel.size()).isZero();
        assertThat(received("DELETE_EVERYTHING", "error")).isEqualTo(1.0);
    }

    @Test
    void handleMessage_MalformedJson_CountedAsError() throws Exception {
        // When
        listener.handleMessage("not json");

        // Then
        assertThat(received("unknown", "error")).isEqualTo(1.0);
    }
}
