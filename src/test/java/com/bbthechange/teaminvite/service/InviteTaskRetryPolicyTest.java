package com.bbthechange.teaminvite.service;

import com.bbthechange.teaminvite.config.TeamInviteProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class InviteTaskRetryPolicyTest {

    private TeamInviteProperties properties;

    @BeforeEach
    void setUp() {
        properties = new TeamInviteProperties();
        properties.getRetry().setMaxRetries(3);
        properties.getRetry().setBaseDelay(Duration.ofSeconds(60));
        properties.getRetry().setMaxDelay(Duration.ofSeconds(600));
    }

    @Test
    void backoff_WithoutJitter_DoublesUntilCapped() {
        // Given
        properties.getRetry().setJitter(false);
        InviteTaskRetryPolicy policy = new InviteTaskRetryPolicy(properties);

        // Then
        assertThat(policy.backoff(0)).isEqualTo(Duration.ofSeconds(60));
        assertThat(policy.backoff(1)).isEqualTo(Duration.ofSeconds(120));
        assertThat(policy.backoff(2)).isEqualTo(Duration.ofSeconds(240));
        assertThat(policy.backoff(3)).isEqualTo(Duration.ofSeconds(480));
        assertThat(policy.backoff(4)).isEqualTo(Duration.ofSeconds(600));
        assertThat(policy.backoff(200)).isEqualTo(Duration.ofSeconds(600));
    }

    @Test
    void backoff_WithJitter_StaysInUpperHalf() {
        // Given
        InviteTaskRetryPolicy low = new InviteTaskRetryPolicy(properties, () -> 0.0);
        InviteTaskRetryPolicy high = new InviteTaskRetryPolicy(properties, () -> 0.999999);

        // Then
        assertThat(low.backoff(1)).isEqualTo(Duration.ofSeconds(60));
        assertThat(high.backoff(1)).isBetween(Duration.ofSeconds(119), Duration.ofSeconds(120));
    }

    @Test
    void decide_BelowLimit_Retries() {
        // Given
        properties.getRetry().setJitter(false);
        InviteTaskRetryPolicy policy = new InviteTaskRetryPolicy(properties);

        // When
        RetryDecision decision = policy.decide(2);

        // Then
        assertThat(decision.isRetry()).isTrue();
        assertThat(decision.getDelay()).isEqualTo(Duration.ofSeconds(240));
    }

    @Test
    void decide_AtLimit_GivesUp() {
        // Given
        InviteTaskRetryPolicy policy = new InviteTaskRetryPolicy(properties);

        // Then
        assertThat(policy.decide(3).isRetry()).isFalse();
        assertThat(policy.decide(7).isRetry()).isFalse();
    }
}
