package com.bbthechange.teaminvite.util;

import com.bbthechange.teaminvite.exception.InvalidKeyException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class TeamInviteKeyFactoryTest {

    private static final String VALID_UUID = "12345678-1234-1234-1234-123456789012";

    // ============================================================================
    // TEAM PARTITION KEYS
    // ============================================================================

    @Test
    void getTeamPk_WithValidTeamId_ShouldReturnCorrectKey() {
        assertThat(TeamInviteKeyFactory.getTeamPk(42L)).isEqualTo("TEAM#42");
    }

    @Test
    void getTeamPk_WithNonPositiveTeamId_ShouldThrowException() {
        assertThatThrownBy(() -> TeamInviteKeyFactory.getTeamPk(0L))
            .isInstanceOf(InvalidKeyException.class)
            .hasMessageContaining("positive");
        assertThatThrownBy(() -> TeamInviteKeyFactory.getTeamPk(null))
            .isInstanceOf(InvalidKeyException.class);
    }

    @Test
    void getTeamDirectorySk_ShouldSortNumerically() {
        // Given
        String nine = TeamInviteKeyFactory.getTeamDirectorySk(9L);
        String ten = TeamInviteKeyFactory.getTeamDirectorySk(10L);

        // Then
        assertThat(nine).isLessThan(ten);
        assertThat(ten).hasSize(19);
    }

    @Test
    void getMemberSk_ShouldNormalizeIdentity() {
        assertThat(TeamInviteKeyFactory.getMemberSk("  Alice@Example.COM "))
            .isEqualTo("MEMBER#alice@example.com");
    }

    @Test
    void getInviteSk_WithInvalidUuid_ShouldThrowException() {
        assertThatThrownBy(() -> TeamInviteKeyFactory.getInviteSk("not-a-uuid"))
            .isInstanceOf(InvalidKeyException.class)
            .hasMessageContaining("Invalid Invite ID format");
    }

    @Test
    void getInviteSk_WithValidUuid_ShouldReturnCorrectKey() {
        assertThat(TeamInviteKeyFactory.getInviteSk(VALID_UUID)).isEqualTo("INVITE#" + VALID_UUID);
    }

    // ============================================================================
    // WAITING TASK AND CODE KEYS
    // ============================================================================

    @Test
    void getTimeOrderedSk_ShouldOrderByCreationTime() {
        // Given
        Instant earlier = Instant.parse("2024-01-01T00:00:00Z");
        Instant later = earlier.plusMillis(1);

        // When
        String first = TeamInviteKeyFactory.getTimeOrderedSk(earlier, "z");
        String second = TeamInviteKeyFactory.getTimeOrderedSk(later, "a");

        // Then
        assertThat(first).isLessThan(second);
        assertThat(first).isLessThan(TeamInviteKeyFactory.getTimeOrderedUpperBound(earlier));
        assertThat(second).isGreaterThan(TeamInviteKeyFactory.getTimeOrderedUpperBound(earlier));
    }

    @Test
    void getQueueOrderSk_SameInstant_OrdersBySequenceNotId() {
        // Given
        Instant now = Instant.parse("2024-01-01T00:00:00Z");

        // When
        String first = TeamInviteKeyFactory.getQueueOrderSk(now, 9, "zzz");
        String second = TeamInviteKeyFactory.getQueueOrderSk(now, 10, "aaa");
        String later = TeamInviteKeyFactory.getQueueOrderSk(now.plusMillis(1), 1, "aaa");

        // Then
        assertThat(first).isLessThan(second);
        assertThat(second).isLessThan(later);
        assertThat(first).isGreaterThan(TeamInviteKeyFactory.getTimePrefix(now));
        assertThat(first).isLessThan(TeamInviteKeyFactory.getTimePrefix(now.plusMillis(1)));
    }

    @Test
    void getIdentityKey_ShouldCombineNormalizedIdentityAndCode() {
        assertThat(TeamInviteKeyFactory.getIdentityKey("Bob@Example.com", "SPRING-24"))
            .isEqualTo("IDENTITY#bob@example.com#SPRING-24");
    }

    @Test
    void validateCode_WithIllegalCharacters_ShouldThrowException() {
        assertThatThrownBy(() -> TeamInviteKeyFactory.validateCode("bad code!"))
            .isInstanceOf(InvalidKeyException.class)
            .hasMessageContaining("Invalid redeem code format");
        assertThatThrownBy(() -> TeamInviteKeyFactory.validateCode(null))
            .isInstanceOf(InvalidKeyException.class);
    }

    @Test
    void normalizeIdentity_WithBlankIdentity_ShouldThrowException() {
        assertThatThrownBy(() -> TeamInviteKeyFactory.normalizeIdentity("   "))
            .isInstanceOf(InvalidKeyException.class)
            .hasMessageContaining("Identity cannot be null or empty");
    }

    @Test
    void getRefundSk_WithEmptyKey_ShouldThrowException() {
        assertThatThrownBy(() -> TeamInviteKeyFactory.getRefundSk(""))
            .isInstanceOf(InvalidKeyException.class);
        assertThat(TeamInviteKeyFactory.getRefundSk(VALID_UUID)).isEqualTo("REFUND#" + VALID_UUID);
    }
}
