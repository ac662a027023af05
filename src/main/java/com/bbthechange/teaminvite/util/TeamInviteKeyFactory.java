package com.bbthechange.teaminvite.util;

import com.bbthechange.teaminvite.exception.InvalidKeyException;

import java.time.Instant;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Key factory for the TeamInviteTable single-table layout.
 *
 * Key patterns:
 * <ul>
 *   <li>Team: PK = TEAM#{teamId}, SK = METADATA</li>
 *   <li>Member: PK = TEAM#{teamId}, SK = MEMBER#{identity}</li>
 *   <li>Invite record: PK = TEAM#{teamId}, SK = INVITE#{inviteId}</li>
 *   <li>Waiting task: PK = TASK#{taskId}, SK = METADATA</li>
 *   <li>Redeem code: PK = CODE#{code}, SK = METADATA; refund markers under SK = REFUND#{key}</li>
 * </ul>
 */
public final class TeamInviteKeyFactory {
    private static final String DELIMITER = "#";
    private static final Pattern UUID_PATTERN = Pattern.compile(
        "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern CODE_PATTERN = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    public static final String TABLE_NAME = "TeamInviteTable";

    public static final String TEAM_PREFIX = "TEAM";
    public static final String MEMBER_PREFIX = "MEMBER";
    public static final String INVITE_PREFIX = "INVITE";
    public static final String TASK_PREFIX = "TASK";
    public static final String CODE_PREFIX = "CODE";
    public static final String REFUND_PREFIX = "REFUND";
    public static final String METADATA_SUFFIX = "METADATA";

    // DirectoryIndex partitions
    public static final String TEAM_DIRECTORY = "TEAM_DIRECTORY";
    public static final String CODE_DIRECTORY = "CODE_DIRECTORY";
    public static final String INVITE_STATUS_PREFIX = "INVITE_STATUS";
    public static final String TASK_STATUS_PREFIX = "TASK_STATUS";

    // LookupIndex partitions
    public static final String REQUEST_PREFIX = "REQUEST";
    public static final String IDENTITY_PREFIX = "IDENTITY";

    public static final String DIRECTORY_INDEX = "DirectoryIndex";
    public static final String LOOKUP_INDEX = "LookupIndex";

    private TeamInviteKeyFactory() {
        throw new UnsupportedOperationException("Utility class");
    }

    private static void validateUuid(String id, String type) {
        if (id == null || id.trim().isEmpty()) {
            throw new InvalidKeyException(type + " ID cannot be null or empty");
        }
        if (!UUID_PATTERN.matcher(id).matches()) {
            throw new InvalidKeyException("Invalid " + type + " ID format: " + id);
        }
    }

    private static void validateTeamId(Long teamId) {
        if (teamId == null || teamId <= 0) {
            throw new InvalidKeyException("Team ID must be a positive number: " + teamId);
        }
    }

    /**
     * Identities are matched case-insensitively everywhere; this is the canonical form.
     */
    public static String normalizeIdentity(String identity) {
        if (identity == null || identity.trim().isEmpty()) {
            throw new InvalidKeyException("Identity cannot be null or empty");
        }
        return identity.trim().toLowerCase(Locale.ROOT);
    }

    public static String validateCode(String code) {
        if (code == null || !CODE_PATTERN.matcher(code).matches()) {
            throw new InvalidKeyException("Invalid redeem code format: " + code);
        }
        return code;
    }

    // Team partition
    public static String getTeamPk(Long teamId) {
        validateTeamId(teamId);
        return TEAM_PREFIX + DELIMITER + teamId;
    }

    public static String getMetadataSk() {
        return METADATA_SUFFIX;
    }

    public static String getMemberSk(String identity) {
        return MEMBER_PREFIX + DELIMITER + normalizeIdentity(identity);
    }

    public static String getInviteSk(String inviteId) {
        validateUuid(inviteId, "Invite");
        return INVITE_PREFIX + DELIMITER + inviteId;
    }

    /**
     * Zero-padded so the DirectoryIndex sort key orders teams by ascending numeric id.
     */
    public static String getTeamDirectorySk(Long teamId) {
        validateTeamId(teamId);
        return String.format("%019d", teamId);
    }

    // Waiting tasks
    public static String getTaskPk(String taskId) {
        validateUuid(taskId, "Task");
        return TASK_PREFIX + DELIMITER + taskId;
    }

    public static String getTaskStatusKey(String status) {
        return TASK_STATUS_PREFIX + DELIMITER + status;
    }

    public static String getInviteStatusKey(String status) {
        return INVITE_STATUS_PREFIX + DELIMITER + status;
    }

    public static String getTimeOrderedSk(Instant createdAt, String id) {
        return String.format("%015d", createdAt.toEpochMilli()) + DELIMITER + id;
    }

    /**
     * Waiting-queue order: creation time, then the park sequence for tasks parked in the same
     * millisecond. Shares its time prefix with {@link #getTimeOrderedSk}.
     */
    public static String getQueueOrderSk(Instant createdAt, long sequence, String id) {
        return String.format("%015d", createdAt.toEpochMilli()) + DELIMITER
                + String.format("%019d", sequence) + DELIMITER + id;
    }

    /**
     * Sorts before every time-ordered key created at {@code instant} or later.
     */
    public static String getTimePrefix(Instant instant) {
        return String.format("%015d", instant.toEpochMilli());
    }

    /**
     * Upper bound for a time-ordered sort key range: every key created at or before {@code instant}.
     */
    public static String getTimeOrderedUpperBound(Instant instant) {
        return String.format("%015d", instant.toEpochMilli()) + DELIMITER + "~";
    }

    public static String getRequestKey(String requestId) {
        validateUuid(requestId, "Request");
        return REQUEST_PREFIX + DELIMITER + requestId;
    }

    public static String getIdentityKey(String identity, String code) {
        return IDENTITY_PREFIX + DELIMITER + normalizeIdentity(identity) + DELIMITER + validateCode(code);
    }

    // Redeem codes
    public static String getCodePk(String code) {
        return CODE_PREFIX + DELIMITER + validateCode(code);
    }

    public static String getRefundSk(String refundKey) {
        if (refundKey == null || refundKey.trim().isEmpty()) {
            throw new InvalidKeyException("Refund key cannot be null or empty");
        }
        return REFUND_PREFIX + DELIMITER + refundKey;
    }
}
