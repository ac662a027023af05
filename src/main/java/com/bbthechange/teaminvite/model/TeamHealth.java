package com.bbthechange.teaminvite.model;

/**
 * Health of a team's external account. Only ACTIVE teams receive new invites.
 */
public enum TeamHealth {
    ACTIVE,
    BANNED,
    TOKEN_INVALID,
    PAUSED;

    public boolean isHealthy() {
        return this == ACTIVE;
    }
}
