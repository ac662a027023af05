package com.bbthechange.teaminvite.dispatch;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Soft time limit of one batch. Processing checks it between teams and stops starting new work
 * once it has passed.
 */
public final class TaskDeadline {

    private final Clock clock;
    private final Instant softLimit;

    public TaskDeadline(Clock clock, Duration softLimit) {
        this.clock = clock;
        this.softLimit = clock.instant().plus(softLimit);
    }

    public static TaskDeadline none(Clock clock) {
        return new TaskDeadline(clock, Duration.ofDays(3650));
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(softLimit);
    }

    public Instant getSoftLimit() {
        return softLimit;
    }
}
