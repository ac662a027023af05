package com.bbthechange.teaminvite.service;

import java.time.Duration;

/**
 * Outcome of consulting the retry policy after a transient failure.
 */
public final class RetryDecision {

    private static final RetryDecision GIVE_UP = new RetryDecision(false, Duration.ZERO);

    private final boolean retry;
    private final Duration delay;

    private RetryDecision(boolean retry, Duration delay) {
        this.retry = retry;
        this.delay = delay;
    }

    public static RetryDecision retryAfter(Duration delay) {
        return new RetryDecision(true, delay);
    }

    public static RetryDecision giveUp() {
        return GIVE_UP;
    }

    public boolean isRetry() {
        return retry;
    }

    public Duration getDelay() {
        return delay;
    }

    @Override
    public String toString() {
        return retry ? "retry after " + delay : "give up";
    }
}
