package com.bbthechange.teaminvite.service;

import com.bbthechange.teaminvite.config.TeamInviteProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff for transient invite failures.
 *
 * <p>Attempt {@code n} (0-based) waits {@code min(maxDelay, baseDelay * 2^n)}. With jitter on,
 * the wait is drawn uniformly from the upper half of that range. Once {@code n} reaches the
 * retry limit the task is given up.</p>
 */
@Component
public class InviteTaskRetryPolicy {

    private final TeamInviteProperties.Retry settings;
    private final DoubleSupplier random;

    @Autowired
    public InviteTaskRetryPolicy(TeamInviteProperties properties) {
        this(properties, () -> ThreadLocalRandom.current().nextDouble());
    }

    InviteTaskRetryPolicy(TeamInviteProperties properties, DoubleSupplier random) {
        this.settings = properties.getRetry();
        this.random = random;
    }

    public RetryDecision decide(int attempt) {
        if (attempt >= settings.getMaxRetries()) {
            return RetryDecision.giveUp();
        }
        return RetryDecision.retryAfter(backoff(attempt));
    }

    Duration backoff(int attempt) {
        long baseMillis = settings.getBaseDelay().toMillis();
        long maxMillis = settings.getMaxDelay().toMillis();
        // cap the shift so huge attempt numbers cannot overflow
        long capped = attempt >= 30 ? maxMillis : Math.min(maxMillis, baseMillis << attempt);
        if (!settings.isJitter()) {
            return Duration.ofMillis(capped);
        }
        long half = capped / 2;
        return Duration.ofMillis(half + (long) (random.getAsDouble() * (capped - half)));
    }
}
