package com.bbthechange.teaminvite.service.throttle;

import com.bbthechange.teaminvite.config.TeamInviteProperties;
import com.bbthechange.teaminvite.coordination.Coordinator;
import com.bbthechange.teaminvite.exception.CoordinationUnavailableException;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.OptionalLong;

/**
 * Per-identity request rate limit over fixed one-minute windows shared by all replicas.
 * Fails open: an unreachable coordination service never blocks a request.
 */
@Service
public class RateLimitingService {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitingService.class);
    private static final Duration WINDOW = Duration.ofMinutes(1);

    private final Coordinator coordinator;
    private final TeamInviteProperties.Throttle settings;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public RateLimitingService(Coordinator coordinator, TeamInviteProperties properties,
                               MeterRegistry meterRegistry, Clock clock) {
        this.coordinator = coordinator;
        this.settings = properties.getThrottle();
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Count one enqueue attempt for {@code identity} and tell whether it is within the limit.
     */
    public boolean isEnqueueAllowed(String identity) {
        long window = clock.millis() / WINDOW.toMillis();
        String key = "rate:enqueue:" + identity + ":" + window;
        try {
            coordinator.initCounter(key, 0, WINDOW.plusSeconds(5));
            OptionalLong count = coordinator.incrementIfPresent(key, 1);
            if (count.isPresent() && count.getAsLong() > settings.getRequestsPerMinute()) {
                logger.info("Rate limit exceeded for enqueue ({}/min): {}", settings.getRequestsPerMinute(), identity);
                meterRegistry.counter("team_invite_rate_limited_total", "operation", "enqueue").increment();
                return false;
            }
            return true;
        } catch (CoordinationUnavailableException e) {
            logger.warn("Rate limiter unavailable, allowing request for {}: {}", identity, e.getMessage());
            return true;
        }
    }
}
