package com.bbthechange.teaminvite.service.throttle;

import com.bbthechange.teaminvite.config.TeamInviteProperties;
import com.bbthechange.teaminvite.coordination.Coordinator;
import com.bbthechange.teaminvite.exception.CoordinationUnavailableException;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Distributed counting semaphore bounding in-flight redemptions across replicas.
 *
 * <p>Waits with a fixed backoff up to the configured timeout. When the coordination service
 * is down the semaphore fails open: the caller proceeds with an untracked permit.</p>
 */
@Component
public class RedemptionSemaphore {

    private static final Logger logger = LoggerFactory.getLogger(RedemptionSemaphore.class);
    static final String SEMAPHORE_NAME = "redeem:inflight";

    private final Coordinator coordinator;
    private final TeamInviteProperties.Throttle settings;
    private final MeterRegistry meterRegistry;

    public RedemptionSemaphore(Coordinator coordinator, TeamInviteProperties properties, MeterRegistry meterRegistry) {
        this.coordinator = coordinator;
        this.settings = properties.getThrottle();
        this.meterRegistry = meterRegistry;
    }

    /**
     * @return a permit to close when the redemption finishes, or empty after the wait timed out
     */
    public Optional<Permit> acquire() {
        long deadline = System.nanoTime() + settings.getAcquireTimeout().toNanos();
        Duration leaseTtl = settings.getPermitLeaseTtl();

        while (true) {
            try {
                if (coordinator.tryAcquirePermit(SEMAPHORE_NAME, settings.getMaxConcurrentRedemptions(), leaseTtl)) {
                    return Optional.of(new Permit(true));
                }
            } catch (CoordinationUnavailableException e) {
                logger.warn("Redemption semaphore unavailable, admitting request untracked: {}", e.getMessage());
                meterRegistry.counter("team_invite_semaphore_total", "status", "fail_open").increment();
                return Optional.of(new Permit(false));
            }

            if (System.nanoTime() >= deadline) {
                logger.info("Timed out waiting for a redemption permit ({} in flight)",
                        settings.getMaxConcurrentRedemptions());
                meterRegistry.counter("team_invite_semaphore_total", "status", "timeout").increment();
                return Optional.empty();
            }
            sleep(settings.getAcquireBackoff().toMillis());
        }
    }

    /**
     * Tracked permits currently held across replicas.
     */
    public long inFlight() {
        return coordinator.currentPermits(SEMAPHORE_NAME);
    }

    /**
     * Package-private for testing.
     */
    void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for a redemption permit", e);
        }
    }

    /**
     * Held redemption slot. Closing it more than once is harmless.
     */
    public final class Permit implements AutoCloseable {

        private final boolean tracked;
        private boolean released;

        private Permit(boolean tracked) {
            this.tracked = tracked;
        }

        public boolean isTracked() {
            return tracked;
        }

        @Override
        public void close() {
            if (released || !tracked) {
                released = true;
                return;
            }
            released = true;
            try {
                coordinator.releasePermit(SEMAPHORE_NAME);
            } catch (CoordinationUnavailableException e) {
                // the lease TTL reclaims it
                logger.warn("Could not release redemption permit: {}", e.getMessage());
            }
        }
    }
}
