package com.bbthechange.teaminvite.coordination;

import com.bbthechange.teaminvite.exception.CoordinationUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Runs a periodic job on at most one replica at a time. A replica that cannot take the named
 * mutex, or cannot reach the coordination service, skips the run.
 */
@Component
public class ExclusiveJobRunner {

    private static final Logger logger = LoggerFactory.getLogger(ExclusiveJobRunner.class);

    private final Coordinator coordinator;

    public ExclusiveJobRunner(Coordinator coordinator) {
        this.coordinator = coordinator;
    }

    /**
     * @return the job's result, or empty if the run was skipped
     */
    public <T> Optional<T> runExclusively(String lockName, Duration ttl, Supplier<T> job) {
        Optional<MutexLease> lease;
        try {
            lease = coordinator.tryLock(lockName, ttl);
        } catch (CoordinationUnavailableException e) {
            logger.warn("Skipping {}: coordination unavailable ({})", lockName, e.getMessage());
            return Optional.empty();
        }
        if (lease.isEmpty()) {
            logger.debug("Skipping {}: held by another instance", lockName);
            return Optional.empty();
        }

        try {
            return Optional.ofNullable(job.get());
        } finally {
            try {
                coordinator.unlock(lease.get());
            } catch (CoordinationUnavailableException e) {
                // expires with its TTL
                logger.warn("Could not release {}: {}", lockName, e.getMessage());
            }
        }
    }
}
