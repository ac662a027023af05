package com.bbthechange.teaminvite.coordination;

import java.time.Duration;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Cross-replica coordination primitives: a counting semaphore, atomic counters and a TTL mutex.
 *
 * <p>Every method may throw {@link com.bbthechange.teaminvite.exception.CoordinationUnavailableException}
 * when the backing service cannot be reached. Callers choose fail-open or fail-closed.</p>
 */
public interface Coordinator {

    /**
     * Take one permit if fewer than {@code maxPermits} are held. The permit count expires after
     * {@code leaseTtl} without activity so crashed holders cannot leak permits forever.
     */
    boolean tryAcquirePermit(String semaphore, int maxPermits, Duration leaseTtl);

    void releasePermit(String semaphore);

    long currentPermits(String semaphore);

    /**
     * Atomically decrement a counter only when it is positive.
     */
    DecrementResult decrementIfPositive(String key);

    /**
     * Add {@code delta} to an existing counter.
     *
     * @return the new value, or empty when the counter does not exist
     */
    OptionalLong incrementIfPresent(String key, long delta);

    /**
     * Create a counter unless one already exists.
     *
     * @return true when this call created it
     */
    boolean initCounter(String key, long value, Duration ttl);

    OptionalLong getCounter(String key);

    Optional<MutexLease> tryLock(String name, Duration ttl);

    /**
     * Release a mutex, but only if it is still held by {@code lease}.
     */
    void unlock(MutexLease lease);
}
