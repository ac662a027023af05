package com.bbthechange.teaminvite.coordination;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-process coordinator backed by a Caffeine cache with per-entry expiry.
 * Mirrors the Redis semantics (TTL on semaphore counts, counters and mutexes) for
 * single-node deployments and tests.
 */
public class InMemoryCoordinator implements Coordinator {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryCoordinator.class);
    private static final long NO_EXPIRY = Long.MAX_VALUE;

    private final Ticker ticker;
    private final ConcurrentMap<String, Entry> entries;

    public InMemoryCoordinator() {
        this(Ticker.systemTicker());
    }

    public InMemoryCoordinator(Ticker ticker) {
        this.ticker = ticker;
        Cache<String, Entry> cache = Caffeine.newBuilder()
                .ticker(ticker)
                .executor(Runnable::run)
                .expireAfter(new EntryExpiry())
                .build();
        this.entries = cache.asMap();
    }

    @Override
    public boolean tryAcquirePermit(String semaphore, int maxPermits, Duration leaseTtl) {
        AtomicBoolean acquired = new AtomicBoolean(false);
        long expiresAt = deadline(leaseTtl);
        entries.compute(semaphore, (key, entry) -> {
            long held = entry == null ? 0 : entry.value;
            if (held >= maxPermits) {
                return entry;
            }
            acquired.set(true);
            return new Entry(held + 1, null, expiresAt);
        });
        return acquired.get();
    }

    @Override
    public void releasePermit(String semaphore) {
        entries.computeIfPresent(semaphore, (key, entry) -> {
            long remaining = entry.value - 1;
            return remaining <= 0 ? null : new Entry(remaining, null, entry.expiresAt);
        });
    }

    @Override
    public long currentPermits(String semaphore) {
        Entry entry = entries.get(semaphore);
        return entry == null ? 0 : entry.value;
    }

    @Override
    public DecrementResult decrementIfPositive(String key) {
        AtomicReference<DecrementResult> result = new AtomicReference<>(DecrementResult.MISSING);
        entries.computeIfPresent(key, (k, entry) -> {
            if (entry.value <= 0) {
                result.set(DecrementResult.EXHAUSTED);
                return entry;
            }
            result.set(DecrementResult.DECREMENTED);
            return new Entry(entry.value - 1, null, entry.expiresAt);
        });
        return result.get();
    }

    @Override
    public OptionalLong incrementIfPresent(String key, long delta) {
        Entry updated = entries.computeIfPresent(key,
                (k, entry) -> new Entry(entry.value + delta, null, entry.expiresAt));
        return updated == null ? OptionalLong.empty() : OptionalLong.of(updated.value);
    }

    @Override
    public boolean initCounter(String key, long value, Duration ttl) {
        return entries.putIfAbsent(key, new Entry(value, null, deadline(ttl))) == null;
    }

    @Override
    public OptionalLong getCounter(String key) {
        Entry entry = entries.get(key);
        return entry == null ? OptionalLong.empty() : OptionalLong.of(entry.value);
    }

    @Override
    public Optional<MutexLease> tryLock(String name, Duration ttl) {
        String token = UUID.randomUUID().toString();
        if (entries.putIfAbsent(name, new Entry(0, token, deadline(ttl))) != null) {
            logger.debug("Mutex {} is already held", name);
            return Optional.empty();
        }
        return Optional.of(new MutexLease(name, token));
    }

    @Override
    public void unlock(MutexLease lease) {
        entries.computeIfPresent(lease.getName(),
                (key, entry) -> lease.getToken().equals(entry.token) ? null : entry);
    }

    private long deadline(Duration ttl) {
        return ttl == null ? NO_EXPIRY : ticker.read() + ttl.toNanos();
    }

    private static final class Entry {
        final long value;
        final String token;
        final long expiresAt;

        Entry(long value, String token, long expiresAt) {
            this.value = value;
            this.token = token;
            this.expiresAt = expiresAt;
        }
    }

    private static final class EntryExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return remaining(entry, currentTime);
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return remaining(entry, currentTime);
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private static long remaining(Entry entry, long currentTime) {
            return entry.expiresAt == NO_EXPIRY ? Long.MAX_VALUE : Math.max(0, entry.expiresAt - currentTime);
        }
    }
}
