package com.bbthechange.teaminvite.coordination;

import com.bbthechange.teaminvite.exception.CoordinationUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Redis-backed coordinator. Compound operations run as Lua scripts so each one is atomic on
 * the server; the mutex is {@code SET NX PX} with an owner-checked delete.
 */
public class RedisCoordinator implements Coordinator {

    private static final Logger logger = LoggerFactory.getLogger(RedisCoordinator.class);

    private static final RedisScript<Long> ACQUIRE_PERMIT = new DefaultRedisScript<>(
            "local current = redis.call('INCR', KEYS[1]) "
                    + "if current <= tonumber(ARGV[1]) then "
                    + "  redis.call('PEXPIRE', KEYS[1], ARGV[2]) "
                    + "  return 1 "
                    + "end "
                    + "redis.call('DECR', KEYS[1]) "
                    + "return 0",
            Long.class);

    private static final RedisScript<Long> RELEASE_PERMIT = new DefaultRedisScript<>(
            "local current = redis.call('DECR', KEYS[1]) "
                    + "if current <= 0 then redis.call('DEL', KEYS[1]) end "
                    + "return current",
            Long.class);

    // -2 missing, -1 exhausted, otherwise the value after decrement
    private static final RedisScript<Long> DECREMENT_IF_POSITIVE = new DefaultRedisScript<>(
            "local value = redis.call('GET', KEYS[1]) "
                    + "if not value then return -2 end "
                    + "if tonumber(value) <= 0 then return -1 end "
                    + "return redis.call('DECR', KEYS[1])",
            Long.class);

    private static final RedisScript<Long> INCREMENT_IF_PRESENT = new DefaultRedisScript<>(
            "if redis.call('EXISTS', KEYS[1]) == 0 then return nil end "
                    + "return redis.call('INCRBY', KEYS[1], ARGV[1])",
            Long.class);

    private static final RedisScript<Long> RELEASE_MUTEX = new DefaultRedisScript<>(
            "if redis.call('GET', KEYS[1]) == ARGV[1] then return redis.call('DEL', KEYS[1]) end "
                    + "return 0",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;

    public RedisCoordinator(StringRedisTemplate redisTemplate, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public boolean tryAcquirePermit(String semaphore, int maxPermits, Duration leaseTtl) {
        Long acquired = call("acquirePermit", () -> redisTemplate.execute(ACQUIRE_PERMIT,
                List.of(key(semaphore)), String.valueOf(maxPermits), String.valueOf(leaseTtl.toMillis())));
        return acquired != null && acquired == 1L;
    }

    @Override
    public void releasePermit(String semaphore) {
        call("releasePermit", () -> redisTemplate.execute(RELEASE_PERMIT, List.of(key(semaphore))));
    }

    @Override
    public long currentPermits(String semaphore) {
        return getCounter(semaphore).orElse(0L);
    }

    @Override
    public DecrementResult decrementIfPositive(String key) {
        Long result = call("decrementIfPositive", () ->
                redisTemplate.execute(DECREMENT_IF_POSITIVE, List.of(key(key))));
        if (result == null || result == -2L) {
            return DecrementResult.MISSING;
        }
        return result == -1L ? DecrementResult.EXHAUSTED : DecrementResult.DECREMENTED;
    }

    @Override
    public OptionalLong incrementIfPresent(String key, long delta) {
        Long result = call("incrementIfPresent", () ->
                redisTemplate.execute(INCREMENT_IF_PRESENT, List.of(key(key)), String.valueOf(delta)));
        return result == null ? OptionalLong.empty() : OptionalLong.of(result);
    }

    @Override
    public boolean initCounter(String key, long value, Duration ttl) {
        Boolean created = call("initCounter", () ->
                redisTemplate.opsForValue().setIfAbsent(key(key), String.valueOf(value), ttl));
        return Boolean.TRUE.equals(created);
    }

    @Override
    public OptionalLong getCounter(String key) {
        String value = call("getCounter", () -> redisTemplate.opsForValue().get(key(key)));
        if (value == null) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(value));
        } catch (NumberFormatException e) {
            logger.warn("Encountered non-numeric counter {}: {}", key, value);
            return OptionalLong.empty();
        }
    }

    @Override
    public Optional<MutexLease> tryLock(String name, Duration ttl) {
        String token = UUID.randomUUID().toString();
        Boolean locked = call("tryLock", () -> redisTemplate.opsForValue().setIfAbsent(key(name), token, ttl));
        return Boolean.TRUE.equals(locked) ? Optional.of(new MutexLease(name, token)) : Optional.empty();
    }

    @Override
    public void unlock(MutexLease lease) {
        Long released = call("unlock", () ->
                redisTemplate.execute(RELEASE_MUTEX, List.of(key(lease.getName())), lease.getToken()));
        if (released == null || released == 0L) {
            logger.warn("Mutex {} expired or changed owner before release", lease.getName());
        }
    }

    private String key(String name) {
        return keyPrefix + name;
    }

    private <T> T call(String operation, Supplier<T> command) {
        try {
            return command.get();
        } catch (DataAccessException e) {
            throw new CoordinationUnavailableException("Redis " + operation + " failed: " + e.getMessage(), e);
        }
    }
}
