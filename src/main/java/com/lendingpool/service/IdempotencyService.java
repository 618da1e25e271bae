package com.lendingpool.service;

import com.lendingpool.exception.LendingError;
import com.lendingpool.exception.LendingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Redis-backed guard against replayed write requests.
 *
 * A client that may retry a deposit, loan or repayment sends an {@code Idempotency-Key}
 * header. The first request with a given key runs; any later one within the TTL is
 * rejected with DUPLICATE_REQUEST instead of moving funds twice.
 *
 * KEY NAMING CONVENTION:
 * ======================
 * Pattern: idempotency:{operation}:{caller}:{key}
 * Examples:
 * - idempotency:deposit:alice:7f3c...
 * - idempotency:repay:bob:retry-42
 *
 * The caller is part of the key, so two clients picking the same key never collide.
 *
 * FAILURE HANDLING:
 * =================
 * - Operation fails with any exception: its transaction rolled back, so the key is released
 *   and a retry may run.
 * - Redis unreachable: the request runs unguarded (fail open), exactly as if no key was sent.
 *   Row locks still keep the accounting consistent; only replay protection is lost.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotencyService {

    private final RedisTemplate<String, Object> redisTemplate;

    private static final Duration IDEMPOTENCY_TTL = Duration.ofHours(24);

    private static final String IDEMPOTENCY_PREFIX = "idempotency:";

    /**
     * Runs {@code action} once per (operation, caller, key). A null or blank key runs it unguarded.
     */
    public <T> T execute(String operation, String caller, String key, Supplier<T> action) {
        if (key == null || key.isBlank()) {
            return action.get();
        }
        if (!tryAcquire(operation, caller, key)) {
            throw LendingException.of(LendingError.DUPLICATE_REQUEST,
                    "Request %s for %s was already processed", key, operation);
        }
        try {
            return action.get();
        } catch (RuntimeException e) {
            release(operation, caller, key);
            throw e;
        }
    }

    /**
     * SET key value NX EX ttl.
     *
     * @return true if this is the first request with the key
     */
    public boolean tryAcquire(String operation, String caller, String key) {
        String redisKey = buildKey(operation, caller, key);
        try {
            Boolean success = redisTemplate.opsForValue()
                    .setIfAbsent(redisKey, String.valueOf(System.currentTimeMillis()), IDEMPOTENCY_TTL);

            if (Boolean.TRUE.equals(success)) {
                log.debug("Acquired idempotency key {}", redisKey);
                return true;
            }
            log.warn("Duplicate request rejected: {}", redisKey);
            return false;

        } catch (Exception e) {
            log.error("Redis error acquiring idempotency key {}, running unguarded", redisKey, e);
            return true;
        }
    }

    public void release(String operation, String caller, String key) {
        String redisKey = buildKey(operation, caller, key);
        try {
            redisTemplate.delete(redisKey);
            log.debug("Released idempotency key {}", redisKey);
        } catch (Exception e) {
            log.error("Redis error releasing idempotency key {}", redisKey, e);
        }
    }

    private String buildKey(String operation, String caller, String key) {
        return IDEMPOTENCY_PREFIX + operation + ":" + caller + ":" + key;
    }
}
