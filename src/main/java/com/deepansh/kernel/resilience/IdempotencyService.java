package com.deepansh.kernel.resilience;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-based idempotency for turn submissions.
 *
 * A client that retries a turn request with the same Idempotency-Key gets the
 * stored result instead of a second turn, so tools with side effects do not run
 * twice. Opt-in: requests without a key always run.
 *
 * Key pattern: kernel:idempotency:{agentId}:{idempotencyKey}, TTL 24 hours.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String KEY_PREFIX = "kernel:idempotency:";
    private static final Duration TTL = Duration.ofHours(24);
    // Held while the first request is running
    static final String IN_FLIGHT_SENTINEL = "__IN_FLIGHT__";

    private final StringRedisTemplate redisTemplate;

    public IdempotencyService(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    /**
     * Stored response for the key, if the first request has finished. Empty while the
     * key is unknown or still in flight.
     */
    public Optional<String> getCachedResponse(String scope, String idempotencyKey) {
        String existing = redisTemplate.opsForValue().get(buildKey(scope, idempotencyKey));
        if (existing == null || IN_FLIGHT_SENTINEL.equals(existing)) {
            return Optional.empty();
        }
        log.info("Idempotency hit for key={}", idempotencyKey);
        return Optional.of(existing);
    }

    /** Atomic SET NX claim; false means another request owns the key. */
    public boolean claimKey(String scope, String idempotencyKey) {
        Boolean claimed = redisTemplate.opsForValue()
                .setIfAbsent(buildKey(scope, idempotencyKey), IN_FLIGHT_SENTINEL, TTL);
        return Boolean.TRUE.equals(claimed);
    }

    public void storeResponse(String scope, String idempotencyKey, String responseJson) {
        redisTemplate.opsForValue().set(buildKey(scope, idempotencyKey), responseJson, TTL);
        log.debug("Stored idempotency response for key={}", idempotencyKey);
    }

    /** Frees the key after a failure so the client can retry. */
    public void releaseKey(String scope, String idempotencyKey) {
        redisTemplate.delete(buildKey(scope, idempotencyKey));
        log.debug("Released idempotency key={}", idempotencyKey);
    }

    private String buildKey(String scope, String idempotencyKey) {
        return KEY_PREFIX + scope + ":" + idempotencyKey;
    }
}
