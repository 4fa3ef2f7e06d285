package com.deepansh.kernel.memory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Redis-backed shared memory. Key pattern: kernel:memory:{key}. No TTL; entries
 * live until overwritten.
 */
@Component
@Slf4j
public class RedisSharedMemory implements SharedMemory {

    private static final String KEY_PREFIX = "kernel:memory:";

    private final StringRedisTemplate redisTemplate;

    public RedisSharedMemory(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(KEY_PREFIX + key));
    }

    @Override
    public void put(String key, String value) {
        redisTemplate.opsForValue().set(KEY_PREFIX + key, value);
        log.debug("Shared memory write [key={}, {} chars]", key, value.length());
    }

    @Override
    public List<String> keys(String prefix) {
        Set<String> keys = redisTemplate.keys(KEY_PREFIX + (prefix != null ? prefix : "") + "*");
        if (keys == null) return List.of();
        return keys.stream()
                .map(k -> k.substring(KEY_PREFIX.length()))
                .sorted()
                .toList();
    }
}
