package com.deepansh.kernel.session;

import com.deepansh.kernel.model.Message;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Redis-backed session history.
 *
 * Key pattern: kernel:session:{sessionId}:messages, one JSON array per session,
 * TTL reset on every write so idle sessions expire on their own.
 * Size is managed by {@link ContextCompactor}, not here.
 */
@Component
@Slf4j
public class RedisSessionStore implements SessionStore {

    private static final String KEY_PREFIX = "kernel:session:";
    private static final String KEY_SUFFIX = ":messages";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Value("${kernel.session.ttl-minutes:1440}")
    private long ttlMinutes;

    public RedisSessionStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<Message> load(String sessionId) {
        String json = redisTemplate.opsForValue().get(buildKey(sessionId));
        if (json == null) {
            log.debug("No stored history for session: {}", sessionId);
            return new ArrayList<>();
        }
        try {
            List<Message> messages = objectMapper.readValue(json, new TypeReference<>() {});
            log.debug("Loaded {} messages for session: {}", messages.size(), sessionId);
            return messages;
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize history for session: {}. Starting empty.", sessionId, e);
            return new ArrayList<>();
        }
    }

    @Override
    public void save(String sessionId, List<Message> messages) {
        String json;
        try {
            json = objectMapper.writeValueAsString(messages);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize history for session " + sessionId, e);
        }
        redisTemplate.opsForValue().set(buildKey(sessionId), json, Duration.ofMinutes(ttlMinutes));
        log.debug("Saved {} messages for session: {} (TTL: {}m)", messages.size(), sessionId, ttlMinutes);
    }

    @Override
    public void delete(String sessionId) {
        redisTemplate.delete(buildKey(sessionId));
        log.info("Deleted history for session: {}", sessionId);
    }

    private String buildKey(String sessionId) {
        return KEY_PREFIX + sessionId + KEY_SUFFIX;
    }
}
