package com.botflow.botflow_backend.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Redis-backed cache shared by every instance of the service. Values are stored as JSON with a
 * native TTL, so expiry is enforced by Redis itself.
 */
@Slf4j
public class RedisGraphCache implements GraphCache {

    private static final long SCAN_BATCH = 500;

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;

    public RedisGraphCache(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = keyPrefix != null ? keyPrefix : "";
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        if (!StringUtils.hasText(key)) {
            return Optional.empty();
        }
        try {
            String json = redisTemplate.opsForValue().get(keyPrefix + key);
            if (!StringUtils.hasText(json)) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            log.warn("Dropping unreadable cache entry {}: {}", key, e.getOriginalMessage());
            evict(key);
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Failed to read {} from Redis cache", key, e);
            return Optional.empty();
        }
    }

    @Override
    public void put(String key, Object value, Duration ttl) {
        if (!StringUtils.hasText(key) || value == null) {
            return;
        }
        try {
            redisTemplate.opsForValue().set(keyPrefix + key, objectMapper.writeValueAsString(value), ttl);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize cache value for {}: {}", key, e.getOriginalMessage());
        } catch (RuntimeException e) {
            log.warn("Failed to store {} in Redis cache", key, e);
        }
    }

    @Override
    public void evict(String key) {
        try {
            redisTemplate.delete(keyPrefix + key);
        } catch (RuntimeException e) {
            log.warn("Failed to evict {} from Redis cache", key, e);
        }
    }

    @Override
    public int evictByPrefix(String prefix) {
        ScanOptions options = ScanOptions.scanOptions().match(keyPrefix + prefix + "*").count(SCAN_BATCH).build();
        List<String> keys = new ArrayList<>();
        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            cursor.forEachRemaining(keys::add);
            if (keys.isEmpty()) {
                return 0;
            }
            Long deleted = redisTemplate.delete(keys);
            return deleted != null ? deleted.intValue() : 0;
        } catch (RuntimeException e) {
            // A failed invalidation leaves stale entries until their TTL runs out
            log.error("Failed to evict Redis cache entries with prefix {}", prefix, e);
            return 0;
        }
    }
}
