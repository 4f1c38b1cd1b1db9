package com.botflow.botflow_backend.config;

import com.botflow.botflow_backend.cache.GraphCache;
import com.botflow.botflow_backend.cache.InMemoryGraphCache;
import com.botflow.botflow_backend.cache.RedisGraphCache;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Picks the graph cache backend. {@code app.flow.cache.type=redis} shares the cache across
 * instances; anything else (or a missing Redis template) keeps it in process.
 */
@Slf4j
@Configuration
public class GraphCacheConfig {

    @Bean
    public GraphCache graphCache(
            @Value("${app.flow.cache.type:memory}") String type,
            @Value("${app.flow.cache.redis-prefix:botflow:}") String redisPrefix,
            @Value("${app.flow.cache.max-entries:1000}") long maxEntries,
            ObjectProvider<StringRedisTemplate> redisTemplateProvider,
            ObjectMapper objectMapper) {

        if ("redis".equalsIgnoreCase(type.trim())) {
            StringRedisTemplate redisTemplate = redisTemplateProvider.getIfAvailable();
            if (redisTemplate != null) {
                log.info("Graph cache: Redis (key prefix '{}')", redisPrefix);
                return new RedisGraphCache(redisTemplate, objectMapper, redisPrefix);
            }
            log.warn("Graph cache: app.flow.cache.type=redis but no StringRedisTemplate is available, using in-memory cache");
        } else {
            log.info("Graph cache: in-memory (single instance, up to {} entries)", maxEntries);
        }
        return new InMemoryGraphCache(maxEntries);
    }
}
