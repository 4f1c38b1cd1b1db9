package com.botflow.botflow_backend.config;

import com.botflow.botflow_backend.cache.GraphCache;
import com.botflow.botflow_backend.cache.RedisGraphCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.stereotype.Component;

/**
 * Logs at startup which graph cache is active and, for Redis, whether it answers a PING.
 * An unreachable Redis is not fatal: every cache read then counts as a miss.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CacheStartupLogger implements ApplicationRunner {

    private final GraphCache graphCache;
    private final ObjectProvider<RedisConnectionFactory> connectionFactoryProvider;
    private final Environment env;

    @Override
    public void run(ApplicationArguments args) {
        if (!(graphCache instanceof RedisGraphCache)) {
            log.info("Flow cache: in-memory; cached graphs are not shared between instances");
            return;
        }
        RedisConnectionFactory factory = connectionFactoryProvider.getIfAvailable();
        if (factory == null) {
            log.warn("Flow cache: Redis selected but no connection factory is configured");
            return;
        }
        try (RedisConnection connection = factory.getConnection()) {
            log.info("Flow cache: Redis at {} answered {}", redactedUrl(), connection.ping());
        } catch (Exception e) {
            log.warn("Flow cache: Redis at {} is unreachable, reads will miss until it recovers: {}",
                    redactedUrl(), e.getMessage());
        }
    }

    private String redactedUrl() {
        String url = env.getProperty("spring.data.redis.url", "");
        return url.replaceAll("//[^@/]*@", "//***@");
    }
}
