package com.botflow.botflow_backend.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Process-local cache on Caffeine, bounded by entry count, with the TTL given on each put.
 * Expired and overflowing entries are reclaimed by Caffeine's own maintenance.
 */
@Slf4j
public class InMemoryGraphCache implements GraphCache {

    private record Entry(Object value, long ttlNanos) {}

    private final Cache<String, Entry> cache;

    public InMemoryGraphCache(long maximumSize) {
        this(maximumSize, Ticker.systemTicker(), ForkJoinPool.commonPool());
    }

    InMemoryGraphCache(long maximumSize, Ticker ticker, Executor executor) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new Expiry<String, Entry>() {
                    @Override
                    public long expireAfterCreate(String key, Entry entry, long currentTime) {
                        return entry.ttlNanos();
                    }

                    @Override
                    public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
                        return entry.ttlNanos();
                    }

                    @Override
                    public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .ticker(ticker)
                .executor(executor)
                .build();
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        Entry entry = cache.getIfPresent(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!type.isInstance(entry.value())) {
            log.warn("Cache entry {} holds {} but {} was requested", key,
                    entry.value().getClass().getSimpleName(), type.getSimpleName());
            return Optional.empty();
        }
        return Optional.of(type.cast(entry.value()));
    }

    @Override
    public void put(String key, Object value, Duration ttl) {
        if (key == null || value == null) return;
        cache.put(key, new Entry(value, ttl.toNanos()));
        log.debug("Cached {} for {}s", key, ttl.toSeconds());
    }

    @Override
    public void evict(String key) {
        cache.invalidate(key);
    }

    @Override
    public int evictByPrefix(String prefix) {
        List<String> keys = cache.asMap().keySet().stream().filter(k -> k.startsWith(prefix)).toList();
        cache.invalidateAll(keys);
        log.debug("Evicted {} cache entries with prefix {}", keys.size(), prefix);
        return keys.size();
    }

    /** Entries currently held, after pending expiry and size eviction have run. */
    long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
