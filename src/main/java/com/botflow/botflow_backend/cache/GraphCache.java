package com.botflow.botflow_backend.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Short-lived memo of assembled graph views. Implementations never throw on backend faults;
 * a failed read is a miss and a failed write is dropped.
 */
public interface GraphCache {

    <T> Optional<T> get(String key, Class<T> type);

    void put(String key, Object value, Duration ttl);

    void evict(String key);

    /** @return number of entries removed */
    int evictByPrefix(String prefix);
}
