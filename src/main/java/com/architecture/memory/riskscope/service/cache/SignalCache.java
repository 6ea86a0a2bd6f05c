package com.architecture.memory.riskscope.service.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Ephemeral key/value store for computed signals and investigation traces.
 * Entries are never persisted; a miss is always safe because callers recompute.
 */
public interface SignalCache {

    <T> Optional<T> get(String key, Class<T> type);

    void set(String key, Object value, Duration ttl);

    void invalidate(String key);

    long size();
}
