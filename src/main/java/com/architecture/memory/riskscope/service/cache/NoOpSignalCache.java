package com.architecture.memory.riskscope.service.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Used when {@code riskscope.cache.enabled=false}. Every read misses.
 */
public class NoOpSignalCache implements SignalCache {

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        return Optional.empty();
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
    }

    @Override
    public void invalidate(String key) {
    }

    @Override
    public long size() {
        return 0;
    }
}
