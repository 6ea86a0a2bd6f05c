package com.architecture.memory.riskscope.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;

/**
 * In-process {@link SignalCache} with a TTL per entry.
 */
@Slf4j
public class CaffeineSignalCache implements SignalCache {

    private final Cache<String, Entry> cache;

    public CaffeineSignalCache(long maximumSize) {
        this(maximumSize, Ticker.systemTicker());
    }

    CaffeineSignalCache(long maximumSize, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .ticker(ticker)
                .executor(Runnable::run)
                .expireAfter(new PerEntryExpiry())
                .recordStats()
                .build();
        log.info("[Cache] Signal cache initialized (maximumSize={})", maximumSize);
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        Entry entry = cache.getIfPresent(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!type.isInstance(entry.value())) {
            log.warn("[Cache] Entry {} holds {} but {} was requested, dropping it",
                    key, entry.value().getClass().getSimpleName(), type.getSimpleName());
            cache.invalidate(key);
            return Optional.empty();
        }
        return Optional.of(type.cast(entry.value()));
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        if (value == null || ttl == null || ttl.isZero() || ttl.isNegative()) {
            return;
        }
        cache.put(key, new Entry(value, ttl.toNanos()));
    }

    @Override
    public void invalidate(String key) {
        cache.invalidate(key);
    }

    @Override
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private record Entry(Object value, long ttlNanos) {
    }

    private static final class PerEntryExpiry implements Expiry<String, Entry> {

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
    }
}
