package com.reprise.repository;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.reprise.model.CacheEntry;
import com.reprise.model.CacheKey;
import com.reprise.model.CacheTier;
import com.reprise.model.TierLookup;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * In-process tier: a bounded Caffeine map.
 * Each entry expires at its own {@code createdAt + ttl}, so a value promoted from a slower
 * tier keeps its original deadline instead of starting a fresh one.
 */
@Slf4j
public class MemoryTierStore implements TierStore {

    private final Cache<String, CacheEntry> cache;

    public MemoryTierStore(long maximumSize, Duration ttl, Clock clock) {
        Ticker ticker = () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new EntryDeadline(ttl, clock))
                .ticker(ticker)
                .recordStats()
                .build();
    }

    @Override
    public CacheTier tier() {
        return CacheTier.MEMORY;
    }

    @Override
    public TierLookup get(CacheKey key) {
        CacheEntry entry = cache.getIfPresent(key.encode());
        if (entry == null) {
            log.debug("Memory tier miss: {}", key);
            return TierLookup.miss();
        }
        log.debug("Memory tier hit: {}", key);
        return TierLookup.hit(entry.toBuilder().tierOfOrigin(CacheTier.MEMORY).build());
    }

    @Override
    public void set(CacheEntry entry) {
        cache.put(entry.getKey().encode(), entry.toBuilder().tierOfOrigin(null).build());
    }

    @Override
    public boolean exists(CacheKey key) {
        return cache.getIfPresent(key.encode()) != null;
    }

    public long size() {
        return cache.estimatedSize();
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    /**
     * Expiry measured from the entry's creation time rather than from insertion.
     */
    private static final class EntryDeadline implements Expiry<String, CacheEntry> {

        private final Duration ttl;
        private final Clock clock;

        private EntryDeadline(Duration ttl, Clock clock) {
            this.ttl = ttl;
            this.clock = clock;
        }

        @Override
        public long expireAfterCreate(String key, CacheEntry value, long currentTime) {
            return value.remainingTtl(clock.instant(), ttl).toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry value, long currentTime, long currentDuration) {
            return value.remainingTtl(clock.instant(), ttl).toNanos();
        }

        @Override
        public long expireAfterRead(String key, CacheEntry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
