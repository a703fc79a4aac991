package com.formsecurity.cache.repository;

import com.formsecurity.cache.model.CacheEntry;
import com.formsecurity.cache.model.CacheLevel;
import com.formsecurity.cache.model.CacheSize;
import com.formsecurity.cache.support.CacheValueSerializer;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * MEMORY 层默认实现：Caffeine 本地缓存
 * W-TinyLFU 淘汰，按条目自身的 expiresAt 设置可变过期时间
 */
public class CaffeineMemoryCacheRepository implements CacheRepository {

    private static final Logger log = LoggerFactory.getLogger(CaffeineMemoryCacheRepository.class);

    private final Cache<String, CacheEntry> cache;
    private final CacheValueSerializer serializer;
    private final Clock clock;

    public CaffeineMemoryCacheRepository(Cache<String, CacheEntry> cache, CacheValueSerializer serializer, Clock clock) {
        this.cache = cache;
        this.serializer = serializer;
        this.clock = clock;
    }

    /**
     * 构建按条目过期的 Caffeine 缓存
     */
    public static Cache<String, CacheEntry> newCache(long maximumSize, int initialCapacity, Clock clock) {
        return Caffeine.newBuilder()
            .initialCapacity(initialCapacity)
            .maximumSize(maximumSize)
            .expireAfter(new EntryExpiry(clock))
            .recordStats()
            .removalListener((String key, CacheEntry value, RemovalCause cause) -> {
                if (cause == RemovalCause.SIZE) {
                    log.debug("Memory cache evicted due to size: key={}", key);
                }
            })
            .build();
    }

    @Override
    public CacheLevel level() {
        return CacheLevel.MEMORY;
    }

    @Override
    public CacheEntry get(String key) {
        CacheEntry entry = cache.getIfPresent(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(clock.millis())) {
            cache.invalidate(key);
            return null;
        }
        return entry;
    }

    @Override
    public boolean put(String key, Object value, Long ttlSeconds) {
        long size = serializer.estimateSize(value);
        if (size > level().maxValueBytes()) {
            log.warn("Value too large for memory cache, key: {}, size: {}", key, size);
            return false;
        }
        cache.put(key, CacheEntry.of(value, clock.millis(), ttlSeconds, size));
        return true;
    }

    @Override
    public boolean forget(String key) {
        cache.invalidate(key);
        return true;
    }

    @Override
    public boolean flush() {
        cache.invalidateAll();
        return true;
    }

    @Override
    public boolean has(String key) {
        return get(key) != null;
    }

    @Override
    public CacheSize size() {
        long now = clock.millis();
        long count = 0;
        long bytes = 0;
        for (CacheEntry entry : cache.asMap().values()) {
            if (!entry.isExpired(now)) {
                count++;
                bytes += entry.sizeBytes();
            }
        }
        return new CacheSize(count, bytes);
    }

    @Override
    public Set<String> keys() {
        long now = clock.millis();
        Set<String> keys = new LinkedHashSet<>();
        cache.asMap().forEach((k, e) -> {
            if (!e.isExpired(now)) {
                keys.add(k);
            }
        });
        return keys;
    }

    @Override
    public int purgeExpired() {
        long now = clock.millis();
        int[] removed = {0};
        cache.asMap().entrySet().removeIf(e -> {
            boolean expired = e.getValue().isExpired(now);
            if (expired) {
                removed[0]++;
            }
            return expired;
        });
        cache.cleanUp();
        return removed[0];
    }

    @Override
    public void ping() {
        cache.estimatedSize();
    }

    public Cache<String, CacheEntry> getNativeCache() {
        return cache;
    }

    /**
     * 以条目的 expiresAt 作为物理过期时间，永不过期的条目不设上限
     */
    static final class EntryExpiry implements Expiry<String, CacheEntry> {

        private final Clock clock;

        EntryExpiry(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long expireAfterCreate(String key, CacheEntry value, long currentTime) {
            if (value.expiresAt() == null) {
                return Long.MAX_VALUE;
            }
            long remainingMillis = Math.max(0, value.expiresAt() - clock.millis());
            return TimeUnit.MILLISECONDS.toNanos(remainingMillis);
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry value, long currentTime, long currentDuration) {
            return expireAfterCreate(key, value, currentTime);
        }

        @Override
        public long expireAfterRead(String key, CacheEntry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
