package com.formsecurity.cache.repository;

import com.formsecurity.cache.model.CacheEntry;
import com.formsecurity.cache.model.CacheLevel;
import com.formsecurity.cache.model.CacheSize;
import com.formsecurity.cache.support.CacheValueSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * REQUEST 层：每个调用线程一张独立的 HashMap
 * 单线程访问，无需加锁；调用结束时由协调器 flush
 */
public class RequestLevelCacheRepository implements CacheRepository {

    private static final Logger log = LoggerFactory.getLogger(RequestLevelCacheRepository.class);

    private final ThreadLocal<Map<String, CacheEntry>> store = ThreadLocal.withInitial(HashMap::new);
    private final CacheValueSerializer serializer;
    private final Clock clock;

    public RequestLevelCacheRepository(CacheValueSerializer serializer, Clock clock) {
        this.serializer = serializer;
        this.clock = clock;
    }

    @Override
    public CacheLevel level() {
        return CacheLevel.REQUEST;
    }

    @Override
    public CacheEntry get(String key) {
        Map<String, CacheEntry> map = store.get();
        CacheEntry entry = map.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(clock.millis())) {
            map.remove(key);
            return null;
        }
        return entry;
    }

    @Override
    public boolean put(String key, Object value, Long ttlSeconds) {
        long size = serializer.estimateSize(value);
        if (size > level().maxValueBytes()) {
            log.warn("Value too large for request cache, key: {}, size: {}", key, size);
            return false;
        }
        store.get().put(key, CacheEntry.of(value, clock.millis(), ttlSeconds, size));
        return true;
    }

    @Override
    public boolean forget(String key) {
        store.get().remove(key);
        return true;
    }

    /**
     * 清空当前线程的请求缓存并释放 ThreadLocal
     */
    @Override
    public boolean flush() {
        store.get().clear();
        store.remove();
        return true;
    }

    @Override
    public boolean has(String key) {
        return get(key) != null;
    }

    @Override
    public CacheSize size() {
        long count = 0;
        long bytes = 0;
        long now = clock.millis();
        for (CacheEntry entry : store.get().values()) {
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
        store.get().forEach((k, e) -> {
            if (!e.isExpired(now)) {
                keys.add(k);
            }
        });
        return keys;
    }

    @Override
    public int purgeExpired() {
        long now = clock.millis();
        int removed = 0;
        Iterator<CacheEntry> it = store.get().values().iterator();
        while (it.hasNext()) {
            if (it.next().isExpired(now)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    @Override
    public void ping() {
        // 进程内存储，始终可用
    }
}
