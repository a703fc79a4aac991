package com.formsecurity.cache.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 单 Key 失效事件（不可变）
 * 监听器必须幂等
 *
 * @param cacheKey  规范化存储地址
 * @param namespace 命名空间
 * @param tags      Key 携带的标签
 * @param levels    作用层级，null 表示全部层级
 * @param reason    失效原因
 * @param metadata  附加信息
 * @param timestamp 事件时间
 */
public record InvalidationEvent(String cacheKey,
                                String namespace,
                                Set<String> tags,
                                Set<CacheLevel> levels,
                                String reason,
                                Map<String, Object> metadata,
                                Instant timestamp) {

    public InvalidationEvent {
        tags = tags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        levels = levels == null ? null : Collections.unmodifiableSet(new LinkedHashSet<>(levels));
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static InvalidationEvent of(CacheKey key, Set<CacheLevel> levels, String reason,
                                       Map<String, Object> metadata, Instant timestamp) {
        return new InvalidationEvent(key.toString(), key.namespace(), key.tags(), levels, reason, metadata, timestamp);
    }

    public boolean appliesTo(CacheLevel level) {
        return levels == null || levels.contains(level);
    }
}
