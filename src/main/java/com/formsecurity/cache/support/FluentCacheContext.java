package com.formsecurity.cache.support;

import com.formsecurity.cache.model.CacheLevel;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 链式调用累积的一次性请求描述（不可变）
 * 每个 with 方法返回新实例，由 {@link com.formsecurity.cache.service.FluentCacheOperations} 在终结调用时消费
 */
public final class FluentCacheContext {

    public static final FluentCacheContext EMPTY = new FluentCacheContext(Set.of(), null, null, null);

    private final Set<String> tags;
    private final String prefix;
    private final List<CacheLevel> levels;
    private final Long ttlSeconds;

    private FluentCacheContext(Set<String> tags, String prefix, List<CacheLevel> levels, Long ttlSeconds) {
        this.tags = tags;
        this.prefix = prefix;
        this.levels = levels;
        this.ttlSeconds = ttlSeconds;
    }

    public FluentCacheContext withTags(Collection<String> more) {
        Set<String> merged = new LinkedHashSet<>(tags);
        merged.addAll(more);
        return new FluentCacheContext(Collections.unmodifiableSet(merged), prefix, levels, ttlSeconds);
    }

    public FluentCacheContext withPrefix(String newPrefix) {
        return new FluentCacheContext(tags, newPrefix, levels, ttlSeconds);
    }

    public FluentCacheContext withLevels(Collection<CacheLevel> newLevels) {
        return new FluentCacheContext(tags, prefix, Collections.unmodifiableList(new ArrayList<>(newLevels)), ttlSeconds);
    }

    public FluentCacheContext withTtl(Long newTtlSeconds) {
        return new FluentCacheContext(tags, prefix, levels, newTtlSeconds);
    }

    public Set<String> tags() {
        return tags;
    }

    public String prefix() {
        return prefix;
    }

    public List<CacheLevel> levels() {
        return levels;
    }

    public Long ttlSeconds() {
        return ttlSeconds;
    }

    public boolean isEmpty() {
        return tags.isEmpty() && prefix == null && levels == null && ttlSeconds == null;
    }

    @Override
    public String toString() {
        return "FluentCacheContext{tags=" + tags + ", prefix=" + prefix + ", levels=" + levels + ", ttl=" + ttlSeconds + "}";
    }
}
