package com.formsecurity.cache.service;

import com.formsecurity.cache.model.CacheLevel;
import com.formsecurity.cache.support.FluentCacheContext;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * 链式调用视图
 * tags / prefix / levels / ttl 累积一个不可变的 {@link FluentCacheContext}，
 * 下一次 get / put / remember / forget / flush 原子地取走并清空它；之后的调用不再携带上下文
 */
public class FluentCacheOperations {

    private final CacheOperationService cache;
    private final AtomicReference<FluentCacheContext> pending = new AtomicReference<>(FluentCacheContext.EMPTY);

    FluentCacheOperations(CacheOperationService cache) {
        this.cache = cache;
    }

    public FluentCacheOperations tags(String... tags) {
        pending.updateAndGet(ctx -> ctx.withTags(Arrays.asList(tags)));
        return this;
    }

    public FluentCacheOperations prefix(String prefix) {
        pending.updateAndGet(ctx -> ctx.withPrefix(prefix));
        return this;
    }

    public FluentCacheOperations levels(CacheLevel... levels) {
        pending.updateAndGet(ctx -> ctx.withLevels(Arrays.asList(levels)));
        return this;
    }

    public FluentCacheOperations ttl(long ttlSeconds) {
        pending.updateAndGet(ctx -> ctx.withTtl(ttlSeconds));
        return this;
    }

    public Object get(Object key) {
        return cache.contextGet(consume(), key, null);
    }

    public Object get(Object key, Object defaultValue) {
        return cache.contextGet(consume(), key, defaultValue);
    }

    public boolean put(Object key, Object value) {
        return cache.contextPut(consume(), key, value);
    }

    public <T> T remember(Object key, Supplier<T> producer) {
        return cache.contextRemember(consume(), key, producer);
    }

    public boolean forget(Object key) {
        return cache.contextForget(consume(), key);
    }

    /**
     * 带标签时只失效这些标签下的 Key，否则清空目标层级
     */
    public boolean flush() {
        return cache.contextFlush(consume());
    }

    public boolean hasFluentContext() {
        return !pending.get().isEmpty();
    }

    public void clearFluentContext() {
        pending.set(FluentCacheContext.EMPTY);
    }

    /**
     * 当前累积的上下文（只读快照）
     */
    public FluentCacheContext peek() {
        return pending.get();
    }

    private FluentCacheContext consume() {
        return pending.getAndSet(FluentCacheContext.EMPTY);
    }
}
