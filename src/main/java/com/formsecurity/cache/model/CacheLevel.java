package com.formsecurity.cache.model;

import java.util.List;
import java.util.Locale;

/**
 * 三级缓存层级
 * 按访问延迟升序、易失性降序排列：
 * REQUEST（单次调用内存表）→ MEMORY（共享内存存储）→ DATABASE（持久化存储）
 */
public enum CacheLevel {

    /** 请求级缓存：单次调用生命周期，调用结束即清空 */
    REQUEST(1, 0, false, false, 0.1, 0.9, 1024L * 1024),

    /** 内存级缓存：Caffeine / Redis，跨请求共享 */
    MEMORY(2, 3600, true, true, 1.0, 4.9, 10L * 1024 * 1024),

    /** 数据库级缓存：持久化键值表 */
    DATABASE(3, 86400, true, true, 5.0, 50.0, Long.MAX_VALUE);

    private static final List<CacheLevel> ORDERED = List.of(REQUEST, MEMORY, DATABASE);

    private final int priority;
    private final long defaultTtlSeconds;
    private final boolean survivesRequest;
    private final boolean driverRequired;
    private final double minResponseTimeMs;
    private final double maxResponseTimeMs;
    private final long maxValueBytes;

    CacheLevel(int priority, long defaultTtlSeconds, boolean survivesRequest, boolean driverRequired,
               double minResponseTimeMs, double maxResponseTimeMs, long maxValueBytes) {
        this.priority = priority;
        this.defaultTtlSeconds = defaultTtlSeconds;
        this.survivesRequest = survivesRequest;
        this.driverRequired = driverRequired;
        this.minResponseTimeMs = minResponseTimeMs;
        this.maxResponseTimeMs = maxResponseTimeMs;
        this.maxValueBytes = maxValueBytes;
    }

    /**
     * 读取回退顺序：REQUEST → MEMORY → DATABASE
     */
    public static List<CacheLevel> orderedLevels() {
        return ORDERED;
    }

    /**
     * 按名称解析层级（忽略大小写）
     */
    public static CacheLevel fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Cache level name must not be blank");
        }
        return CacheLevel.valueOf(name.trim().toUpperCase(Locale.ROOT));
    }

    public int priority() {
        return priority;
    }

    /**
     * 默认 TTL（秒），0 表示无 TTL（REQUEST 随调用结束清空）
     */
    public long defaultTtlSeconds() {
        return defaultTtlSeconds;
    }

    public boolean survivesRequest() {
        return survivesRequest;
    }

    /**
     * 是否需要外部存储驱动，REQUEST 永远不需要
     */
    public boolean driverRequired() {
        return driverRequired;
    }

    public double minResponseTimeMs() {
        return minResponseTimeMs;
    }

    public double maxResponseTimeMs() {
        return maxResponseTimeMs;
    }

    public long maxValueBytes() {
        return maxValueBytes;
    }

    public boolean isFasterThan(CacheLevel other) {
        return priority < other.priority;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
