package com.formsecurity.cache.model;

/**
 * 仓库内部的缓存条目
 *
 * @param value     缓存值
 * @param storedAt  写入时间（epoch 毫秒）
 * @param expiresAt 过期时间（epoch 毫秒），null 表示永不过期
 * @param sizeBytes 估算的序列化大小
 */
public record CacheEntry(Object value, long storedAt, Long expiresAt, long sizeBytes) {

    public static CacheEntry of(Object value, long now, Long ttlSeconds, long sizeBytes) {
        return new CacheEntry(value, now, expiryFor(now, ttlSeconds), sizeBytes);
    }

    /**
     * 计算过期时间点，ttl 为 null 或超出 epoch 毫秒可表示范围时返回 null（永不过期）
     */
    public static Long expiryFor(long now, Long ttlSeconds) {
        if (ttlSeconds == null) {
            return null;
        }
        try {
            return Math.addExact(now, Math.multiplyExact(ttlSeconds, 1000L));
        } catch (ArithmeticException e) {
            return null;
        }
    }

    /**
     * expiresAt <= now 即视为过期，过期条目不得被 get/has 返回
     */
    public boolean isExpired(long now) {
        return expiresAt != null && expiresAt <= now;
    }

    /**
     * 剩余存活秒数，永不过期返回 null
     */
    public Long remainingTtlSeconds(long now) {
        if (expiresAt == null) {
            return null;
        }
        return Math.max(0, (expiresAt - now) / 1000L);
    }
}
