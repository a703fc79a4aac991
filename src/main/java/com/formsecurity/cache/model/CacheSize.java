package com.formsecurity.cache.model;

/**
 * 单层缓存容量
 */
public record CacheSize(long count, long bytes) {

    public static final CacheSize EMPTY = new CacheSize(0, 0);

    public CacheSize plus(CacheSize other) {
        return new CacheSize(count + other.count, bytes + other.bytes);
    }

    public double megabytes() {
        return bytes / 1024.0 / 1024.0;
    }
}
