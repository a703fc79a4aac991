package com.formsecurity.cache.model;

/**
 * 单层统计
 */
public record LevelStatistics(CacheLevel level,
                              boolean enabled,
                              boolean available,
                              long hits,
                              long misses,
                              long puts,
                              long deletes,
                              double hitRatio,
                              double avgResponseTimeMs,
                              long keyCount,
                              long sizeBytes) {

    public long samples() {
        return hits + misses;
    }
}
