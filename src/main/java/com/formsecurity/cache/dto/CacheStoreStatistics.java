package com.formsecurity.cache.dto;

import java.time.Instant;

/**
 * 持久层维护前后的统计快照
 */
public record CacheStoreStatistics(long totalKeys,
                                   long totalSizeBytes,
                                   double totalSizeMb,
                                   Instant oldestEntry,
                                   Instant newestEntry) {
}
