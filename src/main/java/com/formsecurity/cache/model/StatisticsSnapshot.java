package com.formsecurity.cache.model;

import java.time.Instant;
import java.util.Map;

/**
 * 统计快照
 *
 * @param levels           每层统计（按层级顺序）
 * @param totalHits        调用级命中次数
 * @param totalMisses      调用级未命中次数
 * @param hitRatio         调用级命中率
 * @param efficiencyScore  综合效率评分 0-100
 */
public record StatisticsSnapshot(Map<CacheLevel, LevelStatistics> levels,
                                 long totalHits,
                                 long totalMisses,
                                 double hitRatio,
                                 long totalSizeBytes,
                                 long totalKeys,
                                 double efficiencyScore,
                                 Instant capturedAt) {
}
