package com.formsecurity.cache.dto;

import com.formsecurity.cache.model.CacheLevel;

import java.util.Map;

/**
 * 容量报告
 *
 * @param status ok | warning | critical
 */
public record CapacityReport(String status,
                             Map<CacheLevel, LevelCapacity> levels,
                             long totalUsedBytes,
                             long totalLimitBytes,
                             double usagePercent,
                             long headroomBytes) {

    public record LevelCapacity(long keyCount,
                                long usedBytes,
                                long limitBytes,
                                double usagePercent,
                                long headroomBytes,
                                String status) {
    }

    public boolean exceeded() {
        return !"ok".equals(status);
    }
}
