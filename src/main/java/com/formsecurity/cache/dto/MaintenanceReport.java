package com.formsecurity.cache.dto;

import java.util.List;

/**
 * 批量维护报告
 */
public record MaintenanceReport(Summary summary,
                                CacheStoreStatistics before,
                                CacheStoreStatistics after,
                                List<MaintenanceOperationResult> operations,
                                List<Recommendation> recommendations) {

    public record Summary(int totalOperations,
                          int successfulOperations,
                          int failedOperations,
                          double successRate,
                          double durationSeconds) {
    }

    public MaintenanceOperationResult operation(String name) {
        return operations.stream().filter(r -> r.operation().equals(name)).findFirst().orElse(null);
    }
}
