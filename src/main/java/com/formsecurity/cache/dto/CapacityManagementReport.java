package com.formsecurity.cache.dto;

import java.util.List;

/**
 * 容量治理报告
 */
public record CapacityManagementReport(CapacityReport capacityBefore,
                                       CapacityReport capacityAfter,
                                       List<Action> actionsTaken,
                                       boolean success) {

    public record Action(String action, String reason, long itemsProcessed, boolean success, String detail) {
    }
}
