package com.formsecurity.cache.dto;

import java.util.List;
import java.util.Map;

/**
 * 单个维护操作结果
 */
public record MaintenanceOperationResult(String operation,
                                         boolean success,
                                         long itemsProcessed,
                                         double durationSeconds,
                                         List<String> errors,
                                         Map<String, Object> details) {

    public MaintenanceOperationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static MaintenanceOperationResult failed(String operation, double durationSeconds, String error) {
        return new MaintenanceOperationResult(operation, false, 0, durationSeconds, List.of(error), Map.of());
    }
}
