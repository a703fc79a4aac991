package com.formsecurity.cache.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 性能自检报告
 *
 * @param overallStatus pass | fail | error
 */
public record PerformanceValidationReport(String overallStatus,
                                          Map<String, Requirement> requirements,
                                          List<String> recommendations,
                                          String error,
                                          Instant timestamp) {

    /**
     * 单项指标
     *
     * @param higherIsBetter true 表示 actual 需不低于 target
     */
    public record Requirement(double target, double actual, String unit, boolean higherIsBetter, boolean passed) {
    }
}
