package com.formsecurity.cache.dto;

import java.util.List;

/**
 * 并发压测报告
 * 参数不合法时不执行压测，errors 给出原因，其余计数为 0
 */
public record LoadTestReport(int requestedOperations,
                             int requestedDurationSeconds,
                             int effectiveDurationSeconds,
                             long completedOperations,
                             long successfulOperations,
                             long failedOperations,
                             double actualDurationSeconds,
                             double targetPerMinute,
                             double throughputPerMinute,
                             double successRate,
                             Latency latency,
                             boolean timedOut,
                             List<Recommendation> recommendations,
                             List<String> errors) {

    public static LoadTestReport rejected(int operationCount, int durationSeconds, String error) {
        return new LoadTestReport(operationCount, durationSeconds, 0, 0, 0, 0, 0.0, 0.0, 0.0, 0.0,
            Latency.EMPTY, false,
            List.of(new Recommendation("validation", "high", error)),
            List.of(error));
    }

    public boolean success() {
        return errors.isEmpty();
    }

    /**
     * 延迟分布（毫秒）
     */
    public record Latency(double min, double avg, double p50, double p95, double p99, double max) {

        public static final Latency EMPTY = new Latency(0, 0, 0, 0, 0, 0);
    }
}
