package com.formsecurity.cache.dto;

import java.util.List;

/**
 * 预热报告
 */
public record WarmingReport(Summary summary, List<Detail> details, List<String> errors) {

    public record Summary(int total, int successful, int failed, int skipped, double successRate, double durationSeconds) {
    }

    /**
     * @param status success | failed | skipped | timeout
     */
    public record Detail(String key, String status, Long ttlSeconds, double durationMs) {
    }
}
