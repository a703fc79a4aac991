package com.formsecurity.cache.service;

import com.formsecurity.cache.config.FormSecurityCacheProperties;
import com.formsecurity.cache.dto.CapacityManagementReport;
import com.formsecurity.cache.dto.CapacityReport;
import com.formsecurity.cache.dto.LoadTestReport;
import com.formsecurity.cache.dto.MaintenanceOperationResult;
import com.formsecurity.cache.dto.PerformanceValidationReport;
import com.formsecurity.cache.dto.Recommendation;
import com.formsecurity.cache.model.CacheKey;
import com.formsecurity.cache.model.CacheLevel;
import com.formsecurity.cache.model.CacheSize;
import com.formsecurity.cache.repository.CacheRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static com.formsecurity.cache.constant.CacheConstants.MAINT_CLEANUP;
import static com.formsecurity.cache.constant.CacheConstants.MAINT_OPTIMIZE;
import static com.formsecurity.cache.constant.CacheConstants.MAINT_VACUUM;

/**
 * 缓存自检：性能达标检查、容量检查、并发压测、容量治理
 * 压测是诊断工具而非生产路径，持续时间被硬性截断到配置上限
 */
public class CacheValidationService {

    private static final Logger log = LoggerFactory.getLogger(CacheValidationService.class);

    static final String STATUS_PASS = "pass";
    static final String STATUS_FAIL = "fail";
    static final String STATUS_ERROR = "error";
    static final String CAPACITY_OK = "ok";
    static final String CAPACITY_WARNING = "warning";
    static final String CAPACITY_CRITICAL = "critical";

    private static final String SAMPLE_NAMESPACE = "validation_sample";
    private static final String LOAD_TEST_NAMESPACE = "load_test";
    private static final int LOAD_TEST_KEY_SPACE = 100;
    private static final long MB = 1024L * 1024;

    private final CacheOperationService cache;
    private final CacheStatisticsService statisticsService;
    private final CacheMaintenanceService maintenanceService;
    private final FormSecurityCacheProperties properties;

    public CacheValidationService(CacheOperationService cache,
                                  CacheStatisticsService statisticsService,
                                  CacheMaintenanceService maintenanceService) {
        this.cache = cache;
        this.statisticsService = statisticsService;
        this.maintenanceService = maintenanceService;
        this.properties = cache.getContext().getProperties();
    }

    // ==================== 性能 ====================

    /**
     * 对 MEMORY / DATABASE 各做一轮定时读写探测，并与配置目标比较
     */
    public PerformanceValidationReport validatePerformance() {
        FormSecurityCacheProperties.Performance targets = properties.getPerformance();
        Map<String, PerformanceValidationReport.Requirement> requirements = new LinkedHashMap<>();
        List<String> recommendations = new ArrayList<>();
        try {
            int samples = Math.max(1, properties.getValidation().getPerformanceSamples());
            long totalOps = 0;
            long totalNanos = 0;
            long sampleHits = 0;

            for (CacheLevel level : List.of(CacheLevel.MEMORY, CacheLevel.DATABASE)) {
                if (!cache.isLevelEnabled(level) || !cache.getRegistry().isAvailable(level)) {
                    continue;
                }
                SampleResult sample = sampleLevel(level, samples);
                totalOps += sample.operations;
                totalNanos += sample.nanos;
                sampleHits += sample.hits;
                double target = level == CacheLevel.MEMORY
                    ? targets.getMemoryResponseTimeMs() : targets.getDatabaseResponseTimeMs();
                double actual = sample.avgMs();
                requirements.put(level.key() + "_response_time",
                    new PerformanceValidationReport.Requirement(target, round(actual), "ms", false, actual <= target));
                if (actual > target) {
                    recommendations.add(level + " response time " + round(actual) + " ms exceeds the "
                        + target + " ms target; check backend latency and connection pooling");
                }
            }

            double throughput = totalNanos == 0 ? 0.0 : totalOps / (totalNanos / 1_000_000_000.0) * 60.0;
            requirements.put("throughput", new PerformanceValidationReport.Requirement(
                targets.getMinThroughputPerMinute(), round(throughput), "ops/min", true,
                throughput >= targets.getMinThroughputPerMinute()));
            if (throughput < targets.getMinThroughputPerMinute()) {
                recommendations.add("Throughput " + Math.round(throughput) + " ops/min is below the "
                    + targets.getMinThroughputPerMinute() + " ops/min target; consider a faster MEMORY driver");
            }

            long samplesSeen = cache.getMetrics().callHits() + cache.getMetrics().callMisses();
            double hitRatio = samplesSeen > 0 ? statisticsService.getHitRatio()
                : totalOps == 0 ? 0.0 : sampleHits / (totalOps / 2.0);
            requirements.put("hit_ratio", new PerformanceValidationReport.Requirement(
                targets.getMinHitRatio(), round(hitRatio), "ratio", true, hitRatio >= targets.getMinHitRatio()));
            if (hitRatio < targets.getMinHitRatio()) {
                recommendations.add("Hit ratio " + round(hitRatio) + " is below " + targets.getMinHitRatio()
                    + "; review TTLs and warm frequently used namespaces");
            }

            boolean pass = requirements.values().stream().allMatch(PerformanceValidationReport.Requirement::passed);
            log.info("Cache performance validation: {}", pass ? STATUS_PASS : STATUS_FAIL);
            return new PerformanceValidationReport(pass ? STATUS_PASS : STATUS_FAIL, requirements,
                recommendations, null, now());
        } catch (Exception e) {
            log.error("Cache performance validation failed", e);
            return new PerformanceValidationReport(STATUS_ERROR, requirements,
                List.of("Resolve the validation error before re-running"), e.getMessage(), now());
        }
    }

    // ==================== 容量 ====================

    public CapacityReport validateCacheCapacity() {
        FormSecurityCacheProperties.Capacity limits = properties.getCapacity();
        Map<CacheLevel, CapacityReport.LevelCapacity> levels = new EnumMap<>(CacheLevel.class);
        long totalUsed = 0;
        String worst = CAPACITY_OK;
        for (CacheLevel level : CacheLevel.orderedLevels()) {
            CacheSize size = sizeOf(level);
            long limit = limitFor(level, limits) * MB;
            double usage = limit == 0 ? 0.0 : size.bytes() * 100.0 / limit;
            String status = statusFor(usage, limits);
            worst = worse(worst, status);
            totalUsed += size.bytes();
            levels.put(level, new CapacityReport.LevelCapacity(size.count(), size.bytes(), limit, round(usage),
                Math.max(0, limit - size.bytes()), status));
        }
        long totalLimit = limits.getTotalLimitMb() * MB;
        double totalUsage = totalLimit == 0 ? 0.0 : totalUsed * 100.0 / totalLimit;
        worst = worse(worst, statusFor(totalUsage, limits));
        return new CapacityReport(worst, levels, totalUsed, totalLimit, round(totalUsage),
            Math.max(0, totalLimit - totalUsed));
    }

    /**
     * 容量治理：warning 时清理过期条目，critical 时再整理存储并清空 REQUEST 层
     *
     * @param options force=true 无论状态都执行清理，aggressive=true 直接按 critical 处理
     */
    public CapacityManagementReport manageCapacity(Map<String, Object> options) {
        boolean force = flag(options, "force");
        boolean aggressive = flag(options, "aggressive");
        CapacityReport before = validateCacheCapacity();
        List<CapacityManagementReport.Action> actions = new ArrayList<>();

        boolean critical = aggressive || CAPACITY_CRITICAL.equals(before.status());
        boolean warning = CAPACITY_WARNING.equals(before.status());

        if (force || warning || critical) {
            actions.add(cleanupExpired(critical ? "emergency" : "preventive"));
        }
        if (critical && (aggressive || validateCacheCapacity().exceeded())) {
            actions.add(maintenanceAction(MAINT_OPTIMIZE, "emergency"));
            actions.add(maintenanceAction(MAINT_VACUUM, "emergency"));
            if (aggressive || CAPACITY_CRITICAL.equals(validateCacheCapacity().status())) {
                boolean flushed = cache.flushRequest();
                actions.add(new CapacityManagementReport.Action("flush_request_level", "emergency", 0, flushed,
                    "Request level flushed to release memory"));
            }
        }

        CapacityReport after = validateCacheCapacity();
        boolean success = actions.stream().allMatch(CapacityManagementReport.Action::success);
        if (!actions.isEmpty()) {
            log.info("Capacity management applied {} actions, status {} -> {}", actions.size(),
                before.status(), after.status());
        }
        return new CapacityManagementReport(before, after, actions, success);
    }

    // ==================== 并发压测 ====================

    /**
     * 固定线程池并发执行 put / get，持续时间截断到 validation.max-load-test-seconds
     *
     * @param operationCount  期望在持续时间内完成的操作数，非正数时返回带错误信息的报告
     * @param durationSeconds 期望持续时间
     */
    public LoadTestReport validateConcurrentOperations(int operationCount, int durationSeconds) {
        if (operationCount <= 0) {
            log.warn("Load test rejected, operation count must be positive: {}", operationCount);
            return LoadTestReport.rejected(operationCount, durationSeconds,
                "Operation count must be positive, got: " + operationCount);
        }
        int cap = Math.max(1, properties.getValidation().getMaxLoadTestSeconds());
        int effectiveSeconds = Math.min(Math.max(1, durationSeconds), cap);
        int threads = Math.max(1, Math.min(properties.getValidation().getLoadTestThreads(), operationCount));
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(effectiveSeconds);

        AtomicInteger issued = new AtomicInteger();
        AtomicLong succeeded = new AtomicLong();
        AtomicLong failed = new AtomicLong();
        ConcurrentLinkedQueue<Long> latencies = new ConcurrentLinkedQueue<>();

        ExecutorService executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "cache-load-test");
            t.setDaemon(true);
            return t;
        });
        long start = System.nanoTime();
        boolean timedOut = false;
        try {
            for (int i = 0; i < threads; i++) {
                executor.execute(() -> {
                    try {
                        int n;
                        while ((n = issued.getAndIncrement()) < operationCount && System.nanoTime() < deadline) {
                            long opStart = System.nanoTime();
                            try {
                                if (runLoadOperation(n)) {
                                    succeeded.incrementAndGet();
                                } else {
                                    failed.incrementAndGet();
                                }
                            } catch (RuntimeException e) {
                                failed.incrementAndGet();
                            }
                            latencies.add(System.nanoTime() - opStart);
                            if (Thread.currentThread().isInterrupted()) {
                                break;
                            }
                        }
                    } finally {
                        cache.endRequest();
                    }
                });
            }
            executor.shutdown();
            if (!executor.awaitTermination(effectiveSeconds + 5L, TimeUnit.SECONDS)) {
                timedOut = true;
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            timedOut = true;
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        double elapsedSeconds = Math.max((System.nanoTime() - start) / 1_000_000_000.0, 0.001);
        cache.invalidateByNamespace(LOAD_TEST_NAMESPACE);

        long completed = succeeded.get() + failed.get();
        double throughput = completed / elapsedSeconds * 60.0;
        double target = operationCount / (double) effectiveSeconds * 60.0;
        double successRate = completed == 0 ? 0.0 : succeeded.get() * 100.0 / completed;
        List<Recommendation> recommendations = loadTestRecommendations(throughput, target, successRate);
        log.info("Load test finished: {} ops in {}s, {} ops/min, success rate {}%",
            completed, round(elapsedSeconds), Math.round(throughput), round(successRate));
        return new LoadTestReport(operationCount, durationSeconds, effectiveSeconds, completed, succeeded.get(),
            failed.get(), round(elapsedSeconds), round(target), round(throughput), round(successRate),
            latency(latencies), timedOut, recommendations, List.of());
    }

    // ==================== 内部实现 ====================

    private boolean runLoadOperation(int n) {
        CacheKey key = CacheKey.of("item_" + (n % LOAD_TEST_KEY_SPACE), LOAD_TEST_NAMESPACE);
        if (n % 2 == 0) {
            Map<String, Object> value = new LinkedHashMap<>();
            value.put("n", n);
            value.put("payload", "load-test");
            return cache.put(key, value, 60L);
        }
        cache.get(key);
        return true;
    }

    private List<Recommendation> loadTestRecommendations(double throughput, double target, double successRate) {
        List<Recommendation> recommendations = new ArrayList<>();
        if (throughput < target * 0.8) {
            recommendations.add(new Recommendation("performance", "high",
                "Actual throughput " + Math.round(throughput) + " ops/min is below 80% of the requested "
                    + Math.round(target) + " ops/min; scale the MEMORY backend or reduce DATABASE fan-out"));
        }
        if (successRate < 95.0) {
            recommendations.add(new Recommendation("reliability", "high",
                "Success rate " + round(successRate) + "% is below 95%; inspect backend errors and circuit breaker state"));
        }
        if (recommendations.isEmpty()) {
            recommendations.add(new Recommendation("performance", "info",
                "Concurrent operation performance meets the requested load"));
        }
        return recommendations;
    }

    private SampleResult sampleLevel(CacheLevel level, int samples) {
        SampleResult result = new SampleResult();
        List<CacheKey> keys = new ArrayList<>(samples);
        try {
            for (int i = 0; i < samples; i++) {
                CacheKey key = CacheKey.of("sample_" + i, SAMPLE_NAMESPACE);
                keys.add(key);
                long start = System.nanoTime();
                cache.putInLevel(level, key, Map.of("i", i), 60L);
                Object value = cache.getFromLevel(level, key);
                result.nanos += System.nanoTime() - start;
                result.operations += 2;
                if (value != null) {
                    result.hits++;
                }
            }
        } finally {
            keys.forEach(key -> cache.forgetFromLevel(level, key));
        }
        return result;
    }

    private CapacityManagementReport.Action cleanupExpired(String reason) {
        long removed = 0;
        boolean success = true;
        StringBuilder detail = new StringBuilder();
        for (CacheLevel level : List.of(CacheLevel.REQUEST, CacheLevel.MEMORY)) {
            if (!cache.getRegistry().isAvailable(level)) {
                continue;
            }
            try {
                CacheRepository repository = cache.getRegistry().find(level);
                int purged = repository.purgeExpired();
                removed += purged;
                detail.append(level).append('=').append(purged).append(' ');
            } catch (Exception e) {
                success = false;
                detail.append(level).append(" failed: ").append(e.getMessage()).append(' ');
                log.warn("Expired cleanup failed on level {}: {}", level, e.toString());
            }
        }
        MaintenanceOperationResult db = maintenanceService.runOperation(MAINT_CLEANUP);
        removed += db.itemsProcessed();
        detail.append("DATABASE=").append(db.itemsProcessed());
        if (cache.getRegistry().isAvailable(CacheLevel.DATABASE)) {
            success &= db.success();
        }
        return new CapacityManagementReport.Action("cleanup_expired", reason, removed, success, detail.toString().trim());
    }

    private CapacityManagementReport.Action maintenanceAction(String operation, String reason) {
        MaintenanceOperationResult result = maintenanceService.runOperation(operation);
        return new CapacityManagementReport.Action(operation + "_storage", reason, result.itemsProcessed(),
            result.success(), result.errors().isEmpty() ? "ok" : String.join("; ", result.errors()));
    }

    private CacheSize sizeOf(CacheLevel level) {
        if (!cache.getRegistry().isAvailable(level)) {
            return CacheSize.EMPTY;
        }
        try {
            return cache.getRegistry().find(level).size();
        } catch (Exception e) {
            log.warn("Failed to read size of cache level {}: {}", level, e.toString());
            return CacheSize.EMPTY;
        }
    }

    private static long limitFor(CacheLevel level, FormSecurityCacheProperties.Capacity limits) {
        switch (level) {
            case REQUEST:
                return limits.getRequestLimitMb();
            case MEMORY:
                return limits.getMemoryLimitMb();
            default:
                return limits.getDatabaseLimitMb();
        }
    }

    private static String statusFor(double usagePercent, FormSecurityCacheProperties.Capacity limits) {
        if (usagePercent > limits.getCriticalThreshold()) {
            return CAPACITY_CRITICAL;
        }
        if (usagePercent > limits.getWarningThreshold()) {
            return CAPACITY_WARNING;
        }
        return CAPACITY_OK;
    }

    private static String worse(String a, String b) {
        List<String> order = Arrays.asList(CAPACITY_OK, CAPACITY_WARNING, CAPACITY_CRITICAL);
        return order.indexOf(a) >= order.indexOf(b) ? a : b;
    }

    private static LoadTestReport.Latency latency(ConcurrentLinkedQueue<Long> samples) {
        if (samples.isEmpty()) {
            return LoadTestReport.Latency.EMPTY;
        }
        long[] sorted = samples.stream().mapToLong(Long::longValue).sorted().toArray();
        double sum = 0;
        for (long v : sorted) {
            sum += v;
        }
        return new LoadTestReport.Latency(
            ms(sorted[0]), round(sum / sorted.length / 1_000_000.0),
            ms(percentile(sorted, 50)), ms(percentile(sorted, 95)), ms(percentile(sorted, 99)),
            ms(sorted[sorted.length - 1]));
    }

    private static long percentile(long[] sorted, int p) {
        int index = (int) Math.ceil(p / 100.0 * sorted.length) - 1;
        return sorted[Math.max(0, Math.min(index, sorted.length - 1))];
    }

    private static boolean flag(Map<String, Object> options, String name) {
        if (options == null) {
            return false;
        }
        Object value = options.get(name);
        return value instanceof Boolean b ? b : value != null && Boolean.parseBoolean(value.toString());
    }

    private Instant now() {
        return Instant.now(cache.getContext().getClock());
    }

    private static double ms(long nanos) {
        return round(nanos / 1_000_000.0);
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }

    private static final class SampleResult {
        private long operations;
        private long nanos;
        private long hits;

        double avgMs() {
            return operations == 0 ? 0.0 : nanos / (double) operations / 1_000_000.0;
        }
    }
}
