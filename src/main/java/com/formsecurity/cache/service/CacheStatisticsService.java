package com.formsecurity.cache.service;

import com.formsecurity.cache.config.FormSecurityCacheProperties;
import com.formsecurity.cache.model.CacheLevel;
import com.formsecurity.cache.model.CacheSize;
import com.formsecurity.cache.model.LevelStatistics;
import com.formsecurity.cache.model.StatisticsSnapshot;
import com.formsecurity.cache.monitor.CacheMetrics;
import com.formsecurity.cache.repository.CacheRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 缓存统计与效率评分
 * 计数器来自协调器实例独占的 {@link CacheMetrics}
 *
 * 效率评分 = 命中率 60% + 延迟 30% + 容量稳定性 10%，结果限制在 0-100，且对每一项单调
 */
public class CacheStatisticsService {

    private static final Logger log = LoggerFactory.getLogger(CacheStatisticsService.class);

    static final double HIT_RATIO_WEIGHT = 0.6;
    static final double LATENCY_WEIGHT = 0.3;
    static final double SIZE_STABILITY_WEIGHT = 0.1;

    /** 容量增长的最小基准，避免空缓存时的噪声 */
    private static final long MIN_BASELINE_BYTES = 1024L * 1024;

    private final CacheOperationService cache;
    private final CacheMetrics metrics;
    private final FormSecurityCacheProperties properties;
    /** 每层首次观测到的容量，作为增长基准 */
    private final Map<CacheLevel, Long> baselineBytes = new ConcurrentHashMap<>();

    public CacheStatisticsService(CacheOperationService cache) {
        this.cache = cache;
        this.metrics = cache.getMetrics();
        this.properties = cache.getContext().getProperties();
    }

    public StatisticsSnapshot getStats() {
        return getStats(null);
    }

    public StatisticsSnapshot getStats(Collection<CacheLevel> levels) {
        Collection<CacheLevel> targets = levelsOrAll(levels);
        Map<CacheLevel, LevelStatistics> perLevel = new EnumMap<>(CacheLevel.class);
        long totalBytes = 0;
        long totalKeys = 0;
        for (CacheLevel level : targets) {
            CacheSize size = sizeOf(level);
            totalBytes += size.bytes();
            totalKeys += size.count();
            long hits = metrics.hits(level);
            long misses = metrics.misses(level);
            perLevel.put(level, new LevelStatistics(level,
                cache.isLevelEnabled(level),
                cache.getRegistry().isAvailable(level),
                hits, misses, metrics.puts(level), metrics.deletes(level),
                ratio(hits, misses),
                metrics.avgResponseTimeMs(level),
                size.count(), size.bytes()));
        }
        return new StatisticsSnapshot(perLevel, metrics.callHits(), metrics.callMisses(), getHitRatio(),
            totalBytes, totalKeys, calculateCacheEfficiency(levels), Instant.now(cache.getContext().getClock()));
    }

    /**
     * 调用级命中率：一次 get 只要某一层命中即计为命中，无样本时为 0
     */
    public double getHitRatio() {
        return ratio(metrics.callHits(), metrics.callMisses());
    }

    /**
     * 多层命中率，按样本数加权而不是对各层比率取平均
     */
    public double getHitRatio(Collection<CacheLevel> levels) {
        long hits = 0;
        long misses = 0;
        for (CacheLevel level : levelsOrAll(levels)) {
            hits += metrics.hits(level);
            misses += metrics.misses(level);
        }
        return ratio(hits, misses);
    }

    public Map<CacheLevel, CacheSize> getCacheSize(Collection<CacheLevel> levels) {
        Map<CacheLevel, CacheSize> sizes = new EnumMap<>(CacheLevel.class);
        for (CacheLevel level : levelsOrAll(levels)) {
            sizes.put(level, sizeOf(level));
        }
        return sizes;
    }

    public long getTotalSizeBytes(Collection<CacheLevel> levels) {
        return getCacheSize(levels).values().stream().mapToLong(CacheSize::bytes).sum();
    }

    /**
     * 按操作次数加权的平均响应时间（毫秒）
     */
    public double getAverageResponseTime(Collection<CacheLevel> levels) {
        long ops = 0;
        long nanos = 0;
        for (CacheLevel level : levelsOrAll(levels)) {
            ops += metrics.timedOperations(level);
            nanos += metrics.totalTimeNanos(level);
        }
        return ops == 0 ? 0.0 : nanos / (double) ops / 1_000_000.0;
    }

    public double calculateCacheEfficiency() {
        return calculateCacheEfficiency(null);
    }

    public double calculateCacheEfficiency(Collection<CacheLevel> levels) {
        long currentBytes = 0;
        long baselineTotal = 0;
        for (Map.Entry<CacheLevel, CacheSize> entry : getCacheSize(levels).entrySet()) {
            long bytes = entry.getValue().bytes();
            currentBytes += bytes;
            baselineTotal += baselineBytes.computeIfAbsent(entry.getKey(), level -> bytes);
        }
        long baseline = Math.max(baselineTotal, MIN_BASELINE_BYTES);
        double growth = Math.max(0, currentBytes - baselineTotal) / (double) baseline;
        return efficiencyScore(getHitRatio(levels), getAverageResponseTime(levels), growth,
            properties.getPerformance().getReferenceResponseTimeMs());
    }

    /**
     * 评分公式
     *
     * @param hitRatio            0-1
     * @param avgResponseTimeMs   平均响应时间，越大分越低
     * @param sizeGrowthRatio     相对基准的增长比例，越大分越低
     * @param referenceResponseMs 延迟得分 50 分对应的响应时间
     */
    public static double efficiencyScore(double hitRatio, double avgResponseTimeMs, double sizeGrowthRatio,
                                         double referenceResponseMs) {
        double hit = Math.min(1.0, Math.max(0.0, hitRatio)) * 100.0;
        double latency = 100.0 * referenceResponseMs / (referenceResponseMs + Math.max(0.0, avgResponseTimeMs));
        double stability = 100.0 / (1.0 + Math.max(0.0, sizeGrowthRatio));
        double score = HIT_RATIO_WEIGHT * hit + LATENCY_WEIGHT * latency + SIZE_STABILITY_WEIGHT * stability;
        return Math.round(Math.min(100.0, Math.max(0.0, score)) * 100.0) / 100.0;
    }

    /**
     * 显式清零计数器，并以当前容量作为新的增长基准
     */
    public void resetStats() {
        metrics.reset();
        getCacheSize(null).forEach((level, size) -> baselineBytes.put(level, size.bytes()));
        log.info("Cache statistics reset");
    }

    public Map<String, Object> getSummary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("hitRatio", getHitRatio());
        summary.put("levelHitRatio", getHitRatio(null));
        summary.put("avgResponseTimeMs", getAverageResponseTime(null));
        summary.put("efficiencyScore", calculateCacheEfficiency());
        summary.put("totalSizeBytes", getTotalSizeBytes(null));
        return summary;
    }

    private CacheSize sizeOf(CacheLevel level) {
        if (!cache.getRegistry().isAvailable(level)) {
            return CacheSize.EMPTY;
        }
        CacheRepository repository = cache.getRegistry().find(level);
        try {
            return repository.size();
        } catch (Exception e) {
            log.warn("Failed to read size of cache level {}: {}", level, e.toString());
            return CacheSize.EMPTY;
        }
    }

    private static double ratio(long hits, long misses) {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }

    private static Collection<CacheLevel> levelsOrAll(Collection<CacheLevel> levels) {
        return levels == null ? CacheLevel.orderedLevels() : levels;
    }
}
