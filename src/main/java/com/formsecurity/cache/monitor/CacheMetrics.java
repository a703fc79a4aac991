package com.formsecurity.cache.monitor;

import com.formsecurity.cache.constant.CacheConstants;
import com.formsecurity.cache.model.CacheLevel;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * 缓存计数器
 * 每个协调器实例独占一份，不是进程级单例，多个实例（如测试中）互不影响；
 * 计数在进程内单调递增，只有显式 reset 才会清零
 */
public class CacheMetrics {

    private final Map<CacheLevel, LevelCounters> levels = new EnumMap<>(CacheLevel.class);
    private final LongAdder callHits = new LongAdder();
    private final LongAdder callMisses = new LongAdder();

    public CacheMetrics() {
        for (CacheLevel level : CacheLevel.orderedLevels()) {
            levels.put(level, new LevelCounters());
        }
    }

    public void recordHit(CacheLevel level, long elapsedNanos) {
        LevelCounters c = levels.get(level);
        c.hits.increment();
        c.time(elapsedNanos);
    }

    public void recordMiss(CacheLevel level, long elapsedNanos) {
        LevelCounters c = levels.get(level);
        c.misses.increment();
        c.time(elapsedNanos);
    }

    public void recordPut(CacheLevel level, long elapsedNanos) {
        LevelCounters c = levels.get(level);
        c.puts.increment();
        c.time(elapsedNanos);
    }

    public void recordDelete(CacheLevel level, long elapsedNanos) {
        LevelCounters c = levels.get(level);
        c.deletes.increment();
        c.time(elapsedNanos);
    }

    public void recordCallHit() {
        callHits.increment();
    }

    public void recordCallMiss() {
        callMisses.increment();
    }

    public long hits(CacheLevel level) {
        return levels.get(level).hits.sum();
    }

    public long misses(CacheLevel level) {
        return levels.get(level).misses.sum();
    }

    public long puts(CacheLevel level) {
        return levels.get(level).puts.sum();
    }

    public long deletes(CacheLevel level) {
        return levels.get(level).deletes.sum();
    }

    public long timedOperations(CacheLevel level) {
        return levels.get(level).timedOps.sum();
    }

    public long totalTimeNanos(CacheLevel level) {
        return levels.get(level).timeNanos.sum();
    }

    public double avgResponseTimeMs(CacheLevel level) {
        LevelCounters c = levels.get(level);
        long ops = c.timedOps.sum();
        return ops == 0 ? 0.0 : c.timeNanos.sum() / (double) ops / 1_000_000.0;
    }

    public long callHits() {
        return callHits.sum();
    }

    public long callMisses() {
        return callMisses.sum();
    }

    public void reset() {
        levels.values().forEach(LevelCounters::reset);
        callHits.reset();
        callMisses.reset();
    }

    /**
     * 注册到 Micrometer，按 level 打标签
     */
    public void bindTo(MeterRegistry registry, String cacheName) {
        for (Map.Entry<CacheLevel, LevelCounters> e : levels.entrySet()) {
            String level = e.getKey().key();
            LevelCounters c = e.getValue();
            FunctionCounter.builder(CacheConstants.METRIC_HITS, c, x -> x.hits.sum())
                .tags("cache", cacheName, "level", level).register(registry);
            FunctionCounter.builder(CacheConstants.METRIC_MISSES, c, x -> x.misses.sum())
                .tags("cache", cacheName, "level", level).register(registry);
            FunctionCounter.builder(CacheConstants.METRIC_PUTS, c, x -> x.puts.sum())
                .tags("cache", cacheName, "level", level).register(registry);
            FunctionCounter.builder(CacheConstants.METRIC_DELETES, c, x -> x.deletes.sum())
                .tags("cache", cacheName, "level", level).register(registry);
            CacheLevel cacheLevel = e.getKey();
            Gauge.builder(CacheConstants.METRIC_RESPONSE_TIME, this, m -> m.avgResponseTimeMs(cacheLevel))
                .tags("cache", cacheName, "level", level)
                .baseUnit("milliseconds")
                .register(registry);
        }
    }

    private static final class LevelCounters {
        private final LongAdder hits = new LongAdder();
        private final LongAdder misses = new LongAdder();
        private final LongAdder puts = new LongAdder();
        private final LongAdder deletes = new LongAdder();
        private final LongAdder timeNanos = new LongAdder();
        private final LongAdder timedOps = new LongAdder();

        void time(long nanos) {
            timeNanos.add(nanos);
            timedOps.increment();
        }

        void reset() {
            hits.reset();
            misses.reset();
            puts.reset();
            deletes.reset();
            timeNanos.reset();
            timedOps.reset();
        }
    }
}
