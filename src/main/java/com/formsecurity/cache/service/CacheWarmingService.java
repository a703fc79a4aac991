package com.formsecurity.cache.service;

import com.formsecurity.cache.config.FormSecurityCacheProperties;
import com.formsecurity.cache.dto.WarmingReport;
import com.formsecurity.cache.model.CacheKey;
import com.formsecurity.cache.model.CacheLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * 缓存预热
 * 按批提交加载任务，每个任务有独立超时；TTL 未指定时按命名空间取配置中的类别 TTL
 */
public class CacheWarmingService {

    private static final Logger log = LoggerFactory.getLogger(CacheWarmingService.class);

    private final CacheOperationService cache;
    private final FormSecurityCacheProperties properties;

    public CacheWarmingService(CacheOperationService cache) {
        this.cache = cache;
        this.properties = cache.getContext().getProperties();
    }

    /**
     * 预热任务
     *
     * @param ttlSeconds 为 null 时使用命名空间的类别 TTL
     */
    public record WarmupTask(CacheKey key, Supplier<?> loader, Long ttlSeconds) {

        public static WarmupTask of(CacheKey key, Supplier<?> loader) {
            return new WarmupTask(key, loader, null);
        }
    }

    public WarmingReport warm(List<WarmupTask> tasks) {
        return warm(tasks, null, false);
    }

    /**
     * 执行预热
     *
     * @param levels 写入的层级，null 表示全部
     * @param force  为 false 时跳过已存在的 Key
     */
    public WarmingReport warm(List<WarmupTask> tasks, Collection<CacheLevel> levels, boolean force) {
        long start = System.nanoTime();
        FormSecurityCacheProperties.Warming config = properties.getWarming();
        int batchSize = Math.max(1, config.getBatchSize());
        List<WarmingReport.Detail> details = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        int successful = 0;
        int failed = 0;
        int skipped = 0;

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(batchSize, Math.max(1, tasks.size())), r -> {
            Thread t = new Thread(r, "cache-warmer");
            t.setDaemon(true);
            return t;
        });
        try {
            for (int from = 0; from < tasks.size(); from += batchSize) {
                List<WarmupTask> batch = tasks.subList(from, Math.min(from + batchSize, tasks.size()));
                List<WarmupTask> pending = new ArrayList<>();
                List<Future<?>> futures = new ArrayList<>();
                for (WarmupTask task : batch) {
                    if (!force && cache.has(task.key(), levels)) {
                        skipped++;
                        details.add(new WarmingReport.Detail(task.key().toString(), "skipped", null, 0));
                        continue;
                    }
                    pending.add(task);
                    futures.add(executor.submit(() -> task.loader().get()));
                }
                for (int i = 0; i < pending.size(); i++) {
                    WarmupTask task = pending.get(i);
                    long taskStart = System.nanoTime();
                    Long ttl = task.ttlSeconds() != null ? task.ttlSeconds()
                        : properties.ttlFor(task.key().namespace(), CacheLevel.MEMORY.defaultTtlSeconds());
                    String key = task.key().toString();
                    try {
                        Object value = futures.get(i).get(config.getTimeoutSeconds(), TimeUnit.SECONDS);
                        if (value != null && cache.put(task.key(), value, ttl, levels)) {
                            successful++;
                            details.add(new WarmingReport.Detail(key, "success", ttl, elapsedMs(taskStart)));
                        } else {
                            failed++;
                            errors.add(key + ": loader returned no value or no level accepted the write");
                            details.add(new WarmingReport.Detail(key, "failed", ttl, elapsedMs(taskStart)));
                        }
                    } catch (TimeoutException e) {
                        futures.get(i).cancel(true);
                        failed++;
                        errors.add(key + ": timed out after " + config.getTimeoutSeconds() + "s");
                        details.add(new WarmingReport.Detail(key, "timeout", ttl, elapsedMs(taskStart)));
                    } catch (ExecutionException e) {
                        failed++;
                        errors.add(key + ": " + e.getCause());
                        details.add(new WarmingReport.Detail(key, "failed", ttl, elapsedMs(taskStart)));
                        log.warn("Cache warmer failed for key {}: {}", key, String.valueOf(e.getCause()));
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            errors.add("Warming interrupted");
            log.warn("Cache warming interrupted");
        } finally {
            executor.shutdownNow();
        }

        int total = tasks.size();
        int attempted = successful + failed;
        double successRate = attempted == 0 ? 100.0 : Math.round(successful * 10_000.0 / attempted) / 100.0;
        double duration = Math.round((System.nanoTime() - start) / 1_000_000.0) / 1000.0;
        log.info("Cache warming finished: total={}, successful={}, failed={}, skipped={}",
            total, successful, failed, skipped);
        return new WarmingReport(new WarmingReport.Summary(total, successful, failed, skipped, successRate, duration),
            details, errors);
    }

    private static double elapsedMs(long startNanos) {
        return Math.round((System.nanoTime() - startNanos) / 1000.0) / 1000.0;
    }
}
