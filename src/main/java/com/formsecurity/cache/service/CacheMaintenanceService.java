package com.formsecurity.cache.service;

import com.formsecurity.cache.config.FormSecurityCacheProperties;
import com.formsecurity.cache.dto.CacheStoreStatistics;
import com.formsecurity.cache.dto.MaintenanceOperationResult;
import com.formsecurity.cache.dto.MaintenanceReport;
import com.formsecurity.cache.dto.Recommendation;
import com.formsecurity.cache.exception.CacheLevelUnavailableException;
import com.formsecurity.cache.exception.UnknownMaintenanceOperationException;
import com.formsecurity.cache.model.CacheEntry;
import com.formsecurity.cache.model.CacheLevel;
import com.formsecurity.cache.model.CacheSize;
import com.formsecurity.cache.repository.CacheRepository;
import com.formsecurity.cache.repository.DatabaseCacheRepository;
import com.formsecurity.cache.repository.TagAwareCacheRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import static com.formsecurity.cache.constant.CacheConstants.MAINT_CLEANUP;
import static com.formsecurity.cache.constant.CacheConstants.MAINT_OPTIMIZE;
import static com.formsecurity.cache.constant.CacheConstants.MAINT_REINDEX;
import static com.formsecurity.cache.constant.CacheConstants.MAINT_VACUUM;
import static com.formsecurity.cache.constant.CacheConstants.MAINT_VALIDATE;
import static com.formsecurity.cache.constant.CacheConstants.SAMPLE_KEY_PREFIX;
import static com.formsecurity.cache.constant.CacheConstants.SAMPLE_NAMESPACE;

/**
 * 持久层缓存维护
 * REQUEST 随调用消失、MEMORY 自行过期，维护主要针对 DATABASE；
 * 批量调用中单个操作失败只记录在该操作的 errors 中，不中断批次
 */
public class CacheMaintenanceService {

    private static final Logger log = LoggerFactory.getLogger(CacheMaintenanceService.class);

    private static final List<String> DEFAULT_OPERATIONS = List.of(MAINT_CLEANUP, MAINT_OPTIMIZE);
    private static final long SAMPLE_TTL_SECONDS = 60;

    private final CacheOperationService cache;
    private final FormSecurityCacheProperties properties;
    private final Clock clock;

    public CacheMaintenanceService(CacheOperationService cache) {
        this.cache = cache;
        this.properties = cache.getContext().getProperties();
        this.clock = cache.getContext().getClock();
    }

    /**
     * 执行一批维护操作，空列表默认 cleanup + optimize
     */
    public MaintenanceReport maintainDatabaseCache(List<String> operations) {
        List<String> ops = operations == null || operations.isEmpty() ? DEFAULT_OPERATIONS : operations;
        long start = System.nanoTime();
        CacheStoreStatistics before = statistics();

        List<MaintenanceOperationResult> results = new ArrayList<>();
        for (String operation : ops) {
            results.add(runOperation(operation));
        }

        CacheStoreStatistics after = statistics();
        int successful = (int) results.stream().filter(MaintenanceOperationResult::success).count();
        int total = results.size();
        MaintenanceReport.Summary summary = new MaintenanceReport.Summary(
            total, successful, total - successful,
            total == 0 ? 0.0 : round(successful * 100.0 / total),
            seconds(System.nanoTime() - start));
        log.info("Database cache maintenance finished: {} of {} operations succeeded", successful, total);
        return new MaintenanceReport(summary, before, after, results, recommendations(after));
    }

    /**
     * 简化形式：操作名 -> 是否成功
     */
    public Map<String, Boolean> maintenance(List<String> operations) {
        Map<String, Boolean> result = new LinkedHashMap<>();
        for (MaintenanceOperationResult r : maintainDatabaseCache(operations).operations()) {
            result.put(r.operation(), r.success());
        }
        return result;
    }

    /**
     * 定时清理过期条目（form-security.cache.maintenance.auto-cleanup=true 时生效）
     */
    @Scheduled(cron = "${form-security.cache.maintenance.cleanup-cron:0 */10 * * * *}")
    public void scheduledCleanup() {
        if (!properties.getMaintenance().isAutoCleanup()) {
            return;
        }
        MaintenanceOperationResult result = runOperation(MAINT_CLEANUP);
        if (result.success()) {
            log.info("Scheduled cache cleanup removed {} expired entries", result.itemsProcessed());
        } else {
            log.warn("Scheduled cache cleanup failed: {}", result.errors());
        }
    }

    public MaintenanceOperationResult runOperation(String operation) {
        long start = System.nanoTime();
        try {
            String op = operation == null ? "" : operation.trim().toLowerCase();
            CacheRepository repository = cache.getRegistry().require(CacheLevel.DATABASE);
            MaintenanceOperationResult result = switch (op) {
                case MAINT_CLEANUP -> cleanup(repository, start);
                case MAINT_OPTIMIZE -> runStatements(MAINT_OPTIMIZE, repository,
                    properties.getDatabase().getOptimizeStatements(), start);
                case MAINT_VACUUM -> runStatements(MAINT_VACUUM, repository,
                    properties.getDatabase().getVacuumStatements(), start);
                case MAINT_REINDEX -> reindex(repository, start);
                case MAINT_VALIDATE -> validate(repository, start);
                default -> throw new UnknownMaintenanceOperationException(operation);
            };
            log.debug("Maintenance operation {} processed {} items", op, result.itemsProcessed());
            return result;
        } catch (UnknownMaintenanceOperationException | CacheLevelUnavailableException e) {
            log.warn("Maintenance operation {} rejected: {}", operation, e.getMessage());
            return MaintenanceOperationResult.failed(operation, seconds(System.nanoTime() - start), e.getMessage());
        } catch (Exception e) {
            log.error("Maintenance operation {} failed", operation, e);
            return MaintenanceOperationResult.failed(operation, seconds(System.nanoTime() - start),
                e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /**
     * 持久层统计快照
     */
    public CacheStoreStatistics statistics() {
        CacheRepository repository = cache.getRegistry().find(CacheLevel.DATABASE);
        if (repository == null || !cache.getRegistry().isAvailable(CacheLevel.DATABASE)) {
            return new CacheStoreStatistics(0, 0, 0.0, null, null);
        }
        try {
            if (repository instanceof DatabaseCacheRepository db) {
                DatabaseCacheRepository.TableStatistics stats = db.statistics();
                return new CacheStoreStatistics(stats.totalKeys(), stats.totalSizeBytes(),
                    round(stats.totalSizeBytes() / 1024.0 / 1024.0),
                    toInstant(stats.oldestStoredAt()), toInstant(stats.newestStoredAt()));
            }
            CacheSize size = repository.size();
            return new CacheStoreStatistics(size.count(), size.bytes(), round(size.megabytes()), null, null);
        } catch (Exception e) {
            log.warn("Failed to collect database cache statistics: {}", e.toString());
            return new CacheStoreStatistics(0, 0, 0.0, null, null);
        }
    }

    /**
     * 按阈值生成建议：Key 过多建议 cleanup，体积过大建议 vacuum，否则建议例行 optimize
     */
    public List<Recommendation> recommendations(CacheStoreStatistics stats) {
        List<Recommendation> recommendations = new ArrayList<>();
        FormSecurityCacheProperties.Maintenance limits = properties.getMaintenance();
        if (stats.totalKeys() > limits.getMaxKeys()) {
            recommendations.add(new Recommendation(MAINT_CLEANUP, "high",
                "Database cache holds " + stats.totalKeys() + " keys, above the limit of "
                    + limits.getMaxKeys() + "; run cleanup to purge expired entries"));
        }
        if (stats.totalSizeMb() > limits.getMaxSizeMb()) {
            recommendations.add(new Recommendation(MAINT_VACUUM, "medium",
                "Database cache size " + stats.totalSizeMb() + " MB exceeds " + limits.getMaxSizeMb()
                    + " MB; run vacuum to reclaim space"));
        }
        if (recommendations.isEmpty()) {
            recommendations.add(new Recommendation(MAINT_OPTIMIZE, "low",
                "Database cache is within limits; periodic optimize keeps lookups fast"));
        }
        return recommendations;
    }

    private MaintenanceOperationResult cleanup(CacheRepository repository, long start) {
        int purged = repository.purgeExpired();
        int pruned = cache.getKeyTracker().retainOnly(CacheLevel.DATABASE, repository.keys());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("expired_removed", purged);
        details.put("index_entries_pruned", pruned);
        return new MaintenanceOperationResult(MAINT_CLEANUP, true, purged,
            seconds(System.nanoTime() - start), List.of(), details);
    }

    private MaintenanceOperationResult runStatements(String operation, CacheRepository repository,
                                                     List<String> statements, long start) {
        if (!(repository instanceof DatabaseCacheRepository db)) {
            return new MaintenanceOperationResult(operation, true, 0, seconds(System.nanoTime() - start),
                List.of(), Map.of("skipped", "backend has no " + operation + " support"));
        }
        if (statements.isEmpty()) {
            return new MaintenanceOperationResult(operation, true, 0, seconds(System.nanoTime() - start),
                List.of(), Map.of("statements", 0, "table", db.getTable()));
        }
        int executed = db.executeStatements(statements);
        return new MaintenanceOperationResult(operation, true, executed, seconds(System.nanoTime() - start),
            List.of(), Map.of("statements", executed, "table", db.getTable()));
    }

    private MaintenanceOperationResult reindex(CacheRepository repository, long start) {
        int indexed = repository instanceof TagAwareCacheRepository tagged
            ? cache.getKeyTracker().rebuild(CacheLevel.DATABASE, tagged.indexedKeys(properties.getPrefix()))
            : cache.getKeyTracker().rebuild(CacheLevel.DATABASE, repository.keys(), properties.getPrefix());
        return new MaintenanceOperationResult(MAINT_REINDEX, true, indexed, seconds(System.nanoTime() - start),
            List.of(), Map.of("indexed_keys", indexed));
    }

    /**
     * 写入校验 Key 再读回比对，最后删除
     */
    private MaintenanceOperationResult validate(CacheRepository repository, long start) {
        String sampleKey = SAMPLE_NAMESPACE + ":" + SAMPLE_KEY_PREFIX + UUID.randomUUID();
        Map<String, Object> sampleValue = new LinkedHashMap<>();
        sampleValue.put("sample", true);
        sampleValue.put("timestamp", clock.millis());
        List<String> errors = new ArrayList<>();
        Map<String, Object> details = new LinkedHashMap<>();
        try {
            boolean written = repository.put(sampleKey, sampleValue, SAMPLE_TTL_SECONDS);
            details.put("write", written);
            CacheEntry entry = repository.get(sampleKey);
            boolean readBack = entry != null && Objects.equals(normalize(entry.value()), normalize(sampleValue));
            details.put("read_after_write", readBack);
            if (!written) {
                errors.add("Sample write was rejected");
            }
            if (!readBack) {
                errors.add("Sample value read back does not match what was written");
            }
        } finally {
            repository.forget(sampleKey);
            details.put("removed", !repository.has(sampleKey));
        }
        return new MaintenanceOperationResult(MAINT_VALIDATE, errors.isEmpty(), 1,
            seconds(System.nanoTime() - start), errors, details);
    }

    private Object normalize(Object value) {
        return cache.getContext().getSerializer().deserialize(cache.getContext().getSerializer().serialize(value));
    }

    private static Instant toInstant(Long epochMillis) {
        return epochMillis == null ? null : Instant.ofEpochMilli(epochMillis);
    }

    private static double seconds(long nanos) {
        return round(nanos / 1_000_000_000.0);
    }

    private static double round(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
