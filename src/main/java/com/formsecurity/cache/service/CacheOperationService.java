package com.formsecurity.cache.service;

import com.formsecurity.cache.config.FormSecurityCacheProperties;
import com.formsecurity.cache.constant.CacheConstants;
import com.formsecurity.cache.model.BulkInvalidationEvent;
import com.formsecurity.cache.model.CacheEntry;
import com.formsecurity.cache.model.CacheKey;
import com.formsecurity.cache.model.CacheLevel;
import com.formsecurity.cache.model.InvalidationEvent;
import com.formsecurity.cache.model.InvalidationOutcome;
import com.formsecurity.cache.monitor.CacheMetrics;
import com.formsecurity.cache.repository.CacheRepository;
import com.formsecurity.cache.repository.CacheRepositoryRegistry;
import com.formsecurity.cache.repository.TagAwareCacheRepository;
import com.formsecurity.cache.support.CacheErrorHandler;
import com.formsecurity.cache.support.CacheFallbackStrategy;
import com.formsecurity.cache.support.CacheOperationalContext;
import com.formsecurity.cache.support.CacheValueSerializer;
import com.formsecurity.cache.support.FluentCacheContext;
import com.formsecurity.cache.support.KeyTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * 三级缓存协调器
 * 读：REQUEST → MEMORY → DATABASE 逐级回退，命中后回填所有更快的层级
 * 写：扇出到所有请求且启用的层级，至少一层接受即成功
 * 单层异常交给按类型注册的异常处理器，不中断其余层级；全部层级失败才走降级策略
 *
 * Key 参数接受原始字符串或 {@link CacheKey}
 */
public class CacheOperationService {

    private static final Logger log = LoggerFactory.getLogger(CacheOperationService.class);

    private static final Object MISS = new Object();

    /** 单层读取失败的哨兵值 */
    private static final CacheEntry FAILED = new CacheEntry(null, 0, null, 0);

    private enum WriteResult { ACCEPTED, REJECTED, FAILED }

    private final CacheRepositoryRegistry registry;
    private final CacheOperationalContext context;
    private final CacheResilienceService resilienceService;
    private final CacheSecurityService securityService;
    private final CacheEventPublisher eventPublisher;
    private final CacheMetrics metrics = new CacheMetrics();
    private final KeyTracker keyTracker = new KeyTracker();
    private final Map<CacheLevel, Boolean> enabledLevels = new ConcurrentHashMap<>();
    private volatile CacheInvalidationService invalidationService;

    public CacheOperationService(CacheRepositoryRegistry registry, CacheOperationalContext context) {
        this(registry, context, null, null, new CacheEventPublisher());
    }

    public CacheOperationService(CacheRepositoryRegistry registry,
                                 CacheOperationalContext context,
                                 CacheResilienceService resilienceService,
                                 CacheSecurityService securityService,
                                 CacheEventPublisher eventPublisher) {
        this.registry = registry;
        this.context = context;
        this.resilienceService = resilienceService;
        this.securityService = securityService;
        this.eventPublisher = eventPublisher;
        FormSecurityCacheProperties.Levels flags = context.getProperties().getLevels();
        enabledLevels.put(CacheLevel.REQUEST, flags.isRequestEnabled());
        enabledLevels.put(CacheLevel.MEMORY, flags.isMemoryEnabled());
        enabledLevels.put(CacheLevel.DATABASE, flags.isDatabaseEnabled());
        restoreIndexes();
        log.info("Cache coordinator initialized, enabled levels: {}, unavailable levels: {}",
            getEnabledLevels(), registry.getUnavailableLevels());
    }

    /**
     * 从持久化了 Key 元数据的层级重建标签与命名空间索引
     *
     * @return 各层恢复的 Key 数量
     */
    public Map<CacheLevel, Integer> restoreIndexes() {
        Map<CacheLevel, Integer> restored = new EnumMap<>(CacheLevel.class);
        for (CacheLevel level : CacheLevel.orderedLevels()) {
            if (!level.survivesRequest() || !isUsable(level)) {
                continue;
            }
            try {
                if (registry.require(level) instanceof TagAwareCacheRepository tagged) {
                    int indexed = keyTracker.rebuild(level,
                        tagged.indexedKeys(context.getProperties().getPrefix()));
                    restored.put(level, indexed);
                    log.info("Restored {} indexed keys for cache level {}", indexed, level);
                }
            } catch (Exception e) {
                log.warn("Failed to restore key index for cache level {}: {}", level, e.getMessage());
            }
        }
        return restored;
    }

    // ==================== 读 ====================

    public Object get(Object key) {
        return get(key, null, null);
    }

    public Object get(Object key, Object defaultValue) {
        return get(key, defaultValue, null);
    }

    /**
     * 逐级读取，命中后回填更快的层级；全部未命中返回默认值
     */
    public Object get(Object key, Object defaultValue, Collection<CacheLevel> levels) {
        return doGet(resolveKey(key, FluentCacheContext.EMPTY), defaultValue,
            resolveLevels(levels, FluentCacheContext.EMPTY));
    }

    /**
     * 读取并转换为指定类型（持久层读回的是 JSON 结构）
     */
    public <T> T getAs(Object key, Class<T> type) {
        return getAs(key, type, null);
    }

    public <T> T getAs(Object key, Class<T> type, Collection<CacheLevel> levels) {
        Object value = get(key, null, levels);
        return value == null ? null : serializer().convert(value, type);
    }

    // ==================== 写 ====================

    public boolean put(Object key, Object value) {
        return put(key, value, null, null);
    }

    public boolean put(Object key, Object value, Long ttlSeconds) {
        return put(key, value, ttlSeconds, null);
    }

    /**
     * 扇出写入
     *
     * @param ttlSeconds 存活秒数，null 表示永不过期
     */
    public boolean put(Object key, Object value, Long ttlSeconds, Collection<CacheLevel> levels) {
        return doPut(resolveKey(key, FluentCacheContext.EMPTY), value, ttlSeconds,
            resolveLevels(levels, FluentCacheContext.EMPTY));
    }

    public boolean add(Object key, Object value) {
        return add(key, value, null, null);
    }

    public boolean add(Object key, Object value, Long ttlSeconds) {
        return add(key, value, ttlSeconds, null);
    }

    /**
     * 不存在时写入：任一目标层级已有存活条目则返回 false 且不做修改
     */
    public boolean add(Object key, Object value, Long ttlSeconds, Collection<CacheLevel> levels) {
        CacheKey cacheKey = resolveKey(key, FluentCacheContext.EMPTY);
        List<CacheLevel> targets = resolveLevels(levels, FluentCacheContext.EMPTY);
        if (doHas(cacheKey, targets, CacheConstants.OP_ADD)) {
            return false;
        }
        return doPut(cacheKey, value, ttlSeconds, targets);
    }

    // ==================== 删除 / 查询 ====================

    public boolean forget(Object key) {
        return forget(key, null);
    }

    /**
     * 从每个目标层级删除并同步清理索引，重复删除同样返回 true
     */
    public boolean forget(Object key, Collection<CacheLevel> levels) {
        return doForget(resolveKey(key, FluentCacheContext.EMPTY), resolveLevels(levels, FluentCacheContext.EMPTY));
    }

    public boolean has(Object key) {
        return has(key, null);
    }

    public boolean has(Object key, Collection<CacheLevel> levels) {
        return doHas(resolveKey(key, FluentCacheContext.EMPTY), resolveLevels(levels, FluentCacheContext.EMPTY),
            CacheConstants.OP_HAS);
    }

    public boolean flush() {
        return flush(null);
    }

    public boolean flush(Collection<CacheLevel> levels) {
        return doFlush(resolveLevels(levels, FluentCacheContext.EMPTY));
    }

    // ==================== remember ====================

    public <T> T remember(Object key, Supplier<T> producer) {
        return remember(key, producer, null, null);
    }

    public <T> T remember(Object key, Supplier<T> producer, Long ttlSeconds) {
        return remember(key, producer, ttlSeconds, null);
    }

    /**
     * 读取，未命中时调用 producer 一次并写入
     * 不做单飞去重：并发未命中时 producer 可能被多个调用方各执行一次，重复写入为幂等覆盖
     */
    public <T> T remember(Object key, Supplier<T> producer, Long ttlSeconds, Collection<CacheLevel> levels) {
        return doRemember(resolveKey(key, FluentCacheContext.EMPTY), producer, ttlSeconds,
            resolveLevels(levels, FluentCacheContext.EMPTY));
    }

    public <T> T rememberForever(Object key, Supplier<T> producer) {
        return remember(key, producer, null, null);
    }

    public <T> T rememberForever(Object key, Supplier<T> producer, Collection<CacheLevel> levels) {
        return remember(key, producer, null, levels);
    }

    // ==================== 单层访问（不回退、不扇出） ====================

    public Object getFromRequest(Object key) {
        return getFromLevel(CacheLevel.REQUEST, key);
    }

    public Object getFromMemory(Object key) {
        return getFromLevel(CacheLevel.MEMORY, key);
    }

    public Object getFromDatabase(Object key) {
        return getFromLevel(CacheLevel.DATABASE, key);
    }

    public boolean putInRequest(Object key, Object value) {
        return putInLevel(CacheLevel.REQUEST, key, value, null);
    }

    public boolean putInMemory(Object key, Object value, Long ttlSeconds) {
        return putInLevel(CacheLevel.MEMORY, key, value, ttlSeconds);
    }

    public boolean putInDatabase(Object key, Object value, Long ttlSeconds) {
        return putInLevel(CacheLevel.DATABASE, key, value, ttlSeconds);
    }

    public boolean forgetFromRequest(Object key) {
        return forgetFromLevel(CacheLevel.REQUEST, key);
    }

    public boolean forgetFromMemory(Object key) {
        return forgetFromLevel(CacheLevel.MEMORY, key);
    }

    public boolean forgetFromDatabase(Object key) {
        return forgetFromLevel(CacheLevel.DATABASE, key);
    }

    public boolean flushRequest() {
        return doFlush(List.of(CacheLevel.REQUEST));
    }

    public boolean flushMemory() {
        return doFlush(List.of(CacheLevel.MEMORY));
    }

    public boolean flushDatabase() {
        return doFlush(List.of(CacheLevel.DATABASE));
    }

    public Object getFromLevel(CacheLevel level, Object key) {
        CacheKey cacheKey = resolveKey(key, FluentCacheContext.EMPTY);
        if (!isUsable(level)) {
            return null;
        }
        CacheEntry entry = readLevel(level, cacheKey);
        return entry == null || entry == FAILED ? null : entry.value();
    }

    public boolean putInLevel(CacheLevel level, Object key, Object value, Long ttlSeconds) {
        CacheKey cacheKey = resolveKey(key, FluentCacheContext.EMPTY);
        validateTtl(ttlSeconds);
        if (value == null || !isUsable(level)) {
            return false;
        }
        return writeLevel(level, cacheKey, value, ttlSeconds) == WriteResult.ACCEPTED;
    }

    public boolean forgetFromLevel(CacheLevel level, Object key) {
        CacheKey cacheKey = resolveKey(key, FluentCacheContext.EMPTY);
        if (!isUsable(level)) {
            return true;
        }
        return deleteLevel(level, cacheKey);
    }

    // ==================== 批量失效 ====================

    /**
     * 挂接失效服务后，批量失效统一走失效服务（依赖级联与统计），未挂接时只删除匹配的 Key
     */
    void attachInvalidationService(CacheInvalidationService invalidationService) {
        this.invalidationService = invalidationService;
    }

    public boolean invalidateByPattern(String pattern) {
        return invalidateByPattern(pattern, null);
    }

    public boolean invalidateByPattern(String pattern, Collection<CacheLevel> levels) {
        if (invalidationService != null) {
            return invalidationService.invalidateByPattern(pattern, levels).success();
        }
        List<CacheLevel> targets = resolveLevels(levels, FluentCacheContext.EMPTY);
        return invalidateMatching("pattern", pattern, keyTracker.findByPattern(pattern, targets), levels,
            CacheConstants.REASON_PATTERN, Map.of()).success();
    }

    public boolean invalidateByTags(Collection<String> tags) {
        return invalidateByTags(tags, null);
    }

    public boolean invalidateByTags(Collection<String> tags, Collection<CacheLevel> levels) {
        if (invalidationService != null) {
            return invalidationService.invalidateByTags(tags, levels).success();
        }
        return invalidateMatching("tags", String.join(",", tags), findKeysByTags(tags, levels), levels,
            CacheConstants.REASON_TAGS, Map.of()).success();
    }

    public boolean invalidateByNamespace(String namespace) {
        return invalidateByNamespace(namespace, null);
    }

    public boolean invalidateByNamespace(String namespace, Collection<CacheLevel> levels) {
        if (invalidationService != null) {
            return invalidationService.invalidateByNamespace(namespace, levels).success();
        }
        List<CacheLevel> targets = resolveLevels(levels, FluentCacheContext.EMPTY);
        return invalidateMatching("namespace", namespace, keyTracker.findByNamespace(namespace, targets), levels,
            CacheConstants.REASON_NAMESPACE, Map.of()).success();
    }

    public Set<CacheKey> findKeysByTags(Collection<String> tags, Collection<CacheLevel> levels) {
        List<CacheLevel> targets = resolveLevels(levels, FluentCacheContext.EMPTY);
        Set<CacheKey> keys = new LinkedHashSet<>();
        for (String tag : tags) {
            keys.addAll(keyTracker.findByTag(tag, targets));
        }
        return keys;
    }

    /**
     * 删除已解析出的一组 Key：每个移除的 Key 发布一个失效事件，最后发布一个汇总事件
     *
     * @param type     pattern | tags | namespace
     * @param criteria 原始匹配条件
     */
    public InvalidationOutcome invalidateMatching(String type, String criteria, Set<CacheKey> keys,
                                                  Collection<CacheLevel> levels, String reason,
                                                  Map<String, Object> metadata) {
        List<CacheLevel> targets = resolveLevels(levels, FluentCacheContext.EMPTY);
        Set<CacheLevel> eventLevels = levels == null ? null : new LinkedHashSet<>(levels);
        Set<CacheKey> removed = new LinkedHashSet<>();
        Set<CacheKey> failed = new LinkedHashSet<>();
        Instant now = Instant.now(context.getClock());
        for (CacheKey key : keys) {
            if (doForget(key, targets)) {
                removed.add(key);
                Map<String, Object> eventMetadata = new LinkedHashMap<>(metadata);
                eventMetadata.put(type, criteria);
                eventPublisher.publish(InvalidationEvent.of(key, eventLevels, reason, eventMetadata, now));
            } else {
                failed.add(key);
            }
        }
        eventPublisher.publish(new BulkInvalidationEvent(type, criteria, eventLevels, removed.size(), now));
        log.debug("Invalidated {} keys by {} '{}', failed: {}", removed.size(), type, criteria, failed.size());
        return new InvalidationOutcome(removed, failed);
    }

    // ==================== 层级控制 ====================

    /**
     * 运行时启用 / 停用层级，停用的层级在读写扇出中被整体跳过
     *
     * @return 启用一个不可用的层级时返回 false（状态仍会记录）
     */
    public boolean toggleLevel(CacheLevel level, boolean enabled) {
        Boolean previous = enabledLevels.put(level, enabled);
        if (!Boolean.valueOf(enabled).equals(previous)) {
            log.info("Cache level {} {}", level, enabled ? "enabled" : "disabled");
        }
        return !enabled || registry.isAvailable(level);
    }

    public boolean isLevelEnabled(CacheLevel level) {
        return Boolean.TRUE.equals(enabledLevels.get(level));
    }

    public List<CacheLevel> getEnabledLevels() {
        List<CacheLevel> result = new ArrayList<>();
        for (CacheLevel level : CacheLevel.orderedLevels()) {
            if (isLevelEnabled(level)) {
                result.add(level);
            }
        }
        return result;
    }

    public List<CacheLevel> getDisabledLevels() {
        List<CacheLevel> result = new ArrayList<>();
        for (CacheLevel level : CacheLevel.orderedLevels()) {
            if (!isLevelEnabled(level)) {
                result.add(level);
            }
        }
        return result;
    }

    public void enableAllLevels() {
        CacheLevel.orderedLevels().forEach(level -> toggleLevel(level, true));
    }

    public void disableAllLevels() {
        CacheLevel.orderedLevels().forEach(level -> toggleLevel(level, false));
    }

    public Map<CacheLevel, Map<String, Object>> getLevelStatusSummary() {
        Map<CacheLevel, Map<String, Object>> summary = new EnumMap<>(CacheLevel.class);
        for (CacheLevel level : CacheLevel.orderedLevels()) {
            Map<String, Object> status = new LinkedHashMap<>();
            status.put("enabled", isLevelEnabled(level));
            status.put("available", registry.isAvailable(level));
            status.put("driverRequired", level.driverRequired());
            status.put("survivesRequest", level.survivesRequest());
            status.put("defaultTtlSeconds", level.defaultTtlSeconds());
            status.put("expectedResponseTimeMs", List.of(level.minResponseTimeMs(), level.maxResponseTimeMs()));
            status.put("trackedKeys", keyTracker.size(level));
            if (resilienceService != null && level.driverRequired()) {
                status.put("circuitBreaker", resilienceService.getState(level).name());
            }
            summary.put(level, status);
        }
        return summary;
    }

    // ==================== 链式上下文 ====================

    public FluentCacheOperations tags(String... tags) {
        return new FluentCacheOperations(this).tags(tags);
    }

    public FluentCacheOperations prefix(String prefix) {
        return new FluentCacheOperations(this).prefix(prefix);
    }

    public FluentCacheOperations levels(CacheLevel... levels) {
        return new FluentCacheOperations(this).levels(levels);
    }

    public FluentCacheOperations ttl(long ttlSeconds) {
        return new FluentCacheOperations(this).ttl(ttlSeconds);
    }

    // ==================== 异常处理 / 降级 ====================

    public void registerErrorHandler(Class<? extends Throwable> type, CacheErrorHandler handler) {
        context.registerErrorHandler(type, handler);
    }

    public void registerFallbackStrategy(String operation, CacheFallbackStrategy strategy) {
        context.registerFallbackStrategy(operation, strategy);
    }

    // ==================== 请求边界 ====================

    /**
     * 结束当前调用：清空 REQUEST 层及其索引
     */
    public void endRequest() {
        CacheRepository request = registry.find(CacheLevel.REQUEST);
        if (request != null) {
            request.flush();
        }
        keyTracker.clear(CacheLevel.REQUEST);
    }

    /**
     * try-with-resources 形式的请求边界
     */
    public RequestScope requestScope() {
        return new RequestScope(this);
    }

    public CacheMetrics getMetrics() {
        return metrics;
    }

    public KeyTracker getKeyTracker() {
        return keyTracker;
    }

    public CacheRepositoryRegistry getRegistry() {
        return registry;
    }

    public CacheOperationalContext getContext() {
        return context;
    }

    public CacheEventPublisher getEventPublisher() {
        return eventPublisher;
    }

    public CacheKey resolveKey(Object key) {
        return resolveKey(key, FluentCacheContext.EMPTY);
    }

    // ==================== 链式上下文消费入口 ====================

    Object contextGet(FluentCacheContext ctx, Object key, Object defaultValue) {
        return doGet(resolveKey(key, ctx), defaultValue, resolveLevels(null, ctx));
    }

    boolean contextPut(FluentCacheContext ctx, Object key, Object value) {
        return doPut(resolveKey(key, ctx), value, ctx.ttlSeconds(), resolveLevels(null, ctx));
    }

    <T> T contextRemember(FluentCacheContext ctx, Object key, Supplier<T> producer) {
        return doRemember(resolveKey(key, ctx), producer, ctx.ttlSeconds(), resolveLevels(null, ctx));
    }

    boolean contextForget(FluentCacheContext ctx, Object key) {
        return doForget(resolveKey(key, ctx), resolveLevels(null, ctx));
    }

    boolean contextFlush(FluentCacheContext ctx) {
        if (!ctx.tags().isEmpty()) {
            return invalidateByTags(ctx.tags(), ctx.levels());
        }
        return doFlush(resolveLevels(null, ctx));
    }

    // ==================== 内部实现 ====================

    private Object doGet(CacheKey key, Object defaultValue, List<CacheLevel> levels) {
        String address = key.toString();
        if (!allowed(CacheConstants.OP_GET, address)) {
            return defaultValue;
        }
        int attempted = 0;
        int failures = 0;
        for (CacheLevel level : levels) {
            if (!isUsable(level)) {
                continue;
            }
            attempted++;
            CacheEntry entry = readLevel(level, key);
            if (entry == FAILED) {
                failures++;
                continue;
            }
            if (entry != null) {
                metrics.recordCallHit();
                backfill(key, entry, level, levels);
                return entry.value();
            }
        }
        metrics.recordCallMiss();
        if (attempted > 0 && failures == attempted) {
            return context.fallback(CacheConstants.OP_GET, address, defaultValue);
        }
        return defaultValue;
    }

    private boolean doPut(CacheKey key, Object value, Long ttlSeconds, List<CacheLevel> levels) {
        validateTtl(ttlSeconds);
        String address = key.toString();
        if (value == null) {
            log.debug("Ignoring null value for key: {}", address);
            return false;
        }
        if (!allowed(CacheConstants.OP_PUT, address)
            || (securityService != null && !securityService.checkValue(address, value))) {
            return false;
        }
        int attempted = 0;
        int failures = 0;
        int accepted = 0;
        for (CacheLevel level : levels) {
            if (!isUsable(level)) {
                continue;
            }
            attempted++;
            WriteResult result = writeLevel(level, key, value, ttlSeconds);
            if (result == WriteResult.ACCEPTED) {
                accepted++;
            } else if (result == WriteResult.FAILED) {
                failures++;
            }
        }
        if (accepted > 0) {
            if (securityService != null) {
                securityService.audit(CacheConstants.OP_PUT, address, "stored levels=" + accepted);
            }
            return true;
        }
        if (attempted == 0) {
            return true;
        }
        if (failures == attempted) {
            return context.fallbackBoolean(CacheConstants.OP_PUT, address);
        }
        return false;
    }

    private boolean doForget(CacheKey key, List<CacheLevel> levels) {
        String address = key.toString();
        if (!allowed(CacheConstants.OP_FORGET, address)) {
            return false;
        }
        int attempted = 0;
        int failures = 0;
        for (CacheLevel level : levels) {
            if (!isUsable(level)) {
                continue;
            }
            attempted++;
            if (!deleteLevel(level, key)) {
                failures++;
            }
        }
        if (attempted > 0 && failures == attempted) {
            return context.fallbackBoolean(CacheConstants.OP_FORGET, address);
        }
        if (securityService != null) {
            securityService.audit(CacheConstants.OP_FORGET, address, "removed");
        }
        return true;
    }

    private boolean doHas(CacheKey key, List<CacheLevel> levels, String operation) {
        String address = key.toString();
        int attempted = 0;
        int failures = 0;
        for (CacheLevel level : levels) {
            if (!isUsable(level)) {
                continue;
            }
            attempted++;
            try {
                CacheRepository repository = registry.require(level);
                boolean present = execute(level, () -> repository.has(address));
                if (present) {
                    return true;
                }
                keyTracker.untrack(level, address);
            } catch (Exception e) {
                failures++;
                context.handleError(level, operation, address, e);
            }
        }
        if (attempted > 0 && failures == attempted) {
            return context.fallbackBoolean(CacheConstants.OP_HAS, address);
        }
        return false;
    }

    private boolean doFlush(List<CacheLevel> levels) {
        int attempted = 0;
        int failures = 0;
        for (CacheLevel level : levels) {
            if (!isUsable(level)) {
                continue;
            }
            attempted++;
            try {
                CacheRepository repository = registry.require(level);
                execute(level, repository::flush);
                keyTracker.clear(level);
                log.info("Cache level {} flushed", level);
            } catch (Exception e) {
                failures++;
                context.handleError(level, CacheConstants.OP_FLUSH, "*", e);
            }
        }
        if (attempted > 0 && failures == attempted) {
            return context.fallbackBoolean(CacheConstants.OP_FLUSH, "*");
        }
        return true;
    }

    @SuppressWarnings("unchecked")
    private <T> T doRemember(CacheKey key, Supplier<T> producer, Long ttlSeconds, List<CacheLevel> levels) {
        validateTtl(ttlSeconds);
        Object cached = doGet(key, MISS, levels);
        if (cached != MISS) {
            return (T) cached;
        }
        T produced = producer.get();
        if (produced != null) {
            doPut(key, produced, ttlSeconds, levels);
        }
        return produced;
    }

    /**
     * 回填命中层之上、且在本次请求层级范围内的所有更快层级
     * TTL 取源条目的剩余寿命，源条目永不过期时取目标层默认值
     */
    private void backfill(CacheKey key, CacheEntry entry, CacheLevel hitLevel, List<CacheLevel> levels) {
        long now = context.getClock().millis();
        Long remaining = entry.remainingTtlSeconds(now);
        if (remaining != null && remaining <= 0) {
            return;
        }
        for (CacheLevel level : levels) {
            if (!level.isFasterThan(hitLevel) || !isUsable(level)) {
                continue;
            }
            Long ttl = remaining;
            if (ttl == null && level.defaultTtlSeconds() > 0) {
                ttl = level.defaultTtlSeconds();
            }
            String address = key.toString();
            try {
                CacheRepository repository = registry.require(level);
                Long effectiveTtl = ttl;
                if (execute(level, () -> store(repository, mergedKey(key), entry.value(), effectiveTtl))) {
                    keyTracker.track(level, mergedKey(key));
                    log.debug("Backfilled key {} from {} into {}", address, hitLevel, level);
                }
            } catch (Exception e) {
                context.handleError(level, "backfill", address, e);
            }
        }
    }

    private CacheEntry readLevel(CacheLevel level, CacheKey key) {
        String address = key.toString();
        long start = System.nanoTime();
        try {
            CacheRepository repository = registry.require(level);
            CacheEntry entry = execute(level, () -> repository.get(address));
            long elapsed = System.nanoTime() - start;
            if (entry == null) {
                metrics.recordMiss(level, elapsed);
                keyTracker.untrack(level, address);
                return null;
            }
            metrics.recordHit(level, elapsed);
            return entry;
        } catch (Exception e) {
            context.handleError(level, CacheConstants.OP_GET, address, e);
            return FAILED;
        }
    }

    private WriteResult writeLevel(CacheLevel level, CacheKey key, Object value, Long ttlSeconds) {
        String address = key.toString();
        long start = System.nanoTime();
        try {
            CacheRepository repository = registry.require(level);
            boolean ok = execute(level, () -> store(repository, mergedKey(key), value, ttlSeconds));
            if (!ok) {
                log.debug("Cache level {} rejected key {}", level, address);
                return WriteResult.REJECTED;
            }
            metrics.recordPut(level, System.nanoTime() - start);
            keyTracker.track(level, key);
            return WriteResult.ACCEPTED;
        } catch (Exception e) {
            context.handleError(level, CacheConstants.OP_PUT, address, e);
            return WriteResult.FAILED;
        }
    }

    private static boolean store(CacheRepository repository, CacheKey key, Object value, Long ttlSeconds) {
        if (repository instanceof TagAwareCacheRepository tagged) {
            return tagged.put(key, value, ttlSeconds);
        }
        return repository.put(key.toString(), value, ttlSeconds);
    }

    private boolean deleteLevel(CacheLevel level, CacheKey key) {
        String address = key.toString();
        long start = System.nanoTime();
        try {
            CacheRepository repository = registry.require(level);
            execute(level, () -> repository.forget(address));
            metrics.recordDelete(level, System.nanoTime() - start);
            keyTracker.untrack(level, address);
            return true;
        } catch (Exception e) {
            context.handleError(level, CacheConstants.OP_FORGET, address, e);
            return false;
        }
    }

    private <T> T execute(CacheLevel level, Supplier<T> operation) {
        if (resilienceService == null) {
            return operation.get();
        }
        return resilienceService.execute(level, operation);
    }

    private boolean isUsable(CacheLevel level) {
        return isLevelEnabled(level) && registry.isAvailable(level);
    }

    private boolean allowed(String operation, String address) {
        return securityService == null || securityService.checkRateLimit(operation, address);
    }

    private CacheKey mergedKey(CacheKey key) {
        return keyTracker.lookup(key.toString()).map(known -> known.withTags(key.tags())).orElse(key);
    }

    private CacheKey resolveKey(Object key, FluentCacheContext ctx) {
        CacheKey cacheKey;
        if (key instanceof CacheKey k) {
            cacheKey = k;
        } else if (key instanceof String s) {
            cacheKey = CacheKey.of(s);
        } else {
            throw new IllegalArgumentException("Cache key must be a String or CacheKey, got: "
                + (key == null ? "null" : key.getClass().getName()));
        }
        if (!ctx.tags().isEmpty()) {
            cacheKey = cacheKey.withTags(ctx.tags());
        }
        String prefix = ctx.prefix() != null ? ctx.prefix() : context.getProperties().getPrefix();
        if (cacheKey.prefix() == null && prefix != null && !prefix.isBlank()) {
            cacheKey = cacheKey.withPrefix(prefix);
        } else if (ctx.prefix() != null) {
            cacheKey = cacheKey.withPrefix(ctx.prefix());
        }
        return cacheKey;
    }

    private List<CacheLevel> resolveLevels(Collection<CacheLevel> levels, FluentCacheContext ctx) {
        Collection<CacheLevel> requested = ctx.levels() != null ? ctx.levels() : levels;
        if (requested == null) {
            return CacheLevel.orderedLevels();
        }
        List<CacheLevel> ordered = new ArrayList<>();
        for (CacheLevel level : CacheLevel.orderedLevels()) {
            if (requested.contains(level)) {
                ordered.add(level);
            }
        }
        return ordered;
    }

    private static void validateTtl(Long ttlSeconds) {
        if (ttlSeconds != null && ttlSeconds <= 0) {
            throw new IllegalArgumentException("TTL must be positive or null (forever), got: " + ttlSeconds);
        }
    }

    private CacheValueSerializer serializer() {
        return context.getSerializer();
    }

    /**
     * 请求边界，关闭时清空 REQUEST 层
     */
    public static final class RequestScope implements AutoCloseable {

        private final CacheOperationService owner;

        private RequestScope(CacheOperationService owner) {
            this.owner = owner;
        }

        @Override
        public void close() {
            owner.endRequest();
        }
    }
}
