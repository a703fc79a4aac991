package com.formsecurity.cache.service;

import com.formsecurity.cache.constant.CacheConstants;
import com.formsecurity.cache.model.CacheKey;
import com.formsecurity.cache.model.CacheLevel;
import com.formsecurity.cache.model.InvalidationEvent;
import com.formsecurity.cache.model.InvalidationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 缓存失效服务
 * 通过协调器的 Key 索引解析 pattern / tag / namespace，不依赖后端扫描；
 * 失效按层级限定，并沿命名空间依赖关系级联；
 * 创建后挂接到协调器，协调器上的批量失效同样经过这里
 */
public class CacheInvalidationService {

    private static final Logger log = LoggerFactory.getLogger(CacheInvalidationService.class);

    private final CacheOperationService cache;
    private final Clock clock;

    /** 命名空间 -> 依赖它的命名空间 */
    private final Map<String, Set<String>> dependencies = new ConcurrentHashMap<>();

    private final AtomicLong invalidations = new AtomicLong();
    private final AtomicLong bulkInvalidations = new AtomicLong();
    private final AtomicLong keysInvalidated = new AtomicLong();
    private final AtomicLong cascadeInvalidations = new AtomicLong();
    private final AtomicLong dependencyInvalidations = new AtomicLong();

    public CacheInvalidationService(CacheOperationService cache) {
        this.cache = cache;
        this.clock = cache.getContext().getClock();
        cache.attachInvalidationService(this);
    }

    /**
     * 失效单个 Key，发布一个事件并级联依赖命名空间
     */
    public boolean invalidate(Object key, Collection<CacheLevel> levels) {
        return invalidate(key, levels, CacheConstants.REASON_MANUAL, Map.of());
    }

    public boolean invalidate(Object key, Collection<CacheLevel> levels, String reason, Map<String, Object> metadata) {
        CacheKey resolved = cache.resolveKey(key);
        CacheKey known = cache.getKeyTracker().lookup(resolved.toString())
            .map(k -> k.withTags(resolved.tags()))
            .orElse(resolved);
        boolean success = cache.forget(resolved, levels);
        invalidations.incrementAndGet();
        if (success) {
            keysInvalidated.incrementAndGet();
            cache.getEventPublisher().publish(InvalidationEvent.of(known,
                levels == null ? null : new LinkedHashSet<>(levels), reason, metadata, Instant.now(clock)));
        }
        cascade(Set.of(known.namespace()), levels);
        return success;
    }

    public InvalidationOutcome invalidateByPattern(String pattern, Collection<CacheLevel> levels) {
        Set<CacheKey> keys = cache.getKeyTracker().findByPattern(pattern, levelsOrAll(levels));
        return bulk("pattern", pattern, keys, levels, CacheConstants.REASON_PATTERN);
    }

    public InvalidationOutcome invalidateByTags(Collection<String> tags, Collection<CacheLevel> levels) {
        Set<CacheKey> keys = cache.findKeysByTags(tags, levels);
        return bulk("tags", String.join(",", tags), keys, levels, CacheConstants.REASON_TAGS);
    }

    public InvalidationOutcome invalidateByNamespace(String namespace, Collection<CacheLevel> levels) {
        Set<CacheKey> keys = cache.getKeyTracker().findByNamespace(namespace, levelsOrAll(levels));
        InvalidationOutcome outcome = cache.invalidateMatching("namespace", namespace, keys, levels,
            CacheConstants.REASON_NAMESPACE, Map.of());
        record(outcome);
        return outcome.merge(cascade(Set.of(namespace), levels));
    }

    // ==================== 依赖关系 ====================

    /**
     * 登记依赖：source 命名空间中的数据失效时，dependentNamespace 整体失效
     */
    public void addDependency(String sourceNamespace, String dependentNamespace) {
        if (sourceNamespace.equals(dependentNamespace)) {
            throw new IllegalArgumentException("Namespace cannot depend on itself: " + sourceNamespace);
        }
        dependencies.computeIfAbsent(sourceNamespace, k -> ConcurrentHashMap.newKeySet()).add(dependentNamespace);
        log.debug("Cache dependency added: {} -> {}", sourceNamespace, dependentNamespace);
    }

    public void removeDependency(String sourceNamespace, String dependentNamespace) {
        dependencies.computeIfPresent(sourceNamespace, (k, set) -> {
            set.remove(dependentNamespace);
            return set.isEmpty() ? null : set;
        });
    }

    public Map<String, Set<String>> getDependencies() {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        dependencies.forEach((k, v) -> copy.put(k, Set.copyOf(v)));
        return copy;
    }

    public Map<String, Long> getStats() {
        Map<String, Long> stats = new LinkedHashMap<>();
        stats.put("invalidations", invalidations.get());
        stats.put("bulk_invalidations", bulkInvalidations.get());
        stats.put("keys_invalidated", keysInvalidated.get());
        stats.put("cascade_invalidations", cascadeInvalidations.get());
        stats.put("dependency_invalidations", dependencyInvalidations.get());
        stats.put("dependencies", (long) dependencies.values().stream().mapToInt(Set::size).sum());
        return stats;
    }

    public void resetStats() {
        invalidations.set(0);
        bulkInvalidations.set(0);
        keysInvalidated.set(0);
        cascadeInvalidations.set(0);
        dependencyInvalidations.set(0);
    }

    private InvalidationOutcome bulk(String type, String criteria, Set<CacheKey> keys,
                                     Collection<CacheLevel> levels, String reason) {
        InvalidationOutcome outcome = cache.invalidateMatching(type, criteria, keys, levels, reason, Map.of());
        record(outcome);
        Set<String> namespaces = new LinkedHashSet<>();
        outcome.removed().forEach(k -> namespaces.add(k.namespace()));
        return outcome.merge(cascade(namespaces, levels));
    }

    private void record(InvalidationOutcome outcome) {
        invalidations.incrementAndGet();
        bulkInvalidations.incrementAndGet();
        keysInvalidated.addAndGet(outcome.count());
    }

    /**
     * 广度优先级联，已访问的命名空间不会重复处理（环安全）
     */
    private InvalidationOutcome cascade(Set<String> sources, Collection<CacheLevel> levels) {
        InvalidationOutcome total = InvalidationOutcome.EMPTY;
        Set<String> visited = new HashSet<>(sources);
        Deque<String> queue = new ArrayDeque<>(sources);
        while (!queue.isEmpty()) {
            String source = queue.poll();
            for (String dependent : dependencies.getOrDefault(source, Set.of())) {
                if (!visited.add(dependent)) {
                    continue;
                }
                Set<CacheKey> keys = cache.getKeyTracker().findByNamespace(dependent, levelsOrAll(levels));
                InvalidationOutcome outcome = cache.invalidateMatching("namespace", dependent, keys, levels,
                    CacheConstants.REASON_DEPENDENCY, Map.of("source_namespace", source));
                cascadeInvalidations.incrementAndGet();
                dependencyInvalidations.addAndGet(outcome.count());
                log.debug("Cascaded invalidation {} -> {}, keys: {}", source, dependent, outcome.count());
                total = total.merge(outcome);
                queue.add(dependent);
            }
        }
        return total;
    }

    private static Collection<CacheLevel> levelsOrAll(Collection<CacheLevel> levels) {
        return levels == null ? CacheLevel.orderedLevels() : levels;
    }
}
