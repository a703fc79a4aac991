package com.formsecurity.cache.repository;

import com.formsecurity.cache.exception.CacheLevelUnavailableException;
import com.formsecurity.cache.model.CacheLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 层级仓库注册表
 * 构造时按层级一次性绑定仓库并探活，之后不再按调用重新解析；
 * 探活失败或未配置的层级登记为不可用，协调器对其读视为未命中、写视为空操作
 */
public class CacheRepositoryRegistry {

    private static final Logger log = LoggerFactory.getLogger(CacheRepositoryRegistry.class);

    private final Map<CacheLevel, CacheRepository> repositories = new EnumMap<>(CacheLevel.class);
    private final Set<CacheLevel> unavailable = ConcurrentHashMap.newKeySet();

    public CacheRepositoryRegistry(Collection<? extends CacheRepository> candidates) {
        for (CacheRepository repository : candidates) {
            CacheLevel level = repository.level();
            if (repositories.containsKey(level)) {
                throw new IllegalArgumentException("Duplicate repository for cache level " + level);
            }
            repositories.put(level, repository);
            try {
                repository.ping();
                log.info("Cache level {} registered with {}", level, repository.getClass().getSimpleName());
            } catch (Exception e) {
                unavailable.add(level);
                log.warn("Cache level {} is unavailable and will degrade to miss/no-op: {}", level, e.toString());
            }
        }
        for (CacheLevel level : CacheLevel.orderedLevels()) {
            if (!repositories.containsKey(level)) {
                unavailable.add(level);
                log.warn("No repository configured for cache level {}", level);
            }
        }
    }

    public boolean isAvailable(CacheLevel level) {
        return repositories.containsKey(level) && !unavailable.contains(level);
    }

    /**
     * 获取可用仓库
     *
     * @throws CacheLevelUnavailableException 层级不可用
     */
    public CacheRepository require(CacheLevel level) {
        if (!isAvailable(level)) {
            throw new CacheLevelUnavailableException(level, null);
        }
        return repositories.get(level);
    }

    /**
     * 获取仓库（无论是否可用），未配置返回 null
     */
    public CacheRepository find(CacheLevel level) {
        return repositories.get(level);
    }

    /**
     * 重新探活，恢复或标记不可用
     */
    public synchronized boolean recheck(CacheLevel level) {
        CacheRepository repository = repositories.get(level);
        if (repository == null) {
            return false;
        }
        try {
            repository.ping();
            if (unavailable.remove(level)) {
                log.info("Cache level {} is available again", level);
            }
            return true;
        } catch (Exception e) {
            if (unavailable.add(level)) {
                log.warn("Cache level {} became unavailable: {}", level, e.toString());
            }
            return false;
        }
    }

    public Set<CacheLevel> getUnavailableLevels() {
        return unavailable.isEmpty() ? EnumSet.noneOf(CacheLevel.class) : EnumSet.copyOf(unavailable);
    }
}
