package com.formsecurity.cache.repository;

import com.formsecurity.cache.model.CacheKey;

import java.util.Set;

/**
 * 随条目一起持久化 Key 元数据（命名空间、标签）的仓库
 * 进程重启后协调器据此重建标签与命名空间索引
 */
public interface TagAwareCacheRepository extends CacheRepository {

    /**
     * 写入条目并保存 Key 的命名空间和标签
     */
    boolean put(CacheKey key, Object value, Long ttlSeconds);

    /**
     * 当前存活条目的完整 Key（含标签）
     *
     * @param knownPrefix 当前配置的全局前缀，用于还原没有元数据的条目，可为 null
     */
    Set<CacheKey> indexedKeys(String knownPrefix);
}
