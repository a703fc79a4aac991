package com.formsecurity.cache.repository;

import com.formsecurity.cache.model.CacheEntry;
import com.formsecurity.cache.model.CacheLevel;
import com.formsecurity.cache.model.CacheSize;

import java.util.Set;

/**
 * 单层缓存仓库的统一契约
 * 仓库只管理自己的条目，不感知标签和命名空间；Key 为规范化存储地址
 * 需要跨进程保留标签的持久层实现 {@link TagAwareCacheRepository}
 */
public interface CacheRepository {

    CacheLevel level();

    /**
     * 读取存活条目，未命中或已过期返回 null（过期条目在此处惰性清除）
     */
    CacheEntry get(String key);

    /**
     * 写入条目
     *
     * @param ttlSeconds 存活秒数，null 表示永不过期
     * @return 是否接受了写入
     */
    boolean put(String key, Object value, Long ttlSeconds);

    /**
     * 删除条目，Key 不存在同样视为成功
     */
    boolean forget(String key);

    boolean flush();

    boolean has(String key);

    CacheSize size();

    /**
     * 当前存活的 Key 集合
     */
    Set<String> keys();

    /**
     * 清除已过期条目
     *
     * @return 清除数量
     */
    int purgeExpired();

    /**
     * 连通性检查，后端不可用时抛出异常
     */
    void ping();
}
