package com.formsecurity.cache.exception;

import com.formsecurity.cache.model.CacheLevel;

/**
 * 缓存层级后端不可用（驱动缺失或连接失败）
 * 协调器将其降级为未命中 / 空操作，不会抛给调用方
 */
public class CacheLevelUnavailableException extends CacheException {

    private final CacheLevel level;

    public CacheLevelUnavailableException(CacheLevel level, Throwable cause) {
        super("Cache level " + level + " is unavailable", cause);
        this.level = level;
    }

    public CacheLevel getLevel() {
        return level;
    }
}
