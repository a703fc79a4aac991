package com.formsecurity.cache.support;

/**
 * 全部层级失败时的降级策略，按操作名注册
 * get 返回替代值，其余操作返回 Boolean
 */
@FunctionalInterface
public interface CacheFallbackStrategy {

    Object fallback(String operation, String key, Object defaultValue);
}
