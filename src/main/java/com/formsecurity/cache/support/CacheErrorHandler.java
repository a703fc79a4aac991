package com.formsecurity.cache.support;

import com.formsecurity.cache.model.CacheLevel;

/**
 * 单层操作异常处理器，按异常类型注册
 */
@FunctionalInterface
public interface CacheErrorHandler {

    void handle(CacheLevel level, String operation, String key, Exception error);
}
