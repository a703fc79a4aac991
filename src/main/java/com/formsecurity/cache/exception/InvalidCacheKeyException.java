package com.formsecurity.cache.exception;

/**
 * 非法缓存 Key（空串、含空白或控制字符）
 */
public class InvalidCacheKeyException extends CacheException {

    public InvalidCacheKeyException(String message) {
        super(message);
    }
}
