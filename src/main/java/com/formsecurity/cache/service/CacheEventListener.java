package com.formsecurity.cache.service;

import com.formsecurity.cache.model.BulkInvalidationEvent;
import com.formsecurity.cache.model.InvalidationEvent;

/**
 * 失效事件监听器，实现必须幂等
 */
public interface CacheEventListener {

    void onInvalidation(InvalidationEvent event);

    default void onBulkInvalidation(BulkInvalidationEvent event) {
    }
}
