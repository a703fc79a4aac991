package com.formsecurity.cache.service;

import com.formsecurity.cache.model.BulkInvalidationEvent;
import com.formsecurity.cache.model.InvalidationEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 失效事件发布器
 * 事件先分发给注册的监听器，再转发到 Spring 事件总线（如果存在）；
 * 监听器异常只记录日志，不影响失效流程
 */
public class CacheEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(CacheEventPublisher.class);

    private final List<CacheEventListener> listeners = new CopyOnWriteArrayList<>();
    private final ApplicationEventPublisher applicationEventPublisher;
    private final AtomicLong publishedCount = new AtomicLong();
    private final AtomicLong listenerFailures = new AtomicLong();

    public CacheEventPublisher() {
        this(null);
    }

    public CacheEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public void addListener(CacheEventListener listener) {
        listeners.add(listener);
    }

    public void removeListener(CacheEventListener listener) {
        listeners.remove(listener);
    }

    public void publish(InvalidationEvent event) {
        publishedCount.incrementAndGet();
        for (CacheEventListener listener : listeners) {
            try {
                listener.onInvalidation(event);
            } catch (RuntimeException e) {
                listenerFailures.incrementAndGet();
                log.error("Invalidation listener {} failed for key {}", listener.getClass().getSimpleName(), event.cacheKey(), e);
            }
        }
        forward(event);
    }

    public void publish(BulkInvalidationEvent event) {
        publishedCount.incrementAndGet();
        for (CacheEventListener listener : listeners) {
            try {
                listener.onBulkInvalidation(event);
            } catch (RuntimeException e) {
                listenerFailures.incrementAndGet();
                log.error("Bulk invalidation listener {} failed for {} '{}'",
                    listener.getClass().getSimpleName(), event.type(), event.criteria(), e);
            }
        }
        forward(event);
    }

    public long getPublishedCount() {
        return publishedCount.get();
    }

    public long getListenerFailures() {
        return listenerFailures.get();
    }

    private void forward(Object event) {
        if (applicationEventPublisher == null) {
            return;
        }
        try {
            applicationEventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            listenerFailures.incrementAndGet();
            log.error("Application event listener failed for {}", event.getClass().getSimpleName(), e);
        }
    }
}
