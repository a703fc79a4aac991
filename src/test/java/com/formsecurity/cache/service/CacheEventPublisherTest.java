package com.formsecurity.cache.service;

import com.formsecurity.cache.model.BulkInvalidationEvent;
import com.formsecurity.cache.model.CacheKey;
import com.formsecurity.cache.model.InvalidationEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * CacheEventPublisher 单元测试
 */
@ExtendWith(MockitoExtension.class)
class CacheEventPublisherTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    @Mock
    private CacheEventListener listener;

    @Test
    @DisplayName("事件分发给监听器并转发到 Spring 事件总线")
    void testPublishForwards() {
        CacheEventPublisher publisher = new CacheEventPublisher(applicationEventPublisher);
        publisher.addListener(listener);
        InvalidationEvent event = InvalidationEvent.of(CacheKey.of("1.2.3.4", "ip_reputation"), null, "manual", Map.of(), NOW);

        publisher.publish(event);

        verify(listener).onInvalidation(event);
        verify(applicationEventPublisher).publishEvent((Object) event);
        assertEquals(1, publisher.getPublishedCount());
    }

    @Test
    @DisplayName("监听器异常被隔离并计数")
    void testListenerFailureIsolated() {
        CacheEventPublisher publisher = new CacheEventPublisher(applicationEventPublisher);
        CacheEventListener second = mock(CacheEventListener.class);
        publisher.addListener(listener);
        publisher.addListener(second);
        BulkInvalidationEvent event = new BulkInvalidationEvent("namespace", "ip_reputation", null, 3, NOW);
        doThrow(new IllegalStateException("boom")).when(listener).onBulkInvalidation(event);

        assertDoesNotThrow(() -> publisher.publish(event));

        verify(second).onBulkInvalidation(event);
        assertEquals(1, publisher.getListenerFailures());
    }

    @Test
    @DisplayName("移除后的监听器不再收到事件")
    void testRemoveListener() {
        CacheEventPublisher publisher = new CacheEventPublisher();
        publisher.addListener(listener);
        publisher.removeListener(listener);

        publisher.publish(InvalidationEvent.of(CacheKey.of("k"), null, "manual", Map.of(), NOW));

        verify(listener, never()).onInvalidation(any());
    }
}
