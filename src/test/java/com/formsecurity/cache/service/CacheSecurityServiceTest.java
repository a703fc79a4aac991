package com.formsecurity.cache.service;

import com.formsecurity.cache.config.FormSecurityCacheProperties;
import com.formsecurity.cache.support.CacheTestFixtures;
import com.formsecurity.cache.support.CacheTestFixtures.Fixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CacheSecurityService 单元测试
 */
class CacheSecurityServiceTest {

    private static FormSecurityCacheProperties.Security config(boolean enabled) {
        FormSecurityCacheProperties.Security security = new FormSecurityCacheProperties.Security();
        security.setEnabled(enabled);
        security.setMaxValueSizeBytes(16);
        security.setRateLimits(Map.of("put", 2));
        return security;
    }

    @Test
    @DisplayName("关闭时所有检查放行")
    void testDisabledAllowsEverything() {
        CacheSecurityService service = new CacheSecurityService(config(false), CacheTestFixtures.serializer());

        for (int i = 0; i < 5; i++) {
            assertTrue(service.checkRateLimit("put", "k"));
        }
        assertTrue(service.checkValue("k", "x".repeat(100)));
    }

    @Test
    @DisplayName("超过窗口限额后拒绝，未配置的操作不限流")
    void testRateLimit() {
        CacheSecurityService service = new CacheSecurityService(config(true), CacheTestFixtures.serializer());

        assertTrue(service.checkRateLimit("put", "k"));
        assertTrue(service.checkRateLimit("put", "k"));
        assertFalse(service.checkRateLimit("put", "k"));
        assertTrue(service.checkRateLimit("get", "k"));
        assertEquals(1L, service.getStatus().get("deniedRequests"));
    }

    @Test
    @DisplayName("超大值被拒绝")
    void testOversizedValue() {
        CacheSecurityService service = new CacheSecurityService(config(true), CacheTestFixtures.serializer());

        assertTrue(service.checkValue("k", "small"));
        assertFalse(service.checkValue("k", "x".repeat(17)));
        assertEquals(1L, service.getStatus().get("oversizedValues"));
    }

    @Test
    @DisplayName("运行时开关")
    void testToggle() {
        CacheSecurityService service = new CacheSecurityService(config(false), CacheTestFixtures.serializer());

        service.enable();
        assertTrue(service.isEnabled());
        assertEquals(true, service.getStatus().get("enabled"));
        service.disable();
        assertFalse(service.isEnabled());
    }

    @Test
    @DisplayName("协调器写入超大值返回 false 且不落任何层")
    void testCoordinatorRejectsOversizedValue() {
        Fixture fixture = CacheTestFixtures.builder()
            .properties(p -> {
                p.getSecurity().setEnabled(true);
                p.getSecurity().setMaxValueSizeBytes(16);
            })
            .withSecurity()
            .build();
        CacheOperationService cache = fixture.cache();
        try {
            assertFalse(cache.put("big", "x".repeat(64), 60L));
            assertFalse(cache.has("big"));
            assertTrue(cache.put("small", "ok", 60L));
        } finally {
            cache.endRequest();
        }
    }

    @Test
    @DisplayName("协调器被限流的读返回默认值")
    void testCoordinatorRateLimitedRead() {
        Fixture fixture = CacheTestFixtures.builder()
            .properties(p -> {
                p.getSecurity().setEnabled(true);
                p.getSecurity().setRateLimits(Map.of("get", 1));
            })
            .withSecurity()
            .build();
        CacheOperationService cache = fixture.cache();
        try {
            cache.put("k", "v", 60L);
            assertEquals("v", cache.get("k"));
            assertEquals("fallback", cache.get("k", "fallback"));
        } finally {
            cache.endRequest();
        }
    }
}
