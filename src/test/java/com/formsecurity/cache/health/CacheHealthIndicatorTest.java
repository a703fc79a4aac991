package com.formsecurity.cache.health;

import com.formsecurity.cache.model.CacheLevel;
import com.formsecurity.cache.support.CacheTestFixtures;
import com.formsecurity.cache.support.CacheTestFixtures.Fixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CacheHealthIndicator 单元测试
 */
class CacheHealthIndicatorTest {

    @Test
    @DisplayName("三层均可用时为 UP")
    @SuppressWarnings("unchecked")
    void testAllLevelsUp() {
        Fixture fixture = CacheTestFixtures.coordinator();
        fixture.cache().put("k", "v", 60L);

        Health health = new CacheHealthIndicator(fixture.cache()).health();

        assertEquals(Status.UP, health.getStatus());
        Map<String, Object> database = (Map<String, Object>) health.getDetails().get("database");
        assertEquals("UP", database.get("status"));
        assertEquals(1L, database.get("keys"));
        fixture.cache().endRequest();
    }

    @Test
    @DisplayName("启用的 DATABASE 不可用时为 DEGRADED")
    @SuppressWarnings("unchecked")
    void testDegraded() {
        Fixture fixture = CacheTestFixtures.builder().withoutDatabase().build();

        Health health = new CacheHealthIndicator(fixture.cache()).health();

        assertEquals(CacheHealthIndicator.DEGRADED, health.getStatus());
        assertEquals("DOWN", ((Map<String, Object>) health.getDetails().get("database")).get("status"));
    }

    @Test
    @DisplayName("不可用的层被禁用后不影响整体状态")
    void testDisabledUnavailableLevelIgnored() {
        Fixture fixture = CacheTestFixtures.builder().withoutDatabase().build();
        fixture.cache().toggleLevel(CacheLevel.DATABASE, false);

        Health health = new CacheHealthIndicator(fixture.cache()).health();

        assertEquals(Status.UP, health.getStatus());
    }
}
