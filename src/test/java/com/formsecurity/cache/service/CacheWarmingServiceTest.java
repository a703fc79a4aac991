package com.formsecurity.cache.service;

import com.formsecurity.cache.dto.WarmingReport;
import com.formsecurity.cache.model.CacheKey;
import com.formsecurity.cache.model.CacheLevel;
import com.formsecurity.cache.service.CacheWarmingService.WarmupTask;
import com.formsecurity.cache.support.CacheTestFixtures;
import com.formsecurity.cache.support.CacheTestFixtures.Fixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CacheWarmingService 单元测试
 */
class CacheWarmingServiceTest {

    private Fixture fixture;
    private CacheOperationService cache;
    private CacheWarmingService warmingService;

    @BeforeEach
    void setUp() {
        fixture = CacheTestFixtures.builder()
            .properties(p -> {
                p.getWarming().setBatchSize(2);
                p.getWarming().setTimeoutSeconds(1);
            })
            .build();
        cache = fixture.cache();
        warmingService = new CacheWarmingService(cache);
    }

    @AfterEach
    void tearDown() {
        cache.endRequest();
    }

    @Test
    @DisplayName("预热成功写入所有层，TTL 取命名空间类别配置")
    void testWarmWithCategoryTtl() {
        CacheKey key = CacheKey.of("203.0.113.7", "ip_reputation");

        WarmingReport report = warmingService.warm(List.of(
            WarmupTask.of(key, () -> Map.of("score", 12))));

        assertEquals(1, report.summary().total());
        assertEquals(1, report.summary().successful());
        assertEquals(100.0, report.summary().successRate());
        assertEquals("success", report.details().get(0).status());
        assertEquals(3600L, report.details().get(0).ttlSeconds());
        assertEquals(Map.of("score", 12), cache.getFromDatabase(key));

        fixture.clock().advanceSeconds(3601);
        assertNull(cache.getFromDatabase(key));
    }

    @Test
    @DisplayName("显式 TTL 优先于类别 TTL")
    void testExplicitTtl() {
        CacheKey key = CacheKey.of("pattern-1", "spam_patterns");

        WarmingReport report = warmingService.warm(List.of(new WarmupTask(key, () -> "v", 10L)));

        assertEquals(10L, report.details().get(0).ttlSeconds());
        fixture.clock().advanceSeconds(11);
        assertFalse(cache.has(key));
    }

    @Test
    @DisplayName("已存在的 Key 被跳过，force 时重新加载")
    void testSkipAndForce() {
        CacheKey key = CacheKey.of("cfg", "configuration");
        cache.put(key, "old", 60L);
        AtomicInteger loads = new AtomicInteger();

        WarmingReport skipped = warmingService.warm(List.of(WarmupTask.of(key, () -> {
            loads.incrementAndGet();
            return "new";
        })));
        assertEquals(1, skipped.summary().skipped());
        assertEquals(0, loads.get());
        assertEquals("old", cache.get(key));

        WarmingReport forced = warmingService.warm(List.of(WarmupTask.of(key, () -> {
            loads.incrementAndGet();
            return "new";
        })), null, true);
        assertEquals(1, forced.summary().successful());
        assertEquals(1, loads.get());
        cache.endRequest();
        assertEquals("new", cache.get(key));
    }

    @Test
    @DisplayName("加载失败和返回 null 都记为失败，不影响同批其它任务")
    void testLoaderFailure() {
        WarmingReport report = warmingService.warm(List.of(
            WarmupTask.of(CacheKey.of("a", "statistics"), () -> {
                throw new IllegalStateException("source down");
            }),
            WarmupTask.of(CacheKey.of("b", "statistics"), () -> null),
            WarmupTask.of(CacheKey.of("c", "statistics"), () -> 3)));

        assertEquals(3, report.summary().total());
        assertEquals(1, report.summary().successful());
        assertEquals(2, report.summary().failed());
        assertEquals(33.33, report.summary().successRate());
        assertEquals(2, report.errors().size());
        assertTrue(report.errors().get(0).contains("source down"));
        assertEquals(3, cache.get(CacheKey.of("c", "statistics")));
    }

    @Test
    @DisplayName("单个任务超时")
    void testTimeout() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        try {
            WarmingReport report = warmingService.warm(List.of(WarmupTask.of(CacheKey.of("slow", "geolocation"), () -> {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return "late";
            })));

            assertEquals(1, report.summary().failed());
            assertEquals("timeout", report.details().get(0).status());
            assertFalse(cache.has(CacheKey.of("slow", "geolocation")));
        } finally {
            release.countDown();
        }
    }

    @Test
    @DisplayName("只写入指定层级")
    void testWarmSelectedLevels() {
        CacheKey key = CacheKey.of("k", "rate_limits");

        warmingService.warm(List.of(WarmupTask.of(key, () -> "v")), List.of(CacheLevel.MEMORY), false);

        assertEquals("v", cache.getFromMemory(key));
        assertNull(cache.getFromDatabase(key));
        assertNull(cache.getFromRequest(key));
    }

    @Test
    @DisplayName("空任务列表")
    void testEmpty() {
        WarmingReport report = warmingService.warm(List.of());

        assertEquals(0, report.summary().total());
        assertEquals(100.0, report.summary().successRate());
    }
}
