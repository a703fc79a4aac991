package com.formsecurity.cache.service;

import com.formsecurity.cache.dto.CapacityManagementReport;
import com.formsecurity.cache.dto.CapacityReport;
import com.formsecurity.cache.dto.LoadTestReport;
import com.formsecurity.cache.dto.PerformanceValidationReport;
import com.formsecurity.cache.model.CacheKey;
import com.formsecurity.cache.model.CacheLevel;
import com.formsecurity.cache.support.CacheTestFixtures;
import com.formsecurity.cache.support.CacheTestFixtures.Fixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 缓存自检测试
 */
class CacheValidationServiceTest {

    private Fixture fixture;
    private CacheOperationService cache;
    private CacheValidationService validationService;

    @BeforeEach
    void setUp() {
        fixture = CacheTestFixtures.builder()
            .properties(p -> {
                p.getValidation().setMaxLoadTestSeconds(2);
                p.getValidation().setLoadTestThreads(4);
                p.getValidation().setPerformanceSamples(5);
            })
            .build();
        cache = fixture.cache();
        validationService = new CacheValidationService(cache, new CacheStatisticsService(cache),
            new CacheMaintenanceService(cache));
    }

    @AfterEach
    void tearDown() {
        cache.endRequest();
    }

    @Test
    @DisplayName("性能自检覆盖 MEMORY、DATABASE、吞吐和命中率，并清理样本数据")
    void testValidatePerformance() {
        PerformanceValidationReport report = validationService.validatePerformance();

        assertNotEquals(CacheValidationService.STATUS_ERROR, report.overallStatus());
        assertTrue(report.requirements().containsKey("memory_response_time"));
        assertTrue(report.requirements().containsKey("database_response_time"));
        assertTrue(report.requirements().containsKey("throughput"));
        assertTrue(report.requirements().containsKey("hit_ratio"));
        assertEquals(0, fixture.database().size().count());
        assertNull(cache.getFromMemory(CacheKey.of("sample_0", "validation_sample")));
    }

    @Test
    @DisplayName("目标无法达到时结果为 fail 并给出建议")
    void testValidatePerformanceFails() {
        fixture.properties().getPerformance().setMinThroughputPerMinute(Long.MAX_VALUE);

        PerformanceValidationReport report = validationService.validatePerformance();

        assertEquals(CacheValidationService.STATUS_FAIL, report.overallStatus());
        assertFalse(report.requirements().get("throughput").passed());
        assertFalse(report.recommendations().isEmpty());
    }

    @Test
    @DisplayName("容量在阈值内为 ok")
    void testCapacityOk() {
        cache.put("k", "v", 60L);

        CapacityReport report = validationService.validateCacheCapacity();

        assertEquals(CacheValidationService.CAPACITY_OK, report.status());
        assertEquals(3, report.levels().size());
        assertTrue(report.totalUsedBytes() > 0);
        assertFalse(report.exceeded());
    }

    @Test
    @DisplayName("超过严重阈值时为 critical")
    void testCapacityCritical() {
        fixture.properties().getCapacity().setTotalLimitMb(1);
        cache.put("big", "x".repeat(1024 * 1024), 60L, List.of(CacheLevel.DATABASE));

        CapacityReport report = validationService.validateCacheCapacity();

        assertEquals(CacheValidationService.CAPACITY_CRITICAL, report.status());
    }

    @Test
    @DisplayName("容量正常时不执行任何治理动作")
    void testManageCapacityNoop() {
        CapacityManagementReport report = validationService.manageCapacity(Map.of());

        assertTrue(report.actionsTaken().isEmpty());
        assertTrue(report.success());
    }

    @Test
    @DisplayName("force 时清理过期条目")
    void testManageCapacityForce() {
        cache.put("old", "v", 1L);
        fixture.clock().advanceSeconds(2);

        CapacityManagementReport report = validationService.manageCapacity(Map.of("force", true));

        assertEquals(1, report.actionsTaken().size());
        assertEquals("cleanup_expired", report.actionsTaken().get(0).action());
        assertEquals("preventive", report.actionsTaken().get(0).reason());
        assertEquals(0, fixture.database().size().count());
    }

    @Test
    @DisplayName("aggressive 时执行紧急整理并清空 REQUEST 层")
    void testManageCapacityAggressive() {
        cache.putInRequest("k", "v");

        CapacityManagementReport report = validationService.manageCapacity(Map.of("aggressive", "true"));

        List<String> actions = report.actionsTaken().stream().map(CapacityManagementReport.Action::action).toList();
        assertEquals(List.of("cleanup_expired", "optimize_storage", "vacuum_storage", "flush_request_level"), actions);
        assertNull(cache.getFromRequest("k"));
    }

    @Test
    @DisplayName("并发压测：持续时间被截断，压测数据被清理")
    void testConcurrentOperations() {
        LoadTestReport report = validationService.validateConcurrentOperations(200, 60);

        assertEquals(2, report.effectiveDurationSeconds());
        assertEquals(60, report.requestedDurationSeconds());
        assertTrue(report.completedOperations() > 0);
        assertTrue(report.completedOperations() <= 200);
        assertEquals(report.completedOperations(), report.successfulOperations() + report.failedOperations());
        assertTrue(report.latency().max() >= report.latency().min());
        assertTrue(cache.getKeyTracker().findByNamespace("load_test", CacheLevel.orderedLevels()).isEmpty());
        assertFalse(report.recommendations().isEmpty());
        assertTrue(report.success());
    }

    @Test
    @DisplayName("非正数操作数返回带错误信息的报告，不执行压测")
    void testConcurrentOperationsInvalid() {
        LoadTestReport report = validationService.validateConcurrentOperations(0, 1);

        assertFalse(report.success());
        assertEquals(0, report.requestedOperations());
        assertEquals(0, report.completedOperations());
        assertEquals(LoadTestReport.Latency.EMPTY, report.latency());
        assertEquals(1, report.errors().size());
        assertEquals("validation", report.recommendations().get(0).type());
        assertEquals("high", report.recommendations().get(0).priority());

        assertFalse(validationService.validateConcurrentOperations(-5, 1).success());
        assertEquals(0, cache.getMetrics().puts(CacheLevel.MEMORY));
    }
}
