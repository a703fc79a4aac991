package com.formsecurity.cache.controller;

import com.formsecurity.cache.dto.CacheStoreStatistics;
import com.formsecurity.cache.dto.MaintenanceOperationResult;
import com.formsecurity.cache.dto.MaintenanceReport;
import com.formsecurity.cache.model.CacheKey;
import com.formsecurity.cache.model.CacheLevel;
import com.formsecurity.cache.model.InvalidationOutcome;
import com.formsecurity.cache.service.CacheInvalidationService;
import com.formsecurity.cache.service.CacheMaintenanceService;
import com.formsecurity.cache.service.CacheOperationService;
import com.formsecurity.cache.service.CacheSecurityService;
import com.formsecurity.cache.service.CacheStatisticsService;
import com.formsecurity.cache.service.CacheValidationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * 缓存管理接口测试
 */
@WebMvcTest(CacheAdminController.class)
class CacheAdminControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CacheOperationService cacheOperationService;

    @MockBean
    private CacheStatisticsService cacheStatisticsService;

    @MockBean
    private CacheMaintenanceService cacheMaintenanceService;

    @MockBean
    private CacheValidationService cacheValidationService;

    @MockBean
    private CacheInvalidationService cacheInvalidationService;

    @MockBean
    private CacheSecurityService cacheSecurityService;

    @Test
    @DisplayName("统计摘要")
    void testSummary() throws Exception {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("hitRatio", 0.75);
        summary.put("efficiencyScore", 82.5);
        when(cacheStatisticsService.getSummary()).thenReturn(summary);

        mockMvc.perform(get("/api/cache/admin/stats/summary"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.code").value(0))
            .andExpect(jsonPath("$.data.hitRatio").value(0.75))
            .andExpect(jsonPath("$.data.efficiencyScore").value(82.5));
    }

    @Test
    @DisplayName("重置统计")
    void testResetStats() throws Exception {
        mockMvc.perform(post("/api/cache/admin/stats/reset"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.code").value(0));

        verify(cacheStatisticsService).resetStats();
    }

    @Test
    @DisplayName("执行维护操作")
    void testMaintenance() throws Exception {
        MaintenanceReport report = new MaintenanceReport(
            new MaintenanceReport.Summary(1, 1, 0, 100.0, 0.01),
            new CacheStoreStatistics(5, 500, 0.0, null, null),
            new CacheStoreStatistics(2, 200, 0.0, null, null),
            List.of(new MaintenanceOperationResult("cleanup", true, 3, 0.01, List.of(), Map.of())),
            List.of());
        when(cacheMaintenanceService.maintainDatabaseCache(List.of("cleanup"))).thenReturn(report);

        mockMvc.perform(post("/api/cache/admin/maintenance")
                .contentType(MediaType.APPLICATION_JSON)
                .content("[\"cleanup\"]"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.summary.successfulOperations").value(1))
            .andExpect(jsonPath("$.data.operations[0].itemsProcessed").value(3));
    }

    @Test
    @DisplayName("切换层级开关")
    void testToggleLevel() throws Exception {
        when(cacheOperationService.toggleLevel(CacheLevel.MEMORY, false)).thenReturn(true);
        when(cacheOperationService.isLevelEnabled(CacheLevel.MEMORY)).thenReturn(false);

        mockMvc.perform(put("/api/cache/admin/levels/memory").param("enabled", "false"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.level").value("MEMORY"))
            .andExpect(jsonPath("$.data.enabled").value(false))
            .andExpect(jsonPath("$.data.available").value(true));
    }

    @Test
    @DisplayName("未知层级返回 400")
    void testToggleUnknownLevel() throws Exception {
        mockMvc.perform(put("/api/cache/admin/levels/disk").param("enabled", "true"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(400));
    }

    @Test
    @DisplayName("按层删除单个 Key")
    void testInvalidateKey() throws Exception {
        when(cacheInvalidationService.invalidate(eq(CacheKey.of("abc", "ip_reputation")), eq(List.of(CacheLevel.MEMORY))))
            .thenReturn(true);

        mockMvc.perform(delete("/api/cache/admin/keys/abc")
                .param("namespace", "ip_reputation")
                .param("levels", "memory"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data").value(true));
    }

    @Test
    @DisplayName("按模式失效返回删除数量")
    void testInvalidatePattern() throws Exception {
        InvalidationOutcome outcome = new InvalidationOutcome(
            Set.of(CacheKey.of("a", "spam_patterns"), CacheKey.of("b", "spam_patterns")), Set.of());
        when(cacheInvalidationService.invalidateByPattern(eq("spam_patterns:*"), isNull())).thenReturn(outcome);

        mockMvc.perform(post("/api/cache/admin/invalidate/pattern").param("pattern", "spam_patterns:*"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data").value(2));
    }

    @Test
    @DisplayName("按标签失效")
    void testInvalidateTags() throws Exception {
        when(cacheInvalidationService.invalidateByTags(eq(List.of("geo")), isNull()))
            .thenReturn(new InvalidationOutcome(Set.of(CacheKey.of("x", "geolocation")), Set.of()));

        mockMvc.perform(post("/api/cache/admin/invalidate/tags")
                .contentType(MediaType.APPLICATION_JSON)
                .content("[\"geo\"]"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data").value(1));
    }

    @Test
    @DisplayName("开启安全策略")
    void testEnableSecurity() throws Exception {
        when(cacheSecurityService.getStatus()).thenReturn(Map.of("enabled", true));

        mockMvc.perform(put("/api/cache/admin/security").param("enabled", "true"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.enabled").value(true));

        verify(cacheSecurityService).enable();
        verify(cacheSecurityService, never()).disable();
    }

    @Test
    @DisplayName("请求结束时清空 REQUEST 层")
    void testRequestBoundary() throws Exception {
        when(cacheInvalidationService.getStats()).thenReturn(Map.of("invalidations", 0L));

        mockMvc.perform(get("/api/cache/admin/invalidation/stats"))
            .andExpect(status().isOk());

        verify(cacheOperationService).endRequest();
    }
}
