package com.formsecurity.cache.controller;

import com.formsecurity.cache.dto.ApiResponse;
import com.formsecurity.cache.dto.CapacityManagementReport;
import com.formsecurity.cache.dto.CapacityReport;
import com.formsecurity.cache.dto.LoadTestReport;
import com.formsecurity.cache.dto.MaintenanceReport;
import com.formsecurity.cache.dto.PerformanceValidationReport;
import com.formsecurity.cache.model.CacheKey;
import com.formsecurity.cache.model.CacheLevel;
import com.formsecurity.cache.model.InvalidationOutcome;
import com.formsecurity.cache.model.StatisticsSnapshot;
import com.formsecurity.cache.service.CacheInvalidationService;
import com.formsecurity.cache.service.CacheMaintenanceService;
import com.formsecurity.cache.service.CacheOperationService;
import com.formsecurity.cache.service.CacheSecurityService;
import com.formsecurity.cache.service.CacheStatisticsService;
import com.formsecurity.cache.service.CacheValidationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 缓存管理接口
 * 统计、维护、自检、层级开关与失效
 */
@Slf4j
@RestController
@RequestMapping("/api/cache/admin")
@RequiredArgsConstructor
public class CacheAdminController {

    private final CacheOperationService cacheOperationService;
    private final CacheStatisticsService cacheStatisticsService;
    private final CacheMaintenanceService cacheMaintenanceService;
    private final CacheValidationService cacheValidationService;
    private final CacheInvalidationService cacheInvalidationService;
    private final CacheSecurityService cacheSecurityService;

    // ==================== 统计 ====================

    /**
     * 统计快照
     */
    @GetMapping("/stats")
    public ApiResponse<StatisticsSnapshot> stats(@RequestParam(required = false) List<String> levels) {
        return ApiResponse.success(cacheStatisticsService.getStats(parseLevels(levels)));
    }

    @GetMapping("/stats/summary")
    public ApiResponse<Map<String, Object>> summary() {
        return ApiResponse.success(cacheStatisticsService.getSummary());
    }

    @PostMapping("/stats/reset")
    public ApiResponse<Void> resetStats() {
        cacheStatisticsService.resetStats();
        log.info("Cache statistics reset via admin API");
        return ApiResponse.success();
    }

    // ==================== 维护 / 自检 ====================

    /**
     * 执行维护操作，body 为空时默认 cleanup + optimize
     */
    @PostMapping("/maintenance")
    public ApiResponse<MaintenanceReport> maintenance(@RequestBody(required = false) List<String> operations) {
        return ApiResponse.success(cacheMaintenanceService.maintainDatabaseCache(operations));
    }

    @GetMapping("/validation/performance")
    public ApiResponse<PerformanceValidationReport> validatePerformance() {
        return ApiResponse.success(cacheValidationService.validatePerformance());
    }

    @GetMapping("/validation/capacity")
    public ApiResponse<CapacityReport> validateCapacity() {
        return ApiResponse.success(cacheValidationService.validateCacheCapacity());
    }

    @PostMapping("/validation/concurrent")
    public ApiResponse<LoadTestReport> validateConcurrent(@RequestParam(defaultValue = "1000") int operations,
                                                          @RequestParam(defaultValue = "10") int duration) {
        return ApiResponse.success(cacheValidationService.validateConcurrentOperations(operations, duration));
    }

    @PostMapping("/capacity/manage")
    public ApiResponse<CapacityManagementReport> manageCapacity(@RequestBody(required = false) Map<String, Object> options) {
        return ApiResponse.success(cacheValidationService.manageCapacity(options));
    }

    // ==================== 层级 ====================

    @GetMapping("/levels")
    public ApiResponse<Map<CacheLevel, Map<String, Object>>> levels() {
        return ApiResponse.success(cacheOperationService.getLevelStatusSummary());
    }

    @PutMapping("/levels/{level}")
    public ApiResponse<Map<String, Object>> toggleLevel(@PathVariable String level, @RequestParam boolean enabled) {
        CacheLevel cacheLevel = CacheLevel.fromName(level);
        boolean applied = cacheOperationService.toggleLevel(cacheLevel, enabled);
        log.info("Cache level {} toggled via admin API: enabled={}", cacheLevel, enabled);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("level", cacheLevel);
        result.put("enabled", cacheOperationService.isLevelEnabled(cacheLevel));
        result.put("available", applied);
        return ApiResponse.success(result);
    }

    // ==================== 失效 ====================

    /**
     * 失效单个 Key，namespace 为空时取默认命名空间
     */
    @DeleteMapping("/keys/{key}")
    public ApiResponse<Boolean> invalidateKey(@PathVariable String key,
                                              @RequestParam(required = false) String namespace,
                                              @RequestParam(required = false) List<String> levels) {
        return ApiResponse.success(cacheInvalidationService.invalidate(CacheKey.of(key, namespace), parseLevels(levels)));
    }

    @PostMapping("/invalidate/pattern")
    public ApiResponse<Integer> invalidatePattern(@RequestParam String pattern,
                                                  @RequestParam(required = false) List<String> levels) {
        InvalidationOutcome outcome = cacheInvalidationService.invalidateByPattern(pattern, parseLevels(levels));
        return ApiResponse.success(outcome.count());
    }

    @PostMapping("/invalidate/tags")
    public ApiResponse<Integer> invalidateTags(@RequestBody List<String> tags,
                                               @RequestParam(required = false) List<String> levels) {
        InvalidationOutcome outcome = cacheInvalidationService.invalidateByTags(tags, parseLevels(levels));
        return ApiResponse.success(outcome.count());
    }

    @PostMapping("/invalidate/namespace/{namespace}")
    public ApiResponse<Integer> invalidateNamespace(@PathVariable String namespace,
                                                    @RequestParam(required = false) List<String> levels) {
        InvalidationOutcome outcome = cacheInvalidationService.invalidateByNamespace(namespace, parseLevels(levels));
        return ApiResponse.success(outcome.count());
    }

    @GetMapping("/invalidation/stats")
    public ApiResponse<Map<String, Long>> invalidationStats() {
        return ApiResponse.success(cacheInvalidationService.getStats());
    }

    // ==================== 安全策略 ====================

    @GetMapping("/security")
    public ApiResponse<Map<String, Object>> securityStatus() {
        return ApiResponse.success(cacheSecurityService.getStatus());
    }

    @PutMapping("/security")
    public ApiResponse<Map<String, Object>> toggleSecurity(@RequestParam boolean enabled) {
        if (enabled) {
            cacheSecurityService.enable();
        } else {
            cacheSecurityService.disable();
        }
        return ApiResponse.success(cacheSecurityService.getStatus());
    }

    private static List<CacheLevel> parseLevels(List<String> names) {
        if (names == null || names.isEmpty()) {
            return null;
        }
        List<CacheLevel> levels = new ArrayList<>();
        for (String name : names) {
            levels.add(CacheLevel.fromName(name));
        }
        return levels;
    }
}
