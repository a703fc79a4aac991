package com.formsecurity.cache.health;

import com.formsecurity.cache.model.CacheLevel;
import com.formsecurity.cache.repository.CacheRepositoryRegistry;
import com.formsecurity.cache.service.CacheOperationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 三级缓存健康检查
 * REQUEST 不可用视为 DOWN；启用的 MEMORY / DATABASE 不可用时缓存仍可降级工作，报告 DEGRADED
 */
@Slf4j
@Component("formSecurityCacheHealthIndicator")
@RequiredArgsConstructor
public class CacheHealthIndicator implements HealthIndicator {

    static final Status DEGRADED = new Status("DEGRADED");

    private final CacheOperationService cacheOperationService;

    @Override
    public Health health() {
        CacheRepositoryRegistry registry = cacheOperationService.getRegistry();
        Map<String, Object> details = new LinkedHashMap<>();
        boolean requestUp = true;
        boolean degraded = false;

        for (CacheLevel level : CacheLevel.orderedLevels()) {
            boolean enabled = cacheOperationService.isLevelEnabled(level);
            boolean available = registry.recheck(level);
            Map<String, Object> levelDetail = new LinkedHashMap<>();
            levelDetail.put("enabled", enabled);
            levelDetail.put("status", available ? "UP" : "DOWN");
            if (available) {
                try {
                    levelDetail.put("keys", registry.find(level).size().count());
                } catch (Exception e) {
                    log.error("Cache level {} health check failed", level, e);
                    levelDetail.put("status", "DOWN");
                    levelDetail.put("error", e.getMessage());
                    available = false;
                }
            }
            details.put(level.key(), levelDetail);
            if (!available && enabled) {
                if (level == CacheLevel.REQUEST) {
                    requestUp = false;
                } else {
                    degraded = true;
                }
            }
        }

        if (!requestUp) {
            return Health.down().withDetails(details).build();
        }
        if (degraded) {
            return Health.status(DEGRADED).withDetails(details).build();
        }
        return Health.up().withDetails(details).build();
    }
}
