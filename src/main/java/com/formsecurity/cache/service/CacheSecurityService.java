package com.formsecurity.cache.service;

import com.formsecurity.cache.config.FormSecurityCacheProperties;
import com.formsecurity.cache.constant.CacheConstants;
import com.formsecurity.cache.support.CacheValueSerializer;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 缓存安全策略（附加层，默认关闭）
 * 开启后：按操作限流、拒绝超大值、写审计日志到独立 Logger
 */
public class CacheSecurityService {

    private static final Logger log = LoggerFactory.getLogger(CacheSecurityService.class);
    private static final Logger audit = LoggerFactory.getLogger(CacheConstants.AUDIT_LOGGER);

    private final FormSecurityCacheProperties.Security config;
    private final CacheValueSerializer serializer;
    private final AtomicBoolean enabled;
    private final RateLimiterRegistry rateLimiterRegistry;
    private final Map<String, RateLimiter> rateLimiters = new ConcurrentHashMap<>();
    private final AtomicLong deniedCount = new AtomicLong();
    private final AtomicLong oversizedCount = new AtomicLong();

    public CacheSecurityService(FormSecurityCacheProperties.Security config, CacheValueSerializer serializer) {
        this.config = config;
        this.serializer = serializer;
        this.enabled = new AtomicBoolean(config.isEnabled());
        this.rateLimiterRegistry = RateLimiterRegistry.ofDefaults();
        config.getRateLimits().forEach((operation, limit) -> rateLimiters.put(operation,
            rateLimiterRegistry.rateLimiter("form-security-cache-" + operation, RateLimiterConfig.custom()
                .limitForPeriod(limit)
                .limitRefreshPeriod(Duration.ofSeconds(config.getRateLimitWindowSeconds()))
                .timeoutDuration(Duration.ZERO)
                .build())));
    }

    public boolean isEnabled() {
        return enabled.get();
    }

    public void enable() {
        if (enabled.compareAndSet(false, true)) {
            log.info("Cache security policy enabled");
            audit("security", "-", "enabled");
        }
    }

    public void disable() {
        if (enabled.compareAndSet(true, false)) {
            log.info("Cache security policy disabled");
            audit("security", "-", "disabled");
        }
    }

    /**
     * 限流检查，未配置限额的操作始终放行
     */
    public boolean checkRateLimit(String operation, String key) {
        if (!isEnabled()) {
            return true;
        }
        RateLimiter limiter = rateLimiters.get(operation);
        if (limiter == null || limiter.acquirePermission()) {
            return true;
        }
        deniedCount.incrementAndGet();
        audit(operation, key, "rate_limited");
        return false;
    }

    /**
     * 值大小检查
     */
    public boolean checkValue(String key, Object value) {
        if (!isEnabled()) {
            return true;
        }
        long size = serializer.estimateSize(value);
        if (size <= config.getMaxValueSizeBytes()) {
            return true;
        }
        oversizedCount.incrementAndGet();
        audit("put", key, "rejected_oversized size=" + size);
        return false;
    }

    /**
     * 写审计日志
     */
    public void audit(String operation, String key, String outcome) {
        if ((isEnabled() && config.isAuditLogging()) || "security".equals(operation)) {
            audit.info("operation={} key={} outcome={}", operation, key, outcome);
        }
    }

    public Map<String, Object> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("enabled", isEnabled());
        status.put("auditLogging", config.isAuditLogging());
        status.put("maxValueSizeBytes", config.getMaxValueSizeBytes());
        status.put("rateLimits", config.getRateLimits());
        status.put("rateLimitWindowSeconds", config.getRateLimitWindowSeconds());
        status.put("deniedRequests", deniedCount.get());
        status.put("oversizedValues", oversizedCount.get());
        return status;
    }
}
