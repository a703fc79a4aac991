package com.formsecurity.cache.service;

import com.formsecurity.cache.config.FormSecurityCacheProperties;
import com.formsecurity.cache.model.CacheLevel;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * 缓存后端熔断保护
 * MEMORY / DATABASE 各一个 Resilience4j 熔断器，熔断打开时调用直接失败，
 * 由协调器按单层失败处理；REQUEST 层为进程内存储，不经过熔断器
 */
public class CacheResilienceService {

    private static final Logger log = LoggerFactory.getLogger(CacheResilienceService.class);

    private final boolean enabled;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final Map<CacheLevel, CircuitBreaker> circuitBreakers = new EnumMap<>(CacheLevel.class);

    public CacheResilienceService(FormSecurityCacheProperties.Resilience config) {
        this.enabled = config.isEnabled();
        CircuitBreakerConfig breakerConfig = CircuitBreakerConfig.custom()
            .failureRateThreshold(config.getFailureRateThreshold())
            .minimumNumberOfCalls(config.getMinimumCalls())
            .slidingWindowSize(Math.max(config.getMinimumCalls(), 10))
            .waitDurationInOpenState(Duration.ofSeconds(config.getWaitDurationInOpenStateSeconds()))
            .permittedNumberOfCallsInHalfOpenState(5)
            .build();
        this.circuitBreakerRegistry = CircuitBreakerRegistry.of(breakerConfig);
        for (CacheLevel level : CacheLevel.orderedLevels()) {
            if (!level.driverRequired()) {
                continue;
            }
            CircuitBreaker breaker = circuitBreakerRegistry.circuitBreaker("form-security-cache-" + level.key());
            breaker.getEventPublisher().onStateTransition(event ->
                log.warn("Cache level {} circuit breaker: {}", level, event.getStateTransition()));
            circuitBreakers.put(level, breaker);
        }
        log.info("Cache resilience initialized, enabled: {}", enabled);
    }

    /**
     * 在熔断器保护下执行单层操作
     */
    public <T> T execute(CacheLevel level, Supplier<T> operation) {
        CircuitBreaker breaker = circuitBreakers.get(level);
        if (!enabled || breaker == null) {
            return operation.get();
        }
        return breaker.executeSupplier(operation);
    }

    public CircuitBreaker.State getState(CacheLevel level) {
        CircuitBreaker breaker = circuitBreakers.get(level);
        return breaker == null ? CircuitBreaker.State.DISABLED : breaker.getState();
    }

    public Map<String, Object> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("enabled", enabled);
        circuitBreakers.forEach((level, breaker) -> {
            CircuitBreaker.Metrics metrics = breaker.getMetrics();
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("state", breaker.getState().name());
            detail.put("failureRate", metrics.getFailureRate());
            detail.put("bufferedCalls", metrics.getNumberOfBufferedCalls());
            detail.put("notPermittedCalls", metrics.getNumberOfNotPermittedCalls());
            status.put(level.key(), detail);
        });
        return status;
    }

    public void reset(CacheLevel level) {
        CircuitBreaker breaker = circuitBreakers.get(level);
        if (breaker != null) {
            breaker.reset();
        }
    }
}
