package com.formsecurity.cache.config;

import com.formsecurity.cache.model.CacheEntry;
import com.formsecurity.cache.repository.CaffeineMemoryCacheRepository;
import com.github.benmanes.caffeine.cache.Cache;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Caffeine 本地缓存配置（MEMORY 层默认驱动）
 * W-TinyLFU 淘汰，条目按自身 TTL 过期
 */
@Configuration
@ConditionalOnProperty(prefix = "form-security.cache.memory", name = "driver", havingValue = "caffeine", matchIfMissing = true)
public class CaffeineConfig {

    private static final Logger log = LoggerFactory.getLogger(CaffeineConfig.class);

    @Bean("memoryLevelCache")
    public Cache<String, CacheEntry> memoryLevelCache(FormSecurityCacheProperties properties, Clock cacheClock,
                                                      MeterRegistry meterRegistry) {
        FormSecurityCacheProperties.Memory memory = properties.getMemory();
        Cache<String, CacheEntry> cache = CaffeineMemoryCacheRepository.newCache(
            memory.getMaxSize(), memory.getInitialCapacity(), cacheClock);

        // 注册 Micrometer 指标
        CaffeineCacheMetrics.monitor(meterRegistry, cache, "form_security_memory_cache");

        log.info("Memory level cache initialized: initialCapacity={}, maximumSize={}",
            memory.getInitialCapacity(), memory.getMaxSize());
        return cache;
    }
}
