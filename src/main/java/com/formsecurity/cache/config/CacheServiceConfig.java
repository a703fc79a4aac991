package com.formsecurity.cache.config;

import com.formsecurity.cache.repository.CacheRepositoryRegistry;
import com.formsecurity.cache.service.CacheEventListener;
import com.formsecurity.cache.service.CacheEventPublisher;
import com.formsecurity.cache.service.CacheInvalidationService;
import com.formsecurity.cache.service.CacheMaintenanceService;
import com.formsecurity.cache.service.CacheOperationService;
import com.formsecurity.cache.service.CacheResilienceService;
import com.formsecurity.cache.service.CacheSecurityService;
import com.formsecurity.cache.service.CacheStatisticsService;
import com.formsecurity.cache.service.CacheValidationService;
import com.formsecurity.cache.service.CacheWarmingService;
import com.formsecurity.cache.support.CacheOperationalContext;
import com.formsecurity.cache.support.CacheValueSerializer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 缓存服务装配
 * 核心服务保持普通构造器，这里统一注入运行上下文
 */
@Configuration
public class CacheServiceConfig {

    @Bean
    public CacheOperationalContext cacheOperationalContext(FormSecurityCacheProperties properties,
                                                           Clock cacheClock,
                                                           CacheValueSerializer serializer) {
        return new CacheOperationalContext(properties, cacheClock, serializer);
    }

    @Bean
    public CacheResilienceService cacheResilienceService(FormSecurityCacheProperties properties) {
        return new CacheResilienceService(properties.getResilience());
    }

    @Bean
    public CacheSecurityService cacheSecurityService(FormSecurityCacheProperties properties,
                                                     CacheValueSerializer serializer) {
        return new CacheSecurityService(properties.getSecurity(), serializer);
    }

    @Bean
    public CacheEventPublisher cacheEventPublisher(ApplicationEventPublisher applicationEventPublisher,
                                                   ObjectProvider<CacheEventListener> listeners) {
        CacheEventPublisher publisher = new CacheEventPublisher(applicationEventPublisher);
        listeners.orderedStream().forEach(publisher::addListener);
        return publisher;
    }

    @Bean
    public CacheOperationService cacheOperationService(CacheRepositoryRegistry registry,
                                                       CacheOperationalContext context,
                                                       CacheResilienceService resilienceService,
                                                       CacheSecurityService securityService,
                                                       CacheEventPublisher eventPublisher) {
        return new CacheOperationService(registry, context, resilienceService, securityService, eventPublisher);
    }

    /**
     * 协调器计数器注册到 Micrometer
     */
    @Bean
    public MeterBinder cacheMetricsBinder(CacheOperationService cacheOperationService) {
        return registry -> cacheOperationService.getMetrics().bindTo(registry, "form-security");
    }

    @Bean
    public CacheInvalidationService cacheInvalidationService(CacheOperationService cacheOperationService) {
        return new CacheInvalidationService(cacheOperationService);
    }

    @Bean
    public CacheMaintenanceService cacheMaintenanceService(CacheOperationService cacheOperationService) {
        return new CacheMaintenanceService(cacheOperationService);
    }

    @Bean
    public CacheStatisticsService cacheStatisticsService(CacheOperationService cacheOperationService) {
        return new CacheStatisticsService(cacheOperationService);
    }

    @Bean
    public CacheValidationService cacheValidationService(CacheOperationService cacheOperationService,
                                                         CacheStatisticsService cacheStatisticsService,
                                                         CacheMaintenanceService cacheMaintenanceService) {
        return new CacheValidationService(cacheOperationService, cacheStatisticsService, cacheMaintenanceService);
    }

    @Bean
    public CacheWarmingService cacheWarmingService(CacheOperationService cacheOperationService) {
        return new CacheWarmingService(cacheOperationService);
    }
}
