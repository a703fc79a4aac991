package com.formsecurity.cache.config;

import com.formsecurity.cache.model.CacheEntry;
import com.formsecurity.cache.repository.CacheRepository;
import com.formsecurity.cache.repository.CacheRepositoryRegistry;
import com.formsecurity.cache.repository.CaffeineMemoryCacheRepository;
import com.formsecurity.cache.repository.DatabaseCacheRepository;
import com.formsecurity.cache.repository.RedisMemoryCacheRepository;
import com.formsecurity.cache.repository.RequestLevelCacheRepository;
import com.formsecurity.cache.support.CacheValueSerializer;
import com.github.benmanes.caffeine.cache.Cache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.util.List;

/**
 * 层级仓库配置
 * 每个层级一个仓库，启动时一次性装配进注册表
 */
@Configuration
@EnableConfigurationProperties(FormSecurityCacheProperties.class)
public class CacheRepositoryConfig {

    private static final Logger log = LoggerFactory.getLogger(CacheRepositoryConfig.class);

    @Bean
    public Clock cacheClock() {
        return Clock.systemUTC();
    }

    @Bean
    public RequestLevelCacheRepository requestLevelCacheRepository(CacheValueSerializer serializer, Clock cacheClock) {
        return new RequestLevelCacheRepository(serializer, cacheClock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "form-security.cache.memory", name = "driver", havingValue = "caffeine", matchIfMissing = true)
    public CaffeineMemoryCacheRepository caffeineMemoryCacheRepository(
            @Qualifier("memoryLevelCache") Cache<String, CacheEntry> memoryLevelCache,
            CacheValueSerializer serializer, Clock cacheClock) {
        return new CaffeineMemoryCacheRepository(memoryLevelCache, serializer, cacheClock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "form-security.cache.memory", name = "driver", havingValue = "redis")
    public RedisMemoryCacheRepository redisMemoryCacheRepository(StringRedisTemplate stringRedisTemplate,
                                                                 CacheValueSerializer serializer,
                                                                 Clock cacheClock,
                                                                 FormSecurityCacheProperties properties) {
        log.info("Memory level uses Redis driver, key prefix: {}", properties.getMemory().getRedisKeyPrefix());
        return new RedisMemoryCacheRepository(stringRedisTemplate, serializer, cacheClock,
            properties.getMemory().getRedisKeyPrefix());
    }

    @Bean
    public DatabaseCacheRepository databaseCacheRepository(JdbcTemplate jdbcTemplate,
                                                           CacheValueSerializer serializer,
                                                           Clock cacheClock,
                                                           FormSecurityCacheProperties properties) {
        FormSecurityCacheProperties.Database database = properties.getDatabase();
        DatabaseCacheRepository repository = new DatabaseCacheRepository(jdbcTemplate, serializer, cacheClock,
            database.getTable(), database.getValueColumnType());
        if (database.isCreateTable()) {
            try {
                repository.createTableIfNotExists();
            } catch (Exception e) {
                // 注册表探活时会把 DATABASE 标记为不可用
                log.warn("Failed to create database cache table {}: {}", database.getTable(), e.toString());
            }
        }
        return repository;
    }

    @Bean
    public CacheRepositoryRegistry cacheRepositoryRegistry(List<CacheRepository> repositories) {
        return new CacheRepositoryRegistry(repositories);
    }
}
