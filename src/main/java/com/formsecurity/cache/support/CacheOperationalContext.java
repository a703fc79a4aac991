package com.formsecurity.cache.support;

import com.formsecurity.cache.config.FormSecurityCacheProperties;
import com.formsecurity.cache.constant.CacheConstants;
import com.formsecurity.cache.model.CacheLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 各服务共享的运行上下文：配置、时钟、序列化器、异常处理器与降级策略
 * 通过构造器注入，替代多个服务各自混入的横切逻辑
 */
public class CacheOperationalContext {

    private static final Logger log = LoggerFactory.getLogger(CacheOperationalContext.class);

    private final FormSecurityCacheProperties properties;
    private final Clock clock;
    private final CacheValueSerializer serializer;
    private final Map<Class<? extends Throwable>, CacheErrorHandler> errorHandlers = new ConcurrentHashMap<>();
    private final Map<String, CacheFallbackStrategy> fallbackStrategies = new ConcurrentHashMap<>();

    private final CacheErrorHandler defaultErrorHandler = (level, operation, key, error) ->
        log.warn("Cache {} failed on level {}, key: {}, error: {}", operation, level, key, error.toString());

    public CacheOperationalContext(FormSecurityCacheProperties properties, Clock clock, CacheValueSerializer serializer) {
        this.properties = properties;
        this.clock = clock;
        this.serializer = serializer;
        registerDefaultFallbacks();
    }

    public void registerErrorHandler(Class<? extends Throwable> type, CacheErrorHandler handler) {
        errorHandlers.put(type, handler);
    }

    public void registerFallbackStrategy(String operation, CacheFallbackStrategy strategy) {
        fallbackStrategies.put(operation, strategy);
    }

    /**
     * 沿异常类继承链查找最具体的处理器，找不到则记录日志
     * 处理器自身抛出的异常只记录，不再向外传播
     */
    public void handleError(CacheLevel level, String operation, String key, Exception error) {
        CacheErrorHandler handler = null;
        for (Class<?> type = error.getClass(); type != null && handler == null; type = type.getSuperclass()) {
            handler = errorHandlers.get(type);
        }
        if (handler == null) {
            handler = defaultErrorHandler;
        }
        try {
            handler.handle(level, operation, key, error);
        } catch (RuntimeException e) {
            log.error("Cache error handler failed for operation {} on level {}", operation, level, e);
        }
    }

    public Object fallback(String operation, String key, Object defaultValue) {
        CacheFallbackStrategy strategy = fallbackStrategies.get(operation);
        if (strategy == null) {
            return defaultValue;
        }
        try {
            return strategy.fallback(operation, key, defaultValue);
        } catch (RuntimeException e) {
            log.error("Cache fallback strategy failed for operation {}, key: {}", operation, key, e);
            return defaultValue;
        }
    }

    public boolean fallbackBoolean(String operation, String key) {
        return Boolean.TRUE.equals(fallback(operation, key, Boolean.FALSE));
    }

    public boolean hasFallbackStrategy(String operation) {
        return fallbackStrategies.containsKey(operation);
    }

    public FormSecurityCacheProperties getProperties() {
        return properties;
    }

    public Clock getClock() {
        return clock;
    }

    public CacheValueSerializer getSerializer() {
        return serializer;
    }

    private void registerDefaultFallbacks() {
        fallbackStrategies.put(CacheConstants.OP_GET, (op, key, dflt) -> {
            log.error("All cache levels failed for get, key: {}, returning default", key);
            return dflt;
        });
        CacheFallbackStrategy failWrite = (op, key, dflt) -> {
            log.error("All cache levels failed for {}, key: {}", op, key);
            return Boolean.FALSE;
        };
        fallbackStrategies.put(CacheConstants.OP_PUT, failWrite);
        fallbackStrategies.put(CacheConstants.OP_ADD, failWrite);
        fallbackStrategies.put(CacheConstants.OP_FORGET, failWrite);
        fallbackStrategies.put(CacheConstants.OP_FLUSH, failWrite);
        fallbackStrategies.put(CacheConstants.OP_HAS, failWrite);
    }
}
