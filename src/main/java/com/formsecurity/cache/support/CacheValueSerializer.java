package com.formsecurity.cache.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.formsecurity.cache.exception.CacheException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * 缓存值序列化器
 * MEMORY(Redis) / DATABASE 层以 JSON 文本存储，读回时得到 Map / List / 标量；
 * REQUEST / Caffeine 层直接存对象，只用它估算大小
 */
public class CacheValueSerializer {

    private static final Logger log = LoggerFactory.getLogger(CacheValueSerializer.class);

    private final ObjectMapper objectMapper;

    public CacheValueSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String serialize(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new CacheException("Failed to serialize cache value of type "
                + (value == null ? "null" : value.getClass().getName()), e);
        }
    }

    public Object deserialize(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, Object.class);
        } catch (JsonProcessingException e) {
            throw new CacheException("Failed to deserialize cache value", e);
        }
    }

    /**
     * 把反序列化得到的通用结构转换成调用方期望的类型
     */
    public <T> T convert(Object value, Class<T> type) {
        if (value == null || type.isInstance(value)) {
            return type.cast(value);
        }
        return objectMapper.convertValue(value, type);
    }

    /**
     * 估算序列化后的字节数
     */
    public long estimateSize(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof String s) {
            return s.getBytes(StandardCharsets.UTF_8).length;
        }
        if (value instanceof byte[] bytes) {
            return bytes.length;
        }
        try {
            return objectMapper.writeValueAsBytes(value).length;
        } catch (JsonProcessingException e) {
            log.debug("Size estimation fell back to toString for {}", value.getClass().getName());
            return (long) String.valueOf(value).length() * 2;
        }
    }

    public long sizeOf(String json) {
        return json == null ? 0 : json.getBytes(StandardCharsets.UTF_8).length;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
