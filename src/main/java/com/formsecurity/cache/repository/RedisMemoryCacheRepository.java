package com.formsecurity.cache.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.formsecurity.cache.exception.CacheException;
import com.formsecurity.cache.model.CacheEntry;
import com.formsecurity.cache.model.CacheLevel;
import com.formsecurity.cache.model.CacheSize;
import com.formsecurity.cache.support.CacheValueSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * MEMORY 层 Redis 实现（form-security.cache.memory.driver=redis）
 * 值以 JSON 信封存储：{"v": 值, "s": 写入时间, "e": 过期时间, "b": 字节数}
 * TTL 交给 Redis EXPIRE，ttl=null 时不设置过期
 */
public class RedisMemoryCacheRepository implements CacheRepository {

    private static final Logger log = LoggerFactory.getLogger(RedisMemoryCacheRepository.class);

    private final StringRedisTemplate redisTemplate;
    private final CacheValueSerializer serializer;
    private final Clock clock;
    private final String keyPrefix;

    public RedisMemoryCacheRepository(StringRedisTemplate redisTemplate, CacheValueSerializer serializer,
                                      Clock clock, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.serializer = serializer;
        this.clock = clock;
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
    }

    @Override
    public CacheLevel level() {
        return CacheLevel.MEMORY;
    }

    @Override
    public CacheEntry get(String key) {
        String raw = redisTemplate.opsForValue().get(keyPrefix + key);
        if (raw == null) {
            return null;
        }
        CacheEntry entry = decode(raw);
        if (entry.isExpired(clock.millis())) {
            redisTemplate.delete(keyPrefix + key);
            return null;
        }
        return entry;
    }

    @Override
    public boolean put(String key, Object value, Long ttlSeconds) {
        String json = serializer.serialize(value);
        long size = serializer.sizeOf(json);
        if (size > level().maxValueBytes()) {
            log.warn("Value too large for redis cache, key: {}, size: {}", key, size);
            return false;
        }
        CacheEntry entry = CacheEntry.of(value, clock.millis(), ttlSeconds, size);
        String envelope = encode(json, entry);
        if (entry.expiresAt() == null) {
            redisTemplate.opsForValue().set(keyPrefix + key, envelope);
        } else {
            redisTemplate.opsForValue().set(keyPrefix + key, envelope, Duration.ofSeconds(ttlSeconds));
        }
        return true;
    }

    @Override
    public boolean forget(String key) {
        redisTemplate.delete(keyPrefix + key);
        return true;
    }

    @Override
    public boolean flush() {
        Set<String> keys = redisTemplate.keys(keyPrefix + "*");
        if (keys != null && !keys.isEmpty()) {
            redisTemplate.delete(keys);
        }
        return true;
    }

    @Override
    public boolean has(String key) {
        return get(key) != null;
    }

    @Override
    public CacheSize size() {
        Set<String> keys = redisTemplate.keys(keyPrefix + "*");
        if (keys == null || keys.isEmpty()) {
            return CacheSize.EMPTY;
        }
        long bytes = 0;
        for (String key : keys) {
            Long len = redisTemplate.opsForValue().size(key);
            bytes += len == null ? 0 : len;
        }
        return new CacheSize(keys.size(), bytes);
    }

    @Override
    public Set<String> keys() {
        Set<String> keys = redisTemplate.keys(keyPrefix + "*");
        if (keys == null || keys.isEmpty()) {
            return Collections.emptySet();
        }
        Set<String> result = new LinkedHashSet<>();
        for (String key : keys) {
            result.add(key.substring(keyPrefix.length()));
        }
        return result;
    }

    /**
     * Redis 自行过期，无需清理
     */
    @Override
    public int purgeExpired() {
        return 0;
    }

    @Override
    public void ping() {
        String pong = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
        if (pong == null) {
            throw new CacheException("Redis ping returned no response");
        }
    }

    private String encode(String json, CacheEntry entry) {
        ObjectNode node = serializer.getObjectMapper().createObjectNode();
        try {
            node.set("v", serializer.getObjectMapper().readTree(json));
        } catch (JsonProcessingException e) {
            throw new CacheException("Failed to encode redis envelope", e);
        }
        node.put("s", entry.storedAt());
        if (entry.expiresAt() != null) {
            node.put("e", entry.expiresAt());
        }
        node.put("b", entry.sizeBytes());
        return node.toString();
    }

    private CacheEntry decode(String raw) {
        try {
            JsonNode node = serializer.getObjectMapper().readTree(raw);
            Object value = serializer.getObjectMapper().treeToValue(node.get("v"), Object.class);
            Long expiresAt = node.hasNonNull("e") ? node.get("e").asLong() : null;
            return new CacheEntry(value, node.path("s").asLong(), expiresAt, node.path("b").asLong());
        } catch (JsonProcessingException e) {
            throw new CacheException("Corrupted redis cache envelope", e);
        }
    }
}
