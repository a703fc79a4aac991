package com.formsecurity.cache.repository;

import com.formsecurity.cache.model.CacheEntry;
import com.formsecurity.cache.model.CacheKey;
import com.formsecurity.cache.model.CacheLevel;
import com.formsecurity.cache.model.CacheSize;
import com.formsecurity.cache.support.CacheValueSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * DATABASE 层：JdbcTemplate 键值表
 * 表结构：cache_key 主键、cache_value JSON 文本、stored_at / expires_at 为 epoch 毫秒（expires_at 为 NULL 表示永不过期），
 * raw_key / key_namespace / key_prefix / key_tags 保存 Key 元数据，key_tags 为 JSON 数组
 * 过期行在读取时惰性删除，批量清理由维护服务调用 purgeExpired
 */
public class DatabaseCacheRepository implements TagAwareCacheRepository {

    private static final Logger log = LoggerFactory.getLogger(DatabaseCacheRepository.class);

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final JdbcTemplate jdbcTemplate;
    private final CacheValueSerializer serializer;
    private final Clock clock;
    private final String table;
    private final String valueColumnType;

    public DatabaseCacheRepository(JdbcTemplate jdbcTemplate, CacheValueSerializer serializer,
                                   Clock clock, String table) {
        this(jdbcTemplate, serializer, clock, table, "CLOB");
    }

    public DatabaseCacheRepository(JdbcTemplate jdbcTemplate, CacheValueSerializer serializer,
                                   Clock clock, String table, String valueColumnType) {
        if (table == null || !TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid cache table name: " + table);
        }
        this.jdbcTemplate = jdbcTemplate;
        this.serializer = serializer;
        this.clock = clock;
        this.table = table;
        this.valueColumnType = valueColumnType;
    }

    /**
     * 建表（仅 CREATE TABLE IF NOT EXISTS，不做迁移）
     */
    public void createTableIfNotExists() {
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + table + " ("
            + "cache_key VARCHAR(512) NOT NULL PRIMARY KEY, "
            + "cache_value " + valueColumnType + ", "
            + "stored_at BIGINT NOT NULL, "
            + "expires_at BIGINT, "
            + "size_bytes BIGINT NOT NULL, "
            + "raw_key VARCHAR(512), "
            + "key_namespace VARCHAR(128), "
            + "key_prefix VARCHAR(128), "
            + "key_tags VARCHAR(2048))");
        log.info("Database cache table ready: {}", table);
    }

    @Override
    public CacheLevel level() {
        return CacheLevel.DATABASE;
    }

    @Override
    public CacheEntry get(String key) {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT cache_value, stored_at, expires_at, size_bytes FROM " + table + " WHERE cache_key = ?", key);
        if (rows.isEmpty()) {
            return null;
        }
        Map<String, Object> row = rows.get(0);
        Long expiresAt = toLong(column(row, "expires_at"));
        long storedAt = toLong(column(row, "stored_at"));
        if (expiresAt != null && expiresAt <= clock.millis()) {
            jdbcTemplate.update("DELETE FROM " + table + " WHERE cache_key = ? AND expires_at <= ?", key, clock.millis());
            return null;
        }
        Object value = serializer.deserialize(String.valueOf(column(row, "cache_value")));
        return new CacheEntry(value, storedAt, expiresAt, toLong(column(row, "size_bytes")));
    }

    @Override
    public boolean put(String key, Object value, Long ttlSeconds) {
        return write(key, value, ttlSeconds, null);
    }

    @Override
    public boolean put(CacheKey key, Object value, Long ttlSeconds) {
        return write(key.toString(), value, ttlSeconds, key);
    }

    private boolean write(String key, Object value, Long ttlSeconds, CacheKey metadata) {
        String json = serializer.serialize(value);
        long size = serializer.sizeOf(json);
        long now = clock.millis();
        Long expiresAt = CacheEntry.expiryFor(now, ttlSeconds);
        String rawKey = metadata == null ? null : metadata.rawKey();
        String namespace = metadata == null ? null : metadata.namespace();
        String prefix = metadata == null ? null : metadata.prefix();
        String tags = metadata == null ? null : serializer.serialize(new ArrayList<>(metadata.tags()));
        String update = "UPDATE " + table + " SET cache_value = ?, stored_at = ?, expires_at = ?, size_bytes = ?, "
            + "raw_key = ?, key_namespace = ?, key_prefix = ?, key_tags = ? WHERE cache_key = ?";
        int updated = jdbcTemplate.update(update, json, now, expiresAt, size, rawKey, namespace, prefix, tags, key);
        if (updated == 0) {
            try {
                jdbcTemplate.update(
                    "INSERT INTO " + table + " (cache_key, cache_value, stored_at, expires_at, size_bytes, "
                        + "raw_key, key_namespace, key_prefix, key_tags) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    key, json, now, expiresAt, size, rawKey, namespace, prefix, tags);
            } catch (DuplicateKeyException e) {
                // 并发插入，后写者覆盖
                jdbcTemplate.update(update, json, now, expiresAt, size, rawKey, namespace, prefix, tags, key);
            }
        }
        return true;
    }

    @Override
    public boolean forget(String key) {
        jdbcTemplate.update("DELETE FROM " + table + " WHERE cache_key = ?", key);
        return true;
    }

    @Override
    public boolean flush() {
        int removed = jdbcTemplate.update("DELETE FROM " + table);
        log.info("Database cache flushed, rows removed: {}", removed);
        return true;
    }

    @Override
    public boolean has(String key) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM " + table + " WHERE cache_key = ? AND (expires_at IS NULL OR expires_at > ?)",
            Integer.class, key, clock.millis());
        return count != null && count > 0;
    }

    /**
     * 物理占用，包含尚未清理的过期行
     */
    @Override
    public CacheSize size() {
        Map<String, Object> row = jdbcTemplate.queryForMap(
            "SELECT COUNT(*) AS total_keys, COALESCE(SUM(size_bytes), 0) AS total_bytes FROM " + table);
        return new CacheSize(toLong(column(row, "total_keys")), toLong(column(row, "total_bytes")));
    }

    @Override
    public Set<String> keys() {
        return new LinkedHashSet<>(jdbcTemplate.queryForList(
            "SELECT cache_key FROM " + table + " WHERE expires_at IS NULL OR expires_at > ? ORDER BY stored_at",
            String.class, clock.millis()));
    }

    /**
     * 由保存的元数据还原存活条目的 Key；没有元数据的行按地址解析，标签为空
     */
    @Override
    public Set<CacheKey> indexedKeys(String knownPrefix) {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT cache_key, raw_key, key_namespace, key_prefix, key_tags FROM " + table
                + " WHERE expires_at IS NULL OR expires_at > ? ORDER BY stored_at", clock.millis());
        Set<CacheKey> keys = new LinkedHashSet<>();
        for (Map<String, Object> row : rows) {
            String address = String.valueOf(column(row, "cache_key"));
            Object rawKey = column(row, "raw_key");
            if (rawKey == null) {
                keys.add(CacheKey.parse(address, knownPrefix));
                continue;
            }
            CacheKey key = CacheKey.of(rawKey.toString(), (String) column(row, "key_namespace"),
                readTags(column(row, "key_tags")), (String) column(row, "key_prefix"));
            if (key.toString().equals(address)) {
                keys.add(key);
            } else {
                log.warn("Stored key metadata does not match address {}, falling back to address parsing", address);
                keys.add(CacheKey.parse(address, knownPrefix));
            }
        }
        return keys;
    }

    @Override
    public int purgeExpired() {
        return jdbcTemplate.update(
            "DELETE FROM " + table + " WHERE expires_at IS NOT NULL AND expires_at <= ?", clock.millis());
    }

    @Override
    public void ping() {
        jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
    }

    /**
     * 表级统计：总行数、总字节、最早 / 最新写入时间
     */
    public TableStatistics statistics() {
        Map<String, Object> row = jdbcTemplate.queryForMap(
            "SELECT COUNT(*) AS total_keys, COALESCE(SUM(size_bytes), 0) AS total_bytes, "
                + "MIN(stored_at) AS oldest, MAX(stored_at) AS newest FROM " + table);
        return new TableStatistics(
            toLong(column(row, "total_keys")),
            toLong(column(row, "total_bytes")),
            toLong(column(row, "oldest")),
            toLong(column(row, "newest")));
    }

    /**
     * 执行后端相关的整理语句（optimize / vacuum）
     *
     * @return 成功执行的语句数
     */
    public int executeStatements(List<String> statements) {
        int executed = 0;
        for (String statement : statements) {
            jdbcTemplate.execute(statement.replace("{table}", table));
            executed++;
        }
        return executed;
    }

    public String getTable() {
        return table;
    }

    private List<String> readTags(Object json) {
        if (json == null) {
            return List.of();
        }
        Object parsed = serializer.deserialize(json.toString());
        List<String> tags = new ArrayList<>();
        if (parsed instanceof Collection<?> values) {
            for (Object value : values) {
                tags.add(String.valueOf(value));
            }
        }
        return tags;
    }

    private static Object column(Map<String, Object> row, String name) {
        Object value = row.get(name);
        if (value == null) {
            value = row.get(name.toUpperCase());
        }
        return value;
    }

    private static Long toLong(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.longValue();
        }
        return Long.parseLong(value.toString());
    }

    public record TableStatistics(long totalKeys, long totalSizeBytes, Long oldestStoredAt, Long newestStoredAt) {
    }
}
