package com.formsecurity.cache.repository;

import com.formsecurity.cache.model.CacheEntry;
import com.formsecurity.cache.model.CacheKey;
import com.formsecurity.cache.support.CacheTestFixtures;
import com.formsecurity.cache.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 数据库级仓库测试（H2 内存库）
 */
class DatabaseCacheRepositoryTest {

    private MutableClock clock;
    private DatabaseCacheRepository repository;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        repository = CacheTestFixtures.databaseRepository(CacheTestFixtures.serializer(), clock);
    }

    @Test
    @DisplayName("值以 JSON 存储，读回为通用结构")
    void testJsonRoundTrip() {
        repository.put("ip:1.2.3.4", Map.of("score", 80, "country", "NL"), 3600L);

        CacheEntry entry = repository.get("ip:1.2.3.4");
        assertNotNull(entry);
        assertEquals(Map.of("score", 80, "country", "NL"), entry.value());
        assertEquals(clock.millis() + 3_600_000L, entry.expiresAt());
        assertTrue(entry.sizeBytes() > 0);
    }

    @Test
    @DisplayName("带元数据写入后可还原完整 Key，包括命名空间、前缀和标签")
    void testIndexedKeys_restoresMetadata() {
        CacheKey tagged = CacheKey.of("rule:1", "spam_patterns", List.of("rules", "detection"), "fs");
        repository.put(tagged, "v", 60L);
        repository.put("legacy:k", "v", null);
        repository.put(CacheKey.of("gone", "ns", List.of("t")), "v", 10L);
        clock.advanceSeconds(10);

        Set<CacheKey> keys = repository.indexedKeys("fs");

        assertEquals(2, keys.size());
        CacheKey restored = keys.stream().filter(k -> k.equals(tagged)).findFirst().orElseThrow();
        assertEquals(Set.of("rules", "detection"), restored.tags());
        assertEquals("spam_patterns", restored.namespace());
        assertEquals("fs", restored.prefix());
        CacheKey legacy = keys.stream().filter(k -> k.toString().equals("legacy:k")).findFirst().orElseThrow();
        assertEquals("legacy", legacy.namespace());
        assertTrue(legacy.tags().isEmpty());
    }

    @Test
    @DisplayName("超大 TTL 的行按永不过期保存")
    void testPut_hugeTtlStoredAsForever() {
        repository.put("k", "v", Long.MAX_VALUE);

        assertNull(repository.get("k").expiresAt());
        assertTrue(repository.has("k"));
    }

    @Test
    @DisplayName("重复写入覆盖旧值")
    void testUpsert() {
        repository.put("k", "first", null);
        repository.put("k", "second", 60L);

        assertEquals("second", repository.get("k").value());
        assertEquals(1, repository.size().count());
    }

    @Test
    @DisplayName("过期行读取时惰性删除")
    void testLazyExpiry() {
        repository.put("k", "v", 30L);
        clock.advanceSeconds(30);

        assertFalse(repository.has("k"));
        assertEquals(1, repository.size().count());
        assertNull(repository.get("k"));
        assertEquals(0, repository.size().count());
    }

    @Test
    @DisplayName("purgeExpired 只删除过期行")
    void testPurgeExpired() {
        repository.put("live1", "a", null);
        repository.put("live2", "b", 3600L);
        repository.put("dead1", "c", 10L);
        repository.put("dead2", "d", 10L);
        repository.put("dead3", "e", 10L);
        clock.advanceSeconds(11);

        assertEquals(3, repository.purgeExpired());
        assertEquals(Set.of("live1", "live2"), repository.keys());
    }

    @Test
    @DisplayName("表统计")
    void testStatistics() {
        long first = clock.millis();
        repository.put("a", "1", null);
        clock.advanceSeconds(5);
        repository.put("b", "2", null);

        DatabaseCacheRepository.TableStatistics stats = repository.statistics();
        assertEquals(2, stats.totalKeys());
        assertTrue(stats.totalSizeBytes() > 0);
        assertEquals(first, stats.oldestStoredAt());
        assertEquals(first + 5_000L, stats.newestStoredAt());
    }

    @Test
    @DisplayName("空表统计没有时间范围")
    void testEmptyStatistics() {
        DatabaseCacheRepository.TableStatistics stats = repository.statistics();

        assertEquals(0, stats.totalKeys());
        assertNull(stats.oldestStoredAt());
    }

    @Test
    @DisplayName("执行维护语句时替换表名")
    void testExecuteStatements() {
        repository.put("k", "v", null);

        int executed = repository.executeStatements(List.of("ANALYZE TABLE {table}"));

        assertEquals(1, executed);
        assertEquals("v", repository.get("k").value());
    }

    @Test
    @DisplayName("非法表名被拒绝")
    void testInvalidTableName() {
        assertThrows(IllegalArgumentException.class, () -> new DatabaseCacheRepository(
            CacheTestFixtures.h2JdbcTemplate(), CacheTestFixtures.serializer(), clock, "cache; DROP TABLE x"));
    }
}
