package com.formsecurity.cache.support;

import com.formsecurity.cache.model.CacheKey;
import com.formsecurity.cache.model.CacheLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Key / 标签索引单元测试
 */
class KeyTrackerTest {

    private static final List<CacheLevel> ALL = CacheLevel.orderedLevels();

    private KeyTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new KeyTracker();
    }

    @Test
    @DisplayName("同一地址重复登记时合并标签")
    void testTagsMergeOnTrack() {
        tracker.track(CacheLevel.MEMORY, CacheKey.of("k", "ns", List.of("a")));
        tracker.track(CacheLevel.MEMORY, CacheKey.of("k", "ns", List.of("b")));

        assertEquals(Set.of("a", "b"), tracker.lookup("ns:k").orElseThrow().tags());
        assertEquals(1, tracker.findByTag("a", ALL).size());
        assertEquals(1, tracker.findByTag("b", ALL).size());
    }

    @Test
    @DisplayName("取消登记后标签索引同步清理")
    void testUntrack() {
        tracker.track(CacheLevel.DATABASE, CacheKey.of("k", "ns", List.of("a")));
        tracker.untrack(CacheLevel.DATABASE, "ns:k");

        assertFalse(tracker.isTracked(CacheLevel.DATABASE, "ns:k"));
        assertTrue(tracker.findByTag("a", ALL).isEmpty());
        assertTrue(tracker.lookup("ns:k").isEmpty());
    }

    @Test
    @DisplayName("glob 同时匹配存储地址和原始 Key")
    void testPatternMatching() {
        tracker.track(CacheLevel.MEMORY, CacheKey.forIpReputation("1.2.3.4"));
        tracker.track(CacheLevel.MEMORY, CacheKey.forGeolocation("1.2.3.4"));

        assertEquals(1, tracker.findByPattern("ip:*", ALL).size());
        assertEquals(1, tracker.findByPattern("ip_reputation:*", ALL).size());
        assertEquals(2, tracker.findByPattern("*1.2.3.4", ALL).size());
        assertEquals(1, tracker.findByPattern("geo:1.2.3.?", ALL).size());
        assertTrue(tracker.findByPattern("ip:9.*", ALL).isEmpty());
    }

    @Test
    @DisplayName("glob 中的正则元字符按字面处理")
    void testGlobQuotesLiterals() {
        assertTrue(KeyTracker.globToRegex("a.b*").matcher("a.bcd").matches());
        assertFalse(KeyTracker.globToRegex("a.b*").matcher("axbcd").matches());
        assertTrue(KeyTracker.globToRegex("(x)+?").matcher("(x)+1").matches());
    }

    @Test
    @DisplayName("按命名空间和层级查询")
    void testNamespaceScopedByLevel() {
        tracker.track(CacheLevel.MEMORY, CacheKey.of("a", "geolocation"));
        tracker.track(CacheLevel.DATABASE, CacheKey.of("b", "geolocation"));

        assertEquals(2, tracker.findByNamespace("geolocation", ALL).size());
        assertEquals(1, tracker.findByNamespace("geolocation", List.of(CacheLevel.DATABASE)).size());
    }

    @Test
    @DisplayName("REQUEST 层索引按线程隔离")
    void testRequestIndexIsThreadLocal() {
        tracker.track(CacheLevel.REQUEST, CacheKey.of("k"));

        int otherThreadSize = CompletableFuture.supplyAsync(() -> tracker.size(CacheLevel.REQUEST)).join();

        assertEquals(0, otherThreadSize);
        assertEquals(1, tracker.size(CacheLevel.REQUEST));
        tracker.clear(CacheLevel.REQUEST);
        assertEquals(0, tracker.size(CacheLevel.REQUEST));
    }

    @Test
    @DisplayName("重建索引：保留已知标签，补充新发现的 Key，丢弃不存在的 Key")
    void testRebuild() {
        tracker.track(CacheLevel.DATABASE, CacheKey.of("kept", "ns", List.of("t")));
        tracker.track(CacheLevel.DATABASE, CacheKey.of("gone", "ns", List.of("t")));

        int size = tracker.rebuild(CacheLevel.DATABASE, Set.of("ns:kept", "geolocation:geo:8.8.8.8"), null);

        assertEquals(2, size);
        assertEquals(Set.of("t"), tracker.lookup("ns:kept").orElseThrow().tags());
        assertFalse(tracker.isTracked(CacheLevel.DATABASE, "ns:gone"));
        assertEquals(1, tracker.findByTag("t", ALL).size());
        assertEquals(1, tracker.findByNamespace("geolocation", ALL).size());
    }

    @Test
    @DisplayName("以完整 Key 重建时恢复标签，丢弃后端已不存在的地址")
    void testRebuildFromKeys() {
        tracker.track(CacheLevel.DATABASE, CacheKey.of("gone", "ns", List.of("t")));

        int size = tracker.rebuild(CacheLevel.DATABASE, List.of(
            CacheKey.of("rule:1", "spam_patterns", List.of("rules")),
            CacheKey.of("rule:2", "spam_patterns")));

        assertEquals(2, size);
        assertFalse(tracker.isTracked(CacheLevel.DATABASE, "ns:gone"));
        assertTrue(tracker.findByTag("t", ALL).isEmpty());
        assertEquals(1, tracker.findByTag("rules", ALL).size());
        assertEquals(2, tracker.findByNamespace("spam_patterns", ALL).size());
    }

    @Test
    @DisplayName("retainOnly 返回丢弃数量")
    void testRetainOnly() {
        tracker.track(CacheLevel.DATABASE, CacheKey.of("a"));
        tracker.track(CacheLevel.DATABASE, CacheKey.of("b"));
        tracker.track(CacheLevel.DATABASE, CacheKey.of("c"));

        assertEquals(2, tracker.retainOnly(CacheLevel.DATABASE, Set.of("default:a")));
        assertEquals(1, tracker.size(CacheLevel.DATABASE));
    }
}
