package com.formsecurity.cache.support;

import com.formsecurity.cache.model.CacheKey;
import com.formsecurity.cache.model.CacheLevel;

import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Key / 标签索引
 * 后端不支持模式扫描和标签查询，由协调器维护每层的地址索引与标签索引；
 * REQUEST 层索引与 REQUEST 存储一样按线程隔离
 */
public class KeyTracker {

    private final Map<CacheLevel, LevelIndex> sharedIndexes = new EnumMap<>(CacheLevel.class);
    private final ThreadLocal<LevelIndex> requestIndex = ThreadLocal.withInitial(LevelIndex::new);

    public KeyTracker() {
        for (CacheLevel level : CacheLevel.orderedLevels()) {
            if (level.survivesRequest()) {
                sharedIndexes.put(level, new LevelIndex());
            }
        }
    }

    public void track(CacheLevel level, CacheKey key) {
        index(level).track(key);
    }

    public void untrack(CacheLevel level, String address) {
        index(level).untrack(address);
    }

    public void clear(CacheLevel level) {
        if (level == CacheLevel.REQUEST) {
            requestIndex.get().clear();
            requestIndex.remove();
        } else {
            index(level).clear();
        }
    }

    public boolean isTracked(CacheLevel level, String address) {
        return index(level).keys.containsKey(address);
    }

    /**
     * 查找已登记的 Key（带合并后的标签）
     */
    public Optional<CacheKey> lookup(String address) {
        for (CacheLevel level : CacheLevel.orderedLevels()) {
            CacheKey key = index(level).keys.get(address);
            if (key != null) {
                return Optional.of(key);
            }
        }
        return Optional.empty();
    }

    public Set<CacheKey> keys(Collection<CacheLevel> levels) {
        Set<CacheKey> result = new LinkedHashSet<>();
        for (CacheLevel level : levels) {
            result.addAll(index(level).keys.values());
        }
        return result;
    }

    public Set<CacheKey> findByTag(String tag, Collection<CacheLevel> levels) {
        Set<CacheKey> result = new LinkedHashSet<>();
        for (CacheLevel level : levels) {
            LevelIndex idx = index(level);
            Set<String> addresses = idx.tags.get(tag);
            if (addresses == null) {
                continue;
            }
            for (String address : addresses) {
                CacheKey key = idx.keys.get(address);
                if (key != null) {
                    result.add(key);
                }
            }
        }
        return result;
    }

    public Set<CacheKey> findByNamespace(String namespace, Collection<CacheLevel> levels) {
        Set<CacheKey> result = new LinkedHashSet<>();
        for (CacheLevel level : levels) {
            for (CacheKey key : index(level).keys.values()) {
                if (key.namespace().equals(namespace)) {
                    result.add(key);
                }
            }
        }
        return result;
    }

    /**
     * glob 匹配（* 任意串，? 单字符），同时匹配存储地址和原始 Key
     */
    public Set<CacheKey> findByPattern(String pattern, Collection<CacheLevel> levels) {
        Pattern regex = globToRegex(pattern);
        Set<CacheKey> result = new LinkedHashSet<>();
        for (CacheLevel level : levels) {
            for (CacheKey key : index(level).keys.values()) {
                if (regex.matcher(key.toString()).matches() || regex.matcher(key.rawKey()).matches()) {
                    result.add(key);
                }
            }
        }
        return result;
    }

    /**
     * 以后端实际存在的 Key 重建某层索引：保留已知 Key 的标签，新发现的 Key 按地址还原
     *
     * @return 重建后的索引大小
     */
    public int rebuild(CacheLevel level, Set<String> liveAddresses, String knownPrefix) {
        LevelIndex idx = index(level);
        idx.keys.keySet().removeIf(address -> !liveAddresses.contains(address));
        idx.tags.values().forEach(addresses -> addresses.retainAll(liveAddresses));
        idx.tags.values().removeIf(Set::isEmpty);
        for (String address : liveAddresses) {
            if (!idx.keys.containsKey(address)) {
                idx.track(CacheKey.parse(address, knownPrefix));
            }
        }
        return idx.keys.size();
    }

    /**
     * 以后端保存的完整 Key 重建某层索引，标签与命名空间随 Key 一起恢复
     *
     * @return 重建后的索引大小
     */
    public int rebuild(CacheLevel level, Collection<CacheKey> liveKeys) {
        LevelIndex idx = index(level);
        Set<String> liveAddresses = new HashSet<>();
        for (CacheKey key : liveKeys) {
            liveAddresses.add(key.toString());
        }
        retainOnly(level, liveAddresses);
        for (CacheKey key : liveKeys) {
            idx.track(key);
        }
        return idx.keys.size();
    }

    /**
     * 丢弃后端已不存在的索引项
     *
     * @return 丢弃数量
     */
    public int retainOnly(CacheLevel level, Set<String> liveAddresses) {
        LevelIndex idx = index(level);
        int removed = 0;
        for (String address : Set.copyOf(idx.keys.keySet())) {
            if (!liveAddresses.contains(address)) {
                idx.untrack(address);
                removed++;
            }
        }
        return removed;
    }

    public int size(CacheLevel level) {
        return index(level).keys.size();
    }

    public static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString());
    }

    private LevelIndex index(CacheLevel level) {
        return level == CacheLevel.REQUEST ? requestIndex.get() : sharedIndexes.get(level);
    }

    /**
     * 单层索引：地址 -> Key，标签 -> 地址集合
     */
    private static final class LevelIndex {

        private final Map<String, CacheKey> keys = new ConcurrentHashMap<>();
        private final Map<String, Set<String>> tags = new ConcurrentHashMap<>();

        void track(CacheKey key) {
            String address = key.toString();
            CacheKey merged = keys.merge(address, key, (old, incoming) -> old.withTags(incoming.tags()));
            for (String tag : merged.tags()) {
                tags.computeIfAbsent(tag, t -> ConcurrentHashMap.newKeySet()).add(address);
            }
        }

        void untrack(String address) {
            CacheKey removed = keys.remove(address);
            if (removed == null) {
                return;
            }
            for (String tag : removed.tags()) {
                tags.computeIfPresent(tag, (t, addresses) -> {
                    addresses.remove(address);
                    return addresses.isEmpty() ? null : addresses;
                });
            }
        }

        void clear() {
            keys.clear();
            tags.clear();
        }
    }
}
