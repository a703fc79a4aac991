package com.formsecurity.cache.model;

import com.formsecurity.cache.exception.InvalidCacheKeyException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 缓存 Key 值对象（不可变）
 * 存储地址格式：{prefix}:{namespace}:{rawKey}，prefix 为空时省略
 * 相等性只由存储地址决定，tags 不参与比较：
 * 同一地址、不同 tags 的两个 Key 指向同一存储槽位，但参与不同的标签失效集合
 */
public final class CacheKey {

    public static final String DEFAULT_NAMESPACE = "default";

    private static final char SEPARATOR = ':';

    private final String rawKey;
    private final String namespace;
    private final Set<String> tags;
    private final String prefix;
    private final String address;

    private CacheKey(String rawKey, String namespace, Set<String> tags, String prefix) {
        this.rawKey = rawKey;
        this.namespace = namespace;
        this.tags = tags;
        this.prefix = prefix;
        this.address = buildAddress(prefix, namespace, rawKey);
    }

    public static CacheKey of(String rawKey) {
        return of(rawKey, null, null, null);
    }

    public static CacheKey of(String rawKey, String namespace) {
        return of(rawKey, namespace, null, null);
    }

    public static CacheKey of(String rawKey, String namespace, Collection<String> tags) {
        return of(rawKey, namespace, tags, null);
    }

    public static CacheKey of(String rawKey, String namespace, Collection<String> tags, String prefix) {
        validateRawKey(rawKey);
        String ns = namespace == null || namespace.isBlank() ? DEFAULT_NAMESPACE : namespace.trim();
        if (ns.indexOf(SEPARATOR) >= 0) {
            throw new InvalidCacheKeyException("Namespace must not contain ':' : " + ns);
        }
        String pfx = prefix == null || prefix.isBlank() ? null : prefix.trim();
        return new CacheKey(rawKey, ns, normalizeTags(tags), pfx);
    }

    // ==================== 业务分类 Key ====================

    /**
     * IP 信誉查询
     */
    public static CacheKey forIpReputation(String ipAddress) {
        return of("ip:" + ipAddress, "ip_reputation", Set.of("ip_reputation", "security"));
    }

    /**
     * 地理位置数据
     */
    public static CacheKey forGeolocation(String ipAddress) {
        return of("geo:" + ipAddress, "geolocation", Set.of("geolocation", "ip_data"));
    }

    /**
     * 垃圾内容模式（identifier 为空时表示该类型的整个模式列表）
     */
    public static CacheKey forSpamPattern(String type, String identifier) {
        String key = identifier == null ? "patterns:" + type : "pattern:" + type + ":" + identifier;
        return of(key, "spam_patterns", Set.of("spam_patterns", "detection", type));
    }

    public static CacheKey forConfiguration(String configKey) {
        return of("config:" + configKey, "configuration", Set.of("configuration", "settings"));
    }

    public static CacheKey forAnalytics(String metric, String... dimensions) {
        StringBuilder key = new StringBuilder("analytics:").append(metric);
        for (String dimension : dimensions) {
            key.append(SEPARATOR).append(dimension);
        }
        return of(key.toString(), "analytics", Set.of("analytics", "metrics", metric));
    }

    /**
     * 由存储地址还原 Key（用于从后端重建索引，标签信息无法还原）
     *
     * @param knownPrefix 当前配置的全局前缀，可为 null
     */
    public static CacheKey parse(String address, String knownPrefix) {
        String rest = address;
        String pfx = null;
        if (knownPrefix != null && !knownPrefix.isBlank() && address.startsWith(knownPrefix + SEPARATOR)) {
            pfx = knownPrefix;
            rest = address.substring(knownPrefix.length() + 1);
        }
        int idx = rest.indexOf(SEPARATOR);
        if (idx <= 0 || idx == rest.length() - 1) {
            return of(rest, null, null, pfx);
        }
        return of(rest.substring(idx + 1), rest.substring(0, idx), null, pfx);
    }

    // ==================== 派生 ====================

    public CacheKey withTags(Collection<String> extraTags) {
        if (extraTags == null || extraTags.isEmpty()) {
            return this;
        }
        Set<String> merged = new LinkedHashSet<>(tags);
        merged.addAll(extraTags);
        return new CacheKey(rawKey, namespace, normalizeTags(merged), prefix);
    }

    public CacheKey withPrefix(String newPrefix) {
        return of(rawKey, namespace, tags, newPrefix);
    }

    public CacheKey withNamespace(String newNamespace) {
        return of(rawKey, newNamespace, tags, prefix);
    }

    public String rawKey() {
        return rawKey;
    }

    public String namespace() {
        return namespace;
    }

    public Set<String> tags() {
        return tags;
    }

    public String prefix() {
        return prefix;
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }

    /**
     * 规范化存储地址
     */
    @Override
    public String toString() {
        return address;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CacheKey)) return false;
        return address.equals(((CacheKey) o).address);
    }

    @Override
    public int hashCode() {
        return address.hashCode();
    }

    private static String buildAddress(String prefix, String namespace, String rawKey) {
        StringBuilder sb = new StringBuilder();
        if (prefix != null) {
            sb.append(prefix).append(SEPARATOR);
        }
        return sb.append(namespace).append(SEPARATOR).append(rawKey).toString();
    }

    private static void validateRawKey(String rawKey) {
        if (rawKey == null || rawKey.isEmpty()) {
            throw new InvalidCacheKeyException("Cache key must not be empty");
        }
        for (int i = 0; i < rawKey.length(); i++) {
            char c = rawKey.charAt(i);
            if (Character.isWhitespace(c) || Character.isISOControl(c)) {
                throw new InvalidCacheKeyException("Cache key contains whitespace or control characters: '" + rawKey + "'");
            }
        }
    }

    private static Set<String> normalizeTags(Collection<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return Collections.emptySet();
        }
        Set<String> result = new LinkedHashSet<>();
        for (String tag : tags) {
            if (tag != null && !tag.isBlank()) {
                result.add(tag.trim());
            }
        }
        return Collections.unmodifiableSet(result);
    }
}
