package com.formsecurity.cache.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 一次失效调用的结果
 *
 * @param removed 成功移除的 Key
 * @param failed  至少一个层级删除失败的 Key
 */
public record InvalidationOutcome(Set<CacheKey> removed, Set<CacheKey> failed) {

    public static final InvalidationOutcome EMPTY = new InvalidationOutcome(Set.of(), Set.of());

    public InvalidationOutcome {
        removed = Collections.unmodifiableSet(new LinkedHashSet<>(removed));
        failed = Collections.unmodifiableSet(new LinkedHashSet<>(failed));
    }

    public boolean success() {
        return failed.isEmpty();
    }

    public int count() {
        return removed.size();
    }

    public InvalidationOutcome merge(InvalidationOutcome other) {
        Set<CacheKey> r = new LinkedHashSet<>(removed);
        r.addAll(other.removed);
        Set<CacheKey> f = new LinkedHashSet<>(failed);
        f.addAll(other.failed);
        return new InvalidationOutcome(r, f);
    }
}
