package com.formsecurity.cache.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 批量失效汇总事件，每次 pattern / tag / namespace 调用发布一次
 *
 * @param type     pattern | tags | namespace
 * @param criteria 匹配条件（模式串、标签列表或命名空间）
 * @param levels   作用层级，null 表示全部层级
 * @param count    实际移除的不同 Key 数量
 */
public record BulkInvalidationEvent(String type,
                                    String criteria,
                                    Set<CacheLevel> levels,
                                    int count,
                                    Instant timestamp) {

    public BulkInvalidationEvent {
        levels = levels == null ? null : Collections.unmodifiableSet(new LinkedHashSet<>(levels));
    }
}
