package com.formsecurity.cache.constant;

/**
 * 缓存常量
 */
public final class CacheConstants {

    private CacheConstants() {
    }

    // ==================== 操作名（用于降级策略注册） ====================
    public static final String OP_GET = "get";
    public static final String OP_PUT = "put";
    public static final String OP_FORGET = "forget";
    public static final String OP_HAS = "has";
    public static final String OP_ADD = "add";
    public static final String OP_FLUSH = "flush";

    // ==================== 维护操作 ====================
    public static final String MAINT_CLEANUP = "cleanup";
    public static final String MAINT_OPTIMIZE = "optimize";
    public static final String MAINT_VACUUM = "vacuum";
    public static final String MAINT_REINDEX = "reindex";
    public static final String MAINT_VALIDATE = "validate";

    /** 维护自检使用的校验 Key 前缀 */
    public static final String SAMPLE_KEY_PREFIX = "__maintenance_sample_";
    public static final String SAMPLE_NAMESPACE = "maintenance";

    // ==================== 失效原因 ====================
    public static final String REASON_MANUAL = "manual";
    public static final String REASON_PATTERN = "pattern";
    public static final String REASON_TAGS = "tags";
    public static final String REASON_NAMESPACE = "namespace";
    public static final String REASON_DEPENDENCY = "dependency";

    // ==================== 指标 ====================
    public static final String METRIC_HITS = "form.security.cache.hits";
    public static final String METRIC_MISSES = "form.security.cache.misses";
    public static final String METRIC_PUTS = "form.security.cache.puts";
    public static final String METRIC_DELETES = "form.security.cache.deletes";
    public static final String METRIC_RESPONSE_TIME = "form.security.cache.response.time.avg";

    /** 审计日志 Logger 名称 */
    public static final String AUDIT_LOGGER = "form-security.cache.audit";
}
