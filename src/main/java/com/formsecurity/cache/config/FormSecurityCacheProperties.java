package com.formsecurity.cache.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 表单安全缓存配置属性
 * 核心服务只接收已绑定好的静态对象，不直接读取配置文件
 */
@Data
@ConfigurationProperties(prefix = "form-security.cache")
public class FormSecurityCacheProperties {

    /** 全局 Key 前缀（环境 / 租户隔离） */
    private String prefix;

    /** 各层级开关 */
    private Levels levels = new Levels();

    /** MEMORY 层配置 */
    private Memory memory = new Memory();

    /** DATABASE 层配置 */
    private Database database = new Database();

    /** 按数据类别的 TTL（秒），key 为命名空间 */
    private Map<String, Long> ttl = defaultCategoryTtls();

    /** 维护配置 */
    private Maintenance maintenance = new Maintenance();

    /** 性能目标 */
    private Performance performance = new Performance();

    /** 容量限制 */
    private Capacity capacity = new Capacity();

    /** 自检配置 */
    private Validation validation = new Validation();

    /** 预热配置 */
    private Warming warming = new Warming();

    /** 安全策略 */
    private Security security = new Security();

    /** 熔断配置 */
    private Resilience resilience = new Resilience();

    @Data
    public static class Levels {
        private boolean requestEnabled = true;
        private boolean memoryEnabled = true;
        private boolean databaseEnabled = true;
    }

    @Data
    public static class Memory {
        /** 驱动：caffeine | redis */
        private String driver = "caffeine";
        /** Caffeine 最大条目数 */
        private long maxSize = 100_000;
        /** Caffeine 初始容量 */
        private int initialCapacity = 1000;
        /** Redis Key 前缀 */
        private String redisKeyPrefix = "fsc:";
    }

    @Data
    public static class Database {
        /** 缓存表名 */
        private String table = "form_security_cache";
        /** cache_value 列类型（H2 / Oracle 用 CLOB，MySQL 用 LONGTEXT，PostgreSQL 用 TEXT） */
        private String valueColumnType = "CLOB";
        /** 启动时自动建表 */
        private boolean createTable = true;
        /** optimize 时执行的语句 */
        private List<String> optimizeStatements = new ArrayList<>();
        /** vacuum 时执行的语句 */
        private List<String> vacuumStatements = new ArrayList<>();
    }

    @Data
    public static class Maintenance {
        /** 超过此 Key 数量建议 cleanup */
        private long maxKeys = 10_000;
        /** 超过此大小（MB）建议 vacuum */
        private long maxSizeMb = 100;
        /** 定时清理过期条目 */
        private boolean autoCleanup = false;
        /** 定时清理 cron */
        private String cleanupCron = "0 */10 * * * *";
    }

    @Data
    public static class Performance {
        /** MEMORY 层响应时间上限（毫秒） */
        private double memoryResponseTimeMs = 5.0;
        /** DATABASE 层响应时间上限（毫秒） */
        private double databaseResponseTimeMs = 20.0;
        /** 最小吞吐（次/分钟） */
        private long minThroughputPerMinute = 10_000;
        /** 最小命中率 */
        private double minHitRatio = 0.85;
        /** 效率评分的基准响应时间（毫秒） */
        private double referenceResponseTimeMs = 5.0;
    }

    @Data
    public static class Capacity {
        /** 总容量上限（MB） */
        private long totalLimitMb = 10 * 1024;
        /** REQUEST 层上限（MB） */
        private long requestLimitMb = 64;
        /** MEMORY 层上限（MB） */
        private long memoryLimitMb = 8 * 1024;
        /** DATABASE 层上限（MB） */
        private long databaseLimitMb = 2 * 1024;
        /** 告警阈值（百分比） */
        private double warningThreshold = 75.0;
        /** 严重阈值（百分比） */
        private double criticalThreshold = 90.0;
    }

    @Data
    public static class Validation {
        /** 压测最长持续时间（秒），调用方传入的值会被截断到此上限 */
        private int maxLoadTestSeconds = 30;
        /** 压测线程数 */
        private int loadTestThreads = 8;
        /** 性能自检采样次数 */
        private int performanceSamples = 50;
    }

    @Data
    public static class Warming {
        private int batchSize = 50;
        private long timeoutSeconds = 30;
    }

    @Data
    public static class Security {
        private boolean enabled = false;
        private boolean auditLogging = true;
        private long maxValueSizeBytes = 10L * 1024 * 1024;
        /** 操作名 -> 每窗口允许次数 */
        private Map<String, Integer> rateLimits = defaultRateLimits();
        /** 限流窗口（秒） */
        private long rateLimitWindowSeconds = 60;
    }

    @Data
    public static class Resilience {
        private boolean enabled = true;
        private float failureRateThreshold = 50.0f;
        private int minimumCalls = 20;
        private long waitDurationInOpenStateSeconds = 30;
    }

    public long ttlFor(String namespace, long fallback) {
        Long value = ttl.get(namespace);
        return value != null ? value : fallback;
    }

    private static Map<String, Long> defaultCategoryTtls() {
        Map<String, Long> ttls = new LinkedHashMap<>();
        ttls.put("spam_patterns", 86_400L);
        ttls.put("ip_reputation", 3_600L);
        ttls.put("rate_limits", 3_600L);
        ttls.put("geolocation", 604_800L);
        ttls.put("configuration", 1_800L);
        ttls.put("statistics", 300L);
        ttls.put("analysis_results", 1_800L);
        return ttls;
    }

    private static Map<String, Integer> defaultRateLimits() {
        Map<String, Integer> limits = new LinkedHashMap<>();
        limits.put("get", 1000);
        limits.put("put", 100);
        limits.put("forget", 50);
        return limits;
    }
}
