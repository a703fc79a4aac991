package com.formsecurity.cache.integration;

import com.formsecurity.cache.model.CacheKey;
import com.formsecurity.cache.model.CacheLevel;
import com.formsecurity.cache.service.CacheOperationService;
import org.junit.jupiter.api.*;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * 缓存管理接口集成测试（Caffeine + H2）
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class CacheAdminIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private CacheOperationService cacheOperationService;

    @AfterEach
    void tearDown() {
        cacheOperationService.enableAllLevels();
        cacheOperationService.endRequest();
    }

    @Test
    @Order(1)
    @DisplayName("健康检查：三层均可用")
    void testHealth() throws Exception {
        mockMvc.perform(get("/actuator/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.components.formSecurityCache.status").value("UP"))
            .andExpect(jsonPath("$.components.formSecurityCache.details.database.status").value("UP"));
    }

    @Test
    @Order(2)
    @DisplayName("写入后通过接口删除单个 Key")
    void testInvalidateKey() throws Exception {
        CacheKey key = CacheKey.of("198.51.100.9", "ip_reputation");
        assertTrue(cacheOperationService.put(key, Map.of("score", 80), 300L));
        assertNotNull(cacheOperationService.getFromDatabase(key));

        mockMvc.perform(delete("/api/cache/admin/keys/198.51.100.9").param("namespace", "ip_reputation"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.code").value(0))
            .andExpect(jsonPath("$.data").value(true));

        assertNull(cacheOperationService.getFromDatabase(key));
        assertNull(cacheOperationService.getFromMemory(key));
    }

    @Test
    @Order(3)
    @DisplayName("按命名空间失效")
    void testInvalidateNamespace() throws Exception {
        cacheOperationService.put(CacheKey.of("a", "spam_patterns"), "p1", 300L);
        cacheOperationService.put(CacheKey.of("b", "spam_patterns"), "p2", 300L);

        mockMvc.perform(post("/api/cache/admin/invalidate/namespace/spam_patterns"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data").value(2));

        assertFalse(cacheOperationService.has(CacheKey.of("a", "spam_patterns")));
    }

    @Test
    @Order(4)
    @DisplayName("关闭 DATABASE 层后写入不落库")
    void testToggleLevel() throws Exception {
        mockMvc.perform(put("/api/cache/admin/levels/database").param("enabled", "false"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.enabled").value(false));

        CacheKey key = CacheKey.of("toggle", "configuration");
        assertTrue(cacheOperationService.put(key, "v", 60L));
        assertEquals("v", cacheOperationService.getFromMemory(key));

        mockMvc.perform(put("/api/cache/admin/levels/database").param("enabled", "true"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.enabled").value(true));
        assertNull(cacheOperationService.getFromDatabase(key));
    }

    @Test
    @Order(5)
    @DisplayName("维护：默认执行 cleanup 与 optimize")
    void testMaintenance() throws Exception {
        mockMvc.perform(post("/api/cache/admin/maintenance"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.summary.totalOperations").value(2))
            .andExpect(jsonPath("$.data.operations[0].operation").value("cleanup"))
            .andExpect(jsonPath("$.data.operations[0].success").value(true));
    }

    @Test
    @Order(6)
    @DisplayName("统计快照与层级状态")
    void testStatsAndLevels() throws Exception {
        mockMvc.perform(get("/api/cache/admin/stats").param("levels", "memory", "database"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.efficiencyScore").isNumber());

        mockMvc.perform(get("/api/cache/admin/levels"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.MEMORY.enabled").value(true));

        List<CacheLevel> enabled = cacheOperationService.getEnabledLevels();
        assertEquals(3, enabled.size());
    }
}
