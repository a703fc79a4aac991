package com.formsecurity.cache.repository;

import com.formsecurity.cache.exception.CacheLevelUnavailableException;
import com.formsecurity.cache.model.CacheLevel;
import com.formsecurity.cache.support.CacheTestFixtures;
import com.formsecurity.cache.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * 仓库注册表单元测试
 */
class CacheRepositoryRegistryTest {

    private final MutableClock clock = new MutableClock();
    private final RequestLevelCacheRepository request =
        new RequestLevelCacheRepository(CacheTestFixtures.serializer(), clock);

    @Test
    @DisplayName("未配置的层级登记为不可用")
    void testMissingLevelsUnavailable() {
        CacheRepositoryRegistry registry = new CacheRepositoryRegistry(List.of(request));

        assertTrue(registry.isAvailable(CacheLevel.REQUEST));
        assertFalse(registry.isAvailable(CacheLevel.MEMORY));
        assertEquals(Set.of(CacheLevel.MEMORY, CacheLevel.DATABASE), registry.getUnavailableLevels());
        assertThrows(CacheLevelUnavailableException.class, () -> registry.require(CacheLevel.DATABASE));
        assertNull(registry.find(CacheLevel.MEMORY));
    }

    @Test
    @DisplayName("探活失败的层级不可用，恢复后 recheck 重新启用")
    void testPingFailureAndRecovery() {
        CacheRepository database = mock(CacheRepository.class);
        when(database.level()).thenReturn(CacheLevel.DATABASE);
        doThrow(new IllegalStateException("down")).doNothing().when(database).ping();

        CacheRepositoryRegistry registry = new CacheRepositoryRegistry(List.of(request, database));
        assertFalse(registry.isAvailable(CacheLevel.DATABASE));
        assertSame(database, registry.find(CacheLevel.DATABASE));

        assertTrue(registry.recheck(CacheLevel.DATABASE));
        assertTrue(registry.isAvailable(CacheLevel.DATABASE));
        assertSame(database, registry.require(CacheLevel.DATABASE));
    }

    @Test
    @DisplayName("同一层级重复注册被拒绝")
    void testDuplicateLevel() {
        RequestLevelCacheRepository other = new RequestLevelCacheRepository(CacheTestFixtures.serializer(), clock);

        assertThrows(IllegalArgumentException.class, () -> new CacheRepositoryRegistry(List.of(request, other)));
    }
}
