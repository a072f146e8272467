package org.replikativ.chunkcache;

import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CacheConfig")
class CacheConfigTest {

    @Test
    @DisplayName("defaults")
    void testDefaults() {
        CacheConfig config = CacheConfig.defaults();
        assertEquals(16, config.getChunkSize());
        assertEquals(64, config.getMaxCachedChunks());
        assertEquals(2, config.getPreloadRadius());
        assertEquals(3, config.getPriorityLevels());
        assertEquals(4, config.getLoadingBatchSize());
        assertEquals(1000, config.getLoadingDelayMs());
        assertEquals(300_000, config.getUnloadThresholdMs());
        assertEquals(60_000, config.getSaveIntervalMs());
    }

    @Test
    @DisplayName("toBuilder() keeps unchanged values")
    void testToBuilder() {
        CacheConfig base = CacheConfig.builder().chunkSize(32).maxCachedChunks(10).build();
        CacheConfig derived = base.toBuilder().preloadRadius(5).build();
        assertEquals(32, derived.getChunkSize());
        assertEquals(10, derived.getMaxCachedChunks());
        assertEquals(5, derived.getPreloadRadius());
    }

    @Test
    @DisplayName("out-of-range values are rejected")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> CacheConfig.builder().chunkSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> CacheConfig.builder().maxCachedChunks(0).build());
        assertThrows(IllegalArgumentException.class, () -> CacheConfig.builder().preloadRadius(-1).build());
        assertThrows(IllegalArgumentException.class, () -> CacheConfig.builder().priorityLevels(0).build());
        assertThrows(IllegalArgumentException.class, () -> CacheConfig.builder().loadingBatchSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> CacheConfig.builder().loadingDelayMs(-1).build());
        assertThrows(IllegalArgumentException.class, () -> CacheConfig.builder().unloadThresholdMs(-1).build());
        assertThrows(IllegalArgumentException.class, () -> CacheConfig.builder().saveIntervalMs(0).build());
    }

    @Test
    @DisplayName("radius 0 and a single tier are allowed")
    void testEdgeValues() {
        CacheConfig config = CacheConfig.builder().preloadRadius(0).priorityLevels(1).loadingDelayMs(0).build();
        assertEquals(0, config.getPreloadRadius());
        assertEquals(1, config.getPriorityLevels());
    }
}
