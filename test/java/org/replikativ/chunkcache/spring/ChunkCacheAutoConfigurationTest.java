package org.replikativ.chunkcache.spring;

import org.junit.jupiter.api.*;
import org.replikativ.chunkcache.AutoSaver;
import org.replikativ.chunkcache.CacheConfig;
import org.replikativ.chunkcache.ChunkCache;
import org.replikativ.chunkcache.ResourceBackend;
import org.replikativ.chunkcache.ResourceNotFoundException;

import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ChunkCacheAutoConfiguration")
class ChunkCacheAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(ChunkCacheAutoConfiguration.class));

    static class MapBackend implements ResourceBackend<String> {
        final Map<String, String> chunks = new ConcurrentHashMap<>();

        @Override
        public String fetch(String ownerId, int x, int y) {
            String chunk = chunks.get(ownerId + ":" + x + ":" + y);
            if (chunk == null) {
                throw new ResourceNotFoundException("No chunk " + ownerId + ":" + x + ":" + y);
            }
            return chunk;
        }

        @Override
        public void persist(String ownerId, int x, int y, String chunk) {
            chunks.put(ownerId + ":" + x + ":" + y, chunk);
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class BackendConfig {
        @Bean
        ResourceBackend<String> backend() {
            return new MapBackend();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomCacheConfig {
        @Bean
        ChunkCache<String> customCache() {
            return ChunkCache.builder(new MapBackend())
                .config(CacheConfig.builder().maxCachedChunks(3).build())
                .build();
        }
    }

    @Test
    @DisplayName("without a backend only the config is exposed")
    void testNoBackend() {
        runner.run(context -> {
            assertThat(context).hasSingleBean(CacheConfig.class);
            assertThat(context).doesNotHaveBean(ChunkCache.class);
            assertThat(context).doesNotHaveBean(AutoSaver.class);
            assertThat(context.getBean(CacheConfig.class).getMaxCachedChunks())
                .isEqualTo(CacheConfig.DEFAULT_MAX_CACHED_CHUNKS);
        });
    }

    @Test
    @DisplayName("properties are bound onto the cache config")
    void testProperties() {
        runner.withUserConfiguration(BackendConfig.class)
            .withPropertyValues(
                "chunkcache.max-cached-chunks=12",
                "chunkcache.preload-radius=4",
                "chunkcache.loading-delay-ms=250")
            .run(context -> {
                assertThat(context).hasSingleBean(ChunkCache.class);
                CacheConfig config = context.getBean(ChunkCache.class).getConfig();
                assertThat(config.getMaxCachedChunks()).isEqualTo(12);
                assertThat(config.getPreloadRadius()).isEqualTo(4);
                assertThat(config.getLoadingDelayMs()).isEqualTo(250L);
                assertThat(config.getChunkSize()).isEqualTo(CacheConfig.DEFAULT_CHUNK_SIZE);
            });
    }

    @Test
    @DisplayName("invalid values fail the context")
    void testInvalidProperties() {
        runner.withPropertyValues("chunkcache.max-cached-chunks=0")
            .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("auto-save is opt-in")
    void testAutoSave() {
        runner.withUserConfiguration(BackendConfig.class)
            .run(context -> assertThat(context).doesNotHaveBean(AutoSaver.class));

        runner.withUserConfiguration(BackendConfig.class)
            .withPropertyValues("chunkcache.auto-save=true", "chunkcache.save-interval-ms=5000")
            .run(context -> {
                assertThat(context).hasSingleBean(AutoSaver.class);
                assertThat(context.getBean(AutoSaver.class).isRunning()).isTrue();
            });
    }

    @Test
    @DisplayName("a user-defined cache takes precedence")
    void testBacksOff() {
        runner.withUserConfiguration(BackendConfig.class, CustomCacheConfig.class)
            .run(context -> {
                assertThat(context).hasSingleBean(ChunkCache.class);
                assertThat(context.getBean(ChunkCache.class).getConfig().getMaxCachedChunks()).isEqualTo(3);
            });
    }

    @Test
    @DisplayName("the cache is closed with the context")
    void testClosedOnShutdown() {
        ChunkCache<?>[] cache = new ChunkCache<?>[1];
        runner.withUserConfiguration(BackendConfig.class)
            .run(context -> {
                cache[0] = context.getBean(ChunkCache.class);
                assertThat(cache[0].isClosed()).isFalse();
            });
        assertThat(cache[0].isClosed()).isTrue();
    }
}
