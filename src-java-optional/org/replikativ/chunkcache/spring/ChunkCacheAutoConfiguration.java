package org.replikativ.chunkcache.spring;

import org.replikativ.chunkcache.AutoSaver;
import org.replikativ.chunkcache.CacheConfig;
import org.replikativ.chunkcache.ChunkCache;
import org.replikativ.chunkcache.ResourceBackend;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot auto-configuration for {@link ChunkCache}.
 *
 * <p>Always exposes a {@link CacheConfig}. A cache is created when the context
 * holds a {@link ResourceBackend}; an {@link AutoSaver} when
 * {@code chunkcache.auto-save=true}. The cache is flushed on shutdown.</p>
 */
@AutoConfiguration
@ConditionalOnClass(ChunkCache.class)
@EnableConfigurationProperties(ChunkCacheProperties.class)
public class ChunkCacheAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public CacheConfig chunkCacheConfig(ChunkCacheProperties props) {
        return props.toCacheConfig();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnBean(ResourceBackend.class)
    @ConditionalOnMissingBean(ChunkCache.class)
    public ChunkCache<?> chunkCache(ResourceBackend<?> backend, CacheConfig config, ChunkCacheProperties props) {
        return create(backend, config, props.isAutoDrain());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnBean(ChunkCache.class)
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "chunkcache", name = "auto-save", havingValue = "true")
    public AutoSaver chunkCacheAutoSaver(ChunkCache<?> cache, CacheConfig config) {
        return AutoSaver.start(cache, config.getSaveIntervalMs());
    }

    private static <T> ChunkCache<T> create(ResourceBackend<T> backend, CacheConfig config, boolean autoDrain) {
        return ChunkCache.builder(backend)
            .config(config)
            .autoDrain(autoDrain)
            .build();
    }
}
