package org.replikativ.chunkcache.spring;

import org.replikativ.chunkcache.CacheConfig;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for {@link ChunkCacheAutoConfiguration}.
 *
 * <p>Unset values fall back to the {@link CacheConfig} defaults.</p>
 */
@ConfigurationProperties(prefix = "chunkcache")
public class ChunkCacheProperties {

    private Integer chunkSize;
    private Integer maxCachedChunks;
    private Integer preloadRadius;
    private Integer priorityLevels;
    private Integer loadingBatchSize;
    private Long loadingDelayMs;
    private Long unloadThresholdMs;
    private Long saveIntervalMs;

    /**
     * Drain the load queue on a background thread.
     */
    private boolean autoDrain = true;

    /**
     * Run an auto-save task every {@code save-interval-ms}.
     */
    private boolean autoSave = false;

    public Integer getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(Integer chunkSize) {
        this.chunkSize = chunkSize;
    }

    public Integer getMaxCachedChunks() {
        return maxCachedChunks;
    }

    public void setMaxCachedChunks(Integer maxCachedChunks) {
        this.maxCachedChunks = maxCachedChunks;
    }

    public Integer getPreloadRadius() {
        return preloadRadius;
    }

    public void setPreloadRadius(Integer preloadRadius) {
        this.preloadRadius = preloadRadius;
    }

    public Integer getPriorityLevels() {
        return priorityLevels;
    }

    public void setPriorityLevels(Integer priorityLevels) {
        this.priorityLevels = priorityLevels;
    }

    public Integer getLoadingBatchSize() {
        return loadingBatchSize;
    }

    public void setLoadingBatchSize(Integer loadingBatchSize) {
        this.loadingBatchSize = loadingBatchSize;
    }

    public Long getLoadingDelayMs() {
        return loadingDelayMs;
    }

    public void setLoadingDelayMs(Long loadingDelayMs) {
        this.loadingDelayMs = loadingDelayMs;
    }

    public Long getUnloadThresholdMs() {
        return unloadThresholdMs;
    }

    public void setUnloadThresholdMs(Long unloadThresholdMs) {
        this.unloadThresholdMs = unloadThresholdMs;
    }

    public Long getSaveIntervalMs() {
        return saveIntervalMs;
    }

    public void setSaveIntervalMs(Long saveIntervalMs) {
        this.saveIntervalMs = saveIntervalMs;
    }

    public boolean isAutoDrain() {
        return autoDrain;
    }

    public void setAutoDrain(boolean autoDrain) {
        this.autoDrain = autoDrain;
    }

    public boolean isAutoSave() {
        return autoSave;
    }

    public void setAutoSave(boolean autoSave) {
        this.autoSave = autoSave;
    }

    /**
     * Build a validated {@link CacheConfig} from the bound values.
     */
    public CacheConfig toCacheConfig() {
        CacheConfig.Builder builder = CacheConfig.builder();
        if (chunkSize != null) {
            builder.chunkSize(chunkSize);
        }
        if (maxCachedChunks != null) {
            builder.maxCachedChunks(maxCachedChunks);
        }
        if (preloadRadius != null) {
            builder.preloadRadius(preloadRadius);
        }
        if (priorityLevels != null) {
            builder.priorityLevels(priorityLevels);
        }
        if (loadingBatchSize != null) {
            builder.loadingBatchSize(loadingBatchSize);
        }
        if (loadingDelayMs != null) {
            builder.loadingDelayMs(loadingDelayMs);
        }
        if (unloadThresholdMs != null) {
            builder.unloadThresholdMs(unloadThresholdMs);
        }
        if (saveIntervalMs != null) {
            builder.saveIntervalMs(saveIntervalMs);
        }
        return builder.build();
    }
}
