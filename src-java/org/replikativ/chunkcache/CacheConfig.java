package org.replikativ.chunkcache;

/**
 * Configuration for a {@link ChunkCache}.
 *
 * <p>This is an immutable record of the settings a cache is created with.
 * Use {@link #builder()} to construct one; unset values keep their defaults.</p>
 */
public final class CacheConfig {

    public static final int DEFAULT_CHUNK_SIZE = 16;
    public static final int DEFAULT_MAX_CACHED_CHUNKS = 64;
    public static final int DEFAULT_PRELOAD_RADIUS = 2;
    public static final int DEFAULT_PRIORITY_LEVELS = 3;
    public static final int DEFAULT_LOADING_BATCH_SIZE = 4;
    public static final long DEFAULT_LOADING_DELAY_MS = 1000;
    public static final long DEFAULT_UNLOAD_THRESHOLD_MS = 300_000;
    public static final long DEFAULT_SAVE_INTERVAL_MS = 60_000;

    private static final CacheConfig DEFAULTS = builder().build();

    private final int chunkSize;
    private final int maxCachedChunks;
    private final int preloadRadius;
    private final int priorityLevels;
    private final int loadingBatchSize;
    private final long loadingDelayMs;
    private final long unloadThresholdMs;
    private final long saveIntervalMs;

    CacheConfig(int chunkSize, int maxCachedChunks, int preloadRadius, int priorityLevels,
                int loadingBatchSize, long loadingDelayMs, long unloadThresholdMs, long saveIntervalMs) {
        this.chunkSize = chunkSize;
        this.maxCachedChunks = maxCachedChunks;
        this.preloadRadius = preloadRadius;
        this.priorityLevels = priorityLevels;
        this.loadingBatchSize = loadingBatchSize;
        this.loadingDelayMs = loadingDelayMs;
        this.unloadThresholdMs = unloadThresholdMs;
        this.saveIntervalMs = saveIntervalMs;
    }

    /**
     * Create a builder initialized with the default values.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a configuration holding only default values
     */
    public static CacheConfig defaults() {
        return DEFAULTS;
    }

    /** World units per chunk side, used to map world coordinates to chunk coordinates. */
    public int getChunkSize() { return chunkSize; }
    /** Capacity bound of the entry table. */
    public int getMaxCachedChunks() { return maxCachedChunks; }
    /** Square prefetch radius in chunks; also the distance at which priority saturates. */
    public int getPreloadRadius() { return preloadRadius; }
    /** Number of priority tiers; tier 0 is kept longest. */
    public int getPriorityLevels() { return priorityLevels; }
    /** Maximum number of fetches dispatched per drain step. */
    public int getLoadingBatchSize() { return loadingBatchSize; }
    /** Delay between drain steps while keys remain queued. */
    public long getLoadingDelayMs() { return loadingDelayMs; }
    /** Idle time after which an entry is considered stale. */
    public long getUnloadThresholdMs() { return unloadThresholdMs; }
    /** Period of the optional auto-save task. */
    public long getSaveIntervalMs() { return saveIntervalMs; }

    /**
     * Create a builder pre-populated with this configuration.
     */
    public Builder toBuilder() {
        return new Builder()
            .chunkSize(chunkSize)
            .maxCachedChunks(maxCachedChunks)
            .preloadRadius(preloadRadius)
            .priorityLevels(priorityLevels)
            .loadingBatchSize(loadingBatchSize)
            .loadingDelayMs(loadingDelayMs)
            .unloadThresholdMs(unloadThresholdMs)
            .saveIntervalMs(saveIntervalMs);
    }

    @Override
    public String toString() {
        return "CacheConfig{" +
               "chunkSize=" + chunkSize +
               ", maxCachedChunks=" + maxCachedChunks +
               ", preloadRadius=" + preloadRadius +
               ", priorityLevels=" + priorityLevels +
               ", loadingBatchSize=" + loadingBatchSize +
               ", loadingDelayMs=" + loadingDelayMs +
               ", unloadThresholdMs=" + unloadThresholdMs +
               ", saveIntervalMs=" + saveIntervalMs +
               '}';
    }

    /**
     * Builder for {@link CacheConfig}.
     */
    public static final class Builder {
        private int chunkSize = DEFAULT_CHUNK_SIZE;
        private int maxCachedChunks = DEFAULT_MAX_CACHED_CHUNKS;
        private int preloadRadius = DEFAULT_PRELOAD_RADIUS;
        private int priorityLevels = DEFAULT_PRIORITY_LEVELS;
        private int loadingBatchSize = DEFAULT_LOADING_BATCH_SIZE;
        private long loadingDelayMs = DEFAULT_LOADING_DELAY_MS;
        private long unloadThresholdMs = DEFAULT_UNLOAD_THRESHOLD_MS;
        private long saveIntervalMs = DEFAULT_SAVE_INTERVAL_MS;

        private Builder() {}

        public Builder chunkSize(int chunkSize) { this.chunkSize = chunkSize; return this; }
        public Builder maxCachedChunks(int max) { this.maxCachedChunks = max; return this; }
        public Builder preloadRadius(int radius) { this.preloadRadius = radius; return this; }
        public Builder priorityLevels(int levels) { this.priorityLevels = levels; return this; }
        public Builder loadingBatchSize(int size) { this.loadingBatchSize = size; return this; }
        public Builder loadingDelayMs(long ms) { this.loadingDelayMs = ms; return this; }
        public Builder unloadThresholdMs(long ms) { this.unloadThresholdMs = ms; return this; }
        public Builder saveIntervalMs(long ms) { this.saveIntervalMs = ms; return this; }

        /**
         * Validate and build the configuration.
         *
         * @throws IllegalArgumentException if a value is out of range
         */
        public CacheConfig build() {
            require(chunkSize > 0, "chunkSize must be positive");
            require(maxCachedChunks > 0, "maxCachedChunks must be positive");
            require(preloadRadius >= 0, "preloadRadius must not be negative");
            require(priorityLevels >= 1, "priorityLevels must be at least 1");
            require(loadingBatchSize > 0, "loadingBatchSize must be positive");
            require(loadingDelayMs >= 0, "loadingDelayMs must not be negative");
            require(unloadThresholdMs >= 0, "unloadThresholdMs must not be negative");
            require(saveIntervalMs > 0, "saveIntervalMs must be positive");
            return new CacheConfig(chunkSize, maxCachedChunks, preloadRadius, priorityLevels,
                                   loadingBatchSize, loadingDelayMs, unloadThresholdMs, saveIntervalMs);
        }

        private static void require(boolean condition, String message) {
            if (!condition) {
                throw new IllegalArgumentException(message);
            }
        }
    }
}
