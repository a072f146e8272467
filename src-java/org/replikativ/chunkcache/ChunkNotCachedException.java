package org.replikativ.chunkcache;

/**
 * Thrown when an operation requires a cached chunk but the key is not in the table.
 */
public class ChunkNotCachedException extends ChunkCacheException {

    private final ChunkKey key;

    /**
     * Create a new not-cached exception.
     *
     * @param key the key that was not cached
     */
    public ChunkNotCachedException(ChunkKey key) {
        super("Chunk not cached: " + key);
        this.key = key;
    }

    /**
     * Get the key that was not cached.
     *
     * @return chunk key
     */
    public ChunkKey getKey() {
        return key;
    }
}
