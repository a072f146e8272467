package org.replikativ.chunkcache;

/**
 * A lifecycle notification emitted by {@link ChunkCache}.
 *
 * <p>Events are observability only: they describe what already happened and
 * carry no way to change cache state.</p>
 *
 * @param <T> chunk payload type
 */
public final class CacheEvent<T> {

    /**
     * Event kinds.
     */
    public enum Type {
        /** A fetch resolved and the chunk entered the table. */
        CHUNK_LOADED,
        /** An entry left the table (capacity eviction, explicit evict or stale unload). */
        CHUNK_EVICTED,
        /** A chunk was written to the backend and is clean again. */
        CHUNK_SAVED,
        /** A fetch or write for a key failed. */
        CHUNK_ERROR,
        /** The table was cleared. */
        CACHE_CLEARED,
        /** A drain step of the load queue completed. */
        QUEUE_PROCESSED
    }

    private final Type type;
    private final ChunkKey key;
    private final T chunk;
    private final String message;
    private final int count;
    private final int remaining;

    private CacheEvent(Type type, ChunkKey key, T chunk, String message, int count, int remaining) {
        this.type = type;
        this.key = key;
        this.chunk = chunk;
        this.message = message;
        this.count = count;
        this.remaining = remaining;
    }

    static <T> CacheEvent<T> loaded(ChunkKey key, T chunk) {
        return new CacheEvent<>(Type.CHUNK_LOADED, key, chunk, null, 0, 0);
    }

    static <T> CacheEvent<T> evicted(ChunkKey key) {
        return new CacheEvent<>(Type.CHUNK_EVICTED, key, null, null, 0, 0);
    }

    static <T> CacheEvent<T> saved(ChunkKey key) {
        return new CacheEvent<>(Type.CHUNK_SAVED, key, null, null, 0, 0);
    }

    static <T> CacheEvent<T> error(ChunkKey key, String message) {
        return new CacheEvent<>(Type.CHUNK_ERROR, key, null, message, 0, 0);
    }

    static <T> CacheEvent<T> cleared(int count) {
        return new CacheEvent<>(Type.CACHE_CLEARED, null, null, null, count, 0);
    }

    static <T> CacheEvent<T> queueProcessed(int processed, int remaining) {
        return new CacheEvent<>(Type.QUEUE_PROCESSED, null, null, null, processed, remaining);
    }

    public Type getType() {
        return type;
    }

    /**
     * @return the affected key, or null for {@code CACHE_CLEARED} and {@code QUEUE_PROCESSED}
     */
    public ChunkKey getKey() {
        return key;
    }

    /**
     * @return the loaded chunk for {@code CHUNK_LOADED}, otherwise null
     */
    public T getChunk() {
        return chunk;
    }

    /**
     * @return the failure message for {@code CHUNK_ERROR}, otherwise null
     */
    public String getMessage() {
        return message;
    }

    /**
     * Cleared entries for {@code CACHE_CLEARED}, processed keys for {@code QUEUE_PROCESSED}.
     */
    public int getCount() {
        return count;
    }

    /**
     * Keys still queued for {@code QUEUE_PROCESSED}.
     */
    public int getRemaining() {
        return remaining;
    }

    @Override
    public String toString() {
        switch (type) {
            case CACHE_CLEARED:
                return "CacheEvent{" + type + ", count=" + count + "}";
            case QUEUE_PROCESSED:
                return "CacheEvent{" + type + ", processed=" + count + ", remaining=" + remaining + "}";
            case CHUNK_ERROR:
                return "CacheEvent{" + type + ", key=" + key + ", message=" + message + "}";
            default:
                return "CacheEvent{" + type + ", key=" + key + "}";
        }
    }
}
