package org.replikativ.chunkcache;

/**
 * Outcome of {@link ChunkCache#getOrLoad(ChunkKey)}.
 */
public enum LoadStatus {

    /** The chunk was cached and is returned with the result. */
    HIT,

    /**
     * The chunk is not cached yet. It is either queued or being fetched; the
     * caller must not enqueue it again and will see a {@code CHUNK_LOADED} or
     * {@code CHUNK_ERROR} event once the fetch resolves.
     */
    PENDING
}
