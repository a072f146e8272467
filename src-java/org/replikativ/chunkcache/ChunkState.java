package org.replikativ.chunkcache;

/**
 * Lifecycle state of a single key as seen by the cache.
 *
 * <p>{@code ABSENT -> QUEUED -> LOADING -> CACHED_CLEAN <-> CACHED_DIRTY -> ABSENT}.
 * A failed fetch returns the key to {@code ABSENT}.</p>
 */
public enum ChunkState {
    ABSENT,
    QUEUED,
    LOADING,
    CACHED_CLEAN,
    CACHED_DIRTY;

    public boolean isCached() {
        return this == CACHED_CLEAN || this == CACHED_DIRTY;
    }
}
