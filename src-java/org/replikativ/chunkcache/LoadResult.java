package org.replikativ.chunkcache;

import java.util.Objects;

/**
 * Result of a cache lookup: either a hit carrying the chunk or a pending marker.
 *
 * @param <T> chunk payload type
 */
public final class LoadResult<T> {

    private static final LoadResult<?> PENDING = new LoadResult<>(LoadStatus.PENDING, null);

    private final LoadStatus status;
    private final T chunk;

    private LoadResult(LoadStatus status, T chunk) {
        this.status = status;
        this.chunk = chunk;
    }

    static <T> LoadResult<T> hit(T chunk) {
        return new LoadResult<>(LoadStatus.HIT, Objects.requireNonNull(chunk, "chunk"));
    }

    @SuppressWarnings("unchecked")
    static <T> LoadResult<T> pending() {
        return (LoadResult<T>) PENDING;
    }

    public LoadStatus getStatus() {
        return status;
    }

    public boolean isHit() {
        return status == LoadStatus.HIT;
    }

    public boolean isPending() {
        return status == LoadStatus.PENDING;
    }

    /**
     * Get the chunk of a hit.
     *
     * @return the chunk (a snapshot if the cache was built with a snapshot function)
     * @throws IllegalStateException if the result is pending
     */
    public T getChunk() {
        if (chunk == null) {
            throw new IllegalStateException("Chunk is still loading");
        }
        return chunk;
    }

    @Override
    public String toString() {
        return isHit() ? "LoadResult{HIT, chunk=" + chunk + "}" : "LoadResult{PENDING}";
    }
}
