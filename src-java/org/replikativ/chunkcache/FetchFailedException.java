package org.replikativ.chunkcache;

/**
 * Thrown (or reported) when the backend could not fetch a chunk.
 *
 * <p>The key is removed from the load queue and is not retried automatically.
 * Use {@link #isNotFound()} to tell a missing chunk from a transient failure.</p>
 */
public class FetchFailedException extends ChunkCacheException {

    private final ChunkKey key;

    public FetchFailedException(ChunkKey key, Throwable cause) {
        super("Fetch failed for " + key + ": " + (cause == null ? "unknown error" : cause.getMessage()), cause);
        this.key = key;
    }

    public ChunkKey getKey() {
        return key;
    }

    /**
     * @return true when the backend reported that the chunk does not exist
     */
    public boolean isNotFound() {
        return getCause() instanceof ResourceNotFoundException;
    }
}
