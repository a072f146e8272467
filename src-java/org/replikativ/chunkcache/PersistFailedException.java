package org.replikativ.chunkcache;

/**
 * Thrown when the backend could not persist a chunk, either during an explicit
 * save or during the write-back that precedes eviction.
 *
 * <p>The entry stays cached and dirty.</p>
 */
public class PersistFailedException extends ChunkCacheException {

    private final ChunkKey key;

    /**
     * Create a new persist failed exception.
     *
     * @param key the key whose write failed
     * @param cause underlying backend error
     */
    public PersistFailedException(ChunkKey key, Throwable cause) {
        this("Persist failed for " + key + ": " + (cause == null ? "unknown error" : cause.getMessage()), key, cause);
    }

    /**
     * Create a new persist failed exception with a custom message.
     *
     * @param message error message
     * @param key the key whose write failed
     * @param cause underlying backend error
     */
    protected PersistFailedException(String message, ChunkKey key, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    /**
     * Get the key whose write failed.
     *
     * @return chunk key
     */
    public ChunkKey getKey() {
        return key;
    }
}
