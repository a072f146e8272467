package org.replikativ.chunkcache;

/**
 * Thrown when the cache is over capacity and the only eviction candidates left
 * are dirty entries that could not be written back.
 *
 * <p>This aborts the whole eviction pass. No entry is dropped: the table stays
 * above capacity until the backend accepts writes again or the caller clears
 * the cache with {@code force}.</p>
 *
 * <p>It is a {@link PersistFailedException} for the candidate whose forced
 * write-back failed.</p>
 */
public class CacheExhaustedException extends PersistFailedException {

    private final int size;
    private final int capacity;

    /**
     * Create a new cache exhausted exception.
     *
     * @param key the candidate whose write-back failed
     * @param size table size at the time of failure
     * @param capacity configured maximum number of entries
     * @param cause underlying backend error
     */
    public CacheExhaustedException(ChunkKey key, int size, int capacity, Throwable cause) {
        super("Cache full (" + size + "/" + capacity + "), all eviction candidates dirty and unwritable; "
              + "write-back of " + key + " failed", key, cause);
        this.size = size;
        this.capacity = capacity;
    }

    public int getSize() {
        return size;
    }

    public int getCapacity() {
        return capacity;
    }
}
