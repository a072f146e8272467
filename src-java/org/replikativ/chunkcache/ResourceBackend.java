package org.replikativ.chunkcache;

/**
 * Persistence collaborator the cache loads chunks from and writes them back to.
 *
 * <p>Implementations can back chunks with any storage (HTTP service, files,
 * database). Transport, serialization and timeouts are the implementation's
 * concern. Calls may block; the cache issues fetches from its fetch executor and
 * never issues two concurrent fetches for the same key.</p>
 *
 * @param <T> chunk payload type
 */
public interface ResourceBackend<T> {

    /**
     * Fetch a chunk.
     *
     * @param ownerId owning context id
     * @param x chunk grid x coordinate
     * @param y chunk grid y coordinate
     * @return the chunk content, never null
     * @throws ResourceNotFoundException if no such chunk exists
     * @throws TransientResourceException if the fetch failed but may succeed later
     */
    T fetch(String ownerId, int x, int y);

    /**
     * Persist a chunk.
     *
     * @param ownerId owning context id
     * @param x chunk grid x coordinate
     * @param y chunk grid y coordinate
     * @param chunk the content to write
     * @throws ResourceBackendException if the write failed
     */
    void persist(String ownerId, int x, int y, T chunk);
}
