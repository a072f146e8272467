package org.replikativ.chunkcache;

/**
 * Base exception for chunk cache operations.
 *
 * <p>All chunk cache exceptions extend this class,
 * making it easy to catch all cache-related errors.</p>
 */
public class ChunkCacheException extends RuntimeException {

    /**
     * Create a new exception with a message.
     *
     * @param message error message
     */
    public ChunkCacheException(String message) {
        super(message);
    }

    /**
     * Create a new exception with a message and cause.
     *
     * @param message error message
     * @param cause underlying cause
     */
    public ChunkCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
