package org.replikativ.chunkcache;

/**
 * Base class for errors raised by a {@link ResourceBackend}.
 */
public class ResourceBackendException extends ChunkCacheException {

    public ResourceBackendException(String message) {
        super(message);
    }

    public ResourceBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
