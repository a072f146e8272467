package org.replikativ.chunkcache;

/**
 * Raised by a backend when the requested chunk does not exist.
 */
public class ResourceNotFoundException extends ResourceBackendException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
