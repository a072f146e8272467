package org.replikativ.chunkcache;

/**
 * Raised by a backend for failures that may succeed on a later attempt
 * (timeouts, unavailable service, I/O errors).
 */
public class TransientResourceException extends ResourceBackendException {

    public TransientResourceException(String message) {
        super(message);
    }

    public TransientResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
