package org.replikativ.chunkcache;

/**
 * Subscriber for cache lifecycle events.
 *
 * <p>Listeners are invoked synchronously on the thread performing the cache
 * operation, while the cache lock is held. They must return quickly and must not
 * block on other threads that use the cache. Exceptions thrown by a listener are
 * logged and ignored.</p>
 *
 * @param <T> chunk payload type
 */
@FunctionalInterface
public interface CacheListener<T> {

    void onEvent(CacheEvent<T> event);
}
