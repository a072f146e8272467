package org.replikativ.chunkcache;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Listener collecting every event.
 */
class EventLog implements CacheListener<String> {

    private final List<CacheEvent<String>> events = new CopyOnWriteArrayList<>();

    @Override
    public void onEvent(CacheEvent<String> event) {
        events.add(event);
    }

    List<CacheEvent<String>> all() {
        return new ArrayList<>(events);
    }

    List<CacheEvent<String>> of(CacheEvent.Type type) {
        return events.stream().filter(e -> e.getType() == type).collect(Collectors.toList());
    }

    List<ChunkKey> keysOf(CacheEvent.Type type) {
        return of(type).stream().map(CacheEvent::getKey).collect(Collectors.toList());
    }
}
