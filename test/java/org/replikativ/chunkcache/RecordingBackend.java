package org.replikativ.chunkcache;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory backend for tests. Unknown keys fetch as "{key}" unless registered
 * as missing or failing; records every fetch and persist.
 */
class RecordingBackend implements ResourceBackend<String> {

    private final Map<ChunkKey, String> stored = new ConcurrentHashMap<>();
    private final Set<ChunkKey> missing = ConcurrentHashMap.newKeySet();
    private final Set<ChunkKey> failingFetch = ConcurrentHashMap.newKeySet();
    private final Set<ChunkKey> failingPersist = ConcurrentHashMap.newKeySet();
    private final Map<ChunkKey, AtomicInteger> fetchCounts = new ConcurrentHashMap<>();
    private final Map<ChunkKey, AtomicInteger> outstanding = new ConcurrentHashMap<>();
    private final Set<ChunkKey> overlapping = ConcurrentHashMap.newKeySet();
    private final List<ChunkKey> fetchLog = Collections.synchronizedList(new ArrayList<>());
    private final List<ChunkKey> persistLog = Collections.synchronizedList(new ArrayList<>());

    @Override
    public String fetch(String ownerId, int x, int y) {
        ChunkKey key = ChunkKey.of(ownerId, x, y);
        fetchLog.add(key);
        fetchCounts.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
        if (outstanding.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet() > 1) {
            overlapping.add(key);
        }
        try {
            if (missing.contains(key)) {
                throw new ResourceNotFoundException("No chunk " + key);
            }
            if (failingFetch.contains(key)) {
                throw new TransientResourceException("Backend unavailable for " + key);
            }
            return stored.getOrDefault(key, "{" + key + "}");
        } finally {
            outstanding.get(key).decrementAndGet();
        }
    }

    @Override
    public void persist(String ownerId, int x, int y, String chunk) {
        ChunkKey key = ChunkKey.of(ownerId, x, y);
        if (failingPersist.contains(key)) {
            throw new TransientResourceException("Write rejected for " + key);
        }
        persistLog.add(key);
        stored.put(key, chunk);
    }

    RecordingBackend missing(ChunkKey key) {
        missing.add(key);
        return this;
    }

    RecordingBackend failFetch(ChunkKey key) {
        failingFetch.add(key);
        return this;
    }

    RecordingBackend failPersist(ChunkKey key) {
        failingPersist.add(key);
        return this;
    }

    RecordingBackend recoverPersist(ChunkKey key) {
        failingPersist.remove(key);
        return this;
    }

    RecordingBackend recoverFetch(ChunkKey key) {
        failingFetch.remove(key);
        missing.remove(key);
        return this;
    }

    void store(ChunkKey key, String chunk) {
        stored.put(key, chunk);
    }

    String stored(ChunkKey key) {
        return stored.get(key);
    }

    int fetchCount(ChunkKey key) {
        AtomicInteger n = fetchCounts.get(key);
        return n == null ? 0 : n.get();
    }

    int totalFetches() {
        return fetchLog.size();
    }

    Set<ChunkKey> overlappingFetches() {
        return overlapping;
    }

    List<ChunkKey> persisted() {
        synchronized (persistLog) {
            return new ArrayList<>(persistLog);
        }
    }
}
