package chunkcache.internal;

import org.replikativ.chunkcache.ChunkKey;

import java.util.Objects;

/**
 * One cached chunk plus its lifecycle metadata.
 *
 * <p>Entries are owned by a single cache and mutated only while its lock is held.
 * The insertion sequence is fixed at creation and breaks eviction ties when two
 * entries share priority and access time.</p>
 *
 * <p><b>Internal API</b> - subject to change without notice.</p>
 *
 * @param <T> chunk payload type
 */
public final class CacheEntry<T> {

    private final ChunkKey key;
    private final long sequence;
    private T chunk;
    private long lastAccessed;
    private boolean dirty;
    private int priority;
    private boolean pinned;

    public CacheEntry(ChunkKey key, T chunk, long sequence, long now, int priority, boolean dirty) {
        this.key = Objects.requireNonNull(key, "key");
        this.chunk = Objects.requireNonNull(chunk, "chunk");
        this.sequence = sequence;
        this.lastAccessed = now;
        this.priority = priority;
        this.dirty = dirty;
    }

    public ChunkKey getKey() { return key; }
    public long getSequence() { return sequence; }
    public T getChunk() { return chunk; }
    public long getLastAccessed() { return lastAccessed; }
    public boolean isDirty() { return dirty; }
    public int getPriority() { return priority; }
    public boolean isPinned() { return pinned; }

    /**
     * Record an access at the given time.
     */
    public void touch(long now) {
        this.lastAccessed = now;
    }

    /**
     * Replace the content. Does NOT mark the entry dirty.
     */
    public void setChunk(T chunk) {
        this.chunk = Objects.requireNonNull(chunk, "chunk");
    }

    public void markDirty() {
        this.dirty = true;
    }

    /**
     * Clear the dirty flag (call only after a successful write-back).
     */
    public void markClean() {
        this.dirty = false;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public void setPinned(boolean pinned) {
        this.pinned = pinned;
    }

    @Override
    public String toString() {
        return "CacheEntry{key=" + key +
               ", priority=" + priority +
               ", lastAccessed=" + lastAccessed +
               ", dirty=" + dirty +
               (pinned ? ", pinned" : "") + "}";
    }
}
