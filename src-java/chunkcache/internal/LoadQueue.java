package chunkcache.internal;

import org.replikativ.chunkcache.ChunkKey;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Deduplicated set of keys awaiting a fetch, plus the keys whose fetch is in flight.
 *
 * <p>A key is in at most one of the two sets. {@link #takeBatch(int)} moves keys
 * from pending to in-flight in FIFO order; {@link #complete(ChunkKey)} releases
 * them once the fetch resolved. Because an in-flight key cannot be enqueued again,
 * at most one fetch per key is ever outstanding.</p>
 *
 * <p>Not thread-safe: guarded by the owning cache's lock.</p>
 *
 * <p><b>Internal API</b> - subject to change without notice.</p>
 */
public final class LoadQueue {

    private final LinkedHashSet<ChunkKey> pending = new LinkedHashSet<>();
    private final Set<ChunkKey> inFlight = new HashSet<>();

    /**
     * Add a key unless it is already pending or in flight.
     *
     * @return true if the key was added
     */
    public boolean enqueue(ChunkKey key) {
        if (inFlight.contains(key)) {
            return false;
        }
        return pending.add(key);
    }

    public boolean contains(ChunkKey key) {
        return pending.contains(key) || inFlight.contains(key);
    }

    public boolean isPending(ChunkKey key) {
        return pending.contains(key);
    }

    public boolean isInFlight(ChunkKey key) {
        return inFlight.contains(key);
    }

    /**
     * Remove up to {@code max} pending keys, oldest first, and mark them in flight.
     */
    public List<ChunkKey> takeBatch(int max) {
        if (pending.isEmpty() || max <= 0) {
            return Collections.emptyList();
        }
        List<ChunkKey> batch = new ArrayList<>(Math.min(max, pending.size()));
        Iterator<ChunkKey> it = pending.iterator();
        while (it.hasNext() && batch.size() < max) {
            ChunkKey key = it.next();
            it.remove();
            inFlight.add(key);
            batch.add(key);
        }
        return batch;
    }

    /**
     * Release an in-flight key after its fetch resolved.
     *
     * @return true if the key was in flight
     */
    public boolean complete(ChunkKey key) {
        return inFlight.remove(key);
    }

    /**
     * Drop a pending (not yet dispatched) key. In-flight keys are unaffected.
     */
    public boolean removePending(ChunkKey key) {
        return pending.remove(key);
    }

    /**
     * Drop every pending key of one owner.
     *
     * @return number of keys dropped
     */
    public int clearPending(String ownerId) {
        int before = pending.size();
        pending.removeIf(k -> k.getOwnerId().equals(ownerId));
        return before - pending.size();
    }

    /**
     * Drop every pending key.
     *
     * @return number of keys dropped
     */
    public int clearPending() {
        int n = pending.size();
        pending.clear();
        return n;
    }

    public int pendingCount() {
        return pending.size();
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    public boolean isEmpty() {
        return pending.isEmpty() && inFlight.isEmpty();
    }
}
