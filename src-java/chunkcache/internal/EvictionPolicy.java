package chunkcache.internal;

import org.replikativ.chunkcache.ChunkKey;
import org.replikativ.chunkcache.GridPoint;

import java.util.Comparator;

/**
 * Pure functions deciding priority tiers and eviction order.
 *
 * <h2>Priority</h2>
 * <p>Tier = floor(min(d / radius, 1) * (levels - 1)) where d is the Chebyshev
 * distance between a chunk and the reference point. Tier 0 is the most valuable.</p>
 *
 * <h2>Eviction order</h2>
 * <ol>
 *   <li>Highest tier first</li>
 *   <li>Then oldest last access</li>
 *   <li>Then lowest insertion sequence</li>
 * </ol>
 * <p>Pinned entries are never candidates. Clean candidates are always taken
 * before dirty ones; a dirty entry is only selected when no clean candidate
 * remains, and the caller must write it back before removing it.</p>
 *
 * <p><b>Internal API</b> - subject to change without notice.</p>
 */
public final class EvictionPolicy {

    /**
     * Most evictable entry first.
     */
    public static final Comparator<CacheEntry<?>> EVICTION_ORDER =
        Comparator.<CacheEntry<?>>comparingInt(CacheEntry::getPriority).reversed()
            .thenComparingLong(CacheEntry::getLastAccessed)
            .thenComparingLong(CacheEntry::getSequence);

    private EvictionPolicy() {}

    /**
     * Compute the priority tier of a chunk position.
     *
     * @param position chunk grid position
     * @param reference reference point in chunk grid coordinates
     * @param preloadRadius distance at which the tier saturates
     * @param priorityLevels number of tiers (at least 1)
     * @return tier in [0, priorityLevels - 1]
     */
    public static int computePriority(GridPoint position, GridPoint reference,
                                      int preloadRadius, int priorityLevels) {
        int distance = ChunkGrid.chebyshevDistance(position, reference);
        double normalized;
        if (preloadRadius <= 0) {
            normalized = distance == 0 ? 0.0 : 1.0;
        } else {
            normalized = Math.min((double) distance / preloadRadius, 1.0);
        }
        return (int) Math.floor(normalized * (priorityLevels - 1));
    }

    /**
     * Select the next entry to evict.
     *
     * @param entries current table entries
     * @param exclude key that must not be chosen (the entry just inserted), may be null
     * @return the victim, or null if every entry is pinned or excluded
     */
    public static <T> CacheEntry<T> selectVictim(Iterable<CacheEntry<T>> entries, ChunkKey exclude) {
        CacheEntry<T> bestClean = null;
        CacheEntry<T> bestDirty = null;
        for (CacheEntry<T> entry : entries) {
            if (entry.isPinned() || entry.getKey().equals(exclude)) {
                continue;
            }
            if (entry.isDirty()) {
                if (bestDirty == null || EVICTION_ORDER.compare(entry, bestDirty) < 0) {
                    bestDirty = entry;
                }
            } else if (bestClean == null || EVICTION_ORDER.compare(entry, bestClean) < 0) {
                bestClean = entry;
            }
        }
        return bestClean != null ? bestClean : bestDirty;
    }
}
