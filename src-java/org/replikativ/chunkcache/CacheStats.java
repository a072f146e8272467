package org.replikativ.chunkcache;

/**
 * Point-in-time snapshot of cache counters. All counters are monotonic over the
 * cache's lifetime.
 */
public final class CacheStats {

    private final long hits;
    private final long misses;
    private final long loads;
    private final long loadFailures;
    private final long evictions;
    private final long saves;
    private final long saveFailures;

    CacheStats(long hits, long misses, long loads, long loadFailures,
               long evictions, long saves, long saveFailures) {
        this.hits = hits;
        this.misses = misses;
        this.loads = loads;
        this.loadFailures = loadFailures;
        this.evictions = evictions;
        this.saves = saves;
        this.saveFailures = saveFailures;
    }

    public long getHits() { return hits; }
    public long getMisses() { return misses; }
    public long getLoads() { return loads; }
    public long getLoadFailures() { return loadFailures; }
    public long getEvictions() { return evictions; }
    public long getSaves() { return saves; }
    public long getSaveFailures() { return saveFailures; }

    /**
     * Fraction of lookups that were hits, or 0 when nothing was looked up yet.
     */
    public double getHitRatio() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }

    @Override
    public String toString() {
        return "CacheStats{" +
               "hits=" + hits +
               ", misses=" + misses +
               ", loads=" + loads +
               ", loadFailures=" + loadFailures +
               ", evictions=" + evictions +
               ", saves=" + saves +
               ", saveFailures=" + saveFailures +
               '}';
    }
}
