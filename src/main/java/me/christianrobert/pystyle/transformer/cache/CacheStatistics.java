package me.christianrobert.pystyle.transformer.cache;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Hit, miss and eviction counters of a {@link ConversionCache}.
 */
public class CacheStatistics {

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    void recordHit() {
        hits.incrementAndGet();
    }

    void recordMiss() {
        misses.incrementAndGet();
    }

    void recordEviction() {
        evictions.incrementAndGet();
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }

    public long getEvictions() {
        return evictions.get();
    }

    public long getRequests() {
        return getHits() + getMisses();
    }

    /**
     * Share of lookups that were hits, 0.0 before the first lookup.
     */
    public double getHitRate() {
        long requests = getRequests();
        return requests == 0 ? 0.0 : (double) getHits() / requests;
    }

    void reset() {
        hits.set(0);
        misses.set(0);
        evictions.set(0);
    }

    @Override
    public String toString() {
        return String.format("CacheStatistics{hits=%d, misses=%d, evictions=%d, hitRate=%.2f}",
                getHits(), getMisses(), getEvictions(), getHitRate());
    }
}
