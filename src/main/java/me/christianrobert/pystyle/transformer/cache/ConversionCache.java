package me.christianrobert.pystyle.transformer.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * LRU cache of conversion results keyed by fingerprint.
 *
 * <h3>Rules:</h3>
 * <ul>
 *   <li>Only exact fingerprint matches are hits; {@link #get} refreshes recency</li>
 *   <li>Once the entry count exceeds the capacity, the least recently used entry is evicted</li>
 *   <li>The first entry stored for a fingerprint wins; later puts return the stored entry</li>
 *   <li>{@link #getOrCompute} runs lookup, computation and store under a lock striped by fingerprint,
 *       so one fingerprint is computed at most once at a time. A caller holds at most one stripe.</li>
 *   <li>A change of the environment fingerprint (configuration or plugin set) drops every entry</li>
 *   <li>Capacity 0 disables caching: nothing is stored, every lookup misses</li>
 *   <li>{@link #save} and {@link #load} move the entries through a JSON file, keeping their recency
 *       order and the environment fingerprint they belong to</li>
 * </ul>
 */
public class ConversionCache {

    private static final Logger log = LoggerFactory.getLogger(ConversionCache.class);

    private static final int LOCK_STRIPES = 32;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final int capacity;
    private final Object structureLock = new Object();
    private final Map<String, CacheEntry> entries;
    private final ReentrantLock[] stripes = new ReentrantLock[LOCK_STRIPES];
    private final CacheStatistics statistics = new CacheStatistics();

    private String environmentFingerprint;

    public ConversionCache(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Cache capacity must be >= 0, got " + capacity);
        }
        this.capacity = capacity;
        this.entries = new LinkedHashMap<String, CacheEntry>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CacheEntry> eldest) {
                if (size() > ConversionCache.this.capacity) {
                    statistics.recordEviction();
                    log.debug("Evicting least recently used entry {}", eldest.getKey());
                    return true;
                }
                return false;
            }
        };
        for (int i = 0; i < LOCK_STRIPES; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public boolean isEnabled() {
        return capacity > 0;
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * Returns the entry for the fingerprint, or {@code null} on a miss.
     */
    public CacheEntry get(String fingerprint) {
        CacheEntry entry = null;
        if (isEnabled()) {
            synchronized (structureLock) {
                entry = entries.get(fingerprint);
            }
        }
        if (entry != null) {
            statistics.recordHit();
        } else {
            statistics.recordMiss();
        }
        return entry;
    }

    /**
     * Stores an entry unless one is already present for its fingerprint.
     *
     * @return the entry now cached for the fingerprint (the earlier one if there was one)
     */
    public CacheEntry put(CacheEntry entry) {
        if (!isEnabled()) {
            return entry;
        }
        synchronized (structureLock) {
            CacheEntry existing = entries.get(entry.getFingerprint());
            if (existing != null) {
                return existing;
            }
            entries.put(entry.getFingerprint(), entry);
            return entry;
        }
    }

    /**
     * Returns the cached entry, or computes and stores it. Concurrent callers with the same
     * fingerprint wait for the first computation and get its entry.
     *
     * <p>An exception from {@code computation} propagates and nothing is stored.</p>
     */
    public CacheEntry getOrCompute(String fingerprint, Supplier<CacheEntry> computation) {
        if (!isEnabled()) {
            statistics.recordMiss();
            return computation.get();
        }
        ReentrantLock lock = stripeFor(fingerprint);
        lock.lock();
        try {
            CacheEntry cached = get(fingerprint);
            if (cached != null) {
                return cached;
            }
            CacheEntry computed = computation.get();
            return computed != null ? put(computed) : null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops every entry if the environment fingerprint differs from the one the entries
     * were produced under.
     */
    public void ensureEnvironment(String fingerprint) {
        synchronized (structureLock) {
            if (fingerprint.equals(environmentFingerprint)) {
                return;
            }
            if (environmentFingerprint != null && !entries.isEmpty()) {
                log.info("Configuration or plugin set changed, invalidating {} cached conversions", entries.size());
            }
            entries.clear();
            environmentFingerprint = fingerprint;
        }
    }

    public int size() {
        synchronized (structureLock) {
            return entries.size();
        }
    }

    public boolean contains(String fingerprint) {
        synchronized (structureLock) {
            return entries.containsKey(fingerprint);
        }
    }

    public void clear() {
        synchronized (structureLock) {
            entries.clear();
        }
        statistics.reset();
    }

    /**
     * Writes the entries, least recently used first, to {@code file}. Recency is not changed.
     *
     * @return the number of entries written
     * @throws IOException if the file cannot be written
     */
    public int save(Path file) throws IOException {
        CacheSnapshot snapshot;
        synchronized (structureLock) {
            snapshot = CacheSnapshot.of(environmentFingerprint, new ArrayList<>(entries.values()));
        }
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        MAPPER.writeValue(file.toFile(), snapshot);
        log.info("Saved {} cached conversions to {}", snapshot.getEntries().size(), file);
        return snapshot.getEntries().size();
    }

    /**
     * Adds the entries saved in {@code file}. A missing file loads nothing. Entries saved under
     * another environment fingerprint than the current one are skipped; an empty cache adopts
     * the saved fingerprint, so the next {@link #ensureEnvironment} keeps or drops them.
     *
     * @return the number of entries added
     * @throws IOException if the file cannot be read or is not a saved cache
     */
    public int load(Path file) throws IOException {
        if (!isEnabled() || !Files.exists(file)) {
            return 0;
        }
        CacheSnapshot snapshot = MAPPER.readValue(file.toFile(), CacheSnapshot.class);
        List<CacheEntry> restored = new ArrayList<>();
        try {
            for (CacheSnapshot.StoredEntry stored : snapshot.getEntries()) {
                restored.add(stored.toCacheEntry());
            }
        } catch (IllegalArgumentException e) {
            throw new IOException("Malformed cache file " + file + ": " + e.getMessage(), e);
        }

        int added = 0;
        synchronized (structureLock) {
            String savedEnvironment = snapshot.getEnvironmentFingerprint();
            if (environmentFingerprint == null) {
                environmentFingerprint = savedEnvironment;
            } else if (!environmentFingerprint.equals(savedEnvironment)) {
                log.info("Cache file {} belongs to another configuration or plugin set, skipping it", file);
                return 0;
            }
            for (CacheEntry entry : restored) {
                if (!entries.containsKey(entry.getFingerprint())) {
                    entries.put(entry.getFingerprint(), entry);
                    added++;
                }
            }
        }
        log.info("Loaded {} cached conversions from {}", added, file);
        return added;
    }

    public CacheStatistics getStatistics() {
        return statistics;
    }

    private ReentrantLock stripeFor(String fingerprint) {
        return stripes[Math.floorMod(fingerprint.hashCode(), LOCK_STRIPES)];
    }
}
