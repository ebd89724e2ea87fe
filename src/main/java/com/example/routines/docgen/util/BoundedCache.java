package com.example.routines.docgen.util;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Size-bounded map that evicts its eldest entry once full.
 *
 * With {@code accessOrder} reads refresh an entry (LRU); without it entries
 * leave in insertion order (FIFO). All operations hold the instance lock, so
 * lookup, eviction and insertion never interleave between callers.
 */
public class BoundedCache<K, V> {
    private final int maxEntries;
    private final LinkedHashMap<K, V> entries;
    private long evictionCount;

    public BoundedCache(int maxEntries, boolean accessOrder) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.entries = new LinkedHashMap<K, V>(16, 0.75f, accessOrder) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                boolean evict = size() > BoundedCache.this.maxEntries;
                if (evict) {
                    evictionCount++;
                }
                return evict;
            }
        };
    }

    public synchronized V get(K key) {
        return entries.get(key);
    }

    public synchronized void put(K key, V value) {
        entries.put(key, value);
    }

    public synchronized V remove(K key) {
        return entries.remove(key);
    }

    public synchronized boolean containsKey(K key) {
        return entries.containsKey(key);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }

    /**
     * Snapshot of the keys, eldest first.
     */
    public synchronized List<K> keys() {
        return new ArrayList<>(entries.keySet());
    }

    public synchronized long getEvictionCount() {
        return evictionCount;
    }

    public int getMaxEntries() {
        return maxEntries;
    }
}
