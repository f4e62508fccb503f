package com.civicintel.servicerequest.service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bounded label → id map for one dimension table, least recently used entry
 * evicted first. Holds no state the store does not already have: an evicted
 * label is simply looked up again.
 */
public class DimensionCache {

    private final int maxEntries;
    private final Map<String, Long> entries;

    public DimensionCache(int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be positive, was " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Long> eldest) {
                return size() > DimensionCache.this.maxEntries;
            }
        };
    }

    public Long get(String label) {
        return entries.get(label);
    }

    public void put(String label, long id) {
        entries.put(label, id);
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }
}
