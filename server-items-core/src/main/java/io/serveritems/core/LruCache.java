package io.serveritems.core;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed-capacity map with least-recently-used eviction.
 *
 * <p>{@link #get} and {@link #set} promote the key to most recently used; {@link #has} does not.
 * Capacity is at least 1. Not thread-safe.
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class LruCache<K, V> {
    private final LinkedHashMap<K, V> entries = new LinkedHashMap<>(16, 0.75f, true);
    private int maxSize;

    public LruCache(int maxSize) {
        this.maxSize = Math.max(1, maxSize);
    }

    public int maxSize() {
        return maxSize;
    }

    public int size() {
        return entries.size();
    }

    /**
     * Returns the cached value, or null if absent. Promotes the entry.
     */
    public V get(K key) {
        return entries.get(key);
    }

    public boolean has(K key) {
        return entries.containsKey(key);
    }

    /**
     * Stores a value, promoting the key and evicting the least recently used entries beyond capacity.
     */
    public void set(K key, V value) {
        entries.put(key, value);
        evictToFit();
    }

    public boolean delete(K key) {
        if (!entries.containsKey(key)) return false;
        entries.remove(key);
        return true;
    }

    public void clear() {
        entries.clear();
    }

    /**
     * Changes the capacity, evicting least recently used entries if the cache no longer fits.
     */
    public void setMaxSize(int newMaxSize) {
        this.maxSize = Math.max(1, newMaxSize);
        evictToFit();
    }

    /**
     * Keys from least to most recently used.
     */
    public List<K> keys() {
        return new ArrayList<>(entries.keySet());
    }

    /**
     * Entries from least to most recently used. Iterating does not promote.
     */
    public List<Map.Entry<K, V>> entries() {
        List<Map.Entry<K, V>> out = new ArrayList<>(entries.size());
        for (Map.Entry<K, V> e : entries.entrySet()) {
            out.add(Map.entry(e.getKey(), e.getValue()));
        }
        return out;
    }

    private void evictToFit() {
        Iterator<K> it = entries.keySet().iterator();
        while (entries.size() > maxSize && it.hasNext()) {
            it.next();
            it.remove();
        }
    }
}
