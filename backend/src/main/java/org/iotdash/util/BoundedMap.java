package org.iotdash.util;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Insertion-ordered map that evicts its oldest entry once {@code capacity} is exceeded.
 * Re-putting an existing key keeps its original position. Not thread-safe.
 */
public class BoundedMap<K, V> extends LinkedHashMap<K, V> {
    private final int capacity;

    public BoundedMap(int capacity) {
        super(16, 0.75f, false);
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }

    @Override
    protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
        return size() > capacity;
    }
}
