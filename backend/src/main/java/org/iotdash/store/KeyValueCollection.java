package org.iotdash.store;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One named collection of the in-memory store. Single operations are atomic,
 * sequences of operations are not.
 */
public class KeyValueCollection<V> {
    private final String name;
    private final Map<String, V> entries = new ConcurrentHashMap<>();

    public KeyValueCollection(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public Optional<V> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(key));
    }

    public void put(String key, V value) {
        entries.put(key, value);
    }

    public Optional<V> remove(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.remove(key));
    }

    public boolean containsKey(String key) {
        return key != null && entries.containsKey(key);
    }

    public Collection<V> values() {
        return List.copyOf(entries.values());
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }
}
