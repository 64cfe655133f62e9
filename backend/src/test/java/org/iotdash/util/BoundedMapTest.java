package org.iotdash.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BoundedMapTest {

    @Test
    void evictsOldestInsertedEntry() {
        BoundedMap<String, Integer> map = new BoundedMap<>(2);
        map.put("a", 1);
        map.put("b", 2);
        map.put("a", 3);
        map.put("c", 4);

        assertEquals(List.of("b", "c"), List.copyOf(map.keySet()));
        assertFalse(map.containsKey("a"));
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new BoundedMap<String, String>(0));
    }
}
