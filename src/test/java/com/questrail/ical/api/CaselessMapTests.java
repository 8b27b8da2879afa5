package com.questrail.ical.api;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CaselessMapTests
{
    @Test
    void lookupIgnoresCase() {
        CaselessMap<String> map = new CaselessMap<>();
        map.put("tzid", "Europe/Berlin");

        assertEquals("Europe/Berlin", map.get("TZID"));
        assertEquals("Europe/Berlin", map.get("TzId"));
        assertTrue(map.containsKey("tZiD"));
        assertNull(map.get("value"));
    }

    @Test
    void keysAreNormalizedAndKeepInsertionOrder() {
        CaselessMap<Integer> map = new CaselessMap<>();
        map.put("b", 1);
        map.put("a", 2);
        map.put("C", 3);
        map.put("B", 4);

        assertEquals(List.of("B", "A", "C"), map.keys());
        assertEquals(4, map.get("b"));
        assertEquals(3, map.size());
    }

    @Test
    void removeDropsKeyFromOrder() {
        CaselessMap<Integer> map = new CaselessMap<>();
        map.put("x", 1);
        map.put("y", 2);

        assertEquals(1, map.remove("X"));
        assertEquals(List.of("Y"), map.keys());
        assertNull(map.remove("x"));
    }

    @Test
    void equalityIgnoresOrderAndCase() {
        CaselessMap<String> a = new CaselessMap<>();
        a.put("one", "1");
        a.put("two", "2");

        CaselessMap<String> b = new CaselessMap<>();
        b.put("TWO", "2");
        b.put("One", "1");

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void copyIsIndependent() {
        CaselessMap<String> original = new CaselessMap<>();
        original.put("k", "v");

        CaselessMap<String> copy = new CaselessMap<>(original);
        copy.put("other", "w");

        assertFalse(original.containsKey("other"));
        assertEquals("v", copy.get("K"));
    }

    @Test
    void nullValuesAreRejected() {
        CaselessMap<String> map = new CaselessMap<>();
        assertThrows(NullPointerException.class, () -> map.put("k", null));
    }
}
