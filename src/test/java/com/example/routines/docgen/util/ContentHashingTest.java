package com.example.routines.docgen.util;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ContentHashingTest {

    @Test
    public void testKeyOrderDoesNotChangeTheHash() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("a", 1);
        first.put("b", Arrays.asList("x", "y"));
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("b", Arrays.asList("x", "y"));
        second.put("a", 1);

        assertEquals(ContentHashing.canonicalJson(first), ContentHashing.canonicalJson(second));
        assertEquals(ContentHashing.hash(first), ContentHashing.hash(second));
    }

    @Test
    public void testDifferentContentGivesDifferentHash() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("a", 1);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("a", 2);

        assertNotEquals(ContentHashing.hash(first), ContentHashing.hash(second));
        assertEquals(64, ContentHashing.hash(first).length());
    }
}
