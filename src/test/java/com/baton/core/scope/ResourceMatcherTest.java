package com.baton.core.scope;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ResourceMatcherTest {

    @Test
    @DisplayName("equal paths match after normalisation")
    void equalPaths() {
        assertTrue(ResourceMatcher.matches("./src/a.txt", "src/a.txt"));
        assertTrue(ResourceMatcher.matches("src\\a.txt", "src/a.txt"));
    }

    @Test
    @DisplayName("relative path matches its absolute spelling")
    void suffixMatch() {
        assertTrue(ResourceMatcher.matches("/repo/src/a.txt", "src/a.txt"));
        assertFalse(ResourceMatcher.matches("src/data.txt", "a.txt"));
    }

    @Test
    @DisplayName("a directory declared with a trailing slash contains its files")
    void directoryContains() {
        assertTrue(ResourceMatcher.matches("src/auth/", "src/auth/Login.java"));
        assertTrue(ResourceMatcher.matches("src/auth/Login.java", "src/auth/"));
        assertFalse(ResourceMatcher.matches("src/auth", "src/auth/Login.java"));
        assertFalse(ResourceMatcher.matches("src/auth/", "src/authz/Login.java"));
    }

    @Test
    @DisplayName("blank resources never match")
    void blankNeverMatches() {
        assertFalse(ResourceMatcher.matches("", ""));
        assertFalse(ResourceMatcher.matches(null, "a.txt"));
    }

    @Test
    @DisplayName("overlap reports both spellings of each overlapping resource")
    void overlap() {
        Set<String> overlap = ResourceMatcher.overlap(List.of("a.txt", "c.txt"), List.of("./a.txt", "b.txt"));
        assertEquals(Set.of("a.txt"), overlap);

        Set<String> dir = ResourceMatcher.overlap(List.of("src/"), List.of("src/x.java", "lib/y.java"));
        assertEquals(Set.of("src", "src/x.java"), dir);
    }
}
