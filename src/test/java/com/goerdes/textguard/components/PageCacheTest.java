package com.goerdes.textguard.components;

import com.goerdes.textguard.utils.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PageCacheTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");
    private static final Duration TTL = Duration.ofHours(24);

    @TempDir
    Path dir;

    @Test
    void testEntryIsFreshUntilTtlElapses() {
        MutableClock clock = new MutableClock(T0);
        PageCache cache = new PageCache(dir, TTL, clock);
        cache.put("https://example.org/a", "cached text");

        clock.set(T0.plus(TTL).minusSeconds(1));
        assertEquals(Optional.of("cached text"), cache.getFresh("https://example.org/a"));

        clock.set(T0.plus(TTL));
        assertTrue(cache.getFresh("https://example.org/a").isEmpty());

        clock.set(T0.plus(TTL).plusSeconds(1));
        assertTrue(cache.getFresh("https://example.org/a").isEmpty());
        assertTrue(cache.contains("https://example.org/a"));
    }

    @Test
    void testRewriteRefreshesEntry() {
        MutableClock clock = new MutableClock(T0);
        PageCache cache = new PageCache(dir, TTL, clock);
        cache.put("https://example.org/b", "old");

        clock.set(T0.plus(TTL).plusSeconds(60));
        cache.put("https://example.org/b", "new");

        assertEquals(Optional.of("new"), cache.getFresh("https://example.org/b"));
    }

    @Test
    void testMissingEntry() {
        PageCache cache = new PageCache(dir, TTL, new MutableClock(T0));

        assertTrue(cache.getFresh("https://example.org/missing").isEmpty());
        assertFalse(cache.contains("https://example.org/missing"));
    }

    @Test
    void testFileNameIsUrlHash() {
        PageCache cache = new PageCache(dir, TTL, new MutableClock(T0));
        Path file = cache.fileFor("https://example.org/a");

        assertEquals(dir, file.getParent());
        assertTrue(file.getFileName().toString().matches("[0-9a-f]{64}\\.txt"));
    }

    @Test
    void testClearRemovesEverything() throws Exception {
        PageCache cache = new PageCache(dir.resolve("cache"), TTL, new MutableClock(T0));
        cache.put("https://example.org/1", "one");
        cache.put("https://example.org/2", "two");

        cache.clear();

        assertFalse(cache.contains("https://example.org/1"));
        try (Stream<Path> files = Files.list(dir.resolve("cache"))) {
            assertEquals(0, files.count());
        }
    }
}
