package me.internalizable.testenv.environment.shared;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StashServerTest {

    @Nested
    @DisplayName("StashServer")
    class Stash {

        private final StashServer stash = new StashServer();

        @BeforeEach
        void start() {
            stash.start();
        }

        @AfterEach
        void stop() {
            stash.stop();
        }

        @Test
        @DisplayName("hands a value over exactly once")
        void takeRemoves() {
            stash.put("/fetch/api", "token", "abc");

            assertEquals("abc", stash.take("/fetch/api", "token"));
            assertNull(stash.take("/fetch/api", "token"));
        }

        @Test
        void scopesKeysByPath() {
            stash.put("/a", "key", 1);
            stash.put("/b", "key", 2);

            assertEquals(2, stash.take("/b", "key"));
            assertEquals(1, stash.take("/a", "key"));
        }

        @Test
        void rejectsDuplicateKey() {
            stash.put("/a", "key", 1);
            assertThrows(IllegalStateException.class, () -> stash.put("/a", "key", 2));
        }

        @Test
        void rejectsDoubleStart() {
            assertThrows(IllegalStateException.class, stash::start);
        }

        @Test
        void dropsValuesOnStop() {
            stash.put("/a", "key", 1);
            stash.stop();

            assertFalse(stash.isRunning());
            assertEquals(0, stash.size());
            assertThrows(IllegalStateException.class, () -> stash.take("/a", "key"));
            stash.start();
        }
    }

    @Nested
    @DisplayName("SharedCache")
    class Cache {

        @Test
        void computesOnce() {
            SharedCache cache = new SharedCache();
            cache.start();
            try {
                assertEquals("v1", cache.computeIfAbsent("k", key -> "v1"));
                assertEquals("v1", cache.computeIfAbsent("k", key -> "v2"));
                assertEquals(1, cache.size());
            } finally {
                cache.stop();
            }
        }

        @Test
        void rejectsUseWhenStopped() {
            SharedCache cache = new SharedCache();
            assertThrows(IllegalStateException.class, () -> cache.put("k", "v"));
        }
    }
}
