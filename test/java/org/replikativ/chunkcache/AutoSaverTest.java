package org.replikativ.chunkcache;

import org.junit.jupiter.api.*;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AutoSaver")
class AutoSaverTest {

    private RecordingBackend backend;
    private ChunkCache<String> cache;

    @BeforeEach
    void setUp() {
        backend = new RecordingBackend();
        cache = ChunkCache.builder(backend).fetchExecutor(Runnable::run).build();
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    private ChunkKey loadDirty(int x, int y) {
        ChunkKey key = ChunkKey.of("poi", x, y);
        cache.getOrLoad(key);
        cache.processQueue().join();
        cache.update(key, s -> s + "*");
        return key;
    }

    @Test
    @DisplayName("runOnce() saves dirty chunks and reports failures")
    void testRunOnce() {
        ChunkKey ok = loadDirty(0, 0);
        ChunkKey bad = loadDirty(1, 0);
        backend.failPersist(bad);
        AutoSaver saver = AutoSaver.manual(cache);

        List<SaveResult> results = saver.runOnce();

        assertEquals(2, results.size());
        assertEquals(List.of(ok), backend.persisted());
        assertEquals(1, cache.dirtyCount());
        assertFalse(saver.isRunning());
    }

    @Test
    @DisplayName("runOnce() on a closed cache does nothing")
    void testClosedCache() {
        loadDirty(0, 0);
        AutoSaver saver = AutoSaver.manual(cache);
        cache.close();

        assertTrue(saver.runOnce().isEmpty());
    }

    @Test
    @DisplayName("scheduled runs save periodically until closed")
    void testScheduled() throws Exception {
        CountDownLatch saved = new CountDownLatch(2);
        cache.addListener(e -> {
            if (e.getType() == CacheEvent.Type.CHUNK_SAVED) {
                saved.countDown();
            }
        });
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            loadDirty(0, 0);
            AutoSaver saver = AutoSaver.start(cache, scheduler, 10);
            assertTrue(saver.isRunning());

            loadDirty(1, 1);
            assertTrue(saved.await(5, TimeUnit.SECONDS));

            saver.close();
            assertFalse(saver.isRunning());
            assertFalse(scheduler.isShutdown(), "caller-owned scheduler stays alive");
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    @DisplayName("a failing backend does not stop the schedule")
    void testKeepsRunningAfterFailure() throws Exception {
        ChunkKey key = loadDirty(0, 0);
        backend.failPersist(key);
        CountDownLatch errors = new CountDownLatch(2);
        cache.addListener(e -> {
            if (e.getType() == CacheEvent.Type.CHUNK_ERROR) {
                errors.countDown();
            }
        });

        try (AutoSaver saver = AutoSaver.start(cache, 10)) {
            assertTrue(errors.await(5, TimeUnit.SECONDS), "retried on the next run");
            assertTrue(saver.isRunning());
        }
    }

    @Test
    @DisplayName("a non-positive interval is rejected")
    void testInvalidInterval() {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            assertThrows(IllegalArgumentException.class, () -> AutoSaver.start(cache, scheduler, 0));
        } finally {
            scheduler.shutdownNow();
        }
    }
}
