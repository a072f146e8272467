package org.replikativ.chunkcache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodic task calling {@link ChunkCache#saveAllDirty()}.
 *
 * <p>Runs outside the cache: the cache itself never saves on a timer. Each run
 * takes the cache lock like any other operation, finds zero or more dirty chunks
 * and logs the keys that could not be written.</p>
 *
 * <pre>{@code
 * AutoSaver saver = AutoSaver.start(cache, cache.getConfig().getSaveIntervalMs());
 * ...
 * saver.close();
 * cache.close();
 * }</pre>
 */
public final class AutoSaver implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(AutoSaver.class);

    private final ChunkCache<?> cache;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private ScheduledFuture<?> task;

    private AutoSaver(ChunkCache<?> cache, ScheduledExecutorService scheduler, boolean ownsScheduler) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
    }

    /**
     * Create an auto-saver that is not scheduled. Use {@link #runOnce()} to drive it.
     */
    public static AutoSaver manual(ChunkCache<?> cache) {
        return new AutoSaver(cache, null, false);
    }

    /**
     * Start saving every {@code intervalMs} on a private daemon thread.
     */
    public static AutoSaver start(ChunkCache<?> cache, long intervalMs) {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "chunk-cache-autosave");
            t.setDaemon(true);
            return t;
        });
        AutoSaver saver = new AutoSaver(cache, scheduler, true);
        saver.schedule(intervalMs);
        return saver;
    }

    /**
     * Start saving every {@code intervalMs} on a caller-owned scheduler.
     */
    public static AutoSaver start(ChunkCache<?> cache, ScheduledExecutorService scheduler, long intervalMs) {
        AutoSaver saver = new AutoSaver(cache, Objects.requireNonNull(scheduler, "scheduler"), false);
        saver.schedule(intervalMs);
        return saver;
    }

    private synchronized void schedule(long intervalMs) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be positive: " + intervalMs);
        }
        task = scheduler.scheduleWithFixedDelay(this::runQuietly, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Save all dirty chunks now.
     *
     * @return per-key results; empty if the cache is closed or nothing was dirty
     */
    public List<SaveResult> runOnce() {
        if (cache.isClosed()) {
            return Collections.emptyList();
        }
        List<SaveResult> results = cache.saveAllDirty();
        for (SaveResult r : results) {
            if (!r.isSuccess()) {
                logger.warn("Auto-save of {} failed: {}", r.getKey(), r.getError().getMessage());
            }
        }
        return results;
    }

    private void runQuietly() {
        try {
            runOnce();
        } catch (IllegalStateException e) {
            // cache closed between the check and the save
            logger.debug("Auto-save skipped: {}", e.getMessage());
        } catch (RuntimeException e) {
            // an exception escaping here would cancel the periodic task
            logger.error("Auto-save run failed", e);
        }
    }

    public synchronized boolean isRunning() {
        return task != null && !task.isDone();
    }

    @Override
    public synchronized void close() {
        if (task != null) {
            task.cancel(false);
            task = null;
        }
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }
}
