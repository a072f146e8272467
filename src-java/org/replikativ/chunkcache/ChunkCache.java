package org.replikativ.chunkcache;

import chunkcache.internal.CacheEntry;
import chunkcache.internal.ChunkGrid;
import chunkcache.internal.EvictionPolicy;
import chunkcache.internal.LoadQueue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * ChunkCache - bounded cache and prefetch manager for spatially partitioned chunks.
 *
 * <p>Sits between a {@link ResourceBackend} and consumers that need low-latency
 * access to nearby chunks. Misses are queued and fetched in bounded batches;
 * loaded chunks are tiered by their distance to a reference point and evicted
 * highest tier first, oldest access first. Dirty chunks are always written back
 * before they leave the table.</p>
 *
 * <h2>Basic Usage:</h2>
 * <pre>{@code
 * ChunkCache<Tiles> cache = ChunkCache.builder(backend)
 *     .config(CacheConfig.builder().maxCachedChunks(128).build())
 *     .autoDrain(true)
 *     .build();
 *
 * cache.addListener(e -> log.info("{}", e));
 * cache.prefetchAround("poi-7", playerWorldPos);
 *
 * LoadResult<Tiles> r = cache.getOrLoad(ChunkKey.of("poi-7", 0, 0));
 * if (r.isHit()) {
 *     cache.update(key, tiles -> tiles.with(3, 4, WALL));   // marks dirty
 * }
 *
 * cache.close();   // flushes dirty chunks
 * }</pre>
 *
 * <h2>Chunk Ownership:</h2>
 * <p>The cache owns every cached chunk. Chunks handed out by
 * {@link #getOrLoad(ChunkKey)} and {@code CHUNK_LOADED} events pass through the
 * builder's {@code snapshot} function, which defaults to identity. For a mutable
 * payload type configure a copying snapshot (for example
 * {@code .snapshot(Tiles::copy)}); otherwise callers receive the live chunk and
 * changes made to it bypass dirty tracking. Use {@link #update} to change a chunk
 * and {@link #read} to inspect it without copying.</p>
 *
 * <p>After {@link #close()} every access and mutation throws
 * {@link IllegalStateException}; only the introspection queries keep working.</p>
 *
 * <h2>Thread Safety:</h2>
 * <p>The entry table and load queue are guarded by one lock. Backend fetches run on
 * the fetch executor outside the lock, so fetches for different keys proceed
 * concurrently; write-backs run on the calling thread while the lock is held.</p>
 *
 * @param <T> chunk payload type
 * @see CacheConfig
 * @see ResourceBackend
 */
public final class ChunkCache<T> implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ChunkCache.class);

    private final CacheConfig config;
    private final ResourceBackend<T> backend;
    private final Clock clock;
    private final Executor fetchExecutor;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final UnaryOperator<T> snapshot;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<ChunkKey, CacheEntry<T>> entries = new LinkedHashMap<>();
    private final LoadQueue queue = new LoadQueue();
    private final List<CacheListener<T>> listeners = new CopyOnWriteArrayList<>();

    private GridPoint referencePoint;
    private long nextSequence;
    private boolean draining;
    private ScheduledFuture<?> nextDrain;
    private volatile boolean closed;

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder loads = new LongAdder();
    private final LongAdder loadFailures = new LongAdder();
    private final LongAdder evictions = new LongAdder();
    private final LongAdder saves = new LongAdder();
    private final LongAdder saveFailures = new LongAdder();

    private ChunkCache(Builder<T> builder) {
        this.config = builder.config;
        this.backend = builder.backend;
        this.clock = builder.clock;
        this.snapshot = builder.snapshot;
        this.referencePoint = builder.referencePoint;
        if (builder.scheduler != null) {
            this.scheduler = builder.scheduler;
            this.ownsScheduler = false;
        } else if (builder.autoDrain) {
            this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "chunk-cache-drain");
                t.setDaemon(true);
                return t;
            });
            this.ownsScheduler = true;
        } else {
            this.scheduler = null;
            this.ownsScheduler = false;
        }
        this.fetchExecutor = builder.fetchExecutor != null ? builder.fetchExecutor : ForkJoinPool.commonPool();
        this.listeners.addAll(builder.listeners);
    }

    // ==========================================================================
    // Builder
    // ==========================================================================

    /**
     * Create a builder for a cache over the given backend.
     *
     * @param backend the persistence collaborator
     * @return a new builder instance
     */
    public static <T> Builder<T> builder(ResourceBackend<T> backend) {
        return new Builder<>(backend);
    }

    /**
     * Builder for creating ChunkCache instances.
     */
    public static final class Builder<T> {
        private final ResourceBackend<T> backend;
        private CacheConfig config = CacheConfig.defaults();
        private Clock clock = Clock.systemUTC();
        private Executor fetchExecutor;
        private ScheduledExecutorService scheduler;
        private boolean autoDrain;
        private UnaryOperator<T> snapshot = UnaryOperator.identity();
        private GridPoint referencePoint = GridPoint.ORIGIN;
        private final List<CacheListener<T>> listeners = new ArrayList<>();

        private Builder(ResourceBackend<T> backend) {
            this.backend = Objects.requireNonNull(backend, "backend");
        }

        /** Cache configuration. Defaults to {@link CacheConfig#defaults()}. */
        public Builder<T> config(CacheConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        /** Time source for access timestamps and stale detection. */
        public Builder<T> clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /** Executor running backend fetches. Defaults to the common fork-join pool. */
        public Builder<T> fetchExecutor(Executor executor) {
            this.fetchExecutor = executor;
            return this;
        }

        /**
         * Scheduler driving the drain loop. The cache does not shut it down.
         * Setting a scheduler enables automatic draining.
         */
        public Builder<T> scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        /**
         * Drain the load queue automatically on a private daemon thread.
         * Without this (and without a scheduler) callers drive {@link ChunkCache#processQueue()}.
         */
        public Builder<T> autoDrain(boolean autoDrain) {
            this.autoDrain = autoDrain;
            return this;
        }

        /**
         * Copy function applied to chunks handed out in load results and events.
         * Required for mutable payloads; leave unset only for immutable ones.
         */
        public Builder<T> snapshot(UnaryOperator<T> snapshot) {
            this.snapshot = Objects.requireNonNull(snapshot, "snapshot");
            return this;
        }

        /** Initial reference point in chunk grid coordinates. Defaults to the origin. */
        public Builder<T> referencePoint(GridPoint referencePoint) {
            this.referencePoint = Objects.requireNonNull(referencePoint, "referencePoint");
            return this;
        }

        public Builder<T> listener(CacheListener<T> listener) {
            this.listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        public ChunkCache<T> build() {
            return new ChunkCache<>(this);
        }
    }

    // ==========================================================================
    // Lookup and loading
    // ==========================================================================

    /**
     * Return a cached chunk or schedule its load.
     *
     * <p>On a hit the access time is refreshed. On a miss the key is queued
     * unless it is already queued or being fetched; either way the result is
     * {@link LoadStatus#PENDING}.</p>
     *
     * @param key chunk key
     * @return hit carrying the chunk, or pending
     */
    public LoadResult<T> getOrLoad(ChunkKey key) {
        Objects.requireNonNull(key, "key");
        lock.lock();
        try {
            ensureOpen();
            CacheEntry<T> entry = entries.get(key);
            if (entry != null) {
                entry.touch(clock.millis());
                hits.increment();
                return LoadResult.hit(snapshot.apply(entry.getChunk()));
            }
            misses.increment();
            if (queue.enqueue(key)) {
                logger.debug("Queued {} (pending={})", key, queue.pendingCount());
                startDrainLoop();
            }
        } finally {
            lock.unlock();
        }
        return LoadResult.pending();
    }

    /**
     * Run one drain step: dispatch up to {@code loadingBatchSize} queued keys to
     * the backend and complete when every dispatched fetch resolved.
     *
     * <p>Fetch failures are reported through {@code CHUNK_ERROR} events and the
     * report's failed count. Every dispatched key is resolved and
     * {@code QUEUE_PROCESSED} is emitted even if inserting a fetched chunk could
     * not be balanced by eviction; the returned future then completes
     * exceptionally with that {@link CacheExhaustedException} (further ones of
     * the same batch are suppressed on it).</p>
     *
     * @return future of the step's report
     */
    public CompletableFuture<QueueReport> processQueue() {
        List<ChunkKey> batch;
        lock.lock();
        try {
            ensureOpen();
            batch = queue.takeBatch(config.getLoadingBatchSize());
            if (batch.isEmpty()) {
                return CompletableFuture.completedFuture(new QueueReport(0, 0, queue.pendingCount()));
            }
        } finally {
            lock.unlock();
        }

        logger.debug("Dispatching batch of {} fetches", batch.size());
        List<CacheExhaustedException> exhausted = new CopyOnWriteArrayList<>();
        List<CompletableFuture<Boolean>> fetches = new ArrayList<>(batch.size());
        for (ChunkKey key : batch) {
            fetches.add(dispatch(key, exhausted));
        }

        return CompletableFuture.allOf(fetches.toArray(new CompletableFuture[0]))
            .thenApply(ignored -> {
                int failed = 0;
                for (CompletableFuture<Boolean> f : fetches) {
                    if (!f.join()) {
                        failed++;
                    }
                }
                int remaining;
                lock.lock();
                try {
                    remaining = queue.pendingCount();
                    emit(CacheEvent.queueProcessed(batch.size(), remaining));
                } finally {
                    lock.unlock();
                }
                logger.debug("Batch done: processed={} failed={} remaining={}", batch.size(), failed, remaining);
                if (!exhausted.isEmpty()) {
                    CacheExhaustedException first = exhausted.get(0);
                    for (int i = 1; i < exhausted.size(); i++) {
                        first.addSuppressed(exhausted.get(i));
                    }
                    throw first;
                }
                return new QueueReport(batch.size(), failed, remaining);
            });
    }

    /**
     * Issue one fetch. The future yields true on success, false on fetch failure;
     * it never completes exceptionally. Eviction failures while inserting the
     * fetched chunk are collected into {@code exhausted}.
     */
    private CompletableFuture<Boolean> dispatch(ChunkKey key, List<CacheExhaustedException> exhausted) {
        CompletableFuture<T> fetch;
        try {
            fetch = CompletableFuture.supplyAsync(
                () -> backend.fetch(key.getOwnerId(), key.getX(), key.getY()), fetchExecutor);
        } catch (RejectedExecutionException e) {
            fetch = CompletableFuture.failedFuture(new TransientResourceException("Fetch rejected", e));
        }
        return fetch.handle((chunk, error) -> {
            if (error == null && chunk == null) {
                error = new ResourceNotFoundException("Backend returned no content for " + key);
            }
            try {
                completeLoad(key, chunk, unwrap(error));
            } catch (CacheExhaustedException e) {
                exhausted.add(e);
            }
            return error == null;
        });
    }

    /**
     * Resolve a dispatched fetch: insert the chunk on success, report the error otherwise.
     *
     * <p>A failed key leaves the queue and is not retried; a later
     * {@link #getOrLoad(ChunkKey)} queues it again.</p>
     *
     * @throws CacheExhaustedException if the insert could not be balanced by eviction
     */
    void completeLoad(ChunkKey key, T chunk, Throwable error) {
        lock.lock();
        try {
            queue.complete(key);
            if (error != null) {
                loadFailures.increment();
                FetchFailedException failure = new FetchFailedException(key, error);
                if (failure.isNotFound()) {
                    logger.debug("Chunk {} not found in backend", key);
                } else {
                    logger.warn("Fetch of {} failed: {}", key, error.getMessage());
                }
                emit(CacheEvent.error(key, failure.getMessage()));
                return;
            }
            if (closed) {
                logger.debug("Discarding {} fetched after close", key);
                return;
            }
            if (entries.containsKey(key)) {
                logger.debug("Discarding fetched {}: already cached", key);
                return;
            }
            insert(key, chunk, false);
            loads.increment();
            emit(CacheEvent.loaded(key, snapshot.apply(chunk)));
            evictUntilUnderCapacity(key);
        } finally {
            lock.unlock();
        }
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    /**
     * Insert locally produced content (for example a freshly generated chunk).
     *
     * <p>The entry is dirty until saved. A queued load for the key is dropped;
     * an in-flight fetch for it is discarded when it completes.</p>
     *
     * @throws CacheExhaustedException if the insert could not be balanced by eviction
     */
    public void put(ChunkKey key, T chunk) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(chunk, "chunk");
        lock.lock();
        try {
            ensureOpen();
            queue.removePending(key);
            CacheEntry<T> existing = entries.get(key);
            if (existing != null) {
                existing.setChunk(chunk);
                existing.markDirty();
                existing.touch(clock.millis());
                return;
            }
            insert(key, chunk, true);
            evictUntilUnderCapacity(key);
        } finally {
            lock.unlock();
        }
    }

    private void insert(ChunkKey key, T chunk, boolean dirty) {
        int priority = priorityOf(key);
        entries.put(key, new CacheEntry<>(key, chunk, nextSequence++, clock.millis(), priority, dirty));
        logger.debug("Cached {} (priority={}, size={})", key, priority, entries.size());
    }

    // ==========================================================================
    // Prefetch
    // ==========================================================================

    /**
     * Queue every chunk within {@code radius} (Chebyshev) of a world position.
     *
     * <p>Keys of the same owner that are queued but not yet dispatched are dropped
     * first: the newest request wins. Cached and in-flight keys are skipped.
     * Pending keys of other owners are untouched.</p>
     *
     * @param ownerId owning context id
     * @param centerWorld center in world coordinates
     * @param radius square radius in chunks
     * @return the keys queued by this call, closest first
     */
    public List<ChunkKey> prefetchRadius(String ownerId, GridPoint centerWorld, int radius) {
        Objects.requireNonNull(ownerId, "ownerId");
        if (radius < 0) {
            throw new IllegalArgumentException("radius must not be negative: " + radius);
        }
        GridPoint center = ChunkGrid.toChunkPosition(centerWorld, config.getChunkSize());
        List<ChunkKey> enqueued = new ArrayList<>();
        lock.lock();
        try {
            ensureOpen();
            int dropped = queue.clearPending(ownerId);
            for (GridPoint p : ChunkGrid.square(center, radius)) {
                ChunkKey key = new ChunkKey(ownerId, p.getX(), p.getY());
                if (!entries.containsKey(key) && queue.enqueue(key)) {
                    enqueued.add(key);
                }
            }
            logger.debug("Prefetch {} around chunk {} r={}: dropped={} queued={}",
                         ownerId, center, radius, dropped, enqueued.size());
            if (!enqueued.isEmpty()) {
                startDrainLoop();
            }
        } finally {
            lock.unlock();
        }
        return enqueued;
    }

    /**
     * {@link #prefetchRadius} with the configured preload radius.
     */
    public List<ChunkKey> prefetchAround(String ownerId, GridPoint centerWorld) {
        return prefetchRadius(ownerId, centerWorld, config.getPreloadRadius());
    }

    // ==========================================================================
    // Priority
    // ==========================================================================

    /**
     * Priority tier of a key relative to the current reference point.
     */
    public int computePriority(ChunkKey key) {
        lock.lock();
        try {
            return priorityOf(key);
        } finally {
            lock.unlock();
        }
    }

    private int priorityOf(ChunkKey key) {
        return EvictionPolicy.computePriority(key.position(), referencePoint,
                                              config.getPreloadRadius(), config.getPriorityLevels());
    }

    /**
     * Move the reference point used for new entries. Existing tiers are kept
     * until {@link #recomputePriorities()} is called.
     *
     * @param chunkPosition reference point in chunk grid coordinates
     */
    public void setReferencePoint(GridPoint chunkPosition) {
        Objects.requireNonNull(chunkPosition, "chunkPosition");
        lock.lock();
        try {
            this.referencePoint = chunkPosition;
        } finally {
            lock.unlock();
        }
    }

    public GridPoint getReferencePoint() {
        lock.lock();
        try {
            return referencePoint;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Re-tier every cached entry against the current reference point.
     *
     * @return number of entries whose tier changed
     */
    public int recomputePriorities() {
        lock.lock();
        try {
            ensureOpen();
            int changed = 0;
            for (CacheEntry<T> entry : entries.values()) {
                int p = priorityOf(entry.getKey());
                if (p != entry.getPriority()) {
                    entry.setPriority(p);
                    changed++;
                }
            }
            return changed;
        } finally {
            lock.unlock();
        }
    }

    // ==========================================================================
    // Access and mutation
    // ==========================================================================

    /**
     * Lend the cached chunk to {@code reader} for the duration of the call.
     * The reference must not escape the function.
     *
     * @throws ChunkNotCachedException if the key is not cached
     */
    public <R> R read(ChunkKey key, Function<? super T, R> reader) {
        lock.lock();
        try {
            ensureOpen();
            CacheEntry<T> entry = requireEntry(key);
            entry.touch(clock.millis());
            return reader.apply(entry.getChunk());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replace the cached chunk with {@code updater}'s result and mark it dirty.
     *
     * @throws ChunkNotCachedException if the key is not cached
     */
    public void update(ChunkKey key, UnaryOperator<T> updater) {
        lock.lock();
        try {
            ensureOpen();
            CacheEntry<T> entry = requireEntry(key);
            T updated = Objects.requireNonNull(updater.apply(entry.getChunk()), "updater returned null");
            entry.setChunk(updated);
            entry.markDirty();
            entry.touch(clock.millis());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Flag a cached chunk as diverged from its persisted copy.
     *
     * @throws ChunkNotCachedException if the key is not cached
     */
    public void markDirty(ChunkKey key) {
        lock.lock();
        try {
            ensureOpen();
            requireEntry(key).markDirty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Pin an entry so that neither capacity eviction nor stale unloading removes it.
     *
     * @throws ChunkNotCachedException if the key is not cached
     */
    public void activate(ChunkKey key) {
        lock.lock();
        try {
            ensureOpen();
            requireEntry(key).setPinned(true);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Unpin an entry. Over-capacity is resolved on the next insert.
     *
     * @throws ChunkNotCachedException if the key is not cached
     */
    public void deactivate(ChunkKey key) {
        lock.lock();
        try {
            ensureOpen();
            requireEntry(key).setPinned(false);
        } finally {
            lock.unlock();
        }
    }

    private CacheEntry<T> requireEntry(ChunkKey key) {
        CacheEntry<T> entry = entries.get(key);
        if (entry == null) {
            throw new ChunkNotCachedException(key);
        }
        return entry;
    }

    // ==========================================================================
    // Persistence
    // ==========================================================================

    /**
     * Write a cached chunk to the backend and mark it clean.
     *
     * @throws ChunkNotCachedException if the key is not cached
     * @throws PersistFailedException if the backend rejected the write
     */
    public void save(ChunkKey key) {
        lock.lock();
        try {
            ensureOpen();
            writeBack(requireEntry(key));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Save every dirty entry.
     *
     * @return one result per dirty entry, in table order; empty if nothing was dirty
     */
    public List<SaveResult> saveAllDirty() {
        lock.lock();
        try {
            ensureOpen();
            return flushDirty();
        } finally {
            lock.unlock();
        }
    }

    private List<SaveResult> flushDirty() {
        List<SaveResult> results = new ArrayList<>();
        for (CacheEntry<T> entry : new ArrayList<>(entries.values())) {
            if (!entry.isDirty()) {
                continue;
            }
            try {
                writeBack(entry);
                results.add(SaveResult.success(entry.getKey()));
            } catch (PersistFailedException e) {
                results.add(SaveResult.failure(entry.getKey(), e));
            }
        }
        if (!results.isEmpty()) {
            long failed = results.stream().filter(r -> !r.isSuccess()).count();
            logger.info("Saved {} dirty chunks ({} failed)", results.size() - failed, failed);
        }
        return results;
    }

    /**
     * Persist an entry; must hold the lock.
     */
    private void writeBack(CacheEntry<T> entry) {
        ChunkKey key = entry.getKey();
        try {
            backend.persist(key.getOwnerId(), key.getX(), key.getY(), entry.getChunk());
        } catch (RuntimeException e) {
            saveFailures.increment();
            PersistFailedException failure = new PersistFailedException(key, e);
            logger.warn("Write-back of {} failed: {}", key, e.getMessage());
            emit(CacheEvent.error(key, failure.getMessage()));
            throw failure;
        }
        entry.markClean();
        saves.increment();
        emit(CacheEvent.saved(key));
    }

    // ==========================================================================
    // Eviction
    // ==========================================================================

    /**
     * Remove entries until the table is within capacity; must hold the lock.
     *
     * @param justInserted key exempt from selection
     */
    private void evictUntilUnderCapacity(ChunkKey justInserted) {
        int capacity = config.getMaxCachedChunks();
        while (entries.size() > capacity) {
            CacheEntry<T> victim = EvictionPolicy.selectVictim(entries.values(), justInserted);
            if (victim == null) {
                logger.warn("Cache over capacity ({}/{}): all remaining entries are pinned",
                            entries.size(), capacity);
                return;
            }
            if (victim.isDirty()) {
                try {
                    writeBack(victim);
                } catch (PersistFailedException e) {
                    CacheExhaustedException exhausted =
                        new CacheExhaustedException(victim.getKey(), entries.size(), capacity, e.getCause());
                    logger.error(exhausted.getMessage());
                    throw exhausted;
                }
            }
            remove(victim.getKey());
        }
    }

    /**
     * Remove one entry, writing it back first if dirty.
     *
     * @throws ChunkNotCachedException if the key is not cached
     * @throws PersistFailedException if the write-back failed; the entry is kept
     */
    public void evict(ChunkKey key) {
        lock.lock();
        try {
            ensureOpen();
            CacheEntry<T> entry = requireEntry(key);
            if (entry.isDirty()) {
                writeBack(entry);
            }
            remove(key);
        } finally {
            lock.unlock();
        }
    }

    private void remove(ChunkKey key) {
        entries.remove(key);
        evictions.increment();
        logger.debug("Evicted {} (size={})", key, entries.size());
        emit(CacheEvent.evicted(key));
    }

    /**
     * Remove unpinned entries idle for longer than {@code unloadThresholdMs}.
     * Dirty entries are written back first; a failed write keeps the entry.
     *
     * @return one result per stale entry: success if it was unloaded
     */
    public List<SaveResult> unloadStale() {
        lock.lock();
        try {
            ensureOpen();
            long cutoff = clock.millis() - config.getUnloadThresholdMs();
            List<SaveResult> results = new ArrayList<>();
            for (CacheEntry<T> entry : new ArrayList<>(entries.values())) {
                if (entry.isPinned() || entry.getLastAccessed() >= cutoff) {
                    continue;
                }
                try {
                    if (entry.isDirty()) {
                        writeBack(entry);
                    }
                    remove(entry.getKey());
                    results.add(SaveResult.success(entry.getKey()));
                } catch (PersistFailedException e) {
                    results.add(SaveResult.failure(entry.getKey(), e));
                }
            }
            if (!results.isEmpty()) {
                logger.debug("Stale unload: {} candidates, size now {}", results.size(), entries.size());
            }
            return results;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Empty the table and drop every queued (not yet dispatched) load.
     *
     * @param force if true, dirty entries are discarded (logged); otherwise they are
     *              saved first and nothing is removed if any save fails
     * @return number of entries removed
     * @throws PersistFailedException if {@code force} is false and a save failed
     */
    public int clear(boolean force) {
        lock.lock();
        try {
            ensureOpen();
            if (force) {
                for (CacheEntry<T> entry : entries.values()) {
                    if (entry.isDirty()) {
                        logger.warn("Discarding unsaved changes of {}", entry.getKey());
                    }
                }
            } else {
                PersistFailedException first = null;
                for (SaveResult r : flushDirty()) {
                    if (!r.isSuccess()) {
                        if (first == null) {
                            first = (PersistFailedException) r.getError();
                        } else {
                            first.addSuppressed(r.getError());
                        }
                    }
                }
                if (first != null) {
                    throw first;
                }
            }
            int count = entries.size();
            entries.clear();
            int dropped = queue.clearPending();
            logger.info("Cleared {} chunks, dropped {} queued loads", count, dropped);
            emit(CacheEvent.cleared(count));
            return count;
        } finally {
            lock.unlock();
        }
    }

    // ==========================================================================
    // Drain loop
    // ==========================================================================

    /**
     * Start the drain loop if a scheduler is configured and no loop is running;
     * must hold the lock.
     */
    private void startDrainLoop() {
        scheduleDrain(0);
    }

    private void scheduleDrain(long delayMs) {
        if (scheduler == null || closed || draining) {
            return;
        }
        try {
            nextDrain = scheduler.schedule(this::runDrainStep, delayMs, TimeUnit.MILLISECONDS);
            draining = true;
        } catch (RejectedExecutionException e) {
            logger.warn("Drain scheduler rejected the next step; queue must be drained manually", e);
        }
    }

    private void runDrainStep() {
        CompletableFuture<QueueReport> step;
        try {
            step = processQueue();
        } catch (IllegalStateException e) {
            logger.debug("Drain loop stopped: {}", e.getMessage());
            finishDrainStep();
            return;
        }
        step.whenComplete((report, error) -> {
            if (error != null) {
                logger.error("Drain step failed", unwrap(error));
            }
            finishDrainStep();
        });
    }

    private void finishDrainStep() {
        lock.lock();
        try {
            draining = false;
            nextDrain = null;
            if (queue.pendingCount() > 0) {
                scheduleDrain(config.getLoadingDelayMs());
            }
        } finally {
            lock.unlock();
        }
    }

    // ==========================================================================
    // Events
    // ==========================================================================

    public void addListener(CacheListener<T> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public boolean removeListener(CacheListener<T> listener) {
        return listeners.remove(listener);
    }

    private void emit(CacheEvent<T> event) {
        for (CacheListener<T> listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                logger.warn("Listener failed on {}", event, e);
            }
        }
    }

    // ==========================================================================
    // Introspection
    // ==========================================================================

    public CacheConfig getConfig() {
        return config;
    }

    /**
     * Lifecycle state of a key.
     */
    public ChunkState stateOf(ChunkKey key) {
        lock.lock();
        try {
            CacheEntry<T> entry = entries.get(key);
            if (entry != null) {
                return entry.isDirty() ? ChunkState.CACHED_DIRTY : ChunkState.CACHED_CLEAN;
            }
            if (queue.isInFlight(key)) {
                return ChunkState.LOADING;
            }
            return queue.isPending(key) ? ChunkState.QUEUED : ChunkState.ABSENT;
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(ChunkKey key) {
        lock.lock();
        try {
            return entries.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Priority tier of a cached entry.
     *
     * @throws ChunkNotCachedException if the key is not cached
     */
    public int priorityOfEntry(ChunkKey key) {
        lock.lock();
        try {
            return requireEntry(key).getPriority();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int pendingCount() {
        lock.lock();
        try {
            return queue.pendingCount();
        } finally {
            lock.unlock();
        }
    }

    public int inFlightCount() {
        lock.lock();
        try {
            return queue.inFlightCount();
        } finally {
            lock.unlock();
        }
    }

    public int dirtyCount() {
        lock.lock();
        try {
            int n = 0;
            for (CacheEntry<T> entry : entries.values()) {
                if (entry.isDirty()) {
                    n++;
                }
            }
            return n;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cached keys of one owner, in insertion order.
     */
    public List<ChunkKey> cachedKeys(String ownerId) {
        lock.lock();
        try {
            List<ChunkKey> keys = new ArrayList<>();
            for (ChunkKey key : entries.keySet()) {
                if (key.getOwnerId().equals(ownerId)) {
                    keys.add(key);
                }
            }
            return Collections.unmodifiableList(keys);
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats() {
        return new CacheStats(hits.sum(), misses.sum(), loads.sum(), loadFailures.sum(),
                              evictions.sum(), saves.sum(), saveFailures.sum());
    }

    public boolean isClosed() {
        return closed;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("ChunkCache is closed");
        }
    }

    // ==========================================================================
    // Lifecycle
    // ==========================================================================

    /**
     * Stop the drain loop and flush dirty chunks. Failed writes are logged; their
     * content is lost once the cache is discarded. Fetches already in flight run to
     * completion and are discarded.
     */
    @Override
    public void close() {
        List<SaveResult> results;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            results = flushDirty();
            closed = true;
            if (nextDrain != null) {
                nextDrain.cancel(false);
                nextDrain = null;
            }
            draining = false;
        } finally {
            lock.unlock();
        }
        for (SaveResult r : results) {
            if (!r.isSuccess()) {
                logger.error("Chunk {} not saved on close: {}", r.getKey(), r.getError().getMessage());
            }
        }
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }
}
