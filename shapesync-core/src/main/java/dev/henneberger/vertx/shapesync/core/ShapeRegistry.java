package dev.henneberger.vertx.shapesync.core;

import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the lifecycle of every shape served by the process.
 *
 * <p>Shapes are deduplicated by {@link ShapeDefinition#hash()}: concurrent callers asking for the
 * same definition share one handle. A deleted shape stays behind as a tombstone so that late
 * writers see {@link ShapeDeletedException} instead of {@link ShapeNotFoundException}; asking for
 * its definition again creates a new shape with a new handle.
 *
 * <p>Snapshot waiters and state listeners are always notified after the registry lock has been
 * released, so they may call back into the registry.
 */
public final class ShapeRegistry {

  private static final Logger LOG = LoggerFactory.getLogger(ShapeRegistry.class);

  private final ShapeLogStore logStore;
  private final ShapeRegistryOptions options;
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<String, Entry> byHandle = new HashMap<>();
  private final Map<String, String> handleByHash = new HashMap<>();
  private final List<Handler<ShapeStateChange>> stateHandlers = new CopyOnWriteArrayList<>();
  private final AtomicLong lastHandleMicros = new AtomicLong();

  public ShapeRegistry(ShapeLogStore logStore) {
    this(logStore, new ShapeRegistryOptions());
  }

  public ShapeRegistry(ShapeLogStore logStore, ShapeRegistryOptions options) {
    this.logStore = Objects.requireNonNull(logStore, "logStore");
    this.options = new ShapeRegistryOptions(Objects.requireNonNull(options, "options"));
    this.options.validate();
  }

  public ShapeRegistration getOrCreate(ShapeDefinition definition) {
    Objects.requireNonNull(definition, "definition");
    String hash = definition.hash();

    lock.readLock().lock();
    try {
      Entry existing = liveByHash(hash);
      if (existing != null) {
        return new ShapeRegistration(existing.handle, false, existing.snapshotReady.future());
      }
    } finally {
      lock.readLock().unlock();
    }

    Entry created;
    lock.writeLock().lock();
    try {
      Entry existing = liveByHash(hash);
      if (existing != null) {
        return new ShapeRegistration(existing.handle, false, existing.snapshotReady.future());
      }
      String handle = new ShapeHandle(hash, nextHandleMicros()).toString();
      created = new Entry(handle, definition, new ChunkTracker(options.getChunkThresholdBytes()));
      byHandle.put(handle, created);
      handleByHash.put(hash, handle);
    } finally {
      lock.writeLock().unlock();
    }

    LOG.info("Created shape {} for {}", created.handle, definition);
    emit(new ShapeStateChange(created.handle, null, ShapeState.CREATING));
    return new ShapeRegistration(created.handle, true, created.snapshotReady.future());
  }

  public Optional<ShapeInfo> get(String handle) {
    lock.readLock().lock();
    try {
      Entry entry = byHandle.get(handle);
      return entry == null ? Optional.empty() : Optional.of(entry.view());
    } finally {
      lock.readLock().unlock();
    }
  }

  public Optional<ShapeInfo> getByHash(String hash) {
    lock.readLock().lock();
    try {
      Entry entry = liveByHash(hash);
      return entry == null ? Optional.empty() : Optional.of(entry.view());
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Soft-deletes a shape. Deleting an already deleted shape does nothing.
   *
   * @throws ShapeNotFoundException if the handle was never registered or has been removed
   */
  public void delete(String handle) {
    ShapeStateChange change;
    Entry entry;
    lock.writeLock().lock();
    try {
      entry = byHandle.get(handle);
      if (entry == null) {
        throw new ShapeNotFoundException(handle);
      }
      if (entry.state == ShapeState.DELETED) {
        return;
      }
      change = new ShapeStateChange(handle, entry.state, ShapeState.DELETED);
      entry.state = ShapeState.DELETED;
      handleByHash.remove(entry.hash, handle);
    } finally {
      lock.writeLock().unlock();
    }
    LOG.info("Deleted shape {}", handle);
    entry.releaseWaiters();
    emit(change);
  }

  /**
   * Evicts a shape entirely. Waiters on its snapshot are released.
   */
  public void remove(String handle) {
    Entry entry;
    lock.writeLock().lock();
    try {
      entry = byHandle.remove(handle);
      if (entry == null) {
        throw new ShapeNotFoundException(handle);
      }
      handleByHash.remove(entry.hash, handle);
    } finally {
      lock.writeLock().unlock();
    }
    LOG.debug("Removed shape {}", handle);
    entry.releaseWaiters();
  }

  /**
   * Moves the shape's latest offset forward. Offsets that are not strictly later than the current
   * one are ignored.
   */
  public void updateOffset(String handle, LogOffset offset) {
    Objects.requireNonNull(offset, "offset");
    lock.readLock().lock();
    try {
      Entry entry = requireLive(handle);
      synchronized (entry) {
        if (offset.isAfter(entry.latestOffset)) {
          entry.latestOffset = offset;
        }
      }
    } finally {
      lock.readLock().unlock();
    }
  }

  public LogOffset latestOffset(String handle) {
    lock.readLock().lock();
    try {
      Entry entry = requireKnown(handle);
      synchronized (entry) {
        return entry.latestOffset;
      }
    } finally {
      lock.readLock().unlock();
    }
  }

  public ShapeState state(String handle) {
    lock.readLock().lock();
    try {
      return requireKnown(handle).state;
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Completes when the shape's snapshot is ready, immediately for shapes that are already active
   * or deleted. Completion of {@code cancellation}, successful or not, fails the returned future
   * with {@link SnapshotWaitCancelledException} unless the snapshot became ready first. A cancelled
   * waiter is dropped from the shape right away.
   *
   * @param cancellation optional, may be {@code null}
   */
  public Future<Void> awaitSnapshot(String handle, Future<?> cancellation) {
    Entry entry;
    lock.readLock().lock();
    try {
      entry = byHandle.get(handle);
    } finally {
      lock.readLock().unlock();
    }
    if (entry == null) {
      return Future.failedFuture(new ShapeNotFoundException(handle));
    }
    if (entry.state != ShapeState.CREATING) {
      return Future.succeededFuture();
    }

    Promise<Void> waiter = Promise.promise();
    if (!entry.addWaiter(waiter)) {
      return Future.succeededFuture();
    }
    if (cancellation != null) {
      cancellation.onComplete(ar -> {
        entry.removeWaiter(waiter);
        waiter.tryFail(new SnapshotWaitCancelledException(handle,
          ar.succeeded() ? "cancelled by caller" : String.valueOf(ar.cause())));
      });
    }
    return waiter.future();
  }

  public void awaitSnapshotBlocking(String handle) throws InterruptedException {
    awaitSnapshotBlocking(handle, options.getSnapshotTimeout());
  }

  /**
   * Blocks the calling thread until the snapshot is ready. Must not be called from an event loop.
   *
   * @throws SnapshotWaitCancelledException if {@code timeout} elapses first
   */
  public void awaitSnapshotBlocking(String handle, Duration timeout) throws InterruptedException {
    CountDownLatch latch = new CountDownLatch(1);
    AtomicReference<Throwable> failure = new AtomicReference<>();
    awaitSnapshot(handle, null).onComplete(ar -> {
      if (ar.failed()) {
        failure.set(ar.cause());
      }
      latch.countDown();
    });
    if (!latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
      throw new SnapshotWaitCancelledException(handle, "timed out after " + timeout.toMillis() + "ms");
    }
    Throwable err = failure.get();
    if (err instanceof RuntimeException) {
      throw (RuntimeException) err;
    }
    if (err != null) {
      throw new IllegalStateException(err);
    }
  }

  /**
   * Promotes a {@link ShapeState#CREATING} shape to {@link ShapeState#ACTIVE} and releases its
   * snapshot waiters. Shapes in any other state are left alone.
   */
  public void markSnapshotComplete(String handle) {
    ShapeStateChange change;
    Entry entry;
    lock.writeLock().lock();
    try {
      entry = requireKnown(handle);
      if (entry.state != ShapeState.CREATING) {
        return;
      }
      change = activate(entry);
    } finally {
      lock.writeLock().unlock();
    }
    entry.releaseWaiters();
    emit(change);
  }

  public void setState(String handle, ShapeState target) {
    Objects.requireNonNull(target, "target");
    if (target == ShapeState.DELETED) {
      delete(handle);
      return;
    }
    ShapeStateChange change;
    Entry entry;
    lock.writeLock().lock();
    try {
      entry = requireKnown(handle);
      if (target != ShapeState.ACTIVE || entry.state != ShapeState.CREATING) {
        throw new InvalidStateTransitionException(handle, entry.state, target);
      }
      change = activate(entry);
    } finally {
      lock.writeLock().unlock();
    }
    entry.releaseWaiters();
    emit(change);
  }

  /**
   * Reads stored log entries strictly after {@code since}. A shape without stored data yields an
   * empty list; stored entries with unreadable offsets are skipped.
   *
   * @param limit maximum number of entries, {@code <= 0} for no limit
   */
  public List<ShapeLogEntry> getLog(String handle, LogOffset since, int limit) {
    Objects.requireNonNull(since, "since");
    lock.readLock().lock();
    try {
      requireLive(handle);
    } finally {
      lock.readLock().unlock();
    }

    List<LogItem> items;
    try {
      items = logStore.getLogSince(handle, since.toString(), limit);
    } catch (ShapeLogNotFoundException e) {
      return List.of();
    } catch (Exception e) {
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      throw new ShapeLogReadException(handle, e);
    }

    List<ShapeLogEntry> entries = new ArrayList<>(items.size());
    for (LogItem item : items) {
      try {
        entries.add(new ShapeLogEntry(LogOffset.parse(item.getOffset()), item.getKey(),
          item.getOperation(), item.getJson()));
      } catch (InvalidOffsetException e) {
        LOG.warn("Skipping log item of shape {} with invalid offset '{}': {}", handle, item.getOffset(),
          e.getMessage());
      }
    }
    return entries;
  }

  /**
   * End of the closed chunk starting at {@code start}, looked up in memory first and then in the
   * log store.
   */
  public Optional<LogOffset> getChunkEnd(String handle, LogOffset start) {
    Entry entry;
    lock.readLock().lock();
    try {
      entry = byHandle.get(handle);
    } finally {
      lock.readLock().unlock();
    }
    if (entry == null) {
      return Optional.empty();
    }
    Optional<LogOffset> inMemory = entry.chunkTracker.getChunkEnd(start);
    if (inMemory.isPresent()) {
      return inMemory;
    }

    Optional<String> stored;
    try {
      stored = logStore.getChunkEnd(handle, start.toString());
    } catch (Exception e) {
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      throw new ShapeLogReadException(handle, e);
    }
    if (stored.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(LogOffset.parse(stored.get()));
    } catch (InvalidOffsetException e) {
      LOG.warn("Ignoring stored chunk end '{}' of shape {}: {}", stored.get(), handle, e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Feeds the shape's chunk tracker.
   *
   * @return {@code true} if the item closed a chunk
   */
  public boolean addToChunker(String handle, LogOffset offset, long size) {
    lock.readLock().lock();
    try {
      return requireLive(handle).chunkTracker.add(offset, size);
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Most recently closed chunk of the shape, empty for unknown shapes. */
  public Optional<ChunkBoundary> lastCompletedChunk(String handle) {
    Entry entry;
    lock.readLock().lock();
    try {
      entry = byHandle.get(handle);
    } finally {
      lock.readLock().unlock();
    }
    if (entry == null) {
      return Optional.empty();
    }
    List<ChunkBoundary> chunks = entry.chunkTracker.completedChunks();
    return chunks.isEmpty() ? Optional.empty() : Optional.of(chunks.get(chunks.size() - 1));
  }

  public boolean hasShape(String handle) {
    lock.readLock().lock();
    try {
      Entry entry = byHandle.get(handle);
      return entry != null && entry.state != ShapeState.DELETED;
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Shapes that are not deleted. */
  public List<ShapeInfo> list() {
    lock.readLock().lock();
    try {
      List<ShapeInfo> result = new ArrayList<>();
      for (Entry entry : byHandle.values()) {
        if (entry.state != ShapeState.DELETED) {
          result.add(entry.view());
        }
      }
      return result;
    } finally {
      lock.readLock().unlock();
    }
  }

  public int count() {
    lock.readLock().lock();
    try {
      int count = 0;
      for (Entry entry : byHandle.values()) {
        if (entry.state != ShapeState.DELETED) {
          count++;
        }
      }
      return count;
    } finally {
      lock.readLock().unlock();
    }
  }

  public ShapeSubscription onStateChange(Handler<ShapeStateChange> handler) {
    Objects.requireNonNull(handler, "handler");
    stateHandlers.add(handler);
    return () -> stateHandlers.remove(handler);
  }

  /**
   * Releases every snapshot waiter and forgets all shapes.
   */
  public void cleanup() {
    List<Entry> released;
    lock.writeLock().lock();
    try {
      released = new ArrayList<>(byHandle.values());
      byHandle.clear();
      handleByHash.clear();
    } finally {
      lock.writeLock().unlock();
    }
    for (Entry entry : released) {
      entry.releaseWaiters();
    }
    LOG.info("Registry cleaned up, {} shapes released", released.size());
  }

  int pendingSnapshotWaiters(String handle) {
    Entry entry;
    lock.readLock().lock();
    try {
      entry = byHandle.get(handle);
    } finally {
      lock.readLock().unlock();
    }
    return entry == null ? 0 : entry.waiterCount();
  }

  private ShapeStateChange activate(Entry entry) {
    ShapeState previous = entry.state;
    entry.state = ShapeState.ACTIVE;
    return new ShapeStateChange(entry.handle, previous, ShapeState.ACTIVE);
  }

  private Entry liveByHash(String hash) {
    String handle = handleByHash.get(hash);
    if (handle == null) {
      return null;
    }
    Entry entry = byHandle.get(handle);
    return entry == null || entry.state == ShapeState.DELETED ? null : entry;
  }

  private Entry requireKnown(String handle) {
    Entry entry = byHandle.get(handle);
    if (entry == null) {
      throw new ShapeNotFoundException(handle);
    }
    return entry;
  }

  private Entry requireLive(String handle) {
    Entry entry = requireKnown(handle);
    if (entry.state == ShapeState.DELETED) {
      throw new ShapeDeletedException(handle);
    }
    return entry;
  }

  private long nextHandleMicros() {
    Instant now = Instant.now();
    long micros = now.getEpochSecond() * 1_000_000L + now.getNano() / 1_000L;
    return lastHandleMicros.updateAndGet(previous -> Math.max(previous + 1, micros));
  }

  private void emit(ShapeStateChange change) {
    for (Handler<ShapeStateChange> handler : stateHandlers) {
      try {
        handler.handle(change);
      } catch (RuntimeException e) {
        LOG.warn("State change handler failed for shape {}", change.handle(), e);
      }
    }
  }

  private static final class Entry {
    private final String handle;
    private final String hash;
    private final ShapeDefinition definition;
    private final ChunkTracker chunkTracker;
    private final Promise<Void> snapshotReady = Promise.promise();
    private final Set<Promise<Void>> waiters = new LinkedHashSet<>();
    private boolean released;
    private volatile ShapeState state = ShapeState.CREATING;
    private LogOffset latestOffset = LogOffset.INITIAL;

    private Entry(String handle, ShapeDefinition definition, ChunkTracker chunkTracker) {
      this.handle = handle;
      this.hash = definition.hash();
      this.definition = definition;
      this.chunkTracker = chunkTracker;
    }

    private synchronized boolean addWaiter(Promise<Void> waiter) {
      if (released) {
        return false;
      }
      waiters.add(waiter);
      return true;
    }

    private synchronized void removeWaiter(Promise<Void> waiter) {
      waiters.remove(waiter);
    }

    private synchronized int waiterCount() {
      return waiters.size();
    }

    private void releaseWaiters() {
      List<Promise<Void>> pending;
      synchronized (this) {
        if (released) {
          return;
        }
        released = true;
        pending = new ArrayList<>(waiters);
        waiters.clear();
      }
      snapshotReady.tryComplete();
      for (Promise<Void> waiter : pending) {
        waiter.tryComplete();
      }
    }

    private ShapeInfo view() {
      LogOffset offset;
      synchronized (this) {
        offset = latestOffset;
      }
      return new ShapeInfo(handle, definition, state, offset, chunkTracker.completedChunks(),
        snapshotReady.future());
    }
  }
}
