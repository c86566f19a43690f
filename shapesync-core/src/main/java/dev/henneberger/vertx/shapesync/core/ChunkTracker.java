package dev.henneberger.vertx.shapesync.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Splits a shape log into chunks of roughly {@link #threshold()} bytes.
 *
 * <p>A chunk is closed by the first item that would bring it to the threshold; that item opens
 * the next chunk. Safe for concurrent readers with a single writer.
 */
public final class ChunkTracker {

  public static final long DEFAULT_THRESHOLD_BYTES = 10L * 1024 * 1024;

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final long threshold;
  private final List<ChunkBoundary> completed = new ArrayList<>();
  private final Map<LogOffset, LogOffset> endsByStart = new HashMap<>();
  private LogOffset chunkStart;
  private LogOffset lastOffset;
  private long chunkSize;

  public ChunkTracker() {
    this(DEFAULT_THRESHOLD_BYTES);
  }

  /**
   * @param threshold chunk size in bytes, values {@code <= 0} select {@link #DEFAULT_THRESHOLD_BYTES}
   */
  public ChunkTracker(long threshold) {
    this.threshold = threshold <= 0 ? DEFAULT_THRESHOLD_BYTES : threshold;
  }

  /**
   * Records an item of {@code size} bytes at {@code offset}.
   *
   * @return {@code true} if the item closed the previous chunk
   */
  public boolean add(LogOffset offset, long size) {
    lock.writeLock().lock();
    try {
      if (chunkStart == null) {
        chunkStart = offset;
        lastOffset = offset;
        chunkSize = size;
        return false;
      }
      if (chunkSize + size >= threshold) {
        ChunkBoundary boundary = new ChunkBoundary(chunkStart, lastOffset);
        completed.add(boundary);
        endsByStart.put(boundary.start(), boundary.end());
        chunkStart = offset;
        lastOffset = offset;
        chunkSize = size;
        return true;
      }
      chunkSize += size;
      lastOffset = offset;
      return false;
    } finally {
      lock.writeLock().unlock();
    }
  }

  public Optional<LogOffset> getChunkEnd(LogOffset start) {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(endsByStart.get(start));
    } finally {
      lock.readLock().unlock();
    }
  }

  public boolean isChunkComplete(LogOffset start) {
    return getChunkEnd(start).isPresent();
  }

  public void reset() {
    lock.writeLock().lock();
    try {
      completed.clear();
      endsByStart.clear();
      chunkStart = null;
      lastOffset = null;
      chunkSize = 0;
    } finally {
      lock.writeLock().unlock();
    }
  }

  public Optional<LogOffset> currentChunkStart() {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(chunkStart);
    } finally {
      lock.readLock().unlock();
    }
  }

  public long currentChunkSize() {
    lock.readLock().lock();
    try {
      return chunkSize;
    } finally {
      lock.readLock().unlock();
    }
  }

  public Optional<LogOffset> lastOffset() {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(lastOffset);
    } finally {
      lock.readLock().unlock();
    }
  }

  public boolean hasItems() {
    lock.readLock().lock();
    try {
      return chunkStart != null;
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Closed chunks in the order they were closed. */
  public List<ChunkBoundary> completedChunks() {
    lock.readLock().lock();
    try {
      return Collections.unmodifiableList(new ArrayList<>(completed));
    } finally {
      lock.readLock().unlock();
    }
  }

  public long threshold() {
    return threshold;
  }
}
