package dev.henneberger.vertx.shapesync.core;

import java.util.Objects;

/**
 * Inclusive start and end offsets of a closed chunk.
 */
public final class ChunkBoundary {
  private final LogOffset start;
  private final LogOffset end;

  public ChunkBoundary(LogOffset start, LogOffset end) {
    this.start = Objects.requireNonNull(start, "start");
    this.end = Objects.requireNonNull(end, "end");
  }

  public LogOffset start() {
    return start;
  }

  public LogOffset end() {
    return end;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ChunkBoundary)) {
      return false;
    }
    ChunkBoundary that = (ChunkBoundary) o;
    return start.equals(that.start) && end.equals(that.end);
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, end);
  }

  @Override
  public String toString() {
    return "ChunkBoundary{start=" + start + ", end=" + end + '}';
  }
}
