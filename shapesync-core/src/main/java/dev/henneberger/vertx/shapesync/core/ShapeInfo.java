package dev.henneberger.vertx.shapesync.core;

import io.vertx.core.Future;
import java.util.List;

/**
 * Point-in-time view of a registered shape.
 */
public final class ShapeInfo {
  private final String handle;
  private final ShapeDefinition definition;
  private final ShapeState state;
  private final LogOffset latestOffset;
  private final List<ChunkBoundary> completedChunks;
  private final Future<Void> snapshotReady;

  ShapeInfo(String handle,
            ShapeDefinition definition,
            ShapeState state,
            LogOffset latestOffset,
            List<ChunkBoundary> completedChunks,
            Future<Void> snapshotReady) {
    this.handle = handle;
    this.definition = definition;
    this.state = state;
    this.latestOffset = latestOffset;
    this.completedChunks = completedChunks;
    this.snapshotReady = snapshotReady;
  }

  public String handle() {
    return handle;
  }

  public ShapeDefinition definition() {
    return definition;
  }

  public String hash() {
    return definition.hash();
  }

  public ShapeState state() {
    return state;
  }

  public LogOffset latestOffset() {
    return latestOffset;
  }

  /** Chunks closed at the time of the view, oldest first. */
  public List<ChunkBoundary> completedChunks() {
    return completedChunks;
  }

  /** Completes once the snapshot is ready or the shape goes away. */
  public Future<Void> snapshotReady() {
    return snapshotReady;
  }
}
