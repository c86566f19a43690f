package dev.henneberger.vertx.shapesync.core;

import io.vertx.core.Future;

public final class ShapeRegistration {
  private final String handle;
  private final boolean created;
  private final Future<Void> snapshotReady;

  ShapeRegistration(String handle, boolean created, Future<Void> snapshotReady) {
    this.handle = handle;
    this.created = created;
    this.snapshotReady = snapshotReady;
  }

  public String handle() {
    return handle;
  }

  /**
   * {@code true} if this call created the shape and the caller is expected to produce its
   * snapshot.
   */
  public boolean created() {
    return created;
  }

  public Future<Void> snapshotReady() {
    return snapshotReady;
  }
}
