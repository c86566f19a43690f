package dev.henneberger.vertx.shapesync.core;

/**
 * The caller stopped waiting for a snapshot before it became ready.
 */
public final class SnapshotWaitCancelledException extends ShapeRegistryException {

  public SnapshotWaitCancelledException(String handle, String reason) {
    super(handle, "snapshot wait for " + handle + " cancelled: " + reason);
  }
}
