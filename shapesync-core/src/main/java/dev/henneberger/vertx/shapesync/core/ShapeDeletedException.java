package dev.henneberger.vertx.shapesync.core;

public final class ShapeDeletedException extends ShapeRegistryException {

  public ShapeDeletedException(String handle) {
    super(handle, "shape has been deleted: " + handle);
  }
}
