package dev.henneberger.vertx.shapesync.core;

public final class ShapeNotFoundException extends ShapeRegistryException {

  public ShapeNotFoundException(String handle) {
    super(handle, "shape not found: " + handle);
  }
}
