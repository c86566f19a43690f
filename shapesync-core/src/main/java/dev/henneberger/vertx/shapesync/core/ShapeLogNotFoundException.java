package dev.henneberger.vertx.shapesync.core;

/**
 * Thrown by a {@link ShapeLogStore} that holds no data for a shape.
 */
public final class ShapeLogNotFoundException extends Exception {
  private final String handle;

  public ShapeLogNotFoundException(String handle) {
    super("no stored log for shape " + handle);
    this.handle = handle;
  }

  public String handle() {
    return handle;
  }
}
