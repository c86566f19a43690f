package dev.henneberger.vertx.shapesync.core;

/**
 * Base type of the failures raised by {@link ShapeRegistry}.
 */
public class ShapeRegistryException extends IllegalStateException {

  private final String handle;

  public ShapeRegistryException(String handle, String message) {
    super(message);
    this.handle = handle;
  }

  public ShapeRegistryException(String handle, String message, Throwable cause) {
    super(message, cause);
    this.handle = handle;
  }

  public String handle() {
    return handle;
  }
}
