package dev.henneberger.vertx.shapesync.core;

public final class ShapeLogReadException extends ShapeRegistryException {

  public ShapeLogReadException(String handle, Throwable cause) {
    super(handle, "failed to read log of " + handle + ": " + cause.getMessage(), cause);
  }
}
