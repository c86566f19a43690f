package dev.henneberger.vertx.shapesync.core;

public final class InvalidStateTransitionException extends ShapeRegistryException {
  private final ShapeState from;
  private final ShapeState to;

  public InvalidStateTransitionException(String handle, ShapeState from, ShapeState to) {
    super(handle, "invalid shape state transition for " + handle + ": " + from + " -> " + to);
    this.from = from;
    this.to = to;
  }

  public ShapeState from() {
    return from;
  }

  public ShapeState to() {
    return to;
  }
}
