package dev.henneberger.vertx.shapesync.core;

public final class ShapeStateChange {
  private final String handle;
  private final ShapeState previousState;
  private final ShapeState state;

  public ShapeStateChange(String handle, ShapeState previousState, ShapeState state) {
    this.handle = handle;
    this.previousState = previousState;
    this.state = state;
  }

  public String handle() {
    return handle;
  }

  /**
   * {@code null} when the shape was just created.
   */
  public ShapeState previousState() {
    return previousState;
  }

  public ShapeState state() {
    return state;
  }
}
