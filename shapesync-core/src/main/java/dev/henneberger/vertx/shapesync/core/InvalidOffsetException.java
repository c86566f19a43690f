package dev.henneberger.vertx.shapesync.core;

/**
 * Raised when a log offset cannot be constructed or parsed.
 */
public final class InvalidOffsetException extends Exception {

  public enum Reason {
    /** The coordinates are numerically outside the allowed range. */
    INVALID_OFFSET,
    /** The text form does not follow the offset grammar. */
    INVALID_FORMAT
  }

  private final Reason reason;

  public InvalidOffsetException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public InvalidOffsetException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
