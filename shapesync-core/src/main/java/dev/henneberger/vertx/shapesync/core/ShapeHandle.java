package dev.henneberger.vertx.shapesync.core;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Opaque shape identifier of the form {@code {hash}-{microsTimestamp}}.
 */
public final class ShapeHandle {

  private static final Pattern HASH = Pattern.compile("[0-9a-f]{16}");

  private final String hash;
  private final long timestampMicros;

  public ShapeHandle(String hash, long timestampMicros) {
    if (hash == null || !HASH.matcher(hash).matches()) {
      throw new IllegalArgumentException("shape hash must be 16 lowercase hex characters: " + hash);
    }
    if (timestampMicros <= 0) {
      throw new IllegalArgumentException("timestamp must be positive");
    }
    this.hash = hash;
    this.timestampMicros = timestampMicros;
  }

  public static ShapeHandle parse(String text) {
    Objects.requireNonNull(text, "text");
    int dash = text.indexOf('-');
    if (dash < 0 || dash != text.lastIndexOf('-')) {
      throw new IllegalArgumentException("invalid shape handle: " + text);
    }
    long timestamp;
    try {
      timestamp = Long.parseLong(text.substring(dash + 1));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("invalid shape handle: " + text, e);
    }
    return new ShapeHandle(text.substring(0, dash), timestamp);
  }

  public String hash() {
    return hash;
  }

  public long timestampMicros() {
    return timestampMicros;
  }

  public boolean sameShape(ShapeDefinition definition) {
    return hash.equals(definition.hash());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ShapeHandle)) {
      return false;
    }
    ShapeHandle that = (ShapeHandle) o;
    return timestampMicros == that.timestampMicros && hash.equals(that.hash);
  }

  @Override
  public int hashCode() {
    return Objects.hash(hash, timestampMicros);
  }

  @Override
  public String toString() {
    return hash + "-" + timestampMicros;
  }
}
