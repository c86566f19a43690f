package dev.henneberger.vertx.shapesync.core;

import java.util.Objects;

public final class ShapeLogEntry {
  private final LogOffset offset;
  private final String key;
  private final LogItem.Operation operation;
  private final String json;

  public ShapeLogEntry(LogOffset offset, String key, LogItem.Operation operation, String json) {
    this.offset = Objects.requireNonNull(offset, "offset");
    this.key = key;
    this.operation = operation;
    this.json = json;
  }

  public LogOffset getOffset() {
    return offset;
  }

  public String getKey() {
    return key;
  }

  public LogItem.Operation getOperation() {
    return operation;
  }

  public String getJson() {
    return json;
  }
}
