package dev.henneberger.vertx.shapesync.core;

import java.util.Objects;

/**
 * One stored log entry. Offsets stay in their text form at the storage boundary.
 */
public final class LogItem {

  public enum Operation {
    INSERT,
    UPDATE,
    DELETE
  }

  private final String offset;
  private final String key;
  private final Operation operation;
  private final String json;

  public LogItem(String offset, String key, Operation operation, String json) {
    this.offset = Objects.requireNonNull(offset, "offset");
    this.key = Objects.requireNonNull(key, "key");
    this.operation = Objects.requireNonNull(operation, "operation");
    this.json = Objects.requireNonNull(json, "json");
  }

  public String getOffset() {
    return offset;
  }

  public String getKey() {
    return key;
  }

  public Operation getOperation() {
    return operation;
  }

  public String getJson() {
    return json;
  }

  @Override
  public String toString() {
    return "LogItem{offset=" + offset + ", key=" + key + ", operation=" + operation + '}';
  }
}
