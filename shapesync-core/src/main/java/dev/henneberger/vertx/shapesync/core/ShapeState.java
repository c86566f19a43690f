package dev.henneberger.vertx.shapesync.core;

public enum ShapeState {
  CREATING,
  ACTIVE,
  DELETED
}
