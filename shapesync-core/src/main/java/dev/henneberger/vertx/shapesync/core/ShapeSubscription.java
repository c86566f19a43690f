package dev.henneberger.vertx.shapesync.core;

@FunctionalInterface
public interface ShapeSubscription {
  void cancel();
}
