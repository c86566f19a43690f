package dev.henneberger.vertx.shapesync.core;

import java.util.Objects;
import org.slf4j.Logger;

public final class ShapeSyncLogging {

  private ShapeSyncLogging() {
  }

  public static ShapeSubscription attachDefaultLogging(ShapeRegistry registry, Logger logger) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(logger, "logger");

    return registry.onStateChange(change -> {
      if (change.previousState() == null) {
        logger.info("shape={} created state={}", change.handle(), change.state());
      } else {
        logger.info("shape={} state={} prev={}", change.handle(), change.state(), change.previousState());
      }
    });
  }
}
