package dev.henneberger.vertx.shapesync.core;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class ShapeSyncLoggingTest {

  @Test
  void detachesWhenCancelled() {
    ShapeRegistry registry = new ShapeRegistry(new InMemoryShapeLogStore());
    AtomicInteger other = new AtomicInteger();
    registry.onStateChange(change -> other.incrementAndGet());

    ShapeSubscription logging = ShapeSyncLogging.attachDefaultLogging(registry,
      LoggerFactory.getLogger(ShapeSyncLoggingTest.class));
    String handle = registry.getOrCreate(ShapeDefinition.of("public", "users")).handle();
    logging.cancel();
    registry.delete(handle);

    assertEquals(2, other.get());
  }
}
