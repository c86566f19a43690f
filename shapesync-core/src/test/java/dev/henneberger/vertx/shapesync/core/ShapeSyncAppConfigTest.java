package dev.henneberger.vertx.shapesync.core;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.vertx.core.json.JsonObject;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ShapeSyncAppConfigTest {

  @Test
  void readsValuesFromEnvironment() {
    ShapeSyncAppConfig config = ShapeSyncAppConfig.fromMap(Map.of(
      "SHAPE_CHUNK_THRESHOLD_BYTES", "2048",
      "SHAPE_SNAPSHOT_TIMEOUT_MS", "1500"));

    assertEquals(2048, config.chunkThresholdBytes());
    ShapeRegistryOptions options = config.toRegistryOptions();
    assertEquals(2048, options.getChunkThresholdBytes());
    assertEquals(Duration.ofMillis(1500), options.getSnapshotTimeout());
  }

  @Test
  void fallsBackToDefaultsOnMissingOrInvalidValues() {
    ShapeSyncAppConfig config = ShapeSyncAppConfig.fromMap(Map.of(
      "SHAPE_CHUNK_THRESHOLD_BYTES", "lots",
      "SHAPE_SNAPSHOT_TIMEOUT_MS", "-4"));

    assertEquals(10L * 1024 * 1024, config.chunkThresholdBytes());
    assertEquals(30_000L, config.snapshotTimeoutMs());
  }

  @Test
  void optionsRoundTripThroughJson() {
    ShapeRegistryOptions options = new ShapeRegistryOptions()
      .setChunkThresholdBytes(512)
      .setSnapshotTimeout(Duration.ofSeconds(3));

    JsonObject json = options.toJson();
    ShapeRegistryOptions copy = new ShapeRegistryOptions(json);

    assertEquals(512L, json.getLong("chunkThresholdBytes"));
    assertEquals(512, copy.getChunkThresholdBytes());
    assertEquals(Duration.ofSeconds(3), copy.getSnapshotTimeout());
  }

  @Test
  void jsonWithoutATimeoutKeepsTheDefault() {
    ShapeRegistryOptions options = new ShapeRegistryOptions(new JsonObject().put("chunkThresholdBytes", 4096));

    assertEquals(4096, options.getChunkThresholdBytes());
    assertEquals(ShapeRegistryOptions.DEFAULT_SNAPSHOT_TIMEOUT, options.getSnapshotTimeout());
    assertEquals(30_000L, options.toJson().getLong("snapshotTimeoutMs"));
  }

  @Test
  void nullJsonLeavesDefaults() {
    ShapeRegistryOptions options = new ShapeRegistryOptions((JsonObject) null);

    assertEquals(ShapeRegistryOptions.DEFAULT_CHUNK_THRESHOLD_BYTES, options.getChunkThresholdBytes());
  }
}
