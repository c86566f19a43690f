package dev.henneberger.vertx.shapesync.core;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

public final class ShapeSyncAppConfig {

  private final long chunkThresholdBytes;
  private final long snapshotTimeoutMs;

  private ShapeSyncAppConfig(long chunkThresholdBytes, long snapshotTimeoutMs) {
    this.chunkThresholdBytes = chunkThresholdBytes;
    this.snapshotTimeoutMs = snapshotTimeoutMs;
  }

  public static ShapeSyncAppConfig fromEnv() {
    return fromMap(System.getenv());
  }

  static ShapeSyncAppConfig fromMap(Map<String, String> env) {
    Objects.requireNonNull(env, "env");

    long threshold = positiveLongEnvOrDefault(env, "SHAPE_CHUNK_THRESHOLD_BYTES",
      ShapeRegistryOptions.DEFAULT_CHUNK_THRESHOLD_BYTES);
    long timeoutMs = positiveLongEnvOrDefault(env, "SHAPE_SNAPSHOT_TIMEOUT_MS",
      ShapeRegistryOptions.DEFAULT_SNAPSHOT_TIMEOUT.toMillis());

    return new ShapeSyncAppConfig(threshold, timeoutMs);
  }

  public long chunkThresholdBytes() {
    return chunkThresholdBytes;
  }

  public long snapshotTimeoutMs() {
    return snapshotTimeoutMs;
  }

  public ShapeRegistryOptions toRegistryOptions() {
    return new ShapeRegistryOptions()
      .setChunkThresholdBytes(chunkThresholdBytes)
      .setSnapshotTimeout(Duration.ofMillis(snapshotTimeoutMs));
  }

  private static long positiveLongEnvOrDefault(Map<String, String> env, String key, long defaultValue) {
    String value = env.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      long parsed = Long.parseLong(value.trim());
      return parsed > 0 ? parsed : defaultValue;
    } catch (NumberFormatException ignore) {
      return defaultValue;
    }
  }
}
