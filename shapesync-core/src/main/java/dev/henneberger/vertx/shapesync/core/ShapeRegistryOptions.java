package dev.henneberger.vertx.shapesync.core;

import io.vertx.codegen.annotations.DataObject;
import io.vertx.codegen.annotations.GenIgnore;
import io.vertx.codegen.json.annotations.JsonGen;
import io.vertx.core.json.JsonObject;
import java.time.Duration;

/**
 * Tuning for a {@link ShapeRegistry}.
 */
@DataObject
@JsonGen(publicConverter = false)
public class ShapeRegistryOptions {

  public static final long DEFAULT_CHUNK_THRESHOLD_BYTES = ChunkTracker.DEFAULT_THRESHOLD_BYTES;
  public static final Duration DEFAULT_SNAPSHOT_TIMEOUT = Duration.ofSeconds(30);

  private long chunkThresholdBytes = DEFAULT_CHUNK_THRESHOLD_BYTES;
  private Duration snapshotTimeout = DEFAULT_SNAPSHOT_TIMEOUT;

  public ShapeRegistryOptions() {
  }

  public ShapeRegistryOptions(JsonObject json) {
    ShapeRegistryOptionsConverter.fromJson(json, this);
  }

  public ShapeRegistryOptions(ShapeRegistryOptions other) {
    this.chunkThresholdBytes = other.chunkThresholdBytes;
    this.snapshotTimeout = other.snapshotTimeout;
  }

  public long getChunkThresholdBytes() {
    return chunkThresholdBytes;
  }

  public ShapeRegistryOptions setChunkThresholdBytes(long chunkThresholdBytes) {
    this.chunkThresholdBytes = chunkThresholdBytes;
    return this;
  }

  @GenIgnore
  public Duration getSnapshotTimeout() {
    return snapshotTimeout;
  }

  /**
   * Default wait used by {@link ShapeRegistry#awaitSnapshotBlocking(String)}.
   */
  @GenIgnore
  public ShapeRegistryOptions setSnapshotTimeout(Duration snapshotTimeout) {
    this.snapshotTimeout = snapshotTimeout;
    return this;
  }

  public long getSnapshotTimeoutMs() {
    return snapshotTimeout == null ? 0L : snapshotTimeout.toMillis();
  }

  public ShapeRegistryOptions setSnapshotTimeoutMs(long snapshotTimeoutMs) {
    this.snapshotTimeout = Duration.ofMillis(snapshotTimeoutMs);
    return this;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    ShapeRegistryOptionsConverter.toJson(this, json);
    return json;
  }

  void validate() {
    OptionValidation.requireMin("chunkThresholdBytes", chunkThresholdBytes, 1);
    OptionValidation.requirePositive("snapshotTimeout", snapshotTimeout);
  }
}
