package dev.henneberger.vertx.shapesync.core;

import io.vertx.core.json.JsonObject;

final class ShapeRegistryOptionsConverter {

  private ShapeRegistryOptionsConverter() {
  }

  static void fromJson(JsonObject json, ShapeRegistryOptions options) {
    if (json == null) {
      return;
    }
    if (json.containsKey("chunkThresholdBytes")) options.setChunkThresholdBytes(json.getLong("chunkThresholdBytes"));
    if (json.containsKey("snapshotTimeoutMs")) options.setSnapshotTimeoutMs(json.getLong("snapshotTimeoutMs"));
  }

  static void toJson(ShapeRegistryOptions options, JsonObject json) {
    json.put("chunkThresholdBytes", options.getChunkThresholdBytes());
    if (options.getSnapshotTimeout() != null) {
      json.put("snapshotTimeoutMs", options.getSnapshotTimeoutMs());
    }
  }
}
