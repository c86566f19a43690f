package dev.henneberger.vertx.shapesync.core;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for shape snapshots, logs and chunk boundaries. Offsets cross this boundary
 * in their text form.
 */
public interface ShapeLogStore {

  /**
   * Items strictly after {@code offset}, snapshot items first.
   *
   * @param limit maximum number of items, {@code <= 0} for no limit
   * @throws ShapeLogNotFoundException if nothing is stored for the shape
   */
  List<LogItem> getLogSince(String handle, String offset, int limit) throws Exception;

  Optional<String> getChunkEnd(String handle, String offset) throws Exception;

  void setChunkEnd(String handle, String startOffset, String endOffset) throws Exception;

  void appendToLog(String handle, List<LogItem> items) throws Exception;

  void setSnapshot(String handle, ShapeSchema schema, List<LogItem> items, String baseOffset) throws Exception;
}
