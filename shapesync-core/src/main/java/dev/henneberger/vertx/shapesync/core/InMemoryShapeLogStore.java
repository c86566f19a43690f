package dev.henneberger.vertx.shapesync.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Heap-backed {@link ShapeLogStore}. Contents are lost on restart.
 */
public final class InMemoryShapeLogStore implements ShapeLogStore {

  private static final Logger LOG = LoggerFactory.getLogger(InMemoryShapeLogStore.class);

  private final Map<String, StoredShape> shapes = new ConcurrentHashMap<>();

  /**
   * Items strictly after {@code offset}, snapshot first. Items whose stored offset does not parse
   * are skipped and do not count towards {@code limit}.
   */
  @Override
  public List<LogItem> getLogSince(String handle, String offset, int limit) throws Exception {
    StoredShape shape = require(handle);
    LogOffset since = LogOffset.parse(offset);
    List<LogItem> result = new ArrayList<>();
    synchronized (shape) {
      for (List<LogItem> source : List.of(shape.snapshot, shape.log)) {
        for (LogItem item : source) {
          if (limit > 0 && result.size() >= limit) {
            return result;
          }
          LogOffset itemOffset;
          try {
            itemOffset = LogOffset.parse(item.getOffset());
          } catch (InvalidOffsetException e) {
            LOG.warn("Skipping stored item of shape {} with invalid offset '{}'", handle, item.getOffset());
            continue;
          }
          if (itemOffset.isAfter(since)) {
            result.add(item);
          }
        }
      }
    }
    return result;
  }

  @Override
  public Optional<String> getChunkEnd(String handle, String offset) {
    StoredShape shape = shapes.get(handle);
    if (shape == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(shape.chunkEnds.get(offset));
  }

  @Override
  public void setChunkEnd(String handle, String startOffset, String endOffset) throws Exception {
    require(handle).chunkEnds.put(startOffset, endOffset);
  }

  @Override
  public void appendToLog(String handle, List<LogItem> items) throws Exception {
    StoredShape shape = require(handle);
    synchronized (shape) {
      shape.log.addAll(items);
    }
  }

  @Override
  public void setSnapshot(String handle, ShapeSchema schema, List<LogItem> items, String baseOffset) {
    shapes.put(handle, new StoredShape(schema, items, baseOffset));
  }

  public boolean hasShape(String handle) {
    return shapes.containsKey(handle);
  }

  public Optional<ShapeSchema> getSchema(String handle) {
    StoredShape shape = shapes.get(handle);
    return shape == null ? Optional.empty() : Optional.of(shape.schema);
  }

  /**
   * Text offset of the newest stored item. Falls back to the snapshot base offset and then to
   * {@code "0_0"} when the shape holds nothing.
   */
  public String getLatestOffset(String handle) throws ShapeLogNotFoundException {
    StoredShape shape = require(handle);
    synchronized (shape) {
      if (!shape.log.isEmpty()) {
        return shape.log.get(shape.log.size() - 1).getOffset();
      }
      if (!shape.snapshot.isEmpty()) {
        return shape.snapshot.get(shape.snapshot.size() - 1).getOffset();
      }
    }
    return shape.baseOffset == null || shape.baseOffset.isEmpty() ? LogOffset.INITIAL.toString() : shape.baseOffset;
  }

  public void deleteShape(String handle) {
    shapes.remove(handle);
  }

  public void cleanup() {
    shapes.clear();
  }

  private StoredShape require(String handle) throws ShapeLogNotFoundException {
    StoredShape shape = shapes.get(handle);
    if (shape == null) {
      throw new ShapeLogNotFoundException(handle);
    }
    return shape;
  }

  private static final class StoredShape {
    private final ShapeSchema schema;
    private final List<LogItem> snapshot;
    private final List<LogItem> log = new ArrayList<>();
    private final Map<String, String> chunkEnds = new ConcurrentHashMap<>();
    private final String baseOffset;

    private StoredShape(ShapeSchema schema, List<LogItem> snapshot, String baseOffset) {
      this.schema = schema;
      this.snapshot = new ArrayList<>(snapshot);
      this.baseOffset = baseOffset;
    }
  }
}
