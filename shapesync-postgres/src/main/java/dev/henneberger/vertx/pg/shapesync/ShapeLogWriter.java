/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.henneberger.vertx.pg.shapesync;

import dev.henneberger.vertx.shapesync.core.ChunkBoundary;
import dev.henneberger.vertx.shapesync.core.LogItem;
import dev.henneberger.vertx.shapesync.core.LogOffset;
import dev.henneberger.vertx.shapesync.core.ShapeDefinition;
import dev.henneberger.vertx.shapesync.core.ShapeDeletedException;
import dev.henneberger.vertx.shapesync.core.ShapeInfo;
import dev.henneberger.vertx.shapesync.core.ShapeLogStore;
import dev.henneberger.vertx.shapesync.core.ShapeNotFoundException;
import dev.henneberger.vertx.shapesync.core.ShapeRegistry;
import dev.henneberger.vertx.shapesync.core.ShapeSchema;
import dev.henneberger.vertx.shapesync.core.ShapeState;
import io.vertx.core.Future;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the changes of one shape to its log.
 *
 * <p>Changes are filtered through the shape's where clause. An update that moves a row into the
 * shape is logged as an insert, one that moves it out as a delete, and one that changes the key of
 * a row inside the shape as a delete of the old key followed by an insert of the new one. With the
 * default replica mode deletes carry only the key columns and updates the key plus the changed
 * columns; with {@link ShapeDefinition.ReplicaMode#FULL} both carry whole rows and updates add the
 * previous values of changed columns as {@code old_value}.
 *
 * <p>Each log item is appended to the {@link ShapeLogStore}; the shape's latest offset and chunk
 * tracker in the {@link ShapeRegistry} follow, and closed chunk boundaries are persisted. A
 * truncate of the shape's table deletes the shape so clients have to refetch it.
 */
public final class ShapeLogWriter implements ShapeConsumer {

  private static final Logger LOG = LoggerFactory.getLogger(ShapeLogWriter.class);

  private final ShapeRegistry registry;
  private final ShapeLogStore store;
  private final Function<Integer, Optional<RelationMetadata>> relations;
  private final String handle;
  private final ShapeDefinition definition;
  private final TableRef table;
  private final WhereClause where;
  private volatile TransactionCollector collector;

  /**
   * @param relations relation metadata lookup, usually {@code collector::relation}
   * @throws IllegalArgumentException if the shape's where clause cannot be parsed
   */
  public ShapeLogWriter(ShapeRegistry registry,
                        ShapeLogStore store,
                        Function<Integer, Optional<RelationMetadata>> relations,
                        String handle) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.store = Objects.requireNonNull(store, "store");
    this.relations = Objects.requireNonNull(relations, "relations");
    this.handle = Objects.requireNonNull(handle, "handle");
    ShapeInfo info = registry.get(handle).orElseThrow(() -> new ShapeNotFoundException(handle));
    this.definition = info.definition();
    this.table = TableRef.of(definition.schema(), definition.table());
    this.where = definition.where().isEmpty() ? null : WhereClause.parse(definition.where());
  }

  @Override
  public String handle() {
    return handle;
  }

  @Override
  public TableRef table() {
    return table;
  }

  /**
   * Registers this writer with {@code collector}. Once the shape is deleted the writer unregisters
   * itself.
   */
  public ShapeLogWriter attach(TransactionCollector collector) {
    this.collector = Objects.requireNonNull(collector, "collector");
    collector.register(this);
    return this;
  }

  /**
   * Stores the initial rows of the shape at consecutive virtual offsets starting at
   * {@link LogOffset#INITIAL} and marks the snapshot complete. Rows outside the where clause are
   * left out.
   */
  public void writeSnapshot(RelationMetadata relation, List<Map<String, ColumnValue>> rows) throws Exception {
    List<LogItem> items = new ArrayList<>(rows.size());
    LogOffset offset = LogOffset.INITIAL;
    for (Map<String, ColumnValue> row : rows) {
      if (where != null && !where.matches(row)) {
        continue;
      }
      if (!items.isEmpty()) {
        offset = offset.increment();
      }
      List<String> keyColumns = keyColumns(relation, row);
      String key = key(row, keyColumns);
      JsonObject message = new JsonObject()
        .put("offset", offset.toString())
        .put("key", key)
        .put("value", rowValue(row, keyColumns))
        .put("headers", new JsonObject().put("operation", "insert"));
      items.add(new LogItem(offset.toString(), key, LogItem.Operation.INSERT, message.encode()));
    }

    store.setSnapshot(handle, schemaOf(relation), items, LogOffset.INITIAL.toString());
    for (LogItem item : items) {
      track(LogOffset.parse(item.getOffset()), item.getJson());
    }
    registry.markSnapshotComplete(handle);
    LOG.info("Wrote snapshot of shape {} with {} of {} rows", handle, items.size(), rows.size());
  }

  @Override
  public Future<Void> processChange(Change change) {
    Optional<ShapeInfo> info = registry.get(handle);
    if (info.isEmpty() || info.get().state() == ShapeState.DELETED) {
      detach();
      return Future.succeededFuture();
    }
    if (change.getOperation() == Change.Operation.TRUNCATE) {
      LOG.info("Truncate of {} invalidates shape {}", change.getRelation(), handle);
      registry.delete(handle);
      detach();
      return Future.succeededFuture();
    }

    try {
      List<LogItem> items = toLogItems(change);
      if (items.isEmpty()) {
        return Future.succeededFuture();
      }
      store.appendToLog(handle, items);
      for (LogItem item : items) {
        track(LogOffset.parse(item.getOffset()), item.getJson());
      }
      return Future.succeededFuture();
    } catch (ShapeDeletedException e) {
      LOG.debug("Shape {} deleted while writing change at {}", handle, change.getOffset());
      detach();
      return Future.succeededFuture();
    } catch (Exception e) {
      return Future.failedFuture(e);
    }
  }

  private void detach() {
    TransactionCollector attached = collector;
    if (attached != null) {
      collector = null;
      attached.unregister(handle);
    }
  }

  private void track(LogOffset offset, String json) throws Exception {
    registry.updateOffset(handle, offset);
    boolean closed = registry.addToChunker(handle, offset, json.getBytes(StandardCharsets.UTF_8).length);
    if (!closed) {
      return;
    }
    Optional<ChunkBoundary> boundary = registry.lastCompletedChunk(handle);
    if (boundary.isPresent()) {
      store.setChunkEnd(handle, boundary.get().start().toString(), boundary.get().end().toString());
    }
  }

  private List<LogItem> toLogItems(Change change) {
    RelationMetadata relation = relations.apply(change.getRelationId()).orElse(null);
    List<String> keyColumns = keyColumns(relation, change.rowOrKeys());

    switch (change.getOperation()) {
      case INSERT: {
        Map<String, ColumnValue> row = change.getNewRecord();
        if (where != null && !where.matches(row)) {
          return List.of();
        }
        return List.of(item(change.getOffset(), LogItem.Operation.INSERT, key(row, keyColumns),
          rowValue(row, keyColumns), null, headers(change, LogItem.Operation.INSERT, change.isLast())));
      }
      case DELETE: {
        Map<String, ColumnValue> row = change.getOldRecord();
        if (!previousMatches(row)) {
          return List.of();
        }
        return List.of(item(change.getOffset(), LogItem.Operation.DELETE, key(row, keyColumns),
          deleteValue(row, keyColumns), null, headers(change, LogItem.Operation.DELETE, change.isLast())));
      }
      default:
        return updateItems(change, keyColumns);
    }
  }

  private List<LogItem> updateItems(Change change, List<String> keyColumns) {
    Map<String, ColumnValue> previous = change.getOldRecord();
    Map<String, ColumnValue> current = resolveUnchanged(change.getNewRecord(), previous);
    boolean oldMatches = previousMatches(previous);
    boolean newMatches = where == null || where.matches(current);
    LogOffset offset = change.getOffset();
    String newKey = key(current, keyColumns);

    if (oldMatches && newMatches && change.isKeyChanged()) {
      String oldKey = key(previous, keyColumns);
      LogItem delete = item(offset, LogItem.Operation.DELETE, oldKey, deleteValue(previous, keyColumns), null,
        headers(change, LogItem.Operation.DELETE, false).put("key_change_to", newKey));
      LogItem insert = item(offset.increment(), LogItem.Operation.INSERT, newKey,
        rowValue(current, keyColumns), null,
        headers(change, LogItem.Operation.INSERT, change.isLast()).put("key_change_from", oldKey));
      return List.of(delete, insert);
    }
    if (oldMatches && newMatches) {
      JsonObject oldValue = definition.replica() == ShapeDefinition.ReplicaMode.FULL
        ? changedPreviousValues(previous, current, keyColumns)
        : null;
      return List.of(item(offset, LogItem.Operation.UPDATE, newKey,
        updateValue(current, previous, keyColumns), oldValue,
        headers(change, LogItem.Operation.UPDATE, change.isLast())));
    }
    if (newMatches) {
      return List.of(item(offset, LogItem.Operation.INSERT, newKey, rowValue(current, keyColumns), null,
        headers(change, LogItem.Operation.INSERT, change.isLast())));
    }
    if (oldMatches) {
      Map<String, ColumnValue> removed = previous.isEmpty() ? current : previous;
      return List.of(item(offset, LogItem.Operation.DELETE, key(removed, keyColumns),
        deleteValue(removed, keyColumns), null, headers(change, LogItem.Operation.DELETE, change.isLast())));
    }
    return List.of();
  }

  /**
   * Whether a row as it was before the change belonged to the shape. Rows that lack a column the
   * where clause reads, as with the default replica identity, count as belonging.
   */
  private boolean previousMatches(Map<String, ColumnValue> previous) {
    return where == null || !where.isDecidable(previous) || where.matches(previous);
  }

  private static LogItem item(LogOffset offset,
                       LogItem.Operation operation,
                       String key,
                       JsonObject value,
                       JsonObject oldValue,
                       JsonObject headers) {
    JsonObject message = new JsonObject()
      .put("offset", offset.toString())
      .put("key", key)
      .put("value", value)
      .put("headers", headers);
    if (oldValue != null) {
      message.put("old_value", oldValue);
    }
    return new LogItem(offset.toString(), key, operation, message.encode());
  }

  private static JsonObject headers(Change change, LogItem.Operation operation, boolean last) {
    JsonObject headers = new JsonObject()
      .put("operation", operation.name().toLowerCase(Locale.ROOT))
      .put("txid", change.getXid())
      .put("relation", new JsonArray().add(change.getRelation().schema()).add(change.getRelation().table()));
    if (last) {
      headers.put("last", true);
    }
    return headers;
  }

  private JsonObject deleteValue(Map<String, ColumnValue> row, List<String> keyColumns) {
    if (definition.replica() == ShapeDefinition.ReplicaMode.FULL) {
      return rowValue(row, keyColumns);
    }
    JsonObject json = new JsonObject();
    for (String column : keyColumns) {
      put(json, column, row.get(column));
    }
    return json;
  }

  private JsonObject updateValue(Map<String, ColumnValue> current,
                                 Map<String, ColumnValue> previous,
                                 List<String> keyColumns) {
    JsonObject full = rowValue(current, keyColumns);
    if (definition.replica() == ShapeDefinition.ReplicaMode.FULL) {
      return full;
    }
    JsonObject json = new JsonObject();
    for (String column : full.fieldNames()) {
      ColumnValue before = previous.get(column);
      if (keyColumns.contains(column) || before == null || !before.equals(current.get(column))) {
        json.put(column, full.getValue(column));
      }
    }
    return json;
  }

  /** Previous values of the columns the update changed, {@code null} when it changed none. */
  private JsonObject changedPreviousValues(Map<String, ColumnValue> previous,
                                           Map<String, ColumnValue> current,
                                           List<String> keyColumns) {
    JsonObject json = new JsonObject();
    for (Map.Entry<String, ColumnValue> entry : previous.entrySet()) {
      String column = entry.getKey();
      ColumnValue after = current.get(column);
      if (included(column, keyColumns) && after != null && !after.isUnchanged() && !after.equals(entry.getValue())) {
        put(json, column, entry.getValue());
      }
    }
    return json.isEmpty() ? null : json;
  }

  /** The row restricted to the shape's columns plus the key. Unresolved unchanged values are left out. */
  private JsonObject rowValue(Map<String, ColumnValue> row, List<String> keyColumns) {
    JsonObject json = new JsonObject();
    for (String column : new TreeSet<>(row.keySet())) {
      if (included(column, keyColumns)) {
        put(json, column, row.get(column));
      }
    }
    return json;
  }

  private boolean included(String column, List<String> keyColumns) {
    return definition.columns().isEmpty() || definition.columns().contains(column) || keyColumns.contains(column);
  }

  private static void put(JsonObject json, String column, ColumnValue value) {
    if (value == null || value.isUnchanged()) {
      return;
    }
    if (value.isText()) {
      json.put(column, value.text());
    } else {
      json.putNull(column);
    }
  }

  private static Map<String, ColumnValue> resolveUnchanged(Map<String, ColumnValue> row,
                                                           Map<String, ColumnValue> previous) {
    Map<String, ColumnValue> resolved = new LinkedHashMap<>(row);
    for (Map.Entry<String, ColumnValue> entry : row.entrySet()) {
      ColumnValue before = previous.get(entry.getKey());
      if (entry.getValue().isUnchanged() && before != null) {
        resolved.put(entry.getKey(), before);
      }
    }
    return resolved;
  }

  private static List<String> keyColumns(RelationMetadata relation, Map<String, ColumnValue> row) {
    List<String> keyColumns = new ArrayList<>();
    if (relation != null) {
      for (RelationMetadata.Column column : relation.keyColumns()) {
        keyColumns.add(column.name());
      }
      if (keyColumns.isEmpty()) {
        for (RelationMetadata.Column column : relation.columns()) {
          keyColumns.add(column.name());
        }
      }
    }
    if (keyColumns.isEmpty()) {
      keyColumns.addAll(new TreeSet<>(row.keySet()));
    }
    return keyColumns;
  }

  private String key(Map<String, ColumnValue> row, List<String> keyColumns) {
    StringBuilder key = new StringBuilder()
      .append(quote(definition.schema()))
      .append('.')
      .append(quote(definition.table()));
    for (String column : keyColumns) {
      ColumnValue value = row.get(column);
      key.append('/').append(value != null && value.isText() ? quote(value.text()) : "_");
    }
    return key.toString();
  }

  private static String quote(String identifier) {
    return '"' + identifier.replace("\"", "\"\"") + '"';
  }

  private static ShapeSchema schemaOf(RelationMetadata relation) {
    List<ShapeSchema.Column> columns = new ArrayList<>();
    int keyIndex = 0;
    for (RelationMetadata.Column column : relation.columns()) {
      columns.add(new ShapeSchema.Column(column.name(), String.valueOf(column.typeOid()),
        column.isKey() ? keyIndex++ : -1));
    }
    return new ShapeSchema(relation.schema(), relation.table(), columns);
  }
}
