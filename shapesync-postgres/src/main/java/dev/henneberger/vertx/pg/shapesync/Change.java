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

import dev.henneberger.vertx.shapesync.core.LogOffset;
import java.util.Map;
import java.util.Objects;

/**
 * A row-level change at a fixed position of the shape log.
 */
public final class Change {

  /**
   * The change operation type.
   */
  public enum Operation {
    INSERT,
    UPDATE,
    DELETE,
    TRUNCATE
  }

  private final Operation operation;
  private final LogOffset offset;
  private final TableRef relation;
  private final int relationId;
  private final Map<String, ColumnValue> newRecord;
  private final Map<String, ColumnValue> oldRecord;
  private final long xid;
  private final int byteSize;
  private final boolean keyChanged;
  private volatile boolean last;

  public Change(Operation operation,
                LogOffset offset,
                TableRef relation,
                int relationId,
                Map<String, ColumnValue> newRecord,
                Map<String, ColumnValue> oldRecord,
                long xid,
                int byteSize) {
    this(operation, offset, relation, relationId, newRecord, oldRecord, xid, byteSize, false);
  }

  /**
   * @param keyChanged whether an update moved the row to another replica identity key; such a
   *                   change owns the offset after its own as well
   */
  public Change(Operation operation,
                LogOffset offset,
                TableRef relation,
                int relationId,
                Map<String, ColumnValue> newRecord,
                Map<String, ColumnValue> oldRecord,
                long xid,
                int byteSize,
                boolean keyChanged) {
    this.operation = Objects.requireNonNull(operation, "operation");
    this.offset = Objects.requireNonNull(offset, "offset");
    this.relation = Objects.requireNonNull(relation, "relation");
    this.relationId = relationId;
    this.newRecord = WalMessage.unmodifiableCopy(newRecord);
    this.oldRecord = WalMessage.unmodifiableCopy(oldRecord);
    this.xid = xid;
    this.byteSize = byteSize;
    this.keyChanged = keyChanged;
  }

  public Operation getOperation() {
    return operation;
  }

  public LogOffset getOffset() {
    return offset;
  }

  public TableRef getRelation() {
    return relation;
  }

  public int getRelationId() {
    return relationId;
  }

  public Map<String, ColumnValue> getNewRecord() {
    return newRecord;
  }

  public Map<String, ColumnValue> getOldRecord() {
    return oldRecord;
  }

  public long getXid() {
    return xid;
  }

  public int getByteSize() {
    return byteSize;
  }

  public boolean isKeyChanged() {
    return keyChanged;
  }

  /** Whether this is the final change of its transaction. */
  public boolean isLast() {
    return last;
  }

  void markLast() {
    this.last = true;
  }

  public Map<String, ColumnValue> rowOrKeys() {
    return !newRecord.isEmpty() ? newRecord : oldRecord;
  }

  @Override
  public String toString() {
    return "Change{" +
      "operation=" + operation +
      ", offset=" + offset +
      ", relation=" + relation +
      ", xid=" + xid +
      ", last=" + last +
      (keyChanged ? ", keyChanged=true" : "") +
      ", newRecord=" + newRecord +
      ", oldRecord=" + oldRecord +
      '}';
  }
}
