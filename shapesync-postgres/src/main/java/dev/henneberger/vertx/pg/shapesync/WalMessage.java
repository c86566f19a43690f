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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.postgresql.replication.LogSequenceNumber;

/**
 * A decoded logical replication message, as consumed by {@link TransactionCollector}.
 */
public abstract class WalMessage {

  public enum Kind {
    RELATION,
    BEGIN,
    COMMIT,
    INSERT,
    UPDATE,
    DELETE,
    TRUNCATE
  }

  private final Kind kind;

  WalMessage(Kind kind) {
    this.kind = kind;
  }

  public final Kind kind() {
    return kind;
  }

  public static Relation relation(RelationMetadata metadata) {
    return new Relation(metadata);
  }

  public static Begin begin(LogSequenceNumber finalLsn, long xid, Instant commitTime) {
    return new Begin(finalLsn, xid, commitTime);
  }

  public static Commit commit(LogSequenceNumber commitLsn, LogSequenceNumber endLsn, Instant commitTime) {
    return new Commit(commitLsn, endLsn, commitTime);
  }

  public static RowChange insert(int relationId, Map<String, ColumnValue> newValues, int byteSize) {
    return new RowChange(Kind.INSERT, relationId, newValues, Map.of(), Map.of(), byteSize);
  }

  public static RowChange update(int relationId,
                                 Map<String, ColumnValue> newValues,
                                 Map<String, ColumnValue> oldValues,
                                 Map<String, ColumnValue> changedKeyOldValues,
                                 int byteSize) {
    return new RowChange(Kind.UPDATE, relationId, newValues, oldValues, changedKeyOldValues, byteSize);
  }

  public static RowChange delete(int relationId,
                                 Map<String, ColumnValue> oldValues,
                                 Map<String, ColumnValue> changedKeyOldValues,
                                 int byteSize) {
    return new RowChange(Kind.DELETE, relationId, Map.of(), oldValues, changedKeyOldValues, byteSize);
  }

  public static Truncate truncate(List<Integer> relationIds, boolean cascade, boolean restartIdentity) {
    return new Truncate(relationIds, cascade, restartIdentity);
  }

  public static final class Relation extends WalMessage {
    private final RelationMetadata metadata;

    private Relation(RelationMetadata metadata) {
      super(Kind.RELATION);
      this.metadata = Objects.requireNonNull(metadata, "metadata");
    }

    public RelationMetadata getMetadata() {
      return metadata;
    }
  }

  public static final class Begin extends WalMessage {
    private final LogSequenceNumber finalLsn;
    private final long xid;
    private final Instant commitTime;

    private Begin(LogSequenceNumber finalLsn, long xid, Instant commitTime) {
      super(Kind.BEGIN);
      this.finalLsn = Objects.requireNonNull(finalLsn, "finalLsn");
      this.xid = xid;
      this.commitTime = commitTime;
    }

    /** LSN of the transaction's commit record. */
    public LogSequenceNumber getFinalLsn() {
      return finalLsn;
    }

    public long getXid() {
      return xid;
    }

    public Instant getCommitTime() {
      return commitTime;
    }
  }

  public static final class Commit extends WalMessage {
    private final LogSequenceNumber commitLsn;
    private final LogSequenceNumber endLsn;
    private final Instant commitTime;

    private Commit(LogSequenceNumber commitLsn, LogSequenceNumber endLsn, Instant commitTime) {
      super(Kind.COMMIT);
      this.commitLsn = Objects.requireNonNull(commitLsn, "commitLsn");
      this.endLsn = Objects.requireNonNull(endLsn, "endLsn");
      this.commitTime = commitTime;
    }

    public LogSequenceNumber getCommitLsn() {
      return commitLsn;
    }

    /** End of the transaction in the WAL; the position to resume from. */
    public LogSequenceNumber getEndLsn() {
      return endLsn;
    }

    public Instant getCommitTime() {
      return commitTime;
    }
  }

  /**
   * Insert, update or delete of one row. Absent tuples are empty maps.
   */
  public static final class RowChange extends WalMessage {
    private final int relationId;
    private final Map<String, ColumnValue> newValues;
    private final Map<String, ColumnValue> oldValues;
    private final Map<String, ColumnValue> changedKeyOldValues;
    private final int byteSize;

    private RowChange(Kind kind,
                      int relationId,
                      Map<String, ColumnValue> newValues,
                      Map<String, ColumnValue> oldValues,
                      Map<String, ColumnValue> changedKeyOldValues,
                      int byteSize) {
      super(kind);
      this.relationId = relationId;
      this.newValues = unmodifiableCopy(newValues);
      this.oldValues = unmodifiableCopy(oldValues);
      this.changedKeyOldValues = unmodifiableCopy(changedKeyOldValues);
      this.byteSize = byteSize;
    }

    public int getRelationId() {
      return relationId;
    }

    public Map<String, ColumnValue> getNewValues() {
      return newValues;
    }

    /** Full previous row, present for tables with replica identity FULL. */
    public Map<String, ColumnValue> getOldValues() {
      return oldValues;
    }

    /** Previous key columns, present when the key changed or the row was deleted. */
    public Map<String, ColumnValue> getChangedKeyOldValues() {
      return changedKeyOldValues;
    }

    public int getByteSize() {
      return byteSize;
    }
  }

  public static final class Truncate extends WalMessage {
    private final List<Integer> relationIds;
    private final boolean cascade;
    private final boolean restartIdentity;

    private Truncate(List<Integer> relationIds, boolean cascade, boolean restartIdentity) {
      super(Kind.TRUNCATE);
      this.relationIds = List.copyOf(relationIds);
      this.cascade = cascade;
      this.restartIdentity = restartIdentity;
    }

    public List<Integer> getRelationIds() {
      return relationIds;
    }

    public boolean isCascade() {
      return cascade;
    }

    public boolean isRestartIdentity() {
      return restartIdentity;
    }
  }

  static Map<String, ColumnValue> unmodifiableCopy(Map<String, ColumnValue> values) {
    if (values == null || values.isEmpty()) {
      return Collections.emptyMap();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }
}
