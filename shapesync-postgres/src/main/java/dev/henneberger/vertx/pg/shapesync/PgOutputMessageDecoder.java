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

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.postgresql.replication.LogSequenceNumber;

/**
 * Decoder for the native PostgreSQL {@code pgoutput} logical replication format (protocol
 * version 1) into {@link WalMessage}s.
 */
public final class PgOutputMessageDecoder {

  private static final long PG_EPOCH_SECONDS = 946684800L;

  private static final int TRUNCATE_CASCADE = 1;
  private static final int TRUNCATE_RESTART_IDENTITY = 2;

  private final Map<Integer, RelationMetadata> relations = new HashMap<>();

  public Optional<WalMessage> decode(ByteBuffer buffer) {
    byte[] payload = new byte[buffer.remaining()];
    buffer.get(payload);
    return decode(payload);
  }

  /**
   * @return the decoded message, empty for message types that carry nothing for shapes
   *         (type, origin and logical decoding messages)
   */
  public synchronized Optional<WalMessage> decode(byte[] payload) {
    Cursor cursor = new Cursor(payload);
    if (!cursor.hasRemaining()) {
      return Optional.empty();
    }

    char messageType = (char) cursor.readByte();
    switch (messageType) {
      case 'B':
        return Optional.of(decodeBegin(cursor));
      case 'C':
        return Optional.of(decodeCommit(cursor));
      case 'R':
        return Optional.of(decodeRelation(cursor));
      case 'I':
        return Optional.of(decodeInsert(cursor));
      case 'U':
        return Optional.of(decodeUpdate(cursor));
      case 'D':
        return Optional.of(decodeDelete(cursor));
      case 'T':
        return Optional.of(decodeTruncate(cursor));
      case 'Y':
      case 'O':
      case 'M':
        return Optional.empty();
      default:
        throw new IllegalArgumentException("Unsupported pgoutput message type: " + messageType);
    }
  }

  public synchronized void clearRelations() {
    relations.clear();
  }

  private WalMessage decodeBegin(Cursor cursor) {
    LogSequenceNumber finalLsn = LogSequenceNumber.valueOf(cursor.readLong());
    Instant commitTime = fromPgEpochMicros(cursor.readLong());
    long xid = Integer.toUnsignedLong(cursor.readInt());
    return WalMessage.begin(finalLsn, xid, commitTime);
  }

  private WalMessage decodeCommit(Cursor cursor) {
    cursor.readByte();
    LogSequenceNumber commitLsn = LogSequenceNumber.valueOf(cursor.readLong());
    LogSequenceNumber endLsn = LogSequenceNumber.valueOf(cursor.readLong());
    Instant commitTime = fromPgEpochMicros(cursor.readLong());
    return WalMessage.commit(commitLsn, endLsn, commitTime);
  }

  private WalMessage decodeRelation(Cursor cursor) {
    int relationId = cursor.readInt();
    String schema = cursor.readCString();
    String table = cursor.readCString();
    RelationMetadata.ReplicaIdentity replicaIdentity =
      RelationMetadata.ReplicaIdentity.fromCode((char) cursor.readByte());
    int columnCount = cursor.readUnsignedShort();
    List<RelationMetadata.Column> columns = new ArrayList<>(columnCount);

    for (int i = 0; i < columnCount; i++) {
      boolean key = (cursor.readByte() & 1) == 1;
      String name = cursor.readCString();
      int typeOid = cursor.readInt();
      int typeModifier = cursor.readInt();
      columns.add(new RelationMetadata.Column(name, typeOid, typeModifier, key));
    }

    RelationMetadata metadata = new RelationMetadata(relationId, schema, table, columns, replicaIdentity);
    relations.put(relationId, metadata);
    return WalMessage.relation(metadata);
  }

  private WalMessage decodeInsert(Cursor cursor) {
    int relationId = cursor.readInt();
    RelationMetadata relation = relation(relationId);
    char tupleType = (char) cursor.readByte();
    if (tupleType != 'N') {
      throw new IllegalArgumentException("Unexpected tuple marker for INSERT: " + tupleType);
    }

    Tuple row = decodeTuple(cursor, relation);
    return WalMessage.insert(relationId, row.values, row.byteSize);
  }

  private WalMessage decodeUpdate(Cursor cursor) {
    int relationId = cursor.readInt();
    RelationMetadata relation = relation(relationId);

    Tuple oldValues = Tuple.EMPTY;
    Tuple oldKeys = Tuple.EMPTY;

    char marker = (char) cursor.readByte();
    if (marker == 'K') {
      oldKeys = decodeTuple(cursor, relation);
      marker = (char) cursor.readByte();
    } else if (marker == 'O') {
      oldValues = decodeTuple(cursor, relation);
      marker = (char) cursor.readByte();
    }
    if (marker != 'N') {
      throw new IllegalArgumentException("Unexpected tuple marker for UPDATE: " + marker);
    }
    Tuple newValues = decodeTuple(cursor, relation);

    return WalMessage.update(relationId, newValues.values, oldValues.values, oldKeys.values,
      newValues.byteSize + oldValues.byteSize + oldKeys.byteSize);
  }

  private WalMessage decodeDelete(Cursor cursor) {
    int relationId = cursor.readInt();
    RelationMetadata relation = relation(relationId);
    char marker = (char) cursor.readByte();
    if (marker == 'K') {
      Tuple keys = decodeTuple(cursor, relation);
      return WalMessage.delete(relationId, Map.of(), keys.values, keys.byteSize);
    }
    if (marker == 'O') {
      Tuple old = decodeTuple(cursor, relation);
      return WalMessage.delete(relationId, old.values, Map.of(), old.byteSize);
    }
    throw new IllegalArgumentException("Unexpected tuple marker for DELETE: " + marker);
  }

  private WalMessage decodeTruncate(Cursor cursor) {
    int relationCount = cursor.readInt();
    int options = cursor.readByte();
    List<Integer> relationIds = new ArrayList<>(relationCount);
    for (int i = 0; i < relationCount; i++) {
      relationIds.add(cursor.readInt());
    }
    return WalMessage.truncate(relationIds,
      (options & TRUNCATE_CASCADE) != 0,
      (options & TRUNCATE_RESTART_IDENTITY) != 0);
  }

  private Tuple decodeTuple(Cursor cursor, RelationMetadata relation) {
    int colCount = cursor.readUnsignedShort();
    Map<String, ColumnValue> values = new LinkedHashMap<>();
    int byteSize = 0;

    for (int i = 0; i < colCount; i++) {
      String column = i < relation.columns().size()
        ? relation.columns().get(i).name()
        : "col_" + i;
      char kind = (char) cursor.readByte();
      switch (kind) {
        case 'n':
          values.put(column, ColumnValue.NULL);
          break;
        case 'u':
          values.put(column, ColumnValue.UNCHANGED);
          break;
        case 't': {
          int len = cursor.readInt();
          values.put(column, ColumnValue.text(cursor.readString(len)));
          byteSize += len;
          break;
        }
        case 'b': {
          int len = cursor.readInt();
          byte[] binary = cursor.readBytes(len);
          values.put(column, ColumnValue.text("base64:" + Base64.getEncoder().encodeToString(binary)));
          byteSize += len;
          break;
        }
        default:
          throw new IllegalArgumentException("Unsupported tuple column kind: " + kind);
      }
    }

    return new Tuple(values, byteSize);
  }

  private RelationMetadata relation(int relationId) {
    RelationMetadata relation = relations.get(relationId);
    if (relation == null) {
      throw new ReplicationProtocolException(ReplicationProtocolException.Kind.UNKNOWN_RELATION,
        "pgoutput relation metadata missing for relation id " + relationId);
    }
    return relation;
  }

  private static Instant fromPgEpochMicros(long micros) {
    long seconds = Math.floorDiv(micros, 1_000_000L);
    long microsRemainder = Math.floorMod(micros, 1_000_000L);
    return Instant.ofEpochSecond(PG_EPOCH_SECONDS + seconds, microsRemainder * 1_000L);
  }

  private static final class Tuple {
    private static final Tuple EMPTY = new Tuple(Map.of(), 0);

    private final Map<String, ColumnValue> values;
    private final int byteSize;

    private Tuple(Map<String, ColumnValue> values, int byteSize) {
      this.values = values;
      this.byteSize = byteSize;
    }
  }

  private static final class Cursor {
    private final byte[] bytes;
    private int index;

    private Cursor(byte[] bytes) {
      this.bytes = bytes;
      this.index = 0;
    }

    private boolean hasRemaining() {
      return index < bytes.length;
    }

    private void require(int count) {
      if (index + count > bytes.length) {
        throw new IllegalArgumentException("Truncated pgoutput message at offset " + index);
      }
    }

    private int readUnsignedShort() {
      require(2);
      return ((bytes[index++] & 0xff) << 8) | (bytes[index++] & 0xff);
    }

    private byte readByte() {
      require(1);
      return bytes[index++];
    }

    private int readInt() {
      require(4);
      int value = ((bytes[index] & 0xff) << 24)
        | ((bytes[index + 1] & 0xff) << 16)
        | ((bytes[index + 2] & 0xff) << 8)
        | (bytes[index + 3] & 0xff);
      index += 4;
      return value;
    }

    private long readLong() {
      long high = readInt() & 0xffffffffL;
      long low = readInt() & 0xffffffffL;
      return (high << 32) | low;
    }

    private String readCString() {
      int start = index;
      while (index < bytes.length && bytes[index] != 0) {
        index++;
      }
      if (index >= bytes.length) {
        throw new IllegalArgumentException("Unterminated string in pgoutput message");
      }
      String out = new String(bytes, start, index - start, StandardCharsets.UTF_8);
      index++;
      return out;
    }

    private String readString(int len) {
      require(len);
      String out = new String(bytes, index, len, StandardCharsets.UTF_8);
      index += len;
      return out;
    }

    private byte[] readBytes(int len) {
      require(len);
      byte[] out = new byte[len];
      System.arraycopy(bytes, index, out, 0, len);
      index += len;
      return out;
    }
  }
}
