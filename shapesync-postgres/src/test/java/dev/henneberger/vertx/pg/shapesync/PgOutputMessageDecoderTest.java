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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.henneberger.vertx.shapesync.core.LogOffset;
import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class PgOutputMessageDecoderTest {

  @Test
  void decodesBeginAndCommit() {
    PgOutputMessageDecoder decoder = new PgOutputMessageDecoder();

    WalMessage.Begin begin = (WalMessage.Begin) decoder.decode(beginMessage(0x16B6C50L, 42)).orElseThrow();
    WalMessage.Commit commit = (WalMessage.Commit) decoder.decode(commitMessage(0x16B6C50L, 0x16B6C80L))
      .orElseThrow();

    assertEquals(0x16B6C50L, begin.getFinalLsn().asLong());
    assertEquals(42, begin.getXid());
    assertEquals(Instant.parse("2000-01-01T00:00:01Z"), begin.getCommitTime());
    assertEquals(0x16B6C50L, commit.getCommitLsn().asLong());
    assertEquals(0x16B6C80L, commit.getEndLsn().asLong());
  }

  @Test
  void decodesRelationMetadata() {
    PgOutputMessageDecoder decoder = new PgOutputMessageDecoder();

    WalMessage.Relation relation = (WalMessage.Relation) decoder.decode(relationMessage('f')).orElseThrow();

    RelationMetadata metadata = relation.getMetadata();
    assertEquals(1, metadata.relationId());
    assertEquals(TableRef.of("public", "users"), metadata.tableRef());
    assertEquals(RelationMetadata.ReplicaIdentity.FULL, metadata.replicaIdentity());
    assertEquals(2, metadata.columns().size());
    assertTrue(metadata.columns().get(0).isKey());
    assertFalse(metadata.columns().get(1).isKey());
    assertEquals(25, metadata.columns().get(1).typeOid());
  }

  @Test
  void decodesInsertWithRelationMetadata() {
    PgOutputMessageDecoder decoder = new PgOutputMessageDecoder();
    decoder.decode(relationMessage('d'));

    WalMessage.RowChange insert = (WalMessage.RowChange) decoder.decode(insertMessage()).orElseThrow();

    assertEquals(WalMessage.Kind.INSERT, insert.kind());
    assertEquals(1, insert.getRelationId());
    assertEquals(ColumnValue.text("1"), insert.getNewValues().get("id"));
    assertEquals(ColumnValue.text("alice"), insert.getNewValues().get("name"));
    assertEquals(6, insert.getByteSize());
  }

  @Test
  void distinguishesUnchangedToastFromNull() {
    PgOutputMessageDecoder decoder = new PgOutputMessageDecoder();
    decoder.decode(relationMessage('d'));

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    writeByte(out, 'U');
    writeInt(out, 1);
    writeByte(out, 'K');
    writeShort(out, 2);
    writeByte(out, 't');
    writeString(out, "7");
    writeByte(out, 'n');
    writeByte(out, 'N');
    writeShort(out, 2);
    writeByte(out, 't');
    writeString(out, "8");
    writeByte(out, 'u');

    WalMessage.RowChange update = (WalMessage.RowChange) decoder.decode(out.toByteArray()).orElseThrow();

    assertEquals(ColumnValue.text("8"), update.getNewValues().get("id"));
    assertTrue(update.getNewValues().get("name").isUnchanged());
    assertFalse(update.getNewValues().get("name").isNull());
    assertEquals(ColumnValue.text("7"), update.getChangedKeyOldValues().get("id"));
    assertTrue(update.getChangedKeyOldValues().get("name").isNull());
    assertTrue(update.getOldValues().isEmpty());
    assertEquals(2, update.getByteSize());
  }

  @Test
  void decodesDeleteWithFullOldRow() {
    PgOutputMessageDecoder decoder = new PgOutputMessageDecoder();
    decoder.decode(relationMessage('f'));

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    writeByte(out, 'D');
    writeInt(out, 1);
    writeByte(out, 'O');
    writeShort(out, 2);
    writeByte(out, 't');
    writeString(out, "3");
    writeByte(out, 't');
    writeString(out, "carol");

    WalMessage.RowChange delete = (WalMessage.RowChange) decoder.decode(out.toByteArray()).orElseThrow();

    assertEquals(WalMessage.Kind.DELETE, delete.kind());
    assertEquals(ColumnValue.text("carol"), delete.getOldValues().get("name"));
    assertTrue(delete.getChangedKeyOldValues().isEmpty());
    assertTrue(delete.getNewValues().isEmpty());
  }

  @Test
  void decodesTruncate() {
    PgOutputMessageDecoder decoder = new PgOutputMessageDecoder();
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    writeByte(out, 'T');
    writeInt(out, 2);
    writeByte(out, 3);
    writeInt(out, 1);
    writeInt(out, 5);

    WalMessage.Truncate truncate = (WalMessage.Truncate) decoder.decode(out.toByteArray()).orElseThrow();

    assertEquals(List.of(1, 5), truncate.getRelationIds());
    assertTrue(truncate.isCascade());
    assertTrue(truncate.isRestartIdentity());
  }

  @Test
  void rowForUnknownRelationFails() {
    PgOutputMessageDecoder decoder = new PgOutputMessageDecoder();

    ReplicationProtocolException err = assertThrows(ReplicationProtocolException.class,
      () -> decoder.decode(insertMessage()));
    assertEquals(ReplicationProtocolException.Kind.UNKNOWN_RELATION, err.kind());
  }

  @Test
  void ignoresTypeAndOriginMessages() {
    PgOutputMessageDecoder decoder = new PgOutputMessageDecoder();

    assertFalse(decoder.decode(new byte[] {'Y', 0, 0, 0, 1}).isPresent());
    assertFalse(decoder.decode(new byte[0]).isPresent());
    assertThrows(IllegalArgumentException.class, () -> decoder.decode(new byte[] {'Z'}));
  }

  @Test
  void rejectsTruncatedPayload() {
    PgOutputMessageDecoder decoder = new PgOutputMessageDecoder();

    assertThrows(IllegalArgumentException.class, () -> decoder.decode(new byte[] {'B', 0, 0}));
  }

  @Test
  void decodedStreamFeedsCollector() throws Exception {
    PgOutputMessageDecoder decoder = new PgOutputMessageDecoder();
    TransactionCollector collector = new TransactionCollector();
    RecordingConsumer consumer = new RecordingConsumer("users-shape", TableRef.of("public", "users"));
    collector.register(consumer);

    for (byte[] payload : List.of(relationMessage('d'), beginMessage(1000, 5), insertMessage(),
      insertMessage(), commitMessage(1000, 1040))) {
      WalMessage message = decoder.decode(ByteBuffer.wrap(payload)).orElseThrow();
      collector.process(message);
    }

    assertEquals(2, consumer.changes().size());
    assertEquals(LogOffset.mustOf(1000, 1), consumer.changes().get(1).getOffset());
    assertTrue(consumer.changes().get(1).isLast());
    assertEquals(LogOffset.mustOf(1040, 0), collector.lastCommittedOffset());
  }

  private static byte[] beginMessage(long finalLsn, int xid) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    writeByte(out, 'B');
    writeLong(out, finalLsn);
    writeLong(out, 1_000_000L);
    writeInt(out, xid);
    return out.toByteArray();
  }

  private static byte[] commitMessage(long commitLsn, long endLsn) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    writeByte(out, 'C');
    writeByte(out, 0);
    writeLong(out, commitLsn);
    writeLong(out, endLsn);
    writeLong(out, 1_000_000L);
    return out.toByteArray();
  }

  private static byte[] relationMessage(char replicaIdentity) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    writeByte(out, 'R');
    writeInt(out, 1);
    writeCString(out, "public");
    writeCString(out, "users");
    writeByte(out, replicaIdentity);
    writeShort(out, 2);

    writeByte(out, 1);
    writeCString(out, "id");
    writeInt(out, 23);
    writeInt(out, -1);

    writeByte(out, 0);
    writeCString(out, "name");
    writeInt(out, 25);
    writeInt(out, -1);
    return out.toByteArray();
  }

  private static byte[] insertMessage() {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    writeByte(out, 'I');
    writeInt(out, 1);
    writeByte(out, 'N');
    writeShort(out, 2);

    writeByte(out, 't');
    writeString(out, "1");

    writeByte(out, 't');
    writeString(out, "alice");
    return out.toByteArray();
  }

  private static void writeByte(ByteArrayOutputStream out, int value) {
    out.write(value);
  }

  private static void writeShort(ByteArrayOutputStream out, int value) {
    out.write((value >>> 8) & 0xff);
    out.write(value & 0xff);
  }

  private static void writeInt(ByteArrayOutputStream out, int value) {
    out.write((value >>> 24) & 0xff);
    out.write((value >>> 16) & 0xff);
    out.write((value >>> 8) & 0xff);
    out.write(value & 0xff);
  }

  private static void writeLong(ByteArrayOutputStream out, long value) {
    writeInt(out, (int) (value >>> 32));
    writeInt(out, (int) value);
  }

  private static void writeCString(ByteArrayOutputStream out, String value) {
    out.writeBytes(value.getBytes(StandardCharsets.UTF_8));
    out.write(0);
  }

  private static void writeString(ByteArrayOutputStream out, String value) {
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    writeInt(out, bytes.length);
    out.writeBytes(bytes);
  }
}
