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
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.postgresql.replication.LogSequenceNumber;

/**
 * Changes of one open transaction, accumulated until its commit.
 */
final class Transaction {
  private final long xid;
  private final LogSequenceNumber lsn;
  private final LogOffset baseOffset;
  private final List<Change> changes = new ArrayList<>();
  private final Set<Integer> affectedRelations = new LinkedHashSet<>();
  private long opCounter;

  Transaction(long xid, LogSequenceNumber lsn) {
    this.xid = xid;
    this.lsn = lsn;
    this.baseOffset = LogOffset.mustOf(lsn.asLong(), 0);
  }

  long xid() {
    return xid;
  }

  LogSequenceNumber lsn() {
    return lsn;
  }

  LogOffset baseOffset() {
    return baseOffset;
  }

  LogOffset nextOffset() {
    return LogOffset.mustOf(baseOffset.txOffset(), opCounter++);
  }

  void add(Change change) {
    changes.add(change);
    affectedRelations.add(change.getRelationId());
  }

  List<Change> changes() {
    return changes;
  }

  Set<Integer> affectedRelations() {
    return affectedRelations;
  }

  void markLastChange() {
    if (!changes.isEmpty()) {
      changes.get(changes.size() - 1).markLast();
    }
  }
}
