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
import io.vertx.core.Future;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Groups WAL messages into transactions and hands each committed change to the consumers
 * registered for its table.
 *
 * <p>Changes are delivered in commit order, and within a transaction in the order the server sent
 * them. Every change of a transaction shares the transaction's LSN as its offset's transaction
 * component, with a per-transaction counter as operation component. Delivery is sequential: each
 * consumer's future must complete before the next consumer or change is served.
 *
 * <p>Consumers and listeners running inside a dispatch may register and unregister consumers.
 * Those requests take effect once the dispatch has finished; an unregistered consumer receives no
 * further changes of the running dispatch.
 */
public final class TransactionCollector {

  private static final Logger LOG = LoggerFactory.getLogger(TransactionCollector.class);

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<String, ShapeConsumer> consumers = new LinkedHashMap<>();
  private final Map<TableRef, Set<String>> tableIndex = new HashMap<>();
  private final Set<String> unscoped = new LinkedHashSet<>();
  private final Map<Integer, RelationMetadata> relations = new ConcurrentHashMap<>();
  private final Queue<Runnable> deferred = new ConcurrentLinkedQueue<>();
  private final Set<String> unregistering = ConcurrentHashMap.newKeySet();

  private Transaction currentTransaction;
  private volatile LogOffset lastCommittedOffset = LogOffset.INITIAL;

  /**
   * Registers a consumer, replacing any consumer already registered under the same handle.
   */
  public void register(ShapeConsumer consumer) {
    Objects.requireNonNull(consumer, "consumer");
    String handle = Objects.requireNonNull(consumer.handle(), "handle");
    TableRef table = consumer.table() == null ? TableRef.UNSCOPED : consumer.table();
    if (lock.getReadHoldCount() > 0) {
      deferred.add(() -> register(consumer));
      return;
    }

    lock.writeLock().lock();
    try {
      removeFromIndex(handle);
      consumers.put(handle, consumer);
      if (table.isScoped()) {
        tableIndex.computeIfAbsent(table, t -> new LinkedHashSet<>()).add(handle);
      } else {
        unscoped.add(handle);
      }
    } finally {
      lock.writeLock().unlock();
    }
    LOG.debug("Registered consumer {} for {}", handle, table);
  }

  public void unregister(String handle) {
    if (lock.getReadHoldCount() > 0) {
      unregistering.add(handle);
      deferred.add(() -> unregister(handle));
      LOG.debug("Deferring unregistration of {} until dispatch completes", handle);
      return;
    }
    lock.writeLock().lock();
    try {
      removeFromIndex(handle);
      consumers.remove(handle);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Applies one message. Must be driven by a single thread in stream order.
   *
   * @throws ReplicationProtocolException if the message does not fit the current stream state;
   *                                      nothing is changed in that case
   * @throws ConsumerDispatchException    if a consumer failed a change of the committed transaction
   */
  public synchronized void process(WalMessage message) throws ConsumerDispatchException {
    Objects.requireNonNull(message, "message");
    switch (message.kind()) {
      case RELATION:
        handleRelation((WalMessage.Relation) message);
        break;
      case BEGIN:
        handleBegin((WalMessage.Begin) message);
        break;
      case COMMIT:
        handleCommit((WalMessage.Commit) message);
        break;
      case INSERT:
      case UPDATE:
      case DELETE:
        handleRowChange((WalMessage.RowChange) message);
        break;
      case TRUNCATE:
        handleTruncate((WalMessage.Truncate) message);
        break;
      default:
        break;
    }
  }

  private void handleRelation(WalMessage.Relation message) {
    RelationMetadata metadata = message.getMetadata();
    relations.put(metadata.relationId(), metadata);
  }

  private void handleBegin(WalMessage.Begin message) {
    long lsn = message.getFinalLsn().asLong();
    if (lsn <= 0) {
      throw new ReplicationProtocolException(ReplicationProtocolException.Kind.INVALID_LOG_POSITION,
        "invalid begin LSN " + message.getFinalLsn().asString() + " for xid " + message.getXid());
    }
    if (currentTransaction != null) {
      LOG.warn("Discarding uncommitted transaction xid={} with {} changes",
        currentTransaction.xid(), currentTransaction.changes().size());
    }
    currentTransaction = new Transaction(message.getXid(), message.getFinalLsn());
  }

  private void handleCommit(WalMessage.Commit message) throws ConsumerDispatchException {
    Transaction transaction = currentTransaction;
    if (transaction == null) {
      return;
    }
    currentTransaction = null;
    lastCommittedOffset = LogOffset.mustOf(message.getEndLsn().asLong(), 0);
    transaction.markLastChange();

    LOG.debug("Dispatching xid={} changes={} relations={} commit={}",
      transaction.xid(), transaction.changes().size(), transaction.affectedRelations().size(),
      message.getEndLsn().asString());
    dispatch(transaction.changes());
  }

  private void handleRowChange(WalMessage.RowChange message) {
    Transaction transaction = requireTransaction(message.kind());
    RelationMetadata relation = relations.get(message.getRelationId());
    if (relation == null) {
      throw new ReplicationProtocolException(ReplicationProtocolException.Kind.UNKNOWN_RELATION,
        "unknown relation id " + message.getRelationId());
    }

    Change.Operation operation;
    Map<String, ColumnValue> newRecord = Map.of();
    Map<String, ColumnValue> oldRecord = Map.of();
    boolean keyChanged = false;
    switch (message.kind()) {
      case INSERT:
        operation = Change.Operation.INSERT;
        newRecord = message.getNewValues();
        break;
      case UPDATE:
        operation = Change.Operation.UPDATE;
        newRecord = message.getNewValues();
        oldRecord = previousValues(message);
        keyChanged = keyChanged(relation, oldRecord, newRecord);
        break;
      default:
        operation = Change.Operation.DELETE;
        oldRecord = previousValues(message);
        break;
    }

    LogOffset offset = transaction.nextOffset();
    if (keyChanged) {
      transaction.nextOffset();
    }
    transaction.add(new Change(operation, offset, relation.tableRef(),
      relation.relationId(), newRecord, oldRecord, transaction.xid(), message.getByteSize(), keyChanged));
  }

  private static boolean keyChanged(RelationMetadata relation,
                                    Map<String, ColumnValue> oldRecord,
                                    Map<String, ColumnValue> newRecord) {
    if (oldRecord.isEmpty()) {
      return false;
    }
    for (RelationMetadata.Column column : relation.keyColumns()) {
      ColumnValue before = oldRecord.get(column.name());
      ColumnValue after = newRecord.get(column.name());
      if (before != null && after != null && !after.isUnchanged() && !before.equals(after)) {
        return true;
      }
    }
    return false;
  }

  private void handleTruncate(WalMessage.Truncate message) {
    Transaction transaction = requireTransaction(message.kind());
    for (Integer relationId : message.getRelationIds()) {
      RelationMetadata relation = relations.get(relationId);
      if (relation == null) {
        LOG.debug("Skipping truncate of unknown relation id {}", relationId);
        continue;
      }
      transaction.add(new Change(Change.Operation.TRUNCATE, transaction.nextOffset(), relation.tableRef(),
        relation.relationId(), Map.of(), Map.of(), transaction.xid(), 0));
    }
  }

  private static Map<String, ColumnValue> previousValues(WalMessage.RowChange message) {
    if (!message.getOldValues().isEmpty()) {
      return message.getOldValues();
    }
    return message.getChangedKeyOldValues();
  }

  private Transaction requireTransaction(WalMessage.Kind kind) {
    if (currentTransaction == null) {
      throw new ReplicationProtocolException(ReplicationProtocolException.Kind.NOT_IN_TRANSACTION,
        kind + " received outside of a transaction");
    }
    return currentTransaction;
  }

  private void dispatch(List<Change> changes) throws ConsumerDispatchException {
    lock.readLock().lock();
    try {
      for (Change change : changes) {
        for (ShapeConsumer consumer : consumersFor(change.getRelation())) {
          if (!unregistering.contains(consumer.handle())) {
            awaitConsumer(consumer, change);
          }
        }
      }
    } finally {
      lock.readLock().unlock();
      applyDeferred();
    }
  }

  private void applyDeferred() {
    Runnable action;
    while ((action = deferred.poll()) != null) {
      action.run();
    }
    unregistering.clear();
  }

  private List<ShapeConsumer> consumersFor(TableRef table) {
    List<ShapeConsumer> matching = new ArrayList<>();
    Set<String> handles = tableIndex.get(table);
    if (handles != null) {
      for (String handle : handles) {
        matching.add(consumers.get(handle));
      }
    }
    for (String handle : unscoped) {
      matching.add(consumers.get(handle));
    }
    return matching;
  }

  private static void awaitConsumer(ShapeConsumer consumer, Change change) throws ConsumerDispatchException {
    Future<Void> result;
    try {
      result = consumer.processChange(change);
    } catch (RuntimeException e) {
      throw new ConsumerDispatchException(consumer.handle(), change.getOffset(), e);
    }
    if (result == null) {
      return;
    }

    CountDownLatch latch = new CountDownLatch(1);
    AtomicReference<Throwable> failure = new AtomicReference<>();
    result.onComplete(ar -> {
      if (ar.failed()) {
        failure.set(ar.cause());
      }
      latch.countDown();
    });
    try {
      latch.await();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ConsumerDispatchException(consumer.handle(), change.getOffset(), e);
    }
    Throwable err = failure.get();
    if (err != null) {
      throw new ConsumerDispatchException(consumer.handle(), change.getOffset(), err);
    }
  }

  private void removeFromIndex(String handle) {
    ShapeConsumer existing = consumers.get(handle);
    if (existing == null) {
      return;
    }
    unscoped.remove(handle);
    tableIndex.entrySet().removeIf(entry -> entry.getValue().remove(handle) && entry.getValue().isEmpty());
  }

  /** Offset of the last committed transaction's end, {@link LogOffset#INITIAL} before the first. */
  public LogOffset lastCommittedOffset() {
    return lastCommittedOffset;
  }

  public int consumerCount() {
    lock.readLock().lock();
    try {
      return consumers.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  public List<String> consumersForTable(String schema, String table) {
    lock.readLock().lock();
    try {
      Set<String> handles = tableIndex.get(TableRef.of(schema, table));
      return handles == null ? List.of() : List.copyOf(handles);
    } finally {
      lock.readLock().unlock();
    }
  }

  public boolean hasConsumer(String handle) {
    lock.readLock().lock();
    try {
      return consumers.containsKey(handle);
    } finally {
      lock.readLock().unlock();
    }
  }

  public Optional<RelationMetadata> relation(int relationId) {
    return Optional.ofNullable(relations.get(relationId));
  }

  public int relationCount() {
    return relations.size();
  }

  public void clearRelations() {
    relations.clear();
  }

  public synchronized boolean isInTransaction() {
    return currentTransaction != null;
  }

  public synchronized OptionalLong currentTransactionXid() {
    return currentTransaction == null ? OptionalLong.empty() : OptionalLong.of(currentTransaction.xid());
  }

  /**
   * Drops the open transaction and the relation cache, for use after the replication stream
   * restarted.
   */
  public synchronized void reset() {
    if (currentTransaction != null) {
      LOG.info("Dropping open transaction xid={} on reset", currentTransaction.xid());
    }
    currentTransaction = null;
    relations.clear();
  }
}
