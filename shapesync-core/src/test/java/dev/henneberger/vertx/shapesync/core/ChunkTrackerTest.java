package dev.henneberger.vertx.shapesync.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ChunkTrackerTest {

  private static LogOffset offset(long tx, long op) {
    return LogOffset.mustOf(tx, op);
  }

  @Test
  void closesChunkWhenThresholdReached() {
    ChunkTracker tracker = new ChunkTracker(100);

    assertFalse(tracker.add(offset(1, 0), 40));
    assertFalse(tracker.add(offset(1, 1), 40));
    assertTrue(tracker.add(offset(1, 2), 40));

    assertEquals(List.of(new ChunkBoundary(offset(1, 0), offset(1, 1))), tracker.completedChunks());
    assertEquals(Optional.of(offset(1, 2)), tracker.currentChunkStart());
    assertEquals(40, tracker.currentChunkSize());
  }

  @Test
  void oversizedFirstItemDoesNotCloseAChunk() {
    ChunkTracker tracker = new ChunkTracker(100);

    assertFalse(tracker.add(offset(1, 0), 150));
    assertTrue(tracker.add(offset(1, 1), 10));

    assertEquals(List.of(new ChunkBoundary(offset(1, 0), offset(1, 0))), tracker.completedChunks());
    assertEquals(Optional.of(offset(1, 1)), tracker.currentChunkStart());
    assertEquals(10, tracker.currentChunkSize());
  }

  @Test
  void boundariesAreOrderedAndDisjoint() {
    ChunkTracker tracker = new ChunkTracker(10);
    for (int i = 0; i < 50; i++) {
      tracker.add(offset(2, i), 4);
    }
    List<ChunkBoundary> chunks = tracker.completedChunks();
    assertFalse(chunks.isEmpty());
    for (int i = 0; i < chunks.size(); i++) {
      ChunkBoundary chunk = chunks.get(i);
      assertTrue(chunk.start().isBeforeOrEqual(chunk.end()));
      if (i > 0) {
        assertTrue(chunks.get(i - 1).end().isBefore(chunk.start()));
      }
    }
  }

  @Test
  void looksUpChunkEnds() {
    ChunkTracker tracker = new ChunkTracker(10);
    tracker.add(offset(1, 0), 6);
    tracker.add(offset(1, 1), 6);

    assertEquals(Optional.of(offset(1, 0)), tracker.getChunkEnd(offset(1, 0)));
    assertTrue(tracker.isChunkComplete(offset(1, 0)));
    assertFalse(tracker.isChunkComplete(offset(1, 1)));
    assertEquals(Optional.empty(), tracker.getChunkEnd(offset(9, 9)));
  }

  @Test
  void nonPositiveThresholdUsesDefault() {
    assertEquals(ChunkTracker.DEFAULT_THRESHOLD_BYTES, new ChunkTracker(0).threshold());
    assertEquals(ChunkTracker.DEFAULT_THRESHOLD_BYTES, new ChunkTracker(-5).threshold());
    assertEquals(10L * 1024 * 1024, new ChunkTracker().threshold());
  }

  @Test
  void resetForgetsEverything() {
    ChunkTracker tracker = new ChunkTracker(10);
    tracker.add(offset(1, 0), 8);
    tracker.add(offset(1, 1), 8);
    assertTrue(tracker.hasItems());

    tracker.reset();

    assertFalse(tracker.hasItems());
    assertEquals(Optional.empty(), tracker.currentChunkStart());
    assertEquals(Optional.empty(), tracker.lastOffset());
    assertEquals(0, tracker.currentChunkSize());
    assertTrue(tracker.completedChunks().isEmpty());
  }

  @Test
  void completedChunksIsACopy() {
    ChunkTracker tracker = new ChunkTracker(10);
    tracker.add(offset(1, 0), 8);
    tracker.add(offset(1, 1), 8);
    List<ChunkBoundary> chunks = tracker.completedChunks();

    tracker.add(offset(1, 2), 8);

    assertEquals(1, chunks.size());
    assertEquals(2, tracker.completedChunks().size());
    assertThrows(UnsupportedOperationException.class, () -> chunks.add(chunks.get(0)));
  }
}
