package dev.henneberger.vertx.shapesync.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class LogOffsetTest {

  @Test
  void reservedOffsetsAreOrdered() {
    LogOffset real = LogOffset.mustOf(100, 0);
    assertTrue(LogOffset.BEFORE_ALL.isBefore(LogOffset.INITIAL));
    assertTrue(LogOffset.INITIAL.isBefore(LogOffset.LAST_BEFORE_REAL));
    assertTrue(LogOffset.LAST_BEFORE_REAL.isBefore(real));
    assertTrue(real.isBefore(LogOffset.LAST));
    assertTrue(LogOffset.mustOf(0, Long.MAX_VALUE - 1).isBefore(LogOffset.mustOf(1, 0)));
  }

  @Test
  void sortsLexicographically() {
    List<LogOffset> offsets = new ArrayList<>(List.of(
      LogOffset.mustOf(5, 3),
      LogOffset.LAST,
      LogOffset.mustOf(5, 1),
      LogOffset.BEFORE_ALL,
      LogOffset.mustOf(2, 9),
      LogOffset.INITIAL));
    Collections.sort(offsets);
    assertEquals(List.of(
      LogOffset.BEFORE_ALL,
      LogOffset.INITIAL,
      LogOffset.mustOf(2, 9),
      LogOffset.mustOf(5, 1),
      LogOffset.mustOf(5, 3),
      LogOffset.LAST), offsets);
  }

  @Test
  void rejectsInvalidCoordinates() {
    InvalidOffsetException err = assertThrows(InvalidOffsetException.class, () -> LogOffset.of(-1, 5));
    assertEquals(InvalidOffsetException.Reason.INVALID_OFFSET, err.reason());
    assertThrows(InvalidOffsetException.class, () -> LogOffset.of(-2, 0));
    assertThrows(InvalidOffsetException.class, () -> LogOffset.of(3, -1));
    assertThrows(IllegalArgumentException.class, () -> LogOffset.mustOf(-5, 0));
  }

  @Test
  void constructingMinusOneZeroYieldsBeforeAll() throws Exception {
    assertSame(LogOffset.BEFORE_ALL, LogOffset.of(-1, 0));
    assertTrue(LogOffset.of(-1, 0).isBeforeAll());
  }

  @Test
  void formatsTextForms() {
    assertEquals("-1", LogOffset.BEFORE_ALL.toString());
    assertEquals("0_0", LogOffset.INITIAL.toString());
    assertEquals("0_inf", LogOffset.LAST_BEFORE_REAL.toString());
    assertEquals("9223372036854775807_inf", LogOffset.LAST.toString());
    assertEquals("123_45", LogOffset.mustOf(123, 45).toString());
  }

  @Test
  void parsesTextForms() throws Exception {
    assertEquals(LogOffset.BEFORE_ALL, LogOffset.parse("-1"));
    assertEquals(LogOffset.BEFORE_ALL, LogOffset.parse("-1_0"));
    assertEquals(LogOffset.LAST_BEFORE_REAL, LogOffset.parse("0_inf"));
    assertEquals(LogOffset.mustOf(7, 3), LogOffset.parse("0007_03"));
    assertEquals(LogOffset.mustOf(12, Long.MAX_VALUE), LogOffset.parse("12_inf"));
  }

  @Test
  void roundTripsThroughText() throws Exception {
    List<LogOffset> offsets = List.of(
      LogOffset.BEFORE_ALL,
      LogOffset.INITIAL,
      LogOffset.LAST_BEFORE_REAL,
      LogOffset.LAST,
      LogOffset.mustOf(0, Long.MAX_VALUE - 1),
      LogOffset.mustOf(0, 17),
      LogOffset.mustOf(24_000_000L, 2));
    for (LogOffset offset : offsets) {
      assertEquals(offset, LogOffset.parse(offset.toString()), offset.toString());
    }
    assertEquals("0_9223372036854775806", LogOffset.mustOf(0, Long.MAX_VALUE - 1).toString());
  }

  @Test
  void rejectsMalformedText() {
    for (String text : List.of("", " 1_2", "1_2 ", "1.5_2", "1_2.0", "1_2_3", "abc", "1_", "_1", "1",
      "+1_2", "1_INF", "99999999999999999999_0")) {
      InvalidOffsetException err = assertThrows(InvalidOffsetException.class, () -> LogOffset.parse(text),
        text);
      assertEquals(InvalidOffsetException.Reason.INVALID_FORMAT, err.reason(), text);
    }
  }

  @Test
  void rejectsOutOfRangeText() {
    InvalidOffsetException err = assertThrows(InvalidOffsetException.class, () -> LogOffset.parse("-1_3"));
    assertEquals(InvalidOffsetException.Reason.INVALID_OFFSET, err.reason());
    assertThrows(InvalidOffsetException.class, () -> LogOffset.parse("-3_0"));
  }

  @Test
  void incrementsOperationOffset() {
    assertEquals(LogOffset.mustOf(5, 11), LogOffset.mustOf(5, 10).increment());
    assertEquals(LogOffset.mustOf(5, 14), LogOffset.mustOf(5, 10).incrementBy(4));
  }

  @Test
  void incrementingLastBeforeRealEntersRealRegion() {
    assertEquals(LogOffset.mustOf(1, 0), LogOffset.LAST_BEFORE_REAL.increment());
    assertEquals(LogOffset.mustOf(1, 4), LogOffset.LAST_BEFORE_REAL.incrementBy(5));
    assertTrue(LogOffset.LAST_BEFORE_REAL.increment().isReal());
  }

  @Test
  void refusesToOverflowOnIncrement() {
    assertThrows(IllegalStateException.class, LogOffset.LAST::increment);
    assertThrows(IllegalStateException.class, () -> LogOffset.mustOf(4, Long.MAX_VALUE - 1).incrementBy(2));
    assertThrows(IllegalArgumentException.class, () -> LogOffset.INITIAL.incrementBy(0));
  }

  @Test
  void classifiesRegions() {
    assertTrue(LogOffset.INITIAL.isVirtual());
    assertFalse(LogOffset.INITIAL.isReal());
    assertTrue(LogOffset.LAST_BEFORE_REAL.isLastBeforeReal());
    assertTrue(LogOffset.mustOf(9, 0).isReal());
    assertFalse(LogOffset.BEFORE_ALL.isVirtual());
  }

  @Test
  void minAndMax() {
    LogOffset a = LogOffset.mustOf(3, 4);
    LogOffset b = LogOffset.mustOf(3, 9);
    assertEquals(a, LogOffset.min(a, b));
    assertEquals(b, LogOffset.max(a, b));
    assertTrue(a.isBeforeOrEqual(a));
    assertTrue(b.isAfterOrEqual(a));
  }
}
