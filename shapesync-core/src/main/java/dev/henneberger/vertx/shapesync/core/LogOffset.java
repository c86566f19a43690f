package dev.henneberger.vertx.shapesync.core;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Position inside a shape log.
 *
 * <p>An offset is the pair {@code (txOffset, opOffset)} ordered lexicographically. A transaction
 * offset of {@code 0} addresses snapshot rows (the virtual region), a positive transaction offset
 * is a WAL position and {@code -1} is reserved for {@link #BEFORE_ALL}. Text form is
 * {@code "-1"}, {@code "{tx}_{op}"} or {@code "{tx}_inf"} when the operation offset is
 * {@link Long#MAX_VALUE}.
 */
public final class LogOffset implements Comparable<LogOffset> {

  private static final String INFINITY = "inf";
  private static final Pattern TEXT_FORM = Pattern.compile("(-?[0-9]+)_(-?[0-9]+|inf)");

  /** Sorts before every other offset; asks for a full initial sync. */
  public static final LogOffset BEFORE_ALL = new LogOffset(-1, 0);
  /** First snapshot position. */
  public static final LogOffset INITIAL = new LogOffset(0, 0);
  /** Upper bound of the virtual region. */
  public static final LogOffset LAST_BEFORE_REAL = new LogOffset(0, Long.MAX_VALUE);
  /** Greatest possible offset, for open-ended range queries only. */
  public static final LogOffset LAST = new LogOffset(Long.MAX_VALUE, Long.MAX_VALUE);

  private final long txOffset;
  private final long opOffset;

  private LogOffset(long txOffset, long opOffset) {
    this.txOffset = txOffset;
    this.opOffset = opOffset;
  }

  public static LogOffset of(long txOffset, long opOffset) throws InvalidOffsetException {
    if (txOffset == -1 && opOffset == 0) {
      return BEFORE_ALL;
    }
    if (txOffset < 0 || opOffset < 0) {
      throw new InvalidOffsetException(InvalidOffsetException.Reason.INVALID_OFFSET,
        "invalid offset: (" + txOffset + ", " + opOffset + ")");
    }
    if (txOffset == 0 && opOffset == 0) {
      return INITIAL;
    }
    return new LogOffset(txOffset, opOffset);
  }

  /**
   * Like {@link #of(long, long)} for coordinates known to be valid.
   *
   * @throws IllegalArgumentException when the coordinates are out of range
   */
  public static LogOffset mustOf(long txOffset, long opOffset) {
    try {
      return of(txOffset, opOffset);
    } catch (InvalidOffsetException e) {
      throw new IllegalArgumentException(e.getMessage(), e);
    }
  }

  public static LogOffset parse(String text) throws InvalidOffsetException {
    if (text == null || text.isEmpty()) {
      throw new InvalidOffsetException(InvalidOffsetException.Reason.INVALID_FORMAT, "empty offset");
    }
    if ("-1".equals(text)) {
      return BEFORE_ALL;
    }
    Matcher matcher = TEXT_FORM.matcher(text);
    if (!matcher.matches()) {
      throw new InvalidOffsetException(InvalidOffsetException.Reason.INVALID_FORMAT,
        "invalid offset format: " + text);
    }
    long tx;
    long op;
    try {
      tx = Long.parseLong(matcher.group(1));
      String opText = matcher.group(2);
      op = INFINITY.equals(opText) ? Long.MAX_VALUE : Long.parseLong(opText);
    } catch (NumberFormatException e) {
      throw new InvalidOffsetException(InvalidOffsetException.Reason.INVALID_FORMAT,
        "invalid offset format: " + text, e);
    }
    return of(tx, op);
  }

  public long txOffset() {
    return txOffset;
  }

  public long opOffset() {
    return opOffset;
  }

  public boolean isBeforeAll() {
    return txOffset == -1;
  }

  public boolean isVirtual() {
    return txOffset == 0;
  }

  public boolean isReal() {
    return txOffset > 0;
  }

  public boolean isLastBeforeReal() {
    return txOffset == 0 && opOffset == Long.MAX_VALUE;
  }

  public boolean isBefore(LogOffset other) {
    return compareTo(other) < 0;
  }

  public boolean isAfter(LogOffset other) {
    return compareTo(other) > 0;
  }

  public boolean isBeforeOrEqual(LogOffset other) {
    return compareTo(other) <= 0;
  }

  public boolean isAfterOrEqual(LogOffset other) {
    return compareTo(other) >= 0;
  }

  public LogOffset increment() {
    return incrementBy(1);
  }

  /**
   * Advances the operation offset by {@code n}. Stepping past {@link #LAST_BEFORE_REAL} lands on
   * the first real transaction, {@code (1, n - 1)}.
   */
  public LogOffset incrementBy(long n) {
    if (n < 1) {
      throw new IllegalArgumentException("increment must be >= 1");
    }
    if (isBeforeAll()) {
      throw new IllegalStateException("cannot increment " + this);
    }
    if (isLastBeforeReal()) {
      return mustOf(1, n - 1);
    }
    if (opOffset > Long.MAX_VALUE - n) {
      throw new IllegalStateException("cannot increment " + this + " by " + n);
    }
    return mustOf(txOffset, opOffset + n);
  }

  public static LogOffset min(LogOffset a, LogOffset b) {
    return a.compareTo(b) <= 0 ? a : b;
  }

  public static LogOffset max(LogOffset a, LogOffset b) {
    return a.compareTo(b) >= 0 ? a : b;
  }

  @Override
  public int compareTo(LogOffset other) {
    int byTx = Long.compare(txOffset, other.txOffset);
    return byTx != 0 ? byTx : Long.compare(opOffset, other.opOffset);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof LogOffset)) {
      return false;
    }
    LogOffset that = (LogOffset) o;
    return txOffset == that.txOffset && opOffset == that.opOffset;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(txOffset) * 31 + Long.hashCode(opOffset);
  }

  @Override
  public String toString() {
    if (isBeforeAll()) {
      return "-1";
    }
    if (opOffset == Long.MAX_VALUE) {
      return txOffset + "_" + INFINITY;
    }
    return txOffset + "_" + opOffset;
  }
}
