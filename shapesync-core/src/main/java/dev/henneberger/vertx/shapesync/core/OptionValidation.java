package dev.henneberger.vertx.shapesync.core;

import java.time.Duration;

public final class OptionValidation {

  private OptionValidation() {
  }

  public static void require(String fieldName, String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(fieldName + " is required");
    }
  }

  public static void requireMin(String fieldName, long value, long minInclusive) {
    if (value < minInclusive) {
      throw new IllegalArgumentException(fieldName + " must be >= " + minInclusive);
    }
  }

  public static void requirePositive(String fieldName, Duration value) {
    if (value == null || value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(fieldName + " must be positive");
    }
  }
}
