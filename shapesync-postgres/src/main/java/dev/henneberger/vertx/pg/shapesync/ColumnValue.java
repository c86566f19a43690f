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

import java.util.Objects;

/**
 * A column value as carried by a WAL tuple.
 *
 * <p>{@link #UNCHANGED} marks a TOASTed value the server did not resend because it did not change.
 * It is distinct from {@link #NULL} and has to be resolved against previously seen data.
 */
public final class ColumnValue {

  public enum Kind {
    NULL,
    TEXT,
    UNCHANGED
  }

  public static final ColumnValue NULL = new ColumnValue(Kind.NULL, null);
  public static final ColumnValue UNCHANGED = new ColumnValue(Kind.UNCHANGED, null);

  private final Kind kind;
  private final String text;

  private ColumnValue(Kind kind, String text) {
    this.kind = kind;
    this.text = text;
  }

  public static ColumnValue text(String text) {
    return new ColumnValue(Kind.TEXT, Objects.requireNonNull(text, "text"));
  }

  public Kind kind() {
    return kind;
  }

  public boolean isNull() {
    return kind == Kind.NULL;
  }

  public boolean isUnchanged() {
    return kind == Kind.UNCHANGED;
  }

  public boolean isText() {
    return kind == Kind.TEXT;
  }

  /**
   * @throws IllegalStateException unless this is a {@link Kind#TEXT} value
   */
  public String text() {
    if (kind != Kind.TEXT) {
      throw new IllegalStateException("column value is " + kind);
    }
    return text;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ColumnValue)) {
      return false;
    }
    ColumnValue that = (ColumnValue) o;
    return kind == that.kind && Objects.equals(text, that.text);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, text);
  }

  @Override
  public String toString() {
    return kind == Kind.TEXT ? "'" + text + "'" : kind.name();
  }
}
