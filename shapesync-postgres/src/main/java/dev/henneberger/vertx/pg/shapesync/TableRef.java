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
 * Schema-qualified table name. {@link #UNSCOPED} stands for "every table".
 */
public final class TableRef {

  public static final TableRef UNSCOPED = new TableRef("", "");

  private final String schema;
  private final String table;

  private TableRef(String schema, String table) {
    this.schema = schema;
    this.table = table;
  }

  public static TableRef of(String schema, String table) {
    String s = schema == null ? "" : schema;
    String t = table == null ? "" : table;
    if (s.isEmpty() && t.isEmpty()) {
      return UNSCOPED;
    }
    return new TableRef(s, t);
  }

  public String schema() {
    return schema;
  }

  public String table() {
    return table;
  }

  public boolean isScoped() {
    return !schema.isEmpty() && !table.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TableRef)) {
      return false;
    }
    TableRef that = (TableRef) o;
    return schema.equals(that.schema) && table.equals(that.table);
  }

  @Override
  public int hashCode() {
    return Objects.hash(schema, table);
  }

  @Override
  public String toString() {
    return isScoped() ? schema + "." + table : "*";
  }
}
