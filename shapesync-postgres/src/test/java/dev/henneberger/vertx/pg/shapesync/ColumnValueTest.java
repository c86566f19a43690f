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
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ColumnValueTest {

  @Test
  void unchangedIsNotNull() {
    assertNotEquals(ColumnValue.NULL, ColumnValue.UNCHANGED);
    assertTrue(ColumnValue.UNCHANGED.isUnchanged());
    assertFalse(ColumnValue.UNCHANGED.isNull());
    assertThrows(IllegalStateException.class, ColumnValue.UNCHANGED::text);
    assertThrows(IllegalStateException.class, ColumnValue.NULL::text);
  }

  @Test
  void textValuesCompareByContent() {
    assertEquals(ColumnValue.text("a"), ColumnValue.text("a"));
    assertNotEquals(ColumnValue.text("a"), ColumnValue.text("b"));
    assertEquals("", ColumnValue.text("").text());
    assertEquals(ColumnValue.Kind.TEXT, ColumnValue.text("").kind());
  }

  @Test
  void unscopedTableRef() {
    assertEquals(TableRef.UNSCOPED, TableRef.of("", null));
    assertFalse(TableRef.UNSCOPED.isScoped());
    assertTrue(TableRef.of("public", "users").isScoped());
    assertEquals("public.users", TableRef.of("public", "users").toString());
  }
}
